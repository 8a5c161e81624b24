package org.stellora.runtime.actors;

import java.util.concurrent.CompletableFuture;

import org.stellora.runtime.messages.PlanetReply;
import org.stellora.runtime.messages.PlanetRequest;

/**
 * How an explorer reaches planet mailboxes, by id only.
 */
@FunctionalInterface
public interface PlanetGateway {

    /**
     * @param planetId Target planet.
     * @param request  The request.
     * @return The reply future. Unknown or stopped planets answer
     *         {@link org.stellora.runtime.model.RejectionReason#PLANET_UNAVAILABLE}.
     * @throws MailboxFullException if the planet's mailbox stayed full for the send timeout.
     */
    CompletableFuture<PlanetReply> send(int planetId, PlanetRequest request);
}
