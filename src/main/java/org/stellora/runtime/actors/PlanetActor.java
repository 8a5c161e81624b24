package org.stellora.runtime.actors;

import java.util.concurrent.CompletableFuture;

import org.stellora.runtime.messages.PlanetMessage;
import org.stellora.runtime.messages.PlanetReply;
import org.stellora.runtime.messages.PlanetRequest;
import org.stellora.runtime.model.CapabilityViolationException;
import org.stellora.runtime.model.Planet;
import org.stellora.runtime.model.RejectionReason;

import com.typesafe.config.Config;

/**
 * Actor owning one {@link Planet}.
 * <p>
 * Requests are served first-come-first-served from the mailbox. Because only this actor's
 * thread touches the planet, concurrent combination or rocket requests from several explorers
 * can never exceed the planet type's limits.
 */
public class PlanetActor extends AbstractActor<PlanetMessage> {

    private final Planet planet;

    /**
     * @param planet  The planet to own. Must not be accessed by any other thread afterwards.
     * @param options Channel options, see {@link AbstractActor#AbstractActor(String, Config)}.
     */
    public PlanetActor(Planet planet, Config options) {
        super("planet-" + planet.getId(), options);
        this.planet = planet;
    }

    /**
     * Sends a request and returns the future of its reply.
     *
     * @param request The request.
     * @return The reply future.
     * @throws MailboxFullException  if the mailbox stayed full for the send timeout.
     * @throws IllegalStateException if the actor is not running.
     */
    public CompletableFuture<PlanetReply> ask(PlanetRequest request) {
        PlanetMessage message = PlanetMessage.of(request);
        send(message);
        return message.reply();
    }

    @Override
    protected void handle(PlanetMessage message) {
        boolean wasAlive = planet.isAlive();
        PlanetReply reply;
        try {
            reply = planet.handle(message.request());
        } catch (CapabilityViolationException e) {
            message.reply().completeExceptionally(e);
            throw e;
        }
        if (log.isDebugEnabled()) {
            log.debug("{} handled {} -> {}", actorName, message.request(), reply);
        }
        if (wasAlive && !planet.isAlive()) {
            log.info("Planet {} ({}) destroyed", planet.getId(), planet.getType());
        }
        message.reply().complete(reply);
    }

    @Override
    protected void onDiscard(PlanetMessage message) {
        message.reply().complete(PlanetReply.rejected(RejectionReason.PLANET_UNAVAILABLE));
    }

    public int getPlanetId() {
        return planet.getId();
    }
}
