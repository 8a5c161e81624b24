package org.stellora.runtime.messages;

import java.util.concurrent.CompletableFuture;

/**
 * Mailbox entry of a planet actor: a request plus the future its reply completes.
 *
 * @param request The request.
 * @param reply   Completed exactly once by the planet actor.
 */
public record PlanetMessage(PlanetRequest request, CompletableFuture<PlanetReply> reply) {

    public static PlanetMessage of(PlanetRequest request) {
        return new PlanetMessage(request, new CompletableFuture<>());
    }
}
