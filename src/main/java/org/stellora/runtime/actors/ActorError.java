package org.stellora.runtime.actors;

import java.time.Instant;

/**
 * A transient problem observed by an actor that did not stop it.
 *
 * @param timestamp When the error was recorded.
 * @param code      Short machine-readable code, e.g. {@code "REPLY_TIMEOUT"}.
 * @param message   Human-readable description.
 */
public record ActorError(Instant timestamp, String code, String message) {
}
