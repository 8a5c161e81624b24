package org.stellora.runtime.model;

/**
 * Thrown when a planet's state contradicts the capability matrix of its own type.
 * <p>
 * This is the only fatal fault of the simulation: it signals a broken internal
 * invariant rather than a rejected request.
 */
public class CapabilityViolationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public CapabilityViolationException(String message) {
        super(message);
    }
}
