package org.stellora.runtime.model;

/**
 * Typed reasons why a request was not served.
 * <p>
 * Every reason is recoverable: it is returned to the requester as a value and the
 * explorer strategies react to it. None of them terminates an actor.
 */
public enum RejectionReason {
    /** The pair of kinds has no product. */
    NO_RECIPE,
    /** A generation, combination or rocket limit of the planet type was hit. */
    CAPABILITY_EXCEEDED,
    /** A required input unit (or the rocket to use) is missing. */
    INSUFFICIENT_INVENTORY,
    /** No charged energy cell is available for an operation that discharges one. */
    NO_ENERGY,
    /** The target planet is dead or not part of the galaxy. */
    PLANET_UNAVAILABLE,
    /** The explorer addressed by the command has terminated. */
    EXPLORER_DEAD,
    /** No path exists between the explorer and a resource it needs. */
    DISCONNECTED,
    /** The addressed actor did not answer within the reply timeout. */
    TIMEOUT
}
