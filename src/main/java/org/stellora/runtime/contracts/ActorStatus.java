package org.stellora.runtime.contracts;

/**
 * Lifecycle status of a planet or explorer as reported in snapshots.
 */
public enum ActorStatus {
    /** The actor is alive and answering. */
    ACTIVE,
    /** Terminal: the planet is destroyed or the explorer has died. */
    DEAD,
    /** The actor did not answer within the snapshot timeout. */
    UNKNOWN
}
