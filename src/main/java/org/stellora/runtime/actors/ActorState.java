package org.stellora.runtime.actors;

/**
 * Lifecycle state of an actor thread.
 */
public enum ActorState {
    STOPPED,
    RUNNING,
    ERROR
}
