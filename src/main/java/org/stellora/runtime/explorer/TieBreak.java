package org.stellora.runtime.explorer;

/**
 * How an explorer picks among equally good neighbors.
 */
public enum TieBreak {
    /** Uniformly at random, drawn from the explorer's own seeded stream. */
    RANDOM,
    /** The candidate with the lowest planet id. */
    LOWEST_ID
}
