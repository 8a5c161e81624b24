package org.stellora.runtime.spi;

import java.util.Random;

/**
 * Source of randomness for the simulation.
 * <p>
 * All random decisions (environmental events, greedy neighbor choice) draw from a
 * provider so that a run is reproducible from its seed. Each consumer should use its
 * own derived provider, which keeps streams independent of scheduling order.
 */
public interface IRandomProvider {

    /**
     * @param bound Exclusive upper bound, must be positive.
     * @return A uniformly distributed value in {@code [0, bound)}.
     */
    int nextInt(int bound);

    /**
     * @return A uniformly distributed value in {@code [0.0, 1.0)}.
     */
    double nextDouble();

    /**
     * @return A {@link Random} view backed by this provider's stream.
     */
    Random asJavaRandom();

    /**
     * Creates an independent, deterministic child stream.
     *
     * @param scope Name of the consumer (e.g. {@code "explorer"}).
     * @param key   Instance key within the scope (e.g. the explorer id).
     * @return A provider whose sequence depends only on this provider's seed, {@code scope} and {@code key}.
     */
    IRandomProvider deriveFor(String scope, long key);
}
