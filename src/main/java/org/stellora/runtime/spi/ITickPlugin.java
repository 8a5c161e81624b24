package org.stellora.runtime.spi;

import org.stellora.runtime.GalaxyOrchestrator;

/**
 * Plugin executed once at the start of every tick, before explorers act.
 * <p>
 * Tick plugins inject environmental events into the galaxy through
 * {@link GalaxyOrchestrator#sendEvent(int, org.stellora.runtime.messages.PlanetRequest)}. They never
 * touch planet state directly. Every event sent during a tick is acknowledged before
 * explorers receive the tick.
 * <p>
 * Plugins are executed sequentially in their configured order. Implementations must
 * provide a constructor with signature
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)}.
 */
public interface ITickPlugin {

    /**
     * Executes the plugin logic for the current tick.
     *
     * @param orchestrator The orchestrator running the tick.
     */
    void execute(GalaxyOrchestrator orchestrator);
}
