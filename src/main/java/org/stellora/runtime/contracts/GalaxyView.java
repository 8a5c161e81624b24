package org.stellora.runtime.contracts;

import java.util.Map;
import java.util.Optional;

import org.stellora.runtime.topology.GalaxyTopology;

/**
 * What an explorer may know about the galaxy during one tick: a frozen copy of the
 * topology and the public state of every live planet. Nothing in a view is shared
 * mutably with the orchestrator.
 *
 * @param tick     The tick being executed.
 * @param topology Frozen topology containing only live planets.
 * @param planets  Planet catalogue keyed by id.
 */
public record GalaxyView(long tick, GalaxyTopology topology, Map<Integer, PlanetSnapshot> planets) {

    public GalaxyView {
        if (!topology.isFrozen()) {
            topology = topology.frozenCopy();
        }
        planets = Map.copyOf(planets);
    }

    public Optional<PlanetSnapshot> planet(int id) {
        return Optional.ofNullable(planets.get(id));
    }

    /**
     * @param id A planet id.
     * @return {@code true} if the planet is in the topology and was alive at the start of the tick.
     */
    public boolean isAlive(int id) {
        PlanetSnapshot snapshot = planets.get(id);
        return topology.contains(id) && snapshot != null && snapshot.alive();
    }
}
