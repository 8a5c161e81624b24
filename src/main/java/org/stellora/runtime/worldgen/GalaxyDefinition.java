package org.stellora.runtime.worldgen;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Complete initial state of a galaxy: planets with their edges, and explorers.
 *
 * @param planets   Planet definitions.
 * @param explorers Explorer definitions.
 */
public record GalaxyDefinition(List<PlanetDefinition> planets, List<ExplorerDefinition> explorers) {

    /**
     * @throws IllegalArgumentException if ids repeat, an edge names an unknown planet, an explorer
     *                                  starts on an unknown planet or a planet links to itself.
     */
    public GalaxyDefinition {
        planets = List.copyOf(planets);
        explorers = List.copyOf(explorers);
        Set<Integer> planetIds = new HashSet<>();
        for (PlanetDefinition p : planets) {
            if (!planetIds.add(p.id())) {
                throw new IllegalArgumentException("Duplicate planet id " + p.id());
            }
        }
        for (PlanetDefinition p : planets) {
            for (int n : p.neighbors()) {
                if (n == p.id()) {
                    throw new IllegalArgumentException("Planet " + p.id() + " lists itself as neighbor");
                }
                if (!planetIds.contains(n)) {
                    throw new IllegalArgumentException("Planet " + p.id() + " links to unknown planet " + n);
                }
            }
        }
        Set<Integer> explorerIds = new HashSet<>();
        for (ExplorerDefinition e : explorers) {
            if (!explorerIds.add(e.id())) {
                throw new IllegalArgumentException("Duplicate explorer id " + e.id());
            }
            if (!planetIds.contains(e.startPlanet())) {
                throw new IllegalArgumentException(
                        "Explorer " + e.id() + " starts on unknown planet " + e.startPlanet());
            }
        }
    }
}
