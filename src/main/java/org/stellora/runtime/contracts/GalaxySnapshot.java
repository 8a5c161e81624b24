package org.stellora.runtime.contracts;

import java.util.List;
import java.util.Optional;

/**
 * Read-only picture of the whole galaxy after a tick.
 *
 * @param tick          Number of completed ticks.
 * @param planets       Planet snapshots ordered by id, including destroyed planets.
 * @param explorers     Explorer snapshots ordered by id.
 * @param criticalNodes Articulation points of the current topology, ascending.
 */
public record GalaxySnapshot(
        long tick,
        List<PlanetSnapshot> planets,
        List<ExplorerSnapshot> explorers,
        List<Integer> criticalNodes) {

    public GalaxySnapshot {
        planets = List.copyOf(planets);
        explorers = List.copyOf(explorers);
        criticalNodes = List.copyOf(criticalNodes);
    }

    public Optional<PlanetSnapshot> planet(int id) {
        return planets.stream().filter(p -> p.id() == id).findFirst();
    }

    public Optional<ExplorerSnapshot> explorer(int id) {
        return explorers.stream().filter(e -> e.id() == id).findFirst();
    }

    public long alivePlanetCount() {
        return planets.stream().filter(PlanetSnapshot::alive).count();
    }

    public long aliveExplorerCount() {
        return explorers.stream().filter(ExplorerSnapshot::alive).count();
    }
}
