package org.stellora.runtime.explorer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import org.stellora.runtime.actors.PlanetGateway;
import org.stellora.runtime.contracts.GalaxyView;
import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.messages.PlanetReply;
import org.stellora.runtime.model.Planet;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;
import org.stellora.runtime.topology.GalaxyTopology;

/**
 * Planets answered synchronously on the calling thread, for driving strategies tick by tick
 * without actors.
 */
class GalaxyFixture {

    private final Map<Integer, Planet> planets = new HashMap<>();
    private final GalaxyTopology topology = new GalaxyTopology();
    private long tick;

    GalaxyFixture planet(int id, PlanetType type, Set<ResourceKind> supports) {
        return planet(id, type, supports, Integer.MAX_VALUE, Map.of());
    }

    /** A negative charge means fully charged. */
    GalaxyFixture planet(int id, PlanetType type, Set<ResourceKind> supports, int charge,
                         Map<ResourceKind, Integer> inventory) {
        planets.put(id, new Planet(id, type, supports, 5, charge < 0 ? Integer.MAX_VALUE : charge, inventory));
        topology.addNode(id);
        return this;
    }

    GalaxyFixture connect(int a, int b) {
        topology.connect(a, b);
        return this;
    }

    /** Removes a planet from the topology, as the orchestrator does after its destruction. */
    GalaxyFixture destroy(int id) {
        topology.removeNode(id);
        return this;
    }

    Planet planet(int id) {
        return planets.get(id);
    }

    PlanetGateway gateway() {
        return (id, request) -> {
            Planet planet = planets.get(id);
            if (planet == null || !topology.contains(id)) {
                return CompletableFuture.completedFuture(PlanetReply.rejected(RejectionReason.PLANET_UNAVAILABLE));
            }
            return CompletableFuture.completedFuture(planet.handle(request));
        };
    }

    GalaxyView view() {
        Map<Integer, PlanetSnapshot> snapshots = new HashMap<>();
        planets.forEach((id, planet) -> snapshots.put(id, planet.snapshot()));
        return new GalaxyView(tick, topology.frozenCopy(), snapshots);
    }

    ExplorerContext context(Explorer explorer, ExplorerSettings settings) {
        return new ExplorerContext(explorer, view(), gateway(), settings, new Random(7));
    }

    /**
     * Runs one explorer tick the way the explorer actor does.
     */
    ExplorerContext tick(Explorer explorer, ExplorerSettings settings) {
        ExplorerContext ctx = context(explorer, settings);
        if (ctx.checkSurvival()) {
            explorer.getStrategy().step(ctx);
        }
        tick++;
        return ctx;
    }

    static Explorer explorer(int start, StrategyKind strategy, ResourceKind target,
                             Map<ResourceKind, Integer> inventory) {
        return new Explorer(0, start, strategy, target, List.of(), 100, inventory);
    }

    static ExplorerSettings lowestIdSettings() {
        return new ExplorerSettings(100, 4, 3, TieBreak.LOWEST_ID, 1000);
    }
}
