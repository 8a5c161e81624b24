package org.stellora.runtime.explorer;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.IntPredicate;

import org.stellora.runtime.contracts.GalaxyView;
import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.ResourceKind;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Planet classification and nearest-planet search shared by the strategies.
 */
final class Planning {

    private Planning() {
    }

    /**
     * @return {@code true} if {@code counts} holds both inputs; {@code (X, X)} needs two units.
     */
    static boolean holdsPair(Map<ResourceKind, Integer> counts, ResourceKind a, ResourceKind b) {
        int needed = a == b ? 2 : 1;
        return counts.getOrDefault(a, 0) >= needed && counts.getOrDefault(b, 0) >= needed;
    }

    /**
     * @return {@code true} if the planet can hand out {@code kind} now: it holds a unit, or it
     *         supports the kind and can pay for generation.
     */
    static boolean supplies(PlanetSnapshot p, ResourceKind kind) {
        if (!p.alive()) {
            return false;
        }
        if (p.count(kind) > 0) {
            return true;
        }
        return p.supportedKinds().contains(kind)
                && (!p.type().generationDischargesCell() || p.hasEnergy());
    }

    static boolean supplies(GalaxyView view, int planetId, ResourceKind kind) {
        return view.isAlive(planetId) && view.planet(planetId).map(p -> supplies(p, kind)).orElse(false);
    }

    /**
     * @return {@code true} if the planet may still perform a combination as far as the explorer knows.
     */
    static boolean isUsableCombiner(ExplorerContext ctx, int planetId) {
        if (!ctx.view().isAlive(planetId) || ctx.memory().isExhaustedCombiner(planetId)) {
            return false;
        }
        Optional<PlanetSnapshot> p = ctx.view().planet(planetId);
        return p.isPresent() && p.get().type() != null
                && p.get().type().canCombine()
                && PlanetType.below(p.get().type().getCombinationLimit(), p.get().combinations());
    }

    /**
     * @return {@code true} if an explorer standing on the planet could leave by rocket.
     */
    static boolean canLaunchRocket(GalaxyView view, int planetId) {
        if (!view.isAlive(planetId)) {
            return false;
        }
        Optional<PlanetSnapshot> p = view.planet(planetId);
        return p.isPresent() && p.get().type() != null && p.get().type().canBuildRockets()
                && (p.get().rockets() > 0 || p.get().hasEnergy());
    }

    /**
     * Finds the nearest live planet matching {@code filter}.
     * <p>
     * Reachable planets win by hop count, then by lower id. If none is reachable, the lowest-id
     * match elsewhere in the galaxy is returned; it can only be reached by rocket.
     *
     * @param view   The galaxy view.
     * @param from   Start planet.
     * @param filter Which planets qualify.
     * @return The chosen planet, if any.
     */
    static OptionalInt nearest(GalaxyView view, int from, IntPredicate filter) {
        Int2IntOpenHashMap distances = view.topology().distancesFrom(from);
        int best = -1;
        int bestDistance = Integer.MAX_VALUE;
        int fallback = -1;
        for (int id : view.topology().nodes()) {
            if (!view.isAlive(id) || !filter.test(id)) {
                continue;
            }
            if (distances.containsKey(id)) {
                int d = distances.get(id);
                if (d < bestDistance) {
                    best = id;
                    bestDistance = d;
                }
            } else if (fallback < 0) {
                fallback = id;
            }
        }
        if (best >= 0) {
            return OptionalInt.of(best);
        }
        return fallback >= 0 ? OptionalInt.of(fallback) : OptionalInt.empty();
    }

    /**
     * @return {@code true} if a planet in the explorer's component can launch a rocket.
     */
    static boolean rocketAccessible(GalaxyView view, IntSet component) {
        for (int id : component) {
            if (canLaunchRocket(view, id)) {
                return true;
            }
        }
        return false;
    }
}
