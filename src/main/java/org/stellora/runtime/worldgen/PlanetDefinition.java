package org.stellora.runtime.worldgen;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.ResourceKind;

/**
 * How one planet is created at galaxy initialization.
 *
 * @param id             Unique planet id.
 * @param type           Planet type.
 * @param neighbors      Ids of adjacent planets. Edges are undirected; listing an edge on one side suffices.
 * @param supportedKinds Base kinds the planet can generate.
 * @param initialCharge  Charged cells at start; negative means fully charged.
 * @param inventory      Initial resource counts.
 */
public record PlanetDefinition(int id, PlanetType type, List<Integer> neighbors, Set<ResourceKind> supportedKinds,
                               int initialCharge, Map<ResourceKind, Integer> inventory) {

    public PlanetDefinition {
        neighbors = List.copyOf(neighbors);
        supportedKinds = Set.copyOf(supportedKinds);
        inventory = Map.copyOf(inventory);
    }

    /**
     * Default generation capability: single-kind types get one base kind chosen by id
     * (HYDROGEN, OXYGEN, CARBON, SILICON in rotation), the others get all four.
     *
     * @param id   Planet id.
     * @param type Planet type.
     * @return The default supported kinds.
     */
    public static Set<ResourceKind> defaultSupportedKinds(int id, PlanetType type) {
        if (type.getGenerationLimit() == PlanetType.UNBOUNDED) {
            return ResourceKind.baseKinds();
        }
        if (type.getGenerationLimit() == 0) {
            return Set.of();
        }
        List<ResourceKind> base = List.copyOf(ResourceKind.baseKinds());
        return Set.of(base.get(Math.floorMod(id, base.size())));
    }
}
