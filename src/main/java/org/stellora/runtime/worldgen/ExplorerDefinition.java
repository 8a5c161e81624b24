package org.stellora.runtime.worldgen;

import java.util.List;
import java.util.Map;

import org.stellora.runtime.explorer.StrategyKind;
import org.stellora.runtime.model.ResourceKind;

/**
 * How one explorer is created at galaxy initialization.
 *
 * @param id              Unique explorer id.
 * @param startPlanet     Id of the planet the explorer starts on.
 * @param strategy        Strategy to run.
 * @param target          Complex resource to produce.
 * @param fallbackTargets Targets to switch to when the current one becomes infeasible.
 * @param life            Life budget; zero or negative means the configured default.
 * @param inventory       Resources carried at start.
 */
public record ExplorerDefinition(int id, int startPlanet, StrategyKind strategy, ResourceKind target,
                                 List<ResourceKind> fallbackTargets, int life, Map<ResourceKind, Integer> inventory) {

    public ExplorerDefinition {
        fallbackTargets = List.copyOf(fallbackTargets);
        inventory = Map.copyOf(inventory);
    }
}
