package org.stellora.runtime.explorer;

import java.util.Map;

import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.model.Inventory;
import org.stellora.runtime.model.ResourceKind;
import org.stellora.runtime.recipe.RecipeBook;
import org.stellora.runtime.recipe.RecipePair;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * No lookahead: take whatever the current planet offers, combine whatever can be combined,
 * then wander to a neighbor chosen by the tie-break policy. Completed target units are kept
 * out of combinations.
 * <p>
 * If the planet holds no base resources the explorer asks it to generate the supported
 * kind it carries least of, so that a freshly initialized galaxy still yields resources.
 */
public class GreedyStrategy implements IExplorerStrategy {

    @Override
    public void step(ExplorerContext ctx) {
        harvestAll(ctx);
        combineAll(ctx);
        wander(ctx);
    }

    protected void harvestAll(ExplorerContext ctx) {
        PlanetSnapshot here = ctx.currentPlanet().orElse(null);
        if (here == null) {
            return;
        }
        boolean harvested = false;
        for (ResourceKind kind : ResourceKind.baseKinds()) {
            for (int i = 0; i < here.count(kind) && ctx.canHarvestMore(); i++) {
                if (!ctx.harvest(kind).ok()) {
                    break;
                }
                harvested = true;
            }
        }
        if (!harvested && ctx.canHarvestMore() && !here.supportedKinds().isEmpty()) {
            ctx.collect(leastCarried(ctx.explorer().getInventory(), here));
        }
    }

    private static ResourceKind leastCarried(Inventory inventory, PlanetSnapshot here) {
        ResourceKind best = null;
        for (ResourceKind kind : ResourceKind.baseKinds()) {
            if (here.supportedKinds().contains(kind)
                    && (best == null || inventory.count(kind) < inventory.count(best))) {
                best = kind;
            }
        }
        return best;
    }

    protected void combineAll(ExplorerContext ctx) {
        boolean progress = true;
        while (progress && ctx.isAlive() && Planning.isUsableCombiner(ctx, ctx.position())) {
            progress = false;
            for (Map.Entry<RecipePair, ResourceKind> recipe : RecipeBook.recipes().entrySet()) {
                RecipePair pair = recipe.getKey();
                if (!Planning.holdsPair(ctx.workingInventory(), pair.first(), pair.second())) {
                    continue;
                }
                if (!ctx.combine(pair.first(), pair.second()).ok()) {
                    return;
                }
                progress = true;
                break;
            }
        }
    }

    protected void wander(ExplorerContext ctx) {
        if (!ctx.isAlive() || ctx.hasMoved()) {
            return;
        }
        int next = ctx.choose(aliveNeighbors(ctx));
        if (next >= 0) {
            ctx.moveTo(next);
        }
    }

    protected static IntList aliveNeighbors(ExplorerContext ctx) {
        IntArrayList result = new IntArrayList();
        for (int n : ctx.view().topology().neighbors(ctx.position())) {
            if (ctx.view().isAlive(n)) {
                result.add(n);
            }
        }
        return result;
    }
}
