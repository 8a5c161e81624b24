package org.stellora.runtime.explorer;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;
import org.stellora.runtime.recipe.RecipeBook;
import org.stellora.runtime.recipe.RecipePair;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Plans with the full galaxy view.
 * <p>
 * Each tick the explorer:
 * <ol>
 *   <li>computes the base units still missing for its target;</li>
 *   <li>collects missing units at the current planet (harvesting, or generating first);</li>
 *   <li>once nothing is missing and the current planet can combine, executes the combination chain;</li>
 *   <li>otherwise travels one hop along a shortest path towards the nearest source of a missing
 *       unit, or towards the nearest combiner when nothing is missing.</li>
 * </ol>
 * A destination outside the explorer's component is reached by rocket from the current planet
 * if it can launch one, else by first travelling to the nearest planet that can. If neither
 * works the tick ends with {@link RejectionReason#DISCONNECTED}.
 */
public class BestPathStrategy implements IExplorerStrategy {

    @Override
    public void step(ExplorerContext ctx) {
        pursue(ctx);
    }

    protected void pursue(ExplorerContext ctx) {
        if (!ctx.isAlive()) {
            return;
        }
        Map<ResourceKind, Integer> needed = RecipeBook.baseRequirements(ctx.target(), ctx.workingInventory());
        if (!needed.isEmpty()) {
            collectHere(ctx, needed);
            needed = RecipeBook.baseRequirements(ctx.target(), ctx.workingInventory());
        }
        if (needed.isEmpty() && Planning.isUsableCombiner(ctx, ctx.position())) {
            int completedBefore = ctx.explorer().getCompletedTargets();
            combineHere(ctx);
            if (ctx.explorer().getCompletedTargets() > completedBefore) {
                return;
            }
            needed = RecipeBook.baseRequirements(ctx.target(), ctx.workingInventory());
        }
        OptionalInt destination = needed.isEmpty() ? nearestCombiner(ctx) : nearestSource(ctx, needed);
        if (destination.isEmpty()) {
            ctx.memory().clearPlan();
            ctx.reject(RejectionReason.DISCONNECTED);
            return;
        }
        if (destination.getAsInt() != ctx.position()) {
            advance(ctx, destination.getAsInt());
        }
    }

    private void collectHere(ExplorerContext ctx, Map<ResourceKind, Integer> needed) {
        for (Map.Entry<ResourceKind, Integer> entry : needed.entrySet()) {
            ResourceKind kind = entry.getKey();
            for (int i = 0; i < entry.getValue() && ctx.canHarvestMore(); i++) {
                if (!Planning.supplies(ctx.view(), ctx.position(), kind) || !ctx.collect(kind).ok()) {
                    break;
                }
            }
        }
    }

    private void combineHere(ExplorerContext ctx) {
        List<RecipePair> steps = RecipeBook.combinationSteps(ctx.target(), ctx.workingInventory());
        for (RecipePair pair : steps) {
            if (!ctx.isAlive() || !ctx.combine(pair.first(), pair.second()).ok()) {
                return;
            }
        }
    }

    protected OptionalInt nearestSource(ExplorerContext ctx, Map<ResourceKind, Integer> needed) {
        return Planning.nearest(ctx.view(), ctx.position(), id -> {
            for (ResourceKind kind : needed.keySet()) {
                if (Planning.supplies(ctx.view(), id, kind)) {
                    return true;
                }
            }
            return false;
        });
    }

    /**
     * Nearest planet able to combine. Unlimited combiners are preferred while more than one
     * combination remains, since a single-use combiner cannot finish the chain.
     */
    protected OptionalInt nearestCombiner(ExplorerContext ctx) {
        int remaining = RecipeBook.combinationSteps(ctx.target(), ctx.workingInventory()).size();
        if (remaining > 1) {
            OptionalInt unlimited = Planning.nearest(ctx.view(), ctx.position(),
                    id -> Planning.isUsableCombiner(ctx, id) && isUnlimitedCombiner(ctx, id));
            if (unlimited.isPresent()) {
                return unlimited;
            }
        }
        return Planning.nearest(ctx.view(), ctx.position(), id -> Planning.isUsableCombiner(ctx, id));
    }

    private static boolean isUnlimitedCombiner(ExplorerContext ctx, int id) {
        Optional<PlanetSnapshot> p = ctx.view().planet(id);
        return p.isPresent() && p.get().type() != null
                && p.get().type().getCombinationLimit() == PlanetType.UNBOUNDED;
    }

    /**
     * Takes one step towards {@code destination}.
     */
    protected void advance(ExplorerContext ctx, int destination) {
        Optional<IntList> path = ctx.view().topology().shortestPath(ctx.position(), destination);
        if (path.isPresent()) {
            ctx.memory().planRoute(destination, path.get());
            ctx.moveTo(path.get().getInt(0));
            return;
        }
        if (Planning.canLaunchRocket(ctx.view(), ctx.position())) {
            ctx.memory().planRoute(destination, IntList.of(destination));
            ctx.rocketJump(destination);
            return;
        }
        OptionalInt launchPad = Planning.nearest(ctx.view(), ctx.position(),
                id -> Planning.canLaunchRocket(ctx.view(), id));
        if (launchPad.isPresent()) {
            Optional<IntList> toPad = ctx.view().topology().shortestPath(ctx.position(), launchPad.getAsInt());
            if (toPad.isPresent() && !toPad.get().isEmpty()) {
                ctx.memory().planRoute(launchPad.getAsInt(), toPad.get());
                ctx.moveTo(toPad.get().getInt(0));
                return;
            }
        }
        ctx.memory().clearPlan();
        ctx.reject(RejectionReason.DISCONNECTED);
    }
}
