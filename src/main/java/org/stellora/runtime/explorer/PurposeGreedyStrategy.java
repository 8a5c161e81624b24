package org.stellora.runtime.explorer;

import java.util.Map;

import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.model.ResourceKind;
import org.stellora.runtime.recipe.RecipeBook;
import org.stellora.runtime.recipe.RecipePair;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Greedy movement with a goal: only resources on the target's recipe tree are collected and
 * combined, and neighbors are ranked by how many still-needed base kinds they were last seen
 * holding or generating. Once every base unit is carried, neighbors able to combine rank first.
 */
public class PurposeGreedyStrategy extends GreedyStrategy {

    @Override
    public void step(ExplorerContext ctx) {
        collectNeeded(ctx);
        combineTowardTarget(ctx);
        moveWithPurpose(ctx);
    }

    private void collectNeeded(ExplorerContext ctx) {
        Map<ResourceKind, Integer> needed = RecipeBook.baseRequirements(ctx.target(), ctx.workingInventory());
        for (Map.Entry<ResourceKind, Integer> entry : needed.entrySet()) {
            if (!Planning.supplies(ctx.view(), ctx.position(), entry.getKey())) {
                continue;
            }
            for (int i = 0; i < entry.getValue() && ctx.canHarvestMore(); i++) {
                if (!ctx.collect(entry.getKey()).ok()) {
                    break;
                }
            }
        }
    }

    private void combineTowardTarget(ExplorerContext ctx) {
        for (RecipePair pair : RecipeBook.combinationSteps(ctx.target(), ctx.workingInventory())) {
            if (!ctx.isAlive() || !Planning.isUsableCombiner(ctx, ctx.position())) {
                return;
            }
            if (!ctx.combine(pair.first(), pair.second()).ok()) {
                return;
            }
        }
    }

    private void moveWithPurpose(ExplorerContext ctx) {
        if (!ctx.isAlive() || ctx.hasMoved()) {
            return;
        }
        Map<ResourceKind, Integer> needed = RecipeBook.baseRequirements(ctx.target(), ctx.workingInventory());
        IntList best = new IntArrayList();
        int bestScore = -1;
        for (int n : aliveNeighbors(ctx)) {
            int score = score(ctx, n, needed);
            if (score > bestScore) {
                best.clear();
                bestScore = score;
            }
            if (score == bestScore) {
                best.add(n);
            }
        }
        int next = ctx.choose(best);
        if (next >= 0) {
            ctx.moveTo(next);
        }
    }

    private int score(ExplorerContext ctx, int planetId, Map<ResourceKind, Integer> needed) {
        PlanetSnapshot seen = ctx.memory().lastSeen(planetId).orElse(null);
        if (seen == null) {
            return 0;
        }
        if (needed.isEmpty()) {
            return Planning.isUsableCombiner(ctx, planetId) ? 1 : 0;
        }
        int score = 0;
        for (ResourceKind kind : needed.keySet()) {
            if (Planning.supplies(seen, kind)) {
                score++;
            }
        }
        return score;
    }
}
