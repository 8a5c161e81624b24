package org.stellora.runtime.explorer;

import java.util.Map;
import java.util.Optional;
import java.util.function.IntPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stellora.runtime.contracts.GalaxyView;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;
import org.stellora.runtime.recipe.RecipeBook;

import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * {@link BestPathStrategy} that re-checks feasibility around every step.
 * <p>
 * The target is infeasible when a missing base kind has no live source the explorer can reach,
 * or when no live combiner is reachable. "Reachable" means inside the explorer's component, or
 * anywhere if the component contains a planet that can launch a rocket. On infeasibility the
 * explorer records {@link RejectionReason#DISCONNECTED}, switches to its next fallback target and
 * replans from its current position in the same tick. The same switch happens after
 * {@link ExplorerSettings#capabilityFailureThreshold()} consecutive
 * {@link RejectionReason#CAPABILITY_EXCEEDED} rejections.
 */
public class AdaptiveBestPathStrategy extends BestPathStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveBestPathStrategy.class);

    @Override
    public void step(ExplorerContext ctx) {
        while (ctx.isAlive() && !isFeasible(ctx)) {
            ctx.reject(RejectionReason.DISCONNECTED);
            if (!switchTarget(ctx, "target unreachable")) {
                break;
            }
        }
        pursue(ctx);
        if (ctx.isAlive()
                && ctx.memory().getConsecutiveCapabilityFailures() >= ctx.settings().capabilityFailureThreshold()) {
            switchTarget(ctx, "repeated capability rejections");
        }
    }

    private boolean switchTarget(ExplorerContext ctx, String cause) {
        ResourceKind previous = ctx.target();
        Optional<ResourceKind> next = ctx.explorer().switchToFallback();
        if (next.isEmpty()) {
            LOG.debug("Explorer {} has no fallback left for {} ({})", ctx.explorer().getId(), previous, cause);
            return false;
        }
        LOG.info("Explorer {} switched target {} -> {}: {}", ctx.explorer().getId(), previous, next.get(), cause);
        return true;
    }

    /**
     * @param ctx The tick context.
     * @return {@code true} if every missing base kind and a combiner can still be reached.
     */
    boolean isFeasible(ExplorerContext ctx) {
        GalaxyView view = ctx.view();
        IntSet component = view.topology().reachableFrom(ctx.position());
        boolean rocket = Planning.rocketAccessible(view, component);
        Map<ResourceKind, Integer> needed = RecipeBook.baseRequirements(ctx.target(), ctx.workingInventory());
        for (ResourceKind kind : needed.keySet()) {
            if (!reachableMatch(view, component, rocket, id -> Planning.supplies(view, id, kind))) {
                return false;
            }
        }
        return reachableMatch(view, component, rocket, id -> Planning.isUsableCombiner(ctx, id));
    }

    private static boolean reachableMatch(GalaxyView view, IntSet component, boolean rocket,
                                          IntPredicate filter) {
        for (int id : view.topology().nodes()) {
            if (view.isAlive(id) && (rocket || component.contains(id)) && filter.test(id)) {
                return true;
            }
        }
        return false;
    }
}
