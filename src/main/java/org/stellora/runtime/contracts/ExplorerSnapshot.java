package org.stellora.runtime.contracts;

import java.util.Map;

import org.stellora.runtime.explorer.StrategyKind;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;

/**
 * Immutable view of one explorer's state at a point in time.
 *
 * @param id               The explorer id.
 * @param position         Id of the planet the explorer stands on.
 * @param inventory        Resources carried.
 * @param life             Remaining life budget.
 * @param strategy         Active strategy.
 * @param target           Current target resource.
 * @param alive            {@code false} once the explorer has died.
 * @param status           Reporting status.
 * @param completedTargets Units of a target resource produced so far.
 * @param lastRejection    Most recent rejection, or {@code null}.
 */
public record ExplorerSnapshot(
        int id,
        int position,
        Map<ResourceKind, Integer> inventory,
        int life,
        StrategyKind strategy,
        ResourceKind target,
        boolean alive,
        ActorStatus status,
        int completedTargets,
        RejectionReason lastRejection) {

    public ExplorerSnapshot {
        inventory = inventory == null ? Map.of() : Map.copyOf(inventory);
    }

    public static ExplorerSnapshot unknown(int id, StrategyKind strategy, ResourceKind target) {
        return new ExplorerSnapshot(id, -1, Map.of(), 0, strategy, target, true, ActorStatus.UNKNOWN, 0, null);
    }
}
