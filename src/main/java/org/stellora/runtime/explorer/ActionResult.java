package org.stellora.runtime.explorer;

import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;

/**
 * Outcome of one explorer action.
 *
 * @param ok      {@code true} if the action took effect.
 * @param product Resource gained, if any.
 * @param reason  Rejection reason if not ok.
 */
public record ActionResult(boolean ok, ResourceKind product, RejectionReason reason) {

    public static ActionResult success() {
        return new ActionResult(true, null, null);
    }

    public static ActionResult gained(ResourceKind product) {
        return new ActionResult(true, product, null);
    }

    public static ActionResult rejected(RejectionReason reason) {
        return new ActionResult(false, null, reason);
    }
}
