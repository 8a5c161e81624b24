package org.stellora.runtime.messages;

import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;

/**
 * Answer to a {@link PlanetRequest}. Rejections are values, never exceptions.
 *
 * @param ok      {@code true} if the request was applied.
 * @param product The resource produced, harvested or generated, if any.
 * @param reason  Why the request was rejected; {@code null} on success.
 * @param state   Planet state after handling; set for state queries, may be {@code null} otherwise.
 */
public record PlanetReply(boolean ok, ResourceKind product, RejectionReason reason, PlanetSnapshot state) {

    public static PlanetReply success() {
        return new PlanetReply(true, null, null, null);
    }

    public static PlanetReply produced(ResourceKind product) {
        return new PlanetReply(true, product, null, null);
    }

    public static PlanetReply rejected(RejectionReason reason) {
        return new PlanetReply(false, null, reason, null);
    }

    public static PlanetReply state(PlanetSnapshot snapshot) {
        return new PlanetReply(true, null, null, snapshot);
    }
}
