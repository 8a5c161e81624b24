package org.stellora.runtime.messages;

import org.stellora.runtime.contracts.ExplorerSnapshot;
import org.stellora.runtime.model.RejectionReason;

/**
 * Answer to an {@link ExplorerCommand}.
 *
 * @param accepted {@code false} if the explorer refused the command.
 * @param reason   Why the command was refused; {@code null} if accepted.
 * @param state    Explorer state after handling the command.
 */
public record ExplorerReply(boolean accepted, RejectionReason reason, ExplorerSnapshot state) {

    public static ExplorerReply accepted(ExplorerSnapshot state) {
        return new ExplorerReply(true, null, state);
    }

    public static ExplorerReply rejected(RejectionReason reason, ExplorerSnapshot state) {
        return new ExplorerReply(false, reason, state);
    }
}
