package org.stellora.runtime.messages;

import java.util.concurrent.CompletableFuture;

import org.stellora.runtime.contracts.GalaxyView;
import org.stellora.runtime.explorer.StrategyKind;
import org.stellora.runtime.model.ResourceKind;

/**
 * The closed set of commands the orchestrator sends to an explorer. Each command is
 * answered with an {@link ExplorerReply}.
 */
public sealed interface ExplorerCommand permits
        ExplorerCommand.Tick,
        ExplorerCommand.Query,
        ExplorerCommand.Reconfigure {

    CompletableFuture<ExplorerReply> reply();

    /**
     * Act for one tick.
     *
     * @param tick  The tick number.
     * @param view  Frozen galaxy view for this tick.
     * @param reply Completed once the explorer has finished the tick.
     */
    record Tick(long tick, GalaxyView view, CompletableFuture<ExplorerReply> reply) implements ExplorerCommand {
    }

    record Query(CompletableFuture<ExplorerReply> reply) implements ExplorerCommand {
    }

    /**
     * Change strategy and target.
     *
     * @param strategy New strategy.
     * @param target   New complex target resource.
     * @param reply    Completed after the change was applied or rejected.
     */
    record Reconfigure(StrategyKind strategy, ResourceKind target, CompletableFuture<ExplorerReply> reply)
            implements ExplorerCommand {
    }
}
