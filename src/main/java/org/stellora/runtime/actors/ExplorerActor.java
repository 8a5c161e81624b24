package org.stellora.runtime.actors;

import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.stellora.runtime.contracts.ExplorerSnapshot;
import org.stellora.runtime.explorer.Explorer;
import org.stellora.runtime.explorer.ExplorerContext;
import org.stellora.runtime.explorer.ExplorerSettings;
import org.stellora.runtime.messages.ExplorerCommand;
import org.stellora.runtime.messages.ExplorerCommand.Query;
import org.stellora.runtime.messages.ExplorerCommand.Reconfigure;
import org.stellora.runtime.messages.ExplorerCommand.Tick;
import org.stellora.runtime.messages.ExplorerReply;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;

/**
 * Actor owning one {@link Explorer}.
 * <p>
 * On {@link Tick} the explorer checks whether it survived the environment, then lets its
 * strategy act through an {@link ExplorerContext}. Planet requests block this actor only;
 * other explorers keep running. Combinations whose reply arrived late are settled before
 * every command. A dead explorer answers every command except {@link Query}
 * with {@link RejectionReason#EXPLORER_DEAD}.
 */
public class ExplorerActor extends AbstractActor<ExplorerCommand> {

    private final Explorer explorer;
    private final PlanetGateway gateway;
    private final ExplorerSettings settings;
    private final Random random;

    /**
     * @param explorer The explorer to own.
     * @param gateway  Access to planet mailboxes.
     * @param settings Explorer tunables.
     * @param rng      Random provider; a stream is derived for this explorer's id.
     * @param options  Channel options, see {@link AbstractActor#AbstractActor(String, Config)}.
     */
    public ExplorerActor(Explorer explorer, PlanetGateway gateway, ExplorerSettings settings,
                         IRandomProvider rng, Config options) {
        super("explorer-" + explorer.getId(), options);
        this.explorer = explorer;
        this.gateway = gateway;
        this.settings = settings;
        this.random = rng.deriveFor("explorer", explorer.getId()).asJavaRandom();
    }

    /**
     * Sends a command built around a fresh reply future.
     *
     * @param command Factory receiving the future.
     * @return The reply future.
     */
    public CompletableFuture<ExplorerReply> ask(Function<CompletableFuture<ExplorerReply>, ExplorerCommand> command) {
        CompletableFuture<ExplorerReply> reply = new CompletableFuture<>();
        send(command.apply(reply));
        return reply;
    }

    @Override
    protected void handle(ExplorerCommand command) {
        int settled = explorer.settleInFlight();
        if (settled > 0) {
            log.debug("Explorer {} settled {} late combination(s)", explorer.getId(), settled);
        }
        ExplorerReply reply;
        if (command instanceof Tick tick) {
            reply = onTick(tick);
        } else if (command instanceof Reconfigure reconfigure) {
            reply = onReconfigure(reconfigure);
        } else if (command instanceof Query) {
            reply = ExplorerReply.accepted(explorer.snapshot());
        } else {
            throw new IllegalArgumentException("Unsupported explorer command: " + command);
        }
        command.reply().complete(reply);
    }

    private ExplorerReply onTick(Tick tick) {
        if (!explorer.isAlive()) {
            explorer.getMemory().recordRejection(RejectionReason.EXPLORER_DEAD);
            return ExplorerReply.rejected(RejectionReason.EXPLORER_DEAD, explorer.snapshot());
        }
        ExplorerContext ctx = new ExplorerContext(explorer, tick.view(), gateway, settings, random);
        if (ctx.checkSurvival()) {
            try {
                explorer.getStrategy().step(ctx);
            } catch (RuntimeException e) {
                log.warn("Explorer {} strategy {} failed at tick {}: {}", explorer.getId(),
                        explorer.getStrategyKind(), tick.tick(), e.getMessage());
                log.debug("Strategy failure details:", e);
                recordError("STRATEGY_FAILED", e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        ExplorerSnapshot after = explorer.snapshot();
        if (log.isDebugEnabled()) {
            log.debug("Tick {}: {}", tick.tick(), after);
        }
        return ExplorerReply.accepted(after);
    }

    private ExplorerReply onReconfigure(Reconfigure reconfigure) {
        if (!explorer.isAlive()) {
            return ExplorerReply.rejected(RejectionReason.EXPLORER_DEAD, explorer.snapshot());
        }
        if (reconfigure.target() == null || !reconfigure.target().isComplex()) {
            return ExplorerReply.rejected(RejectionReason.NO_RECIPE, explorer.snapshot());
        }
        explorer.reconfigure(reconfigure.strategy(), reconfigure.target());
        log.info("Explorer {} reconfigured: strategy={}, target={}", explorer.getId(),
                reconfigure.strategy(), reconfigure.target());
        return ExplorerReply.accepted(explorer.snapshot());
    }

    @Override
    protected void onDiscard(ExplorerCommand command) {
        command.reply().complete(ExplorerReply.rejected(RejectionReason.TIMEOUT, explorer.snapshot()));
    }

    public int getExplorerId() {
        return explorer.getId();
    }
}
