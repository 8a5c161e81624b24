package org.stellora.runtime.explorer;

import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stellora.runtime.actors.MailboxFullException;
import org.stellora.runtime.actors.PlanetGateway;
import org.stellora.runtime.contracts.ActorStatus;
import org.stellora.runtime.contracts.GalaxyView;
import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.messages.PlanetReply;
import org.stellora.runtime.messages.PlanetRequest;
import org.stellora.runtime.messages.PlanetRequest.ExplorerHarvest;
import org.stellora.runtime.messages.PlanetRequest.GenerateResource;
import org.stellora.runtime.messages.PlanetRequest.InputOrigin;
import org.stellora.runtime.messages.PlanetRequest.RequestCombine;
import org.stellora.runtime.messages.PlanetRequest.RequestRocket;
import org.stellora.runtime.messages.PlanetRequest.RocketAction;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;

import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Everything a strategy may do during one tick.
 * <p>
 * Actions talk to the planet the explorer stands on through its mailbox and block until the
 * reply arrives or {@link ExplorerSettings#replyTimeoutMs()} passes. Every rejection is
 * recorded in the explorer's memory and returned; none is thrown.
 * <p>
 * Costs: each move along an edge or rocket jump spends one life unit. Harvesting, generating
 * and combining are free but bounded by {@link ExplorerSettings#maxHarvestPerTick()} units
 * harvested per tick. At most one move is allowed per tick.
 */
public class ExplorerContext {

    private static final Logger LOG = LoggerFactory.getLogger(ExplorerContext.class);

    private final Explorer explorer;
    private final GalaxyView view;
    private final PlanetGateway gateway;
    private final ExplorerSettings settings;
    private final Random random;
    private boolean moved;
    private int harvestedThisTick;

    public ExplorerContext(Explorer explorer, GalaxyView view, PlanetGateway gateway,
                           ExplorerSettings settings, Random random) {
        this.explorer = explorer;
        this.view = view;
        this.gateway = gateway;
        this.settings = settings;
        this.random = random;
    }

    /**
     * Applies the death conditions at the start of a tick and refreshes memory of the
     * current neighborhood.
     *
     * @return {@code true} if the explorer is still alive.
     */
    public boolean checkSurvival() {
        if (!explorer.isAlive()) {
            return false;
        }
        int position = explorer.getPosition();
        if (explorer.getLife() <= 0) {
            kill("life exhausted");
        } else if (!view.isAlive(position)) {
            kill("planet " + position + " destroyed");
        } else if (!energyReachable(position)) {
            kill("no reachable planet with energy");
        } else {
            observeNeighborhood();
        }
        return explorer.isAlive();
    }

    private boolean energyReachable(int position) {
        for (int id : view.topology().reachableFrom(position)) {
            Optional<PlanetSnapshot> p = view.planet(id);
            if (p.isPresent() && p.get().alive()
                    && (p.get().status() == ActorStatus.UNKNOWN || p.get().hasEnergy())) {
                return true;
            }
        }
        return false;
    }

    private void observeNeighborhood() {
        int position = explorer.getPosition();
        view.planet(position).ifPresent(explorer.getMemory()::observe);
        for (int n : view.topology().neighbors(position)) {
            view.planet(n).ifPresent(explorer.getMemory()::observe);
        }
    }

    private void kill(String cause) {
        explorer.die(cause);
        LOG.info("Explorer {} died at planet {}: {}", explorer.getId(), explorer.getPosition(), cause);
    }

    // ---------------------------------------------------------------- actions

    /**
     * Takes one unit of {@code kind} from the current planet.
     *
     * @param kind The kind to take.
     * @return The result; INSUFFICIENT_INVENTORY if the planet has none.
     */
    public ActionResult harvest(ResourceKind kind) {
        if (!explorer.isAlive()) {
            return ActionResult.rejected(RejectionReason.EXPLORER_DEAD);
        }
        if (!canHarvestMore()) {
            return ActionResult.rejected(RejectionReason.CAPABILITY_EXCEEDED);
        }
        PlanetReply reply = request(new ExplorerHarvest(kind));
        if (!reply.ok()) {
            return reject(reply.reason());
        }
        explorer.getInventory().add(kind);
        harvestedThisTick++;
        return ActionResult.gained(kind);
    }

    /**
     * Asks the current planet to generate one unit of {@code kind} into its own inventory.
     *
     * @param kind A base kind.
     * @return The result.
     */
    public ActionResult generate(ResourceKind kind) {
        if (!explorer.isAlive()) {
            return ActionResult.rejected(RejectionReason.EXPLORER_DEAD);
        }
        PlanetReply reply = request(new GenerateResource(kind));
        if (!reply.ok()) {
            return reject(reply.reason());
        }
        explorer.getMemory().recordCapabilitySuccess();
        return ActionResult.gained(kind);
    }

    /**
     * Obtains one unit of {@code kind} at the current planet: harvests it if the planet holds
     * it, otherwise generates it first.
     *
     * @param kind A base kind.
     * @return The result of the final harvest, or the generation failure.
     */
    public ActionResult collect(ResourceKind kind) {
        if (!canHarvestMore()) {
            return ActionResult.rejected(RejectionReason.CAPABILITY_EXCEEDED);
        }
        boolean present = currentPlanet().map(p -> p.count(kind) > 0).orElse(false);
        if (present) {
            PlanetReply reply = request(new ExplorerHarvest(kind));
            if (reply.ok()) {
                explorer.getInventory().add(kind);
                harvestedThisTick++;
                return ActionResult.gained(kind);
            }
        }
        ActionResult generated = generate(kind);
        if (!generated.ok()) {
            return generated;
        }
        return harvest(kind);
    }

    /**
     * Combines two carried units at the current planet. The units leave the explorer's
     * inventory only if the planet accepts; the product is added to it. Completed target
     * units are never used as inputs. If the reply times out the planet may still perform
     * the combination, so the inputs are held back until the late reply settles them.
     *
     * @param first  First input.
     * @param second Second input.
     * @return The result, with the product on success.
     */
    public ActionResult combine(ResourceKind first, ResourceKind second) {
        if (!explorer.isAlive()) {
            return ActionResult.rejected(RejectionReason.EXPLORER_DEAD);
        }
        if (!Planning.holdsPair(explorer.workingInventory(), first, second)) {
            return reject(RejectionReason.INSUFFICIENT_INVENTORY);
        }
        int planetId = explorer.getPosition();
        CompletableFuture<PlanetReply> pending =
                send(planetId, new RequestCombine(first, second, InputOrigin.REQUESTER));
        PlanetReply reply = await(planetId, pending);
        if (reply.reason() == RejectionReason.TIMEOUT && pending != null) {
            explorer.holdInFlight(first, second, pending);
            return reject(RejectionReason.TIMEOUT);
        }
        if (!reply.ok()) {
            if (reply.reason() == RejectionReason.CAPABILITY_EXCEEDED) {
                explorer.getMemory().markExhaustedCombiner(explorer.getPosition());
            }
            return reject(reply.reason());
        }
        explorer.getInventory().remove(first);
        explorer.getInventory().remove(second);
        explorer.getInventory().add(reply.product());
        explorer.getMemory().recordCapabilitySuccess();
        if (reply.product() == explorer.getTarget()) {
            explorer.completeTarget();
            explorer.getMemory().clearPlan();
            LOG.info("Explorer {} produced {} ({} so far)", explorer.getId(), reply.product(),
                    explorer.getCompletedTargets());
        }
        return ActionResult.gained(reply.product());
    }

    /**
     * Moves along one edge.
     *
     * @param neighbor An adjacent live planet.
     * @return The result; DISCONNECTED if not adjacent, PLANET_UNAVAILABLE if destroyed.
     * @throws IllegalStateException if the explorer already moved this tick.
     */
    public ActionResult moveTo(int neighbor) {
        if (!explorer.isAlive()) {
            return ActionResult.rejected(RejectionReason.EXPLORER_DEAD);
        }
        checkNotMoved();
        if (!view.topology().areAdjacent(explorer.getPosition(), neighbor)) {
            return reject(RejectionReason.DISCONNECTED);
        }
        if (!view.isAlive(neighbor)) {
            return reject(RejectionReason.PLANET_UNAVAILABLE);
        }
        travel(neighbor);
        return ActionResult.success();
    }

    /**
     * Jumps to any live planet with a rocket from the current planet, building the rocket
     * first if none is available.
     *
     * @param destination The destination planet.
     * @return The result.
     * @throws IllegalStateException if the explorer already moved this tick.
     */
    public ActionResult rocketJump(int destination) {
        if (!explorer.isAlive()) {
            return ActionResult.rejected(RejectionReason.EXPLORER_DEAD);
        }
        checkNotMoved();
        if (!view.isAlive(destination)) {
            return reject(RejectionReason.PLANET_UNAVAILABLE);
        }
        PlanetReply use = request(new RequestRocket(RocketAction.USE));
        if (!use.ok() && use.reason() == RejectionReason.INSUFFICIENT_INVENTORY) {
            PlanetReply create = request(new RequestRocket(RocketAction.CREATE));
            if (!create.ok()) {
                return reject(create.reason());
            }
            use = request(new RequestRocket(RocketAction.USE));
        }
        if (!use.ok()) {
            return reject(use.reason());
        }
        explorer.getMemory().recordCapabilitySuccess();
        LOG.debug("Explorer {} jumped by rocket {} -> {}", explorer.getId(), explorer.getPosition(), destination);
        travel(destination);
        return ActionResult.success();
    }

    private void travel(int destination) {
        moved = true;
        explorer.moveTo(destination);
        explorer.spendLife(1);
        view.planet(destination).ifPresent(explorer.getMemory()::observe);
        if (explorer.getLife() == 0) {
            kill("life exhausted");
        }
    }

    private void checkNotMoved() {
        if (moved) {
            throw new IllegalStateException("Explorer " + explorer.getId() + " already moved this tick");
        }
    }

    /**
     * Records a rejection that did not come from a planet, e.g. an unreachable goal.
     *
     * @param reason The reason.
     * @return The rejected result.
     */
    public ActionResult reject(RejectionReason reason) {
        explorer.getMemory().recordRejection(reason);
        return ActionResult.rejected(reason);
    }

    private PlanetReply request(PlanetRequest request) {
        int planetId = explorer.getPosition();
        return await(planetId, send(planetId, request));
    }

    private CompletableFuture<PlanetReply> send(int planetId, PlanetRequest request) {
        try {
            return gateway.send(planetId, request);
        } catch (MailboxFullException e) {
            LOG.warn("Explorer {} could not reach planet {}: {}", explorer.getId(), planetId, e.getMessage());
            return null;
        }
    }

    // A null future stands for a request that never left the explorer.
    private PlanetReply await(int planetId, CompletableFuture<PlanetReply> future) {
        if (future == null) {
            return PlanetReply.rejected(RejectionReason.TIMEOUT);
        }
        try {
            return future.get(settings.replyTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Explorer {} got no reply from planet {} within {}ms", explorer.getId(), planetId,
                    settings.replyTimeoutMs());
            return PlanetReply.rejected(RejectionReason.TIMEOUT);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PlanetReply.rejected(RejectionReason.TIMEOUT);
        } catch (ExecutionException e) {
            LOG.warn("Planet {} failed: {}", planetId, e.getCause().getMessage());
            return PlanetReply.rejected(RejectionReason.PLANET_UNAVAILABLE);
        }
    }

    // ---------------------------------------------------------------- queries

    /**
     * Picks one candidate according to the configured tie-break policy.
     *
     * @param candidates Planet ids in ascending order.
     * @return The chosen id, or {@code -1} if there are none.
     */
    public int choose(IntList candidates) {
        if (candidates.isEmpty()) {
            return -1;
        }
        if (settings.tieBreak() == TieBreak.LOWEST_ID) {
            int min = candidates.getInt(0);
            for (int i = 1; i < candidates.size(); i++) {
                min = Math.min(min, candidates.getInt(i));
            }
            return min;
        }
        return candidates.getInt(random.nextInt(candidates.size()));
    }

    public Optional<PlanetSnapshot> currentPlanet() {
        return view.planet(explorer.getPosition());
    }

    public boolean canHarvestMore() {
        return harvestedThisTick < settings.maxHarvestPerTick();
    }

    public boolean hasMoved() {
        return moved;
    }

    public boolean isAlive() {
        return explorer.isAlive();
    }

    public int position() {
        return explorer.getPosition();
    }

    public ResourceKind target() {
        return explorer.getTarget();
    }

    public Map<ResourceKind, Integer> workingInventory() {
        return explorer.workingInventory();
    }

    public Explorer explorer() {
        return explorer;
    }

    public ExplorerMemory memory() {
        return explorer.getMemory();
    }

    public GalaxyView view() {
        return view;
    }

    public ExplorerSettings settings() {
        return settings;
    }
}
