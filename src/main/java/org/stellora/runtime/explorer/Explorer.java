package org.stellora.runtime.explorer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.stellora.runtime.contracts.ActorStatus;
import org.stellora.runtime.contracts.ExplorerSnapshot;
import org.stellora.runtime.messages.PlanetReply;
import org.stellora.runtime.model.Inventory;
import org.stellora.runtime.model.ResourceKind;

/**
 * State of one explorer: position, carried resources, life budget and goal.
 * <p>
 * Not thread-safe. Owned by exactly one {@link org.stellora.runtime.actors.ExplorerActor}.
 */
public final class Explorer {

    private final int id;
    private final Inventory inventory;
    private final Deque<ResourceKind> fallbackTargets;
    private final ExplorerMemory memory = new ExplorerMemory();
    private final List<InFlightCombine> inFlight = new ArrayList<>();
    private int position;
    private int life;
    private StrategyKind strategyKind;
    private IExplorerStrategy strategy;
    private ResourceKind target;
    private boolean alive = true;
    private int completedTargets;
    private String causeOfDeath;

    /**
     * @param id               Explorer id.
     * @param startPlanet      Id of the planet the explorer starts on.
     * @param strategyKind     The strategy to run.
     * @param target           A complex resource to produce.
     * @param fallbackTargets  Complex resources to switch to, in order, when the target becomes infeasible.
     * @param life             Initial life budget.
     * @param initialInventory Resources carried at start.
     * @throws IllegalArgumentException if a target is not a complex kind or life is not positive.
     */
    public Explorer(int id, int startPlanet, StrategyKind strategyKind, ResourceKind target,
                    List<ResourceKind> fallbackTargets, int life, Map<ResourceKind, Integer> initialInventory) {
        requireComplex(target);
        fallbackTargets.forEach(Explorer::requireComplex);
        if (life <= 0) {
            throw new IllegalArgumentException("Explorer " + id + " needs a positive life budget, got " + life);
        }
        this.id = id;
        this.position = startPlanet;
        this.strategyKind = strategyKind;
        this.strategy = strategyKind.create();
        this.target = target;
        this.fallbackTargets = new ArrayDeque<>(fallbackTargets);
        this.life = life;
        this.inventory = new Inventory(initialInventory);
    }

    private static void requireComplex(ResourceKind kind) {
        if (kind == null || !kind.isComplex()) {
            throw new IllegalArgumentException("Explorer target must be a complex resource, got " + kind);
        }
    }

    /**
     * Replaces strategy and target. Fallback targets are kept.
     *
     * @param strategyKind New strategy.
     * @param target       New complex target.
     */
    public void reconfigure(StrategyKind strategyKind, ResourceKind target) {
        requireComplex(target);
        if (strategyKind != this.strategyKind) {
            this.strategyKind = strategyKind;
            this.strategy = strategyKind.create();
        }
        this.target = target;
        memory.clearPlan();
        memory.resetCapabilityFailures();
    }

    /**
     * Switches to the next fallback target, if any.
     *
     * @return The new target, or empty if no fallback remains.
     */
    public Optional<ResourceKind> switchToFallback() {
        ResourceKind next = fallbackTargets.pollFirst();
        if (next == null) {
            return Optional.empty();
        }
        target = next;
        memory.clearPlan();
        memory.resetCapabilityFailures();
        return Optional.of(next);
    }

    void moveTo(int planetId) {
        position = planetId;
    }

    void spendLife(int amount) {
        life = Math.max(0, life - amount);
    }

    void die(String cause) {
        alive = false;
        causeOfDeath = cause;
        memory.clearPlan();
    }

    void completeTarget() {
        completedTargets++;
    }

    /**
     * A combination with requester-supplied inputs whose reply did not arrive in time. The
     * planet may still perform it, so the inputs stay out of the inventory until it settles.
     */
    record InFlightCombine(ResourceKind first, ResourceKind second, CompletableFuture<PlanetReply> reply) {
    }

    void holdInFlight(ResourceKind first, ResourceKind second, CompletableFuture<PlanetReply> reply) {
        inventory.remove(first);
        inventory.remove(second);
        inFlight.add(new InFlightCombine(first, second, reply));
    }

    /**
     * Settles combinations whose reply arrived late. A success adds the product (counting a
     * completed target), anything else returns both inputs.
     *
     * @return The number of combinations settled.
     */
    public int settleInFlight() {
        int settled = 0;
        Iterator<InFlightCombine> it = inFlight.iterator();
        while (it.hasNext()) {
            InFlightCombine combine = it.next();
            if (!combine.reply().isDone()) {
                continue;
            }
            it.remove();
            settled++;
            PlanetReply reply = outcome(combine.reply());
            if (reply != null && reply.ok() && reply.product() != null) {
                inventory.add(reply.product());
                if (reply.product() == target) {
                    completeTarget();
                }
            } else {
                inventory.add(combine.first());
                inventory.add(combine.second());
            }
        }
        return settled;
    }

    private static PlanetReply outcome(CompletableFuture<PlanetReply> reply) {
        try {
            return reply.getNow(null);
        } catch (CompletionException | CancellationException e) {
            return null;
        }
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Carried resources without units of the current target. Finished target units are a score,
     * not inputs for the next unit.
     *
     * @return A fresh map of working resources.
     */
    public Map<ResourceKind, Integer> workingInventory() {
        Map<ResourceKind, Integer> working = new EnumMap<>(ResourceKind.class);
        working.putAll(inventory.toMap());
        working.remove(target);
        return working;
    }

    public ExplorerSnapshot snapshot() {
        return new ExplorerSnapshot(id, position, inventory.toMap(), life, strategyKind, target, alive,
                alive ? ActorStatus.ACTIVE : ActorStatus.DEAD, completedTargets, memory.getLastRejection());
    }

    public int getId() {
        return id;
    }

    public int getPosition() {
        return position;
    }

    public int getLife() {
        return life;
    }

    public Inventory getInventory() {
        return inventory;
    }

    public StrategyKind getStrategyKind() {
        return strategyKind;
    }

    public IExplorerStrategy getStrategy() {
        return strategy;
    }

    public ResourceKind getTarget() {
        return target;
    }

    public List<ResourceKind> getFallbackTargets() {
        return List.copyOf(fallbackTargets);
    }

    public boolean isAlive() {
        return alive;
    }

    public int getCompletedTargets() {
        return completedTargets;
    }

    public String getCauseOfDeath() {
        return causeOfDeath;
    }

    public ExplorerMemory getMemory() {
        return memory;
    }

    @Override
    public String toString() {
        return "Explorer{id=" + id + ", position=" + position + ", life=" + life + ", strategy=" + strategyKind
                + ", target=" + target + ", inventory=" + inventory + ", alive=" + alive + "}";
    }
}
