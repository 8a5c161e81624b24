package org.stellora.runtime.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.stellora.runtime.contracts.ActorStatus;
import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.messages.PlanetReply;
import org.stellora.runtime.messages.PlanetRequest;
import org.stellora.runtime.messages.PlanetRequest.AsteroidArrival;
import org.stellora.runtime.messages.PlanetRequest.ExplorerHarvest;
import org.stellora.runtime.messages.PlanetRequest.GenerateResource;
import org.stellora.runtime.messages.PlanetRequest.InputOrigin;
import org.stellora.runtime.messages.PlanetRequest.QueryState;
import org.stellora.runtime.messages.PlanetRequest.RequestCombine;
import org.stellora.runtime.messages.PlanetRequest.RequestRocket;
import org.stellora.runtime.messages.PlanetRequest.RocketAction;
import org.stellora.runtime.messages.PlanetRequest.SunrayArrival;
import org.stellora.runtime.recipe.RecipeBook;

/**
 * The economic state of one planet and the rules of its type.
 * <p>
 * Every request is applied all-or-nothing: a rejected request leaves the planet
 * unchanged. After each successful mutation the capability matrix of the type is
 * re-checked; a breach is an internal fault and raises
 * {@link CapabilityViolationException}.
 * <p>
 * <b>Thread safety:</b> not thread-safe. A planet is owned by exactly one
 * {@link org.stellora.runtime.actors.PlanetActor}, which serializes all access.
 */
public final class Planet {

    private final int id;
    private final PlanetType type;
    private final Set<ResourceKind> supportedKinds;
    private final EnergyCells cells;
    private final Inventory inventory;
    private int rockets;
    private int combinations;
    private boolean alive = true;

    /**
     * Creates a planet with fully charged cells and an empty inventory.
     *
     * @param id             The planet id.
     * @param type           The planet type.
     * @param supportedKinds Base kinds the planet can generate.
     * @param manyCellCapacity Cell count used by many-cell types.
     */
    public Planet(int id, PlanetType type, Set<ResourceKind> supportedKinds, int manyCellCapacity) {
        this(id, type, supportedKinds, manyCellCapacity, Integer.MAX_VALUE, Map.of());
    }

    /**
     * @param id               The planet id.
     * @param type             The planet type.
     * @param supportedKinds   Base kinds the planet can generate; at most the type's generation limit.
     * @param manyCellCapacity Cell count used by many-cell types.
     * @param initialCharge    Initially charged cells, clamped to the capacity.
     * @param initialInventory Initial resource counts.
     * @throws IllegalArgumentException if the supported kinds violate the type's generation limit
     *                                  or contain a complex kind.
     */
    public Planet(int id, PlanetType type, Set<ResourceKind> supportedKinds, int manyCellCapacity,
                  int initialCharge, Map<ResourceKind, Integer> initialInventory) {
        this.id = id;
        this.type = type;
        this.supportedKinds = supportedKinds.isEmpty()
                ? EnumSet.noneOf(ResourceKind.class)
                : EnumSet.copyOf(supportedKinds);
        for (ResourceKind kind : this.supportedKinds) {
            if (!kind.isBase()) {
                throw new IllegalArgumentException("Planet " + id + " cannot generate complex kind " + kind);
            }
        }
        if (PlanetType.exceeds(type.getGenerationLimit(), this.supportedKinds.size())) {
            throw new IllegalArgumentException(String.format(
                    "Planet %d of type %s supports at most %d base kind(s), got %s",
                    id, type, type.getGenerationLimit(), this.supportedKinds));
        }
        int capacity = type.hasManyCells() ? manyCellCapacity : 1;
        this.cells = new EnergyCells(capacity, initialCharge);
        this.inventory = new Inventory(initialInventory);
    }

    /**
     * Applies one request.
     *
     * @param request The request to apply.
     * @return The reply; rejections are returned, never thrown.
     * @throws CapabilityViolationException if applying the request broke the capability matrix.
     */
    public PlanetReply handle(PlanetRequest request) {
        if (request instanceof QueryState) {
            return PlanetReply.state(snapshot());
        }
        if (!alive) {
            return PlanetReply.rejected(RejectionReason.PLANET_UNAVAILABLE);
        }
        PlanetReply reply;
        if (request instanceof GenerateResource g) {
            reply = generate(g.kind());
        } else if (request instanceof RequestCombine c) {
            reply = combine(c.first(), c.second(), c.origin());
        } else if (request instanceof RequestRocket r) {
            reply = r.action() == RocketAction.CREATE ? createRocket() : useRocket();
        } else if (request instanceof ExplorerHarvest h) {
            reply = harvest(h.kind());
        } else if (request instanceof SunrayArrival s) {
            reply = sunray(s.amount());
        } else if (request instanceof AsteroidArrival a) {
            reply = asteroid(a.damage());
        } else {
            throw new IllegalArgumentException("Unsupported planet request: " + request);
        }
        verifyCapabilities();
        return reply;
    }

    PlanetReply generate(ResourceKind kind) {
        if (!supportedKinds.contains(kind)) {
            return PlanetReply.rejected(RejectionReason.CAPABILITY_EXCEEDED);
        }
        if (type.generationDischargesCell() && !cells.discharge()) {
            return PlanetReply.rejected(RejectionReason.NO_ENERGY);
        }
        inventory.add(kind);
        return PlanetReply.produced(kind);
    }

    PlanetReply combine(ResourceKind first, ResourceKind second, InputOrigin origin) {
        if (!PlanetType.below(type.getCombinationLimit(), combinations)) {
            return PlanetReply.rejected(RejectionReason.CAPABILITY_EXCEEDED);
        }
        Optional<ResourceKind> product = RecipeBook.combine(first, second);
        if (product.isEmpty()) {
            return PlanetReply.rejected(RejectionReason.NO_RECIPE);
        }
        if (origin == InputOrigin.PLANET) {
            if (!inventory.containsPair(first, second)) {
                return PlanetReply.rejected(RejectionReason.INSUFFICIENT_INVENTORY);
            }
            inventory.remove(first);
            inventory.remove(second);
            inventory.add(product.get());
        }
        combinations++;
        return PlanetReply.produced(product.get());
    }

    PlanetReply createRocket() {
        if (!PlanetType.below(type.getRocketLimit(), rockets)) {
            return PlanetReply.rejected(RejectionReason.CAPABILITY_EXCEEDED);
        }
        if (!cells.discharge()) {
            return PlanetReply.rejected(RejectionReason.NO_ENERGY);
        }
        rockets++;
        return PlanetReply.success();
    }

    PlanetReply useRocket() {
        if (!type.canBuildRockets()) {
            return PlanetReply.rejected(RejectionReason.CAPABILITY_EXCEEDED);
        }
        if (rockets == 0) {
            return PlanetReply.rejected(RejectionReason.INSUFFICIENT_INVENTORY);
        }
        rockets--;
        return PlanetReply.success();
    }

    PlanetReply harvest(ResourceKind kind) {
        if (!inventory.remove(kind)) {
            return PlanetReply.rejected(RejectionReason.INSUFFICIENT_INVENTORY);
        }
        return PlanetReply.produced(kind);
    }

    PlanetReply sunray(int amount) {
        cells.charge(amount);
        return PlanetReply.success();
    }

    PlanetReply asteroid(int damage) {
        if (rockets > 0) {
            rockets--;
            return PlanetReply.success();
        }
        cells.destroy(damage);
        if (!cells.hasCharge()) {
            alive = false;
        }
        return PlanetReply.success();
    }

    private void verifyCapabilities() {
        if (PlanetType.exceeds(type.getRocketLimit(), rockets)) {
            throw new CapabilityViolationException(String.format(
                    "Planet %d of type %s holds %d rockets (limit %d)", id, type, rockets, type.getRocketLimit()));
        }
        if (PlanetType.exceeds(type.getCombinationLimit(), combinations)) {
            throw new CapabilityViolationException(String.format(
                    "Planet %d of type %s performed %d combinations (limit %d)",
                    id, type, combinations, type.getCombinationLimit()));
        }
        if (rockets < 0 || combinations < 0) {
            throw new CapabilityViolationException("Planet " + id + " has a negative counter");
        }
    }

    public PlanetSnapshot snapshot() {
        return new PlanetSnapshot(id, type, inventory.toMap(), cells.getCharged(), cells.getCapacity(),
                rockets, combinations, supportedKinds, alive, alive ? ActorStatus.ACTIVE : ActorStatus.DEAD);
    }

    public int getId() {
        return id;
    }

    public PlanetType getType() {
        return type;
    }

    public Set<ResourceKind> getSupportedKinds() {
        return Collections.unmodifiableSet(supportedKinds);
    }

    public int getCharged() {
        return cells.getCharged();
    }

    public int getRockets() {
        return rockets;
    }

    public int getCombinations() {
        return combinations;
    }

    public boolean isAlive() {
        return alive;
    }

    @Override
    public String toString() {
        return "Planet{id=" + id + ", type=" + type + ", energy=" + cells.getCharged() + "/" + cells.getCapacity()
                + ", rockets=" + rockets + ", inventory=" + inventory + ", alive=" + alive + "}";
    }
}
