package org.stellora.runtime.contracts;

import java.util.Map;
import java.util.Set;

import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.ResourceKind;

/**
 * Immutable view of one planet's state at a point in time.
 *
 * @param id             The planet id.
 * @param type           The planet type.
 * @param inventory      Resource counts held by the planet.
 * @param energy         Charged energy cells.
 * @param capacity       Total energy cells.
 * @param rockets        Rockets currently held.
 * @param combinations   Successful combinations performed so far.
 * @param supportedKinds Base kinds the planet can generate.
 * @param alive          {@code false} once the planet is destroyed.
 * @param status         Reporting status; {@link ActorStatus#UNKNOWN} if the planet did not answer.
 */
public record PlanetSnapshot(
        int id,
        PlanetType type,
        Map<ResourceKind, Integer> inventory,
        int energy,
        int capacity,
        int rockets,
        int combinations,
        Set<ResourceKind> supportedKinds,
        boolean alive,
        ActorStatus status) {

    public PlanetSnapshot {
        inventory = inventory == null ? Map.of() : Map.copyOf(inventory);
        supportedKinds = supportedKinds == null ? Set.of() : Set.copyOf(supportedKinds);
    }

    /**
     * Placeholder for a planet that did not answer a state query in time.
     * The planet is assumed alive since its death was never observed.
     *
     * @param id   The planet id.
     * @param type The planet type as known to the orchestrator.
     * @return A snapshot with status {@link ActorStatus#UNKNOWN} and no state.
     */
    public static PlanetSnapshot unknown(int id, PlanetType type) {
        return new PlanetSnapshot(id, type, Map.of(), 0, 0, 0, 0, Set.of(), true, ActorStatus.UNKNOWN);
    }

    public int count(ResourceKind kind) {
        return inventory.getOrDefault(kind, 0);
    }

    public boolean hasEnergy() {
        return energy > 0;
    }

    /**
     * @param kind A resource kind.
     * @return {@code true} if the planet holds {@code kind} or can generate it.
     */
    public boolean canSupply(ResourceKind kind) {
        return count(kind) > 0 || supportedKinds.contains(kind);
    }
}
