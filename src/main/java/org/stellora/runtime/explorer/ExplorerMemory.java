package org.stellora.runtime.explorer;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.model.RejectionReason;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Strategy-private knowledge of one explorer. Owned by the explorer's actor thread.
 */
public final class ExplorerMemory {

    private final Int2ObjectOpenHashMap<PlanetSnapshot> knownPlanets = new Int2ObjectOpenHashMap<>();
    private final IntOpenHashSet exhaustedCombiners = new IntOpenHashSet();
    private final EnumMap<RejectionReason, Integer> rejectionCounts = new EnumMap<>(RejectionReason.class);
    private IntList plannedRoute = new IntArrayList();
    private int destination = -1;
    private int consecutiveCapabilityFailures;
    private RejectionReason lastRejection;

    /**
     * Remembers what a planet looked like when it was last seen.
     *
     * @param snapshot The observed state.
     */
    public void observe(PlanetSnapshot snapshot) {
        knownPlanets.put(snapshot.id(), snapshot);
    }

    public Optional<PlanetSnapshot> lastSeen(int planetId) {
        return Optional.ofNullable(knownPlanets.get(planetId));
    }

    public int knownPlanetCount() {
        return knownPlanets.size();
    }

    public void recordRejection(RejectionReason reason) {
        lastRejection = reason;
        rejectionCounts.merge(reason, 1, Integer::sum);
        if (reason == RejectionReason.CAPABILITY_EXCEEDED) {
            consecutiveCapabilityFailures++;
        }
    }

    /**
     * Called after a capability-governed action (generate, combine, rocket) succeeded.
     */
    public void recordCapabilitySuccess() {
        consecutiveCapabilityFailures = 0;
    }

    public void resetCapabilityFailures() {
        consecutiveCapabilityFailures = 0;
    }

    /**
     * Marks a planet as no longer able to combine (a single-use combiner that refused).
     *
     * @param planetId The planet.
     */
    public void markExhaustedCombiner(int planetId) {
        exhaustedCombiners.add(planetId);
    }

    public boolean isExhaustedCombiner(int planetId) {
        return exhaustedCombiners.contains(planetId);
    }

    public IntSet exhaustedCombiners() {
        return exhaustedCombiners;
    }

    public void planRoute(int destination, IntList route) {
        this.destination = destination;
        this.plannedRoute = new IntArrayList(route);
    }

    public void clearPlan() {
        this.destination = -1;
        this.plannedRoute = new IntArrayList();
    }

    public int getDestination() {
        return destination;
    }

    public IntList getPlannedRoute() {
        return plannedRoute;
    }

    public int getConsecutiveCapabilityFailures() {
        return consecutiveCapabilityFailures;
    }

    public RejectionReason getLastRejection() {
        return lastRejection;
    }

    public int rejectionCount(RejectionReason reason) {
        return rejectionCounts.getOrDefault(reason, 0);
    }

    public Map<RejectionReason, Integer> rejectionCounts() {
        return Map.copyOf(rejectionCounts);
    }
}
