package org.stellora.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A multiset of resource units with non-negative counts.
 * <p>
 * Not thread-safe: every inventory is owned by a single actor. Use {@link #toMap()}
 * to hand an immutable copy across actor boundaries.
 */
public final class Inventory {

    private final EnumMap<ResourceKind, Integer> counts = new EnumMap<>(ResourceKind.class);

    public Inventory() {
    }

    /**
     * Creates an inventory pre-filled from a count map (zero and negative entries are ignored).
     *
     * @param initial Initial counts.
     */
    public Inventory(Map<ResourceKind, Integer> initial) {
        initial.forEach((kind, count) -> {
            if (count != null && count > 0) {
                counts.put(kind, count);
            }
        });
    }

    public int count(ResourceKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    public boolean contains(ResourceKind kind) {
        return count(kind) > 0;
    }

    public void add(ResourceKind kind) {
        add(kind, 1);
    }

    public void add(ResourceKind kind, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot add a negative amount: " + amount);
        }
        if (amount > 0) {
            counts.merge(kind, amount, Integer::sum);
        }
    }

    /**
     * Removes one unit.
     *
     * @param kind The kind to remove.
     * @return {@code true} if a unit was present and removed.
     */
    public boolean remove(ResourceKind kind) {
        int current = count(kind);
        if (current == 0) {
            return false;
        }
        if (current == 1) {
            counts.remove(kind);
        } else {
            counts.put(kind, current - 1);
        }
        return true;
    }

    /**
     * Checks whether the pair can be taken from this inventory; {@code (X, X)} needs two units.
     */
    public boolean containsPair(ResourceKind a, ResourceKind b) {
        if (a == b) {
            return count(a) >= 2;
        }
        return contains(a) && contains(b);
    }

    public int total() {
        int sum = 0;
        for (int c : counts.values()) {
            sum += c;
        }
        return sum;
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * @return an immutable copy containing only kinds with a positive count.
     */
    public Map<ResourceKind, Integer> toMap() {
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
