package org.stellora.runtime.model;

/**
 * The energy-cell store of a planet: a fixed capacity of cells, some of which are charged.
 * <p>
 * Charge only changes through {@link #discharge()} (generation, rocket building),
 * {@link #charge(int)} (sunrays) and {@link #destroy(int)} (asteroids).
 * Not thread-safe; owned by exactly one planet.
 */
public final class EnergyCells {

    private final int capacity;
    private int charged;

    /**
     * @param capacity Number of cells (1 for single-cell types).
     * @param charged  Initially charged cells, clamped to {@code [0, capacity]}.
     */
    public EnergyCells(int capacity, int charged) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Energy cell capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.charged = Math.max(0, Math.min(capacity, charged));
    }

    public int getCapacity() {
        return capacity;
    }

    public int getCharged() {
        return charged;
    }

    public boolean hasCharge() {
        return charged > 0;
    }

    /**
     * Uses one charged cell.
     *
     * @return {@code true} if a charged cell was available and discharged.
     */
    public boolean discharge() {
        if (charged == 0) {
            return false;
        }
        charged--;
        return true;
    }

    /**
     * Charges up to {@code amount} empty cells.
     *
     * @param amount Cells to charge.
     * @return The number of cells actually charged.
     */
    public int charge(int amount) {
        int added = Math.max(0, Math.min(amount, capacity - charged));
        charged += added;
        return added;
    }

    /**
     * Destroys up to {@code amount} charged cells.
     *
     * @param amount Cells to destroy.
     * @return The number of charged cells lost.
     */
    public int destroy(int amount) {
        int lost = Math.max(0, Math.min(amount, charged));
        charged -= lost;
        return lost;
    }
}
