package org.stellora.runtime.model;

/**
 * The four planet types and their capability matrix.
 * <p>
 * Each type fixes four independent limits:
 * <pre>
 * Type | Energy cells | Generation | Rockets | Combination
 *  A   | many         | &lt;= 1       | &lt;= 1    | none
 *  B   | one          | unbounded  | none    | &lt;= 1
 *  C   | one          | &lt;= 1       | &lt;= 1    | unbounded
 *  D   | many         | unbounded  | none    | none
 * </pre>
 * The generation limit counts the distinct base kinds a planet can produce. A type
 * limited to one kind pays for every unit with a charged energy cell; a type with
 * unbounded generation produces without discharging cells.
 */
public enum PlanetType {
    A(true, 1, 1, 0),
    B(false, Limits.UNBOUNDED, 0, 1),
    C(false, 1, 1, Limits.UNBOUNDED),
    D(true, Limits.UNBOUNDED, 0, 0);

    /** Marker for a capability without an upper limit. */
    public static final int UNBOUNDED = Limits.UNBOUNDED;

    private final boolean manyCells;
    private final int generationLimit;
    private final int rocketLimit;
    private final int combinationLimit;

    PlanetType(boolean manyCells, int generationLimit, int rocketLimit, int combinationLimit) {
        this.manyCells = manyCells;
        this.generationLimit = generationLimit;
        this.rocketLimit = rocketLimit;
        this.combinationLimit = combinationLimit;
    }

    /**
     * @return {@code true} if the type holds a pool of cells, {@code false} for a single cell.
     */
    public boolean hasManyCells() {
        return manyCells;
    }

    /**
     * @return the number of distinct base kinds the type may generate, or {@link #UNBOUNDED}.
     */
    public int getGenerationLimit() {
        return generationLimit;
    }

    public int getRocketLimit() {
        return rocketLimit;
    }

    /**
     * @return the number of successful combinations a planet of this type may ever perform,
     *         or {@link #UNBOUNDED}.
     */
    public int getCombinationLimit() {
        return combinationLimit;
    }

    public boolean canBuildRockets() {
        return rocketLimit > 0;
    }

    public boolean canCombine() {
        return combinationLimit != 0;
    }

    /**
     * @return {@code true} if every generated unit discharges one energy cell.
     */
    public boolean generationDischargesCell() {
        return generationLimit != UNBOUNDED;
    }

    /**
     * Checks a counter against one of this type's limits.
     *
     * @param limit The limit (possibly {@link #UNBOUNDED}).
     * @param count The counter value.
     * @return {@code true} if {@code count} is still below the limit.
     */
    public static boolean below(int limit, int count) {
        return limit == UNBOUNDED || count < limit;
    }

    /**
     * @param limit The limit (possibly {@link #UNBOUNDED}).
     * @param count The counter value.
     * @return {@code true} if {@code count} is above the limit.
     */
    public static boolean exceeds(int limit, int count) {
        return limit != UNBOUNDED && count > limit;
    }

    /**
     * Parses a type code ({@code A}-{@code D}, case-insensitive).
     *
     * @param code The code to parse.
     * @return The planet type.
     * @throws IllegalArgumentException if the code is unknown.
     */
    public static PlanetType parse(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Planet type code must not be empty");
        }
        try {
            return PlanetType.valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown planet type: '" + code + "' (expected A, B, C or D)", e);
        }
    }

    // Enum constant arguments may not forward-reference the enum's own static fields.
    private static final class Limits {
        static final int UNBOUNDED = -1;
    }
}
