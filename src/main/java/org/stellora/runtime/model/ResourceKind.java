package org.stellora.runtime.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * The ten resource kinds that exist in the galaxy.
 * <p>
 * Base kinds are produced by planets from energy; complex kinds only arise from
 * combining two other kinds (see {@link org.stellora.runtime.recipe.RecipeBook}).
 * A resource carries no identity beyond its kind.
 */
public enum ResourceKind {
    HYDROGEN(true),
    OXYGEN(true),
    CARBON(true),
    SILICON(true),
    WATER(false),
    DIAMOND(false),
    LIFE(false),
    ROBOT(false),
    DOLPHIN(false),
    AI_PARTNER(false);

    private static final Set<ResourceKind> BASE = EnumSet.of(HYDROGEN, OXYGEN, CARBON, SILICON);
    private static final Set<ResourceKind> COMPLEX = EnumSet.complementOf(EnumSet.copyOf(BASE));

    private final boolean base;

    ResourceKind(boolean base) {
        this.base = base;
    }

    public boolean isBase() {
        return base;
    }

    public boolean isComplex() {
        return !base;
    }

    /**
     * @return a fresh mutable set of the four base kinds.
     */
    public static Set<ResourceKind> baseKinds() {
        return EnumSet.copyOf(BASE);
    }

    /**
     * @return a fresh mutable set of the six complex kinds.
     */
    public static Set<ResourceKind> complexKinds() {
        return EnumSet.copyOf(COMPLEX);
    }

    /**
     * Parses a kind name leniently: case-insensitive, accepting {@code -} and blanks
     * in place of {@code _} (so {@code "AI-Partner"} resolves to {@link #AI_PARTNER}).
     *
     * @param name The name to parse.
     * @return The matching kind.
     * @throws IllegalArgumentException if no kind matches.
     */
    public static ResourceKind parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Resource kind name must not be null");
        }
        String normalized = name.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        try {
            return ResourceKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resource kind: '" + name + "'", e);
        }
    }
}
