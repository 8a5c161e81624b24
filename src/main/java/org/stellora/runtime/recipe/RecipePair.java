package org.stellora.runtime.recipe;

import org.stellora.runtime.model.ResourceKind;

/**
 * An unordered pair of resource kinds, stored in canonical (ordinal) order.
 *
 * @param first  The kind with the lower ordinal.
 * @param second The kind with the higher (or equal) ordinal.
 */
public record RecipePair(ResourceKind first, ResourceKind second) {

    /**
     * Creates the canonical pair for two kinds given in any order.
     */
    public static RecipePair of(ResourceKind a, ResourceKind b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Recipe inputs must not be null");
        }
        return a.ordinal() <= b.ordinal() ? new RecipePair(a, b) : new RecipePair(b, a);
    }

    @Override
    public String toString() {
        return first + "+" + second;
    }
}
