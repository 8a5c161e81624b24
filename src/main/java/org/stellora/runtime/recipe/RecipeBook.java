package org.stellora.runtime.recipe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.stellora.runtime.model.Inventory;
import org.stellora.runtime.model.ResourceKind;

import static org.stellora.runtime.model.ResourceKind.AI_PARTNER;
import static org.stellora.runtime.model.ResourceKind.CARBON;
import static org.stellora.runtime.model.ResourceKind.DIAMOND;
import static org.stellora.runtime.model.ResourceKind.DOLPHIN;
import static org.stellora.runtime.model.ResourceKind.HYDROGEN;
import static org.stellora.runtime.model.ResourceKind.LIFE;
import static org.stellora.runtime.model.ResourceKind.OXYGEN;
import static org.stellora.runtime.model.ResourceKind.ROBOT;
import static org.stellora.runtime.model.ResourceKind.SILICON;
import static org.stellora.runtime.model.ResourceKind.WATER;

/**
 * The fixed recipe table of the galaxy and the queries derived from it.
 * <p>
 * The table maps unordered pairs of kinds to a product:
 * <ul>
 *   <li>HYDROGEN + OXYGEN = WATER</li>
 *   <li>CARBON + CARBON = DIAMOND</li>
 *   <li>WATER + CARBON = LIFE</li>
 *   <li>SILICON + LIFE = ROBOT</li>
 *   <li>WATER + LIFE = DOLPHIN</li>
 *   <li>ROBOT + DIAMOND = AI_PARTNER</li>
 * </ul>
 * All other pairs have no product. The class is stateless and every method is pure;
 * callers own the inventories and apply consumption and production themselves.
 */
public final class RecipeBook {

    private static final Map<RecipePair, ResourceKind> PRODUCTS;
    private static final Map<ResourceKind, RecipePair> INGREDIENTS;

    static {
        Map<RecipePair, ResourceKind> products = new LinkedHashMap<>();
        products.put(RecipePair.of(HYDROGEN, OXYGEN), WATER);
        products.put(RecipePair.of(CARBON, CARBON), DIAMOND);
        products.put(RecipePair.of(WATER, CARBON), LIFE);
        products.put(RecipePair.of(SILICON, LIFE), ROBOT);
        products.put(RecipePair.of(WATER, LIFE), DOLPHIN);
        products.put(RecipePair.of(ROBOT, DIAMOND), AI_PARTNER);
        PRODUCTS = Collections.unmodifiableMap(products);

        Map<ResourceKind, RecipePair> ingredients = new EnumMap<>(ResourceKind.class);
        products.forEach((pair, product) -> ingredients.put(product, pair));
        INGREDIENTS = Collections.unmodifiableMap(ingredients);
    }

    private RecipeBook() {
    }

    /**
     * Resolves the product of combining two kinds. Order of the arguments does not matter.
     *
     * @param a First input.
     * @param b Second input.
     * @return The product, or empty if the pair has no recipe.
     */
    public static Optional<ResourceKind> combine(ResourceKind a, ResourceKind b) {
        return Optional.ofNullable(PRODUCTS.get(RecipePair.of(a, b)));
    }

    /**
     * @return the immutable recipe table in declaration order.
     */
    public static Map<RecipePair, ResourceKind> recipes() {
        return PRODUCTS;
    }

    /**
     * @param product A complex kind.
     * @return the pair that produces it, or empty for base kinds.
     */
    public static Optional<RecipePair> ingredients(ResourceKind product) {
        return Optional.ofNullable(INGREDIENTS.get(product));
    }

    /**
     * Checks whether {@code kind} is {@code target} itself or appears anywhere in its recipe tree.
     */
    public static boolean isOnRecipeTree(ResourceKind kind, ResourceKind target) {
        if (kind == target) {
            return true;
        }
        RecipePair pair = INGREDIENTS.get(target);
        if (pair == null) {
            return false;
        }
        return isOnRecipeTree(kind, pair.first()) || isOnRecipeTree(kind, pair.second());
    }

    /**
     * @return the base kinds that appear in the recipe tree of {@code target}.
     */
    public static Set<ResourceKind> relevantBaseKinds(ResourceKind target) {
        Set<ResourceKind> result = EnumSet.noneOf(ResourceKind.class);
        for (ResourceKind kind : ResourceKind.baseKinds()) {
            if (isOnRecipeTree(kind, target)) {
                result.add(kind);
            }
        }
        return result;
    }

    /**
     * Computes the base units still missing to produce one unit of {@code target},
     * reusing every unit (base or intermediate) already in {@code held}.
     * <p>
     * For example AI_PARTNER from an empty inventory needs
     * {@code {HYDROGEN:1, OXYGEN:1, CARBON:3, SILICON:1}}; holding a LIFE removes the
     * HYDROGEN, OXYGEN and one CARBON from that demand.
     *
     * @param target The kind to produce.
     * @param held   Units already available (not modified).
     * @return an immutable map of missing base kinds to counts; empty if nothing is missing.
     */
    public static Map<ResourceKind, Integer> baseRequirements(ResourceKind target, Map<ResourceKind, Integer> held) {
        Inventory available = new Inventory(held);
        Map<ResourceKind, Integer> missing = new EnumMap<>(ResourceKind.class);
        collectMissing(target, available, missing);
        return Collections.unmodifiableMap(missing);
    }

    private static void collectMissing(ResourceKind kind, Inventory available, Map<ResourceKind, Integer> missing) {
        if (available.remove(kind)) {
            return;
        }
        RecipePair pair = INGREDIENTS.get(kind);
        if (pair == null) {
            missing.merge(kind, 1, Integer::sum);
            return;
        }
        collectMissing(pair.first(), available, missing);
        collectMissing(pair.second(), available, missing);
    }

    /**
     * Lists the combinations that can be executed right now, in order, to progress
     * towards {@code target} with the units in {@code held}.
     * <p>
     * Each step only uses units that are held or produced by an earlier step. If the
     * whole tree is satisfiable the last step yields {@code target}; otherwise the
     * list covers the satisfiable subtrees only. If {@code target} itself is already
     * held the list is empty.
     *
     * @param target The kind to produce.
     * @param held   Units already available (not modified).
     * @return the executable combination steps.
     */
    public static List<RecipePair> combinationSteps(ResourceKind target, Map<ResourceKind, Integer> held) {
        Inventory available = new Inventory(held);
        List<RecipePair> steps = new ArrayList<>();
        if (!available.contains(target)) {
            resolve(target, available, steps);
        }
        return steps;
    }

    private static boolean resolve(ResourceKind kind, Inventory available, List<RecipePair> steps) {
        if (available.remove(kind)) {
            return true;
        }
        RecipePair pair = INGREDIENTS.get(kind);
        if (pair == null) {
            return false;
        }
        boolean first = resolve(pair.first(), available, steps);
        boolean second = resolve(pair.second(), available, steps);
        if (first && second) {
            steps.add(pair);
            return true;
        }
        return false;
    }
}
