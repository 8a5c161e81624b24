package org.stellora.runtime.recipe;

import static org.assertj.core.api.Assertions.assertThat;
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

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stellora.runtime.model.ResourceKind;

@Tag("unit")
class RecipeBookTest {

    @Test
    void combinesTheSixRecipesInEitherOrder() {
        assertThat(RecipeBook.combine(HYDROGEN, OXYGEN)).contains(WATER);
        assertThat(RecipeBook.combine(OXYGEN, HYDROGEN)).contains(WATER);
        assertThat(RecipeBook.combine(CARBON, CARBON)).contains(DIAMOND);
        assertThat(RecipeBook.combine(CARBON, WATER)).contains(LIFE);
        assertThat(RecipeBook.combine(LIFE, SILICON)).contains(ROBOT);
        assertThat(RecipeBook.combine(LIFE, WATER)).contains(DOLPHIN);
        assertThat(RecipeBook.combine(DIAMOND, ROBOT)).contains(AI_PARTNER);
        assertThat(RecipeBook.recipes()).hasSize(6);
    }

    @Test
    void everyOtherPairHasNoProduct() {
        int products = 0;
        for (ResourceKind a : ResourceKind.values()) {
            for (ResourceKind b : ResourceKind.values()) {
                if (RecipeBook.combine(a, b).isPresent()) {
                    products++;
                }
            }
        }
        // five unordered pairs of distinct kinds count twice, CARBON+CARBON once
        assertThat(products).isEqualTo(11);
        assertThat(RecipeBook.combine(HYDROGEN, HYDROGEN)).isEmpty();
        assertThat(RecipeBook.combine(WATER, WATER)).isEmpty();
    }

    @Test
    void baseRequirementsOfAiPartner() {
        assertThat(RecipeBook.baseRequirements(AI_PARTNER, Map.of()))
                .isEqualTo(Map.of(HYDROGEN, 1, OXYGEN, 1, CARBON, 3, SILICON, 1));
    }

    @Test
    void baseRequirementsReuseHeldIntermediates() {
        assertThat(RecipeBook.baseRequirements(AI_PARTNER, Map.of(LIFE, 1)))
                .isEqualTo(Map.of(CARBON, 2, SILICON, 1));
        assertThat(RecipeBook.baseRequirements(DOLPHIN, Map.of(HYDROGEN, 2, OXYGEN, 2, CARBON, 1))).isEmpty();
    }

    @Test
    void combinationStepsAreExecutableInOrder() {
        List<RecipePair> steps = RecipeBook.combinationSteps(LIFE, Map.of(HYDROGEN, 1, OXYGEN, 1, CARBON, 1));

        assertThat(steps).containsExactly(RecipePair.of(HYDROGEN, OXYGEN), RecipePair.of(WATER, CARBON));
    }

    @Test
    void combinationStepsCoverOnlySatisfiableSubtrees() {
        List<RecipePair> steps = RecipeBook.combinationSteps(ROBOT, Map.of(HYDROGEN, 1, OXYGEN, 1));

        assertThat(steps).containsExactly(RecipePair.of(HYDROGEN, OXYGEN));
        assertThat(RecipeBook.combinationSteps(WATER, Map.of(WATER, 1))).isEmpty();
    }

    @Test
    void recipeTreeMembership() {
        assertThat(RecipeBook.isOnRecipeTree(CARBON, DIAMOND)).isTrue();
        assertThat(RecipeBook.isOnRecipeTree(SILICON, DOLPHIN)).isFalse();
        assertThat(RecipeBook.relevantBaseKinds(DIAMOND)).containsExactly(CARBON);
        assertThat(RecipeBook.relevantBaseKinds(AI_PARTNER)).containsExactlyInAnyOrder(HYDROGEN, OXYGEN, CARBON, SILICON);
        assertThat(RecipeBook.ingredients(HYDROGEN)).isEmpty();
    }
}
