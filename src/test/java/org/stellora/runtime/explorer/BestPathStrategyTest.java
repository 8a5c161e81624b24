package org.stellora.runtime.explorer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.stellora.runtime.model.ResourceKind.CARBON;
import static org.stellora.runtime.model.ResourceKind.HYDROGEN;
import static org.stellora.runtime.model.ResourceKind.LIFE;
import static org.stellora.runtime.model.ResourceKind.OXYGEN;
import static org.stellora.runtime.model.ResourceKind.WATER;

import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stellora.junit.extensions.logging.LogWatchExtension;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.RejectionReason;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class BestPathStrategyTest {

    private final ExplorerSettings settings = GalaxyFixture.lowestIdSettings();

    @Test
    void producesWaterThenLifeOnCombinerPlanet() {
        GalaxyFixture galaxy = new GalaxyFixture().planet(0, PlanetType.C, Set.of(CARBON));
        Explorer explorer = GalaxyFixture.explorer(0, StrategyKind.BEST_PATH, LIFE,
                Map.of(HYDROGEN, 1, OXYGEN, 1, CARBON, 1));

        galaxy.tick(explorer, settings);

        assertThat(explorer.getInventory().toMap()).containsExactlyEntriesOf(Map.of(LIFE, 1));
        assertThat(explorer.getCompletedTargets()).isEqualTo(1);
        assertThat(galaxy.planet(0).getCombinations()).isEqualTo(2);
        assertThat(explorer.getLife()).isEqualTo(100);
    }

    @Test
    void travelsToSourceThenCollectsAndCombines() {
        GalaxyFixture galaxy = new GalaxyFixture()
                .planet(0, PlanetType.C, Set.of(CARBON))
                .planet(1, PlanetType.B, Set.of(HYDROGEN, OXYGEN))
                .connect(0, 1);
        Explorer explorer = GalaxyFixture.explorer(0, StrategyKind.BEST_PATH, WATER, Map.of());

        galaxy.tick(explorer, settings);
        assertThat(explorer.getPosition()).isEqualTo(1);
        assertThat(explorer.getLife()).isEqualTo(99);
        assertThat(explorer.getMemory().getDestination()).isEqualTo(1);

        galaxy.tick(explorer, settings);
        assertThat(explorer.getInventory().toMap()).containsExactlyEntriesOf(Map.of(WATER, 1));
        assertThat(explorer.getCompletedTargets()).isEqualTo(1);
        assertThat(galaxy.planet(1).getCombinations()).isEqualTo(1);
    }

    @Test
    void jumpsByRocketWhenSourceIsInAnotherComponent() {
        GalaxyFixture galaxy = new GalaxyFixture()
                .planet(0, PlanetType.C, Set.of(CARBON))
                .planet(1, PlanetType.B, Set.of(HYDROGEN, OXYGEN));
        Explorer explorer = GalaxyFixture.explorer(0, StrategyKind.BEST_PATH, WATER, Map.of());

        galaxy.tick(explorer, settings);

        assertThat(explorer.getPosition()).isEqualTo(1);
        assertThat(explorer.getLife()).isEqualTo(99);
        assertThat(galaxy.planet(0).getCharged()).isZero();
        assertThat(galaxy.planet(0).getRockets()).isZero();
    }

    @Test
    void reportsDisconnectedWhenNoSourceExists() {
        GalaxyFixture galaxy = new GalaxyFixture().planet(0, PlanetType.B, Set.of(CARBON));
        Explorer explorer = GalaxyFixture.explorer(0, StrategyKind.BEST_PATH, WATER, Map.of());

        galaxy.tick(explorer, settings);

        assertThat(explorer.getPosition()).isZero();
        assertThat(explorer.getMemory().getLastRejection()).isEqualTo(RejectionReason.DISCONNECTED);
        assertThat(explorer.isAlive()).isTrue();
    }

    @Test
    void prefersUnlimitedCombinerForLongChains() {
        // 1 is a single-use combiner next door, 2 an unlimited one two hops away
        GalaxyFixture galaxy = new GalaxyFixture()
                .planet(0, PlanetType.D, Set.of())
                .planet(1, PlanetType.B, Set.of())
                .planet(2, PlanetType.D, Set.of())
                .planet(3, PlanetType.C, Set.of(CARBON))
                .connect(0, 1).connect(0, 2).connect(2, 3);
        Explorer explorer = GalaxyFixture.explorer(0, StrategyKind.BEST_PATH, LIFE,
                Map.of(HYDROGEN, 1, OXYGEN, 1, CARBON, 1));

        galaxy.tick(explorer, settings);

        assertThat(explorer.getPosition()).isEqualTo(2);
        assertThat(explorer.getMemory().getDestination()).isEqualTo(3);
    }
}
