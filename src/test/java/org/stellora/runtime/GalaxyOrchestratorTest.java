package org.stellora.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.stellora.runtime.model.ResourceKind.AI_PARTNER;
import static org.stellora.runtime.model.ResourceKind.CARBON;
import static org.stellora.runtime.model.ResourceKind.DIAMOND;
import static org.stellora.runtime.model.ResourceKind.DOLPHIN;
import static org.stellora.runtime.model.ResourceKind.HYDROGEN;
import static org.stellora.runtime.model.ResourceKind.OXYGEN;
import static org.stellora.runtime.model.ResourceKind.SILICON;
import static org.stellora.runtime.model.ResourceKind.WATER;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.stellora.junit.extensions.logging.AllowLog;
import org.stellora.junit.extensions.logging.ExpectLog;
import org.stellora.junit.extensions.logging.LogLevel;
import org.stellora.junit.extensions.logging.LogWatchExtension;
import org.stellora.runtime.contracts.ActorStatus;
import org.stellora.runtime.contracts.ExplorerSnapshot;
import org.stellora.runtime.contracts.GalaxySnapshot;
import org.stellora.runtime.contracts.PlanetSnapshot;
import org.stellora.runtime.explorer.StrategyKind;
import org.stellora.runtime.messages.ExplorerReply;
import org.stellora.runtime.messages.PlanetRequest.AsteroidArrival;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;
import org.stellora.runtime.spi.IRandomProvider;
import org.stellora.runtime.spi.ITickPlugin;
import org.stellora.runtime.spi.SeededRandomProvider;
import org.stellora.runtime.worldgen.CosmicEventPlugin;
import org.stellora.runtime.worldgen.ExplorerDefinition;
import org.stellora.runtime.worldgen.GalaxyDefinition;
import org.stellora.runtime.worldgen.PlanetDefinition;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class GalaxyOrchestratorTest {

    private static final String QUIET = """
            stellora.tickPlugins = []
            stellora.simulation.sequentialExplorers = true
            stellora.explorer.tieBreak = LOWEST_ID
            """;

    private GalaxyOrchestrator orchestrator;

    /** Drops an asteroid on one planet at one tick. */
    public static class AsteroidStrikePlugin implements ITickPlugin {

        private final int planet;
        private final long tick;

        public AsteroidStrikePlugin(IRandomProvider randomProvider, Config options) {
            this.planet = options.getInt("planet");
            this.tick = options.getLong("tick");
        }

        @Override
        public void execute(GalaxyOrchestrator orchestrator) {
            if (orchestrator.getCurrentTick() == tick) {
                orchestrator.sendEvent(planet, new AsteroidArrival(1));
            }
        }
    }

    /** Holds the ticking thread before every tick. */
    public static class SlowTickPlugin implements ITickPlugin {

        private final long delayMs;

        public SlowTickPlugin(IRandomProvider randomProvider, Config options) {
            this.delayMs = options.getLong("delayMs");
        }

        @Override
        public void execute(GalaxyOrchestrator orchestrator) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    private static Config stellora(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve()
                .getConfig("stellora");
    }

    private static PlanetDefinition planet(int id, PlanetType type, Set<ResourceKind> supports, int charge,
                                           Integer... neighbors) {
        return new PlanetDefinition(id, type, List.of(neighbors), supports, charge, Map.of());
    }

    private GalaxyOrchestrator start(GalaxyDefinition galaxy, String overrides) {
        orchestrator = new GalaxyOrchestrator(galaxy, stellora(overrides), new SeededRandomProvider(42));
        orchestrator.start();
        return orchestrator;
    }

    private static GalaxyDefinition waterGalaxy(StrategyKind strategy) {
        return new GalaxyDefinition(
                List.of(planet(0, PlanetType.C, Set.of(CARBON), -1, 1),
                        planet(1, PlanetType.B, Set.of(HYDROGEN, OXYGEN), -1)),
                List.of(new ExplorerDefinition(0, 0, strategy, WATER, List.of(), 0, Map.of())));
    }

    @Test
    void explorerReachesSourceAndProducesTarget() {
        start(waterGalaxy(StrategyKind.BEST_PATH), QUIET);

        GalaxySnapshot first = orchestrator.tick();
        assertThat(first.tick()).isEqualTo(1);
        assertThat(first.explorer(0).orElseThrow().position()).isEqualTo(1);

        GalaxySnapshot second = orchestrator.tick();
        ExplorerSnapshot explorer = second.explorer(0).orElseThrow();
        assertThat(explorer.completedTargets()).isEqualTo(1);
        assertThat(explorer.inventory()).containsEntry(WATER, 1);
        assertThat(explorer.life()).isEqualTo(99);
        assertThat(second.planet(1).orElseThrow().combinations()).isEqualTo(1);
        assertThat(orchestrator.getCurrentTick()).isEqualTo(2);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*GalaxyOrchestrator",
            messagePattern = "Critical planet 2 destroyed at tick 0: galaxy split from 1 into 2 components")
    void destroyedCriticalPlanetSplitsGalaxyAndExplorerAdapts() {
        GalaxyDefinition galaxy = new GalaxyDefinition(
                List.of(planet(0, PlanetType.B, Set.of(HYDROGEN, OXYGEN, CARBON), -1, 1),
                        planet(1, PlanetType.D, Set.of(HYDROGEN, OXYGEN, CARBON), -1, 2),
                        planet(2, PlanetType.D, Set.of(), 1, 3),
                        planet(3, PlanetType.D, Set.of(SILICON), -1)),
                List.of(new ExplorerDefinition(0, 0, StrategyKind.BEST_PATH_ADAPTIVE, AI_PARTNER,
                        List.of(DOLPHIN), 0, Map.of())));
        start(galaxy, QUIET + """
                stellora.tickPlugins = [{
                  className = "org.stellora.runtime.GalaxyOrchestratorTest$AsteroidStrikePlugin"
                  options { planet = 2, tick = 0 }
                }]
                """);
        assertThat(orchestrator.getLastSnapshot().criticalNodes()).containsExactly(1, 2);

        GalaxySnapshot snapshot = orchestrator.tick();

        assertThat(snapshot.planet(2).orElseThrow().alive()).isFalse();
        assertThat(snapshot.planet(2).orElseThrow().status()).isEqualTo(ActorStatus.DEAD);
        assertThat(snapshot.criticalNodes()).isEmpty();
        assertThat(orchestrator.alivePlanetIds().toIntArray()).containsExactly(0, 1, 3);
        assertThat(orchestrator.getTopology().components()).hasSize(2);
        assertThat(snapshot.explorer(0).orElseThrow().target()).isEqualTo(DOLPHIN);
        assertThat(snapshot.alivePlanetCount()).isEqualTo(3);
    }

    @Test
    void liveSnapshotReportsEveryActor() {
        start(waterGalaxy(StrategyKind.GREEDY), QUIET);

        GalaxySnapshot snapshot = orchestrator.snapshot();

        assertThat(snapshot.tick()).isZero();
        assertThat(snapshot.planets()).extracting(PlanetSnapshot::status).containsOnly(ActorStatus.ACTIVE);
        assertThat(snapshot.explorers()).extracting(ExplorerSnapshot::status).containsExactly(ActorStatus.ACTIVE);
        assertThat(snapshot.planet(0).orElseThrow().energy()).isEqualTo(1);
    }

    @Test
    void configureChangesStrategyAndTarget() {
        start(waterGalaxy(StrategyKind.BEST_PATH), QUIET);

        ExplorerReply reply = orchestrator.configure(0, StrategyKind.GREEDY, DIAMOND);

        assertThat(reply.accepted()).isTrue();
        assertThat(reply.state().strategy()).isEqualTo(StrategyKind.GREEDY);
        assertThat(reply.state().target()).isEqualTo(DIAMOND);
        assertThat(orchestrator.snapshot().explorer(0).orElseThrow().target()).isEqualTo(DIAMOND);
    }

    @Test
    void configureRejectsUnknownExplorerAndBaseTarget() {
        start(waterGalaxy(StrategyKind.BEST_PATH), QUIET);

        assertThatThrownBy(() -> orchestrator.configure(7, StrategyKind.GREEDY, DIAMOND))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown explorer 7");
        assertThatThrownBy(() -> orchestrator.configure(0, StrategyKind.GREEDY, CARBON))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deadExplorerRejectsReconfiguration() {
        GalaxyDefinition galaxy = new GalaxyDefinition(
                List.of(planet(0, PlanetType.C, Set.of(CARBON), 0)),
                List.of(new ExplorerDefinition(0, 0, StrategyKind.GREEDY, WATER, List.of(), 0, Map.of())));
        start(galaxy, QUIET);

        orchestrator.tick();
        ExplorerReply reply = orchestrator.configure(0, StrategyKind.BEST_PATH, DIAMOND);

        assertThat(orchestrator.getLastSnapshot().aliveExplorerCount()).isZero();
        assertThat(reply.accepted()).isFalse();
        assertThat(reply.reason()).isEqualTo(RejectionReason.EXPLORER_DEAD);
    }

    @Test
    void configureEventsUpdatesCosmicEventPlugin() {
        start(waterGalaxy(StrategyKind.BEST_PATH), """
                stellora.events.sunrayRate = 0.0
                stellora.events.asteroidRate = 0.0
                """);

        assertThat(orchestrator.configureEvents(0.5, 0.25)).isEqualTo(1);

        CosmicEventPlugin plugin = (CosmicEventPlugin) orchestrator.getTickPlugins().get(0);
        assertThat(plugin.getSunrayRate()).isEqualTo(0.5);
        assertThat(plugin.getAsteroidRate()).isEqualTo(0.25);
        assertThatThrownBy(() -> orchestrator.configureEvents(1.5, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No cosmic event plugin configured; event rates unchanged")
    void configureEventsWithoutPluginWarns() {
        start(waterGalaxy(StrategyKind.BEST_PATH), QUIET);

        assertThat(orchestrator.configureEvents(0.1, 0.1)).isZero();
    }

    @Test
    void snapshotDoesNotWaitForLongRun() throws Exception {
        start(waterGalaxy(StrategyKind.BEST_PATH), QUIET + """
                stellora.tickPlugins = [{
                  className = "org.stellora.runtime.GalaxyOrchestratorTest$SlowTickPlugin"
                  options { delayMs = 200 }
                }]
                """);
        CompletableFuture<GalaxySnapshot> run = CompletableFuture.supplyAsync(() -> orchestrator.run(10));
        await().atMost(Duration.ofSeconds(5)).until(() -> orchestrator.getCurrentTick() >= 1);

        long started = System.nanoTime();
        GalaxySnapshot snapshot = orchestrator.snapshot();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMs).isLessThan(1000);
        assertThat(run).isNotDone();
        assertThat(snapshot.tick()).isBetween(1L, 9L);
        assertThat(snapshot.explorer(0).orElseThrow().status()).isEqualTo(ActorStatus.ACTIVE);
        assertThat(run.get(10, TimeUnit.SECONDS).tick()).isEqualTo(10);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*GalaxyOrchestrator",
            messagePattern = "Explorer 0 did not answer within 100ms at tick 0")
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*GalaxyOrchestrator",
            messagePattern = "Explorer 0 unreachable: .*")
    void silentActorsAreReportedUnknown() {
        start(waterGalaxy(StrategyKind.BEST_PATH), QUIET + "stellora.channels.snapshotTimeoutMs = 100");
        orchestrator.explorerActor(0).stop();
        orchestrator.planetActor(1).stop();

        GalaxySnapshot snapshot = orchestrator.snapshot();

        ExplorerSnapshot explorer = snapshot.explorer(0).orElseThrow();
        assertThat(explorer.status()).isEqualTo(ActorStatus.UNKNOWN);
        assertThat(explorer.alive()).isTrue();
        assertThat(explorer.strategy()).isEqualTo(StrategyKind.BEST_PATH);
        assertThat(explorer.target()).isEqualTo(WATER);
        PlanetSnapshot silent = snapshot.planet(1).orElseThrow();
        assertThat(silent.status()).isEqualTo(ActorStatus.UNKNOWN);
        assertThat(silent.type()).isEqualTo(PlanetType.B);
        assertThat(snapshot.planet(0).orElseThrow().status()).isEqualTo(ActorStatus.ACTIVE);
    }

    @Test
    void lifecycleIsEnforced() {
        orchestrator = new GalaxyOrchestrator(waterGalaxy(StrategyKind.BEST_PATH), stellora(QUIET),
                new SeededRandomProvider(1));

        assertThatThrownBy(orchestrator::tick).isInstanceOf(IllegalStateException.class);
        assertThat(orchestrator.snapshot().tick()).isZero();

        orchestrator.start();
        assertThatThrownBy(orchestrator::start).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> orchestrator.run(-1)).isInstanceOf(IllegalArgumentException.class);
        GalaxySnapshot last = orchestrator.run(2);

        orchestrator.shutdown();
        orchestrator.shutdown();

        assertThat(orchestrator.isRunning()).isFalse();
        assertThatThrownBy(orchestrator::tick).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> orchestrator.configure(0, StrategyKind.GREEDY, DIAMOND))
                .isInstanceOf(IllegalStateException.class);
        assertThat(orchestrator.snapshot()).isEqualTo(last);
    }

    @Test
    void unknownPluginClassIsRejected() {
        Config config = stellora(QUIET + "stellora.tickPlugins = [{ className = \"org.stellora.NoSuchPlugin\" }]");

        assertThatThrownBy(() -> new GalaxyOrchestrator(waterGalaxy(StrategyKind.GREEDY), config,
                new SeededRandomProvider(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Failed to instantiate plugin: org.stellora.NoSuchPlugin");
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Critical planet .*")
    void sequentialRunsAreReplayableFromSeed() {
        Config root = ConfigFactory.parseString("stellora.simulation.sequentialExplorers = true")
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();

        GalaxySnapshot first;
        try (GalaxyOrchestrator a = GalaxyOrchestrator.fromConfig(root)) {
            a.start();
            first = a.run(10);
        }
        GalaxySnapshot second;
        try (GalaxyOrchestrator b = GalaxyOrchestrator.fromConfig(root)) {
            b.start();
            second = b.run(10);
        }

        assertThat(second).isEqualTo(first);
        assertThat(first.tick()).isEqualTo(10);
        assertThat(first.planets()).hasSize(7);
        assertThat(first.explorers()).hasSize(4);
    }
}
