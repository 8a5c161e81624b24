package org.stellora.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.stellora.junit.extensions.logging.LogWatchExtension;
import org.stellora.runtime.GalaxyOrchestrator;
import org.stellora.runtime.messages.PlanetRequest;
import org.stellora.runtime.messages.PlanetRequest.AsteroidArrival;
import org.stellora.runtime.messages.PlanetRequest.SunrayArrival;
import org.stellora.runtime.spi.SeededRandomProvider;

import com.typesafe.config.ConfigFactory;

import it.unimi.dsi.fastutil.ints.IntArrayList;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class CosmicEventPluginTest {

    @Mock
    private GalaxyOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        lenient().when(orchestrator.alivePlanetIds()).thenReturn(IntArrayList.of(0, 1));
    }

    private static CosmicEventPlugin plugin(Map<String, Object> options) {
        return new CosmicEventPlugin(new SeededRandomProvider(3), ConfigFactory.parseMap(options));
    }

    @Test
    void sequenceModeReplaysEventsThenStops() {
        CosmicEventPlugin plugin = plugin(Map.of("mode", "sequence", "sequence", "SA-$", "sunrayRate", 1.0));

        plugin.execute(orchestrator);
        verify(orchestrator).sendEvent(0, new SunrayArrival(1));
        verify(orchestrator).sendEvent(1, new SunrayArrival(1));

        plugin.execute(orchestrator);
        verify(orchestrator).sendEvent(0, new AsteroidArrival(1));
        verify(orchestrator).sendEvent(1, new AsteroidArrival(1));

        plugin.execute(orchestrator);
        plugin.execute(orchestrator);
        assertThat(plugin.hasEnded()).isTrue();
        plugin.execute(orchestrator);

        verify(orchestrator, times(4)).sendEvent(anyInt(), any(PlanetRequest.class));
    }

    @Test
    void exhaustedSequenceFallsBackToRates() {
        CosmicEventPlugin plugin = plugin(Map.of("mode", "SEQUENCE", "sequence", "-",
                "sunrayRate", 1.0, "sunrayCharge", 2));

        plugin.execute(orchestrator);
        verify(orchestrator, never()).sendEvent(anyInt(), any(PlanetRequest.class));

        plugin.execute(orchestrator);
        verify(orchestrator).sendEvent(0, new SunrayArrival(2));
        verify(orchestrator).sendEvent(1, new SunrayArrival(2));
        assertThat(plugin.hasEnded()).isFalse();
    }

    @Test
    void certainRatesHitEveryPlanet() {
        CosmicEventPlugin plugin = plugin(Map.of("sunrayRate", 1.0, "asteroidRate", 1.0, "asteroidDamage", 3));

        plugin.execute(orchestrator);

        verify(orchestrator).sendEvent(0, new SunrayArrival(1));
        verify(orchestrator).sendEvent(0, new AsteroidArrival(3));
        verify(orchestrator).sendEvent(1, new SunrayArrival(1));
        verify(orchestrator).sendEvent(1, new AsteroidArrival(3));
    }

    @Test
    void zeroRatesSendNothingUntilReconfigured() {
        CosmicEventPlugin plugin = plugin(Map.of());

        plugin.execute(orchestrator);
        verify(orchestrator, never()).sendEvent(anyInt(), any(PlanetRequest.class));

        plugin.setRates(0.0, 1.0);
        plugin.execute(orchestrator);
        verify(orchestrator, times(2)).sendEvent(anyInt(), any(AsteroidArrival.class));
        assertThat(plugin.getMode()).isEqualTo(CosmicEventPlugin.Mode.PROBABILITY);
    }

    @Test
    void rejectsInvalidOptions() {
        assertThatThrownBy(() -> plugin(Map.of("mode", "SEQUENCE", "sequence", "SX")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'X'");
        assertThatThrownBy(() -> plugin(Map.of("sunrayRate", 1.5)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> plugin(Map.of("mode", "RANDOM")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> plugin(Map.of("asteroidDamage", -1)))
                .isInstanceOf(IllegalArgumentException.class);

        CosmicEventPlugin plugin = plugin(Map.of());
        assertThatThrownBy(() -> plugin.setRates(-0.1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
