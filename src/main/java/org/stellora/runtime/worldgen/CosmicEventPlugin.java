package org.stellora.runtime.worldgen;

import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stellora.runtime.GalaxyOrchestrator;
import org.stellora.runtime.messages.PlanetRequest.AsteroidArrival;
import org.stellora.runtime.messages.PlanetRequest.SunrayArrival;
import org.stellora.runtime.spi.IRandomProvider;
import org.stellora.runtime.spi.ITickPlugin;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * A tick plugin that sends sunrays and asteroids to planets.
 * <ul>
 *   <li><b>mode:</b> {@code PROBABILITY} or {@code SEQUENCE}.</li>
 *   <li><b>sunrayRate / asteroidRate:</b> in probability mode, the chance per planet and tick
 *   of receiving a sunray / an asteroid.</li>
 *   <li><b>sequence:</b> in sequence mode, one character per tick: {@code S} sunray to every
 *   planet, {@code A} asteroid to every planet, {@code -} quiet tick, {@code $} no further events.
 *   When the sequence runs out without {@code $}, probability mode takes over.</li>
 *   <li><b>sunrayCharge:</b> cells charged by one sunray.</li>
 *   <li><b>asteroidDamage:</b> charged cells destroyed by one unprotected asteroid hit.</li>
 * </ul>
 */
public class CosmicEventPlugin implements ITickPlugin {

    private static final Logger LOG = LoggerFactory.getLogger(CosmicEventPlugin.class);

    public enum Mode { PROBABILITY, SEQUENCE }

    private final IRandomProvider random;
    private final Mode mode;
    private final String sequence;
    private final int sunrayCharge;
    private final int asteroidDamage;
    private volatile double sunrayRate;
    private volatile double asteroidRate;
    private int cursor;
    private boolean ended;

    /**
     * @param randomProvider The source of randomness.
     * @param options        Plugin options, see class documentation.
     * @throws IllegalArgumentException if an option is invalid.
     */
    public CosmicEventPlugin(IRandomProvider randomProvider, Config options) {
        this.random = randomProvider.deriveFor("cosmicEvents", 0);
        Config defaults = ConfigFactory.parseMap(Map.of(
                "mode", "PROBABILITY",
                "sunrayRate", 0.0,
                "asteroidRate", 0.0,
                "sequence", "",
                "sunrayCharge", 1,
                "asteroidDamage", 1
        ));
        Config c = options.withFallback(defaults);
        try {
            this.mode = Mode.valueOf(c.getString("mode").trim().toUpperCase(Locale.ROOT));
            this.sequence = c.getString("sequence");
            this.sunrayCharge = c.getInt("sunrayCharge");
            this.asteroidDamage = c.getInt("asteroidDamage");
            setRates(c.getDouble("sunrayRate"), c.getDouble("asteroidRate"));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid cosmic event configuration", e);
        }
        if (sunrayCharge < 0 || asteroidDamage < 0) {
            throw new IllegalArgumentException("sunrayCharge and asteroidDamage must not be negative");
        }
        for (char ch : sequence.toCharArray()) {
            if ("SA-$".indexOf(ch) < 0) {
                throw new IllegalArgumentException("Invalid character '" + ch + "' in event sequence");
            }
        }
    }

    /**
     * Changes the probability-mode rates. Takes effect at the next tick.
     *
     * @param sunrayRate   Chance in {@code [0, 1]}.
     * @param asteroidRate Chance in {@code [0, 1]}.
     * @throws IllegalArgumentException if a rate is outside {@code [0, 1]}.
     */
    public void setRates(double sunrayRate, double asteroidRate) {
        if (sunrayRate < 0 || sunrayRate > 1 || asteroidRate < 0 || asteroidRate > 1) {
            throw new IllegalArgumentException(
                    String.format("Event rates must be within [0, 1], got sunray=%s asteroid=%s", sunrayRate, asteroidRate));
        }
        this.sunrayRate = sunrayRate;
        this.asteroidRate = asteroidRate;
    }

    @Override
    public void execute(GalaxyOrchestrator orchestrator) {
        if (ended) {
            return;
        }
        if (mode == Mode.SEQUENCE && cursor < sequence.length()) {
            char event = sequence.charAt(cursor++);
            switch (event) {
                case 'S' -> sendToAll(orchestrator, true);
                case 'A' -> sendToAll(orchestrator, false);
                case '$' -> {
                    ended = true;
                    LOG.debug("Event sequence ended at tick {}", orchestrator.getCurrentTick());
                }
                default -> {
                    // quiet tick
                }
            }
            return;
        }
        double sunray = sunrayRate;
        double asteroid = asteroidRate;
        for (int id : orchestrator.alivePlanetIds()) {
            if (sunray > 0 && random.nextDouble() < sunray) {
                orchestrator.sendEvent(id, new SunrayArrival(sunrayCharge));
            }
            if (asteroid > 0 && random.nextDouble() < asteroid) {
                orchestrator.sendEvent(id, new AsteroidArrival(asteroidDamage));
            }
        }
    }

    private void sendToAll(GalaxyOrchestrator orchestrator, boolean sunray) {
        for (int id : orchestrator.alivePlanetIds()) {
            orchestrator.sendEvent(id, sunray ? new SunrayArrival(sunrayCharge) : new AsteroidArrival(asteroidDamage));
        }
    }

    public Mode getMode() {
        return mode;
    }

    public double getSunrayRate() {
        return sunrayRate;
    }

    public double getAsteroidRate() {
        return asteroidRate;
    }

    public boolean hasEnded() {
        return ended;
    }
}
