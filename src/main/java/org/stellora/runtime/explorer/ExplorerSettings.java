package org.stellora.runtime.explorer;

import java.util.Locale;
import java.util.Map;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Tunables shared by all explorers.
 *
 * @param life                       Initial life budget.
 * @param maxHarvestPerTick          Upper bound on units harvested or generated in one tick.
 * @param capabilityFailureThreshold Consecutive CAPABILITY_EXCEEDED rejections that make an
 *                                   adaptive explorer give up its target.
 * @param tieBreak                   Neighbor tie-break policy.
 * @param replyTimeoutMs             How long an explorer waits for a planet reply.
 */
public record ExplorerSettings(int life, int maxHarvestPerTick, int capabilityFailureThreshold,
                               TieBreak tieBreak, long replyTimeoutMs) {

    public ExplorerSettings {
        if (life <= 0) {
            throw new IllegalArgumentException("Explorer life must be positive, got " + life);
        }
        if (maxHarvestPerTick <= 0) {
            throw new IllegalArgumentException("maxHarvestPerTick must be positive, got " + maxHarvestPerTick);
        }
        if (capabilityFailureThreshold <= 0) {
            throw new IllegalArgumentException(
                    "capabilityFailureThreshold must be positive, got " + capabilityFailureThreshold);
        }
        if (replyTimeoutMs <= 0) {
            throw new IllegalArgumentException("replyTimeoutMs must be positive, got " + replyTimeoutMs);
        }
    }

    /**
     * Reads settings from an {@code explorer} config block.
     *
     * @param explorer       The {@code stellora.explorer} block.
     * @param replyTimeoutMs The channel reply timeout.
     * @return The settings.
     * @throws IllegalArgumentException if a value is missing or invalid.
     */
    public static ExplorerSettings fromConfig(Config explorer, long replyTimeoutMs) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "life", 100,
                "maxHarvestPerTick", 4,
                "capabilityFailureThreshold", 3,
                "tieBreak", "RANDOM"
        ));
        Config c = explorer.withFallback(defaults);
        try {
            TieBreak tieBreak = TieBreak.valueOf(c.getString("tieBreak").trim().toUpperCase(Locale.ROOT));
            return new ExplorerSettings(c.getInt("life"), c.getInt("maxHarvestPerTick"),
                    c.getInt("capabilityFailureThreshold"), tieBreak, replyTimeoutMs);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid explorer configuration", e);
        }
    }

    public static ExplorerSettings defaults() {
        return new ExplorerSettings(100, 4, 3, TieBreak.RANDOM, 2000);
    }
}
