package org.stellora.cli;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stellora.cli.config.ConfigLoader;
import org.stellora.runtime.GalaxyOrchestrator;
import org.stellora.runtime.contracts.ExplorerSnapshot;
import org.stellora.runtime.contracts.GalaxySnapshot;
import org.stellora.runtime.contracts.GalaxySnapshotJson;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Runs one galaxy from configuration until {@code stellora.simulation.maxTicks} is reached
 * or every explorer is dead. The only accepted argument is the path of a configuration file.
 */
public final class GalaxyRunner {

    private static final Logger LOG = LoggerFactory.getLogger(GalaxyRunner.class);

    private GalaxyRunner() {
    }

    public static void main(final String[] args) {
        final File configFile = args.length > 0 ? new File(args[0]) : null;
        final Config config;
        try {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> LOG.info(message);
                    case WARN -> LOG.warn(message);
                }
            });
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
            System.exit(1);
            return;
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        try {
            run(config);
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            LOG.error("Simulation aborted: {}", e.getMessage());
            LOG.debug("Abort details:", e);
            System.exit(2);
        }
    }

    /**
     * Builds the galaxy described by {@code config}, runs it and shuts it down.
     *
     * @param config Resolved root configuration.
     * @return The final snapshot.
     */
    public static GalaxySnapshot run(final Config config) {
        final long maxTicks = config.getLong("stellora.simulation.maxTicks");
        final String snapshotFile = config.getString("stellora.simulation.snapshotFile");

        GalaxySnapshot snapshot;
        try (GalaxyOrchestrator orchestrator = GalaxyOrchestrator.fromConfig(config)) {
            orchestrator.start();
            snapshot = orchestrator.getLastSnapshot();
            while (snapshot.tick() < maxTicks && snapshot.aliveExplorerCount() > 0) {
                snapshot = orchestrator.tick();
            }
            snapshot = orchestrator.snapshot();
        }

        logSummary(snapshot);
        if (!snapshotFile.isBlank()) {
            writeSnapshot(Path.of(snapshotFile), snapshot);
        }
        return snapshot;
    }

    private static void logSummary(final GalaxySnapshot snapshot) {
        LOG.info("Simulation finished after {} ticks: {}/{} planets alive, {}/{} explorers alive, critical nodes {}",
                snapshot.tick(), snapshot.alivePlanetCount(), snapshot.planets().size(),
                snapshot.aliveExplorerCount(), snapshot.explorers().size(), snapshot.criticalNodes());
        for (ExplorerSnapshot explorer : snapshot.explorers()) {
            LOG.info("  explorer {} [{}] target={} completed={} alive={} inventory={}",
                    explorer.id(), explorer.strategy(), explorer.target(), explorer.completedTargets(),
                    explorer.alive(), explorer.inventory());
        }
    }

    private static void writeSnapshot(final Path file, final GalaxySnapshot snapshot) {
        try {
            final Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, GalaxySnapshotJson.toPrettyJson(snapshot), StandardCharsets.UTF_8);
            LOG.info("Final snapshot written to {}", file.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write snapshot to " + file, e);
        }
    }
}
