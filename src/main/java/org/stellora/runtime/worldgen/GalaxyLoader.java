package org.stellora.runtime.worldgen;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stellora.runtime.explorer.StrategyKind;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.ResourceKind;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Builds a {@link GalaxyDefinition} from configuration or from a galaxy file.
 * <p>
 * Galaxy file format, one planet per line:
 * <pre>
 * # id,type,neighbor,neighbor,...
 * 0,C,1,2
 * 1,B,0
 * 2,A,0
 * </pre>
 * Blank lines and {@code #} comments are ignored; edges are undirected.
 */
public final class GalaxyLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GalaxyLoader.class);

    private GalaxyLoader() {
    }

    /**
     * Reads the {@code stellora.galaxy} block.
     * <p>
     * If {@code file} is set, planets come from that galaxy file and {@code planets} is ignored.
     *
     * @param galaxy The galaxy block.
     * @return The galaxy definition.
     * @throws IllegalArgumentException if the configuration or the file is invalid.
     * @throws UncheckedIOException     if the galaxy file cannot be read.
     */
    public static GalaxyDefinition fromConfig(Config galaxy) {
        try {
            List<PlanetDefinition> planets;
            if (galaxy.hasPath("file") && !galaxy.getString("file").isBlank()) {
                Path file = Path.of(galaxy.getString("file"));
                planets = parseFile(file);
                LOG.info("Loaded {} planets from {}", planets.size(), file);
            } else {
                planets = new ArrayList<>();
                for (Config planet : galaxy.getConfigList("planets")) {
                    planets.add(readPlanet(planet));
                }
            }
            List<ExplorerDefinition> explorers = new ArrayList<>();
            if (galaxy.hasPath("explorers")) {
                for (Config explorer : galaxy.getConfigList("explorers")) {
                    explorers.add(readExplorer(explorer));
                }
            }
            return new GalaxyDefinition(planets, explorers);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid galaxy configuration: " + e.getMessage(), e);
        }
    }

    private static PlanetDefinition readPlanet(Config c) {
        int id = c.getInt("id");
        PlanetType type = PlanetType.parse(c.getString("type"));
        List<Integer> neighbors = c.hasPath("neighbors") ? c.getIntList("neighbors") : List.of();
        Set<ResourceKind> supports = c.hasPath("supports")
                ? parseKinds(c.getStringList("supports"))
                : PlanetDefinition.defaultSupportedKinds(id, type);
        int charge = c.hasPath("charge") ? c.getInt("charge") : -1;
        Map<ResourceKind, Integer> inventory = c.hasPath("inventory") ? readInventory(c.getConfig("inventory")) : Map.of();
        return new PlanetDefinition(id, type, neighbors, supports, charge, inventory);
    }

    private static ExplorerDefinition readExplorer(Config c) {
        int id = c.getInt("id");
        int start = c.getInt("start");
        StrategyKind strategy = StrategyKind.parse(c.hasPath("strategy") ? c.getString("strategy") : "BEST_PATH");
        ResourceKind target = ResourceKind.parse(c.hasPath("target") ? c.getString("target") : "WATER");
        List<ResourceKind> fallbacks = new ArrayList<>();
        if (c.hasPath("fallbackTargets")) {
            for (String name : c.getStringList("fallbackTargets")) {
                fallbacks.add(ResourceKind.parse(name));
            }
        }
        int life = c.hasPath("life") ? c.getInt("life") : 0;
        Map<ResourceKind, Integer> inventory = c.hasPath("inventory") ? readInventory(c.getConfig("inventory")) : Map.of();
        return new ExplorerDefinition(id, start, strategy, target, fallbacks, life, inventory);
    }

    private static Set<ResourceKind> parseKinds(List<String> names) {
        Set<ResourceKind> kinds = EnumSet.noneOf(ResourceKind.class);
        for (String name : names) {
            kinds.add(ResourceKind.parse(name));
        }
        return kinds;
    }

    private static Map<ResourceKind, Integer> readInventory(Config inventory) {
        Map<ResourceKind, Integer> result = new EnumMap<>(ResourceKind.class);
        for (String key : inventory.root().keySet()) {
            result.put(ResourceKind.parse(key), inventory.getInt(key));
        }
        return result;
    }

    /**
     * Parses a galaxy file.
     *
     * @param file The file.
     * @return Planet definitions in file order.
     * @throws UncheckedIOException     if the file cannot be read.
     * @throws IllegalArgumentException if a line is malformed.
     */
    public static List<PlanetDefinition> parseFile(Path file) {
        try {
            return parseLines(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read galaxy file " + file, e);
        }
    }

    /**
     * Parses galaxy file lines. Supported kinds get their defaults, cells start fully charged.
     *
     * @param lines The lines.
     * @return Planet definitions in line order.
     * @throws IllegalArgumentException if a line is malformed; the message names the line number.
     */
    public static List<PlanetDefinition> parseLines(List<String> lines) {
        List<PlanetDefinition> planets = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] fields = line.split(",");
            if (fields.length < 2) {
                throw new IllegalArgumentException("Line " + (i + 1) + ": expected 'id,type[,neighbor...]' but got '" + line + "'");
            }
            try {
                int id = Integer.parseInt(fields[0].trim());
                PlanetType type = PlanetType.parse(fields[1]);
                List<Integer> neighbors = new ArrayList<>();
                for (int f = 2; f < fields.length; f++) {
                    if (!fields[f].isBlank()) {
                        neighbors.add(Integer.parseInt(fields[f].trim()));
                    }
                }
                planets.add(new PlanetDefinition(id, type, neighbors,
                        PlanetDefinition.defaultSupportedKinds(id, type), -1, Map.of()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return planets;
    }
}
