package org.stellora.runtime.explorer;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * The closed set of explorer strategies, selected by configuration.
 */
public enum StrategyKind {
    GREEDY(GreedyStrategy::new),
    GREEDY_WITH_PURPOSE(PurposeGreedyStrategy::new),
    BEST_PATH(BestPathStrategy::new),
    BEST_PATH_ADAPTIVE(AdaptiveBestPathStrategy::new);

    private final Supplier<IExplorerStrategy> factory;

    StrategyKind(Supplier<IExplorerStrategy> factory) {
        this.factory = factory;
    }

    /**
     * @return A fresh strategy instance. Strategies are stateless; per-explorer state lives in
     *         {@link ExplorerMemory}.
     */
    public IExplorerStrategy create() {
        return factory.get();
    }

    /**
     * Parses a strategy name. Case, underscores, dashes and spaces are ignored, so
     * {@code "BestPathAdaptive"} and {@code "best-path-adaptive"} both resolve.
     *
     * @param name The name to parse.
     * @return The strategy kind.
     * @throws IllegalArgumentException if no strategy matches.
     */
    public static StrategyKind parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Strategy name must not be null");
        }
        String normalized = normalize(name);
        for (StrategyKind kind : values()) {
            if (normalize(kind.name()).equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: '" + name + "'");
    }

    private static String normalize(String s) {
        return s.replaceAll("[_\\-\\s]", "").toUpperCase(Locale.ROOT);
    }
}
