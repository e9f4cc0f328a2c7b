package org.pragmatica.unionize.rewrite;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration for the union rewriter.
 *
 * @param wrapperModules modules whose {@code Optional}/{@code Union} are rewritten
 * @param pruneImports   whether wrapper imports that are no longer needed get removed
 * @param maxPasses      upper bound on rewrite passes over one file or fragment
 */
public record RewriteConfig(Set<String> wrapperModules, boolean pruneImports, int maxPasses) {
    public static final int DEFAULT_MAX_PASSES = 64;

    /**
     * Default configuration: {@code typing} and {@code typing_extensions}, imports pruned.
     */
    public static final RewriteConfig DEFAULT = new RewriteConfig(Set.of("typing", "typing_extensions"),
                                                                  true,
                                                                  DEFAULT_MAX_PASSES);

    public RewriteConfig {
        wrapperModules = Set.copyOf(wrapperModules);
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be positive, got " + maxPasses);
        }
    }

    /**
     * Factory method for default config.
     */
    public static RewriteConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Builder-style method to add a module that re-exports the typing wrappers.
     */
    public RewriteConfig withWrapperModule(String module) {
        var modules = new LinkedHashSet<>(wrapperModules);
        modules.add(module);
        return new RewriteConfig(modules, pruneImports, maxPasses);
    }

    public RewriteConfig withPruneImports(boolean pruneImports) {
        return new RewriteConfig(wrapperModules, pruneImports, maxPasses);
    }

    public RewriteConfig withMaxPasses(int maxPasses) {
        return new RewriteConfig(wrapperModules, pruneImports, maxPasses);
    }

    public boolean isWrapperModule(String module) {
        return wrapperModules.contains(module);
    }
}
