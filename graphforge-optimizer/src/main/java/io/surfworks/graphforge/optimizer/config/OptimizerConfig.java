package io.surfworks.graphforge.optimizer.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

import io.surfworks.graphforge.graph.Domains;
import io.surfworks.graphforge.optimizer.TransformerLevel;

/**
 * Configuration for an optimization run.
 *
 * <p>Loaded from {@code ~/.config/graphforge/optimizer.json} by {@link OptimizerConfigLoader};
 * callers override single values with the {@code with*} methods.
 *
 * @param optimizationLevel   highest level to run, {@code LEVEL1} upward
 * @param maxSteps            maximum number of sweeps per level
 * @param compatibleProviders execution providers whose nodes may be fused (empty = any)
 * @param disabledTransformers transformer names left out of the run
 * @param disabledRules       rewrite rule names left out of the run
 */
public record OptimizerConfig(
        TransformerLevel optimizationLevel,
        int maxSteps,
        Set<String> compatibleProviders,
        Set<String> disabledTransformers,
        Set<String> disabledRules
) {

    /** Default highest level */
    public static final TransformerLevel DEFAULT_LEVEL = TransformerLevel.LEVEL2;

    /** Default sweep limit per level */
    public static final int DEFAULT_MAX_STEPS = 5;

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "graphforge"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "optimizer.json";

    public OptimizerConfig {
        Objects.requireNonNull(optimizationLevel, "optimizationLevel cannot be null");
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }
        compatibleProviders = Set.copyOf(compatibleProviders);
        disabledTransformers = Set.copyOf(disabledTransformers);
        disabledRules = Set.copyOf(disabledRules);
    }

    /**
     * Returns the default configuration: up to LEVEL2, 5 steps, CPU provider only.
     */
    public static OptimizerConfig defaults() {
        return new OptimizerConfig(
                DEFAULT_LEVEL,
                DEFAULT_MAX_STEPS,
                Set.of(Domains.CPU_EXECUTION_PROVIDER),
                Set.of(),
                Set.of()
        );
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public OptimizerConfig withOptimizationLevel(TransformerLevel level) {
        return new OptimizerConfig(level, maxSteps, compatibleProviders, disabledTransformers, disabledRules);
    }

    public OptimizerConfig withMaxSteps(int steps) {
        return new OptimizerConfig(optimizationLevel, steps, compatibleProviders, disabledTransformers, disabledRules);
    }

    public OptimizerConfig withCompatibleProviders(Set<String> providers) {
        return new OptimizerConfig(optimizationLevel, maxSteps, providers, disabledTransformers, disabledRules);
    }

    public OptimizerConfig withDisabledTransformers(Set<String> transformers) {
        return new OptimizerConfig(optimizationLevel, maxSteps, compatibleProviders, transformers, disabledRules);
    }

    public OptimizerConfig withDisabledRules(Set<String> rules) {
        return new OptimizerConfig(optimizationLevel, maxSteps, compatibleProviders, disabledTransformers, rules);
    }
}
