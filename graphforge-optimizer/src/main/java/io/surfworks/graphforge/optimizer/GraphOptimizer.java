package io.surfworks.graphforge.optimizer;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.optimizer.config.OptimizerConfig;
import io.surfworks.graphforge.optimizer.fusion.EmbedLayerNormFusion;
import io.surfworks.graphforge.optimizer.rewrite.RewriteRule;
import io.surfworks.graphforge.optimizer.rewrite.RuleBasedGraphTransformer;
import io.surfworks.graphforge.optimizer.rewrite.UnsqueezeElimination;

/**
 * Entry point for optimizing a graph with a configured set of transformers.
 *
 * <p>Example usage:
 * <pre>{@code
 * GraphOptimizer optimizer = GraphOptimizer.standard(OptimizerConfigLoader.load());
 * OptimizationReport report = optimizer.optimize(graph);
 * }</pre>
 *
 * <p>{@link #optimize} runs the {@code DEFAULT} level first, then {@code LEVEL1} up to the
 * configured level, each to a fixed point.
 */
public final class GraphOptimizer {

    private static final Logger LOG = Logger.getLogger(GraphOptimizer.class.getName());

    public static final String LEVEL1_RULE_BASED_TRANSFORMER = "Level1_RuleBasedTransformer";

    private final OptimizerConfig config;
    private final GraphTransformerManager manager;
    private final Logger logger;

    public GraphOptimizer(OptimizerConfig config) {
        this(config, LOG);
    }

    public GraphOptimizer(OptimizerConfig config, Logger logger) {
        this.config = config;
        this.manager = new GraphTransformerManager(config.maxSteps());
        this.logger = logger;
    }

    /**
     * Creates an optimizer with the built-in transformers, minus the disabled ones:
     * <ul>
     *   <li>LEVEL1: {@value #LEVEL1_RULE_BASED_TRANSFORMER} with {@link UnsqueezeElimination}</li>
     *   <li>LEVEL2: {@link EmbedLayerNormFusion} on the configured providers</li>
     * </ul>
     */
    public static GraphOptimizer standard(OptimizerConfig config) {
        GraphOptimizer optimizer = new GraphOptimizer(config);

        List<RewriteRule> level1Rules = new ArrayList<>();
        level1Rules.add(new UnsqueezeElimination());
        optimizer.registerRules(LEVEL1_RULE_BASED_TRANSFORMER, level1Rules, TransformerLevel.LEVEL1);

        optimizer.register(new EmbedLayerNormFusion(config.compatibleProviders()), TransformerLevel.LEVEL2);
        return optimizer;
    }

    /**
     * Registers a transformer unless its name is disabled in the configuration.
     *
     * @return true if the transformer was registered
     */
    public boolean register(GraphTransformer transformer, TransformerLevel level) {
        if (config.disabledTransformers().contains(transformer.name())) {
            logger.fine(() -> "Transformer " + transformer.name() + " is disabled");
            return false;
        }
        manager.register(transformer, level);
        return true;
    }

    /**
     * Groups the enabled rules into a rule-based transformer and registers it.
     * Nothing is registered if every rule is disabled.
     */
    public boolean registerRules(String transformerName, List<RewriteRule> rules, TransformerLevel level) {
        RuleBasedGraphTransformer transformer = new RuleBasedGraphTransformer(transformerName);
        for (RewriteRule rule : rules) {
            if (config.disabledRules().contains(rule.name())) {
                logger.fine(() -> "Rule " + rule.name() + " is disabled");
                continue;
            }
            transformer.register(rule);
        }
        if (transformer.ruleCount() == 0) {
            return false;
        }
        return register(transformer, level);
    }

    public GraphTransformerManager manager() {
        return manager;
    }

    public OptimizerConfig config() {
        return config;
    }

    /**
     * Optimizes {@code graph} in place.
     *
     * @throws OptimizationException if a transformer fails; the graph may be partially rewritten
     */
    public OptimizationReport optimize(Graph graph) throws OptimizationException {
        List<OptimizationReport> reports = new ArrayList<>();
        for (TransformerLevel level : TransformerLevel.values()) {
            if (level.compareTo(config.optimizationLevel()) > 0) {
                break;
            }
            reports.add(manager.applyTransformers(graph, level, logger));
        }
        OptimizationReport report = OptimizationReport.combine(graph.name(), reports);
        logger.fine(() -> "Optimization of " + graph.name() + " finished: " + report);
        return report;
    }
}
