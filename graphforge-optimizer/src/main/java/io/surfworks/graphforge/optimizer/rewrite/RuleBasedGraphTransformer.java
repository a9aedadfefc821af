package io.surfworks.graphforge.optimizer.rewrite;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.GraphUtils;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.optimizer.GraphTransformer;
import io.surfworks.graphforge.optimizer.OptimizationException;

/**
 * Drives a set of {@link RewriteRule}s over a graph.
 *
 * <p>Nodes are visited in topological order. Nested graphs of a node are rewritten
 * first, then the node's rules run in registration order until one removes the node.
 * Nodes assigned to an incompatible execution provider are skipped.
 *
 * <p>Example usage:
 * <pre>{@code
 * RuleBasedGraphTransformer level1 = new RuleBasedGraphTransformer("Level1_RuleBasedTransformer")
 *     .register(new UnsqueezeElimination());
 * boolean modified = level1.apply(graph, logger);
 * }</pre>
 */
public final class RuleBasedGraphTransformer implements GraphTransformer {

    private final String name;
    private final Set<String> compatibleProviders;
    private final Map<String, List<RewriteRule>> rulesByOpType = new LinkedHashMap<>();
    private final List<RewriteRule> anyOpRules = new ArrayList<>();
    private final Set<String> ruleNames = new HashSet<>();

    public RuleBasedGraphTransformer(String name) {
        this(name, Set.of());
    }

    public RuleBasedGraphTransformer(String name, Set<String> compatibleProviders) {
        this.name = name;
        this.compatibleProviders = Set.copyOf(compatibleProviders);
    }

    /**
     * Registers a rule.
     *
     * @return this transformer for chaining
     * @throws IllegalArgumentException if a rule with the same name is already registered
     */
    public RuleBasedGraphTransformer register(RewriteRule rule) {
        if (!ruleNames.add(rule.name())) {
            throw new IllegalArgumentException("Rule " + rule.name() + " is already registered in " + name);
        }
        if (rule.targetOpTypes().isEmpty()) {
            anyOpRules.add(rule);
        } else {
            for (String opType : rule.targetOpTypes()) {
                rulesByOpType.computeIfAbsent(opType, k -> new ArrayList<>()).add(rule);
            }
        }
        return this;
    }

    public int ruleCount() {
        return ruleNames.size();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> compatibleProviders() {
        return compatibleProviders;
    }

    @Override
    public boolean applyImpl(Graph graph, int graphLevel, Logger logger) throws OptimizationException {
        boolean modified = false;
        for (int index : graph.nodesInTopologicalOrder()) {
            Node node = graph.node(index).orElse(null);
            if (node == null) {
                continue;
            }
            modified |= recurse(node, graphLevel, logger);

            if (!GraphUtils.isSupportedProvider(node, compatibleProviders)) {
                continue;
            }
            modified |= applyRulesOnNode(graph, node, logger);
        }
        return modified;
    }

    private boolean applyRulesOnNode(Graph graph, Node node, Logger logger) throws OptimizationException {
        List<RewriteRule> rules = new ArrayList<>(rulesByOpType.getOrDefault(node.opType(), List.of()));
        rules.addAll(anyOpRules);

        boolean modified = false;
        for (RewriteRule rule : rules) {
            RewriteRuleEffect effect = rule.checkConditionAndApply(graph, node, logger);
            if (effect != RewriteRuleEffect.NONE) {
                modified = true;
                logger.fine(() -> String.format("%s: rule %s %s node %s",
                        name, rule.name(), effect, node.name()));
            }
            if (effect == RewriteRuleEffect.REMOVED_CURRENT_NODE) {
                break;
            }
        }
        return modified;
    }
}
