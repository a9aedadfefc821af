package io.surfworks.graphforge.optimizer.rewrite;

import java.util.List;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.optimizer.OptimizationException;

/**
 * A local rewrite anchored on a single node.
 *
 * <p>A rule has a cheap, side-effect-free precondition and a rewrite. The rewrite only
 * runs when the precondition holds, and it may only fail with an
 * {@link OptimizationException} when the graph itself is broken. A rule that finds
 * nothing to do returns {@link RewriteRuleEffect#NONE}.
 *
 * <p>Rules are grouped and driven by a {@link RuleBasedGraphTransformer}.
 */
public interface RewriteRule {

    /**
     * Unique name within the owning transformer.
     */
    String name();

    /**
     * Operator types this rule is evaluated on. Empty means every node.
     */
    List<String> targetOpTypes();

    /**
     * Returns true if {@link #apply} may be invoked on this node. Must not mutate the graph.
     */
    boolean satisfyCondition(Graph graph, Node node, Logger logger);

    /**
     * Rewrites the graph around {@code node}.
     *
     * @throws OptimizationException if the graph is structurally inconsistent
     */
    RewriteRuleEffect apply(Graph graph, Node node, Logger logger) throws OptimizationException;

    /**
     * Checks the condition and applies the rule if it holds.
     *
     * @return the effect, {@link RewriteRuleEffect#NONE} if the condition did not hold
     */
    default RewriteRuleEffect checkConditionAndApply(Graph graph, Node node, Logger logger)
            throws OptimizationException {
        if (!satisfyCondition(graph, node, logger)) {
            return RewriteRuleEffect.NONE;
        }
        return apply(graph, node, logger);
    }
}
