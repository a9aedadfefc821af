package io.surfworks.graphforge.optimizer;

import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.Node;

/**
 * A pass that rewrites a graph in place.
 *
 * <p>One call of {@link #apply} is a single sweep over the graph. Repeating sweeps until
 * nothing changes is the job of {@link GraphTransformerManager}. A sweep over a graph the
 * transformer has already fully rewritten must report no modification.
 *
 * <p>Implementations recurse into nested graphs via {@link #recurse} before inspecting
 * the owning node, so rewrites happen at every nesting level.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public final class MyFusion implements GraphTransformer {
 *     public String name() { return "MyFusion"; }
 *
 *     public boolean applyImpl(Graph graph, int graphLevel, Logger logger) throws OptimizationException {
 *         boolean modified = false;
 *         for (int index : graph.nodesInTopologicalOrder()) {
 *             Node node = graph.node(index).orElse(null);
 *             if (node == null) continue;
 *             modified |= recurse(node, graphLevel, logger);
 *             // ... match and rewrite ...
 *         }
 *         return modified;
 *     }
 * }
 * }</pre>
 */
public interface GraphTransformer {

    /**
     * Unique name, used for registration, logging and telemetry.
     */
    String name();

    /**
     * Execution providers whose nodes this transformer may rewrite. Empty means all.
     */
    default Set<String> compatibleProviders() {
        return Set.of();
    }

    /**
     * Returns true if the manager should run this transformer only in its first sweep.
     */
    default boolean shouldOnlyApplyOnce() {
        return false;
    }

    /**
     * Runs one sweep over {@code graph}.
     *
     * @param graph the graph to rewrite
     * @param graphLevel nesting depth, 0 for the main graph
     * @param logger diagnostics sink
     * @return true if the graph was modified
     * @throws OptimizationException if the graph cannot be rewritten safely
     */
    boolean applyImpl(Graph graph, int graphLevel, Logger logger) throws OptimizationException;

    /**
     * Runs one sweep over a main graph and re-checks its invariants if anything changed.
     *
     * @return true if the graph was modified
     * @throws OptimizationException if the sweep failed
     */
    default boolean apply(Graph graph, Logger logger) throws OptimizationException {
        boolean modified = applyImpl(graph, 0, logger);
        if (modified) {
            graph.resolve();
        }
        return modified;
    }

    /**
     * Applies this transformer to every nested graph owned by {@code node}.
     *
     * @return true if any nested graph was modified
     */
    default boolean recurse(Node node, int graphLevel, Logger logger) throws OptimizationException {
        boolean modified = false;
        for (Graph subgraph : node.subgraphs()) {
            modified |= applyImpl(subgraph, graphLevel + 1, logger);
        }
        return modified;
    }
}
