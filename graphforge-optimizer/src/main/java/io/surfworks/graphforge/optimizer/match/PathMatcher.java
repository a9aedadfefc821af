package io.surfworks.graphforge.optimizer.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.EdgeEnd;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.GraphUtils;
import io.surfworks.graphforge.graph.Node;

/**
 * Walks a chain of edge/operator constraints from an anchor node.
 *
 * <p>Each {@link EdgeEndToMatch} step names the slots to follow and the operator type,
 * version set and domain expected at the other end. Matching fails at the first step
 * with no matching edge. It also fails when a forward step finds more than one matching
 * consumer, since the path would be ambiguous.
 *
 * <p>The matcher only checks structure. Consumer counts, constant values and shapes
 * are pattern-specific and are checked by the caller on the returned edges.
 *
 * <p>Example, matching {@code Shape -> Gather -> Unsqueeze} upward from an Unsqueeze:
 * <pre>{@code
 * Optional<List<EdgeEnd>> path = PathMatcher.findPath(graph, unsqueeze, Direction.INPUT, List.of(
 *         EdgeEndToMatch.onnx(0, 0, "Gather", 1, 11),
 *         EdgeEndToMatch.onnx(0, 0, "Shape", 1)), logger);
 * }</pre>
 */
public final class PathMatcher {

    /**
     * Direction to walk from the anchor.
     */
    public enum Direction {
        /** Follow input edges to producers. */
        INPUT,
        /** Follow output edges to consumers. */
        OUTPUT
    }

    private PathMatcher() {} // Utility class

    /**
     * Matches a path starting at {@code anchor}.
     *
     * @param graph the graph owning the anchor
     * @param anchor the node to start from
     * @param direction which edges to follow
     * @param steps the path, in walking order
     * @param logger diagnostics sink
     * @return the matched edges in path order, or empty if any step fails
     */
    public static Optional<List<EdgeEnd>> findPath(Graph graph, Node anchor, Direction direction,
                                                   List<EdgeEndToMatch> steps, Logger logger) {
        List<EdgeEnd> result = new ArrayList<>(steps.size());
        Node current = anchor;
        for (EdgeEndToMatch step : steps) {
            List<EdgeEnd> candidates = direction == Direction.INPUT
                    ? graph.inputEdges(current)
                    : graph.outputEdges(current);

            EdgeEnd found = null;
            for (EdgeEnd edge : candidates) {
                if (!matches(edge, step)) {
                    continue;
                }
                if (direction == Direction.INPUT) {
                    // an input slot has a single producer
                    found = edge;
                    break;
                }
                if (found != null) {
                    logger.warning(String.format("Path match from %s failed: multiple edges match %s",
                            anchor.name(), step));
                    return Optional.empty();
                }
                found = edge;
            }
            if (found == null) {
                logger.fine(() -> String.format("Path match from %s stopped at %s", anchor.name(), step));
                return Optional.empty();
            }
            result.add(found);
            current = found.node();
        }
        return Optional.of(result);
    }

    private static boolean matches(EdgeEnd edge, EdgeEndToMatch step) {
        return edge.srcArgIndex() == step.srcArgIndex()
                && edge.dstArgIndex() == step.dstArgIndex()
                && GraphUtils.isSupportedOptypeVersionAndDomain(edge.node(), step.opType(), step.versions(), step.domain());
    }
}
