package io.surfworks.graphforge.graph;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Graph queries and mutation primitives shared by rewrite rules and fusion passes.
 *
 * <p>None of these check that a rewrite is semantically equivalent. Callers validate
 * a candidate fully before mutating anything.
 */
public final class GraphUtils {

    private GraphUtils() {} // Utility class

    // ==================== Queries ====================

    /**
     * Returns true if the node has the given op type and domain and its since-version
     * is one of {@code versions}.
     */
    public static boolean isSupportedOptypeVersionAndDomain(Node node, String opType,
                                                            Collection<Integer> versions, String domain) {
        return node.opType().equals(opType)
                && versions.contains(node.sinceVersion())
                && Domains.matches(node.domain(), domain);
    }

    /**
     * Returns true if the node's provider is in {@code compatibleProviders}, or the set is empty.
     * An unassigned node only passes the empty set.
     */
    public static boolean isSupportedProvider(Node node, Set<String> compatibleProviders) {
        if (compatibleProviders.isEmpty()) {
            return true;
        }
        String provider = node.executionProviderType();
        return provider != null && compatibleProviders.contains(provider);
    }

    /**
     * First consumer of the node's outputs with the given op type, in edge order.
     */
    public static Optional<Node> firstChildByType(Node node, String opType) {
        for (EdgeEnd edge : node.graph().outputEdges(node)) {
            if (edge.node().opType().equals(opType)) {
                return Optional.of(edge.node());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns true if the node has one input and one output, the output is not a graph
     * output, and the output is not read from inside a nested graph.
     */
    public static boolean canRemoveNode(Graph graph, Node node) {
        if (node.inputDefs().size() != 1 || node.outputDefs().size() != 1) {
            return false;
        }
        if (graph.isNodeOutputsInGraphOutputs(node)) {
            return false;
        }
        String output = node.outputDef(0).name();
        for (EdgeEnd edge : graph.outputEdges(node)) {
            if (edge.dstArgIndex() >= edge.node().inputDefs().size()) {
                // implicit use inside a nested graph; renaming there is not supported
                return false;
            }
        }
        return !output.equals(node.inputDef(0).name());
    }

    // ==================== Mutation ====================

    /**
     * Detaches all output edges of the node so it can be removed. Consumers keep their
     * input slots and must be re-wired or removed by the caller.
     */
    public static void removeNodeOutputEdges(Graph graph, Node node) {
        graph.detachNodeOutputs(node);
    }

    /**
     * Points input slot {@code slot} of {@code node} at {@code arg}.
     */
    public static void replaceNodeInput(Node node, int slot, NodeArg arg) {
        node.graph().replaceNodeInput(node, slot, arg);
    }

    /**
     * Removes a single-input, single-output node and feeds its consumers from the node's input.
     *
     * @return true if the node was removed, false if {@link #canRemoveNode} declined
     */
    public static boolean removeNode(Graph graph, Node node) {
        if (!canRemoveNode(graph, node)) {
            return false;
        }
        NodeArg replacement = node.inputDef(0);
        List<EdgeEnd> edges = graph.outputEdges(node);
        for (EdgeEnd edge : edges) {
            replaceNodeInput(edge.node(), edge.dstArgIndex(), replacement);
        }
        removeNodeOutputEdges(graph, node);
        graph.removeNode(node.index());
        return true;
    }

    /**
     * Replaces an initializer under the same name, for example with a re-shaped copy.
     */
    public static void replaceInitializer(Graph graph, String name, TensorData tensor) {
        graph.replaceInitializer(name, tensor);
    }

    /**
     * Registers a new initializer and returns the NodeArg that refers to it.
     */
    public static NodeArg addInitializer(Graph graph, TensorData tensor) {
        graph.addInitializer(tensor);
        NodeArg arg = graph.getOrCreateNodeArg(tensor.name(), tensor.elementType(), tensor.shape());
        if (arg.shape() == null) {
            arg.setShape(tensor.shape());
        }
        return arg;
    }
}
