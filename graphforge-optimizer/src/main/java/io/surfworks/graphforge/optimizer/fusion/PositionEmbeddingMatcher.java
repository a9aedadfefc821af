package io.surfworks.graphforge.optimizer.fusion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.EdgeEnd;
import io.surfworks.graphforge.graph.ElementType;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorData;
import io.surfworks.graphforge.graph.TensorShape;
import io.surfworks.graphforge.optimizer.match.EdgeEndToMatch;
import io.surfworks.graphforge.optimizer.match.InitializerValues;
import io.surfworks.graphforge.optimizer.match.PathMatcher;
import io.surfworks.graphforge.optimizer.match.PathMatcher.Direction;

/**
 * Finds the position embedding feeding the word-embedding Add of a BERT embedding block.
 *
 * <p>Three shapes of graph are recognised:
 * <ul>
 *   <li>folded: the Add's second input is a constant (batch, sequence, hidden) tensor,
 *       which is what constant folding leaves behind for static input shapes</li>
 *   <li>constant indices: {@code Gather(table, [0..seq-1] per batch)}</li>
 *   <li>computed indices: {@code Gather(table, Expand(...))} where the indices are
 *       derived from {@code Shape(input_ids)} by one of two exporter-specific subgraphs</li>
 * </ul>
 *
 * <p>Computed indices, opset 10 export:
 * <pre>
 *   Shape -> Gather(1) -> Unsqueeze -> ConstantOfShape -> NonZero -> Transpose
 *         -> Squeeze -> Cast -> Unsqueeze -> Expand -> Gather
 * </pre>
 * Computed indices, opset 11 export:
 * <pre>
 *   Shape -> Gather(1) -> Cast -> Range(0, n, 1) -> Unsqueeze -> Expand -> Gather
 * </pre>
 * In both exports the Expand's target shape may come from
 * {@code Concat(Unsqueeze(Gather(Shape, 0)), Unsqueeze(Gather(Shape, 1)))}, sharing the
 * {@code Gather(Shape, 1)} with the index path.
 */
final class PositionEmbeddingMatcher {

    private static final int SUBGRAPH1_GATHER_STEP = 8;

    private static final List<EdgeEndToMatch> POSITION_GATHER_PATH = List.of(
            EdgeEndToMatch.onnx(0, 1, "Gather", 1, 11));

    private static final List<EdgeEndToMatch> SUBGRAPH1_PATH = List.of(
            EdgeEndToMatch.onnx(0, 1, "Expand", 8),
            EdgeEndToMatch.onnx(0, 0, "Unsqueeze", 1, 11),
            EdgeEndToMatch.onnx(0, 0, "Cast", 9),
            EdgeEndToMatch.onnx(0, 0, "Squeeze", 1, 11),
            EdgeEndToMatch.onnx(0, 0, "Transpose", 1),
            EdgeEndToMatch.onnx(0, 0, "NonZero", 9),
            EdgeEndToMatch.onnx(0, 0, "ConstantOfShape", 9),
            EdgeEndToMatch.onnx(0, 0, "Unsqueeze", 1, 11),
            EdgeEndToMatch.onnx(0, 0, "Gather", 1, 11),
            EdgeEndToMatch.onnx(0, 0, "Shape", 1));

    private static final List<EdgeEndToMatch> EXPAND_SHAPE_PATH = List.of(
            EdgeEndToMatch.onnx(0, 1, "Shape", 1));

    private static final List<EdgeEndToMatch> SUBGRAPH2_PATH = List.of(
            EdgeEndToMatch.onnx(0, 1, "Expand", 8),
            EdgeEndToMatch.onnx(0, 0, "Unsqueeze", 11),
            EdgeEndToMatch.onnx(0, 0, "Range", 11),
            EdgeEndToMatch.onnx(0, 1, "Cast", 9),
            EdgeEndToMatch.onnx(0, 0, "Gather", 11));

    private static final List<EdgeEndToMatch> BATCH_DIM_PATH = List.of(
            EdgeEndToMatch.onnx(0, 1, "Concat", 4, 11),
            EdgeEndToMatch.onnx(0, 0, "Unsqueeze", 1, 11),
            EdgeEndToMatch.onnx(0, 0, "Gather", 1, 11),
            EdgeEndToMatch.onnx(0, 0, "Shape", 1));

    private static final List<EdgeEndToMatch> SEQUENCE_DIM_PATH = List.of(
            EdgeEndToMatch.onnx(0, 1, "Unsqueeze", 1, 11),
            EdgeEndToMatch.onnx(0, 0, "Gather", 1, 11),
            EdgeEndToMatch.onnx(0, 0, "Shape", 1));

    private PositionEmbeddingMatcher() {} // Utility class

    // ==================== Folded ====================

    /**
     * Matches a constant-folded position embedding: the Add's second input is a constant
     * FLOAT or FLOAT16 initializer of shape (batch, sequence, hidden) whose batches are
     * identical. The first batch is sliced out as a new (sequence, hidden) table.
     */
    static Optional<PositionEmbedding> matchFolded(Graph graph, Node wordAdd, NodeArg inputIds,
                                                   long hiddenSize, Logger logger) {
        NodeArg addInput = wordAdd.inputDef(1);
        Optional<TensorData> constant = graph.constantInitializer(addInput.name(), true);
        if (constant.isEmpty()) {
            return Optional.empty();
        }

        TensorShape inputShape = inputIds.shape();
        if (inputShape == null || inputShape.rank() != 2
                || !inputShape.hasDimValue(0) || !inputShape.hasDimValue(1)) {
            logger.fine("Input is expected to have dim value in all dimensions");
            return Optional.empty();
        }
        long batchSize = inputShape.dimValue(0);
        long sequenceLength = inputShape.dimValue(1);
        if (batchSize <= 0 || sequenceLength <= 0) {
            return Optional.empty();
        }

        TensorData tensor = constant.get();
        if (!Arrays.equals(tensor.dims(), new long[] {batchSize, sequenceLength, hiddenSize})) {
            logger.fine(() -> "Position embedding shape not matched: " + Arrays.toString(tensor.dims()));
            return Optional.empty();
        }
        if (tensor.elementType() != ElementType.FLOAT && tensor.elementType() != ElementType.FLOAT16) {
            logger.fine(() -> "Position embedding data type shall be float or float16: " + tensor.elementType());
            return Optional.empty();
        }

        int perBatch = (int) (sequenceLength * hiddenSize);
        byte[] first = tensor.elementBytes(0, perBatch);
        for (int b = 1; b < batchSize; b++) {
            if (!Arrays.equals(first, tensor.elementBytes(b * perBatch, perBatch))) {
                logger.fine(() -> "Position embedding differs between batches in " + tensor.name());
                return Optional.empty();
            }
        }

        TensorData extracted = new TensorData(graph.generateNodeArgName("position_embeddings"),
                tensor.elementType(), new long[] {sequenceLength, hiddenSize}, first);
        return Optional.of(PositionEmbedding.folded(extracted));
    }

    // ==================== Gathered ====================

    /**
     * Matches {@code Gather(table, indices) -> Add} at the Add's second input, where the
     * indices are either a constant position sequence or computed from {@code input_ids}.
     */
    static Optional<PositionEmbedding> matchGathered(Graph graph, Node wordAdd, NodeArg inputIds, Logger logger) {
        Optional<List<EdgeEnd>> edges = PathMatcher.findPath(graph, wordAdd, Direction.INPUT,
                POSITION_GATHER_PATH, logger);
        if (edges.isEmpty()) {
            return Optional.empty();
        }
        Node positionGather = edges.get().get(0).node();
        if (graph.outputEdgesCount(positionGather) != 1 || positionGather.inputDefs().size() < 2) {
            return Optional.empty();
        }
        NodeArg table = positionGather.inputDef(0);
        NodeArg indices = positionGather.inputDef(1);

        List<Node> nodes = new ArrayList<>();
        if (graph.isConstantInitializer(indices.name(), true)) {
            if (!isPositionSequence(graph, indices, inputIds)) {
                logger.fine(() -> "Position indices " + indices.name() + " are not [0, sequence) per batch");
                return Optional.empty();
            }
        } else {
            Optional<List<Node>> subgraph = matchSubgraph1(graph, positionGather, inputIds, logger);
            if (subgraph.isEmpty()) {
                subgraph = matchSubgraph2(graph, positionGather, inputIds, logger);
            }
            if (subgraph.isEmpty()) {
                return Optional.empty();
            }
            nodes.addAll(subgraph.get());
        }
        nodes.add(positionGather);
        return Optional.of(PositionEmbedding.gathered(table, nodes));
    }

    private static boolean isPositionSequence(Graph graph, NodeArg indices, NodeArg inputIds) {
        TensorShape expected = inputIds.shape();
        if (expected == null || expected.rank() != 2 || !expected.hasDimValue(0) || !expected.hasDimValue(1)) {
            return false;
        }
        List<Long> data = new ArrayList<>();
        if (!InitializerValues.appendTensorFromInitializer(graph, indices, data)
                || data.size() != expected.dimValue(0) * expected.dimValue(1)) {
            return false;
        }
        long sequenceLength = expected.dimValue(1);
        long expectedValue = 0;
        for (long value : data) {
            if (value != expectedValue) {
                return false;
            }
            expectedValue++;
            if (expectedValue >= sequenceLength) {
                expectedValue = 0;
            }
        }
        return true;
    }

    /**
     * Opset 10 export. The {@code Gather(Shape, 1)} in the path either feeds only this
     * path, and the Expand's shape comes straight from {@code Shape(input_ids)}, or is
     * shared with the Concat-built shape.
     */
    private static Optional<List<Node>> matchSubgraph1(Graph graph, Node positionGather, NodeArg inputIds,
                                                       Logger logger) {
        Optional<List<EdgeEnd>> found = PathMatcher.findPath(graph, positionGather, Direction.INPUT,
                SUBGRAPH1_PATH, logger);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        List<EdgeEnd> edges = found.get();
        Node gather = edges.get(SUBGRAPH1_GATHER_STEP).node();
        int gatherEdgeCount = graph.outputEdgesCount(gather);
        for (int i = 0; i < edges.size(); i++) {
            int count = graph.outputEdgesCount(edges.get(i).node());
            if (count != 1 && !(i == SUBGRAPH1_GATHER_STEP && count == 2)) {
                logger.fine("Output edge count not expected for nodes in position path 1");
                return Optional.empty();
            }
        }

        Node expand = edges.get(0).node();
        Set<Node> nodes = new LinkedHashSet<>();
        if (gatherEdgeCount == 1) {
            if (!hasConstantInput(graph, gather, 1, 1)) {
                logger.fine("Second input of Gather should be a constant with value 1");
                return Optional.empty();
            }
            Optional<List<EdgeEnd>> shapeEdge = PathMatcher.findPath(graph, expand, Direction.INPUT,
                    EXPAND_SHAPE_PATH, logger);
            if (shapeEdge.isEmpty()) {
                logger.fine("Failed to match Shape node feeding Expand");
                return Optional.empty();
            }
            Node expandShape = shapeEdge.get().get(0).node();
            Node pathShape = edges.get(edges.size() - 1).node();
            if (!readsValue(pathShape, inputIds) || !readsValue(expandShape, inputIds)) {
                logger.fine("The parent of shape nodes are expected to be input_ids");
                return Optional.empty();
            }
            nodes.add(expandShape);
        } else {
            Optional<List<Node>> shape = matchPositionShape(graph, expand, inputIds, gather, logger);
            if (shape.isEmpty()) {
                return Optional.empty();
            }
            nodes.addAll(shape.get());
        }
        addNodes(nodes, edges);
        return Optional.of(new ArrayList<>(nodes));
    }

    /**
     * Opset 11 export, index path through {@code Range(0, n, 1)}.
     */
    private static Optional<List<Node>> matchSubgraph2(Graph graph, Node positionGather, NodeArg inputIds,
                                                       Logger logger) {
        Optional<List<EdgeEnd>> found = PathMatcher.findPath(graph, positionGather, Direction.INPUT,
                SUBGRAPH2_PATH, logger);
        if (found.isEmpty()) {
            logger.fine("Failed to find position path 2");
            return Optional.empty();
        }
        List<EdgeEnd> edges = found.get();
        for (int i = 0; i < edges.size(); i++) {
            int expected = i == 4 ? 2 : 1;
            if (graph.outputEdgesCount(edges.get(i).node()) != expected) {
                logger.fine("Output edge count not expected for nodes in position path 2");
                return Optional.empty();
            }
        }

        Node expand = edges.get(0).node();
        Node range = edges.get(2).node();
        Node sequenceGather = edges.get(4).node();
        if (!hasConstantInput(graph, range, 0, 0)) {
            logger.fine("The first input of Range should be a constant with value 0");
            return Optional.empty();
        }
        if (!hasConstantInput(graph, range, 2, 1)) {
            logger.fine("The third input of Range should be a constant with value 1");
            return Optional.empty();
        }

        Optional<List<Node>> shape = matchPositionShape(graph, expand, inputIds, sequenceGather, logger);
        if (shape.isEmpty()) {
            return Optional.empty();
        }
        Set<Node> nodes = new LinkedHashSet<>(shape.get());
        addNodes(nodes, edges);
        return Optional.of(new ArrayList<>(nodes));
    }

    /**
     * Matches the target shape of the Expand, {@code Concat(batch, sequence)} built from
     * two {@code Shape(input_ids)} lookups. The sequence lookup must be
     * {@code expectedSequenceGather}, the Gather the index path also reads.
     * The Expand itself is not part of the returned nodes.
     */
    private static Optional<List<Node>> matchPositionShape(Graph graph, Node expand, NodeArg inputIds,
                                                           Node expectedSequenceGather, Logger logger) {
        Optional<List<EdgeEnd>> batchPath = PathMatcher.findPath(graph, expand, Direction.INPUT,
                BATCH_DIM_PATH, logger);
        if (batchPath.isEmpty()) {
            logger.fine("Failed to find batch dimension path of position shape");
            return Optional.empty();
        }
        for (EdgeEnd edge : batchPath.get()) {
            if (graph.outputEdgesCount(edge.node()) != 1) {
                logger.fine("Output edge count not expected for nodes in batch dimension path");
                return Optional.empty();
            }
        }
        Node concat = batchPath.get().get(0).node();
        Node batchGather = batchPath.get().get(2).node();
        Node batchShape = batchPath.get().get(3).node();
        if (!hasConstantInput(graph, batchGather, 1, 0)) {
            logger.fine("Second input of Gather in batch dimension path should be a constant with value 0");
            return Optional.empty();
        }

        Optional<List<EdgeEnd>> sequencePath = PathMatcher.findPath(graph, concat, Direction.INPUT,
                SEQUENCE_DIM_PATH, logger);
        if (sequencePath.isEmpty()) {
            logger.fine("Failed to find sequence dimension path of position shape");
            return Optional.empty();
        }
        List<EdgeEnd> edges = sequencePath.get();
        if (graph.outputEdgesCount(edges.get(0).node()) != 1
                || graph.outputEdgesCount(edges.get(1).node()) != 2
                || graph.outputEdgesCount(edges.get(2).node()) != 1) {
            logger.fine("Output edge count not expected for nodes in sequence dimension path");
            return Optional.empty();
        }
        Node sequenceGather = edges.get(1).node();
        Node sequenceShape = edges.get(2).node();
        if (sequenceGather != expectedSequenceGather) {
            logger.fine("Gather in sequence dimension path is not shared with the position index path");
            return Optional.empty();
        }
        if (!hasConstantInput(graph, sequenceGather, 1, 1)) {
            logger.fine("Second input of Gather in sequence dimension path should be a constant with value 1");
            return Optional.empty();
        }
        if (!readsValue(batchShape, inputIds) || !readsValue(sequenceShape, inputIds)) {
            logger.fine("The parent of two shape nodes are expected to be input_ids");
            return Optional.empty();
        }

        Set<Node> nodes = new LinkedHashSet<>();
        addNodes(nodes, batchPath.get());
        addNodes(nodes, edges);
        return Optional.of(new ArrayList<>(nodes));
    }

    // ==================== Helpers ====================

    private static boolean hasConstantInput(Graph graph, Node node, int slot, long expected) {
        return node.inputDefs().size() > slot
                && InitializerValues.isInitializerWithExpectedValue(graph, node.inputDef(slot), expected, true);
    }

    private static boolean readsValue(Node node, NodeArg value) {
        return !node.inputDefs().isEmpty() && node.inputDef(0).name().equals(value.name());
    }

    private static void addNodes(Set<Node> nodes, List<EdgeEnd> edges) {
        for (EdgeEnd edge : edges) {
            nodes.add(edge.node());
        }
    }
}
