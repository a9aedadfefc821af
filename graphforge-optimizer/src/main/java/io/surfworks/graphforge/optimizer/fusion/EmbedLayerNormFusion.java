package io.surfworks.graphforge.optimizer.fusion;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Attribute;
import io.surfworks.graphforge.graph.Domains;
import io.surfworks.graphforge.graph.EdgeEnd;
import io.surfworks.graphforge.graph.ElementType;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.GraphUtils;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorShape;
import io.surfworks.graphforge.optimizer.GraphTransformer;
import io.surfworks.graphforge.optimizer.OptimizationException;
import io.surfworks.graphforge.optimizer.match.EdgeEndToMatch;
import io.surfworks.graphforge.optimizer.match.PathMatcher;
import io.surfworks.graphforge.optimizer.match.PathMatcher.Direction;
import io.surfworks.graphforge.optimizer.match.ShapeChecks;

/**
 * Fuses the embedding block of a BERT-style encoder into one
 * {@code com.microsoft:EmbedLayerNormalization} node.
 *
 * <p>Matches, anchored on the LayerNormalization that feeds the first Attention:
 * <pre>
 *   (input_ids) --> Gather(word) ----------+      (segment_ids)
 *        |                                 v           |
 *        +--> [position indices] --> Gather(pos) --> Add    Gather(segment)
 *                                                     \      /
 *                                                       Add
 *                                                        |
 *   (mask) --> ReduceSum ---------+              LayerNormalization
 *                                 v                      |
 *                              Attention &lt;--------------+
 * </pre>
 *
 * <p>Fused output:
 * <pre>
 *   EmbedLayerNormalization(input_ids, segment_ids, word_embedding, position_embedding,
 *                           segment_embedding, gamma, beta, mask)
 *       -> (layer norm output, mask index)
 * </pre>
 * Index inputs that are not INT32 get a Cast in front of the fused node.
 *
 * <p>Every check runs before the graph is touched. A candidate that fails any check
 * leaves the graph exactly as it was.
 */
public final class EmbedLayerNormFusion implements GraphTransformer {

    public static final String NAME = "EmbedLayerNormFusion";
    public static final String FUSED_OP_TYPE = "EmbedLayerNormalization";

    private static final List<EdgeEndToMatch> REDUCE_SUM_PATH = List.of(
            EdgeEndToMatch.onnx(0, 3, "ReduceSum", 1, 11));
    private static final List<EdgeEndToMatch> LAYER_NORM_ADD_PATH = List.of(
            EdgeEndToMatch.onnx(0, 0, "Add", 7));
    private static final List<EdgeEndToMatch> SEGMENT_EMBEDDING_PATH = List.of(
            EdgeEndToMatch.onnx(0, 1, "Gather", 1, 11));
    private static final List<EdgeEndToMatch> WORD_EMBEDDING_PATH = List.of(
            EdgeEndToMatch.onnx(0, 0, "Add", 7),
            EdgeEndToMatch.onnx(0, 0, "Gather", 1, 11));

    private final Set<String> compatibleProviders;

    public EmbedLayerNormFusion() {
        this(Set.of());
    }

    public EmbedLayerNormFusion(Set<String> compatibleProviders) {
        this.compatibleProviders = Set.copyOf(compatibleProviders);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Set<String> compatibleProviders() {
        return compatibleProviders;
    }

    @Override
    public boolean applyImpl(Graph graph, int graphLevel, Logger logger) throws OptimizationException {
        boolean modified = false;
        for (int index : graph.nodesInTopologicalOrder()) {
            Node layerNorm = graph.node(index).orElse(null);
            if (layerNorm == null) {
                continue; // removed by an earlier fusion in this sweep
            }
            modified |= recurse(layerNorm, graphLevel, logger);

            if (!GraphUtils.isSupportedOptypeVersionAndDomain(layerNorm, "LayerNormalization", List.of(9), Domains.ONNX)
                    || !GraphUtils.isSupportedProvider(layerNorm, compatibleProviders)) {
                continue;
            }
            Optional<Node> attention = GraphUtils.firstChildByType(layerNorm, "Attention");
            if (attention.isEmpty()) {
                // the embedding block comes before every Attention; nothing further can match
                logger.fine(() -> "No Attention after " + layerNorm.name() + ", stopping " + NAME);
                return modified;
            }

            Optional<Candidate> candidate = match(graph, layerNorm, attention.get(), logger);
            if (candidate.isEmpty()) {
                continue;
            }
            Node fused = fuse(graph, candidate.get());
            logger.fine(() -> String.format("%s: fused %d nodes into %s",
                    NAME, candidate.get().nodesToRemove().size(), fused.name()));
            modified = true;
        }
        return modified;
    }

    /**
     * Everything a fusion needs, captured before any mutation.
     */
    record Candidate(
            Node layerNorm,
            Node reduceSum,
            NodeArg inputIds,
            NodeArg segmentIds,
            NodeArg mask,
            NodeArg wordEmbedding,
            PositionEmbedding positionEmbedding,
            NodeArg segmentEmbedding,
            NodeArg gamma,
            NodeArg beta,
            List<Node> nodesToRemove
    ) {}

    // ==================== Matching ====================

    Optional<Candidate> match(Graph graph, Node layerNorm, Node attention, Logger logger) {
        if (!GraphUtils.isSupportedOptypeVersionAndDomain(attention, "Attention", List.of(1), Domains.MICROSOFT)
                || !GraphUtils.isSupportedProvider(attention, compatibleProviders)) {
            return Optional.empty();
        }
        if (layerNorm.inputDefs().size() < 3) {
            return Optional.empty();
        }

        // ReduceSum --> Attention (mask index)
        Optional<List<EdgeEnd>> edges = PathMatcher.findPath(graph, attention, Direction.INPUT, REDUCE_SUM_PATH, logger);
        if (edges.isEmpty()) {
            return Optional.empty();
        }
        Node reduceSum = edges.get().get(0).node();

        // Add --> LayerNormalization
        edges = PathMatcher.findPath(graph, layerNorm, Direction.INPUT, LAYER_NORM_ADD_PATH, logger);
        if (edges.isEmpty()) {
            return Optional.empty();
        }
        Node layerNormAdd = edges.get().get(0).node();

        // Gather(segment) --> Add
        edges = PathMatcher.findPath(graph, layerNormAdd, Direction.INPUT, SEGMENT_EMBEDDING_PATH, logger);
        if (edges.isEmpty()) {
            return Optional.empty();
        }
        Node segmentGather = edges.get().get(0).node();
        if (graph.outputEdgesCount(segmentGather) != 1 || segmentGather.inputDefs().size() < 2) {
            return Optional.empty();
        }
        NodeArg segmentEmbedding = segmentGather.inputDef(0);
        TensorShape segmentShape = segmentEmbedding.shape();
        if (segmentShape == null || segmentShape.rank() != 2
                || !segmentShape.hasDimValue(1) || segmentShape.dimValue(1) <= 0) {
            logger.fine("Segment embedding shape not expected");
            return Optional.empty();
        }
        long hiddenSize = segmentShape.dimValue(1);

        // Gather(word) --> Add --> Add
        edges = PathMatcher.findPath(graph, layerNormAdd, Direction.INPUT, WORD_EMBEDDING_PATH, logger);
        if (edges.isEmpty()) {
            return Optional.empty();
        }
        Node wordAdd = edges.get().get(0).node();
        Node wordGather = edges.get().get(1).node();
        if (graph.outputEdgesCount(wordAdd) != 1 || graph.outputEdgesCount(wordGather) != 1
                || wordAdd.inputDefs().size() < 2 || wordGather.inputDefs().size() < 2) {
            return Optional.empty();
        }
        NodeArg wordEmbedding = wordGather.inputDef(0);
        if (!ShapeChecks.hasDimValue(wordEmbedding, 2, 1, hiddenSize)) {
            logger.fine("Word embedding shape not expected");
            return Optional.empty();
        }

        NodeArg inputIds = wordGather.inputDef(1);
        Optional<PositionEmbedding> position = graph.isConstantInitializer(wordAdd.inputDef(1).name(), true)
                ? PositionEmbeddingMatcher.matchFolded(graph, wordAdd, inputIds, hiddenSize, logger)
                : PositionEmbeddingMatcher.matchGathered(graph, wordAdd, inputIds, logger);
        if (position.isEmpty()) {
            logger.fine("Failed to match position embedding");
            return Optional.empty();
        }
        TensorShape positionShape = position.get().shape();
        if (positionShape == null || positionShape.rank() != 2
                || !positionShape.hasDimValue(1) || positionShape.dimValue(1) != hiddenSize) {
            logger.fine("Position embedding shape is not expected");
            return Optional.empty();
        }

        NodeArg segmentIds = segmentGather.inputDef(1);
        NodeArg mask = reduceSum.inputDefs().isEmpty() ? null : reduceSum.inputDef(0);
        if (!checkInput(inputIds, "input_ids", logger)
                || !checkInput(segmentIds, "segment_ids", logger)
                || mask == null || !checkInput(mask, "mask", logger)) {
            return Optional.empty();
        }
        if (!ShapeChecks.sameShape(inputIds, segmentIds)) {
            logger.fine("Input_ids and segment_ids should have the same shape");
            return Optional.empty();
        }
        if (!ShapeChecks.sameShape(inputIds, mask)) {
            logger.fine("Input_ids and mask should have the same shape");
            return Optional.empty();
        }

        NodeArg gamma = layerNorm.inputDef(1);
        NodeArg beta = layerNorm.inputDef(2);
        if (!ShapeChecks.hasDimValue(gamma, 1, 0, hiddenSize)) {
            logger.fine("Gamma should be of shape (hidden_size)");
            return Optional.empty();
        }
        if (!ShapeChecks.hasDimValue(beta, 1, 0, hiddenSize)) {
            logger.fine("Beta should be of shape (hidden_size)");
            return Optional.empty();
        }

        Set<Node> nodesToRemove = new LinkedHashSet<>(position.get().nodes());
        nodesToRemove.add(wordGather);
        nodesToRemove.add(segmentGather);
        nodesToRemove.add(wordAdd);
        nodesToRemove.add(reduceSum);
        nodesToRemove.add(layerNormAdd);
        nodesToRemove.add(layerNorm);
        if (!isSelfContained(graph, nodesToRemove, layerNorm, reduceSum, logger)) {
            return Optional.empty();
        }

        return Optional.of(new Candidate(layerNorm, reduceSum, inputIds, segmentIds, mask, wordEmbedding,
                position.get(), segmentEmbedding, gamma, beta, new ArrayList<>(nodesToRemove)));
    }

    /**
     * Validates shape (batch_size, sequence_length) and an INT32/INT64 element type.
     * Both dimensions may be symbolic.
     */
    private static boolean checkInput(NodeArg input, String role, Logger logger) {
        TensorShape shape = input.shape();
        if (shape == null || shape.rank() != 2 || !input.hasType()) {
            logger.fine(() -> role + " " + input.name() + " shape is unknown or not 2D, or data type unknown");
            return false;
        }
        if (input.elementType() != ElementType.INT64 && input.elementType() != ElementType.INT32) {
            logger.fine(() -> role + " " + input.name() + " data type is not int32 or int64");
            return false;
        }
        return true;
    }

    /**
     * Returns true if removing {@code nodes} leaves no dangling consumer: apart from the two
     * outputs the fused node takes over, every value they produce is consumed only inside the
     * matched set and is not a graph output.
     */
    private static boolean isSelfContained(Graph graph, Set<Node> nodes, Node layerNorm, Node reduceSum,
                                           Logger logger) {
        for (Node node : nodes) {
            // output 0 of these two is re-produced by the fused node
            int firstDropped = node == layerNorm || node == reduceSum ? 1 : 0;
            for (int i = firstDropped; i < node.outputDefs().size(); i++) {
                if (graph.isGraphOutput(node.outputDef(i).name())) {
                    logger.fine(() -> "Matched node " + node.name() + " produces a graph output");
                    return false;
                }
            }
            for (EdgeEnd edge : graph.outputEdges(node)) {
                if (edge.srcArgIndex() < firstDropped) {
                    continue;
                }
                if (!nodes.contains(edge.node())) {
                    logger.fine(() -> "Matched node " + node.name() + " is also consumed by " + edge.node().name());
                    return false;
                }
            }
        }
        return true;
    }

    // ==================== Rewrite ====================

    private static Node fuse(Graph graph, Candidate candidate) {
        Node layerNorm = candidate.layerNorm();
        String provider = layerNorm.executionProviderType();

        NodeArg inputIds = CastInsertion.castToInt32(graph, candidate.inputIds(), provider);
        NodeArg segmentIds = CastInsertion.castToInt32(graph, candidate.segmentIds(), provider);
        NodeArg mask = CastInsertion.castToInt32(graph, candidate.mask(), provider);
        NodeArg positionEmbedding = candidate.positionEmbedding().materialize(graph);

        List<NodeArg> inputs = List.of(
                inputIds,
                segmentIds,
                candidate.wordEmbedding(),
                positionEmbedding,
                candidate.segmentEmbedding(),
                candidate.gamma(),
                candidate.beta(),
                mask);
        List<NodeArg> outputs = List.of(layerNorm.outputDef(0), candidate.reduceSum().outputDef(0));

        Map<String, Attribute> attributes = new LinkedHashMap<>();
        layerNorm.attribute("epsilon").ifPresent(eps -> attributes.put("epsilon", eps));

        for (Node node : candidate.nodesToRemove()) {
            GraphUtils.removeNodeOutputEdges(graph, node);
        }
        Node fused = graph.addNode(graph.generateNodeName(FUSED_OP_TYPE), FUSED_OP_TYPE,
                "fused EmbedLayerNorm subgraphs", inputs, outputs, attributes, Domains.MICROSOFT, 1);
        fused.setExecutionProviderType(provider);

        for (Node node : candidate.nodesToRemove()) {
            graph.removeNode(node.index());
        }
        return fused;
    }
}
