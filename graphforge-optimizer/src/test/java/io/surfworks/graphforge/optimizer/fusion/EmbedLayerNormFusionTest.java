package io.surfworks.graphforge.optimizer.fusion;

import static io.surfworks.graphforge.optimizer.fusion.BertEmbeddingGraphs.PositionStyle;
import static io.surfworks.graphforge.optimizer.fusion.BertEmbeddingGraphs.fingerprint;
import static io.surfworks.graphforge.optimizer.fusion.BertEmbeddingGraphs.opTypes;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Attribute;
import io.surfworks.graphforge.graph.Domains;
import io.surfworks.graphforge.graph.ElementType;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorData;
import io.surfworks.graphforge.graph.TensorShape;
import io.surfworks.graphforge.optimizer.OptimizationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the embedding-block fusion on the export variants built by {@link BertEmbeddingGraphs}.
 */
@DisplayName("EmbedLayerNormFusion")
class EmbedLayerNormFusionTest {

    private static final Logger LOG = Logger.getLogger(EmbedLayerNormFusionTest.class.getName());

    private static final EmbedLayerNormFusion FUSION =
            new EmbedLayerNormFusion(Set.of(Domains.CPU_EXECUTION_PROVIDER));

    private static Node fusedNode(Graph graph) {
        List<Node> fused = graph.nodes().stream()
                .filter(n -> n.opType().equals(EmbedLayerNormFusion.FUSED_OP_TYPE))
                .toList();
        assertEquals(1, fused.size(), "expected exactly one fused node");
        return fused.get(0);
    }

    private static List<String> inputNames(Node node) {
        return node.inputDefs().stream().map(NodeArg::name).toList();
    }

    private static List<String> outputNames(Node node) {
        return node.outputDefs().stream().map(NodeArg::name).toList();
    }

    private static void assertUnchanged(Graph graph) throws OptimizationException {
        String before = fingerprint(graph);
        assertFalse(FUSION.apply(graph, LOG));
        assertEquals(before, fingerprint(graph));
    }

    // ==================== Computed position indices ====================

    @Nested
    @DisplayName("Computed position indices")
    class ComputedIndicesTests {

        @Test
        @DisplayName("fuses the opset 11 Range subgraph with a Concat-built shape")
        void fusesRangeSubgraph() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.RANGE_SUBGRAPH).build();
            assertEquals(19, graph.nodeCount());

            assertTrue(FUSION.apply(graph, LOG));

            assertEquals(List.of("Attention", "Cast", "Cast", "Cast", "EmbedLayerNormalization"),
                    opTypes(graph).stream().sorted().toList());
            Node fused = fusedNode(graph);
            assertEquals(List.of("input_ids_Int32", "segment_ids_Int32", "word_embedding", "position_embedding",
                    "segment_embedding", "gamma", "beta", "input_mask_Int32"), inputNames(fused));
            assertEquals(List.of("layer_norm_out", "mask_index"), outputNames(fused));
            assertEquals(Domains.MICROSOFT, fused.domain());
            assertEquals(Domains.CPU_EXECUTION_PROVIDER, fused.executionProviderType());
            assertEquals(Attribute.of(1e-12f), fused.attribute("epsilon").orElseThrow());
        }

        @Test
        @DisplayName("drops the constants only the position subgraph used")
        void cleansPositionConstants() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.RANGE_SUBGRAPH).build();

            assertTrue(FUSION.apply(graph, LOG));

            for (String name : List.of("range_start", "range_delta", "batch_index", "sequence_index")) {
                assertTrue(graph.initializer(name).isEmpty(), name + " should have been cleaned up");
            }
            assertTrue(graph.initializer("position_embedding").isPresent());
        }

        @Test
        @DisplayName("fuses the opset 10 NonZero subgraph sharing the sequence Gather")
        void fusesNonZeroSharedShape() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.NONZERO_SHARED_SHAPE).build();
            assertEquals(23, graph.nodeCount());

            assertTrue(FUSION.apply(graph, LOG));

            assertEquals(5, graph.nodeCount());
            assertEquals("position_embedding", fusedNode(graph).inputDef(3).name());
        }

        @Test
        @DisplayName("fuses the opset 10 NonZero subgraph with the Expand shape read from input_ids")
        void fusesNonZeroDirectShape() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.NONZERO_DIRECT_SHAPE).build();
            assertEquals(19, graph.nodeCount());

            assertTrue(FUSION.apply(graph, LOG));

            assertEquals(5, graph.nodeCount());
            assertTrue(graph.nodeByName("expand_shape").isEmpty());
        }

        @Test
        @DisplayName("declines when the sequence length is read with index 2")
        void declinesWrongSequenceIndex() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder()
                    .style(PositionStyle.RANGE_SUBGRAPH).sequenceIndex(2).build());
            assertUnchanged(BertEmbeddingGraphs.builder()
                    .style(PositionStyle.NONZERO_DIRECT_SHAPE).sequenceIndex(2).build());
        }

        @Test
        @DisplayName("declines when the sequence index constant can be overridden at run time")
        void declinesOverridableSequenceIndex() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.RANGE_SUBGRAPH).build();
            graph.addInput(graph.nodeArg("sequence_index").orElseThrow());

            assertUnchanged(graph);
        }

        @Test
        @DisplayName("declines when the batch size is read with index 1")
        void declinesWrongBatchIndex() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder()
                    .style(PositionStyle.NONZERO_SHARED_SHAPE).batchIndex(1).build());
        }

        @Test
        @DisplayName("declines when Range does not start at 0")
        void declinesRangeStart() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder()
                    .style(PositionStyle.RANGE_SUBGRAPH).rangeStart(1).build());
        }
    }

    // ==================== Constant positions ====================

    @Nested
    @DisplayName("Constant positions")
    class ConstantPositionTests {

        @Test
        @DisplayName("fuses a Gather with constant position ids")
        void fusesConstantIndices() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.CONSTANT_INDICES).build();
            assertEquals(8, graph.nodeCount());

            assertTrue(FUSION.apply(graph, LOG));

            assertEquals(5, graph.nodeCount());
            assertEquals("position_embedding", fusedNode(graph).inputDef(3).name());
            assertTrue(graph.initializer("position_ids").isEmpty());
        }

        @Test
        @DisplayName("slices the first batch out of a folded position tensor")
        void extractsFoldedEmbedding() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.FOLDED).build();
            TensorData folded = graph.initializer("position_embedded").orElseThrow();

            assertTrue(FUSION.apply(graph, LOG));

            String name = fusedNode(graph).inputDef(3).name();
            assertEquals("position_embeddings", name);
            TensorData extracted = graph.initializer(name).orElseThrow();
            assertArrayEquals(new long[] {BertEmbeddingGraphs.SEQUENCE, BertEmbeddingGraphs.HIDDEN}, extracted.dims());
            float[] expected = Arrays.copyOf(folded.floats(),
                    (int) (BertEmbeddingGraphs.SEQUENCE * BertEmbeddingGraphs.HIDDEN));
            assertArrayEquals(expected, extracted.floats());
            assertTrue(graph.initializer("position_embedded").isEmpty());
        }

        @Test
        @DisplayName("declines a folded tensor whose batches differ and registers nothing")
        void declinesDifferingBatches() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.FOLDED).foldedBatchesDiffer().build();

            assertUnchanged(graph);
            assertTrue(graph.initializer("position_embeddings").isEmpty());
        }

        @Test
        @DisplayName("declines a folded tensor when the input shape is symbolic")
        void declinesFoldedSymbolic() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder()
                    .style(PositionStyle.FOLDED).staticShape(false).build());
        }
    }

    // ==================== Inputs and gating ====================

    @Nested
    @DisplayName("Input validation")
    class InputValidationTests {

        @Test
        @DisplayName("adds no Cast for INT32 inputs")
        void noCastForInt32() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().idsType(ElementType.INT32).build();

            assertTrue(FUSION.apply(graph, LOG));

            assertEquals(List.of("Attention", "EmbedLayerNormalization"), opTypes(graph).stream().sorted().toList());
            Node fused = fusedNode(graph);
            assertEquals("input_ids", fused.inputDef(0).name());
            assertEquals("input_mask", fused.inputDef(7).name());
        }

        @Test
        @DisplayName("inserted Casts convert to INT32 on the layer norm's provider")
        void castsConvertToInt32() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().build();

            assertTrue(FUSION.apply(graph, LOG));

            Node cast = graph.nodeByName("input_ids_Cast").orElseThrow();
            assertEquals(Attribute.of((long) ElementType.INT32.code()), cast.attribute("to").orElseThrow());
            assertEquals(Domains.CPU_EXECUTION_PROVIDER, cast.executionProviderType());
            NodeArg out = cast.outputDef(0);
            assertEquals(ElementType.INT32, out.elementType());
            assertEquals(graph.nodeArg("input_ids").orElseThrow().shape(), out.shape());
        }

        @Test
        @DisplayName("declines when segment_ids has a differently named sequence dimension")
        void declinesMismatchedSegmentShape() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder().mismatchedSegmentShape().build());
        }

        @Test
        @DisplayName("declines nodes on an incompatible provider")
        void declinesIncompatibleProvider() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder().provider(Domains.CUDA_EXECUTION_PROVIDER).build());
        }

        @Test
        @DisplayName("stops without changes when no Attention follows the layer norm")
        void stopsWithoutAttention() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder().withoutAttention().build());
        }
    }

    // ==================== Safety ====================

    @Nested
    @DisplayName("Safety")
    class SafetyTests {

        @Test
        @DisplayName("is idempotent")
        void idempotent() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().build();
            assertTrue(FUSION.apply(graph, LOG));
            String once = fingerprint(graph);

            assertFalse(FUSION.apply(graph, LOG));
            assertEquals(once, fingerprint(graph));
        }

        @Test
        @DisplayName("declines when the word Gather has another consumer")
        void declinesSharedWordGather() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder().extraWordGatherConsumer().build());
        }

        @Test
        @DisplayName("declines when a position subgraph node feeds a node outside the match")
        void declinesSharedShapeNode() throws OptimizationException {
            assertUnchanged(BertEmbeddingGraphs.builder()
                    .style(PositionStyle.NONZERO_DIRECT_SHAPE).extraShapeConsumer().build());
        }

        @Test
        @DisplayName("fuses a block nested in a control-flow body")
        void fusesNestedBlock() throws OptimizationException {
            Graph graph = new Graph("main");
            NodeArg cond = graph.addInput(new NodeArg("cond", ElementType.BOOL, TensorShape.scalar()));
            Graph body = BertEmbeddingGraphs.builder().nestedIn(graph).build();
            NodeArg result = new NodeArg("if_out", ElementType.FLOAT, null);
            graph.addNode("if", "If", "", List.of(cond), List.of(result),
                    Map.of("then_branch", Attribute.of(body)), Domains.ONNX, 1);
            graph.addOutput(result);

            assertTrue(FUSION.apply(graph, LOG));

            assertEquals(5, body.nodeCount());
            fusedNode(body);
            assertEquals(1, graph.nodeCount());
            graph.resolve();
        }

        @Test
        @DisplayName("fused graph passes resolve")
        void fusedGraphResolves() throws OptimizationException {
            Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.NONZERO_SHARED_SHAPE).build();
            assertTrue(FUSION.apply(graph, LOG));

            graph.resolve();
            Node attention = graph.nodeByName("attention").orElseThrow();
            assertEquals(fusedNode(graph), graph.producer(attention.inputDef(0).name()).orElseThrow());
            assertEquals(fusedNode(graph), graph.producer(attention.inputDef(3).name()).orElseThrow());
        }
    }
}
