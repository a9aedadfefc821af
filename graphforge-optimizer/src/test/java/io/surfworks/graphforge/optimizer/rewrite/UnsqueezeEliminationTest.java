package io.surfworks.graphforge.optimizer.rewrite;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Attribute;
import io.surfworks.graphforge.graph.Domains;
import io.surfworks.graphforge.graph.ElementType;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.GraphUtils;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorData;
import io.surfworks.graphforge.graph.TensorShape;
import io.surfworks.graphforge.optimizer.OptimizationException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("UnsqueezeElimination")
class UnsqueezeEliminationTest {

    private static final Logger LOG = Logger.getLogger(UnsqueezeEliminationTest.class.getName());

    private final UnsqueezeElimination rule = new UnsqueezeElimination();

    /**
     * w[4] -> Unsqueeze -> w_unsqueezed -> Add(x, .) -> y
     */
    private static Graph foldable(Attribute axes) {
        Graph graph = new Graph("main");
        NodeArg x = graph.addInput(new NodeArg("x", ElementType.FLOAT, TensorShape.of(1, 4)));
        NodeArg w = GraphUtils.addInitializer(graph,
                TensorData.ofFloats("w", new long[] {4}, 1f, 2f, 3f, 4f));
        NodeArg unsqueezed = new NodeArg("w_unsqueezed", ElementType.FLOAT, null);
        Map<String, Attribute> attrs = axes == null ? Map.of() : Map.of("axes", axes);
        graph.addNode("unsqueeze", "Unsqueeze", "", List.of(w), List.of(unsqueezed), attrs, Domains.ONNX, 11);
        NodeArg y = new NodeArg("y", ElementType.FLOAT, TensorShape.of(1, 4));
        graph.addNode("add", "Add", List.of(x, unsqueezed), List.of(y), Domains.ONNX, 7);
        graph.addOutput(y);
        return graph;
    }

    private static Node unsqueeze(Graph graph) {
        return graph.nodeByName("unsqueeze").orElseThrow();
    }

    private static long[] dimsOf(Graph graph, String name) {
        return graph.initializer(name).orElseThrow().dims();
    }

    // ==================== Folding ====================

    @Nested
    @DisplayName("Folding")
    class FoldingTests {

        @Test
        @DisplayName("reshapes the initializer and feeds the consumer directly")
        void foldsLeadingAxis() throws OptimizationException {
            Graph graph = foldable(Attribute.ofInts(0));

            assertEquals(RewriteRuleEffect.REMOVED_CURRENT_NODE, rule.checkConditionAndApply(graph, unsqueeze(graph), LOG));

            assertArrayEquals(new long[] {1, 4}, dimsOf(graph, "w"));
            assertArrayEquals(new float[] {1f, 2f, 3f, 4f}, graph.initializer("w").orElseThrow().floats());
            Node add = graph.nodeByName("add").orElseThrow();
            assertEquals("w", add.inputDef(1).name());
            assertEquals(TensorShape.of(1, 4), add.inputDef(1).shape());
            assertEquals(1, graph.nodeCount());
            graph.resolve();
        }

        @Test
        @DisplayName("normalizes a negative axis against the output rank")
        void foldsNegativeAxis() throws OptimizationException {
            Graph graph = foldable(Attribute.ofInts(-1));

            rule.checkConditionAndApply(graph, unsqueeze(graph), LOG);

            assertArrayEquals(new long[] {4, 1}, dimsOf(graph, "w"));
        }

        @Test
        @DisplayName("inserts every listed axis")
        void foldsSeveralAxes() throws OptimizationException {
            Graph graph = foldable(Attribute.ofInts(2, 0));

            rule.checkConditionAndApply(graph, unsqueeze(graph), LOG);

            assertArrayEquals(new long[] {1, 4, 1}, dimsOf(graph, "w"));
        }
    }

    // ==================== Invalid axes ====================

    @Nested
    @DisplayName("Invalid axes")
    class InvalidAxesTests {

        @Test
        @DisplayName("a repeated axis fails and leaves the graph untouched")
        void repeatedAxis() {
            Graph graph = foldable(Attribute.ofInts(0, 0));

            OptimizationException e = assertThrows(OptimizationException.class,
                    () -> rule.checkConditionAndApply(graph, unsqueeze(graph), LOG));

            assertTrue(e.getMessage().contains("index out of range"));
            assertEquals(UnsqueezeElimination.NAME, e.transformer());
            assertArrayEquals(new long[] {4}, dimsOf(graph, "w"));
            assertEquals(2, graph.nodeCount());
        }

        @Test
        @DisplayName("an axis past the output rank fails")
        void axisTooLarge() {
            Graph graph = foldable(Attribute.ofInts(2));

            assertThrows(OptimizationException.class,
                    () -> rule.checkConditionAndApply(graph, unsqueeze(graph), LOG));
            assertArrayEquals(new long[] {4}, dimsOf(graph, "w"));
        }

        @Test
        @DisplayName("a negative axis below the output rank fails")
        void axisTooSmall() {
            Graph graph = foldable(Attribute.ofInts(-3));

            assertThrows(OptimizationException.class,
                    () -> rule.checkConditionAndApply(graph, unsqueeze(graph), LOG));
        }
    }

    // ==================== Declined ====================

    @Nested
    @DisplayName("Declined")
    class DeclinedTests {

        @Test
        @DisplayName("no axes attribute is a no-op")
        void missingAxes() throws OptimizationException {
            Graph graph = foldable(null);

            assertEquals(RewriteRuleEffect.NONE, rule.checkConditionAndApply(graph, unsqueeze(graph), LOG));
            assertEquals(2, graph.nodeCount());
            assertArrayEquals(new long[] {4}, dimsOf(graph, "w"));
        }

        @Test
        @DisplayName("an initializer that is also a graph input may be overridden")
        void overridableInitializer() {
            Graph graph = foldable(Attribute.ofInts(0));
            graph.addInput(graph.nodeArg("w").orElseThrow());

            assertFalse(rule.satisfyCondition(graph, unsqueeze(graph), LOG));
        }

        @Test
        @DisplayName("an output that is a graph output is kept")
        void graphOutput() {
            Graph graph = foldable(Attribute.ofInts(0));
            graph.addOutput(graph.nodeArg("w_unsqueezed").orElseThrow());

            assertFalse(rule.satisfyCondition(graph, unsqueeze(graph), LOG));
        }

        @Test
        @DisplayName("a computed input is not folded")
        void computedInput() {
            Graph graph = new Graph("main");
            NodeArg x = graph.addInput(new NodeArg("x", ElementType.FLOAT, TensorShape.of(4)));
            NodeArg out = new NodeArg("x_unsqueezed", ElementType.FLOAT, null);
            Node node = graph.addNode("unsqueeze", "Unsqueeze", "", List.of(x), List.of(out),
                    Map.of("axes", Attribute.ofInts(0)), Domains.ONNX, 11);
            graph.addNode("relu", "Relu", List.of(out), List.of(new NodeArg("y", ElementType.FLOAT, null)),
                    Domains.ONNX, 6);

            assertFalse(rule.satisfyCondition(graph, node, LOG));
        }
    }
}
