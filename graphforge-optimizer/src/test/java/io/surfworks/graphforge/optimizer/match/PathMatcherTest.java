package io.surfworks.graphforge.optimizer.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Domains;
import io.surfworks.graphforge.graph.EdgeEnd;
import io.surfworks.graphforge.graph.ElementType;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorShape;
import io.surfworks.graphforge.optimizer.match.PathMatcher.Direction;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PathMatcher")
class PathMatcherTest {

    private final List<LogRecord> records = new ArrayList<>();
    private Logger logger;
    private Handler handler;

    @BeforeEach
    void captureLogs() {
        logger = Logger.getLogger(PathMatcherTest.class.getName() + ".capture");
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        handler.setLevel(Level.ALL);
        logger.addHandler(handler);
    }

    @AfterEach
    void releaseLogs() {
        logger.removeHandler(handler);
    }

    private static NodeArg i64(String name) {
        return new NodeArg(name, ElementType.INT64, TensorShape.of(2));
    }

    /**
     * ids -> Shape -> Gather -> Unsqueeze, plus a second Gather reading the same Shape.
     */
    private static Graph shapeChain(boolean secondGather) {
        Graph graph = new Graph("main");
        NodeArg ids = graph.addInput(new NodeArg("ids", ElementType.INT64, TensorShape.of(2, 3)));
        NodeArg index = graph.addInput(i64("index"));
        NodeArg shape = i64("shape");
        NodeArg dim = i64("dim");
        graph.addNode("shape", "Shape", List.of(ids), List.of(shape), Domains.ONNX, 1);
        graph.addNode("gather", "Gather", List.of(shape, index), List.of(dim), Domains.ONNX, 11);
        graph.addNode("unsqueeze", "Unsqueeze", List.of(dim), List.of(i64("dim_1d")), Domains.ONNX, 11);
        if (secondGather) {
            graph.addNode("gather_b", "Gather", List.of(shape, index), List.of(i64("dim_b")), Domains.ONNX, 11);
        }
        return graph;
    }

    // ==================== Input direction ====================

    @Nested
    @DisplayName("Input direction")
    class InputDirectionTests {

        @Test
        @DisplayName("returns the matched edges in path order")
        void matchesUpwardPath() {
            Graph graph = shapeChain(false);
            Node unsqueeze = graph.nodeByName("unsqueeze").orElseThrow();

            Optional<List<EdgeEnd>> path = PathMatcher.findPath(graph, unsqueeze, Direction.INPUT, List.of(
                    EdgeEndToMatch.onnx(0, 0, "Gather", 1, 11),
                    EdgeEndToMatch.onnx(0, 0, "Shape", 1)), logger);

            assertTrue(path.isPresent());
            assertEquals("gather", path.get().get(0).node().name());
            assertEquals("shape", path.get().get(1).node().name());
            assertEquals(0, path.get().get(1).dstArgIndex());
        }

        @Test
        @DisplayName("fails on a version outside the accepted set")
        void rejectsVersion() {
            Graph graph = shapeChain(false);
            Node unsqueeze = graph.nodeByName("unsqueeze").orElseThrow();

            assertTrue(PathMatcher.findPath(graph, unsqueeze, Direction.INPUT, List.of(
                    EdgeEndToMatch.onnx(0, 0, "Gather", 1)), logger).isEmpty());
        }

        @Test
        @DisplayName("fails on the wrong destination slot")
        void rejectsSlot() {
            Graph graph = shapeChain(false);
            Node gather = graph.nodeByName("gather").orElseThrow();

            assertTrue(PathMatcher.findPath(graph, gather, Direction.INPUT, List.of(
                    EdgeEndToMatch.onnx(0, 1, "Shape", 1)), logger).isEmpty());
        }

        @Test
        @DisplayName("fails on the wrong domain")
        void rejectsDomain() {
            Graph graph = shapeChain(false);
            Node gather = graph.nodeByName("gather").orElseThrow();

            assertTrue(PathMatcher.findPath(graph, gather, Direction.INPUT, List.of(
                    new EdgeEndToMatch(0, 0, "Shape", Set.of(1), Domains.MICROSOFT)), logger).isEmpty());
        }

        @Test
        @DisplayName("an empty path matches trivially")
        void emptyPath() {
            Graph graph = shapeChain(false);
            Node gather = graph.nodeByName("gather").orElseThrow();

            assertEquals(Optional.of(List.of()), PathMatcher.findPath(graph, gather, Direction.INPUT, List.of(), logger));
        }
    }

    // ==================== Output direction ====================

    @Nested
    @DisplayName("Output direction")
    class OutputDirectionTests {

        @Test
        @DisplayName("follows a unique consumer downward")
        void matchesDownwardPath() {
            Graph graph = shapeChain(false);
            Node shape = graph.nodeByName("shape").orElseThrow();

            Optional<List<EdgeEnd>> path = PathMatcher.findPath(graph, shape, Direction.OUTPUT, List.of(
                    EdgeEndToMatch.onnx(0, 0, "Gather", 11),
                    EdgeEndToMatch.onnx(0, 0, "Unsqueeze", 11)), logger);

            assertTrue(path.isPresent());
            assertEquals("unsqueeze", path.get().get(1).node().name());
        }

        @Test
        @DisplayName("fails with a warning when several consumers match")
        void ambiguousConsumers() {
            Graph graph = shapeChain(true);
            Node shape = graph.nodeByName("shape").orElseThrow();

            Optional<List<EdgeEnd>> path = PathMatcher.findPath(graph, shape, Direction.OUTPUT, List.of(
                    EdgeEndToMatch.onnx(0, 0, "Gather", 11)), logger);

            assertTrue(path.isEmpty());
            assertTrue(records.stream().anyMatch(r -> r.getLevel() == Level.WARNING
                    && r.getMessage().contains("multiple edges")));
        }
    }
}
