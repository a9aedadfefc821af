package io.surfworks.graphforge.optimizer.fusion;

import static io.surfworks.graphforge.optimizer.fusion.BertEmbeddingGraphs.PositionStyle;
import static io.surfworks.graphforge.optimizer.fusion.BertEmbeddingGraphs.opTypes;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Set;

import io.surfworks.graphforge.graph.Domains;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.optimizer.GraphOptimizer;
import io.surfworks.graphforge.optimizer.OptimizationException;
import io.surfworks.graphforge.optimizer.OptimizationReport;
import io.surfworks.graphforge.optimizer.TransformerLevel;
import io.surfworks.graphforge.optimizer.config.OptimizerConfig;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Runs the standard optimizer over a full embedding block.
 */
@DisplayName("Standard optimizer on an embedding block")
class StandardPipelineTest {

    @Test
    @DisplayName("fuses at LEVEL2 and reaches a fixed point")
    void fusesWithDefaults() throws OptimizationException {
        Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.RANGE_SUBGRAPH).build();

        OptimizationReport report = GraphOptimizer.standard(OptimizerConfig.defaults()).optimize(graph);

        assertEquals(19, report.nodesBefore());
        assertEquals(5, report.nodesAfter());
        // one stable LEVEL1 sweep, then the fusing sweep and a stable one at LEVEL2
        assertEquals(3, report.stepsRun());
        assertEquals(3, report.applications().size());
        assertEquals(1, report.modifiedCount(EmbedLayerNormFusion.NAME));
        assertEquals(1, opTypes(graph).stream().filter(EmbedLayerNormFusion.FUSED_OP_TYPE::equals).count());
    }

    @Test
    @DisplayName("stops at LEVEL1 when configured")
    void respectsLevel() throws OptimizationException {
        Graph graph = BertEmbeddingGraphs.builder().style(PositionStyle.RANGE_SUBGRAPH).build();
        OptimizerConfig config = OptimizerConfig.defaults().withOptimizationLevel(TransformerLevel.LEVEL1);

        OptimizationReport report = GraphOptimizer.standard(config).optimize(graph);

        assertFalse(report.modified());
        assertEquals(19, graph.nodeCount());
    }

    @Test
    @DisplayName("leaves nodes of other providers alone")
    void respectsProviders() throws OptimizationException {
        Graph graph = BertEmbeddingGraphs.builder()
                .style(PositionStyle.RANGE_SUBGRAPH)
                .provider(Domains.CUDA_EXECUTION_PROVIDER)
                .build();
        OptimizerConfig config = OptimizerConfig.defaults()
                .withCompatibleProviders(Set.of(Domains.CPU_EXECUTION_PROVIDER));

        OptimizationReport report = GraphOptimizer.standard(config).optimize(graph);

        assertFalse(report.modified());
        assertEquals(19, graph.nodeCount());
    }
}
