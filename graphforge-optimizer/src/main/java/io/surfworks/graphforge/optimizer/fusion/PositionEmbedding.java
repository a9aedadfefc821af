package io.surfworks.graphforge.optimizer.fusion;

import java.util.List;

import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.GraphUtils;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorData;
import io.surfworks.graphforge.graph.TensorShape;

/**
 * The position embedding table found for a fusion candidate, plus the nodes that
 * computed the position lookup and go away with the fusion.
 *
 * <p>Exactly one of {@code table} and {@code extracted} is set. {@code extracted} is a
 * table sliced out of a constant-folded (batch, sequence, hidden) initializer; it is
 * only registered in the graph by {@link #materialize} once the whole candidate has
 * been validated.
 *
 * @param table existing (vocabulary, hidden) table read by the position Gather
 * @param extracted (sequence, hidden) table not yet registered as an initializer
 * @param nodes position subgraph nodes to remove, in match order
 */
record PositionEmbedding(NodeArg table, TensorData extracted, List<Node> nodes) {

    PositionEmbedding {
        if ((table == null) == (extracted == null)) {
            throw new IllegalArgumentException("Exactly one of table and extracted must be set");
        }
        nodes = List.copyOf(nodes);
    }

    static PositionEmbedding gathered(NodeArg table, List<Node> nodes) {
        return new PositionEmbedding(table, null, nodes);
    }

    static PositionEmbedding folded(TensorData extracted) {
        return new PositionEmbedding(null, extracted, List.of());
    }

    TensorShape shape() {
        return table != null ? table.shape() : extracted.shape();
    }

    /**
     * Returns the value to feed the fused node, registering the extracted table if needed.
     */
    NodeArg materialize(Graph graph) {
        return table != null ? table : GraphUtils.addInitializer(graph, extracted);
    }
}
