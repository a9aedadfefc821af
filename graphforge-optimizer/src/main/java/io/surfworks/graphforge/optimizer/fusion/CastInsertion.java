package io.surfworks.graphforge.optimizer.fusion;

import java.util.List;
import java.util.Map;

import io.surfworks.graphforge.graph.Attribute;
import io.surfworks.graphforge.graph.Domains;
import io.surfworks.graphforge.graph.ElementType;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorShape;

/**
 * Inserts {@code Cast} nodes that adapt index tensors to the element type a fused
 * operator expects.
 */
public final class CastInsertion {

    static final int CAST_SINCE_VERSION = 9;

    private CastInsertion() {} // Utility class

    /**
     * Returns a 2-D INT32 view of {@code input}.
     *
     * <p>If the input already is INT32 it is returned unchanged. Otherwise a new
     * {@code Cast(to=INT32)} node is added whose output keeps the first two dimensions
     * of the input, and that output is returned.
     *
     * @param providerType execution provider assigned to the new node (may be null)
     */
    public static NodeArg castToInt32(Graph graph, NodeArg input, String providerType) {
        if (input.elementType() == ElementType.INT32) {
            return input;
        }
        TensorShape inputShape = input.shape();
        TensorShape castShape = inputShape == null || inputShape.rank() < 2
                ? null
                : new TensorShape(List.of(inputShape.dim(0), inputShape.dim(1)));

        NodeArg cast32 = graph.getOrCreateNodeArg(
                graph.generateNodeArgName(input.name() + "_Int32"), ElementType.INT32, castShape);

        Node cast = graph.addNode(
                graph.generateNodeName(input.name() + "_Cast"),
                "Cast",
                "Cast Input from int64 to int32",
                List.of(input),
                List.of(cast32),
                Map.of("to", Attribute.of((long) ElementType.INT32.code())),
                Domains.ONNX,
                CAST_SINCE_VERSION);
        cast.setExecutionProviderType(providerType);
        return cast32;
    }
}
