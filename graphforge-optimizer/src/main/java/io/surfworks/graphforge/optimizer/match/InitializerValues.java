package io.surfworks.graphforge.optimizer.match;

import java.util.List;
import java.util.Optional;

import io.surfworks.graphforge.graph.ElementType;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorData;
import io.surfworks.graphforge.graph.TensorShape;

/**
 * Checks on the values held by initializers, used to gate pattern steps on constants
 * such as "the indices input of this Gather is the scalar 1".
 */
public final class InitializerValues {

    private static final float FLOAT_TOLERANCE = 1e-6f;

    private InitializerValues() {} // Utility class

    /**
     * Returns true if the value is declared as a scalar: rank 0, or rank 1 with a single
     * element. Unknown shapes are not scalars.
     */
    public static boolean isScalar(NodeArg arg) {
        TensorShape shape = arg.shape();
        if (shape == null) {
            return false;
        }
        return shape.rank() == 0 || (shape.rank() == 1 && shape.hasDimValue(0) && shape.dimValue(0) == 1);
    }

    /**
     * Returns true if {@code arg} is a scalar integer initializer equal to {@code expected}.
     *
     * @param requireConstant only accept initializers that cannot be overridden at run time
     */
    public static boolean isInitializerWithExpectedValue(Graph graph, NodeArg arg, long expected,
                                                         boolean requireConstant) {
        Optional<TensorData> tensor = scalarInitializer(graph, arg, requireConstant);
        if (tensor.isEmpty()) {
            return false;
        }
        ElementType type = tensor.get().elementType();
        if (type != ElementType.INT64 && type != ElementType.INT32) {
            return false;
        }
        return tensor.get().longs()[0] == expected;
    }

    /**
     * Returns true if {@code arg} is a scalar FLOAT initializer within 1e-6 of {@code expected}.
     */
    public static boolean isInitializerWithExpectedValue(Graph graph, NodeArg arg, float expected,
                                                         boolean requireConstant) {
        Optional<TensorData> tensor = scalarInitializer(graph, arg, requireConstant);
        if (tensor.isEmpty() || tensor.get().elementType() != ElementType.FLOAT) {
            return false;
        }
        return Math.abs(tensor.get().floats()[0] - expected) < FLOAT_TOLERANCE;
    }

    /**
     * Appends the elements of a constant INT64/INT32 initializer to {@code data}.
     *
     * @return false if the value is not such an initializer
     */
    public static boolean appendTensorFromInitializer(Graph graph, NodeArg arg, List<Long> data) {
        Optional<TensorData> tensor = graph.constantInitializer(arg.name(), true);
        if (tensor.isEmpty()) {
            return false;
        }
        ElementType type = tensor.get().elementType();
        if (type != ElementType.INT64 && type != ElementType.INT32) {
            return false;
        }
        for (long v : tensor.get().longs()) {
            data.add(v);
        }
        return true;
    }

    private static Optional<TensorData> scalarInitializer(Graph graph, NodeArg arg, boolean requireConstant) {
        if (!isScalar(arg)) {
            return Optional.empty();
        }
        Optional<TensorData> tensor = requireConstant
                ? graph.constantInitializer(arg.name(), true)
                : graph.initializer(arg.name());
        if (tensor.isEmpty() || tensor.get().elementCount() != 1) {
            return Optional.empty();
        }
        return tensor;
    }
}
