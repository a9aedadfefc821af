package io.surfworks.graphforge.optimizer.match;

import io.surfworks.graphforge.graph.Dim;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorShape;

/**
 * Shape comparisons that fail closed: a dimension nobody can name is never assumed
 * to match.
 */
public final class ShapeChecks {

    private ShapeChecks() {} // Utility class

    /**
     * Two dimensions are the same if both are concrete and equal, or both are symbolic
     * with the same parameter name.
     */
    public static boolean sameDim(Dim a, Dim b) {
        if (a.hasValue() && b.hasValue()) {
            return a.value() == b.value();
        }
        return a.isSymbolic() && b.isSymbolic() && a.param().equals(b.param());
    }

    /**
     * Returns true if both shapes are known, have the same rank and every dimension
     * is the same per {@link #sameDim}.
     */
    public static boolean sameShape(TensorShape a, TensorShape b) {
        if (a == null || b == null || a.rank() != b.rank()) {
            return false;
        }
        for (int i = 0; i < a.rank(); i++) {
            if (!sameDim(a.dim(i), b.dim(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean sameShape(NodeArg a, NodeArg b) {
        return sameShape(a.shape(), b.shape());
    }

    /**
     * Returns true if the value has a known shape of the given rank whose dimension
     * {@code dim} is concrete and equal to {@code expected}.
     */
    public static boolean hasDimValue(NodeArg arg, int rank, int dim, long expected) {
        TensorShape shape = arg.shape();
        return shape != null
                && shape.rank() == rank
                && shape.hasDimValue(dim)
                && shape.dimValue(dim) == expected;
    }
}
