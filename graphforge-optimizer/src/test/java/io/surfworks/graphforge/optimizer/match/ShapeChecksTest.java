package io.surfworks.graphforge.optimizer.match;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.surfworks.graphforge.graph.Dim;
import io.surfworks.graphforge.graph.ElementType;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorShape;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ShapeChecks")
class ShapeChecksTest {

    @Test
    @DisplayName("concrete dims match by value")
    void concreteDims() {
        assertTrue(ShapeChecks.sameShape(TensorShape.of(2, 3), TensorShape.of(2, 3)));
        assertFalse(ShapeChecks.sameShape(TensorShape.of(2, 3), TensorShape.of(3, 2)));
        assertFalse(ShapeChecks.sameShape(TensorShape.of(2, 3), TensorShape.of(2, 3, 1)));
    }

    @Test
    @DisplayName("symbolic dims match only by parameter name")
    void symbolicDims() {
        TensorShape a = TensorShape.of(Dim.symbolic("batch"), Dim.symbolic("seq"));
        assertTrue(ShapeChecks.sameShape(a, TensorShape.of(Dim.symbolic("batch"), Dim.symbolic("seq"))));
        assertFalse(ShapeChecks.sameShape(a, TensorShape.of(Dim.symbolic("batch"), Dim.symbolic("len"))));
        assertFalse(ShapeChecks.sameShape(a, TensorShape.of(Dim.symbolic("batch"), Dim.of(3))));
    }

    @Test
    @DisplayName("unknown dims and unknown shapes never match")
    void unknownFailsClosed() {
        TensorShape unknown = TensorShape.of(Dim.of(2), Dim.unknown());
        assertFalse(ShapeChecks.sameShape(unknown, unknown));
        assertFalse(ShapeChecks.sameShape((TensorShape) null, TensorShape.of(2)));
    }

    @Test
    @DisplayName("checks one concrete dimension of a value")
    void hasDimValue() {
        NodeArg gamma = new NodeArg("gamma", ElementType.FLOAT, TensorShape.of(768));
        assertTrue(ShapeChecks.hasDimValue(gamma, 1, 0, 768));
        assertFalse(ShapeChecks.hasDimValue(gamma, 2, 0, 768));
        assertFalse(ShapeChecks.hasDimValue(new NodeArg("x", ElementType.FLOAT, null), 1, 0, 768));
    }
}
