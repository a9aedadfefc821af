package io.surfworks.graphforge.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Declared (possibly partially symbolic) shape of a value.
 */
public record TensorShape(List<Dim> dims) {

    public TensorShape {
        dims = List.copyOf(dims);
    }

    /**
     * Creates a fully concrete shape.
     */
    public static TensorShape of(long... dims) {
        List<Dim> list = new ArrayList<>(dims.length);
        for (long d : dims) {
            list.add(Dim.of(d));
        }
        return new TensorShape(list);
    }

    public static TensorShape of(Dim... dims) {
        return new TensorShape(Arrays.asList(dims));
    }

    public static TensorShape scalar() {
        return new TensorShape(List.of());
    }

    public int rank() {
        return dims.size();
    }

    public Dim dim(int i) {
        return dims.get(i);
    }

    public boolean hasDimValue(int i) {
        return i >= 0 && i < dims.size() && dims.get(i).hasValue();
    }

    /**
     * Concrete value of dimension {@code i}, or 0 when it is not concrete.
     */
    public long dimValue(int i) {
        Dim d = dims.get(i);
        return d.hasValue() ? d.value() : 0;
    }

    public boolean isFullyConcrete() {
        for (Dim d : dims) {
            if (!d.hasValue()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Converts to dimension sizes with -1 for every non-concrete dimension.
     */
    public long[] toLongArray() {
        long[] result = new long[dims.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = dims.get(i).value();
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < dims.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(dims.get(i));
        }
        return sb.append(")").toString();
    }
}
