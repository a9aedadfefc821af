package io.surfworks.graphforge.graph;

/**
 * A single tensor dimension.
 *
 * <p>A dimension is concrete ({@code value >= 0}), symbolic (a named parameter such as
 * {@code batch_size} whose value is only known at run time) or entirely unknown.
 *
 * @param value the concrete size, or -1 when not concrete
 * @param param the symbolic parameter name, or null
 */
public record Dim(long value, String param) {

    private static final Dim UNKNOWN = new Dim(-1, null);

    public Dim {
        if (value < -1) {
            throw new IllegalArgumentException("Dimension value must be >= 0, got " + value);
        }
        if (value >= 0 && param != null) {
            throw new IllegalArgumentException("A dimension is either concrete or symbolic");
        }
    }

    public static Dim of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Dimension value must be >= 0, got " + value);
        }
        return new Dim(value, null);
    }

    public static Dim symbolic(String param) {
        if (param == null || param.isEmpty()) {
            throw new IllegalArgumentException("Symbolic dimension needs a parameter name");
        }
        return new Dim(-1, param);
    }

    public static Dim unknown() {
        return UNKNOWN;
    }

    public boolean hasValue() {
        return value >= 0;
    }

    public boolean isSymbolic() {
        return param != null;
    }

    @Override
    public String toString() {
        if (hasValue()) {
            return Long.toString(value);
        }
        return param != null ? param : "?";
    }
}
