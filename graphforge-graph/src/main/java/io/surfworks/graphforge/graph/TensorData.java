package io.surfworks.graphforge.graph;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * Payload of an initializer: a named constant tensor stored as little-endian raw bytes.
 *
 * <p>Construction validates the payload against the declared dims. A byte length that
 * does not match the element count, or an element count that cannot be indexed with
 * an {@code int}, is structural corruption and raises {@link GraphException}.
 */
public final class TensorData {

    private final String name;
    private final ElementType elementType;
    private final long[] dims;
    private final byte[] rawData;

    public TensorData(String name, ElementType elementType, long[] dims, byte[] rawData) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(elementType, "elementType cannot be null");
        Objects.requireNonNull(dims, "dims cannot be null");
        Objects.requireNonNull(rawData, "rawData cannot be null");
        if (elementType == ElementType.STRING) {
            throw new IllegalArgumentException("String tensors are not supported as raw data: " + name);
        }
        long count = elementCount(name, dims);
        if (count * elementType.byteSize() > Integer.MAX_VALUE) {
            throw new GraphException("Initializer " + name + " is too large: " + count + " elements");
        }
        if (rawData.length != count * elementType.byteSize()) {
            throw new GraphException(String.format(
                    "Initializer %s has %d bytes but dims %s of %s need %d",
                    name, rawData.length, Arrays.toString(dims), elementType, count * elementType.byteSize()));
        }
        this.name = name;
        this.elementType = elementType;
        this.dims = dims.clone();
        this.rawData = rawData.clone();
    }

    // ==================== Factories ====================

    public static TensorData ofLongs(String name, long[] dims, long... values) {
        ByteBuffer buf = allocate(values.length * 8);
        for (long v : values) {
            buf.putLong(v);
        }
        return new TensorData(name, ElementType.INT64, dims, buf.array());
    }

    public static TensorData ofInts(String name, long[] dims, int... values) {
        ByteBuffer buf = allocate(values.length * 4);
        for (int v : values) {
            buf.putInt(v);
        }
        return new TensorData(name, ElementType.INT32, dims, buf.array());
    }

    public static TensorData ofFloats(String name, long[] dims, float... values) {
        ByteBuffer buf = allocate(values.length * 4);
        for (float v : values) {
            buf.putFloat(v);
        }
        return new TensorData(name, ElementType.FLOAT, dims, buf.array());
    }

    /**
     * Scalar (rank 0) INT64 tensor.
     */
    public static TensorData scalar(String name, long value) {
        return ofLongs(name, new long[0], value);
    }

    // ==================== Accessors ====================

    public String name() {
        return name;
    }

    public ElementType elementType() {
        return elementType;
    }

    public long[] dims() {
        return dims.clone();
    }

    public int rank() {
        return dims.length;
    }

    public long dim(int i) {
        return dims[i];
    }

    public int elementCount() {
        return (int) elementCount(name, dims);
    }

    public byte[] rawData() {
        return rawData.clone();
    }

    public TensorShape shape() {
        return TensorShape.of(dims);
    }

    /**
     * Reads integer elements, widening INT32 to long.
     *
     * @throws IllegalStateException if the element type is not INT32 or INT64
     */
    public long[] longs() {
        ByteBuffer buf = ByteBuffer.wrap(rawData).order(ByteOrder.LITTLE_ENDIAN);
        long[] out = new long[elementCount()];
        switch (elementType) {
            case INT64 -> {
                for (int i = 0; i < out.length; i++) {
                    out[i] = buf.getLong();
                }
            }
            case INT32 -> {
                for (int i = 0; i < out.length; i++) {
                    out[i] = buf.getInt();
                }
            }
            default -> throw new IllegalStateException(name + " is not an integer tensor: " + elementType);
        }
        return out;
    }

    /**
     * Reads FLOAT elements.
     *
     * @throws IllegalStateException if the element type is not FLOAT
     */
    public float[] floats() {
        if (elementType != ElementType.FLOAT) {
            throw new IllegalStateException(name + " is not a float tensor: " + elementType);
        }
        ByteBuffer buf = ByteBuffer.wrap(rawData).order(ByteOrder.LITTLE_ENDIAN);
        float[] out = new float[elementCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = buf.getFloat();
        }
        return out;
    }

    /**
     * Raw bytes of {@code count} elements starting at element {@code from}.
     */
    public byte[] elementBytes(int from, int count) {
        int size = elementType.byteSize();
        if (from < 0 || count < 0 || (long) from + count > elementCount()) {
            throw new IndexOutOfBoundsException(
                    "Elements [" + from + ", " + ((long) from + count) + ") out of range for " + name);
        }
        return Arrays.copyOfRange(rawData, from * size, (from + count) * size);
    }

    /**
     * Same bytes under new dims. The element count must not change.
     */
    public TensorData withDims(long... newDims) {
        return new TensorData(name, elementType, newDims, rawData);
    }

    public TensorData withName(String newName) {
        return new TensorData(newName, elementType, dims, rawData);
    }

    private static long elementCount(String name, long[] dims) {
        long count = 1;
        for (long d : dims) {
            if (d < 0) {
                throw new GraphException("Initializer " + name + " has negative dimension " + d);
            }
            count = Math.multiplyExact(count, d);
            if (count > Integer.MAX_VALUE) {
                throw new GraphException("Initializer " + name + " element count out of range");
            }
        }
        return count;
    }

    private static ByteBuffer allocate(int bytes) {
        return ByteBuffer.allocate(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorData that)) return false;
        return name.equals(that.name) &&
               elementType == that.elementType &&
               Arrays.equals(dims, that.dims) &&
               Arrays.equals(rawData, that.rawData);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + elementType.hashCode();
        result = 31 * result + Arrays.hashCode(dims);
        result = 31 * result + Arrays.hashCode(rawData);
        return result;
    }

    @Override
    public String toString() {
        return "TensorData[name=" + name + ", type=" + elementType + ", dims=" + Arrays.toString(dims) + "]";
    }
}
