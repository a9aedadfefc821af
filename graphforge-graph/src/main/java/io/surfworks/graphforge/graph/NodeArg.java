package io.surfworks.graphforge.graph;

import java.util.Objects;

/**
 * A named, typed and shaped value slot: the unit of a def/use edge.
 *
 * <p>A NodeArg has exactly one producer (a node output, a graph input or an
 * initializer) and any number of consumers. Identity is by name within a graph.
 * The element type and shape may be unknown ({@code null}). The shape is mutable
 * so a rewrite that re-shapes a constant can keep the declared shape in sync.
 */
public final class NodeArg {

    private final String name;
    private final ElementType elementType;
    private TensorShape shape;

    public NodeArg(String name, ElementType elementType, TensorShape shape) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("NodeArg name cannot be empty");
        }
        this.name = name;
        this.elementType = elementType;
        this.shape = shape;
    }

    public String name() {
        return name;
    }

    /**
     * Element type, or null if unknown.
     */
    public ElementType elementType() {
        return elementType;
    }

    /**
     * Declared shape, or null if unknown.
     */
    public TensorShape shape() {
        return shape;
    }

    public void setShape(TensorShape shape) {
        this.shape = shape;
    }

    public boolean hasType() {
        return elementType != null;
    }

    @Override
    public String toString() {
        return name + ":" + (elementType == null ? "?" : elementType) + (shape == null ? "(?)" : shape);
    }
}
