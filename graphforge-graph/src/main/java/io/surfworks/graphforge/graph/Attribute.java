package io.surfworks.graphforge.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed node attribute.
 *
 * <p>Graph-valued attributes own nested graphs (control-flow bodies such as the
 * branches of {@code If} or the body of {@code Loop}).
 */
public sealed interface Attribute permits
        Attribute.IntAttr, Attribute.FloatAttr, Attribute.StringAttr,
        Attribute.IntsAttr, Attribute.FloatsAttr, Attribute.StringsAttr,
        Attribute.GraphAttr, Attribute.GraphsAttr {

    enum Type { INT, FLOAT, STRING, INTS, FLOATS, STRINGS, GRAPH, GRAPHS }

    Type type();

    /**
     * Nested graphs owned by this attribute (empty unless GRAPH or GRAPHS).
     */
    default List<Graph> subgraphs() {
        return List.of();
    }

    static Attribute of(long value) {
        return new IntAttr(value);
    }

    static Attribute of(float value) {
        return new FloatAttr(value);
    }

    static Attribute of(String value) {
        return new StringAttr(value);
    }

    static Attribute ofInts(long... values) {
        List<Long> list = new ArrayList<>(values.length);
        for (long v : values) {
            list.add(v);
        }
        return new IntsAttr(list);
    }

    static Attribute of(Graph graph) {
        return new GraphAttr(graph);
    }

    record IntAttr(long value) implements Attribute {
        @Override
        public Type type() {
            return Type.INT;
        }
    }

    record FloatAttr(float value) implements Attribute {
        @Override
        public Type type() {
            return Type.FLOAT;
        }
    }

    record StringAttr(String value) implements Attribute {
        @Override
        public Type type() {
            return Type.STRING;
        }
    }

    record IntsAttr(List<Long> values) implements Attribute {
        public IntsAttr {
            values = List.copyOf(values);
        }

        @Override
        public Type type() {
            return Type.INTS;
        }
    }

    record FloatsAttr(List<Float> values) implements Attribute {
        public FloatsAttr {
            values = List.copyOf(values);
        }

        @Override
        public Type type() {
            return Type.FLOATS;
        }
    }

    record StringsAttr(List<String> values) implements Attribute {
        public StringsAttr {
            values = List.copyOf(values);
        }

        @Override
        public Type type() {
            return Type.STRINGS;
        }
    }

    record GraphAttr(Graph graph) implements Attribute {
        @Override
        public Type type() {
            return Type.GRAPH;
        }

        @Override
        public List<Graph> subgraphs() {
            return List.of(graph);
        }
    }

    record GraphsAttr(List<Graph> graphs) implements Attribute {
        public GraphsAttr {
            graphs = List.copyOf(graphs);
        }

        @Override
        public Type type() {
            return Type.GRAPHS;
        }

        @Override
        public List<Graph> subgraphs() {
            return graphs;
        }
    }
}
