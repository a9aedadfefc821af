package io.surfworks.graphforge.graph;

/**
 * One end of a def/use edge, seen from the node on the other end.
 *
 * <p>For an input edge of node N, {@code node} is the producer, {@code srcArgIndex}
 * the producer's output slot and {@code dstArgIndex} N's input slot. For an output
 * edge of N, {@code node} is the consumer and the indices keep the same meaning:
 * N's output slot and the consumer's input slot.
 *
 * @param node the node at the far end of the edge
 * @param srcArgIndex output slot on the producing side
 * @param dstArgIndex input slot on the consuming side
 */
public record EdgeEnd(Node node, int srcArgIndex, int dstArgIndex) {

    @Override
    public String toString() {
        return String.format("EdgeEnd[%s#%d, src=%d, dst=%d]",
                node.opType(), node.index(), srcArgIndex, dstArgIndex);
    }
}
