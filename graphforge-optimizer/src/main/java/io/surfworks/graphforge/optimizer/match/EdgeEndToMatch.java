package io.surfworks.graphforge.optimizer.match;

import java.util.Set;

import io.surfworks.graphforge.graph.Domains;

/**
 * One step of a path to match: the edge slots to follow and the operator expected
 * at the other end.
 *
 * <p>Example, matching {@code Shape -> Gather} upward from a Gather:
 * <pre>{@code
 * new EdgeEndToMatch(0, 0, "Shape", Set.of(1), Domains.ONNX)
 * }</pre>
 *
 * @param srcArgIndex output slot of the producing node
 * @param dstArgIndex input slot of the consuming node
 * @param opType expected operator type of the node reached
 * @param versions accepted since-versions of that node
 * @param domain expected operator domain
 */
public record EdgeEndToMatch(int srcArgIndex, int dstArgIndex, String opType, Set<Integer> versions, String domain) {

    public EdgeEndToMatch {
        versions = Set.copyOf(versions);
    }

    /**
     * Step on the default operator domain.
     */
    public static EdgeEndToMatch onnx(int srcArgIndex, int dstArgIndex, String opType, Integer... versions) {
        return new EdgeEndToMatch(srcArgIndex, dstArgIndex, opType, Set.of(versions), Domains.ONNX);
    }

    @Override
    public String toString() {
        return String.format("%s%s[src=%d, dst=%d]", opType, versions, srcArgIndex, dstArgIndex);
    }
}
