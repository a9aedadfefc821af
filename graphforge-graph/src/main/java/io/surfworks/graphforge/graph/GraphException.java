package io.surfworks.graphforge.graph;

/**
 * Thrown when the graph is structurally corrupt or a mutation would break its invariants.
 *
 * <p>This is never a "pattern did not match" signal. It means the graph can no
 * longer be trusted and the optimization run must stop.
 */
public class GraphException extends RuntimeException {

    public GraphException(String message) {
        super(message);
    }

    public GraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
