package io.surfworks.graphforge.optimizer;

/**
 * Checked exception for a fatal failure during an optimization run.
 *
 * <p>Raised when a transformer finds the graph in a state it cannot safely rewrite,
 * for example an index that does not fit the representable range. A pattern that
 * simply does not match is never reported this way.
 */
public class OptimizationException extends Exception {

    private final String transformer;

    public OptimizationException(String message) {
        super(message);
        this.transformer = null;
    }

    public OptimizationException(String message, Throwable cause) {
        super(message, cause);
        this.transformer = null;
    }

    public OptimizationException(String transformer, String message) {
        super(transformer + ": " + message);
        this.transformer = transformer;
    }

    public OptimizationException(String transformer, String message, Throwable cause) {
        super(transformer + ": " + message, cause);
        this.transformer = transformer;
    }

    /**
     * Returns the transformer or rule that failed (may be null).
     */
    public String transformer() {
        return transformer;
    }
}
