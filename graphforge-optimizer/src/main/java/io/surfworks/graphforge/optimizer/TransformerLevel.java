package io.surfworks.graphforge.optimizer;

/**
 * Optimization levels. Transformers are registered against one level and levels are
 * applied in ascending order.
 */
public enum TransformerLevel {
    /** Transformers required for correctness, always applied. */
    DEFAULT,
    /** Provider-independent rewrites such as constant re-shaping. */
    LEVEL1,
    /** Provider-specific fusions. */
    LEVEL2,
    /** Layout-level rewrites. */
    LEVEL3
}
