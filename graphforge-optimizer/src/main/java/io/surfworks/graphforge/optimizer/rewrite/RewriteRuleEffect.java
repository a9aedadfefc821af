package io.surfworks.graphforge.optimizer.rewrite;

/**
 * What a {@link RewriteRule} did to the node it was applied to.
 */
public enum RewriteRuleEffect {
    /** Nothing changed. */
    NONE,
    /** The graph changed and the current node is still alive. */
    UPDATED_CURRENT_NODE,
    /** The current node was removed; its index must not be used again. */
    REMOVED_CURRENT_NODE
}
