package io.surfworks.graphforge.optimizer.rewrite;

import java.util.List;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Attribute;
import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.graph.GraphUtils;
import io.surfworks.graphforge.graph.Node;
import io.surfworks.graphforge.graph.NodeArg;
import io.surfworks.graphforge.graph.TensorData;
import io.surfworks.graphforge.optimizer.OptimizationException;

/**
 * Folds an {@code Unsqueeze} of a constant initializer into the initializer itself.
 *
 * <p>The initializer is replaced under the same name by a copy whose dims have a 1
 * inserted at every axis listed in the node's {@code axes} attribute. The Unsqueeze is
 * then removed and its consumers read the reshaped initializer directly.
 *
 * <pre>
 *   W[768] --Unsqueeze(axes=[0])--> X --> consumer
 * becomes
 *   W[1,768] --> consumer
 * </pre>
 */
public final class UnsqueezeElimination implements RewriteRule {

    public static final String NAME = "EliminateUnsqueeze";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> targetOpTypes() {
        return List.of("Unsqueeze");
    }

    @Override
    public boolean satisfyCondition(Graph graph, Node node, Logger logger) {
        if (node.inputDefs().isEmpty()) {
            return false;
        }
        if (!graph.isConstantInitializer(node.inputDef(0).name(), false)) {
            return false;
        }
        if (graph.isNodeOutputsInGraphOutputs(node)) {
            return false;
        }
        return GraphUtils.canRemoveNode(graph, node);
    }

    @Override
    public RewriteRuleEffect apply(Graph graph, Node node, Logger logger) throws OptimizationException {
        NodeArg inputDef = node.inputDef(0);
        TensorData tensor = graph.initializer(inputDef.name()).orElseThrow(() ->
                new OptimizationException(NAME, "initializer " + inputDef.name() + " disappeared"));

        if (!(node.attribute("axes").orElse(null) instanceof Attribute.IntsAttr axesAttr)) {
            logger.fine(() -> "Unsqueeze " + node.name() + " has no INTS axes attribute");
            return RewriteRuleEffect.NONE;
        }
        List<Long> axes = axesAttr.values();

        long outputRank = (long) axes.size() + tensor.rank();
        if (outputRank > Integer.MAX_VALUE) {
            throw new OptimizationException(NAME, "index out of range: output rank " + outputRank
                    + " of " + node.name());
        }
        long[] newDims = new long[(int) outputRank];
        boolean[] inserted = new boolean[newDims.length];
        for (long raw : axes) {
            long axis = raw < 0 ? raw + outputRank : raw;
            if (axis < 0 || axis >= outputRank) {
                throw new OptimizationException(NAME, String.format(
                        "index out of range: axis %d of %s for output rank %d", raw, node.name(), outputRank));
            }
            if (inserted[(int) axis]) {
                throw new OptimizationException(NAME, String.format(
                        "index out of range: axis %d of %s is repeated", raw, node.name()));
            }
            inserted[(int) axis] = true;
            newDims[(int) axis] = 1;
        }
        int next = 0;
        for (int i = 0; i < newDims.length; i++) {
            if (!inserted[i]) {
                newDims[i] = tensor.dim(next++);
            }
        }

        // TODO: when another node also consumes this initializer, register the reshaped
        // copy under graph.generateNodeArgName(...) instead of replacing it in place.
        TensorData reshaped = tensor.withDims(newDims);
        GraphUtils.replaceInitializer(graph, inputDef.name(), reshaped);
        inputDef.setShape(reshaped.shape());

        if (!GraphUtils.removeNode(graph, node)) {
            throw new OptimizationException(NAME, "could not remove " + node.name()
                    + " after folding it into " + inputDef.name());
        }
        logger.fine(() -> "Folded Unsqueeze " + node.name() + " into initializer " + inputDef.name());
        return RewriteRuleEffect.REMOVED_CURRENT_NODE;
    }
}
