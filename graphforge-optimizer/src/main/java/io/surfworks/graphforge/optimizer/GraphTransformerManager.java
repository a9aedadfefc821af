package io.surfworks.graphforge.optimizer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.surfworks.graphforge.graph.Graph;
import io.surfworks.graphforge.optimizer.jfr.GraphTransformEvent;

/**
 * Applies registered transformers level by level until the graph stops changing.
 *
 * <p>For one level, a sweep runs every transformer registered at that level in
 * registration order. Sweeps repeat until one of them changes nothing or
 * {@code maxSteps} sweeps have run. Transformers that should only apply once are
 * skipped after the first sweep.
 *
 * <p>Each application is committed as a {@link GraphTransformEvent}.
 *
 * <p>Example:
 * <pre>{@code
 * GraphTransformerManager manager = new GraphTransformerManager(5);
 * manager.register(new EmbedLayerNormFusion(Set.of("CPUExecutionProvider")), TransformerLevel.LEVEL2);
 * OptimizationReport report = manager.applyTransformers(graph, TransformerLevel.LEVEL2, logger);
 * }</pre>
 */
public final class GraphTransformerManager {

    private final int maxSteps;
    private final Map<TransformerLevel, List<GraphTransformer>> transformers = new EnumMap<>(TransformerLevel.class);
    private final Set<String> names = new HashSet<>();

    public GraphTransformerManager(int maxSteps) {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }
        this.maxSteps = maxSteps;
    }

    public int maxSteps() {
        return maxSteps;
    }

    /**
     * Registers a transformer at a level.
     *
     * @throws IllegalArgumentException if a transformer with the same name is already registered
     */
    public GraphTransformerManager register(GraphTransformer transformer, TransformerLevel level) {
        if (!names.add(transformer.name())) {
            throw new IllegalArgumentException("Transformer " + transformer.name() + " is already registered");
        }
        transformers.computeIfAbsent(level, k -> new ArrayList<>()).add(transformer);
        return this;
    }

    /**
     * Transformers registered at {@code level}, in registration order.
     */
    public List<GraphTransformer> transformers(TransformerLevel level) {
        return List.copyOf(transformers.getOrDefault(level, List.of()));
    }

    /**
     * Runs the transformers of one level to a fixed point or the step limit.
     *
     * @throws OptimizationException if a transformer fails; the graph may be partially rewritten
     */
    public OptimizationReport applyTransformers(Graph graph, TransformerLevel level, Logger logger)
            throws OptimizationException {
        List<GraphTransformer> levelTransformers = transformers.getOrDefault(level, List.of());
        List<OptimizationReport.Application> applications = new ArrayList<>();
        int nodesBefore = graph.nodeCount();
        int steps = 0;

        for (int step = 0; step < maxSteps && !levelTransformers.isEmpty(); step++) {
            steps++;
            boolean changed = false;
            for (GraphTransformer transformer : levelTransformers) {
                if (step > 0 && transformer.shouldOnlyApplyOnce()) {
                    continue;
                }
                changed |= applyOne(graph, transformer, level, step, applications, logger);
            }
            if (!changed) {
                break;
            }
        }

        if (graph.nodeCount() != nodesBefore) {
            logger.info(String.format("%s on %s: %d -> %d nodes in %d step(s)",
                    level, graph.name(), nodesBefore, graph.nodeCount(), steps));
        }
        return new OptimizationReport(graph.name(), nodesBefore, graph.nodeCount(), steps, applications);
    }

    private static boolean applyOne(Graph graph, GraphTransformer transformer, TransformerLevel level, int step,
                                    List<OptimizationReport.Application> applications, Logger logger)
            throws OptimizationException {
        int before = graph.nodeCount();
        GraphTransformEvent event = new GraphTransformEvent();
        event.begin();
        long start = System.nanoTime();

        boolean modified = transformer.apply(graph, logger);

        long durationMicros = (System.nanoTime() - start) / 1000;
        int after = graph.nodeCount();
        event.transformerName = transformer.name();
        event.level = level.name();
        event.step = step;
        event.modified = modified;
        event.nodesBefore = before;
        event.nodesAfter = after;
        event.commit();

        applications.add(new OptimizationReport.Application(
                transformer.name(), level, step, modified, before, after, durationMicros));
        if (modified) {
            logger.fine(() -> String.format("%s modified %s at step %d (%d -> %d nodes)",
                    transformer.name(), graph.name(), step, before, after));
        }
        return modified;
    }
}
