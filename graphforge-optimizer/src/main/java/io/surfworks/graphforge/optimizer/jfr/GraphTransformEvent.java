package io.surfworks.graphforge.optimizer.jfr;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event recording one application of a graph transformer.
 *
 * <p>Usage:
 * <pre>{@code
 * GraphTransformEvent event = new GraphTransformEvent();
 * event.begin();
 * boolean modified = transformer.apply(graph, logger);
 * event.transformerName = transformer.name();
 * event.level = "LEVEL2";
 * event.step = 0;
 * event.modified = modified;
 * event.nodesBefore = before;
 * event.nodesAfter = graph.nodeCount();
 * event.commit();
 * }</pre>
 */
@Name("io.surfworks.graphforge.GraphTransform")
@Label("Graph Transform")
@Category({"GraphForge", "Optimizer"})
@Description("Records one graph transformer application and its effect on the node count")
public class GraphTransformEvent extends Event {

    @Label("Transformer")
    @Description("Name of the applied transformer")
    public String transformerName;

    @Label("Level")
    @Description("Optimization level the transformer is registered at")
    public String level;

    @Label("Step")
    @Description("Zero-based sweep of the fixed-point loop")
    public int step;

    @Label("Modified")
    @Description("Whether the transformer changed the graph")
    public boolean modified;

    @Label("Nodes Before")
    @Description("Live node count of the main graph before the application")
    public int nodesBefore;

    @Label("Nodes After")
    @Description("Live node count of the main graph after the application")
    public int nodesAfter;
}
