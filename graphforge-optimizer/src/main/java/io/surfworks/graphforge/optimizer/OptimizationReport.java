package io.surfworks.graphforge.optimizer;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Outcome of an optimization run: every transformer application in order, plus the
 * node count of the main graph before and after.
 *
 * @param graphName name of the optimized graph
 * @param nodesBefore live nodes before the run
 * @param nodesAfter live nodes after the run
 * @param stepsRun sweeps executed, summed over levels
 * @param applications one record per transformer application
 */
public record OptimizationReport(
        String graphName,
        int nodesBefore,
        int nodesAfter,
        int stepsRun,
        List<Application> applications
) {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    public OptimizationReport {
        applications = List.copyOf(applications);
    }

    /**
     * One application of a transformer within a sweep.
     *
     * @param transformer transformer name
     * @param level level it is registered at
     * @param step zero-based sweep index within the level
     * @param modified whether the graph changed
     * @param nodesBefore live nodes before the application
     * @param nodesAfter live nodes after the application
     * @param durationMicros wall time of the application
     */
    public record Application(
            String transformer,
            TransformerLevel level,
            int step,
            boolean modified,
            int nodesBefore,
            int nodesAfter,
            long durationMicros
    ) {}

    /**
     * Concatenates per-level reports of the same graph, in order.
     */
    public static OptimizationReport combine(String graphName, List<OptimizationReport> reports) {
        if (reports.isEmpty()) {
            throw new IllegalArgumentException("No reports to combine for " + graphName);
        }
        List<Application> all = new ArrayList<>();
        int steps = 0;
        for (OptimizationReport report : reports) {
            all.addAll(report.applications());
            steps += report.stepsRun();
        }
        return new OptimizationReport(graphName,
                reports.get(0).nodesBefore(),
                reports.get(reports.size() - 1).nodesAfter(),
                steps,
                all);
    }

    /**
     * Returns true if any application changed the graph.
     */
    public boolean modified() {
        for (Application app : applications) {
            if (app.modified()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of applications of {@code transformer} that changed the graph.
     */
    public int modifiedCount(String transformer) {
        int count = 0;
        for (Application app : applications) {
            if (app.modified() && app.transformer().equals(transformer)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Pretty-printed JSON rendering, for logs and tooling.
     */
    public String toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("graph", graphName);
        root.addProperty("nodesBefore", nodesBefore);
        root.addProperty("nodesAfter", nodesAfter);
        root.addProperty("stepsRun", stepsRun);
        root.addProperty("modified", modified());

        JsonArray apps = new JsonArray();
        for (Application app : applications) {
            JsonObject entry = new JsonObject();
            entry.addProperty("transformer", app.transformer());
            entry.addProperty("level", app.level().name());
            entry.addProperty("step", app.step());
            entry.addProperty("modified", app.modified());
            entry.addProperty("nodesBefore", app.nodesBefore());
            entry.addProperty("nodesAfter", app.nodesAfter());
            entry.addProperty("durationMicros", app.durationMicros());
            apps.add(entry);
        }
        root.add("applications", apps);
        return GSON.toJson(root);
    }

    @Override
    public String toString() {
        return String.format("OptimizationReport[graph=%s, nodes=%d->%d, steps=%d, applications=%d]",
                graphName, nodesBefore, nodesAfter, stepsRun, applications.size());
    }
}
