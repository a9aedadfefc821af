package io.surfworks.graphforge.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * One operator instance in a {@link Graph}.
 *
 * <p>A node is identified by a stable index that is never reused within its graph.
 * Inputs and outputs are ordered {@link NodeArg} slots; edges are not stored on the
 * node but derived by the owning graph from these slots. Structural changes go through
 * the graph so its producer/consumer bookkeeping stays consistent.
 */
public final class Node {

    private final Graph graph;
    private final int index;
    private final String name;
    private final String opType;
    private final String domain;
    private final int sinceVersion;
    private final String description;
    private final List<NodeArg> inputDefs;
    private final List<NodeArg> outputDefs;
    private final Map<String, Attribute> attributes;
    private String executionProviderType;

    Node(Graph graph, int index, String name, String opType, String domain, int sinceVersion,
         String description, List<NodeArg> inputDefs, List<NodeArg> outputDefs,
         Map<String, Attribute> attributes) {
        this.graph = graph;
        this.index = index;
        this.name = name;
        this.opType = opType;
        this.domain = domain == null ? Domains.ONNX : domain;
        this.sinceVersion = sinceVersion;
        this.description = description == null ? "" : description;
        this.inputDefs = new ArrayList<>(inputDefs);
        this.outputDefs = new ArrayList<>(outputDefs);
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public Graph graph() {
        return graph;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public String opType() {
        return opType;
    }

    public String domain() {
        return domain;
    }

    /**
     * Operator-set version the operator's schema was introduced in.
     */
    public int sinceVersion() {
        return sinceVersion;
    }

    public String description() {
        return description;
    }

    public List<NodeArg> inputDefs() {
        return Collections.unmodifiableList(inputDefs);
    }

    public List<NodeArg> outputDefs() {
        return Collections.unmodifiableList(outputDefs);
    }

    public NodeArg inputDef(int slot) {
        return inputDefs.get(slot);
    }

    public NodeArg outputDef(int slot) {
        return outputDefs.get(slot);
    }

    public Map<String, Attribute> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Optional<Attribute> attribute(String attrName) {
        return Optional.ofNullable(attributes.get(attrName));
    }

    public void addAttribute(String attrName, Attribute value) {
        attributes.put(attrName, value);
    }

    /**
     * Execution provider this node is assigned to, or null if unassigned.
     */
    public String executionProviderType() {
        return executionProviderType;
    }

    public void setExecutionProviderType(String providerType) {
        this.executionProviderType = providerType;
    }

    /**
     * Nested graphs owned by this node's attributes, in attribute order.
     */
    public List<Graph> subgraphs() {
        List<Graph> result = new ArrayList<>();
        for (Attribute attr : attributes.values()) {
            result.addAll(attr.subgraphs());
        }
        return result;
    }

    public boolean containsSubgraph() {
        for (Attribute attr : attributes.values()) {
            if (!attr.subgraphs().isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Names of outer-scope values consumed inside this node's nested graphs, sorted.
     */
    public List<String> implicitInputNames() {
        if (!containsSubgraph()) {
            return List.of();
        }
        Set<String> names = new TreeSet<>();
        for (Graph subgraph : subgraphs()) {
            names.addAll(subgraph.outerScopeReferences());
        }
        return new ArrayList<>(names);
    }

    void setInputDef(int slot, NodeArg arg) {
        inputDefs.set(slot, arg);
    }

    @Override
    public String toString() {
        return String.format("Node[%d, %s, %s:%s(%d), inputs=%s, outputs=%s]",
                index, name, domain.isEmpty() ? "onnx" : domain, opType, sinceVersion,
                inputDefs.stream().map(NodeArg::name).toList(),
                outputDefs.stream().map(NodeArg::name).toList());
    }
}
