package io.surfworks.graphforge.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * A mutable dataflow graph of tensor operations: one function body, either a model's
 * main graph or a nested graph owned by a control-flow node.
 *
 * <p>Nodes live in an arena addressed by stable indices. Removing a node leaves a
 * tombstone, so indices captured in a traversal snapshot stay valid (they simply
 * resolve to empty) and are never handed out again.
 *
 * <p>Def/use edges are derived from node input/output slots. The graph keeps two maps:
 * <ul>
 *   <li>value name → producing (node, output slot)</li>
 *   <li>value name → consuming node indices</li>
 * </ul>
 *
 * <p>Every value a live node consumes must resolve to a live producer, a graph input,
 * an initializer, or (for nested graphs) a value visible in an enclosing graph.
 * {@link #resolve()} checks this after a rewrite.
 *
 * <p>Example:
 * <pre>{@code
 * Graph graph = new Graph("main");
 * NodeArg x = graph.addInput(new NodeArg("x", ElementType.FLOAT, TensorShape.of(2, 8)));
 * NodeArg y = new NodeArg("y", ElementType.FLOAT, TensorShape.of(2, 8));
 * graph.addNode("relu0", "Relu", List.of(x), List.of(y), Domains.ONNX, 6);
 * graph.addOutput(y);
 * }</pre>
 *
 * <p>Not thread-safe. A graph is owned by one optimization run at a time.
 */
public final class Graph {

    private final String name;
    private final Graph parent;

    private final List<Node> nodes = new ArrayList<>();
    private int liveNodeCount;

    private final Map<String, NodeArg> nodeArgs = new HashMap<>();
    private final List<NodeArg> inputs = new ArrayList<>();
    private final List<NodeArg> outputs = new ArrayList<>();
    private final Map<String, TensorData> initializers = new LinkedHashMap<>();

    private final Map<String, ProducerSlot> producers = new HashMap<>();
    private final Map<String, Set<Integer>> consumers = new HashMap<>();

    private final Set<String> usedNodeNames = new HashSet<>();
    private int nameCounter;

    private record ProducerSlot(int nodeIndex, int outputIndex) {}

    /**
     * Creates a top-level graph.
     */
    public Graph(String name) {
        this(name, null);
    }

    /**
     * Creates a graph nested inside {@code parent}. Values not defined locally
     * are looked up in the enclosing graphs.
     */
    public Graph(String name, Graph parent) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.parent = parent;
    }

    public String name() {
        return name;
    }

    /**
     * Enclosing graph, or null for a top-level graph.
     */
    public Graph parent() {
        return parent;
    }

    // ==================== Inputs, outputs, values ====================

    public NodeArg addInput(NodeArg arg) {
        registerArg(arg);
        if (producers.containsKey(arg.name())) {
            throw new GraphException("Graph input " + arg.name() + " is already produced by a node");
        }
        inputs.add(arg);
        return arg;
    }

    public NodeArg addOutput(NodeArg arg) {
        registerArg(arg);
        outputs.add(arg);
        return arg;
    }

    public List<NodeArg> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<NodeArg> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    public boolean isGraphInput(String argName) {
        for (NodeArg in : inputs) {
            if (in.name().equals(argName)) {
                return true;
            }
        }
        return false;
    }

    public boolean isGraphOutput(String argName) {
        for (NodeArg out : outputs) {
            if (out.name().equals(argName)) {
                return true;
            }
        }
        return false;
    }

    public Optional<NodeArg> nodeArg(String argName) {
        return Optional.ofNullable(nodeArgs.get(argName));
    }

    /**
     * Returns the NodeArg with the given name, creating it if it does not exist yet.
     * An existing NodeArg is returned as-is even if its type differs.
     */
    public NodeArg getOrCreateNodeArg(String argName, ElementType type, TensorShape shape) {
        NodeArg existing = nodeArgs.get(argName);
        if (existing != null) {
            return existing;
        }
        NodeArg arg = new NodeArg(argName, type, shape);
        nodeArgs.put(argName, arg);
        return arg;
    }

    // ==================== Nodes ====================

    /**
     * Adds a node without attributes or description.
     */
    public Node addNode(String nodeName, String opType, List<NodeArg> inputDefs, List<NodeArg> outputDefs,
                        String domain, int sinceVersion) {
        return addNode(nodeName, opType, "", inputDefs, outputDefs, Map.of(), domain, sinceVersion);
    }

    /**
     * Adds a node.
     *
     * @throws GraphException if the name is taken, or an output is already produced
     *         by a live node, a graph input or an initializer
     */
    public Node addNode(String nodeName, String opType, String description,
                        List<NodeArg> inputDefs, List<NodeArg> outputDefs,
                        Map<String, Attribute> attributes, String domain, int sinceVersion) {
        Objects.requireNonNull(nodeName, "nodeName cannot be null");
        Objects.requireNonNull(opType, "opType cannot be null");
        if (usedNodeNames.contains(nodeName)) {
            throw new GraphException("Node name already used in graph " + name + ": " + nodeName);
        }
        for (NodeArg out : outputDefs) {
            if (producers.containsKey(out.name())) {
                Node producer = nodes.get(producers.get(out.name()).nodeIndex());
                throw new GraphException("Value " + out.name() + " is already produced by " + producer.name());
            }
            if (isGraphInput(out.name()) || initializers.containsKey(out.name())) {
                throw new GraphException("Value " + out.name() + " is a graph input or initializer");
            }
        }
        for (NodeArg in : inputDefs) {
            registerArg(in);
        }
        for (NodeArg out : outputDefs) {
            registerArg(out);
        }

        int index = nodes.size();
        Node node = new Node(this, index, nodeName, opType, domain, sinceVersion, description,
                inputDefs, outputDefs, attributes);
        nodes.add(node);
        liveNodeCount++;
        usedNodeNames.add(nodeName);

        for (int i = 0; i < outputDefs.size(); i++) {
            producers.put(outputDefs.get(i).name(), new ProducerSlot(index, i));
        }
        for (NodeArg in : inputDefs) {
            consumers.computeIfAbsent(in.name(), k -> new TreeSet<>()).add(index);
        }
        return node;
    }

    /**
     * Removes a node. All of its output edges must have been detached first.
     *
     * @throws GraphException if the node is unknown, already removed, or still has output edges
     */
    public void removeNode(int index) {
        Node node = requireNode(index);
        int edgeCount = outputEdgesCount(node);
        if (edgeCount > 0) {
            throw new GraphException(String.format(
                    "Cannot remove node %s (%s): it still has %d output edge(s)", node.name(), node.opType(), edgeCount));
        }
        for (NodeArg out : node.outputDefs()) {
            ProducerSlot slot = producers.get(out.name());
            if (slot != null && slot.nodeIndex() == index) {
                producers.remove(out.name());
            }
        }
        for (NodeArg in : node.inputDefs()) {
            removeConsumer(in.name(), index);
        }
        nodes.set(index, null);
        liveNodeCount--;
    }

    /**
     * Looks up a node by index. Empty if the index is unknown or the node was removed.
     */
    public Optional<Node> node(int index) {
        if (index < 0 || index >= nodes.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.get(index));
    }

    /**
     * Looks up a live node by index.
     *
     * @throws GraphException if the node does not exist or was removed
     */
    public Node requireNode(int index) {
        return node(index).orElseThrow(() ->
                new GraphException("Node " + index + " does not exist in graph " + name));
    }

    public Optional<Node> nodeByName(String nodeName) {
        for (Node node : nodes) {
            if (node != null && node.name().equals(nodeName)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Live nodes in index order.
     */
    public List<Node> nodes() {
        List<Node> result = new ArrayList<>(liveNodeCount);
        for (Node node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    public int nodeCount() {
        return liveNodeCount;
    }

    /**
     * One past the largest index ever handed out.
     */
    public int maxNodeIndex() {
        return nodes.size();
    }

    /**
     * Indices of the live nodes ordered so every node comes after the producers of
     * its inputs. Ties are broken by ascending index, so the order is deterministic.
     *
     * @throws GraphException if the graph contains a cycle
     */
    public List<Integer> nodesInTopologicalOrder() {
        Map<Integer, List<Integer>> successors = new HashMap<>();
        Map<Integer, Integer> pending = new HashMap<>();
        for (Node node : nodes) {
            if (node == null) {
                continue;
            }
            Set<Integer> preds = new TreeSet<>();
            for (NodeArg in : node.inputDefs()) {
                producerIndex(in.name()).ifPresent(preds::add);
            }
            for (String implicit : node.implicitInputNames()) {
                producerIndex(implicit).ifPresent(preds::add);
            }
            preds.remove(node.index());
            pending.put(node.index(), preds.size());
            for (int p : preds) {
                successors.computeIfAbsent(p, k -> new ArrayList<>()).add(node.index());
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (Map.Entry<Integer, Integer> e : pending.entrySet()) {
            if (e.getValue() == 0) {
                ready.add(e.getKey());
            }
        }
        List<Integer> order = new ArrayList<>(liveNodeCount);
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(current);
            for (int succ : successors.getOrDefault(current, List.of())) {
                int left = pending.merge(succ, -1, Integer::sum);
                if (left == 0) {
                    ready.add(succ);
                }
            }
        }
        if (order.size() != liveNodeCount) {
            throw new GraphException("Graph " + name + " contains a cycle");
        }
        return order;
    }

    /**
     * Generates a node name that has never been used in this graph, removed nodes included.
     * The name is taken once a node is added under it.
     */
    public String generateNodeName(String base) {
        String candidate = base;
        while (usedNodeNames.contains(candidate)) {
            candidate = base + "_token_" + nameCounter++;
        }
        return candidate;
    }

    /**
     * Generates a value name that is not used by any value or initializer in this graph.
     */
    public String generateNodeArgName(String base) {
        String candidate = base;
        while (nodeArgs.containsKey(candidate) || initializers.containsKey(candidate)) {
            candidate = base + "_token_" + nameCounter++;
        }
        return candidate;
    }

    // ==================== Edges ====================

    /**
     * Producer of a value, if it is produced by a live node in this graph.
     */
    public Optional<Node> producer(String argName) {
        return producerIndex(argName).flatMap(this::node);
    }

    /**
     * Live nodes in this graph that consume a value through an explicit input, in index order.
     */
    public List<Node> consumers(String argName) {
        List<Node> result = new ArrayList<>();
        for (int index : consumers.getOrDefault(argName, Set.of())) {
            node(index).ifPresent(result::add);
        }
        return result;
    }

    /**
     * Edges entering the node: one per input slot fed by a live producer.
     */
    public List<EdgeEnd> inputEdges(Node node) {
        List<EdgeEnd> edges = new ArrayList<>();
        for (int slot = 0; slot < node.inputDefs().size(); slot++) {
            ProducerSlot ps = producers.get(node.inputDef(slot).name());
            if (ps != null) {
                edges.add(new EdgeEnd(nodes.get(ps.nodeIndex()), ps.outputIndex(), slot));
            }
        }
        List<String> implicit = node.implicitInputNames();
        for (int i = 0; i < implicit.size(); i++) {
            ProducerSlot ps = producers.get(implicit.get(i));
            if (ps != null) {
                edges.add(new EdgeEnd(nodes.get(ps.nodeIndex()), ps.outputIndex(), node.inputDefs().size() + i));
            }
        }
        return edges;
    }

    /**
     * Edges leaving the node, ordered by (consumer index, source slot, destination slot).
     *
     * <p>A consumer that reads the same value through two input slots contributes two edges.
     * Consumption from inside a nested graph counts as an edge to the node owning that graph.
     */
    public List<EdgeEnd> outputEdges(Node node) {
        List<EdgeEnd> edges = new ArrayList<>();
        for (int src = 0; src < node.outputDefs().size(); src++) {
            String argName = node.outputDef(src).name();
            ProducerSlot ps = producers.get(argName);
            if (ps == null || ps.nodeIndex() != node.index()) {
                continue;
            }
            for (int consumerIndex : consumers.getOrDefault(argName, Set.of())) {
                Node consumer = nodes.get(consumerIndex);
                for (int dst = 0; dst < consumer.inputDefs().size(); dst++) {
                    if (consumer.inputDef(dst).name().equals(argName)) {
                        edges.add(new EdgeEnd(consumer, src, dst));
                    }
                }
            }
            for (Node owner : nodes) {
                if (owner == null || !owner.containsSubgraph()) {
                    continue;
                }
                List<String> implicit = owner.implicitInputNames();
                int pos = implicit.indexOf(argName);
                if (pos >= 0) {
                    edges.add(new EdgeEnd(owner, src, owner.inputDefs().size() + pos));
                }
            }
        }
        edges.sort((a, b) -> {
            int c = Integer.compare(a.node().index(), b.node().index());
            if (c != 0) return c;
            c = Integer.compare(a.srcArgIndex(), b.srcArgIndex());
            return c != 0 ? c : Integer.compare(a.dstArgIndex(), b.dstArgIndex());
        });
        return edges;
    }

    public int outputEdgesCount(Node node) {
        return outputEdges(node).size();
    }

    /**
     * Points input slot {@code slot} of {@code node} at a different value.
     */
    public void replaceNodeInput(Node node, int slot, NodeArg arg) {
        requireLive(node);
        registerArg(arg);
        String old = node.inputDef(slot).name();
        node.setInputDef(slot, arg);
        boolean stillUsed = false;
        for (NodeArg in : node.inputDefs()) {
            if (in.name().equals(old)) {
                stillUsed = true;
                break;
            }
        }
        if (!stillUsed) {
            removeConsumer(old, node.index());
        }
        consumers.computeIfAbsent(arg.name(), k -> new TreeSet<>()).add(node.index());
    }

    /**
     * Stops {@code node} from producing its outputs. The values keep their consumers,
     * which are left without a producer until another node takes the values over or
     * the consumers are removed.
     */
    public void detachNodeOutputs(Node node) {
        requireLive(node);
        for (NodeArg out : node.outputDefs()) {
            ProducerSlot ps = producers.get(out.name());
            if (ps != null && ps.nodeIndex() == node.index()) {
                producers.remove(out.name());
            }
        }
    }

    public boolean isNodeOutputsInGraphOutputs(Node node) {
        for (NodeArg out : node.outputDefs()) {
            if (isGraphOutput(out.name())) {
                return true;
            }
        }
        return false;
    }

    // ==================== Initializers ====================

    public void addInitializer(TensorData tensor) {
        if (initializers.containsKey(tensor.name())) {
            throw new GraphException("Initializer already exists: " + tensor.name());
        }
        if (producers.containsKey(tensor.name())) {
            throw new GraphException("Initializer " + tensor.name() + " would shadow a node output");
        }
        initializers.put(tensor.name(), tensor);
    }

    /**
     * Replaces an initializer under the same name. The new tensor may have different dims;
     * consumers see either the old or the new tensor, never neither.
     */
    public void replaceInitializer(String tensorName, TensorData tensor) {
        if (!initializers.containsKey(tensorName)) {
            throw new GraphException("No initializer named " + tensorName);
        }
        TensorData renamed = tensor.name().equals(tensorName) ? tensor : tensor.withName(tensorName);
        initializers.put(tensorName, renamed);
    }

    public void removeInitializer(String tensorName) {
        initializers.remove(tensorName);
    }

    /**
     * Initializer registered in this graph (outer scopes are not searched).
     */
    public Optional<TensorData> initializer(String tensorName) {
        return Optional.ofNullable(initializers.get(tensorName));
    }

    public Map<String, TensorData> initializers() {
        return Collections.unmodifiableMap(initializers);
    }

    /**
     * Returns true if the value is an initializer that cannot be overridden at run time,
     * meaning it is not also declared as a graph input.
     *
     * @param checkOuterScope also search enclosing graphs when the value is not defined here
     */
    public boolean isConstantInitializer(String tensorName, boolean checkOuterScope) {
        return constantInitializer(tensorName, checkOuterScope).isPresent();
    }

    public Optional<TensorData> constantInitializer(String tensorName, boolean checkOuterScope) {
        TensorData tensor = initializers.get(tensorName);
        if (tensor != null) {
            return isGraphInput(tensorName) ? Optional.empty() : Optional.of(tensor);
        }
        if (checkOuterScope && parent != null && !definesLocally(tensorName)) {
            return parent.constantInitializer(tensorName, true);
        }
        return Optional.empty();
    }

    // ==================== Validation ====================

    /**
     * Checks the graph invariants after a rewrite and drops initializers nothing consumes.
     * Nested graphs are resolved as well.
     *
     * @throws GraphException if a node input or graph output no longer resolves, or the graph has a cycle
     */
    public void resolve() {
        for (Node node : nodes) {
            if (node == null) {
                continue;
            }
            for (NodeArg in : node.inputDefs()) {
                if (!canResolve(in.name())) {
                    throw new GraphException(String.format(
                            "Input %s of node %s (%s) does not resolve in graph %s",
                            in.name(), node.name(), node.opType(), name));
                }
            }
            for (Graph subgraph : node.subgraphs()) {
                subgraph.resolve();
            }
        }
        for (NodeArg out : outputs) {
            if (!canResolve(out.name())) {
                throw new GraphException("Graph output " + out.name() + " does not resolve in graph " + name);
            }
        }
        nodesInTopologicalOrder();
        cleanUnusedInitializers();
    }

    /**
     * Removes initializers that are not consumed by any node (including from nested
     * graphs), are not graph outputs and are not overridable graph inputs.
     *
     * @return the names removed
     */
    public List<String> cleanUnusedInitializers() {
        Set<String> used = new HashSet<>();
        for (Node node : nodes) {
            if (node == null) {
                continue;
            }
            for (NodeArg in : node.inputDefs()) {
                used.add(in.name());
            }
            used.addAll(node.implicitInputNames());
        }
        List<String> removed = new ArrayList<>();
        for (String tensorName : new ArrayList<>(initializers.keySet())) {
            if (!used.contains(tensorName) && !isGraphOutput(tensorName) && !isGraphInput(tensorName)) {
                initializers.remove(tensorName);
                removed.add(tensorName);
            }
        }
        return removed;
    }

    /**
     * Values referenced inside this graph that it does not define itself.
     */
    public Set<String> outerScopeReferences() {
        Set<String> refs = new TreeSet<>();
        for (Node node : nodes) {
            if (node == null) {
                continue;
            }
            for (NodeArg in : node.inputDefs()) {
                if (!definesLocally(in.name())) {
                    refs.add(in.name());
                }
            }
            for (String implicit : node.implicitInputNames()) {
                if (!definesLocally(implicit)) {
                    refs.add(implicit);
                }
            }
        }
        for (NodeArg out : outputs) {
            if (!definesLocally(out.name())) {
                refs.add(out.name());
            }
        }
        return refs;
    }

    boolean definesLocally(String argName) {
        return producers.containsKey(argName) || isGraphInput(argName) || initializers.containsKey(argName);
    }

    private boolean canResolve(String argName) {
        if (definesLocally(argName)) {
            return true;
        }
        return parent != null && parent.canResolve(argName);
    }

    private Optional<Integer> producerIndex(String argName) {
        ProducerSlot ps = producers.get(argName);
        return ps == null ? Optional.empty() : Optional.of(ps.nodeIndex());
    }

    private void registerArg(NodeArg arg) {
        NodeArg existing = nodeArgs.get(arg.name());
        if (existing == null) {
            nodeArgs.put(arg.name(), arg);
        } else if (existing != arg) {
            throw new GraphException("Conflicting definitions of value " + arg.name() + " in graph " + name);
        }
    }

    private void removeConsumer(String argName, int index) {
        Set<Integer> set = consumers.get(argName);
        if (set != null) {
            set.remove(index);
            if (set.isEmpty()) {
                consumers.remove(argName);
            }
        }
    }

    private void requireLive(Node node) {
        if (node.graph() != this || node(node.index()).orElse(null) != node) {
            throw new GraphException("Node " + node.name() + " is not a live node of graph " + name);
        }
    }

    @Override
    public String toString() {
        return String.format("Graph[%s, nodes=%d, inputs=%d, outputs=%d, initializers=%d]",
                name, liveNodeCount, inputs.size(), outputs.size(), initializers.size());
    }
}
