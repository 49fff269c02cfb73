package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.api.ConfigurationException;
import com.dataflow.graphcom.api.Node;
import com.dataflow.graphcom.api.StructuralException;
import com.dataflow.graphcom.node.ComputeNode;
import com.dataflow.graphcom.node.InputNode;
import com.dataflow.graphcom.node.NodeId;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable registry of nodes and their dependencies.
 *
 * Data layout:
 * - labels: label -> identity, only for nodes the caller named.
 * - nodes: identity -> node, for every node reachable from a labelled node.
 * Unlabelled ("hidden") nodes get here as sources of labelled ones.
 * - sources: identity -> identities of its sources (the adjacency).
 * - dependants: identity -> identities of the nodes that use it as a source.
 * This is the reverse adjacency, used for scheduling and failure attribution.
 *
 * Construction:
 * {@link #add(String, Node)} inserts the node and, transitively, every source
 * not present yet. Nothing is ever mutated: each add returns a new graph and
 * the receiver stays valid. The maps are copied shallowly and the per-node
 * dependant sets are replaced only when they change, so unchanged sets are
 * shared between graph values.
 *
 * Validation:
 * - A label can be registered once.
 * - A node whose identity is already present must be the very same object.
 * - After each add, a depth-first walk from the new node checks that no cycle
 * was introduced.
 */
public final class Graph {
    private static final Graph EMPTY = new Graph(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, NodeId> labels;
    private final Map<NodeId, Set<String>> labelsById;
    private final Map<NodeId, Node<?>> nodes;
    private final Map<NodeId, Set<NodeId>> sources;
    private final Map<NodeId, Set<NodeId>> dependants;

    private Graph(Map<String, NodeId> labels, Map<NodeId, Set<String>> labelsById, Map<NodeId, Node<?>> nodes,
            Map<NodeId, Set<NodeId>> sources, Map<NodeId, Set<NodeId>> dependants) {
        this.labels = labels;
        this.labelsById = labelsById;
        this.nodes = nodes;
        this.sources = sources;
        this.dependants = dependants;
    }

    /** The graph without nodes. */
    public static Graph empty() {
        return EMPTY;
    }

    /**
     * Builds a graph by adding every entry to the empty graph. The iteration
     * order of {@code labelled} does not affect the result.
     */
    public static Graph of(Map<String, ? extends Node<?>> labelled) {
        Graph graph = EMPTY;
        for (Map.Entry<String, ? extends Node<?>> e : labelled.entrySet())
            graph = graph.add(e.getKey(), e.getValue());
        return graph;
    }

    /**
     * Returns a new graph with {@code node} registered under {@code label}.
     *
     * @throws ConfigurationException if the label is taken or the node is not an
     *                                input or compute node.
     * @throws StructuralException    if a different node reuses an identity, or
     *                                the node closes a cycle.
     */
    public Graph add(String label, Node<?> node) {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(node, "node");
        if (labels.containsKey(label))
            throw new ConfigurationException("Duplicate label: " + label);

        Map<NodeId, Node<?>> newNodes = new HashMap<>(nodes);
        Map<NodeId, Set<NodeId>> newSources = new HashMap<>(sources);
        Map<NodeId, Set<NodeId>> newDependants = new HashMap<>(dependants);
        insert(node, newNodes, newSources, newDependants);
        checkAcyclic(newSources, node.id());

        Map<String, NodeId> newLabels = new HashMap<>(labels);
        newLabels.put(label, node.id());
        Map<NodeId, Set<String>> newLabelsById = new HashMap<>(labelsById);
        Set<String> nodeLabels = new TreeSet<>(labelsById.getOrDefault(node.id(), Set.of()));
        nodeLabels.add(label);
        newLabelsById.put(node.id(), Collections.unmodifiableSet(nodeLabels));

        return new Graph(Collections.unmodifiableMap(newLabels), Collections.unmodifiableMap(newLabelsById),
                Collections.unmodifiableMap(newNodes), Collections.unmodifiableMap(newSources),
                Collections.unmodifiableMap(newDependants));
    }

    /**
     * Registers {@code root} and every source not present yet, sources first.
     * Iterative post-order walk, so the depth of a chain of hidden sources is
     * bounded only by memory.
     */
    private static void insert(Node<?> root, Map<NodeId, Node<?>> nodes, Map<NodeId, Set<NodeId>> sources,
            Map<NodeId, Set<NodeId>> dependants) {
        Deque<Node<?>> stack = new ArrayDeque<>();
        Set<Node<?>> expanded = Collections.newSetFromMap(new IdentityHashMap<>());
        stack.push(root);
        while (!stack.isEmpty()) {
            Node<?> node = stack.peek();
            Node<?> existing = nodes.get(node.id());
            if (existing != null) {
                if (existing != node)
                    throw new StructuralException("Identity " + node.id() + " is shared by two distinct nodes");
                stack.pop();
                continue;
            }
            if (expanded.add(node)) {
                if (!(node instanceof InputNode) && !(node instanceof ComputeNode))
                    throw new ConfigurationException("Unsupported node type: " + node.getClass().getName());
                for (Node<?> source : node.sources().values())
                    stack.push(source);
                continue;
            }

            // Second visit: every source is registered
            stack.pop();
            Set<NodeId> sourceIds = new LinkedHashSet<>();
            for (Node<?> source : node.sources().values())
                sourceIds.add(source.id());
            nodes.put(node.id(), node);
            sources.put(node.id(), Collections.unmodifiableSet(sourceIds));
            dependants.putIfAbsent(node.id(), Set.of());
            for (NodeId sourceId : sourceIds) {
                Set<NodeId> next = new HashSet<>(dependants.get(sourceId));
                next.add(node.id());
                dependants.put(sourceId, Collections.unmodifiableSet(next));
            }
        }
    }

    /**
     * Depth-first walk from {@code start} along the adjacency. An identity met
     * again while it is still on the current path closes a cycle.
     *
     * @throws StructuralException if a cycle is reachable from {@code start}.
     */
    static void checkAcyclic(Map<NodeId, Set<NodeId>> adjacency, NodeId start) {
        Set<NodeId> onPath = new HashSet<>();
        Set<NodeId> done = new HashSet<>();
        Deque<NodeId> path = new ArrayDeque<>();
        Deque<Iterator<NodeId>> pending = new ArrayDeque<>();
        onPath.add(start);
        path.push(start);
        pending.push(adjacency.getOrDefault(start, Set.of()).iterator());
        while (!pending.isEmpty()) {
            Iterator<NodeId> it = pending.peek();
            if (it.hasNext()) {
                NodeId next = it.next();
                if (done.contains(next))
                    continue;
                if (!onPath.add(next))
                    throw new StructuralException("Cycle detected through node " + next);
                path.push(next);
                pending.push(adjacency.getOrDefault(next, Set.of()).iterator());
            } else {
                pending.pop();
                NodeId id = path.pop();
                onPath.remove(id);
                done.add(id);
            }
        }
    }

    // ── Accessors ──────────────────────────────────────────────

    /** Labelled nodes: label -> identity. */
    public Map<String, NodeId> labels() {
        return labels;
    }

    /** Every node in the graph, labelled or hidden. */
    public Map<NodeId, Node<?>> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean hasLabel(String label) {
        return labels.containsKey(label);
    }

    /**
     * Resolves a label.
     *
     * @throws ConfigurationException if the label is unknown.
     */
    public NodeId idOf(String label) {
        NodeId id = labels.get(label);
        if (id == null)
            throw new ConfigurationException("Unknown label: " + label);
        return id;
    }

    /**
     * @return The first label of the node in alphabetical order, or null for a
     *         hidden node.
     */
    public String labelOf(NodeId id) {
        Set<String> nodeLabels = labelsById.get(id);
        return nodeLabels == null ? null : nodeLabels.iterator().next();
    }

    /** @return Every label of the node, empty for a hidden node. */
    public Set<String> labelsOf(NodeId id) {
        return labelsById.getOrDefault(id, Set.of());
    }

    /** @return The node, or null if not found. */
    public Node<?> node(NodeId id) {
        return nodes.get(id);
    }

    public boolean isInput(NodeId id) {
        return nodes.get(id) instanceof InputNode;
    }

    public Set<NodeId> sourcesOf(NodeId id) {
        return sources.getOrDefault(id, Set.of());
    }

    public Set<NodeId> dependantsOf(NodeId id) {
        return dependants.getOrDefault(id, Set.of());
    }

    /** Identities of every input node, labelled or hidden. */
    public Set<NodeId> inputIds() {
        Set<NodeId> ids = new HashSet<>();
        for (Node<?> node : nodes.values())
            if (node instanceof InputNode)
                ids.add(node.id());
        return ids;
    }

    /**
     * Resolves labels that must all name input nodes.
     *
     * @throws ConfigurationException if a label is unknown or names a compute
     *                                node.
     */
    public Set<NodeId> inputIdsFor(Set<String> inputLabels) {
        Set<NodeId> ids = new HashSet<>();
        for (String label : inputLabels) {
            NodeId id = idOf(label);
            if (!isInput(id))
                throw new ConfigurationException("Label '" + label + "' does not name an input node");
            ids.add(id);
        }
        return ids;
    }

    @Override
    public String toString() {
        return "Graph[" + nodes.size() + " nodes, labels=" + labels.keySet() + "]";
    }
}
