package com.dataflow.graphcom.util;

import com.dataflow.graphcom.api.Node;
import com.dataflow.graphcom.engine.Graph;
import com.dataflow.graphcom.engine.GraphContext;
import com.dataflow.graphcom.engine.TopologicalLeveler;
import com.dataflow.graphcom.node.InputNode;
import com.dataflow.graphcom.node.NodeId;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic utility for inspecting graph state and topology.
 *
 * <p>
 * Generates human-readable text for a context: a single node with its sources
 * and dependants, the whole topology level by level, and the schedule a set
 * of input labels compiles to.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error logs. Allocates
 * freely; keep it off the processing path.
 */
public final class GraphExplain {
    private final GraphContext context;
    private final Graph graph;

    public GraphExplain(GraphContext context) {
        this.context = context;
        this.graph = context.graph();
    }

    /**
     * Dumps detailed state of a single labelled node.
     *
     * @throws com.dataflow.graphcom.api.ConfigurationException if the label is
     *                                                          unknown.
     */
    public String explainNode(String label) {
        NodeId id = graph.idOf(label);
        Node<?> node = graph.node(id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(label).append('\n')
                .append("  Id: ").append(id).append('\n')
                .append("  Type: ").append(node.getClass().getSimpleName()).append('\n')
                .append("  Is input: ").append(node instanceof InputNode).append('\n')
                .append("  Current value: ").append((Object) context.value(label)).append('\n');
        sb.append("  Sources (").append(node.sources().size()).append("): ");
        int i = 0;
        for (Map.Entry<String, Node<?>> e : node.sources().entrySet()) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(e.getKey()).append('=').append(describe(e.getValue().id()));
        }
        sb.append('\n');
        Set<NodeId> dependants = graph.dependantsOf(id);
        sb.append("  Dependants (").append(dependants.size()).append("): ");
        i = 0;
        for (NodeId d : dependants) {
            if (i++ > 0)
                sb.append(", ");
            sb.append(describe(d));
        }
        return sb.append('\n').toString();
    }

    /** Summary of the context's lineage. */
    public String explainContext() {
        return "Epoch: " + context.epoch() + ", Nodes: " + graph.size() + ", Labels: " + graph.labels().size()
                + ", Valued: " + context.nodeValues().size() + ", Compiled input sets: "
                + context.compiledLabelSets().size();
    }

    /** Dumps the graph level by level, starting from every input node. */
    public String dumpTopology() {
        return dumpLevels(TopologicalLeveler.levels(graph));
    }

    /**
     * Dumps the levels a call with {@code inputLabels} runs, including level 0.
     *
     * @throws com.dataflow.graphcom.api.ConfigurationException if a label is
     *                                                          unknown or names
     *                                                          a compute node.
     */
    public String dumpSchedule(Set<String> inputLabels) {
        return dumpLevels(TopologicalLeveler.levels(graph, graph.inputIdsFor(inputLabels)));
    }

    private String dumpLevels(List<List<NodeId>> levels) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.size()).append(" nodes, ").append(levels.size()).append(" levels):\n");
        for (int level = 0; level < levels.size(); level++) {
            List<String> names = new ArrayList<>();
            for (NodeId id : levels.get(level))
                names.add(describe(id));
            sb.append("  [").append(level).append("] ").append(String.join(", ", names)).append('\n');
        }
        return sb.toString();
    }

    private String describe(NodeId id) {
        String label = graph.labelOf(id);
        return label != null ? label : "(hidden " + id + ")";
    }
}
