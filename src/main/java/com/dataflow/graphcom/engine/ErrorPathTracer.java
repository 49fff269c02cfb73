package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.api.Node;
import com.dataflow.graphcom.node.NodeId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recovers the label paths that lead to a failing node.
 *
 * A path starts at a labelled node and lists, hop by hop, the source label
 * each node uses for the next one, ending with the label under which the last
 * dependant refers to the failing node. For
 * {@code total = sum(left, right)}, {@code left = relay(source = x)} and
 * {@code right = relay(source = x)} a failure of the hidden node {@code x}
 * yields {@code [total, left, source]} and {@code [total, right, source]}.
 *
 * The walk goes up the dependants of the failing node and stops at the first
 * labelled node of each branch. A shared node reached through several
 * branches is walked once per branch; the graph is acyclic, so every branch
 * ends. The walk keeps its own stack, so chain depth is not limited by the
 * thread stack. A labelled failing node is reported by its own labels alone, as
 * one-element paths.
 */
public final class ErrorPathTracer {

    private ErrorPathTracer() {
    }

    public static Set<List<String>> paths(Graph graph, NodeId failing) {
        Set<List<String>> paths = new HashSet<>();
        for (String label : graph.labelsOf(failing))
            paths.add(List.of(label));
        if (!paths.isEmpty())
            return paths;

        Deque<Hop> pending = new ArrayDeque<>();
        pending.push(new Hop(failing, null));
        while (!pending.isEmpty()) {
            Hop hop = pending.pop();
            for (NodeId dependantId : graph.dependantsOf(hop.id())) {
                Node<?> dependant = graph.node(dependantId);
                for (Map.Entry<String, Node<?>> source : dependant.sources().entrySet()) {
                    if (!source.getValue().id().equals(hop.id()))
                        continue;
                    Suffix suffix = new Suffix(source.getKey(), hop.suffix());
                    Set<String> labels = graph.labelsOf(dependantId);
                    if (labels.isEmpty()) {
                        pending.push(new Hop(dependantId, suffix));
                        continue;
                    }
                    for (String label : labels) {
                        List<String> path = new ArrayList<>();
                        path.add(label);
                        for (Suffix s = suffix; s != null; s = s.rest())
                            path.add(s.label());
                        paths.add(List.copyOf(path));
                    }
                }
            }
        }
        return paths;
    }

    /** Source labels from a dependant down to the failing node, shared between branches. */
    private record Suffix(String label, Suffix rest) {
    }

    private record Hop(NodeId id, Suffix suffix) {
    }
}
