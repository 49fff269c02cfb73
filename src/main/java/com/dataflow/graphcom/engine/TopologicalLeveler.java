package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.node.NodeId;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Partitions the nodes downstream of a set of inputs into topological levels.
 *
 * Level 0 holds the given inputs. Every other reachable node sits at
 * {@code 1 + max(level of its reachable sources)}, i.e. at the depth of its
 * farthest input. Its sources are therefore always computed in an earlier
 * level, and the nodes of one level are independent of each other.
 *
 * Sources that are not reachable from the inputs are ignored: the node still
 * runs, reading whatever value those sources currently hold.
 *
 * Algorithm:
 * 1. Reachability: walk the dependants of the inputs to collect the nodes
 * touched by this input set.
 * 2. In-degrees: count, for each reachable node, the sources that are also
 * reachable.
 * 3. Kahn's algorithm: release a node once all its reachable sources have been
 * placed, one level after the deepest of them.
 *
 * Each level is sorted by identity, so the same graph and inputs always give
 * the same levels in the same order.
 */
@Log4j2
public final class TopologicalLeveler {

    private TopologicalLeveler() {
    }

    /** Levels starting from every input node of the graph. */
    public static List<List<NodeId>> levels(Graph graph) {
        return levels(graph, graph.inputIds());
    }

    /**
     * Computes the levels reachable from {@code inputIds}.
     *
     * @return Level 0 (the inputs) followed by the downstream levels.
     */
    public static List<List<NodeId>> levels(Graph graph, Set<NodeId> inputIds) {
        // 1. Reachable set
        Set<NodeId> reachable = new HashSet<>(inputIds);
        Deque<NodeId> pending = new ArrayDeque<>(inputIds);
        while (!pending.isEmpty()) {
            for (NodeId dependant : graph.dependantsOf(pending.pop()))
                if (reachable.add(dependant))
                    pending.push(dependant);
        }

        // 2. In-degrees restricted to the reachable set
        Map<NodeId, Integer> inDegree = new HashMap<>();
        for (NodeId id : reachable) {
            int n = 0;
            for (NodeId source : graph.sourcesOf(id))
                if (reachable.contains(source))
                    n++;
            inDegree.put(id, n);
        }

        // 3. Kahn's algorithm, tracking the deepest source of each node
        Map<NodeId, Integer> level = new HashMap<>();
        Deque<NodeId> ready = new ArrayDeque<>();
        for (NodeId id : inputIds) {
            level.put(id, 0);
            ready.add(id);
        }
        int depth = 0, placed = 0;
        while (!ready.isEmpty()) {
            NodeId curr = ready.poll();
            placed++;
            int next = level.get(curr) + 1;
            for (NodeId child : graph.dependantsOf(curr)) {
                level.merge(child, next, Math::max);
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child); // all reachable sources placed
                    depth = Math.max(depth, level.get(child));
                }
            }
        }
        if (placed != reachable.size())
            throw new IllegalStateException("Cycle detected! Levelled " + placed + " of " + reachable.size());

        // 4. Group by level
        List<List<NodeId>> levels = new ArrayList<>(depth + 1);
        for (int i = 0; i <= depth; i++)
            levels.add(new ArrayList<>());
        for (Map.Entry<NodeId, Integer> e : level.entrySet())
            levels.get(e.getValue()).add(e.getKey());
        for (List<NodeId> l : levels)
            Collections.sort(l);

        log.debug("Levelled {} nodes from {} inputs into {} levels", reachable.size(), inputIds.size(),
                levels.size());
        return levels;
    }

    /** The levels without level 0, as a processor runs them. */
    public static List<List<NodeId>> processingLevels(Graph graph, Set<NodeId> inputIds) {
        List<List<NodeId>> levels = levels(graph, inputIds);
        return levels.subList(1, levels.size());
    }
}
