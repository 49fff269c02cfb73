package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.node.NodeId;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Single-threaded processor, the default of every context.
 *
 * Compile:
 * The topological levels are flattened into one ordered stage. Visiting that
 * stage front to back guarantees every source runs before its dependants.
 *
 * Execute:
 * A fold over the stage. The accumulator starts as a copy of the previous
 * values; each node is evaluated against it and its result written back before
 * moving to the next node. Nodes that are not scheduled keep their previous
 * value because they are never overwritten.
 *
 * Failure:
 * The first failing node stops the pass. The accumulator is discarded, so
 * nothing of a failed call is visible to anybody.
 *
 * Stateless; one instance may serve any number of contexts and threads.
 */
public final class SequentialProcessor extends AbstractProcessor {

    @Override
    public Schedule compile(Graph graph, Set<NodeId> inputIds) {
        return Schedule.flattened(TopologicalLeveler.processingLevels(graph, inputIds));
    }

    @Override
    public Map<NodeId, Object> execute(Graph graph, Schedule schedule, Map<NodeId, Object> values,
            Map<NodeId, Object> inputs) {
        final Map<NodeId, Object> acc = new HashMap<>(values);
        for (NodeId id : schedule.order())
            acc.put(id, evaluate(graph, id, acc, inputs));
        return acc;
    }

    @Override
    public String toString() {
        return "SequentialProcessor";
    }
}
