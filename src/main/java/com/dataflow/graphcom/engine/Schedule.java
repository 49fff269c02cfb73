package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.node.NodeId;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiled execution plan of a processing call.
 *
 * A schedule is a list of stages. Every node of a stage depends only on nodes
 * of earlier stages (or on inputs), so the nodes of one stage may run in any
 * order or concurrently. Input nodes are never part of a schedule.
 *
 * The parallel processor keeps one stage per topological level. The
 * sequential processor flattens all levels into a single stage whose order is
 * the execution order.
 */
public final class Schedule {
    private static final Schedule EMPTY = new Schedule(List.of());

    private final List<List<NodeId>> stages;
    private final int nodeCount;

    private Schedule(List<List<NodeId>> stages) {
        this.stages = stages;
        int n = 0;
        for (List<NodeId> stage : stages)
            n += stage.size();
        this.nodeCount = n;
    }

    /** One stage per level, in level order. Empty levels are dropped. */
    public static Schedule leveled(List<? extends List<NodeId>> levels) {
        List<List<NodeId>> stages = new ArrayList<>(levels.size());
        for (List<NodeId> level : levels)
            if (!level.isEmpty())
                stages.add(List.copyOf(level));
        return stages.isEmpty() ? EMPTY : new Schedule(List.copyOf(stages));
    }

    /** A single stage holding the levels one after the other. */
    public static Schedule flattened(List<? extends List<NodeId>> levels) {
        List<NodeId> order = new ArrayList<>();
        for (List<NodeId> level : levels)
            order.addAll(level);
        return order.isEmpty() ? EMPTY : new Schedule(List.of(List.copyOf(order)));
    }

    public List<List<NodeId>> stages() {
        return stages;
    }

    /** Every scheduled node in execution order. */
    public List<NodeId> order() {
        List<NodeId> order = new ArrayList<>(nodeCount);
        for (List<NodeId> stage : stages)
            order.addAll(stage);
        return order;
    }

    public int nodeCount() {
        return nodeCount;
    }

    public boolean isEmpty() {
        return nodeCount == 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Schedule other && stages.equals(other.stages);
    }

    @Override
    public int hashCode() {
        return stages.hashCode();
    }

    @Override
    public String toString() {
        return "Schedule" + stages;
    }
}
