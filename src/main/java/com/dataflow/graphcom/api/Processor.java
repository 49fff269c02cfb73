package com.dataflow.graphcom.api;

import com.dataflow.graphcom.engine.Graph;
import com.dataflow.graphcom.engine.Schedule;
import com.dataflow.graphcom.node.NodeId;

import java.util.Map;
import java.util.Set;

/**
 * Execution strategy of a {@link com.dataflow.graphcom.engine.GraphContext}.
 *
 * A processor has two responsibilities:
 *
 * 1. Compile: turn the set of input identities of a processing call into a
 * {@link Schedule}. The context caches the result per set of input labels, so
 * this runs once per distinct input shape.
 *
 * 2. Execute: run a schedule against the current values and the values of the
 * current input batch, returning the values of every compute node after the
 * call. Nodes that are not scheduled keep their previous value.
 *
 * Contract for implementations:
 * - Never mutate {@code values} or {@code inputs}; the caller's context still
 * refers to them.
 * - A source must be fully computed before any dependant runs.
 * - A handler failure must abort the call. Throwing
 * {@link com.dataflow.graphcom.engine.NodeFailureException} lets the context
 * attribute the failure to label paths.
 *
 * {@link com.dataflow.graphcom.engine.AbstractProcessor} provides the shared
 * per-node evaluation.
 */
public interface Processor {

    /**
     * Builds the execution plan for a set of input nodes.
     *
     * @param graph    The graph to schedule.
     * @param inputIds Identities of the input nodes supplied by the call.
     * @return The schedule, excluding the input nodes themselves.
     */
    Schedule compile(Graph graph, Set<NodeId> inputIds);

    /**
     * Runs a schedule.
     *
     * @param graph    The graph the schedule was compiled for.
     * @param schedule The compiled schedule.
     * @param values   Current compute-node values (read only).
     * @param inputs   Values of the current batch keyed by input identity.
     * @return New compute-node values, including untouched nodes.
     */
    Map<NodeId, Object> execute(Graph graph, Schedule schedule, Map<NodeId, Object> values,
            Map<NodeId, Object> inputs);
}
