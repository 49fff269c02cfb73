package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.api.Handler;
import com.dataflow.graphcom.api.Node;
import com.dataflow.graphcom.api.Processor;
import com.dataflow.graphcom.node.ComputeNode;
import com.dataflow.graphcom.node.NodeId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for processors. Implements the evaluation of a single node, which
 * is the same whatever the execution strategy.
 *
 * Evaluation of a compute node:
 * 1. Gather: for each source label, read the source's value from the running
 * values (compute sources) or, if absent there, from the input batch (input
 * sources). An input that is not part of the batch reads as null.
 * 2. Invoke: call the handler with the node's previous value (null if it never
 * ran) and the gathered map.
 * 3. Attribute: anything the handler throws (runtime exception, error, or a
 * checked exception thrown without declaration) is rethrown as a
 * {@link NodeFailureException} carrying the node's identity.
 */
public abstract class AbstractProcessor implements Processor {

    /**
     * Computes the new value of one node.
     *
     * @param graph  The graph holding the node.
     * @param id     The node to evaluate; must be a compute node.
     * @param values Running compute-node values.
     * @param inputs Values of the current batch.
     * @return The handler's result.
     * @throws NodeFailureException if the handler throws.
     */
    protected static Object evaluate(Graph graph, NodeId id, Map<NodeId, Object> values,
            Map<NodeId, Object> inputs) {
        Node<?> node = graph.node(id);
        if (!(node instanceof ComputeNode<?> compute))
            throw new IllegalStateException("Scheduled node " + id + " is not a compute node: " + node);

        Map<String, Object> sourceValues = new HashMap<>(compute.sources().size() * 2);
        for (Map.Entry<String, Node<?>> e : compute.sources().entrySet()) {
            NodeId sourceId = e.getValue().id();
            sourceValues.put(e.getKey(), values.containsKey(sourceId) ? values.get(sourceId) : inputs.get(sourceId));
        }

        @SuppressWarnings("unchecked")
        Handler<Object> handler = (Handler<Object>) compute.handler();
        try {
            return handler.compute(values.get(id), Collections.unmodifiableMap(sourceValues));
        } catch (Throwable e) {
            throw new NodeFailureException(id, e);
        }
    }
}
