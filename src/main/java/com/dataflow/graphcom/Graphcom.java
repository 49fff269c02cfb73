package com.dataflow.graphcom;

import com.dataflow.graphcom.api.Handler;
import com.dataflow.graphcom.api.Node;
import com.dataflow.graphcom.api.Processor;
import com.dataflow.graphcom.engine.Graph;
import com.dataflow.graphcom.engine.GraphContext;
import com.dataflow.graphcom.engine.ParallelProcessor;
import com.dataflow.graphcom.engine.SequentialProcessor;
import com.dataflow.graphcom.node.ComputeNode;
import com.dataflow.graphcom.node.InputNode;

import java.util.Map;

/**
 * graphcom: incremental dataflow over a DAG of stateful nodes.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Input nodes</b> receive external values, one batch per
 * {@link GraphContext#process} call. They never keep a value.</li>
 * <li><b>Compute nodes</b> derive a new value from their previous value and
 * the current values of their sources.</li>
 * <li>A <b>graph</b> registers nodes under labels. Sources that are not
 * labelled join the graph as hidden nodes.</li>
 * <li>A <b>context</b> holds the values after each batch. Only the nodes
 * downstream of the inputs present in a batch are recomputed; the others keep
 * their value.</li>
 * </ul>
 *
 * <h3>Example</h3>
 *
 * <pre>{@code
 * InputNode<Integer> input = Graphcom.input();
 * ComputeNode<Integer> sum = Graphcom.compute(Map.of("input", input),
 *         (prev, in) -> (prev == null ? 0 : prev) + (Integer) in.get("input"));
 *
 * GraphContext ctx = Graphcom.context(Graphcom.graph(Map.of("input", input, "sum", sum)));
 * ctx = ctx.process(Map.of("input", 10)).process(Map.of("input", 10));
 * ctx.value("sum"); // 20
 * }</pre>
 */
public final class Graphcom {

    private Graphcom() {
        // Prevent instantiation of utility class
    }

    /** A fresh input node. */
    public static <T> InputNode<T> input() {
        return new InputNode<>();
    }

    /**
     * A compute node.
     *
     * @throws com.dataflow.graphcom.api.ConfigurationException if
     *                                                          {@code sources}
     *                                                          is empty.
     */
    public static <T> ComputeNode<T> compute(Map<String, ? extends Node<?>> sources, Handler<T> handler) {
        return new ComputeNode<>(sources, handler);
    }

    public static Graph graph() {
        return Graph.empty();
    }

    /**
     * A graph holding {@code labelled} and, hidden, all their sources.
     *
     * @throws com.dataflow.graphcom.api.StructuralException on identity
     *                                                       collision or cycle.
     */
    public static Graph graph(Map<String, ? extends Node<?>> labelled) {
        return Graph.of(labelled);
    }

    /** A context processing {@code graph} sequentially. */
    public static GraphContext context(Graph graph) {
        return new GraphContext(graph);
    }

    public static GraphContext context(Graph graph, Processor processor) {
        return new GraphContext(graph, processor);
    }

    public static SequentialProcessor sequentialProcessor() {
        return new SequentialProcessor();
    }

    /**
     * A level-parallel processor with its own pool of {@code parallelism}
     * daemon threads.
     */
    public static ParallelProcessor parallelProcessor(int parallelism) {
        return new ParallelProcessor(parallelism);
    }
}
