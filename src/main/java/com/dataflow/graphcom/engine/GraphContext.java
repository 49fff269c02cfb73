package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.api.ComputationException;
import com.dataflow.graphcom.api.ConfigurationException;
import com.dataflow.graphcom.api.ProcessListener;
import com.dataflow.graphcom.api.Processor;
import com.dataflow.graphcom.node.NodeId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The processing session of a graph: the values of its compute nodes after
 * the batches seen so far.
 *
 * Responsibilities:
 * 1. Scheduling: resolves the labels of each batch to input nodes and keeps
 * the compiled schedule per label set (see {@link CompilationCache}).
 * 2. Execution: hands the schedule, the current values and the batch to the
 * {@link Processor}.
 * 3. Attribution: a failing handler surfaces as a
 * {@link ComputationException} with the label paths of the failing node.
 * 4. Name Resolution: reads values by label.
 *
 * Immutability:
 * A context is never modified. {@link #process} and {@link #precompile} return
 * a new context and leave the receiver as it was. Any context value can be
 * kept, branched from or queried from several threads; a failed call leaves the
 * context it was called on fully usable.
 *
 * Input values are ephemeral: they are visible to handlers during the call
 * that supplies them and are never stored.
 */
public final class GraphContext {
    private final Graph graph;
    private final Processor processor;
    private final Map<NodeId, Object> values;
    private final CompilationCache compilations;
    private final long epoch;
    private final ProcessListener listener;

    /** A context using the {@link SequentialProcessor}. */
    public GraphContext(Graph graph) {
        this(graph, new SequentialProcessor());
    }

    public GraphContext(Graph graph, Processor processor) {
        this(Objects.requireNonNull(graph, "graph"), Objects.requireNonNull(processor, "processor"), Map.of(),
                CompilationCache.empty(), 0, null);
    }

    private GraphContext(Graph graph, Processor processor, Map<NodeId, Object> values,
            CompilationCache compilations, long epoch, ProcessListener listener) {
        this.graph = graph;
        this.processor = processor;
        this.values = values;
        this.compilations = compilations;
        this.epoch = epoch;
        this.listener = listener;
    }

    /** Returns a context that reports to {@code listener}, or to nobody if null. */
    public GraphContext withListener(ProcessListener listener) {
        return new GraphContext(graph, processor, values, compilations, epoch, listener);
    }

    /**
     * Compiles the schedule for a set of input labels ahead of the first call
     * that uses it. Values are unchanged.
     *
     * @throws com.dataflow.graphcom.api.ConfigurationException if a label is
     *                                                          unknown or names
     *                                                          a compute node.
     */
    public GraphContext precompile(Set<String> inputLabels) {
        CompilationCache next = compilations.compile(graph, processor, inputLabels);
        return next == compilations ? this : new GraphContext(graph, processor, values, next, epoch, listener);
    }

    /**
     * Processes a batch of input values.
     *
     * @param inputs Values keyed by input label. A null value is passed to
     *               handlers as null. Two labels of the same input node may
     *               both be given only with equal values.
     * @return A new context holding the values after this batch.
     * @throws ConfigurationException if a label is unknown or names a compute
     *                                node, or two labels of one input carry
     *                                different values.
     * @throws ComputationException   if a handler throws.
     */
    public GraphContext process(Map<String, ?> inputs) {
        final Set<String> labels = Set.copyOf(inputs.keySet());
        final long nextEpoch = epoch + 1;
        final ProcessListener l = this.listener;
        if (l != null)
            l.onProcessStart(nextEpoch, labels);

        CompilationCache cache = compilations.compile(graph, processor, labels);
        Schedule schedule = cache.get(labels);

        Map<NodeId, Object> batch = new HashMap<>(inputs.size() * 2);
        for (Map.Entry<String, ?> e : inputs.entrySet()) {
            NodeId id = graph.idOf(e.getKey());
            if (batch.containsKey(id) && !Objects.equals(batch.get(id), e.getValue()))
                throw new ConfigurationException("Conflicting values for input " + id + " under labels "
                        + graph.labelsOf(id));
            batch.put(id, e.getValue());
        }

        Map<NodeId, Object> next;
        try {
            next = processor.execute(graph, schedule, values, Collections.unmodifiableMap(batch));
        } catch (NodeFailureException e) {
            ComputationException error = new ComputationException(e.nodeId(),
                    ErrorPathTracer.paths(graph, e.nodeId()), e.getCause());
            if (l != null)
                l.onProcessError(nextEpoch, error);
            throw error;
        }

        if (l != null)
            l.onProcessEnd(nextEpoch, schedule.nodeCount(), cache != compilations);
        return new GraphContext(graph, processor, Collections.unmodifiableMap(new HashMap<>(next)), cache,
                nextEpoch, l);
    }

    /**
     * Value of a labelled node.
     *
     * @param label The label.
     * @param <T>   Expected value type.
     * @return The current value; null for input nodes and for compute nodes
     *         that have not run yet.
     * @throws com.dataflow.graphcom.api.ConfigurationException if the label is
     *                                                          unknown.
     */
    @SuppressWarnings("unchecked")
    public <T> T value(String label) {
        return (T) values.get(graph.idOf(label));
    }

    /**
     * Values of every labelled compute node that has run at least once. Input
     * labels never appear.
     */
    public Map<String, Object> values() {
        Map<String, Object> result = new HashMap<>();
        for (Map.Entry<String, NodeId> e : graph.labels().entrySet())
            if (values.containsKey(e.getValue()))
                result.put(e.getKey(), values.get(e.getValue()));
        return Collections.unmodifiableMap(result);
    }

    /** Values of every compute node that has run, labelled or hidden. */
    public Map<NodeId, Object> nodeValues() {
        return values;
    }

    public Graph graph() {
        return graph;
    }

    public Processor processor() {
        return processor;
    }

    public CompilationCache compilations() {
        return compilations;
    }

    /** Label sets with a compiled schedule. */
    public Set<Set<String>> compiledLabelSets() {
        return compilations.keys();
    }

    /** Number of successful {@link #process} calls in this context's lineage. */
    public long epoch() {
        return epoch;
    }

    @Override
    public String toString() {
        return "GraphContext[epoch=" + epoch + ", " + graph + ", " + processor + "]";
    }
}
