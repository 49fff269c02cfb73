package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.api.Processor;
import com.dataflow.graphcom.node.NodeId;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Schedules compiled so far, keyed by the set of input labels of a call.
 *
 * The cache is a value: {@link #compile} returns either the same cache (hit)
 * or a new cache holding one more entry (miss). Contexts derived from the same
 * lineage each carry their own cache, so nothing is shared or locked between
 * them.
 */
@Log4j2
public final class CompilationCache {
    private static final CompilationCache EMPTY = new CompilationCache(Map.of());

    private final Map<Set<String>, Schedule> schedules;

    private CompilationCache(Map<Set<String>, Schedule> schedules) {
        this.schedules = schedules;
    }

    public static CompilationCache empty() {
        return EMPTY;
    }

    /** @return The cached schedule, or null on a miss. */
    public Schedule get(Set<String> inputLabels) {
        return schedules.get(inputLabels);
    }

    public boolean contains(Set<String> inputLabels) {
        return schedules.containsKey(inputLabels);
    }

    /**
     * Returns a cache that holds a schedule for {@code inputLabels}, compiling
     * it with {@code processor} on a miss.
     *
     * @throws com.dataflow.graphcom.api.ConfigurationException if a label is
     *                                                          unknown or names
     *                                                          a compute node.
     */
    public CompilationCache compile(Graph graph, Processor processor, Set<String> inputLabels) {
        if (schedules.containsKey(inputLabels))
            return this;

        Set<NodeId> inputIds = graph.inputIdsFor(inputLabels);
        Schedule schedule = processor.compile(graph, inputIds);
        log.debug("Compiled {} for inputs {}: {} nodes in {} stages", processor.getClass().getSimpleName(),
                inputLabels, schedule.nodeCount(), schedule.stages().size());

        Map<Set<String>, Schedule> next = new HashMap<>(schedules);
        next.put(Set.copyOf(inputLabels), schedule);
        return new CompilationCache(Collections.unmodifiableMap(next));
    }

    /** The label sets compiled so far. */
    public Set<Set<String>> keys() {
        return schedules.keySet();
    }

    public int size() {
        return schedules.size();
    }
}
