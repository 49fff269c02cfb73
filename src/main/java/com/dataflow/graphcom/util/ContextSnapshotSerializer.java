package com.dataflow.graphcom.util;

import com.dataflow.graphcom.engine.Graph;
import com.dataflow.graphcom.engine.GraphContext;
import com.dataflow.graphcom.node.NodeId;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import lombok.extern.log4j.Log4j2;

/**
 * Renders a {@link GraphContext} as JSON for logs and debugging dumps.
 *
 * <p>
 * Values go through Jackson as they are; a value Jackson cannot serialize
 * turns the whole document into an {@code {"error": ...}} object rather than
 * failing the caller. There is no reader: this is a diagnostic view, not a
 * storage format.
 */
@Log4j2
public final class ContextSnapshotSerializer {
    private final ObjectMapper mapper;

    public ContextSnapshotSerializer() {
        this(new ObjectMapper());
    }

    public ContextSnapshotSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Builds the snapshot POJO; labels and compiled sets are sorted. */
    public ContextSnapshot snapshot(GraphContext context) {
        Graph graph = context.graph();
        ContextSnapshot snapshot = new ContextSnapshot();
        snapshot.setEpoch(context.epoch());
        snapshot.setNodeCount(graph.size());

        List<String> inputs = new ArrayList<>();
        for (Map.Entry<String, NodeId> e : graph.labels().entrySet())
            if (graph.isInput(e.getValue()))
                inputs.add(e.getKey());
        inputs.sort(null);
        snapshot.setInputs(inputs);

        snapshot.setValues(new TreeMap<>(context.values()));

        List<List<String>> compiled = new ArrayList<>();
        for (Set<String> labels : context.compiledLabelSets()) {
            List<String> sorted = new ArrayList<>(labels);
            sorted.sort(null);
            compiled.add(sorted);
        }
        compiled.sort((a, b) -> a.toString().compareTo(b.toString()));
        snapshot.setCompiledInputSets(compiled);
        return snapshot;
    }

    public String toJson(GraphContext context) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot(context));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize context at epoch {}", context.epoch(), e);
            return mapper.createObjectNode().put("error", "Failed to serialize snapshot: " + e.getOriginalMessage())
                    .toString();
        }
    }
}
