package com.dataflow.graphcom.node;

import com.dataflow.graphcom.api.ConfigurationException;
import com.dataflow.graphcom.api.Handler;
import com.dataflow.graphcom.api.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A node whose value is derived from its sources and its own previous value.
 *
 * The sources are fixed at construction and keyed by labels local to this
 * node. The handler receives the current value of each source under the same
 * labels. Sources are shared references: the same node may feed any number of
 * compute nodes.
 *
 * @param <T> The type of value produced.
 */
public final class ComputeNode<T> implements Node<T> {
    private final NodeId id;
    private final Map<String, Node<?>> sources;
    private final Handler<T> handler;

    public ComputeNode(Map<String, ? extends Node<?>> sources, Handler<T> handler) {
        this(IdGenerator.global(), sources, handler);
    }

    /**
     * @throws ConfigurationException if {@code sources} is empty.
     */
    public ComputeNode(IdGenerator ids, Map<String, ? extends Node<?>> sources, Handler<T> handler) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(handler, "handler");
        if (sources.isEmpty())
            throw new ConfigurationException("Compute node requires at least one source");
        Map<String, Node<?>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Node<?>> e : sources.entrySet()) {
            copy.put(Objects.requireNonNull(e.getKey(), "source label"),
                    Objects.requireNonNull(e.getValue(), () -> "source " + e.getKey()));
        }
        this.id = ids.next();
        this.sources = Collections.unmodifiableMap(copy);
        this.handler = handler;
    }

    @Override
    public NodeId id() {
        return id;
    }

    @Override
    public Map<String, Node<?>> sources() {
        return sources;
    }

    public Handler<T> handler() {
        return handler;
    }

    @Override
    public String toString() {
        return "ComputeNode" + id + sources.keySet();
    }
}
