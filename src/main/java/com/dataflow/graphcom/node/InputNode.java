package com.dataflow.graphcom.node;

import com.dataflow.graphcom.api.Node;

import java.util.Map;

/**
 * Root node that receives external values.
 *
 * Input nodes are the entry points of data into the graph. A value supplied for
 * an input node is visible to its dependants only during the processing call
 * that carries it; the context never stores it. A dependant whose input was not
 * part of the current batch sees {@code null} for it.
 *
 * @param <T> The type of value accepted by this input.
 */
public final class InputNode<T> implements Node<T> {
    private final NodeId id;

    public InputNode() {
        this(IdGenerator.global());
    }

    public InputNode(IdGenerator ids) {
        this.id = ids.next();
    }

    @Override
    public NodeId id() {
        return id;
    }

    @Override
    public Map<String, Node<?>> sources() {
        return Map.of();
    }

    @Override
    public String toString() {
        return "InputNode" + id;
    }
}
