package com.dataflow.graphcom.api;

import com.dataflow.graphcom.node.NodeId;

import java.util.Map;

/**
 * A node in the dataflow graph.
 *
 * There are exactly two kinds of node:
 *
 * 1. Input nodes ({@link com.dataflow.graphcom.node.InputNode}): entry points
 * for external data. They have no sources and never keep a value between
 * processing calls. Their value exists only during the call that supplies it.
 *
 * 2. Compute nodes ({@link com.dataflow.graphcom.node.ComputeNode}): derive a
 * new value from their previous value and the current values of their sources.
 *
 * Identity:
 * Every node carries a process-unique {@link NodeId} assigned at construction
 * time. Graphs deduplicate shared sources by identity, so a node may be the
 * source of any number of dependants without being copied.
 *
 * Nodes never own their sources; they only refer to them. The graph keeps the
 * adjacency as identities, which is what allows cycle detection and
 * deduplication without following object references.
 *
 * @param <T> The type of value this node produces.
 */
public interface Node<T> {

    /**
     * Returns the identity of this node.
     *
     * @return The identity token assigned when the node was created.
     */
    NodeId id();

    /**
     * Returns the sources of this node keyed by the label this node uses for
     * them. Input nodes return an empty map.
     *
     * @return An immutable view of the sources.
     */
    Map<String, Node<?>> sources();
}
