package com.dataflow.graphcom.node;

/**
 * Opaque identity of a node. Ordered by creation sequence of the generator
 * that issued it.
 */
public record NodeId(long value) implements Comparable<NodeId> {

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
