package com.dataflow.graphcom.api;

import com.dataflow.graphcom.node.NodeId;

import java.util.List;
import java.util.Set;

/**
 * A node handler failed while processing a batch.
 *
 * <p>
 * Carries the identity of the failing node and every label path that leads
 * from a labelled ancestor down to it, e.g. {@code [total, left, source]}
 * reads "the node that {@code left} calls {@code source}, reached through the
 * source {@code left} of the labelled node {@code total}". The handler's
 * exception is the cause.
 *
 * <p>
 * The context on which {@code process} was called remains valid; no value of
 * the failing call is committed.
 */
public class ComputationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient NodeId nodeId;
    private final transient Set<List<String>> paths;

    public ComputationException(NodeId nodeId, Set<List<String>> paths, Throwable cause) {
        super("Node " + nodeId + " failed at " + paths + ": " + cause.getMessage(), cause);
        this.nodeId = nodeId;
        this.paths = Set.copyOf(paths);
    }

    /** Identity of the node whose handler threw. */
    public NodeId nodeId() {
        return nodeId;
    }

    /** Label paths from labelled ancestors to the failing node. */
    public Set<List<String>> paths() {
        return paths;
    }
}
