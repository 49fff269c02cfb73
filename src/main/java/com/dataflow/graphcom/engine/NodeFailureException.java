package com.dataflow.graphcom.engine;

import com.dataflow.graphcom.node.NodeId;

/**
 * Raised by a processor when a node handler throws. The context turns it into
 * a {@link com.dataflow.graphcom.api.ComputationException} with the label
 * paths of the failing node.
 */
public final class NodeFailureException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient NodeId nodeId;

    public NodeFailureException(NodeId nodeId, Throwable cause) {
        super("Node " + nodeId + " failed: " + cause.getMessage(), cause);
        this.nodeId = nodeId;
    }

    public NodeId nodeId() {
        return nodeId;
    }
}
