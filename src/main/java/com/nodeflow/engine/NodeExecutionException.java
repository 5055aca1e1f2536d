package com.nodeflow.engine;

import java.util.List;
import java.util.UUID;

/** A node's evaluation step failed. Carries the node and the path that led to it. */
public class NodeExecutionException extends GraphExecutionException {

    private final UUID nodeId;
    private final String nodeName;
    private final List<UUID> path;

    public NodeExecutionException(UUID nodeId, String nodeName, List<UUID> path, Throwable cause) {
        super("Node '" + nodeName + "' (" + nodeId + ") failed: " + cause.getMessage(), cause);
        this.nodeId = nodeId;
        this.nodeName = nodeName;
        this.path = List.copyOf(path);
    }

    public UUID getNodeId() {
        return nodeId;
    }

    public String getNodeName() {
        return nodeName;
    }

    /** Node ids evaluated up to and including the failing node. */
    public List<UUID> getPath() {
        return path;
    }
}
