package com.nodeflow.engine;

import java.util.List;
import java.util.UUID;

/**
 * A node failure recorded by a control-flow run.
 *
 * @param nodeId   The failing node.
 * @param nodeName Its display name.
 * @param path     Node ids from the entry node to the failing node, inclusive.
 * @param error    What the node threw.
 */
public record NodeFailure(UUID nodeId, String nodeName, List<UUID> path, Throwable error) {

    public NodeFailure {
        path = List.copyOf(path);
    }
}
