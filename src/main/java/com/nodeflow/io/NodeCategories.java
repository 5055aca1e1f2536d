package com.nodeflow.io;

import com.nodeflow.api.NodeGraphCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which graph categories a node type belongs in.
 *
 * A type with any flow pin is a control-flow type and only fits control-flow
 * graphs. Pure data types fit both categories, since control-flow graphs use
 * them to compute values for their flow nodes.
 */
public final class NodeCategories {
    private NodeCategories() {
    }

    public static NodeGraphCategory categoryOf(NodeMetadata metadata) {
        return metadata.hasFlowPins() ? NodeGraphCategory.CONTROL_FLOW : NodeGraphCategory.DATA_FLOW;
    }

    public static boolean isCompatible(NodeMetadata metadata, NodeGraphCategory category) {
        return category == NodeGraphCategory.CONTROL_FLOW || !metadata.hasFlowPins();
    }

    /** Registered types usable in a graph of {@code category}, in registration order. */
    public static List<NodeMetadata> availableFor(NodeRegistry registry, NodeGraphCategory category) {
        List<NodeMetadata> out = new ArrayList<>();
        for (NodeMetadata m : registry.all()) {
            if (isCompatible(m, category)) {
                out.add(m);
            }
        }
        return out;
    }
}
