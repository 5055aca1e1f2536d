package com.nodeflow.util;

import com.nodeflow.model.Connection;
import com.nodeflow.model.Node;
import com.nodeflow.model.NodeGraph;
import com.nodeflow.model.NodeGroup;
import com.nodeflow.model.Pin;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Diagnostic utility for inspecting graph structure and pin state.
 *
 * <p>
 * Generates human-readable text dumps and Mermaid diagrams of a
 * {@link NodeGraph}.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error logs. Allocates
 * strings and walks every collection; do not call it per node step.
 */
public final class GraphExplain {
    private final NodeGraph graph;

    public GraphExplain(NodeGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(UUID nodeId) {
        Node node = graph.findNode(nodeId);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(node.getName()).append('\n')
                .append("  Id: ").append(node.getId()).append('\n')
                .append("  Type: ").append(node.getClass().getSimpleName()).append('\n')
                .append("  Enabled: ").append(node.isEnabled()).append('\n')
                .append("  State: ").append(node.getState()).append('\n')
                .append("  Main: ").append(node.getId().equals(graph.getMainNodeId())).append('\n');
        if (node.getGroup() != null)
            sb.append("  Group: ").append(node.getGroup().getName()).append('\n');
        appendPins(sb, "Inputs", node.getInputPins());
        appendPins(sb, "Outputs", node.getOutputPins());
        return sb.toString();
    }

    private static void appendPins(StringBuilder sb, String title, List<Pin> pins) {
        sb.append("  ").append(title).append(" (").append(pins.size()).append("):\n");
        for (Pin pin : pins) {
            sb.append("    ").append(pin.getName());
            if (pin.isFlowPin()) {
                sb.append(" [flow]");
            } else {
                sb.append(" : ").append(pin.getDataType().getSimpleName()).append(" = ").append(pin.getValue());
            }
            if (pin.isConnected())
                sb.append(" (").append(pin.getConnections().size()).append(" conn)");
            sb.append('\n');
        }
    }

    /**
     * Dumps nodes and their outgoing connections in text form.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph '").append(graph.getName()).append("' ").append(graph.getCategory())
                .append(" (").append(graph.getNodes().size()).append(" nodes, ")
                .append(graph.getConnections().size()).append(" connections):\n");
        int i = 0;
        for (Node node : graph.getNodes()) {
            sb.append("  [").append(i++).append("] ").append(node.getName());
            if (node.getId().equals(graph.getMainNodeId()))
                sb.append(" (MAIN)");
            if (!node.isEnabled())
                sb.append(" (DISABLED)");
            sb.append('\n');
            for (Pin out : node.getOutputPins()) {
                for (Connection c : graph.connectionsFrom(out)) {
                    Node target = c.getTargetNode();
                    sb.append("      ").append(out.getName()).append(out.isFlowPin() ? " => " : " -> ")
                            .append(target != null ? target.getName() : "?")
                            .append('.').append(c.getTargetPin().getName()).append('\n');
                }
            }
        }
        long unresolved = graph.getConnections().stream().filter(c -> !c.isResolved()).count();
        if (unresolved > 0)
            sb.append("  Unresolved connections: ").append(unresolved).append('\n');
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS flowchart.
     * <p>
     * Groups become nested subgraphs, flow connections are drawn thick and data
     * connections are labelled with their pin names.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        Map<Node, String> ids = new HashMap<>();
        int i = 0;
        for (Node node : graph.getNodes()) {
            ids.put(node, "n" + i++);
        }
        Map<NodeGroup, String> groupIds = new HashMap<>();
        int g = 0;
        for (NodeGroup group : graph.getAllGroupsRecursive()) {
            groupIds.put(group, "g" + g++);
        }

        // 1. Groups with their members, then ungrouped nodes
        for (NodeGroup root : graph.getGroups()) {
            appendGroup(sb, root, ids, groupIds, "  ");
        }
        for (Node node : graph.getNodes()) {
            if (node.getGroup() == null || !groupIds.containsKey(node.getGroup()))
                appendNode(sb, node, ids, "  ");
        }

        // 2. Edges
        for (Connection c : graph.getConnections()) {
            if (!c.isResolved())
                continue;
            String from = ids.get(c.getSourceNode());
            String to = ids.get(c.getTargetNode());
            if (from == null || to == null)
                continue;
            if (c.isFlow()) {
                sb.append("  ").append(from).append(" ==> ").append(to).append(";\n");
            } else {
                sb.append("  ").append(from).append(" -- \"").append(escape(c.getSourcePin().getName()))
                        .append(" to ").append(escape(c.getTargetPin().getName())).append("\" --> ").append(to)
                        .append(";\n");
            }
        }
        return sb.toString();
    }

    private void appendGroup(StringBuilder sb, NodeGroup group, Map<Node, String> ids,
            Map<NodeGroup, String> groupIds, String indent) {
        sb.append(indent).append("subgraph ").append(groupIds.get(group)).append("[\"")
                .append(escape(group.getName())).append("\"]\n");
        for (Node member : group.getNodes()) {
            if (ids.containsKey(member))
                appendNode(sb, member, ids, indent + "  ");
        }
        for (NodeGroup child : group.getChildren()) {
            appendGroup(sb, child, ids, groupIds, indent + "  ");
        }
        sb.append(indent).append("end\n");
    }

    private void appendNode(StringBuilder sb, Node node, Map<Node, String> ids, String indent) {
        boolean main = node.getId().equals(graph.getMainNodeId());
        sb.append(indent).append(ids.get(node))
                .append(main ? "([\"" : "[\"")
                .append(escape(node.getName())).append("<br/><i>").append(node.getClass().getSimpleName())
                .append("</i>")
                .append(main ? "\"]);\n" : "\"];\n");
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
