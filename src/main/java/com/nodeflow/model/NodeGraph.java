package com.nodeflow.model;

import com.nodeflow.api.NodeGraphCategory;
import com.nodeflow.api.PinDirection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * The aggregate root of the node model.
 *
 * The graph is the sole owner of its nodes, connections and root groups. All
 * cross references (pin to node, node to group, connection to pin) are
 * navigation links that can be rebuilt from ids by {@link #onDeserialized()}.
 *
 * Key Responsibilities:
 *
 * 1. Mutation: adding and removing nodes (with cascade), connecting pins under
 * the compatibility rules, and maintaining the group forest.
 *
 * 2. Roles: computing which nodes may serve as the main node for the graph's
 * category. Roles depend on pins, so they are recomputed on every call.
 *
 * 3. Relinking: rebuilding live references after a load.
 *
 * Structural errors are reported by return values (false or null), never by
 * exceptions. The graph is not thread safe; callers must not edit it while a
 * run is in flight.
 */
public class NodeGraph {
    private static final Logger log = LogManager.getLogger(NodeGraph.class);

    private UUID id = UUID.randomUUID();
    private String name = "";
    private NodeGraphCategory category = NodeGraphCategory.CONTROL_FLOW;
    private UUID mainNodeId;
    private boolean replaceInputConnection = true;

    private final Map<UUID, Node> nodes = new LinkedHashMap<>();
    private final Map<UUID, Connection> connections = new LinkedHashMap<>();
    private final List<NodeGroup> groups = new ArrayList<>();

    public NodeGraph() {
    }

    public NodeGraph(String name, NodeGraphCategory category) {
        this.name = Objects.requireNonNull(name, "name");
        this.category = Objects.requireNonNull(category, "category");
    }

    // -- Nodes --------------------------------------------------------------

    /** Adds the node. No-op returning false if it is null or already present. */
    public boolean addNode(Node node) {
        if (node == null || nodes.containsKey(node.getId())) {
            return false;
        }
        nodes.put(node.getId(), node);
        return true;
    }

    /**
     * Removes the node together with every connection touching it and its
     * group membership. Clears the main node if it was this node.
     */
    public boolean removeNode(Node node) {
        if (node == null || nodes.get(node.getId()) != node) {
            return false;
        }
        List<Connection> related = new ArrayList<>();
        for (Connection c : connections.values()) {
            if (c.touches(node)) {
                related.add(c);
            }
        }
        for (Connection c : related) {
            removeConnection(c);
        }
        if (node.getGroup() != null) {
            node.setGroup(null);
        }
        nodes.remove(node.getId());
        if (node.getId().equals(mainNodeId)) {
            mainNodeId = null;
        }
        return true;
    }

    public boolean containsNode(Node node) {
        return node != null && nodes.get(node.getId()) == node;
    }

    public Node findNode(UUID nodeId) {
        return nodeId == null ? null : nodes.get(nodeId);
    }

    public Pin findPin(UUID pinId) {
        if (pinId == null) {
            return null;
        }
        for (Node node : nodes.values()) {
            for (Pin pin : node.getInputPins()) {
                if (pinId.equals(pin.getId())) return pin;
            }
            for (Pin pin : node.getOutputPins()) {
                if (pinId.equals(pin.getId())) return pin;
            }
        }
        return null;
    }

    /** Nodes in insertion order. */
    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    // -- Connections --------------------------------------------------------

    /**
     * Connects an output pin to an input pin.
     *
     * The owning nodes are added to the graph if missing. When a data input is
     * already connected, the old connection is replaced if
     * {@link #isReplaceInputConnection()} allows it, otherwise the call fails.
     *
     * @return the new connection, or null if the pins cannot be connected.
     */
    public Connection connect(Pin source, Pin target) {
        if (source == null || target == null) {
            return null;
        }
        Node sourceNode = source.getParentNode();
        Node targetNode = target.getParentNode();
        if (sourceNode == null || targetNode == null) {
            log.debug("Rejected connection {} -> {}: pin has no owning node", source, target);
            return null;
        }
        addNode(sourceNode);
        addNode(targetNode);

        if (source.getDirection() != PinDirection.OUTPUT || target.getDirection() != PinDirection.INPUT) {
            log.debug("Rejected connection {} -> {}: must go from output to input", source, target);
            return null;
        }
        if (!source.isCompatibleWith(target)) {
            log.debug("Rejected connection {} -> {}: incompatible pins", source, target);
            return null;
        }
        for (Connection existing : target.getConnections()) {
            if (existing.getSourcePin() == source) {
                log.debug("Rejected connection {} -> {}: already connected", source, target);
                return null;
            }
        }
        if (!target.isFlowPin() && target.isConnected()) {
            if (!replaceInputConnection) {
                log.debug("Rejected connection {} -> {}: input already connected", source, target);
                return null;
            }
            for (Connection existing : new ArrayList<>(target.getConnections())) {
                removeConnection(existing);
            }
        }

        Connection connection = new Connection(source, target);
        connections.put(connection.getId(), connection);
        return connection;
    }

    /** Registers an existing connection as is, without any checks. */
    public boolean addConnection(Connection connection) {
        if (connection == null || connections.containsKey(connection.getId())) {
            return false;
        }
        connections.put(connection.getId(), connection);
        return true;
    }

    /** Disconnects both ends and unregisters the connection. */
    public boolean removeConnection(Connection connection) {
        if (connection == null) {
            return false;
        }
        connection.disconnect();
        return connections.remove(connection.getId()) != null;
    }

    public Collection<Connection> getConnections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    /** Connections leaving {@code pin}, in registration order. */
    public List<Connection> connectionsFrom(Pin pin) {
        List<Connection> out = new ArrayList<>();
        for (Connection c : connections.values()) {
            if (c.getSourcePin() == pin) {
                out.add(c);
            }
        }
        return out;
    }

    /** Connections entering {@code pin}, in registration order. */
    public List<Connection> connectionsTo(Pin pin) {
        List<Connection> out = new ArrayList<>();
        for (Connection c : connections.values()) {
            if (c.getTargetPin() == pin) {
                out.add(c);
            }
        }
        return out;
    }

    /** Resolved data connections feeding any input of {@code node}. */
    public List<Connection> incomingDataConnections(Node node) {
        List<Connection> out = new ArrayList<>();
        for (Connection c : connections.values()) {
            if (c.isResolved() && !c.isFlow() && c.getTargetNode() == node) {
                out.add(c);
            }
        }
        return out;
    }

    /** True only if every connection is resolved and individually valid. */
    public boolean validate() {
        for (Connection c : connections.values()) {
            if (!c.isValid()) {
                return false;
            }
        }
        return true;
    }

    // -- Groups -------------------------------------------------------------

    /** Registers {@code group} as a root group, detaching it from any parent. */
    public boolean addGroup(NodeGroup group) {
        if (group == null || groups.contains(group)) {
            return false;
        }
        if (group.getParent() != null) {
            group.getParent().removeChild(group);
        }
        groups.add(group);
        return true;
    }

    /**
     * Places {@code group} under {@code parent}, registering the parent as a
     * root group if it is not part of the forest yet.
     *
     * @return false if the edit would create a cycle.
     */
    public boolean addGroup(NodeGroup group, NodeGroup parent) {
        if (parent == null) {
            return addGroup(group);
        }
        if (group == null || group == parent || parent.isDescendantOf(group)) {
            log.debug("Rejected nesting {} under {}: would create a cycle", group, parent);
            return false;
        }
        if (!containsGroup(parent)) {
            addGroup(parent);
        }
        groups.remove(group);
        return parent.addChild(group);
    }

    /**
     * Removes the group and its subtree from the forest. Member nodes stay in
     * the graph but leave their groups.
     */
    public boolean removeGroup(NodeGroup group) {
        if (group == null || !containsGroup(group)) {
            return false;
        }
        List<NodeGroup> subtree = new ArrayList<>();
        subtree.add(group);
        subtree.addAll(group.descendants());
        for (NodeGroup g : subtree) {
            for (Node member : new ArrayList<>(g.getNodes())) {
                member.setGroup(null);
            }
        }
        if (group.getParent() != null) {
            group.getParent().removeChild(group);
        } else {
            groups.remove(group);
        }
        return true;
    }

    /**
     * Moves {@code node} into {@code group}, or out of any group when null.
     * A group foreign to the graph is first registered as a root group.
     */
    public void moveNodeToGroup(Node node, NodeGroup group) {
        if (node == null) {
            return;
        }
        if (group != null && !containsGroup(group)) {
            addGroup(group);
        }
        node.setGroup(group);
    }

    public boolean containsGroup(NodeGroup group) {
        return group != null && getAllGroupsRecursive().contains(group);
    }

    public List<NodeGroup> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    /** Every group in the forest, pre-order. */
    public List<NodeGroup> getAllGroupsRecursive() {
        List<NodeGroup> all = new ArrayList<>();
        for (NodeGroup root : groups) {
            all.add(root);
            all.addAll(root.descendants());
        }
        return all;
    }

    // -- Roles --------------------------------------------------------------

    /** Candidate main nodes for the graph's current category. */
    public List<Node> getCandidateMainNodes() {
        return switch (category) {
            case CONTROL_FLOW -> getControlFlowStartNodes();
            case DATA_FLOW -> getDataFlowEndNodes();
        };
    }

    /** Nodes with no flow inputs and at least one flow output. */
    public List<Node> getControlFlowStartNodes() {
        List<Node> out = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (isEntryCandidate(node)) {
                out.add(node);
            }
        }
        return out;
    }

    /** Nodes with at least one data input and no data outputs. */
    public List<Node> getDataFlowEndNodes() {
        List<Node> out = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (isSinkCandidate(node)) {
                out.add(node);
            }
        }
        return out;
    }

    public static boolean isEntryCandidate(Node node) {
        return node.flowInputPins().isEmpty() && !node.flowOutputPins().isEmpty();
    }

    public static boolean isSinkCandidate(Node node) {
        return !node.dataInputPins().isEmpty() && node.dataOutputPins().isEmpty();
    }

    public UUID getMainNodeId() {
        return mainNodeId;
    }

    /** Raw setter, also used by persistence. See {@link #isMainNodeValid()}. */
    public void setMainNodeId(UUID mainNodeId) {
        this.mainNodeId = mainNodeId;
    }

    public Node getMainNode() {
        return findNode(mainNodeId);
    }

    /**
     * Confirms {@code node} as the main node.
     *
     * @throws IllegalArgumentException if the node is not part of this graph.
     */
    public void setMainNode(Node node) {
        if (node == null) {
            mainNodeId = null;
            return;
        }
        if (!containsNode(node)) {
            throw new IllegalArgumentException("Node " + node + " is not part of graph " + name);
        }
        mainNodeId = node.getId();
    }

    /** True if the main node exists and fits the role required by the category. */
    public boolean isMainNodeValid() {
        Node main = getMainNode();
        if (main == null) {
            return false;
        }
        return category == NodeGraphCategory.CONTROL_FLOW ? isEntryCandidate(main) : isSinkCandidate(main);
    }

    // -- Relinking ----------------------------------------------------------

    /**
     * Rebuilds live references from stored ids after a load.
     *
     * Pin parents are re-bound, nodes rejoin the group whose id they carry and
     * connections are bound to the pins their ids name. An id that matches
     * nothing leaves the reference unset.
     */
    public void onDeserialized() {
        reindex();

        Map<UUID, NodeGroup> groupIndex = new LinkedHashMap<>();
        for (NodeGroup g : getAllGroupsRecursive()) {
            groupIndex.putIfAbsent(g.getId(), g);
        }
        for (NodeGroup g : groupIndex.values()) {
            for (Node member : new ArrayList<>(g.getNodes())) {
                if (!containsNode(member) || !g.getId().equals(member.getGroupId())) {
                    g.detachMember(member);
                    if (member.getGroup() == g) {
                        member.setGroup(null);
                    }
                }
            }
        }

        Map<UUID, Pin> pinIndex = new HashMap<>();
        for (Node node : nodes.values()) {
            node.onDeserialized();
            UUID gid = node.getGroupId();
            NodeGroup group = gid != null ? groupIndex.get(gid) : null;
            if (gid != null && group == null) {
                log.debug("Node {} references unknown group {}", node, gid);
            }
            node.setGroup(group);
            for (Pin pin : node.getInputPins()) {
                pinIndex.put(pin.getId(), pin);
            }
            for (Pin pin : node.getOutputPins()) {
                pinIndex.put(pin.getId(), pin);
            }
        }

        int unresolved = 0;
        for (Connection c : connections.values()) {
            Pin source = pinIndex.get(c.getSourcePinId());
            Pin target = pinIndex.get(c.getTargetPinId());
            c.relink(source, target);
            if (source == null || target == null) {
                unresolved++;
            }
        }
        if (unresolved > 0) {
            log.debug("Graph {} relinked with {} unresolved connection(s)", name, unresolved);
        }
    }

    private void reindex() {
        List<Node> nodeList = new ArrayList<>(nodes.values());
        nodes.clear();
        for (Node n : nodeList) {
            nodes.putIfAbsent(n.getId(), n);
        }
        List<Connection> connectionList = new ArrayList<>(connections.values());
        connections.clear();
        for (Connection c : connectionList) {
            connections.putIfAbsent(c.getId(), c);
        }
    }

    // -- Plain properties ---------------------------------------------------

    public UUID getId() {
        return id;
    }

    /** Reassigns the identifier. Only meant for restoring persisted graphs. */
    public void setId(UUID id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public NodeGraphCategory getCategory() {
        return category;
    }

    public void setCategory(NodeGraphCategory category) {
        this.category = Objects.requireNonNull(category, "category");
    }

    /** Key of the engine able to run this graph, the category name. */
    public String getExecutionEngineKey() {
        return category.name();
    }

    public boolean isReplaceInputConnection() {
        return replaceInputConnection;
    }

    public void setReplaceInputConnection(boolean replaceInputConnection) {
        this.replaceInputConnection = replaceInputConnection;
    }

    @Override
    public String toString() {
        return "NodeGraph[" + name + ", " + category + ", " + nodes.size() + " nodes, "
                + connections.size() + " connections]";
    }
}
