package com.nodeflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A visual and logical cluster of nodes and child groups.
 *
 * Groups do not own their members: removing a group never removes nodes from
 * the graph. Groups form a forest; {@link #addChild(NodeGroup)} refuses any
 * edit that would make a group its own ancestor.
 */
public class NodeGroup {

    private UUID id = UUID.randomUUID();
    private String name;
    private Rect bounds = Rect.EMPTY;

    private NodeGroup parent;
    private final List<NodeGroup> children = new ArrayList<>();
    private final Set<Node> nodes = new LinkedHashSet<>();

    public NodeGroup() {
        this("Group");
    }

    public NodeGroup(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public NodeGroup(String name, Rect bounds) {
        this(name);
        setBounds(bounds);
    }

    // -- Members ------------------------------------------------------------

    /** Makes {@code node} a member, taking it out of any other group. */
    public boolean addNode(Node node) {
        if (node == null) {
            return false;
        }
        node.setGroup(this);
        return true;
    }

    public boolean removeNode(Node node) {
        if (node == null || !nodes.contains(node)) {
            return false;
        }
        if (node.getGroup() == this) {
            node.setGroup(null);
        } else {
            nodes.remove(node);
        }
        return true;
    }

    void attachMember(Node node) {
        nodes.add(node);
    }

    void detachMember(Node node) {
        nodes.remove(node);
    }

    public Set<Node> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    public boolean contains(Node node) {
        return nodes.contains(node);
    }

    /** Members of this group and of all descendant groups. */
    public List<Node> getAllNodesRecursive() {
        List<Node> all = new ArrayList<>(nodes);
        for (NodeGroup child : children) {
            all.addAll(child.getAllNodesRecursive());
        }
        return all;
    }

    public boolean containsNodeRecursive(Node node) {
        if (nodes.contains(node)) {
            return true;
        }
        for (NodeGroup child : children) {
            if (child.containsNodeRecursive(node)) {
                return true;
            }
        }
        return false;
    }

    // -- Hierarchy ----------------------------------------------------------

    /**
     * Adds {@code child} under this group, moving it from its current parent.
     *
     * @return false if child is null, this group, or an ancestor of this group.
     */
    public boolean addChild(NodeGroup child) {
        if (child == null || child == this || this.isDescendantOf(child)) {
            return false;
        }
        if (child.parent == this) {
            return true;
        }
        if (child.parent != null) {
            child.parent.removeChild(child);
        }
        children.add(child);
        child.parent = this;
        return true;
    }

    public boolean removeChild(NodeGroup child) {
        if (child == null || !children.remove(child)) {
            return false;
        }
        child.parent = null;
        return true;
    }

    /** True if {@code ancestor} appears on this group's parent chain. */
    public boolean isDescendantOf(NodeGroup ancestor) {
        for (NodeGroup g = parent; g != null; g = g.parent) {
            if (g == ancestor) {
                return true;
            }
        }
        return false;
    }

    /** All groups below this one, pre-order. */
    public List<NodeGroup> descendants() {
        List<NodeGroup> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(NodeGroup group, List<NodeGroup> out) {
        for (NodeGroup child : group.children) {
            out.add(child);
            collect(child, out);
        }
    }

    public NodeGroup getParent() {
        return parent;
    }

    public List<NodeGroup> getChildren() {
        return Collections.unmodifiableList(children);
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

    public Rect getBounds() {
        return bounds;
    }

    public void setBounds(Rect bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    @Override
    public String toString() {
        return "NodeGroup[" + name + ", " + nodes.size() + " nodes, " + children.size() + " children]";
    }
}
