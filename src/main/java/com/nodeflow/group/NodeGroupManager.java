package com.nodeflow.group;

import com.nodeflow.model.Node;
import com.nodeflow.model.NodeGraph;
import com.nodeflow.model.NodeGroup;
import com.nodeflow.model.Point;
import com.nodeflow.model.Rect;
import com.nodeflow.model.Size;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Spatial bookkeeping for node groups: creation, deletion, membership and
 * bounds.
 *
 * The manager works on the group forest of a {@link NodeGraph}. All geometry
 * is computed from node positions and a node size supplied by
 * {@link #getMeasureNode()}, falling back to {@link #getDefaultNodeSize()}
 * when no measurement callback is set.
 */
@Log4j2
public class NodeGroupManager {

    public static final double DEFAULT_EXPAND_PADDING = 8;
    public static final double DEFAULT_FIT_PADDING = 16;

    @Getter
    private final NodeGraph graph;

    /** Measures a node's footprint. Null means "use the default size". */
    @Getter
    @Setter
    private Function<Node, Size> measureNode;

    @Getter
    @Setter
    private Size defaultNodeSize = new Size(120, 60);

    /** Manager over a private graph. */
    public NodeGroupManager() {
        this(new NodeGraph());
    }

    public NodeGroupManager(NodeGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    public List<NodeGroup> getGroups() {
        return graph.getGroups();
    }

    // -- Lifecycle ----------------------------------------------------------

    public NodeGroup createGroup(String name, Rect bounds) {
        return createGroup(name, bounds, null);
    }

    /** Creates a group under {@code parent}, or as a root group when parent is null. */
    public NodeGroup createGroup(String name, Rect bounds, NodeGroup parent) {
        NodeGroup group = new NodeGroup(name, bounds);
        graph.addGroup(group, parent);
        return group;
    }

    /**
     * Creates a group around {@code nodes}, moves them into it and fits the
     * bounds with {@code padding} on every side.
     */
    public NodeGroup createGroupFromNodes(String name, Collection<? extends Node> nodes, double padding, NodeGroup parent) {
        List<Node> members = new ArrayList<>(new LinkedHashSet<Node>(nonNull(nodes)));
        NodeGroup group = createGroup(name, calculateBoundsForNodes(members, padding), parent);
        for (Node node : members) {
            addNodeToGroup(node, group, false);
        }
        updateGroupBoundsToFit(group, padding);
        log.debug("Created group {} around {} node(s)", name, members.size());
        return group;
    }

    public NodeGroup createGroupFromNodes(String name, Collection<? extends Node> nodes) {
        return createGroupFromNodes(name, nodes, DEFAULT_FIT_PADDING, null);
    }

    /** Deletes the group and all its child groups. Member nodes leave their groups. */
    public void deleteGroup(NodeGroup group) {
        if (group == null) {
            return;
        }
        for (NodeGroup child : new ArrayList<>(group.getChildren())) {
            deleteGroup(child);
        }
        for (Node node : new ArrayList<>(group.getNodes())) {
            removeNodeFromGroup(node, group);
        }
        if (!graph.removeGroup(group) && group.getParent() != null) {
            group.getParent().removeChild(group);
        }
    }

    // -- Membership ---------------------------------------------------------

    /**
     * Moves {@code node} into {@code group}; with {@code adjustBounds} the
     * bounds grow to contain the node plus the default expand padding.
     */
    public boolean addNodeToGroup(Node node, NodeGroup group, boolean adjustBounds) {
        if (node == null || group == null) {
            return false;
        }
        graph.moveNodeToGroup(node, group);
        if (adjustBounds) {
            expandBoundsToIncludeNode(group, node, DEFAULT_EXPAND_PADDING);
        }
        return true;
    }

    /** Takes {@code node} out of {@code group}. False if it was not a member. */
    public boolean removeNodeFromGroup(Node node, NodeGroup group) {
        if (node == null || group == null || node.getGroup() != group) {
            return false;
        }
        node.setGroup(null);
        return true;
    }

    // -- Geometry -----------------------------------------------------------

    /**
     * Translates the group's bounds. Member node positions follow when
     * {@code cascadeNodes} is set; child groups follow when
     * {@code cascadeChildren} is set, applying the same node rule.
     */
    public void moveGroup(NodeGroup group, double dx, double dy, boolean cascadeNodes, boolean cascadeChildren) {
        if (group == null) {
            return;
        }
        group.setBounds(group.getBounds().offset(dx, dy));
        if (cascadeNodes) {
            for (Node node : group.getNodes()) {
                node.setPosition(node.getPosition().offset(dx, dy));
            }
        }
        if (cascadeChildren) {
            for (NodeGroup child : group.getChildren()) {
                moveGroup(child, dx, dy, cascadeNodes, true);
            }
        }
    }

    /** Sets the bounds to tightly wrap all nodes of the group and its descendants. Empty groups keep their bounds. */
    public void updateGroupBoundsToFit(NodeGroup group, double padding) {
        if (group == null) {
            return;
        }
        List<Node> all = group.getAllNodesRecursive();
        if (all.isEmpty()) {
            return;
        }
        group.setBounds(calculateBoundsForNodes(all, padding));
    }

    /** True if the node's rectangle lies within the bounds grown by {@code tolerance}. */
    public boolean validateNodeInsideBounds(NodeGroup group, Node node, double tolerance) {
        if (group == null || node == null) {
            return false;
        }
        Rect area = group.getBounds().inflate(tolerance);
        Rect rect = nodeRect(node);
        return area.intersectsWith(rect) && area.contains(rect);
    }

    /**
     * Grows the bounds to contain the node's rectangle plus {@code padding}.
     * Never shrinks existing bounds.
     */
    public void expandBoundsToIncludeNode(NodeGroup group, Node node, double padding) {
        if (group == null || node == null) {
            return;
        }
        group.setBounds(group.getBounds().union(nodeRect(node).inflate(padding)));
    }

    /** Bounding rectangle of the nodes plus padding; {@link Rect#EMPTY} for no nodes. */
    public Rect calculateBoundsForNodes(Collection<? extends Node> nodes, double padding) {
        List<Node> list = nonNull(nodes);
        if (list.isEmpty()) {
            return Rect.EMPTY;
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (Node node : list) {
            Rect r = nodeRect(node);
            minX = Math.min(minX, r.x());
            minY = Math.min(minY, r.y());
            maxX = Math.max(maxX, r.right());
            maxY = Math.max(maxY, r.bottom());
        }
        if (Double.isInfinite(minX) || Double.isInfinite(minY) || Double.isInfinite(maxX) || Double.isInfinite(maxY)) {
            return Rect.EMPTY;
        }
        return Rect.fromEdges(minX - padding, minY - padding, maxX + padding, maxY + padding);
    }

    /**
     * Resolves where a node dragged to {@code desired} may go inside
     * {@code group}.
     *
     * A position whose node rectangle already fits is returned as is. Otherwise
     * {@code dynamicExpand} grows the group (plus padding) and keeps the
     * desired position, while a fixed group clamps the position inside its
     * bounds.
     */
    public Point constrainOrExpandNodePosition(Node node, NodeGroup group, Point desired, boolean dynamicExpand, double padding) {
        if (node == null || group == null) {
            return desired;
        }
        Rect wanted = Rect.of(desired, sizeOf(node));
        Rect g = group.getBounds();
        if (g.contains(wanted)) {
            return desired;
        }
        if (dynamicExpand) {
            group.setBounds(g.union(wanted.inflate(padding)));
            return desired;
        }
        double x = Math.max(g.x(), Math.min(wanted.x(), g.right() - wanted.width()));
        double y = Math.max(g.y(), Math.min(wanted.y(), g.bottom() - wanted.height()));
        return new Point(x, y);
    }

    public Point constrainOrExpandNodePosition(Node node, NodeGroup group, Point desired, boolean dynamicExpand) {
        return constrainOrExpandNodePosition(node, group, desired, dynamicExpand, DEFAULT_EXPAND_PADDING);
    }

    public Rect nodeRect(Node node) {
        return Rect.of(node.getPosition(), sizeOf(node));
    }

    private Size sizeOf(Node node) {
        if (measureNode == null) {
            return defaultNodeSize;
        }
        Size measured = measureNode.apply(node);
        return measured != null ? measured : defaultNodeSize;
    }

    private static List<Node> nonNull(Collection<? extends Node> nodes) {
        List<Node> out = new ArrayList<>();
        if (nodes != null) {
            for (Node n : nodes) {
                if (n != null) {
                    out.add(n);
                }
            }
        }
        return out;
    }
}
