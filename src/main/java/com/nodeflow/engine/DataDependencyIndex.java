package com.nodeflow.engine;

import com.nodeflow.model.Connection;
import com.nodeflow.model.Node;
import com.nodeflow.model.NodeGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * CSR-encoded data dependency structure of a graph.
 *
 * Nodes are numbered in graph insertion order. An edge i -> j exists for every
 * resolved data connection from a pin of node i into a pin of node j, so two
 * connections between the same pair of nodes give two edges and count twice in
 * j's in-degree.
 *
 * Data layout:
 * - nodes: node objects by index.
 * - childrenList: flattened child indices of all nodes.
 * - childrenOffset: node i's children are childrenList[childrenOffset[i]]
 * inclusive to childrenList[childrenOffset[i+1]] exclusive.
 * - inDegree: number of incoming edges per node.
 *
 * The index is a snapshot. Rebuild it after editing the graph.
 */
public final class DataDependencyIndex {
    private final Node[] nodes;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] inDegree;
    private final Map<UUID, Integer> idToIndex;

    private DataDependencyIndex(Node[] nodes, int[] childrenOffset, int[] childrenList,
            int[] inDegree, Map<UUID, Integer> idToIndex) {
        this.nodes = nodes;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.inDegree = inDegree;
        this.idToIndex = idToIndex;
    }

    /** Indexes every node of {@code graph} and its resolved data connections between member nodes. */
    public static DataDependencyIndex of(NodeGraph graph) {
        Builder b = builder();
        for (Node node : graph.getNodes()) {
            b.addNode(node);
        }
        for (Connection c : graph.getConnections()) {
            if (!c.isResolved() || c.isFlow()) {
                continue;
            }
            Node from = c.getSourceNode();
            Node to = c.getTargetNode();
            if (graph.containsNode(from) && graph.containsNode(to)) {
                b.addEdge(from.getId(), to.getId());
            }
        }
        return b.build();
    }

    public int nodeCount() {
        return nodes.length;
    }

    public Node node(int i) {
        return nodes[i];
    }

    /** Resolves a node id to its index. */
    public int indexOf(UUID nodeId) {
        Integer idx = idToIndex.get(nodeId);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        return idx;
    }

    public boolean contains(UUID nodeId) {
        return idToIndex.containsKey(nodeId);
    }

    /** A source has no incoming data edge: no data inputs, or none connected. */
    public boolean isSource(int i) {
        return inDegree[i] == 0;
    }

    public int inDegree(int i) {
        return inDegree[i];
    }

    /** Copy of the in-degree array, for a scheduler to count down. */
    public int[] inDegrees() {
        return inDegree.clone();
    }

    public int childCount(int i) {
        return childrenOffset[i + 1] - childrenOffset[i];
    }

    public int childrenStart(int i) {
        return childrenOffset[i];
    }

    public int childrenEnd(int i) {
        return childrenOffset[i + 1];
    }

    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Node> nodes = new ArrayList<>();
        private final Map<UUID, Integer> idToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(Node node) {
            if (idToIdx.containsKey(node.getId()))
                throw new IllegalArgumentException("Duplicate node id: " + node.getId());
            idToIdx.put(node.getId(), nodes.size());
            nodes.add(node);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /** A self-edge is kept: its node never becomes ready and shows up as a cycle. */
        public Builder addEdge(UUID from, UUID to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(UUID id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + id);
            return idx;
        }

        public DataDependencyIndex build() {
            int n = nodes.size();
            int[] inDegree = new int[n];
            int[] offsets = new int[n + 1];
            for (int i = 0; i < n; i++) {
                List<Integer> children = forwardEdges.get(i);
                offsets[i + 1] = offsets[i] + children.size();
                for (int child : children)
                    inDegree[child]++;
            }

            int[] flatChildren = new int[offsets[n]];
            for (int i = 0; i < n; i++) {
                List<Integer> children = forwardEdges.get(i);
                int base = offsets[i];
                for (int j = 0; j < children.size(); j++)
                    flatChildren[base + j] = children.get(j);
            }
            return new DataDependencyIndex(nodes.toArray(new Node[0]), offsets, flatChildren, inDegree,
                    new HashMap<>(idToIdx));
        }
    }
}
