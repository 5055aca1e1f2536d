package com.nodeflow.io;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;
import com.nodeflow.node.ActionNode;
import com.nodeflow.node.BranchNode;
import com.nodeflow.node.CalcNode;
import com.nodeflow.node.ConstantNode;
import com.nodeflow.node.EventNode;
import com.nodeflow.node.LoopNode;
import com.nodeflow.node.SinkNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registry mapping type keys to node factories and their pin metadata.
 *
 * Pin metadata is captured from a prototype created at registration, so it
 * always matches what the factory builds. Each type key maps to exactly one
 * concrete class and each class to one key; persistence relies on that to
 * name a live node's type.
 */
public final class NodeRegistry {

    private final Map<String, NodeMetadata> registry = new LinkedHashMap<>();
    private final Map<Class<? extends Node>, String> keysByClass = new HashMap<>();

    /** Registry with the built-in node types. */
    public static NodeRegistry withBuiltIns() {
        NodeRegistry r = new NodeRegistry();
        r.registerBuiltIns();
        return r;
    }

    /**
     * Registers a node type.
     *
     * @throws IllegalArgumentException if the key or the produced class is already registered.
     */
    public NodeMetadata register(String typeKey, String displayName, String path, NodeFactory factory) {
        Objects.requireNonNull(typeKey, "typeKey");
        Objects.requireNonNull(factory, "factory");
        if (registry.containsKey(typeKey))
            throw new IllegalArgumentException("Duplicate node type: " + typeKey);

        Node prototype = factory.create();
        if (prototype == null)
            throw new IllegalArgumentException("Factory for " + typeKey + " returned null");
        Class<? extends Node> nodeClass = prototype.getClass();
        String existing = keysByClass.get(nodeClass);
        if (existing != null)
            throw new IllegalArgumentException(nodeClass.getName() + " already registered as " + existing);

        NodeMetadata metadata = new NodeMetadata(typeKey, displayName != null ? displayName : typeKey,
                path != null ? path : "", nodeClass, describe(prototype.getInputPins()),
                describe(prototype.getOutputPins()), factory);
        registry.put(typeKey, metadata);
        keysByClass.put(nodeClass, typeKey);
        return metadata;
    }

    public NodeMetadata register(String typeKey, NodeFactory factory) {
        return register(typeKey, typeKey, "", factory);
    }

    private static List<PinMetadata> describe(List<Pin> pins) {
        List<PinMetadata> out = new ArrayList<>(pins.size());
        for (Pin pin : pins) {
            out.add(PinMetadata.of(pin));
        }
        return out;
    }

    /**
     * Creates a new node of the given type.
     *
     * @throws IllegalArgumentException if the type is unknown.
     */
    public Node create(String typeKey) {
        return requireMetadata(typeKey).factory().create();
    }

    public NodeMetadata metadataFor(String typeKey) {
        return registry.get(typeKey);
    }

    public NodeMetadata requireMetadata(String typeKey) {
        NodeMetadata m = registry.get(typeKey);
        if (m == null)
            throw new IllegalArgumentException("Unknown node type: " + typeKey);
        return m;
    }

    /**
     * Type key of a live node.
     *
     * @throws IllegalArgumentException if the node's class is not registered.
     */
    public String typeKeyOf(Node node) {
        String key = keysByClass.get(node.getClass());
        if (key == null)
            throw new IllegalArgumentException("Unregistered node class: " + node.getClass().getName());
        return key;
    }

    public boolean contains(String typeKey) {
        return registry.containsKey(typeKey);
    }

    /** All types, in registration order. */
    public Collection<NodeMetadata> all() {
        return Collections.unmodifiableCollection(registry.values());
    }

    // ── Built-in Factories ──────────────────────────────────────────

    public void registerBuiltIns() {
        // --- Data Nodes ---
        register("Constant", "Constant", "Data", ConstantNode::new);
        register("Add", "Add", "Math", CalcNode.Add::new);
        register("Subtract", "Subtract", "Math", CalcNode.Subtract::new);
        register("Multiply", "Multiply", "Math", CalcNode.Multiply::new);
        register("Sink", "Sink", "Data", SinkNode::new);

        // --- Flow Nodes ---
        register("Event", "Start Event", "Flow", EventNode::new);
        register("Branch", "Branch", "Flow", BranchNode::new);
        register("Loop", "Loop", "Flow", LoopNode::new);
        register("Action", "Action", "Flow", ActionNode::new);
    }
}
