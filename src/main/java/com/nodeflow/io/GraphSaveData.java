package com.nodeflow.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodeflow.api.NodeGraphCategory;
import com.nodeflow.api.PinDirection;
import com.nodeflow.model.Connection;
import com.nodeflow.model.Node;
import com.nodeflow.model.NodeGraph;
import com.nodeflow.model.NodeGroup;
import com.nodeflow.model.Pin;
import com.nodeflow.model.Point;
import com.nodeflow.model.Rect;
import lombok.Data;
import lombok.extern.log4j.Log4j2;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted form of a node graph.
 *
 * Every relationship is stored as an id: nodes carry their group id,
 * connections their pin ids, groups their parent id. {@link #toModel} restores
 * the entities and lets {@link NodeGraph#onDeserialized()} rebuild the live
 * references.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphSaveData {

    // Stored value types a load may honour. Any other name falls back to the pin's declared type.
    private static final Map<String, Class<?>> VALUE_TYPES = valueTypes(String.class, Boolean.class,
            Character.class, Byte.class, Short.class, Integer.class, Long.class, Float.class, Double.class,
            BigInteger.class, BigDecimal.class);

    private UUID id;
    private String name;
    private NodeGraphCategory category;
    private UUID mainNodeId;
    private boolean replaceInputConnection = true;
    private List<NodeData> nodes = new ArrayList<>();
    private List<ConnectionData> connections = new ArrayList<>();
    private List<GroupData> groups = new ArrayList<>();

    /** A node with its type key and pins. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeData {
        private UUID id;
        private String type;
        private String name;
        private Point position;
        private UUID groupId;
        private boolean enabled = true;
        private List<PinData> inputPins = new ArrayList<>();
        private List<PinData> outputPins = new ArrayList<>();
    }

    /** A pin. Restored by position, the other fields are informational. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class PinData {
        private UUID id;
        private String name;
        private PinDirection direction;
        private String dataType;
        private boolean flowPin;
        private Object value;
        private String valueType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConnectionData {
        private UUID id;
        private UUID sourcePinId;
        private UUID targetPinId;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class GroupData {
        private UUID id;
        private String name;
        private Rect bounds;
        private UUID parentId;
        private List<UUID> memberNodeIds = new ArrayList<>();
    }

    // -- Snapshot -----------------------------------------------------------

    /**
     * Captures {@code graph}.
     *
     * @throws IllegalArgumentException if a node's class is not in the registry.
     */
    public static GraphSaveData fromModel(NodeGraph graph, NodeRegistry registry) {
        GraphSaveData data = new GraphSaveData();
        data.setId(graph.getId());
        data.setName(graph.getName());
        data.setCategory(graph.getCategory());
        data.setMainNodeId(graph.getMainNodeId());
        data.setReplaceInputConnection(graph.isReplaceInputConnection());

        for (Node node : graph.getNodes()) {
            NodeData nd = new NodeData();
            nd.setId(node.getId());
            nd.setType(registry.typeKeyOf(node));
            nd.setName(node.getName());
            nd.setPosition(node.getPosition());
            nd.setGroupId(node.getGroupId());
            nd.setEnabled(node.isEnabled());
            for (Pin pin : node.getInputPins()) {
                nd.getInputPins().add(snapshot(pin));
            }
            for (Pin pin : node.getOutputPins()) {
                nd.getOutputPins().add(snapshot(pin));
            }
            data.getNodes().add(nd);
        }

        for (Connection c : graph.getConnections()) {
            ConnectionData cd = new ConnectionData();
            cd.setId(c.getId());
            cd.setSourcePinId(c.getSourcePinId());
            cd.setTargetPinId(c.getTargetPinId());
            data.getConnections().add(cd);
        }

        for (NodeGroup g : graph.getAllGroupsRecursive()) {
            GroupData gd = new GroupData();
            gd.setId(g.getId());
            gd.setName(g.getName());
            gd.setBounds(g.getBounds());
            gd.setParentId(g.getParent() != null ? g.getParent().getId() : null);
            for (Node member : g.getNodes()) {
                gd.getMemberNodeIds().add(member.getId());
            }
            data.getGroups().add(gd);
        }
        return data;
    }

    private static PinData snapshot(Pin pin) {
        PinData pd = new PinData();
        pd.setId(pin.getId());
        pd.setName(pin.getName());
        pd.setDirection(pin.getDirection());
        pd.setDataType(pin.getDataType().getName());
        pd.setFlowPin(pin.isFlowPin());
        Object value = pin.getValue();
        if (!pin.isFlowPin() && value != null) {
            pd.setValue(value);
            pd.setValueType(value.getClass().getName());
        }
        return pd;
    }

    // -- Restore ------------------------------------------------------------

    public NodeGraph toModel(NodeRegistry registry) {
        return toModel(registry, GraphSerializer.defaultMapper());
    }

    /**
     * Rebuilds a live graph, creating nodes through the registry.
     *
     * @throws IllegalArgumentException if a node type is unknown to the registry.
     */
    public NodeGraph toModel(NodeRegistry registry, ObjectMapper mapper) {
        NodeGraph graph = new NodeGraph();
        if (id != null)
            graph.setId(id);
        graph.setName(name != null ? name : "");
        graph.setCategory(category != null ? category : NodeGraphCategory.CONTROL_FLOW);
        graph.setReplaceInputConnection(replaceInputConnection);

        restoreGroups(graph);

        Map<UUID, UUID> memberships = new LinkedHashMap<>();
        for (GroupData gd : nullSafe(groups)) {
            for (UUID member : nullSafe(gd.getMemberNodeIds())) {
                memberships.putIfAbsent(member, gd.getId());
            }
        }

        for (NodeData nd : nullSafe(nodes)) {
            Node node = registry.create(nd.getType());
            if (nd.getId() != null)
                node.setId(nd.getId());
            if (nd.getName() != null)
                node.setName(nd.getName());
            if (nd.getPosition() != null)
                node.setPosition(nd.getPosition());
            node.setEnabled(nd.isEnabled());
            node.setGroupId(nd.getGroupId() != null ? nd.getGroupId() : memberships.get(node.getId()));
            restorePins(node, node.getInputPins(), nd.getInputPins(), mapper);
            restorePins(node, node.getOutputPins(), nd.getOutputPins(), mapper);
            graph.addNode(node);
        }

        for (ConnectionData cd : nullSafe(connections)) {
            Connection c = new Connection(cd.getSourcePinId(), cd.getTargetPinId());
            if (cd.getId() != null)
                c.setId(cd.getId());
            graph.addConnection(c);
        }

        graph.setMainNodeId(mainNodeId);
        graph.onDeserialized();
        return graph;
    }

    private void restoreGroups(NodeGraph graph) {
        Map<UUID, NodeGroup> byId = new LinkedHashMap<>();
        for (GroupData gd : nullSafe(groups)) {
            NodeGroup g = new NodeGroup(gd.getName() != null ? gd.getName() : "Group");
            if (gd.getId() != null)
                g.setId(gd.getId());
            if (gd.getBounds() != null)
                g.setBounds(gd.getBounds());
            byId.put(g.getId(), g);
        }
        for (GroupData gd : nullSafe(groups)) {
            NodeGroup g = byId.get(gd.getId());
            NodeGroup parent = gd.getParentId() != null ? byId.get(gd.getParentId()) : null;
            if (g == null)
                continue;
            if (parent == null || !parent.addChild(g)) {
                graph.addGroup(g);
            }
        }
    }

    private static void restorePins(Node node, List<Pin> pins, List<PinData> saved, ObjectMapper mapper) {
        List<PinData> data = nullSafe(saved);
        if (data.size() != pins.size()) {
            log.warn("Node {} declares {} pins but {} were saved; restoring by position", node, pins.size(),
                    data.size());
        }
        int n = Math.min(pins.size(), data.size());
        for (int i = 0; i < n; i++) {
            Pin pin = pins.get(i);
            PinData pd = data.get(i);
            if (pd.getId() != null)
                pin.setId(pd.getId());
            if (!pin.isFlowPin()) {
                pin.setValue(convert(pd, pin, mapper));
            }
        }
    }

    private static Object convert(PinData pd, Pin pin, ObjectMapper mapper) {
        Object raw = pd.getValue();
        if (raw == null) {
            return null;
        }
        Class<?> target = pin.getDataType();
        String savedType = pd.getValueType();
        if (savedType != null && !savedType.equals(target.getName())) {
            Class<?> saved = VALUE_TYPES.get(savedType);
            if (saved != null && target.isAssignableFrom(saved)) {
                target = saved;
            } else {
                log.debug("Ignoring value type {} of pin {}, using {}", savedType, pin, target.getName());
            }
        }
        if (target.isInstance(raw)) {
            return raw;
        }
        return mapper.convertValue(raw, target);
    }

    private static Map<String, Class<?>> valueTypes(Class<?>... types) {
        Map<String, Class<?>> byName = new HashMap<>();
        for (Class<?> type : types) {
            byName.put(type.getName(), type);
        }
        return Map.copyOf(byName);
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
