package com.nodeflow.io;

import com.nodeflow.TestNodes;
import com.nodeflow.api.NodeGraphCategory;
import com.nodeflow.engine.CancellationToken;
import com.nodeflow.engine.ControlFlowEngine;
import com.nodeflow.engine.ControlFlowResult;
import com.nodeflow.engine.DataFlowEngine;
import com.nodeflow.engine.DataFlowResult;
import com.nodeflow.model.Connection;
import com.nodeflow.model.Node;
import com.nodeflow.model.NodeGraph;
import com.nodeflow.model.NodeGroup;
import com.nodeflow.model.Point;
import com.nodeflow.model.Rect;
import com.nodeflow.node.ActionNode;
import com.nodeflow.node.CalcNode;
import com.nodeflow.node.ConstantNode;
import com.nodeflow.node.EventNode;
import com.nodeflow.node.LoopNode;
import com.nodeflow.node.SinkNode;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class GraphSerializerTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private GraphSerializer serializer;

    @Before
    public void setUp() {
        serializer = new GraphSerializer(NodeRegistry.withBuiltIns());
    }

    private static NodeGraph arithmeticGraph() {
        NodeGraph graph = new NodeGraph("arith", NodeGraphCategory.DATA_FLOW);
        ConstantNode two = new ConstantNode("Two", 2.0);
        ConstantNode three = new ConstantNode("Three", 3.0);
        CalcNode add = new CalcNode.Add();
        SinkNode sink = new SinkNode("Out");
        two.setPosition(new Point(10, 20));
        graph.connect(two.output(), add.a());
        graph.connect(three.output(), add.b());
        graph.connect(add.result(), sink.input());
        graph.setMainNode(sink);

        NodeGroup math = new NodeGroup("Math", new Rect(0, 0, 300, 200));
        NodeGroup inner = new NodeGroup("Inner", new Rect(10, 10, 100, 100));
        graph.addGroup(math);
        graph.addGroup(inner, math);
        graph.moveNodeToGroup(add, math);
        graph.moveNodeToGroup(sink, inner);
        return graph;
    }

    private static Set<UUID> nodeIds(NodeGraph graph) {
        return graph.getNodes().stream().map(Node::getId).collect(Collectors.toSet());
    }

    private static Set<UUID> connectionIds(NodeGraph graph) {
        return graph.getConnections().stream().map(Connection::getId).collect(Collectors.toSet());
    }

    @Test
    public void testRoundTripPreservesStructure() {
        NodeGraph original = arithmeticGraph();

        NodeGraph loaded = serializer.load(serializer.save(original));

        assertEquals(original.getId(), loaded.getId());
        assertEquals("arith", loaded.getName());
        assertEquals(NodeGraphCategory.DATA_FLOW, loaded.getCategory());
        assertEquals(nodeIds(original), nodeIds(loaded));
        assertEquals(connectionIds(original), connectionIds(loaded));
        assertEquals(original.validate(), loaded.validate());
        assertTrue(loaded.validate());
        assertEquals(original.getMainNodeId(), loaded.getMainNodeId());
        assertTrue(loaded.isMainNodeValid());

        for (Connection c : loaded.getConnections()) {
            assertTrue(c.isResolved());
        }
    }

    @Test
    public void testRoundTripPreservesGroupsAndPositions() {
        NodeGraph original = arithmeticGraph();
        Node sink = original.getMainNode();

        NodeGraph loaded = serializer.load(serializer.save(original));

        assertEquals(1, loaded.getGroups().size());
        NodeGroup math = loaded.getGroups().get(0);
        assertEquals("Math", math.getName());
        assertEquals(new Rect(0, 0, 300, 200), math.getBounds());
        assertEquals(1, math.getChildren().size());
        NodeGroup inner = math.getChildren().get(0);
        assertSame(math, inner.getParent());

        Node loadedSink = loaded.findNode(sink.getId());
        assertSame(inner, loadedSink.getGroup());
        assertTrue(math.containsNodeRecursive(loadedSink));

        Node two = loaded.getNodes().stream().filter(n -> n.getName().equals("Two")).findFirst().orElseThrow();
        assertEquals(new Point(10, 20), two.getPosition());
        assertNull(two.getGroup());
    }

    @Test
    public void testLoadedDataFlowGraphExecutes() {
        NodeGraph loaded = serializer.load(serializer.save(arithmeticGraph()));

        DataFlowResult result = new DataFlowEngine().execute(loaded, CancellationToken.NONE);

        assertEquals(5.0, (Double) result.output(loaded.getMainNodeId(), SinkNode.INPUT), 1e-9);
    }

    @Test
    public void testLoadedControlFlowGraphExecutes() {
        NodeGraph graph = new NodeGraph("cf", NodeGraphCategory.CONTROL_FLOW);
        EventNode start = new EventNode();
        LoopNode loop = new LoopNode("Loop", 2);
        ActionNode body = new ActionNode();
        graph.connect(start.exec(), loop.in());
        graph.connect(loop.body(), body.in());
        graph.connect(body.out(), loop.in());
        graph.setMainNode(start);

        NodeGraph loaded = serializer.load(serializer.save(graph));
        ControlFlowResult result = new ControlFlowEngine().execute(loaded, CancellationToken.NONE);

        assertEquals(ControlFlowResult.Status.COMPLETED, result.status());
        // start, loop, body, loop, body, loop
        assertEquals(6, result.steps());
        LoopNode loadedLoop = (LoopNode) loaded.findNode(loop.getId());
        assertEquals(2, loadedLoop.count().getValue());
    }

    @Test
    public void testLoadsHandWrittenGraph() {
        String json = """
                {
                  "id": "00000000-0000-0000-0000-000000000001",
                  "name": "fixture",
                  "category": "DATA_FLOW",
                  "mainNodeId": "00000000-0000-0000-0000-000000000040",
                  "editorZoom": 1.5,
                  "nodes": [
                    { "id": "00000000-0000-0000-0000-000000000010", "type": "Constant", "name": "A",
                      "outputPins": [ { "id": "00000000-0000-0000-0000-000000000011", "name": "value",
                                        "value": 2.5, "valueType": "java.lang.Double" } ] },
                    { "id": "00000000-0000-0000-0000-000000000020", "type": "Constant", "name": "B",
                      "outputPins": [ { "id": "00000000-0000-0000-0000-000000000021", "name": "value",
                                        "value": 4, "valueType": "java.lang.Integer" } ] },
                    { "id": "00000000-0000-0000-0000-000000000030", "type": "Add",
                      "groupId": "00000000-0000-0000-0000-000000000050",
                      "inputPins": [ { "id": "00000000-0000-0000-0000-000000000031" },
                                     { "id": "00000000-0000-0000-0000-000000000032" } ],
                      "outputPins": [ { "id": "00000000-0000-0000-0000-000000000033" } ] },
                    { "id": "00000000-0000-0000-0000-000000000040", "type": "Sink", "name": "Result",
                      "inputPins": [ { "id": "00000000-0000-0000-0000-000000000041" } ] }
                  ],
                  "connections": [
                    { "id": "00000000-0000-0000-0000-000000000061",
                      "sourcePinId": "00000000-0000-0000-0000-000000000011",
                      "targetPinId": "00000000-0000-0000-0000-000000000031" },
                    { "id": "00000000-0000-0000-0000-000000000062",
                      "sourcePinId": "00000000-0000-0000-0000-000000000021",
                      "targetPinId": "00000000-0000-0000-0000-000000000032" },
                    { "id": "00000000-0000-0000-0000-000000000063",
                      "sourcePinId": "00000000-0000-0000-0000-000000000033",
                      "targetPinId": "00000000-0000-0000-0000-000000000041" },
                    { "id": "00000000-0000-0000-0000-000000000064",
                      "sourcePinId": "00000000-0000-0000-0000-000000000098",
                      "targetPinId": "00000000-0000-0000-0000-000000000099" }
                  ],
                  "groups": [
                    { "id": "00000000-0000-0000-0000-000000000050", "name": "Math",
                      "bounds": { "x": 0, "y": 0, "width": 200, "height": 100 } }
                  ]
                }
                """;

        NodeGraph graph = serializer.load(json);

        assertEquals(4, graph.getNodes().size());
        assertEquals(4, graph.getConnections().size());
        // The dangling connection survives unresolved
        Connection dangling = graph.getConnections().stream()
                .filter(c -> !c.isResolved()).findFirst().orElseThrow();
        assertEquals(UUID.fromString("00000000-0000-0000-0000-000000000064"), dangling.getId());
        assertFalse(graph.validate());

        Node b = graph.findNode(UUID.fromString("00000000-0000-0000-0000-000000000020"));
        assertEquals(4, ((ConstantNode) b).getValue());
        Node add = graph.findNode(UUID.fromString("00000000-0000-0000-0000-000000000030"));
        assertEquals("Math", add.getGroup().getName());

        DataFlowResult result = new DataFlowEngine().execute(graph, CancellationToken.NONE);
        assertEquals(6.5, (Double) result.output(graph.getMainNodeId(), SinkNode.INPUT), 1e-9);
    }

    static volatile boolean markerInitialized;

    /** Must never be touched by a load. */
    public static class Marker {
        static {
            markerInitialized = true;
        }

        public String label;
    }

    @Test
    public void testForeignValueTypeIsIgnored() {
        String json = """
                {
                  "name": "foreign",
                  "category": "DATA_FLOW",
                  "nodes": [
                    { "id": "00000000-0000-0000-0000-000000000010", "type": "Constant", "name": "C",
                      "outputPins": [ { "value": { "label": "x" },
                                        "valueType": "com.nodeflow.io.GraphSerializerTest$Marker" } ] },
                    { "id": "00000000-0000-0000-0000-000000000020", "type": "Constant", "name": "N",
                      "outputPins": [ { "value": 3, "valueType": "java.lang.Long" } ] }
                  ]
                }
                """;

        NodeGraph graph = serializer.load(json);

        assertFalse(markerInitialized);
        Object value = ((ConstantNode) graph.findNode(UUID.fromString("00000000-0000-0000-0000-000000000010")))
                .getValue();
        assertTrue(value instanceof Map);
        assertEquals("x", ((Map<?, ?>) value).get("label"));
        // Listed types are still honoured
        assertEquals(3L, ((ConstantNode) graph.findNode(UUID.fromString("00000000-0000-0000-0000-000000000020")))
                .getValue());
    }

    @Test
    public void testUnknownNodeTypeFailsLoad() {
        String json = """
                { "name": "bad", "category": "DATA_FLOW",
                  "nodes": [ { "id": "00000000-0000-0000-0000-000000000010", "type": "Teleporter" } ] }
                """;
        try {
            serializer.load(json);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("Teleporter"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJsonFailsLoad() {
        serializer.load("{ \"nodes\": [ ");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnregisteredNodeClassFailsSave() {
        NodeGraph graph = new NodeGraph("g", NodeGraphCategory.DATA_FLOW);
        graph.addNode(new TestNodes.Plain("P"));
        serializer.save(graph);
    }

    @Test
    public void testWriteAndReadFile() throws Exception {
        NodeGraph original = arithmeticGraph();
        Path file = tmp.newFile("graph.json").toPath();

        serializer.write(original, file);
        NodeGraph loaded = serializer.read(file);

        assertEquals(nodeIds(original), nodeIds(loaded));
        assertEquals(connectionIds(original), connectionIds(loaded));
    }

    @Test
    public void testSaveDataSnapshot() {
        NodeGraph original = arithmeticGraph();

        GraphSaveData data = GraphSaveData.fromModel(original, serializer.registry());

        assertEquals(4, data.getNodes().size());
        assertEquals(3, data.getConnections().size());
        assertEquals(2, data.getGroups().size());
        GraphSaveData.NodeData two = data.getNodes().get(0);
        assertEquals("Constant", two.getType());
        assertEquals("java.lang.Double", two.getOutputPins().get(0).getValueType());
        assertEquals(2.0, two.getOutputPins().get(0).getValue());
    }
}
