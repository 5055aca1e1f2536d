package com.nodeflow.engine;

import com.nodeflow.TestNodes;
import com.nodeflow.api.NodeGraphCategory;
import com.nodeflow.model.Connection;
import com.nodeflow.model.NodeGraph;
import com.nodeflow.node.EventNode;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.*;

public class DataDependencyIndexTest {

    @Test
    public void testBuilderComputesChildrenAndInDegrees() {
        TestNodes.Plain a = new TestNodes.Plain("A");
        TestNodes.Plain b = new TestNodes.Plain("B");
        TestNodes.Plain c = new TestNodes.Plain("C");

        // A -> B, A -> C, B -> C
        DataDependencyIndex index = DataDependencyIndex.builder()
                .addNode(a)
                .addNode(b)
                .addNode(c)
                .addEdge(a.getId(), b.getId())
                .addEdge(a.getId(), c.getId())
                .addEdge(b.getId(), c.getId())
                .build();

        assertEquals(3, index.nodeCount());
        int ia = index.indexOf(a.getId());
        int ic = index.indexOf(c.getId());
        assertSame(a, index.node(ia));
        assertEquals(2, index.childCount(ia));
        assertEquals(0, index.childCount(ic));
        assertArrayEquals(new int[] {0, 1, 2}, index.inDegrees());
        assertTrue(index.isSource(ia));
        assertFalse(index.isSource(ic));

        List<Integer> children = new ArrayList<>();
        for (int i = index.childrenStart(ia); i < index.childrenEnd(ia); i++)
            children.add(index.childAt(i));
        assertEquals(List.of(index.indexOf(b.getId()), ic), children);
    }

    @Test
    public void testInDegreesIsACopy() {
        TestNodes.Plain a = new TestNodes.Plain("A");
        TestNodes.Plain b = new TestNodes.Plain("B");
        DataDependencyIndex index = DataDependencyIndex.builder()
                .addNode(a).addNode(b).addEdge(a.getId(), b.getId()).build();

        int[] pending = index.inDegrees();
        pending[1] = 0;
        assertEquals(1, index.inDegree(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNodeRejected() {
        TestNodes.Plain a = new TestNodes.Plain("A");
        DataDependencyIndex.builder().addNode(a).addNode(a);
    }

    @Test
    public void testSelfEdgeKeepsNodeBlocked() {
        TestNodes.Plain a = new TestNodes.Plain("A");
        TestNodes.Plain b = new TestNodes.Plain("B");
        DataDependencyIndex index = DataDependencyIndex.builder().addNode(a).addNode(b)
                .addEdge(a.getId(), a.getId()).build();

        assertFalse(index.isSource(index.indexOf(a.getId())));
        assertEquals(1, index.inDegree(index.indexOf(a.getId())));
        assertTrue(index.isSource(index.indexOf(b.getId())));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEdgeToUnknownNodeRejected() {
        TestNodes.Plain a = new TestNodes.Plain("A");
        DataDependencyIndex.builder().addNode(a).addEdge(a.getId(), UUID.randomUUID());
    }

    @Test
    public void testFromGraphIgnoresFlowAndUnresolvedConnections() {
        NodeGraph graph = new NodeGraph("g", NodeGraphCategory.CONTROL_FLOW);
        List<String> log = new ArrayList<>();
        EventNode start = new EventNode("Start");
        TestNodes.Step step = new TestNodes.Step("S", log);
        TestNodes.Source src = new TestNodes.Source("Src", 1);
        TestNodes.PlusOne plus = new TestNodes.PlusOne("P");
        graph.connect(start.exec(), step.in);
        graph.connect(src.y, plus.x);
        graph.addConnection(new Connection(UUID.randomUUID(), UUID.randomUUID()));

        DataDependencyIndex index = DataDependencyIndex.of(graph);

        assertEquals(4, index.nodeCount());
        assertTrue(index.isSource(index.indexOf(step.getId())));
        assertEquals(1, index.inDegree(index.indexOf(plus.getId())));
        assertEquals(1, index.childCount(index.indexOf(src.getId())));
        assertTrue(index.contains(start.getId()));
        assertFalse(index.contains(UUID.randomUUID()));
    }
}
