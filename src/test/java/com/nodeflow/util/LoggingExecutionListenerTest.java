package com.nodeflow.util;

import com.nodeflow.api.NodeGraphCategory;
import org.junit.Test;

import java.util.UUID;

import static org.junit.Assert.*;

public class LoggingExecutionListenerTest {

    @Test
    public void testTracksRunsAndErrors() {
        LoggingExecutionListener listener = new LoggingExecutionListener();
        UUID graph = UUID.randomUUID();

        listener.onRunStart(1, graph, NodeGraphCategory.DATA_FLOW);
        listener.onNodeExecuted(1, UUID.randomUUID(), "A", 100);
        listener.onRunEnd(1, 1);

        listener.onRunStart(2, graph, NodeGraphCategory.DATA_FLOW);
        listener.onNodeError(2, UUID.randomUUID(), "B", new IllegalStateException("bad"));
        listener.onRunEnd(2, 0);

        assertEquals(2, listener.totalRuns());
        assertEquals(1, listener.totalErrors());
        assertEquals(0, listener.lastNodesExecuted());
        assertTrue(listener.minLatencyNanos() <= listener.maxLatencyNanos());
        assertTrue(listener.dump().contains("Graph runs"));

        listener.reset();
        assertEquals(0, listener.totalRuns());
        assertEquals(0, listener.minLatencyNanos());
        assertEquals(0.0, listener.avgLatencyMicros(), 0.0);
    }
}
