package com.nodeflow.util;

import org.junit.Test;

import java.util.UUID;

import static org.junit.Assert.*;

public class NodeProfileListenerTest {

    @Test
    public void testAggregatesPerNode() {
        NodeProfileListener profile = new NodeProfileListener();
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();

        profile.onNodeExecuted(1, a, "A", 1_000);
        profile.onNodeExecuted(2, a, "A", 3_000);
        profile.onNodeExecuted(2, b, "B", 500);
        profile.onNodeError(3, b, "B", new RuntimeException());

        NodeProfileListener.NodeStats sa = profile.statsFor(a);
        assertEquals(2, sa.count);
        assertEquals(1_000, sa.minDurationNanos);
        assertEquals(3_000, sa.maxDurationNanos);
        assertEquals(3_000, sa.lastDurationNanos);
        assertEquals(2.0, sa.avgMicros(), 1e-9);
        assertEquals(1, profile.statsFor(b).errors);
        assertNull(profile.statsFor(UUID.randomUUID()));
    }

    @Test
    public void testDumpListsSlowestFirst() {
        NodeProfileListener profile = new NodeProfileListener();
        profile.onNodeExecuted(1, UUID.randomUUID(), "Fast", 100);
        profile.onNodeExecuted(1, UUID.randomUUID(), "Slow", 900_000);

        String dump = profile.dump();

        assertTrue(dump.startsWith(String.format("%-30s", "Node Name")));
        assertTrue(dump.indexOf("Slow") < dump.indexOf("Fast"));
    }

    @Test
    public void testReset() {
        NodeProfileListener profile = new NodeProfileListener();
        profile.onNodeExecuted(1, UUID.randomUUID(), "A", 1);
        profile.reset();
        assertTrue(profile.allStats().isEmpty());
    }
}
