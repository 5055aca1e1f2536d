package com.nodeflow.model;

import com.nodeflow.TestNodes;
import org.junit.Before;
import org.junit.Test;

import java.util.UUID;

import static org.junit.Assert.*;

public class ConnectionTest {

    private Node a;
    private Node b;
    private Pin out;
    private Pin in;

    @Before
    public void setUp() {
        a = new TestNodes.Plain("A");
        b = new TestNodes.Plain("B");
        out = a.addOutputPin("out", Integer.class);
        in = b.addInputPin("in", Integer.class, -1);
    }

    @Test
    public void testCreationPushesSourceValue() {
        out.setValue(7);
        Connection c = new Connection(out, in);

        assertEquals(7, in.getValue());
        assertSame(out, c.getSourcePin());
        assertSame(in, c.getTargetPin());
        assertEquals(out.getId(), c.getSourcePinId());
        assertEquals(in.getId(), c.getTargetPinId());
        assertTrue(out.getConnections().contains(c));
        assertTrue(in.getConnections().contains(c));
    }

    @Test
    public void testSourceChangePropagatesWhileAttached() {
        new Connection(out, in);
        out.setValue(3);
        assertEquals(3, in.getValue());
    }

    @Test
    public void testDisconnectResetsTargetAndStopsPropagation() {
        Connection c = new Connection(out, in);
        out.setValue(3);

        c.disconnect();

        assertEquals(-1, in.getValue());
        assertFalse(in.isConnected());
        assertFalse(out.isConnected());
        assertNull(c.getSourcePin());

        out.setValue(9);
        assertEquals(-1, in.getValue());
    }

    @Test
    public void testValidity() {
        Connection c = new Connection(out, in);
        assertTrue(c.isValid());

        // Wrong direction built by hand
        Pin otherIn = a.addInputPin("x", Integer.class);
        Connection backwards = new Connection(in, otherIn);
        assertFalse(backwards.isValid());

        Connection unresolved = new Connection(UUID.randomUUID(), UUID.randomUUID());
        assertFalse(unresolved.isResolved());
        assertFalse(unresolved.isValid());
    }

    @Test
    public void testTypeMismatchIsInvalid() {
        Pin text = b.addInputPin("text", String.class);
        Connection c = new Connection(out, text);
        assertFalse(c.isValid());
    }

    @Test
    public void testFlowConnectionCarriesNoValue() {
        Pin exec = a.addFlowOutput("Exec");
        Pin enter = b.addFlowInput("In");
        Connection c = new Connection(exec, enter);

        assertTrue(c.isFlow());
        assertTrue(c.isValid());
        c.transfer();
        assertNull(enter.getValue());
    }
}
