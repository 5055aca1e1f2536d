package com.nodeflow.node;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class LoopNodeTest {

    @Test
    public void testFiresBodyThenCompletedAndResets() {
        LoopNode loop = new LoopNode("L", 2);

        loop.execute();
        assertEquals(List.of(loop.body()), loop.firedFlowOutputs());
        assertEquals(0, loop.index().getValue());

        loop.execute();
        assertEquals(List.of(loop.body()), loop.firedFlowOutputs());
        assertEquals(1, loop.index().getValue());

        loop.execute();
        assertEquals(List.of(loop.completed()), loop.firedFlowOutputs());
        assertEquals(0, loop.getIteration());

        // A new round starts over
        loop.execute();
        assertEquals(List.of(loop.body()), loop.firedFlowOutputs());
    }

    @Test
    public void testPrepareRunClearsIteration() {
        LoopNode loop = new LoopNode("L", 3);
        loop.execute();
        loop.execute();
        assertEquals(2, loop.getIteration());

        loop.prepareRun();
        assertEquals(0, loop.getIteration());
        loop.execute();
        assertEquals(0, loop.index().getValue());
    }

    @Test
    public void testZeroCountCompletesImmediately() {
        LoopNode loop = new LoopNode();
        loop.execute();
        assertEquals(List.of(loop.completed()), loop.firedFlowOutputs());
    }
}
