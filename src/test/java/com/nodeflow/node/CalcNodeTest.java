package com.nodeflow.node;

import org.junit.Test;

import static org.junit.Assert.*;

public class CalcNodeTest {

    @Test
    public void testBuiltInOperations() {
        CalcNode sub = new CalcNode.Subtract();
        sub.a().setValue(10);
        sub.b().setValue(2.5);
        sub.execute();
        assertEquals(7.5, (Double) sub.result().getValue(), 1e-9);

        CalcNode mul = new CalcNode.Multiply();
        mul.a().setValue(3L);
        mul.b().setValue(4.0f);
        mul.execute();
        assertEquals(12.0, (Double) mul.result().getValue(), 1e-9);
    }

    @Test
    public void testUnsetInputsDefaultToZero() {
        CalcNode add = new CalcNode.Add();
        add.execute();
        assertEquals(0.0, (Double) add.result().getValue(), 0.0);
    }

    @Test
    public void testCustomFunction() {
        CalcNode max = new CalcNode("Max", Math::max);
        max.a().setValue(-1);
        max.b().setValue(-3);
        max.execute();
        assertEquals(-1.0, (Double) max.result().getValue(), 0.0);
    }
}
