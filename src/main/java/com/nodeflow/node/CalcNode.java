package com.nodeflow.node;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;

import java.util.Objects;
import java.util.function.DoubleBinaryOperator;

/**
 * Numeric function of two inputs: {@code result = fn(a, b)}.
 *
 * Inputs default to 0.0 when unconnected. Any {@link Number} is accepted on
 * the inputs. The nested subclasses give each built-in operation its own
 * class, so a persisted graph can name it.
 */
public class CalcNode extends Node {
    public static final String A = "a";
    public static final String B = "b";
    public static final String RESULT = "result";

    private final DoubleBinaryOperator fn;
    private final Pin a;
    private final Pin b;
    private final Pin result;

    public CalcNode(String name, DoubleBinaryOperator fn) {
        super(name);
        this.fn = Objects.requireNonNull(fn, "fn");
        this.a = addInputPin(A, Number.class, 0.0);
        this.b = addInputPin(B, Number.class, 0.0);
        this.result = addOutputPin(RESULT, Double.class);
    }

    /** {@code a + b}. */
    public static class Add extends CalcNode {
        public Add() {
            super("Add", Double::sum);
        }
    }

    /** {@code a - b}. */
    public static class Subtract extends CalcNode {
        public Subtract() {
            super("Subtract", (x, y) -> x - y);
        }
    }

    /** {@code a * b}. */
    public static class Multiply extends CalcNode {
        public Multiply() {
            super("Multiply", (x, y) -> x * y);
        }
    }

    @Override
    protected void onExecute() {
        result.setValue(fn.applyAsDouble(number(a), number(b)));
    }

    private static double number(Pin pin) {
        Object v = pin.getValue();
        if (v == null) {
            return 0.0;
        }
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("Input '" + pin.getName() + "' is not a number: " + v);
    }

    public Pin a() {
        return a;
    }

    public Pin b() {
        return b;
    }

    public Pin result() {
        return result;
    }
}
