package com.nodeflow.node;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;

/**
 * Data source holding a fixed value on its {@code value} output.
 *
 * The value lives on the output pin itself, so it survives persistence
 * without any node-specific state.
 */
public class ConstantNode extends Node {
    public static final String OUTPUT = "value";

    private final Pin output;

    public ConstantNode() {
        this("Constant", Object.class, null);
    }

    public ConstantNode(String name, Object value) {
        this(name, value != null ? value.getClass() : Object.class, value);
    }

    public ConstantNode(String name, Class<?> type, Object value) {
        super(name);
        this.output = addOutputPin(OUTPUT, type);
        output.setValue(value);
    }

    public Object getValue() {
        return output.getValue();
    }

    public void setValue(Object value) {
        output.setValue(value);
    }

    public Pin output() {
        return output;
    }
}
