package com.nodeflow.node;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;

/** Terminal data node. Captures the value on its {@code value} input when evaluated. */
public class SinkNode extends Node {
    public static final String INPUT = "value";

    private final Pin input;
    private Object lastValue;

    public SinkNode() {
        this("Sink");
    }

    public SinkNode(String name) {
        this(name, Object.class);
    }

    public SinkNode(String name, Class<?> type) {
        super(name);
        this.input = addInputPin(INPUT, type);
    }

    @Override
    protected void onExecute() {
        lastValue = input.getValue();
    }

    public Object getLastValue() {
        return lastValue;
    }

    public Pin input() {
        return input;
    }
}
