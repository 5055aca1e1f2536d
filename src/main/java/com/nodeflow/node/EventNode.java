package com.nodeflow.node;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;

/** Control-flow entry point: no flow input, a single {@code Exec} output. */
public class EventNode extends Node {
    public static final String EXEC = "Exec";

    private final Pin exec;

    public EventNode() {
        this("Start");
    }

    public EventNode(String name) {
        super(name);
        this.exec = addFlowOutput(EXEC);
    }

    public Pin exec() {
        return exec;
    }
}
