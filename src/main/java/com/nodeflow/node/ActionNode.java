package com.nodeflow.node;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;

/** Flow-through node running an arbitrary action, then continuing on {@code Out}. */
public class ActionNode extends Node {
    public static final String IN = "In";
    public static final String OUT = "Out";

    private final Runnable action;
    private final Pin in;
    private final Pin out;

    public ActionNode() {
        this("Action", () -> { });
    }

    public ActionNode(String name, Runnable action) {
        super(name);
        this.action = action;
        this.in = addFlowInput(IN);
        this.out = addFlowOutput(OUT);
    }

    @Override
    protected void onExecute() {
        action.run();
    }

    public Pin in() {
        return in;
    }

    public Pin out() {
        return out;
    }
}
