package com.nodeflow.node;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;

/**
 * Control-flow if/else: continues on {@code True} or {@code False} depending
 * on the boolean {@code condition} input. A missing condition counts as false.
 */
public class BranchNode extends Node {
    public static final String IN = "In";
    public static final String CONDITION = "condition";
    public static final String TRUE = "True";
    public static final String FALSE = "False";

    private final Pin in;
    private final Pin condition;
    private final Pin whenTrue;
    private final Pin whenFalse;

    public BranchNode() {
        this("Branch");
    }

    public BranchNode(String name) {
        super(name);
        this.in = addFlowInput(IN);
        this.condition = addInputPin(CONDITION, Boolean.class, Boolean.FALSE);
        this.whenTrue = addFlowOutput(TRUE);
        this.whenFalse = addFlowOutput(FALSE);
    }

    @Override
    protected void onExecute() {
        activate(Boolean.TRUE.equals(condition.getValue()) ? whenTrue : whenFalse);
    }

    public Pin in() {
        return in;
    }

    public Pin condition() {
        return condition;
    }

    public Pin whenTrue() {
        return whenTrue;
    }

    public Pin whenFalse() {
        return whenFalse;
    }
}
