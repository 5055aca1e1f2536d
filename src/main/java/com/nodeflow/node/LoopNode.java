package com.nodeflow.node;

import com.nodeflow.model.Node;
import com.nodeflow.model.Pin;

/**
 * Counted loop driven by re-entry.
 *
 * Each time flow enters {@code In}, the node either fires {@code Body} (while
 * fewer than {@code count} iterations ran) or fires {@code Completed} and
 * resets. The body chain loops by connecting its last flow output back into
 * {@code In}. The current iteration, starting at 0, is on {@code index}.
 * Every run starts counting from 0 again.
 */
public class LoopNode extends Node {
    public static final String IN = "In";
    public static final String COUNT = "count";
    public static final String BODY = "Body";
    public static final String COMPLETED = "Completed";
    public static final String INDEX = "index";

    private final Pin in;
    private final Pin count;
    private final Pin body;
    private final Pin completed;
    private final Pin index;

    private int iteration;

    public LoopNode() {
        this("Loop", 0);
    }

    public LoopNode(String name, int count) {
        super(name);
        this.in = addFlowInput(IN);
        this.count = addInputPin(COUNT, Integer.class, count);
        this.body = addFlowOutput(BODY);
        this.completed = addFlowOutput(COMPLETED);
        this.index = addOutputPin(INDEX, Integer.class);
    }

    @Override
    protected void onExecute() {
        Object c = count.getValue();
        int limit = c instanceof Number n ? n.intValue() : 0;
        if (iteration < limit) {
            index.setValue(iteration);
            iteration++;
            activate(body);
        } else {
            iteration = 0;
            activate(completed);
        }
    }

    @Override
    protected void onPrepareRun() {
        iteration = 0;
    }

    /** Iterations run since the loop last completed or the last run started. */
    public int getIteration() {
        return iteration;
    }

    public void setCount(int count) {
        this.count.setValue(count);
    }

    public Pin in() {
        return in;
    }

    public Pin count() {
        return count;
    }

    public Pin body() {
        return body;
    }

    public Pin completed() {
        return completed;
    }

    public Pin index() {
        return index;
    }
}
