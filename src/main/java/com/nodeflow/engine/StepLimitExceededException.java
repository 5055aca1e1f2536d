package com.nodeflow.engine;

/** A control-flow run hit its step bound while failing on the limit was requested. */
public class StepLimitExceededException extends GraphExecutionException {

    private final int maxSteps;

    public StepLimitExceededException(int maxSteps) {
        super("Control flow exceeded " + maxSteps + " steps");
        this.maxSteps = maxSteps;
    }

    public int getMaxSteps() {
        return maxSteps;
    }
}
