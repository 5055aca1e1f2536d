package com.nodeflow.engine;

/**
 * A run precondition does not hold: missing or unconfirmed main node, or a
 * graph handed to the engine of the other category. Raised before any node
 * executes.
 */
public class GraphConsistencyException extends IllegalStateException {

    public GraphConsistencyException(String message) {
        super(message);
    }
}
