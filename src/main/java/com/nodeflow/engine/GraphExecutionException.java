package com.nodeflow.engine;

/** Base class of errors raised while a graph run is in progress. */
public class GraphExecutionException extends RuntimeException {

    public GraphExecutionException(String message) {
        super(message);
    }

    public GraphExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
