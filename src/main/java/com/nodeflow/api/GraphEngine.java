package com.nodeflow.api;

import com.nodeflow.engine.CancellationToken;
import com.nodeflow.model.NodeGraph;

import java.util.concurrent.CompletableFuture;

/**
 * The shared "execute a graph" capability implemented by both schedulers.
 *
 * An engine holds no per-graph state between runs: every call re-derives pin
 * values from the graph's current connections. Runs are single threaded and
 * evaluate one node at a time; cancellation is checked between node
 * evaluations only.
 *
 * @param <R> The result type of a run.
 */
public interface GraphEngine<R> {

    /**
     * Runs the graph on the calling thread.
     *
     * @param graph The graph to execute. Must not be mutated during the run.
     * @param token Cancellation signal checked between node evaluations.
     * @return The run result.
     */
    R execute(NodeGraph graph, CancellationToken token);

    /**
     * Runs the graph asynchronously on the engine's executor.
     *
     * Precondition and execution failures complete the returned future
     * exceptionally.
     */
    CompletableFuture<R> executeAsync(NodeGraph graph, CancellationToken token);

    /** Asynchronous run that can never be cancelled. */
    default CompletableFuture<R> executeAsync(NodeGraph graph) {
        return executeAsync(graph, CancellationToken.NONE);
    }
}
