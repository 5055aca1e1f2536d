package com.nodeflow.engine;

import com.nodeflow.api.ExecutionListener;
import com.nodeflow.api.GraphEngine;
import com.nodeflow.api.NodeGraphCategory;
import com.nodeflow.model.NodeGraph;
import com.nodeflow.util.CompositeExecutionListener;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point that runs any graph with the engine matching its category.
 *
 * Both engines share one {@link CompositeExecutionListener}, so listeners
 * added here observe every run regardless of discipline.
 */
public final class GraphExecutor {
    private final ControlFlowEngine controlFlow;
    private final DataFlowEngine dataFlow;
    private final CompositeExecutionListener listeners = new CompositeExecutionListener();

    public GraphExecutor() {
        this(EngineConfig.defaults());
    }

    public GraphExecutor(EngineConfig config) {
        Objects.requireNonNull(config, "config");
        this.controlFlow = new ControlFlowEngine(config);
        this.dataFlow = new DataFlowEngine(config);
        controlFlow.setListener(listeners);
        dataFlow.setListener(listeners);
    }

    public void addListener(ExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(ExecutionListener listener) {
        return listeners.remove(listener);
    }

    /** The engine that runs graphs of {@code category}. */
    public GraphEngine<? extends ExecutionResult> engineFor(NodeGraphCategory category) {
        return switch (category) {
            case CONTROL_FLOW -> controlFlow;
            case DATA_FLOW -> dataFlow;
        };
    }

    public ControlFlowEngine controlFlow() {
        return controlFlow;
    }

    public DataFlowEngine dataFlow() {
        return dataFlow;
    }

    public ExecutionResult execute(NodeGraph graph, CancellationToken token) {
        Objects.requireNonNull(graph, "graph");
        return switch (graph.getCategory()) {
            case CONTROL_FLOW -> controlFlow.execute(graph, token);
            case DATA_FLOW -> dataFlow.execute(graph, token);
        };
    }

    public CompletableFuture<ExecutionResult> executeAsync(NodeGraph graph, CancellationToken token) {
        Objects.requireNonNull(graph, "graph");
        return switch (graph.getCategory()) {
            case CONTROL_FLOW -> controlFlow.executeAsync(graph, token).thenApply(ExecutionResult.class::cast);
            case DATA_FLOW -> dataFlow.executeAsync(graph, token).thenApply(ExecutionResult.class::cast);
        };
    }

    public CompletableFuture<ExecutionResult> executeAsync(NodeGraph graph) {
        return executeAsync(graph, CancellationToken.NONE);
    }
}
