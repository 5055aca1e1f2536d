package com.nodeflow.api;

import java.util.UUID;

/**
 * Observability interface for monitoring graph execution runs.
 *
 * Implementations can be registered with either engine to receive callbacks
 * during a run. This is the primary mechanism for:
 *
 * - Profiling: Measuring how long each node's evaluation step takes.
 * - Debugging: Tracing which nodes ran, in which order.
 * - Host feedback: Highlighting the node currently executing in an editor.
 *
 * Callbacks are invoked on the thread executing the run, between node
 * evaluations. Keep them light; anything slow here delays the next node.
 */
public interface ExecutionListener {

    /**
     * Called immediately before a run begins.
     *
     * @param run      Sequence number of the run, incremented per engine.
     * @param graphId  The id of the graph being executed.
     * @param category Discipline of the run.
     */
    void onRunStart(long run, UUID graphId, NodeGraphCategory category);

    /**
     * Called after a node's evaluation step returned normally.
     *
     * @param run           Current run number.
     * @param nodeId        Id of the node.
     * @param nodeName      Display name of the node.
     * @param durationNanos Wall time spent in the evaluation step.
     */
    void onNodeExecuted(long run, UUID nodeId, String nodeName, long durationNanos);

    /**
     * Called when a node's evaluation step throws.
     *
     * @param run      Current run number.
     * @param nodeId   Id of the failing node.
     * @param nodeName Display name of the failing node.
     * @param error    The exception raised by the node.
     */
    void onNodeError(long run, UUID nodeId, String nodeName, Throwable error);

    /**
     * Called when the run is over, whatever its outcome.
     *
     * @param run           Current run number.
     * @param nodesExecuted Number of evaluation steps that completed.
     */
    void onRunEnd(long run, int nodesExecuted);
}
