package com.nodeflow.engine;

import com.nodeflow.api.NodeGraphCategory;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a control-flow run.
 *
 * @param graphId  The executed graph.
 * @param status   How the run ended.
 * @param trace    Ids of the nodes whose step completed, in execution order.
 *                 A node appears once per visit.
 * @param skipped  Ids of disabled nodes reached by the traversal.
 * @param failures Node failures, in the order they occurred.
 * @param steps    Number of evaluation steps attempted.
 */
public record ControlFlowResult(UUID graphId, Status status, List<UUID> trace, List<UUID> skipped,
        List<NodeFailure> failures, int steps) implements ExecutionResult {

    public enum Status {
        /** Every path reached a terminal node. */
        COMPLETED,
        /** At least one node failed; its path was abandoned. */
        FAILED,
        /** The token was cancelled between two steps. */
        CANCELLED,
        /** The step bound truncated the run. */
        STEP_LIMIT_REACHED
    }

    public ControlFlowResult {
        trace = List.copyOf(trace);
        skipped = List.copyOf(skipped);
        failures = List.copyOf(failures);
    }

    @Override
    public NodeGraphCategory category() {
        return NodeGraphCategory.CONTROL_FLOW;
    }

    @Override
    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }
}
