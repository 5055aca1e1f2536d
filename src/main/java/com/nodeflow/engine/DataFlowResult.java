package com.nodeflow.engine;

import com.nodeflow.api.NodeGraphCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of a data-flow run.
 *
 * {@code sinkNodeOutputs} maps each sink node id to its pin name to value
 * mapping. Values may be null. A cancelled run reports only what the nodes
 * evaluated before cancellation produced.
 */
public record DataFlowResult(UUID graphId, Map<UUID, Map<String, Object>> sinkNodeOutputs,
        List<UUID> evaluationOrder, boolean cancelled) implements ExecutionResult {

    public DataFlowResult {
        Map<UUID, Map<String, Object>> copy = new LinkedHashMap<>();
        sinkNodeOutputs.forEach((id, values) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        sinkNodeOutputs = Collections.unmodifiableMap(copy);
        evaluationOrder = List.copyOf(evaluationOrder);
    }

    /** Value of {@code pinName} for sink {@code nodeId}, or null. */
    public Object output(UUID nodeId, String pinName) {
        Map<String, Object> values = sinkNodeOutputs.get(nodeId);
        return values != null ? values.get(pinName) : null;
    }

    @Override
    public NodeGraphCategory category() {
        return NodeGraphCategory.DATA_FLOW;
    }

    @Override
    public boolean isSuccess() {
        return !cancelled;
    }
}
