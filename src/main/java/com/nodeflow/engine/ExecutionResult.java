package com.nodeflow.engine;

import com.nodeflow.api.NodeGraphCategory;

import java.util.UUID;

/** Common view of a run result, whichever engine produced it. */
public interface ExecutionResult {

    UUID graphId();

    NodeGraphCategory category();

    /** True if the run ran to completion without node failures. */
    boolean isSuccess();
}
