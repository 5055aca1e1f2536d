package com.nodeflow.api;

/**
 * Lifecycle state of a node's last evaluation, intended for host-side
 * visual feedback.
 */
public enum NodeState {
    /** Idle; never executed in the current session or reset. */
    NORMAL,
    EXECUTING,
    SUCCESS,
    ERROR
}
