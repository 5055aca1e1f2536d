package com.nodeflow.api;

/**
 * The execution discipline of a node graph.
 *
 * The category decides which engine interprets the graph and what the graph's
 * main node means:
 *
 * - CONTROL_FLOW: nodes are sequenced by flow pins. The main node is the entry
 * (event) node the run starts from.
 * - DATA_FLOW: nodes are evaluated in data-dependency order. The main node is a
 * sink whose inputs represent the graph's final answer.
 */
public enum NodeGraphCategory {
    CONTROL_FLOW,
    DATA_FLOW
}
