package com.nodeflow.api;

/** Direction of a pin relative to its owning node. Never changes after creation. */
public enum PinDirection {
    INPUT,
    OUTPUT
}
