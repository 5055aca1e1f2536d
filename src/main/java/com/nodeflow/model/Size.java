package com.nodeflow.model;

/** Width and height of a node's visual footprint. */
public record Size(double width, double height) {
}
