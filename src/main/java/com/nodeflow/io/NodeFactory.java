package com.nodeflow.io;

import com.nodeflow.model.Node;

/** Creates fresh node instances of one registered type. */
@FunctionalInterface
public interface NodeFactory {
    Node create();
}
