package com.nodeflow.io;

import com.nodeflow.model.Node;

import java.util.List;

/**
 * Registered node type.
 *
 * @param typeKey     Stable key written to persisted graphs.
 * @param displayName Name shown in a node palette.
 * @param path        Palette folder, slash separated, e.g. "Math/Arithmetic".
 * @param nodeClass   Concrete class the factory produces.
 * @param inputPins   Input pins in declaration order.
 * @param outputPins  Output pins in declaration order.
 * @param factory     Creates new instances.
 */
public record NodeMetadata(String typeKey, String displayName, String path, Class<? extends Node> nodeClass,
        List<PinMetadata> inputPins, List<PinMetadata> outputPins, NodeFactory factory) {

    public NodeMetadata {
        inputPins = List.copyOf(inputPins);
        outputPins = List.copyOf(outputPins);
    }

    public boolean hasFlowPins() {
        return inputPins.stream().anyMatch(PinMetadata::flowPin)
                || outputPins.stream().anyMatch(PinMetadata::flowPin);
    }
}
