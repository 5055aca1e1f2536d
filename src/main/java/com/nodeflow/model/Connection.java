package com.nodeflow.model;

import com.nodeflow.api.PinDirection;

import java.util.Objects;
import java.util.UUID;

/**
 * A directed edge from an output pin to an input pin.
 *
 * The connection owns value propagation for data pins: the source value is
 * pushed into the target when the connection is created, whenever the source
 * value changes while attached, and on demand through {@link #transfer()}.
 *
 * Pin references are navigation links. A connection restored from persisted
 * data starts with ids only and gets its pins back from
 * {@link NodeGraph#onDeserialized()}.
 */
public class Connection {

    private UUID id = UUID.randomUUID();
    private UUID sourcePinId;
    private UUID targetPinId;

    private Pin sourcePin;
    private Pin targetPin;

    private final Pin.ValueListener sourceListener = (pin, oldValue, newValue) -> transfer();

    /** Creates an unresolved connection. Pins are bound later by relinking. */
    public Connection(UUID sourcePinId, UUID targetPinId) {
        this.sourcePinId = sourcePinId;
        this.targetPinId = targetPinId;
    }

    /**
     * Creates a live connection between two pins and immediately pushes the
     * source value into the target.
     */
    public Connection(Pin source, Pin target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        bind(source, target);
        transfer();
    }

    public UUID getId() {
        return id;
    }

    /** Reassigns the identifier. Only meant for restoring persisted graphs. */
    public void setId(UUID id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public UUID getSourcePinId() {
        return sourcePinId;
    }

    public UUID getTargetPinId() {
        return targetPinId;
    }

    public Pin getSourcePin() {
        return sourcePin;
    }

    public Pin getTargetPin() {
        return targetPin;
    }

    public Node getSourceNode() {
        return sourcePin != null ? sourcePin.getParentNode() : null;
    }

    public Node getTargetNode() {
        return targetPin != null ? targetPin.getParentNode() : null;
    }

    public boolean isResolved() {
        return sourcePin != null && targetPin != null;
    }

    /** True for flow connections. Unresolved connections are reported as data. */
    public boolean isFlow() {
        return sourcePin != null ? sourcePin.isFlowPin() : targetPin != null && targetPin.isFlowPin();
    }

    /** Pushes the current source value into the target. No-op for flow or unresolved connections. */
    public void transfer() {
        if (sourcePin == null || targetPin == null || sourcePin.isFlowPin()) {
            return;
        }
        targetPin.setValue(sourcePin.getValue());
    }

    /**
     * True if both ends are resolved and still satisfy the pin rules: output to
     * input, same kind, compatible types, different nodes.
     */
    public boolean isValid() {
        if (!isResolved()) {
            return false;
        }
        return sourcePin.getDirection() == PinDirection.OUTPUT
                && targetPin.getDirection() == PinDirection.INPUT
                && sourcePin.isCompatibleWith(targetPin);
    }

    /**
     * Detaches both ends. A data target falls back to its default value, so it
     * no longer holds the value it received through this connection.
     */
    public void disconnect() {
        Pin target = targetPin;
        unbind();
        if (target != null && !target.isFlowPin()) {
            target.resetValue();
        }
    }

    /**
     * Rebinds the connection to resolved pins, either of which may be
     * {@code null} when its id no longer matches anything. Values are not
     * pushed; restored input pins already carry their persisted value.
     */
    void relink(Pin source, Pin target) {
        unbind();
        if (source != null) {
            sourcePin = source;
            source.attach(this);
            source.addValueListener(sourceListener);
        }
        if (target != null) {
            targetPin = target;
            target.attach(this);
        }
    }

    /** True if either end belongs to {@code node}, resolved or by id. */
    boolean touches(Node node) {
        if (node == null) {
            return false;
        }
        if (getSourceNode() == node || getTargetNode() == node) {
            return true;
        }
        return node.ownsPin(sourcePinId) || node.ownsPin(targetPinId);
    }

    private void bind(Pin source, Pin target) {
        sourcePinId = source.getId();
        targetPinId = target.getId();
        relink(source, target);
    }

    private void unbind() {
        if (sourcePin != null) {
            sourcePin.removeValueListener(sourceListener);
            sourcePin.detach(this);
            sourcePin = null;
        }
        if (targetPin != null) {
            targetPin.detach(this);
            targetPin = null;
        }
    }

    @Override
    public String toString() {
        return "Connection[" + (sourcePin != null ? sourcePin : sourcePinId)
                + " -> " + (targetPin != null ? targetPin : targetPinId) + "]";
    }
}
