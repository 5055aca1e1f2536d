package com.nodeflow.model;

import com.nodeflow.api.PinDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A typed, directional connection point owned by exactly one node.
 *
 * Two kinds of pin exist:
 *
 * - Flow pins carry no value. An output flow pin means "run the connected node
 * next"; they sequence control-flow graphs.
 * - Data pins carry a value of {@link #getDataType()}. Connections push the
 * value of an output data pin into the input data pin they feed.
 *
 * Direction, kind and data type are fixed at creation. The owning node is
 * assigned when the pin is added to a node and is a navigation link only.
 */
public class Pin {

    /** Callback fired when a pin's value actually changes. */
    @FunctionalInterface
    public interface ValueListener {
        void onValueChanged(Pin pin, Object oldValue, Object newValue);
    }

    private UUID id = UUID.randomUUID();
    private final String name;
    private final PinDirection direction;
    private final Class<?> dataType;
    private final boolean flowPin;
    private final Object defaultValue;

    private Object value;
    private Object tag;
    private Node parentNode;

    // Live connections, navigation only. The graph owns them.
    private final List<Connection> connections = new ArrayList<>(2);
    private final List<ValueListener> listeners = new CopyOnWriteArrayList<>();

    public Pin(String name, PinDirection direction, Class<?> dataType, boolean flowPin, Object defaultValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.dataType = flowPin || dataType == null ? Object.class : boxed(dataType);
        this.flowPin = flowPin;
        this.defaultValue = flowPin ? null : defaultValue;
        this.value = this.defaultValue;
    }

    public static Pin data(String name, PinDirection direction, Class<?> dataType) {
        return new Pin(name, direction, dataType, false, null);
    }

    public static Pin flow(String name, PinDirection direction) {
        return new Pin(name, direction, Object.class, true, null);
    }

    public UUID getId() {
        return id;
    }

    /** Reassigns the identifier. Only meant for restoring persisted graphs. */
    public void setId(UUID id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public String getName() {
        return name;
    }

    public PinDirection getDirection() {
        return direction;
    }

    public boolean isInput() {
        return direction == PinDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == PinDirection.OUTPUT;
    }

    public Class<?> getDataType() {
        return dataType;
    }

    public boolean isFlowPin() {
        return flowPin;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public Object getValue() {
        return value;
    }

    /**
     * Sets the value and notifies listeners and the owning node if it changed.
     * Flow pins ignore values.
     */
    public void setValue(Object newValue) {
        if (flowPin || Objects.equals(value, newValue)) {
            return;
        }
        Object old = value;
        value = newValue;

        for (ValueListener listener : listeners) {
            listener.onValueChanged(this, old, newValue);
        }
        if (parentNode != null) {
            if (direction == PinDirection.INPUT) {
                parentNode.onInputChanged(this);
            } else {
                parentNode.onOutputChanged(this);
            }
        }
    }

    /** Restores the value captured when the pin was created. */
    public void resetValue() {
        setValue(defaultValue);
    }

    public Object getTag() {
        return tag;
    }

    public void setTag(Object tag) {
        this.tag = tag;
    }

    public Node getParentNode() {
        return parentNode;
    }

    void setParentNode(Node parentNode) {
        this.parentNode = parentNode;
    }

    public List<Connection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public boolean isConnected() {
        return !connections.isEmpty();
    }

    void attach(Connection connection) {
        if (!connections.contains(connection)) {
            connections.add(connection);
        }
    }

    void detach(Connection connection) {
        connections.remove(connection);
    }

    public void addValueListener(ValueListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeValueListener(ValueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Checks whether a new connection between this pin and {@code other} is
     * allowed right now.
     *
     * Rejects: the same pin, pins on the same node, pins with the same
     * direction, a data input that already has a connection, mixing flow and
     * data pins, and incompatible data types. Flow inputs accept any number of
     * connections, which is how flow merges and loops back.
     */
    public boolean canConnectTo(Pin other) {
        if (!isCompatibleWith(other)) {
            return false;
        }
        Pin input = isInput() ? this : other;
        return input.isFlowPin() || !input.isConnected();
    }

    /**
     * Same checks as {@link #canConnectTo(Pin)} except input occupancy. Used to
     * validate existing connections and to decide replacement.
     */
    public boolean isCompatibleWith(Pin other) {
        if (other == null || other == this) {
            return false;
        }
        if (parentNode != null && parentNode == other.parentNode) {
            return false;
        }
        if (direction == other.direction) {
            return false;
        }
        if (flowPin != other.flowPin) {
            return false;
        }
        return flowPin || isDataTypeCompatible(other.dataType);
    }

    /**
     * {@code Object} on either side accepts anything; otherwise one type must
     * be assignable to the other.
     */
    public boolean isDataTypeCompatible(Class<?> otherType) {
        if (otherType == null) {
            return false;
        }
        Class<?> other = boxed(otherType);
        if (dataType == Object.class || other == Object.class) {
            return true;
        }
        return dataType.isAssignableFrom(other) || other.isAssignableFrom(dataType);
    }

    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == boolean.class) return Boolean.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }

    @Override
    public String toString() {
        return (parentNode != null ? parentNode.getName() + "." : "") + name
                + "[" + direction + (flowPin ? ", flow" : ", " + dataType.getSimpleName()) + "]";
    }
}
