package com.nodeflow.model;

import com.nodeflow.api.NodeState;
import com.nodeflow.api.PinDirection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class for executable units of a node graph.
 *
 * A node owns an ordered list of input pins and an ordered list of output
 * pins, both declared by the subclass (usually in its constructor), and one
 * evaluation hook, {@link #onExecute()}, which an engine invokes through
 * {@link #execute()}.
 *
 * Key Responsibilities:
 *
 * 1. Pins: declaration order of pins is significant. Control-flow fan-out
 * follows it and persisted pins are matched back by it.
 *
 * 2. Evaluation: {@link #execute()} wraps the hook with state tracking for
 * host feedback. Disabled nodes are not evaluated.
 *
 * 3. Flow branching: a control-flow node picks which flow outputs fire with
 * {@link #activate(Pin)}. A step that activates nothing fires all of them.
 *
 * Nodes never own other nodes. The group reference is navigation only.
 */
public abstract class Node {

    private UUID id = UUID.randomUUID();
    private String name;
    private Point position = Point.ORIGIN;
    private boolean enabled = true;
    private volatile NodeState state = NodeState.NORMAL;

    private UUID groupId;
    private NodeGroup group;

    private final List<Pin> inputPins = new ArrayList<>();
    private final List<Pin> outputPins = new ArrayList<>();

    private final List<Pin> activated = new ArrayList<>(2);
    private boolean flowHalted;

    protected Node() {
        this.name = getClass().getSimpleName();
    }

    protected Node(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * The evaluation step. Reads input pin values and writes output pin values.
     * The default does nothing.
     */
    protected void onExecute() {
    }

    /**
     * Runs the evaluation step unless the node is disabled.
     *
     * @return true if the step ran, false if the node was skipped.
     * @throws RuntimeException whatever the step throws; state becomes ERROR.
     */
    public final boolean execute() {
        if (!enabled) {
            return false;
        }
        activated.clear();
        flowHalted = false;
        state = NodeState.EXECUTING;
        try {
            onExecute();
            state = NodeState.SUCCESS;
            return true;
        } catch (RuntimeException | Error e) {
            state = NodeState.ERROR;
            throw e;
        }
    }

    /** Called by the engines on every node of a graph before a run starts. */
    public final void prepareRun() {
        onPrepareRun();
    }

    /** Hook for nodes that keep state between steps of one run. */
    protected void onPrepareRun() {
    }

    /** Hook for input value changes. Never triggers evaluation by itself. */
    protected void onInputChanged(Pin pin) {
    }

    /** Hook for output value changes. */
    protected void onOutputChanged(Pin pin) {
    }

    // -- Pin declaration ----------------------------------------------------

    protected Pin addInputPin(String name, Class<?> dataType) {
        return addInputPin(name, dataType, null);
    }

    protected Pin addInputPin(String name, Class<?> dataType, Object defaultValue) {
        return addPin(new Pin(name, PinDirection.INPUT, dataType, false, defaultValue));
    }

    protected Pin addOutputPin(String name, Class<?> dataType) {
        return addPin(new Pin(name, PinDirection.OUTPUT, dataType, false, null));
    }

    protected Pin addFlowInput(String name) {
        return addPin(Pin.flow(name, PinDirection.INPUT));
    }

    protected Pin addFlowOutput(String name) {
        return addPin(Pin.flow(name, PinDirection.OUTPUT));
    }

    protected Pin addPin(Pin pin) {
        if (pin.getParentNode() != null && pin.getParentNode() != this) {
            throw new IllegalArgumentException("Pin " + pin.getName() + " already belongs to " + pin.getParentNode());
        }
        List<Pin> pins = pin.isInput() ? inputPins : outputPins;
        if (!pins.contains(pin)) {
            pin.setParentNode(this);
            pins.add(pin);
        }
        return pin;
    }

    // -- Flow branching -----------------------------------------------------

    /**
     * Marks a flow output of this node as fired by the current step.
     *
     * @throws IllegalArgumentException if the pin is not a flow output of this node.
     */
    protected void activate(Pin flowOutput) {
        if (flowOutput == null || !flowOutput.isFlowPin() || !outputPins.contains(flowOutput)) {
            throw new IllegalArgumentException("Not a flow output of " + name + ": " + flowOutput);
        }
        if (!activated.contains(flowOutput)) {
            activated.add(flowOutput);
        }
    }

    /** Ends the control-flow path at this node: no flow output fires for the current step. */
    protected void haltFlow() {
        flowHalted = true;
    }

    /**
     * Flow outputs fired by the last step, in declaration order.
     */
    public List<Pin> firedFlowOutputs() {
        if (flowHalted) {
            return List.of();
        }
        List<Pin> fired = new ArrayList<>();
        for (Pin pin : outputPins) {
            if (pin.isFlowPin() && (activated.isEmpty() || activated.contains(pin))) {
                fired.add(pin);
            }
        }
        return fired;
    }

    // -- Pin queries --------------------------------------------------------

    public List<Pin> getInputPins() {
        return Collections.unmodifiableList(inputPins);
    }

    public List<Pin> getOutputPins() {
        return Collections.unmodifiableList(outputPins);
    }

    public Pin findInputPin(String pinName) {
        return find(inputPins, pinName);
    }

    public Pin findOutputPin(String pinName) {
        return find(outputPins, pinName);
    }

    public List<Pin> dataInputPins() {
        return filter(inputPins, false);
    }

    public List<Pin> dataOutputPins() {
        return filter(outputPins, false);
    }

    public List<Pin> flowInputPins() {
        return filter(inputPins, true);
    }

    public List<Pin> flowOutputPins() {
        return filter(outputPins, true);
    }

    boolean ownsPin(UUID pinId) {
        if (pinId == null) {
            return false;
        }
        for (Pin p : inputPins) {
            if (pinId.equals(p.getId())) return true;
        }
        for (Pin p : outputPins) {
            if (pinId.equals(p.getId())) return true;
        }
        return false;
    }

    private static Pin find(List<Pin> pins, String pinName) {
        for (Pin pin : pins) {
            if (pin.getName().equals(pinName)) {
                return pin;
            }
        }
        return null;
    }

    private static List<Pin> filter(List<Pin> pins, boolean flow) {
        List<Pin> out = new ArrayList<>(pins.size());
        for (Pin pin : pins) {
            if (pin.isFlowPin() == flow) {
                out.add(pin);
            }
        }
        return out;
    }

    // -- Group membership ---------------------------------------------------

    public NodeGroup getGroup() {
        return group;
    }

    public UUID getGroupId() {
        return groupId;
    }

    /** Raw group id, used by persistence before relinking. */
    public void setGroupId(UUID groupId) {
        this.groupId = groupId;
    }

    /**
     * Moves the node into {@code newGroup} (or out of any group when null),
     * keeping both sides of the membership and the group id in step.
     */
    public void setGroup(NodeGroup newGroup) {
        NodeGroup old = this.group;
        this.group = newGroup;
        this.groupId = newGroup != null ? newGroup.getId() : null;
        if (old != null && old != newGroup) {
            old.detachMember(this);
        }
        if (newGroup != null) {
            newGroup.attachMember(this);
        }
    }

    /** Re-binds pin back-references after the node was restored. */
    public void onDeserialized() {
        for (Pin pin : inputPins) {
            pin.setParentNode(this);
        }
        for (Pin pin : outputPins) {
            pin.setParentNode(this);
        }
        if (group != null) {
            groupId = group.getId();
        }
    }

    // -- Plain properties ---------------------------------------------------

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

    public void setName(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public NodeState getState() {
        return state;
    }

    public void resetState() {
        state = NodeState.NORMAL;
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
