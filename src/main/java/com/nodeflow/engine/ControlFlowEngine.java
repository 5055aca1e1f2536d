package com.nodeflow.engine;

import com.nodeflow.api.ExecutionListener;
import com.nodeflow.api.GraphEngine;
import com.nodeflow.api.NodeGraphCategory;
import com.nodeflow.model.Connection;
import com.nodeflow.model.Node;
import com.nodeflow.model.NodeGraph;
import com.nodeflow.model.Pin;
import com.nodeflow.util.ErrorRateLimiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs control-flow graphs: a state machine over flow pins.
 *
 * Algorithm Details:
 *
 * 1. Entry: the run starts at the graph's confirmed main node, which must be an
 * entry candidate (no flow inputs, at least one flow output).
 *
 * 2. Step: a node's evaluation step runs, then every flow output it fired is
 * followed. Outputs are taken in pin declaration order, the connections of one
 * output in registration order. The traversal is depth first: a branch runs to
 * its end before the next sibling starts.
 *
 * 3. Loops: a node may be reached again, which is how loop nodes iterate. Each
 * visit counts as a step and the run stops after
 * {@link EngineConfig#maxSteps()} steps.
 *
 * 4. Failure: a throwing node ends its own branch. The failure is recorded and
 * siblings already scheduled still run.
 *
 * The traversal uses an explicit stack, so long flow chains cannot overflow
 * the thread stack.
 */
public final class ControlFlowEngine implements GraphEngine<ControlFlowResult> {
    private static final Logger log = LogManager.getLogger(ControlFlowEngine.class);

    private final EngineConfig config;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final AtomicLong runs = new AtomicLong();
    private volatile ExecutionListener listener;

    // A scheduled visit. The parent chain is the path from the entry node.
    private record Frame(Node node, Frame parent) {
        List<UUID> path() {
            List<UUID> ids = new ArrayList<>();
            for (Frame f = this; f != null; f = f.parent) {
                ids.add(f.node.getId());
            }
            Collections.reverse(ids);
            return ids;
        }
    }

    public ControlFlowEngine() {
        this(EngineConfig.defaults());
    }

    public ControlFlowEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener;
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public CompletableFuture<ControlFlowResult> executeAsync(NodeGraph graph, CancellationToken token) {
        return CompletableFuture.supplyAsync(() -> execute(graph, token), config.executor());
    }

    /**
     * Runs the graph from its main node.
     *
     * @throws GraphConsistencyException if the graph is not a control-flow graph
     *                                   or its main node is missing or not an entry node.
     */
    @Override
    public ControlFlowResult execute(NodeGraph graph, CancellationToken token) {
        Objects.requireNonNull(graph, "graph");
        CancellationToken cancel = token != null ? token : CancellationToken.NONE;
        Node entry = requireEntry(graph);

        final long run = runs.incrementAndGet();
        final ExecutionListener l = this.listener;
        final boolean hasListener = l != null;
        final int maxSteps = config.maxSteps();

        List<UUID> trace = new ArrayList<>();
        List<UUID> skipped = new ArrayList<>();
        List<NodeFailure> failures = new ArrayList<>();
        ControlFlowResult.Status status = null;
        int steps = 0;

        for (Node node : graph.getNodes())
            node.prepareRun();

        log.debug("Control flow run {} on graph '{}' from {}", run, graph.getName(), entry);
        if (hasListener)
            l.onRunStart(run, graph.getId(), NodeGraphCategory.CONTROL_FLOW);

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(entry, null));
        try {
            while (!stack.isEmpty()) {
                if (cancel.isCancellationRequested()) {
                    status = ControlFlowResult.Status.CANCELLED;
                    log.debug("Control flow run {} cancelled after {} step(s)", run, steps);
                    break;
                }
                Frame frame = stack.pop();
                Node node = frame.node();

                if (!node.isEnabled()) {
                    // A disabled node ends its branch
                    skipped.add(node.getId());
                    continue;
                }
                if (steps >= maxSteps) {
                    status = stepLimitReached(graph, run, frame, failures);
                    break;
                }
                steps++;

                long nodeStart = System.nanoTime();
                try {
                    node.execute();
                } catch (RuntimeException e) {
                    failures.add(new NodeFailure(node.getId(), node.getName(), frame.path(), e));
                    errLimiter.log(node.getId(), String.format("Node '%s' failed in control flow run %d: %s",
                            node.getName(), run, e.getMessage()), e);
                    if (hasListener)
                        l.onNodeError(run, node.getId(), node.getName(), e);
                    continue;
                }
                trace.add(node.getId());
                if (hasListener)
                    l.onNodeExecuted(run, node.getId(), node.getName(), System.nanoTime() - nodeStart);

                // Push in reverse so the first successor runs first
                List<Node> next = successors(graph, node);
                for (int i = next.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(next.get(i), frame));
                }
            }
        } finally {
            if (hasListener)
                l.onRunEnd(run, trace.size());
        }

        if (status == null) {
            status = failures.isEmpty() ? ControlFlowResult.Status.COMPLETED : ControlFlowResult.Status.FAILED;
        }
        log.debug("Control flow run {} ended {}: {} step(s), {} failure(s)", run, status, steps, failures.size());
        return new ControlFlowResult(graph.getId(), status, trace, skipped, failures, steps);
    }

    private ControlFlowResult.Status stepLimitReached(NodeGraph graph, long run, Frame frame, List<NodeFailure> failures) {
        log.warn("Control flow run {} on graph '{}' stopped at the step limit of {}", run, graph.getName(),
                config.maxSteps());
        if (!config.failOnStepLimit()) {
            return ControlFlowResult.Status.STEP_LIMIT_REACHED;
        }
        Node node = frame.node();
        failures.add(new NodeFailure(node.getId(), node.getName(), frame.path(),
                new StepLimitExceededException(config.maxSteps())));
        return ControlFlowResult.Status.FAILED;
    }

    /** Nodes reached through the flow outputs the node fired, in visiting order. */
    static List<Node> successors(NodeGraph graph, Node node) {
        List<Node> next = new ArrayList<>();
        for (Pin out : node.firedFlowOutputs()) {
            for (Connection c : graph.connectionsFrom(out)) {
                Node target = c.getTargetNode();
                if (target != null && c.getTargetPin().isFlowPin() && graph.containsNode(target)) {
                    next.add(target);
                }
            }
        }
        return next;
    }

    private static Node requireEntry(NodeGraph graph) {
        if (graph.getCategory() != NodeGraphCategory.CONTROL_FLOW) {
            throw new GraphConsistencyException("Graph '" + graph.getName() + "' is " + graph.getCategory()
                    + ", not CONTROL_FLOW");
        }
        if (graph.getMainNodeId() == null) {
            throw new GraphConsistencyException("Graph '" + graph.getName() + "' has no confirmed main node");
        }
        Node main = graph.getMainNode();
        if (main == null) {
            throw new GraphConsistencyException("Main node " + graph.getMainNodeId() + " is not part of graph '"
                    + graph.getName() + "'");
        }
        if (!NodeGraph.isEntryCandidate(main)) {
            throw new GraphConsistencyException("Main node " + main + " is not an entry node: it needs no flow "
                    + "inputs and at least one flow output");
        }
        return main;
    }
}
