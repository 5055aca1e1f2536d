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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs data-flow graphs in dependency order.
 *
 * Algorithm Details:
 * The engine runs Kahn's algorithm directly against the
 * {@link DataDependencyIndex} of the graph:
 *
 * 1. Ready set: nodes whose data inputs are all unconnected start ready.
 *
 * 2. Pull: before a node runs, every data connection feeding it transfers its
 * source value into the node's input.
 *
 * 3. Evaluate: the node's step computes its outputs.
 *
 * 4. Push: the node's data outputs are transferred along their connections and
 * each child's pending count drops; a child reaching zero becomes ready.
 *
 * 5. Stall: if the ready set empties while nodes remain, those nodes depend on
 * each other and the run fails with a {@link CyclicDependencyException}.
 *
 * Every run is a fresh pass; nothing is memoized between runs. A failing node
 * aborts the whole pass since later nodes may depend on it.
 */
public final class DataFlowEngine implements GraphEngine<DataFlowResult> {
    private static final Logger log = LogManager.getLogger(DataFlowEngine.class);

    private final EngineConfig config;
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private final AtomicLong runs = new AtomicLong();
    private volatile ExecutionListener listener;

    public DataFlowEngine() {
        this(EngineConfig.defaults());
    }

    public DataFlowEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public void setListener(ExecutionListener listener) {
        this.listener = listener;
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public CompletableFuture<DataFlowResult> executeAsync(NodeGraph graph, CancellationToken token) {
        return CompletableFuture.supplyAsync(() -> execute(graph, token), config.executor());
    }

    /**
     * Evaluates every node once in a valid topological order.
     *
     * @throws GraphConsistencyException if the graph is not a data-flow graph or
     *                                   a set or required main node is not a sink.
     * @throws CyclicDependencyException if the remaining nodes depend on each other.
     * @throws NodeExecutionException    if a node's step fails.
     */
    @Override
    public DataFlowResult execute(NodeGraph graph, CancellationToken token) {
        Objects.requireNonNull(graph, "graph");
        CancellationToken cancel = token != null ? token : CancellationToken.NONE;
        checkPreconditions(graph);

        DataDependencyIndex index = DataDependencyIndex.of(graph);
        final int n = index.nodeCount();
        final long run = runs.incrementAndGet();
        final ExecutionListener l = this.listener;
        final boolean hasListener = l != null;

        for (int i = 0; i < n; i++)
            index.node(i).prepareRun();

        log.debug("Data flow run {} on graph '{}' ({} nodes)", run, graph.getName(), n);
        if (hasListener)
            l.onRunStart(run, graph.getId(), NodeGraphCategory.DATA_FLOW);

        int[] pending = index.inDegrees();
        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (pending[i] == 0)
                queue[tail++] = i;

        boolean[] evaluated = new boolean[n];
        List<UUID> order = new ArrayList<>(n);
        boolean cancelled = false;
        int executed = 0;

        try {
            while (head < tail) {
                if (cancel.isCancellationRequested()) {
                    cancelled = true;
                    log.debug("Data flow run {} cancelled after {} of {} nodes", run, order.size(), n);
                    break;
                }
                int curr = queue[head++];
                Node node = index.node(curr);

                for (Connection c : graph.incomingDataConnections(node)) {
                    c.transfer();
                }

                long nodeStart = System.nanoTime();
                boolean ran;
                try {
                    ran = node.execute();
                } catch (RuntimeException e) {
                    List<UUID> path = new ArrayList<>(order);
                    path.add(node.getId());
                    errLimiter.log(node.getId(), String.format("Node '%s' failed in data flow run %d: %s",
                            node.getName(), run, e.getMessage()), e);
                    if (hasListener)
                        l.onNodeError(run, node.getId(), node.getName(), e);
                    throw new NodeExecutionException(node.getId(), node.getName(), path, e);
                }
                if (ran) {
                    executed++;
                    if (hasListener)
                        l.onNodeExecuted(run, node.getId(), node.getName(), System.nanoTime() - nodeStart);
                }
                evaluated[curr] = true;
                order.add(node.getId());

                for (Pin out : node.dataOutputPins()) {
                    for (Connection c : graph.connectionsFrom(out)) {
                        c.transfer();
                    }
                }

                final int start = index.childrenStart(curr);
                final int end = index.childrenEnd(curr);
                for (int ci = start; ci < end; ci++) {
                    int child = index.childAt(ci);
                    if (--pending[child] == 0)
                        queue[tail++] = child; // Child is now ready
                }
            }

            if (!cancelled && order.size() != n) {
                Set<UUID> unresolved = new LinkedHashSet<>();
                for (int i = 0; i < n; i++)
                    if (!evaluated[i])
                        unresolved.add(index.node(i).getId());
                log.warn("Data flow run {} on graph '{}' stalled on a dependency cycle: {}", run, graph.getName(),
                        unresolved);
                throw new CyclicDependencyException(unresolved, order.size(), n);
            }
        } finally {
            if (hasListener)
                l.onRunEnd(run, executed);
        }

        Map<UUID, Map<String, Object>> sinks = collectSinkOutputs(graph, index, evaluated);
        log.debug("Data flow run {} ended: {} of {} nodes evaluated, {} sink(s)", run, order.size(), n, sinks.size());
        return new DataFlowResult(graph.getId(), sinks, order, cancelled);
    }

    /**
     * A node whose data outputs feed no other node of the graph reports its
     * output values. A node with no data outputs at all reports its input
     * values. Nodes without data pins report nothing.
     */
    static Map<UUID, Map<String, Object>> collectSinkOutputs(NodeGraph graph, DataDependencyIndex index,
            boolean[] evaluated) {
        Map<UUID, Map<String, Object>> sinks = new LinkedHashMap<>();
        for (int i = 0; i < index.nodeCount(); i++) {
            if (!evaluated[i])
                continue;
            Node node = index.node(i);
            List<Pin> outputs = node.dataOutputPins();
            List<Pin> reported;
            if (!outputs.isEmpty()) {
                if (index.childCount(i) > 0)
                    continue;
                reported = outputs;
            } else {
                reported = node.dataInputPins();
            }
            if (reported.isEmpty())
                continue;
            Map<String, Object> values = new LinkedHashMap<>();
            for (Pin pin : reported) {
                values.put(pin.getName(), pin.getValue());
            }
            sinks.put(node.getId(), values);
        }
        return sinks;
    }

    private void checkPreconditions(NodeGraph graph) {
        if (graph.getCategory() != NodeGraphCategory.DATA_FLOW) {
            throw new GraphConsistencyException("Graph '" + graph.getName() + "' is " + graph.getCategory()
                    + ", not DATA_FLOW");
        }
        if (graph.getMainNodeId() == null) {
            if (config.requireMainNode()) {
                throw new GraphConsistencyException("Graph '" + graph.getName() + "' has no confirmed main node");
            }
            return;
        }
        Node main = graph.getMainNode();
        if (main == null) {
            throw new GraphConsistencyException("Main node " + graph.getMainNodeId() + " is not part of graph '"
                    + graph.getName() + "'");
        }
        if (!NodeGraph.isSinkCandidate(main)) {
            throw new GraphConsistencyException("Main node " + main + " is not a sink node: it needs at least one "
                    + "data input and no data outputs");
        }
    }
}
