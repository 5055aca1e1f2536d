package com.nodeflow.util;

import com.nodeflow.api.ExecutionListener;
import com.nodeflow.api.NodeGraphCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Aggregates execution statistics per node to identify bottlenecks and flaky nodes. */
public class NodeProfileListener implements ExecutionListener {

    private static final String ROW = "%-30s %7d %7d %11.2f %11.2f %11.2f %11.2f%n";
    private static final String HEADER = String.format("%-30s %7s %7s %11s %11s %11s %11s%n",
            "Node Name", "Runs", "Errors", "Last", "Avg", "Min", "Max");

    public static class NodeStats {
        public final UUID nodeId;
        public final String name;
        public long count;
        public long errors;
        public long totalDurationNanos;
        public long minDurationNanos = Long.MAX_VALUE;
        public long maxDurationNanos = Long.MIN_VALUE;
        public long lastDurationNanos;

        public NodeStats(UUID nodeId, String name) {
            this.nodeId = nodeId;
            this.name = name;
        }

        void update(long duration) {
            count++;
            totalDurationNanos += duration;
            lastDurationNanos = duration;
            minDurationNanos = Math.min(minDurationNanos, duration);
            maxDurationNanos = Math.max(maxDurationNanos, duration);
        }

        public double avgMicros() {
            return count == 0 ? 0 : totalDurationNanos / (double) count / 1000.0;
        }
    }

    private final Map<UUID, NodeStats> stats = new LinkedHashMap<>();

    /** Stats of one node, or null if it never ran. */
    public synchronized NodeStats statsFor(UUID nodeId) {
        return stats.get(nodeId);
    }

    /** Snapshot of all stats, in first-seen order. */
    public synchronized List<NodeStats> allStats() {
        return new ArrayList<>(stats.values());
    }

    @Override
    public void onRunStart(long run, UUID graphId, NodeGraphCategory category) {
    }

    @Override
    public synchronized void onNodeExecuted(long run, UUID nodeId, String nodeName, long durationNanos) {
        stats.computeIfAbsent(nodeId, id -> new NodeStats(id, nodeName)).update(durationNanos);
    }

    @Override
    public synchronized void onNodeError(long run, UUID nodeId, String nodeName, Throwable error) {
        stats.computeIfAbsent(nodeId, id -> new NodeStats(id, nodeName)).errors++;
    }

    @Override
    public void onRunEnd(long run, int nodesExecuted) {
    }

    public synchronized void reset() {
        stats.clear();
    }

    /**
     * Returns a formatted table of node statistics, slowest total first.
     * Durations are in microseconds.
     */
    public synchronized String dump() {
        StringBuilder sb = new StringBuilder(HEADER);
        stats.values().stream()
                .sorted(Comparator.comparingLong((NodeStats s) -> s.totalDurationNanos).reversed())
                .forEach(s -> sb.append(String.format(ROW, shorten(s.name), s.count, s.errors,
                        micros(s.lastDurationNanos), s.avgMicros(),
                        s.count == 0 ? 0.0 : micros(s.minDurationNanos),
                        s.count == 0 ? 0.0 : micros(s.maxDurationNanos))));
        return sb.toString();
    }

    private static double micros(long nanos) {
        return nanos / 1000.0;
    }

    private static String shorten(String name) {
        return name.length() <= 30 ? name : name.substring(0, 27) + "...";
    }
}
