package com.nodeflow.util;

import com.nodeflow.api.ExecutionListener;
import com.nodeflow.api.NodeGraphCategory;
import lombok.extern.log4j.Log4j2;

import java.util.LongSummaryStatistics;
import java.util.UUID;

/**
 * Writes run boundaries at debug level and node failures at error level.
 * Keeps wall-clock statistics over every completed run.
 *
 * Failure messages are throttled per node id by an {@link ErrorRateLimiter}
 * so a node that fails on every run does not flood the log.
 */
@Log4j2
public final class LoggingExecutionListener implements ExecutionListener {

    private final ErrorRateLimiter failureLog = new ErrorRateLimiter(log, 1000);
    private LongSummaryStatistics runTimes = new LongSummaryStatistics();
    private long startedAt;
    private long lastLatencyNanos;
    private int lastNodesExecuted;
    private long failures;

    @Override
    public void onRunStart(long run, UUID graphId, NodeGraphCategory category) {
        startedAt = System.nanoTime();
        log.debug("Run {} started: graph {} ({})", run, graphId, category);
    }

    @Override
    public void onNodeExecuted(long run, UUID nodeId, String nodeName, long durationNanos) {
        log.trace("Run {}: node '{}' took {} ns", run, nodeName, durationNanos);
    }

    @Override
    public void onNodeError(long run, UUID nodeId, String nodeName, Throwable error) {
        failures++;
        failureLog.log(nodeId, "Node '" + nodeName + "' failed in run " + run + ": " + error.getMessage(), error);
    }

    @Override
    public void onRunEnd(long run, int nodesExecuted) {
        lastLatencyNanos = System.nanoTime() - startedAt;
        lastNodesExecuted = nodesExecuted;
        runTimes.accept(lastLatencyNanos);
        log.debug("Run {} finished: {} node step(s) in {} us", run, nodesExecuted, lastLatencyNanos / 1000.0);
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public int lastNodesExecuted() {
        return lastNodesExecuted;
    }

    public long totalRuns() {
        return runTimes.getCount();
    }

    public long totalErrors() {
        return failures;
    }

    public double avgLatencyMicros() {
        return runTimes.getAverage() / 1000.0;
    }

    /** Shortest run seen, 0 before the first run. */
    public long minLatencyNanos() {
        return runTimes.getCount() == 0 ? 0 : runTimes.getMin();
    }

    public long maxLatencyNanos() {
        return runTimes.getCount() == 0 ? 0 : runTimes.getMax();
    }

    public void reset() {
        runTimes = new LongSummaryStatistics();
        failures = 0;
        failureLog.reset();
    }

    /** One-line summary, e.g. for a shutdown hook. */
    public String dump() {
        return String.format("Graph runs: %d, failures: %d, latency us avg/min/max: %.2f / %.2f / %.2f",
                totalRuns(), failures, avgLatencyMicros(), minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0);
    }
}
