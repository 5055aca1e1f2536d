package com.nodeflow.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limits the rate of error logging per key.
 *
 * A control-flow loop around a failing node would otherwise log the same
 * failure once per iteration. Each key (typically a node id) logs at most once
 * per interval; the number of suppressed messages is reported with the next
 * one that gets through.
 *
 * At most {@code maxKeys} windows are kept. A new key arriving at the cap first
 * drops windows idle for longer than the interval, and all of them if none are.
 */
public class ErrorRateLimiter {
    public static final int DEFAULT_MAX_KEYS = 1024;

    private final Logger logger;
    private final long minIntervalNanos;
    private final int maxKeys;
    private final ConcurrentHashMap<Object, Window> windows = new ConcurrentHashMap<>();

    private static final class Window {
        final AtomicLong lastLogTime = new AtomicLong(Long.MIN_VALUE);
        final AtomicLong suppressed = new AtomicLong();
    }

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, minIntervalMillis, DEFAULT_MAX_KEYS);
    }

    public ErrorRateLimiter(Logger logger, long minIntervalMillis, int maxKeys) {
        if (maxKeys < 1)
            throw new IllegalArgumentException("maxKeys must be positive: " + maxKeys);
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.maxKeys = maxKeys;
    }

    /**
     * Logs {@code message} at ERROR unless {@code key} logged within the interval.
     *
     * @return true if the message was logged.
     */
    public boolean log(Object key, String message, Throwable t) {
        long now = System.nanoTime();
        if (windows.size() >= maxKeys && !windows.containsKey(key)) {
            evict(now);
        }
        Window w = windows.computeIfAbsent(key, k -> new Window());
        long last = w.lastLogTime.get();
        if (last != Long.MIN_VALUE && now - last <= minIntervalNanos) {
            w.suppressed.incrementAndGet();
            return false;
        }
        // One thread wins per interval
        if (!w.lastLogTime.compareAndSet(last, now)) {
            w.suppressed.incrementAndGet();
            return false;
        }
        long dropped = w.suppressed.getAndSet(0);
        if (dropped > 0) {
            logger.error("{} ({} similar suppressed)", message, dropped, t);
        } else {
            logger.error(message, t);
        }
        return true;
    }

    private void evict(long now) {
        windows.values().removeIf(w -> now - w.lastLogTime.get() > minIntervalNanos);
        if (windows.size() >= maxKeys) {
            windows.clear();
        }
    }

    /** Number of keys that currently have a window. */
    public int trackedKeys() {
        return windows.size();
    }

    /** Total of messages currently held back for {@code key}. */
    public long suppressedCount(Object key) {
        Window w = windows.get(key);
        return w == null ? 0 : w.suppressed.get();
    }

    public void reset() {
        windows.clear();
    }
}
