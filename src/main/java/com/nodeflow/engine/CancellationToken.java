package com.nodeflow.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a graph run.
 *
 * Engines check the token between node evaluations only; a node that is
 * already running is never interrupted.
 */
public final class CancellationToken {

    /** A token that is never cancelled. {@link #cancel()} has no effect on it. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /** Requests cancellation. Idempotent and safe from any thread. */
    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public boolean isCancellable() {
        return cancellable;
    }
}
