package com.nodeflow.util;

import com.nodeflow.api.ExecutionListener;
import com.nodeflow.api.NodeGraphCategory;

import java.util.Arrays;
import java.util.UUID;

/**
 * Fans callbacks out to several {@link ExecutionListener}s, in registration
 * order. Adding and removing copy the array so a run in progress keeps
 * iterating a stable snapshot.
 */
public class CompositeExecutionListener implements ExecutionListener {
    private volatile ExecutionListener[] listeners = new ExecutionListener[0];

    public synchronized void add(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        ExecutionListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized boolean remove(ExecutionListener listener) {
        ExecutionListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                ExecutionListener[] next = new ExecutionListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRunStart(long run, UUID graphId, NodeGraphCategory category) {
        for (ExecutionListener l : listeners)
            l.onRunStart(run, graphId, category);
    }

    @Override
    public void onNodeExecuted(long run, UUID nodeId, String nodeName, long durationNanos) {
        for (ExecutionListener l : listeners)
            l.onNodeExecuted(run, nodeId, nodeName, durationNanos);
    }

    @Override
    public void onNodeError(long run, UUID nodeId, String nodeName, Throwable error) {
        for (ExecutionListener l : listeners)
            l.onNodeError(run, nodeId, nodeName, error);
    }

    @Override
    public void onRunEnd(long run, int nodesExecuted) {
        for (ExecutionListener l : listeners)
            l.onRunEnd(run, nodesExecuted);
    }
}
