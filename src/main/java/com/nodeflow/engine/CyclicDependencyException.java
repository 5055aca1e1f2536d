package com.nodeflow.engine;

import java.util.Set;
import java.util.UUID;

/**
 * Data-flow evaluation stalled: no node is ready while some remain
 * unevaluated, so the remaining nodes depend on each other.
 */
public class CyclicDependencyException extends GraphExecutionException {

    private final Set<UUID> unresolvedNodeIds;

    public CyclicDependencyException(Set<UUID> unresolvedNodeIds, int evaluated, int total) {
        super("Cycle detected! Evaluated " + evaluated + " of " + total
                + " nodes, unresolved: " + unresolvedNodeIds);
        this.unresolvedNodeIds = Set.copyOf(unresolvedNodeIds);
    }

    public Set<UUID> getUnresolvedNodeIds() {
        return unresolvedNodeIds;
    }
}
