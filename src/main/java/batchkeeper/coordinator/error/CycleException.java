package batchkeeper.coordinator.error;

import batchkeeper.coordinator.model.DependencyEdge;

/**
 * Raised when inserting a dependency edge would close a cycle.
 * Nothing from the offending call is persisted.
 */
public class CycleException extends KeeperException {

    private final DependencyEdge edge;

    public CycleException(DependencyEdge edge) {
        super("Dependency " + edge.dependentId() + " -> " + edge.predecessorId()
                + " (" + edge.kind() + ") would create a cycle");
        this.edge = edge;
    }

    public DependencyEdge edge() {
        return edge;
    }
}
