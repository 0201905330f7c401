package batchkeeper.coordinator.model;

import java.util.Objects;

/**
 * Directed edge: {@code dependentId} waits on {@code predecessorId}.
 */
public record DependencyEdge(String dependentId, String predecessorId, DependencyKind kind) {

    public DependencyEdge {
        Objects.requireNonNull(dependentId, "dependentId is required");
        Objects.requireNonNull(predecessorId, "predecessorId is required");
        Objects.requireNonNull(kind, "kind is required");
    }

    public static DependencyEdge afterOk(String dependentId, String predecessorId) {
        return new DependencyEdge(dependentId, predecessorId, DependencyKind.AFTER_OK);
    }

    public static DependencyEdge afterFail(String dependentId, String predecessorId) {
        return new DependencyEdge(dependentId, predecessorId, DependencyKind.AFTER_FAIL);
    }

    public static DependencyEdge afterAny(String dependentId, String predecessorId) {
        return new DependencyEdge(dependentId, predecessorId, DependencyKind.AFTER_ANY);
    }

    public boolean isSelfLoop() {
        return dependentId.equals(predecessorId);
    }
}
