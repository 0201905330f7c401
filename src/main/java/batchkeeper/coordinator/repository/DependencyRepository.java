package batchkeeper.coordinator.repository;

import batchkeeper.coordinator.model.DependencyEdge;

import java.util.Collection;
import java.util.List;

/**
 * Repository interface for the dependency graph between jobs.
 */
public interface DependencyRepository {

    /**
     * Insert edges atomically. Edges already present are skipped.
     *
     * @param edges edges to insert
     * @return number of edges actually inserted
     * @throws batchkeeper.coordinator.error.NotFoundException if an endpoint does not exist
     * @throws batchkeeper.coordinator.error.CycleException    if an edge would close a cycle
     */
    int addAll(Collection<DependencyEdge> edges);

    default boolean add(DependencyEdge edge) {
        return addAll(List.of(edge)) > 0;
    }

    /**
     * Incoming edges: what {@code jobId} waits on.
     */
    List<DependencyEdge> dependenciesOf(String jobId);

    /**
     * Outgoing edges: who waits on {@code jobId}.
     */
    List<DependencyEdge> dependentsOf(String jobId);
}
