package batchkeeper.coordinator.repository;

import batchkeeper.coordinator.error.NotFoundException;
import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobFilter;
import batchkeeper.coordinator.model.JobStatus;
import batchkeeper.coordinator.model.JobUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for Job persistence.
 */
public interface JobRepository {

    /**
     * Insert a new job together with its incoming dependency edges.
     * Either everything is stored or nothing is.
     *
     * @param job   the job to insert
     * @param edges edges whose dependent is {@code job}
     * @throws batchkeeper.coordinator.error.ConflictException if the id is taken
     * @throws NotFoundException                               if a predecessor does not exist
     * @throws batchkeeper.coordinator.error.CycleException    if an edge would close a cycle
     */
    void create(Job job, Collection<DependencyEdge> edges);

    /**
     * Insert a new job without dependencies.
     *
     * @param job the job to insert
     */
    default void create(Job job) {
        create(job, List.of());
    }

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Get a job that must exist.
     *
     * @param jobId the job ID
     * @return the job
     * @throws NotFoundException if there is no such job
     */
    default Job get(String jobId) {
        return findById(jobId).orElseThrow(() -> new NotFoundException(jobId));
    }

    /**
     * Apply a field update.
     *
     * @param jobId  the job ID
     * @param update fields to write
     * @throws NotFoundException if there is no such job
     */
    void update(String jobId, JobUpdate update);

    /**
     * Apply a field update only while the job is in one of the expected statuses.
     *
     * @param jobId    the job ID
     * @param expected statuses the job must currently have
     * @param update   fields to write
     * @return false if the job had already moved on
     * @throws NotFoundException if there is no such job
     */
    boolean updateIfStatus(String jobId, Set<JobStatus> expected, JobUpdate update);

    /**
     * List jobs matching a filter, newest first.
     *
     * @param filter criteria
     * @return matching jobs
     */
    List<Job> list(JobFilter filter);

    /**
     * Newest attempt of a retry chain: the spawn with the highest retry count,
     * or the original when it was never retried.
     *
     * @param rootId id of the original job
     * @return the newest attempt, empty if the chain does not exist
     */
    Optional<Job> findLatestAttempt(String rootId);

    /**
     * Delete a job and its incoming dependency edges.
     *
     * @param jobId the job ID
     * @return true if deleted
     */
    boolean delete(String jobId);

    /**
     * Generate a new unique Job ID.
     *
     * @return unique ID like "job-1a2b3c4d"
     */
    String generateId();
}
