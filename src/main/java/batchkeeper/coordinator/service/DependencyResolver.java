package batchkeeper.coordinator.service;

import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobStatus;
import batchkeeper.coordinator.repository.DependencyRepository;
import batchkeeper.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which pending jobs may be submitted, from the stored graph only.
 *
 * <p>
 * A predecessor is judged by the newest attempt of its retry chain, so a
 * failure that is still going to be retried does not release
 * {@code after_fail} dependents, and a retry that succeeds releases
 * {@code after_ok} dependents of the original.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    public enum Readiness {
        /** Every edge is satisfied */
        ELIGIBLE,
        /** Some predecessor has not settled yet */
        WAITING,
        /** Every predecessor settled but some edge can never be satisfied */
        BLOCKED
    }

    /** Settled state of a predecessor chain. */
    enum Outcome {
        ACTIVE,
        COMPLETED,
        FAILED,
        CANCELLED,
        MISSING,
        /** Still pending but can never run */
        BLOCKED
    }

    private final JobRepository jobs;
    private final DependencyRepository dependencies;

    public DependencyResolver(JobRepository jobs, DependencyRepository dependencies) {
        this.jobs = jobs;
        this.dependencies = dependencies;
    }

    public Readiness readiness(Job job) {
        return readiness(job, new HashMap<>());
    }

    /**
     * Readiness memoised per job id for one resolution. The graph is acyclic,
     * so following pending predecessors always terminates.
     */
    private Readiness readiness(Job job, Map<String, Readiness> memo) {
        Readiness known = memo.get(job.id());
        if (known != null) {
            return known;
        }
        Readiness readiness = evaluate(job, memo);
        memo.put(job.id(), readiness);
        return readiness;
    }

    private Readiness evaluate(Job job, Map<String, Readiness> memo) {
        boolean blocked = false;
        for (DependencyEdge edge : dependencies.dependenciesOf(job.id())) {
            Outcome outcome = effectiveOutcome(edge.predecessorId(), memo);
            if (outcome == Outcome.ACTIVE) {
                return Readiness.WAITING;
            }
            if (!isSatisfied(edge, outcome)) {
                blocked = true;
            }
        }
        return blocked ? Readiness.BLOCKED : Readiness.ELIGIBLE;
    }

    /**
     * Pending dependents of the finished job's chain that are now eligible.
     */
    public List<Job> eligibleDependents(Job finished) {
        Set<String> dependentIds = new LinkedHashSet<>();
        for (DependencyEdge edge : dependencies.dependentsOf(finished.rootId())) {
            dependentIds.add(edge.dependentId());
        }
        if (!finished.id().equals(finished.rootId())) {
            for (DependencyEdge edge : dependencies.dependentsOf(finished.id())) {
                dependentIds.add(edge.dependentId());
            }
        }

        List<Job> eligible = new ArrayList<>();
        for (String id : dependentIds) {
            Optional<Job> dependent = jobs.findById(id);
            if (dependent.isEmpty() || dependent.get().status() != JobStatus.PENDING) {
                continue;
            }
            Readiness readiness = readiness(dependent.get());
            log.debug("Dependent {} of {} is {}", id, finished.id(), readiness);
            if (readiness == Readiness.ELIGIBLE) {
                eligible.add(dependent.get());
            }
        }
        return eligible;
    }

    Outcome effectiveOutcome(String predecessorId) {
        return effectiveOutcome(predecessorId, new HashMap<>());
    }

    private Outcome effectiveOutcome(String predecessorId, Map<String, Readiness> memo) {
        Optional<Job> predecessor = jobs.findById(predecessorId);
        if (predecessor.isEmpty()) {
            return Outcome.MISSING;
        }
        Job latest = jobs.findLatestAttempt(predecessor.get().rootId()).orElse(predecessor.get());
        return switch (latest.status()) {
            case COMPLETED -> Outcome.COMPLETED;
            case CANCELLED -> Outcome.CANCELLED;
            case FAILED -> latest.canRetry() ? Outcome.ACTIVE : Outcome.FAILED;
            case PENDING -> readiness(latest, memo) == Readiness.BLOCKED ? Outcome.BLOCKED : Outcome.ACTIVE;
            case QUEUED, RUNNING -> Outcome.ACTIVE;
        };
    }

    static boolean isSatisfied(DependencyEdge edge, Outcome outcome) {
        return switch (edge.kind()) {
            case AFTER_OK -> outcome == Outcome.COMPLETED;
            case AFTER_FAIL -> outcome == Outcome.FAILED;
            case AFTER_ANY -> outcome == Outcome.COMPLETED || outcome == Outcome.FAILED
                    || outcome == Outcome.CANCELLED;
        };
    }
}
