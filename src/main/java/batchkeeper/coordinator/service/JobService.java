package batchkeeper.coordinator.service;

import batchkeeper.coordinator.backend.BackendStatus;
import batchkeeper.coordinator.backend.SchedulerBackend;
import batchkeeper.coordinator.config.KeeperConfig;
import batchkeeper.coordinator.error.ConflictException;
import batchkeeper.coordinator.error.SubmissionException;
import batchkeeper.coordinator.export.StateExporter;
import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.FailureKind;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobFilter;
import batchkeeper.coordinator.model.JobStatus;
import batchkeeper.coordinator.model.JobUpdate;
import batchkeeper.coordinator.repository.JobRepository;
import batchkeeper.coordinator.tracking.FailureDetector;
import batchkeeper.coordinator.tracking.FailureVerdict;
import batchkeeper.coordinator.tracking.LogInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Drives jobs through their lifecycle: submission, polling, failure
 * classification, retries and dependency release.
 *
 * <p>
 * Every call is synchronous and reads its state from the store, so several
 * processes may track the same jobs. Transitions out of a status are
 * compare-and-set; the loser of a race backs off.
 */
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private static final Set<JobStatus> ACTIVE = EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING);
    private static final Set<JobStatus> CANCELLABLE = EnumSet.of(JobStatus.PENDING, JobStatus.QUEUED,
            JobStatus.RUNNING);

    private final JobRepository jobs;
    private final SchedulerBackend backend;
    private final LogInspector inspector;
    private final FailureDetector detector;
    private final DependencyResolver resolver;
    private final StateExporter exporter;
    private final KeeperConfig config;

    public JobService(JobRepository jobs, SchedulerBackend backend, LogInspector inspector,
            FailureDetector detector, DependencyResolver resolver, StateExporter exporter, KeeperConfig config) {
        this.jobs = jobs;
        this.backend = backend;
        this.inspector = inspector;
        this.detector = detector;
        this.resolver = resolver;
        this.exporter = exporter;
        this.config = config;
    }

    /**
     * Create a job with its dependencies and submit it right away when it has
     * nothing to wait for.
     *
     * @return the job as stored after the attempt (PENDING, QUEUED, or FAILED if submission was rejected)
     */
    public Job submit(SubmitRequest request) {
        request.validate();

        String jobId = jobs.generateId();
        Path runDir = runDirectoryFor(jobId);
        int maxRetries = request.maxRetries() != null ? request.maxRetries() : config.defaultMaxRetries();

        Job job = Job.builder()
                .id(jobId)
                .name(request.name())
                .command(request.command())
                .workingDirectory(request.workingDirectory() != null
                        ? Path.of(request.workingDirectory()).toAbsolutePath().toString()
                        : null)
                .runDirectory(runDir.toString())
                .resources(request.resources())
                .env(request.env())
                .expectedFiles(request.expectedFiles())
                .status(JobStatus.PENDING)
                .createdAt(now())
                .maxRetries(maxRetries)
                .build();

        List<DependencyEdge> edges = request.edgesFor(jobId);
        jobs.create(job, edges);
        log.info("Created job {} ({}) with {} dependencies, max retries {}",
                jobId, job.name(), edges.size(), maxRetries);

        Job current = advancePending(job, new ArrayList<>());
        if (current.status() == JobStatus.PENDING) {
            log.info("Job {} is waiting on its dependencies", jobId);
        }
        return current;
    }

    /**
     * One non-blocking tracking pass over a job.
     */
    public TrackResult track(String jobId) {
        Job job = jobs.get(jobId);
        List<String> created = new ArrayList<>();
        Job current = switch (job.status()) {
            case PENDING -> advancePending(job, created);
            case QUEUED, RUNNING -> poll(job, created);
            case FAILED -> {
                recoverRetry(job, created);
                yield job;
            }
            case COMPLETED, CANCELLED -> job;
        };
        return new TrackResult(current, created);
    }

    /**
     * Track jobs until every one of them, and every retry or dependent
     * released on the way, has settled or the timeout elapses.
     *
     * @param timeout {@code null} to wait indefinitely
     */
    public MonitorResult monitor(Collection<String> jobIds, Duration interval, Duration timeout) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be >= 0");
        }
        Instant deadline = timeout != null ? Instant.now().plus(timeout) : null;

        Set<String> active = new LinkedHashSet<>(jobIds);
        Map<String, Job> finished = new LinkedHashMap<>();
        Map<String, Job> blocked = new LinkedHashMap<>();
        boolean timedOut = false;

        log.info("Monitoring {} jobs", active.size());
        while (!active.isEmpty()) {
            if (deadline != null && !Instant.now().isBefore(deadline)) {
                timedOut = true;
                break;
            }
            for (String id : List.copyOf(active)) {
                TrackResult result = track(id);
                for (String newId : result.newJobIds()) {
                    if (!finished.containsKey(newId)) {
                        active.add(newId);
                    }
                }
                Job job = result.job();
                if (job.isTerminal()) {
                    active.remove(id);
                    finished.put(id, job);
                } else if (job.status() == JobStatus.PENDING
                        && resolver.readiness(job) == DependencyResolver.Readiness.BLOCKED) {
                    active.remove(id);
                    blocked.put(id, job);
                }
            }
            if (active.isEmpty()) {
                break;
            }
            log.debug("{} jobs still active", active.size());
            if (!sleep(interval, deadline)) {
                break;
            }
        }

        List<Job> unfinished = active.stream().map(jobs::get).toList();
        MonitorResult result = new MonitorResult(List.copyOf(finished.values()), List.copyOf(blocked.values()),
                unfinished, timedOut);
        log.info("Monitoring done: {} finished, {} blocked, {} unfinished{}", result.finished().size(),
                result.blocked().size(), unfinished.size(), timedOut ? " (timed out)" : "");
        return result;
    }

    public CompletableFuture<MonitorResult> monitorAsync(Collection<String> jobIds, Duration interval,
            Duration timeout, Executor executor) {
        List<String> ids = List.copyOf(jobIds);
        return CompletableFuture.supplyAsync(() -> monitor(ids, interval, timeout), executor);
    }

    /**
     * Manually retry a terminal job, even one whose retry budget is spent.
     *
     * @return the new attempt
     * @throws IllegalStateException if the job, or a newer attempt of it, is still active
     */
    public Job retry(String jobId) {
        Job job = jobs.get(jobId);
        if (!job.isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " is " + job.status() + "; only finished jobs can be retried");
        }
        Job latest = jobs.findLatestAttempt(job.rootId()).orElse(job);
        if (!latest.isTerminal()) {
            throw new IllegalStateException("Job " + jobId + " already has an active attempt " + latest.id());
        }
        Job spawn = spawnRetry(latest, new ArrayList<>());
        log.info("Manual retry of {} created {}", jobId, spawn.id());
        return spawn;
    }

    /**
     * Cancel a job that has not finished yet.
     *
     * @return false if the job had already finished or the scheduler refused
     */
    public boolean cancel(String jobId) {
        Job job = jobs.get(jobId);
        if (!CANCELLABLE.contains(job.status())) {
            log.warn("Job {} is already {}; nothing to cancel", jobId, job.status());
            return false;
        }
        if (job.backendId() != null && !backend.cancel(job.backendId())) {
            log.warn("Scheduler refused to cancel job {} ({})", jobId, job.backendId());
            return false;
        }
        JobUpdate update = JobUpdate.create().status(JobStatus.CANCELLED).completedAt(now());
        if (!jobs.updateIfStatus(jobId, CANCELLABLE, update)) {
            log.warn("Job {} finished before it could be cancelled", jobId);
            return false;
        }
        Job cancelled = jobs.get(jobId);
        log.info("Cancelled job {}", jobId);
        releaseDependents(cancelled, new ArrayList<>());
        return true;
    }

    public Job get(String jobId) {
        return jobs.get(jobId);
    }

    public List<Job> list(JobFilter filter) {
        return jobs.list(filter);
    }

    public FailureReport failureInfo(String jobId) {
        return FailureReport.of(jobs.get(jobId));
    }

    /**
     * Delete a settled job: its run directory, its row and its incoming edges.
     * Dependents keep their edges and will see the job as missing.
     *
     * @throws IllegalStateException if the job is still queued or running
     * @throws UncheckedIOException  if the run directory cannot be removed; the row is kept
     */
    public void cleanup(String jobId) {
        Job job = jobs.get(jobId);
        if (job.status().isActive()) {
            throw new IllegalStateException("Job " + jobId + " is " + job.status() + "; cancel it first");
        }
        Path runDir = Path.of(job.runDirectory());
        try {
            deleteRecursively(runDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove run directory " + runDir, e);
        }
        jobs.delete(jobId);
        log.info("Cleaned up job {}", jobId);
    }

    public void exportState(Path target) throws IOException {
        exporter.export(target);
    }

    public String exportState() {
        return exporter.exportJson();
    }

    // --- Lifecycle steps ---

    private Job advancePending(Job job, List<String> created) {
        DependencyResolver.Readiness readiness = resolver.readiness(job);
        if (readiness != DependencyResolver.Readiness.ELIGIBLE) {
            log.debug("Job {} not submitted: {}", job.id(), readiness);
            return job;
        }
        return submitToBackend(job, created);
    }

    private Job submitToBackend(Job job, List<String> created) {
        String backendId;
        try {
            Path script = writeScript(job);
            backendId = backend.submit(script);
        } catch (SubmissionException | IOException e) {
            log.warn("Submission of job {} failed: {}", job.id(), e.getMessage());
            JobUpdate failed = JobUpdate.create()
                    .status(JobStatus.FAILED)
                    .failure(FailureKind.SCHEDULER, "submission failed: " + e.getMessage(), List.of())
                    .completedAt(now());
            if (!jobs.updateIfStatus(job.id(), EnumSet.of(JobStatus.PENDING), failed)) {
                return jobs.get(job.id());
            }
            Job failedJob = jobs.get(job.id());
            afterTerminal(failedJob, created);
            return failedJob;
        }

        JobUpdate queued = JobUpdate.create()
                .status(JobStatus.QUEUED)
                .backendId(backendId)
                .submittedAt(now());
        if (!jobs.updateIfStatus(job.id(), EnumSet.of(JobStatus.PENDING), queued)) {
            log.warn("Job {} was submitted by another tracker; cancelling duplicate {}", job.id(), backendId);
            backend.cancel(backendId);
            return jobs.get(job.id());
        }
        log.info("Submitted job {} ({}) to {} as {}", job.id(), job.name(), backend.type(), backendId);
        return jobs.get(job.id());
    }

    private Job poll(Job job, List<String> created) {
        if (job.backendId() == null) {
            log.warn("Job {} is {} without a scheduler id", job.id(), job.status());
            return job;
        }
        BackendStatus status = backend.status(job.backendId());
        log.debug("Job {} ({}) scheduler status {}", job.id(), job.backendId(), status);
        return switch (status) {
            case RUNNING -> markRunning(job);
            case COMPLETED, FAILED -> finish(job, status, created);
            case QUEUED, UNKNOWN -> job;
        };
    }

    private Job markRunning(Job job) {
        if (job.status() != JobStatus.QUEUED) {
            return job;
        }
        if (jobs.updateIfStatus(job.id(), EnumSet.of(JobStatus.QUEUED),
                JobUpdate.create().status(JobStatus.RUNNING).startedAt(now()))) {
            log.info("Job {} started", job.id());
        }
        return jobs.get(job.id());
    }

    private Job finish(Job job, BackendStatus status, List<String> created) {
        Integer exitCode = resolveExitCode(job);
        FailureVerdict verdict = detector.detect(job, status, exitCode);

        JobUpdate update = JobUpdate.create()
                .status(verdict.failed() ? JobStatus.FAILED : JobStatus.COMPLETED)
                .exitCode(exitCode)
                .completedAt(now());
        if (verdict.failed()) {
            update.failure(verdict.kind(), verdict.reason(), verdict.errorLines());
        }
        if (!jobs.updateIfStatus(job.id(), ACTIVE, update)) {
            log.debug("Job {} was finished by another tracker", job.id());
            return jobs.get(job.id());
        }

        Job finished = jobs.get(job.id());
        if (verdict.failed()) {
            log.info("Job {} failed ({}): {}", job.id(), verdict.kind(), verdict.reason());
        } else {
            log.info("Job {} completed", job.id());
        }
        afterTerminal(finished, created);
        return finished;
    }

    /**
     * Accounting first, then an exit code the job printed itself.
     */
    private Integer resolveExitCode(Job job) {
        OptionalInt accounted = backend.exitCode(job.backendId());
        if (accounted.isPresent()) {
            return accounted.getAsInt();
        }
        for (Path logFile : List.of(job.stderrPath(), job.stdoutPath())) {
            OptionalInt sentinel = inspector.exitCodeSentinel(logFile);
            if (sentinel.isPresent()) {
                return sentinel.getAsInt();
            }
        }
        return job.exitCode();
    }

    private void afterTerminal(Job job, List<String> created) {
        if (job.canRetry()) {
            spawnRetry(job, created);
        }
        releaseDependents(job, created);
    }

    private void releaseDependents(Job job, List<String> created) {
        for (Job dependent : resolver.eligibleDependents(job)) {
            Job submitted = submitToBackend(dependent, created);
            if (submitted.status() != JobStatus.PENDING) {
                created.add(dependent.id());
            }
        }
    }

    /**
     * A failed job with budget left whose retry was never created, e.g. after a crash.
     */
    private void recoverRetry(Job job, List<String> created) {
        if (!job.canRetry()) {
            return;
        }
        Job latest = jobs.findLatestAttempt(job.rootId()).orElse(job);
        if (latest.id().equals(job.id())) {
            log.info("Recovering missing retry of job {}", job.id());
            afterTerminal(job, created);
        }
    }

    /**
     * Create and submit the next attempt of a chain. Attempt ids are
     * deterministic, so a second tracker racing on the same failure hits a
     * conflict instead of creating a duplicate.
     */
    private Job spawnRetry(Job failed, List<String> created) {
        String rootId = failed.rootId();
        int attempt = failed.retryCount() + 1;
        String spawnId = rootId + "-r" + attempt;

        Job spawn = failed.toBuilder()
                .id(spawnId)
                .runDirectory(runDirectoryFor(spawnId).toString())
                .workingDirectory(failed.workingDirectory().equals(failed.runDirectory())
                        ? null
                        : failed.workingDirectory())
                .status(JobStatus.PENDING)
                .backendId(null)
                .exitCode(null)
                .createdAt(now())
                .submittedAt(null)
                .startedAt(null)
                .completedAt(null)
                .failureKind(null)
                .failureReason(null)
                .errorLines(List.of())
                .retryCount(attempt)
                .maxRetries(Math.max(failed.maxRetries(), attempt))
                .parentJobId(rootId)
                .build();

        try {
            jobs.create(spawn);
        } catch (ConflictException e) {
            log.debug("Retry {} already exists", spawnId);
            return jobs.get(spawnId);
        }
        log.info("Retrying job {} as {} (attempt {} of {})", rootId, spawnId, attempt, spawn.maxRetries());
        created.add(spawnId);
        return submitToBackend(spawn, created);
    }

    private Path writeScript(Job job) throws IOException {
        Path runDir = Path.of(job.runDirectory());
        Files.createDirectories(runDir);
        Path script = runDir.resolve("job." + backend.scriptExtension());
        Files.writeString(script, backend.generateScript(job));
        if (!script.toFile().setExecutable(true, true)) {
            log.debug("Could not mark {} executable", script);
        }
        return script;
    }

    private Path runDirectoryFor(String jobId) {
        return config.runsDirectory().resolve(jobId);
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    private static boolean sleep(Duration interval, Instant deadline) {
        long millis = interval.toMillis();
        if (deadline != null) {
            millis = Math.min(millis, Math.max(0, Duration.between(Instant.now(), deadline).toMillis()));
        }
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Monitoring interrupted");
            return false;
        }
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
