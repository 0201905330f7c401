package batchkeeper.coordinator.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model of a batch job and everything known about its run.
 *
 * <p>
 * A retry is a separate Job whose {@code parentJobId} points at the first
 * job of the chain; the failed attempt keeps its failure record.
 */
public final class Job {

    public static final String STDOUT_FILE = "stdout.log";
    public static final String STDERR_FILE = "stderr.log";

    private final String id;
    private final String name;
    private final String command;
    private final String workingDirectory;
    private final String runDirectory;
    private final ResourceRequest resources;
    private final Map<String, String> env;
    private final List<String> expectedFiles;
    private final JobStatus status;
    private final String backendId;
    private final Integer exitCode;
    private final Instant createdAt;
    private final Instant submittedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final FailureKind failureKind;
    private final String failureReason;
    private final List<String> errorLines;
    private final int retryCount;
    private final int maxRetries;
    private final String parentJobId;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.command = Objects.requireNonNull(builder.command, "command is required");
        this.runDirectory = Objects.requireNonNull(builder.runDirectory, "runDirectory is required");
        this.workingDirectory = builder.workingDirectory != null ? builder.workingDirectory : builder.runDirectory;
        this.resources = builder.resources != null ? builder.resources : ResourceRequest.defaults();
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(builder.env));
        this.expectedFiles = List.copyOf(builder.expectedFiles);
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.backendId = builder.backendId;
        this.exitCode = builder.exitCode;
        this.createdAt = builder.createdAt;
        this.submittedAt = builder.submittedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.failureKind = builder.failureKind;
        this.failureReason = builder.failureReason;
        this.errorLines = List.copyOf(builder.errorLines);
        this.retryCount = builder.retryCount;
        this.maxRetries = builder.maxRetries;
        this.parentJobId = builder.parentJobId;

        if (retryCount < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("retryCount and maxRetries must be >= 0");
        }
        if (retryCount > maxRetries) {
            throw new IllegalArgumentException(
                    "retryCount " + retryCount + " exceeds maxRetries " + maxRetries + " for job " + id);
        }
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String command() {
        return command;
    }

    public String workingDirectory() {
        return workingDirectory;
    }

    public String runDirectory() {
        return runDirectory;
    }

    public ResourceRequest resources() {
        return resources;
    }

    public Map<String, String> env() {
        return env;
    }

    public List<String> expectedFiles() {
        return expectedFiles;
    }

    public JobStatus status() {
        return status;
    }

    public String backendId() {
        return backendId;
    }

    public Integer exitCode() {
        return exitCode;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public String failureReason() {
        return failureReason;
    }

    public List<String> errorLines() {
        return errorLines;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public String parentJobId() {
        return parentJobId;
    }

    /** Id of the first job of this retry chain (the job itself for originals). */
    public String rootId() {
        return parentJobId != null ? parentJobId : id;
    }

    public boolean isRetry() {
        return parentJobId != null;
    }

    /** Failed with retry budget left */
    public boolean canRetry() {
        return status == JobStatus.FAILED && retryCount < maxRetries;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Path stdoutPath() {
        return Path.of(runDirectory, STDOUT_FILE);
    }

    public Path stderrPath() {
        return Path.of(runDirectory, STDERR_FILE);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .command(command)
                .workingDirectory(workingDirectory)
                .runDirectory(runDirectory)
                .resources(resources)
                .env(env)
                .expectedFiles(expectedFiles)
                .status(status)
                .backendId(backendId)
                .exitCode(exitCode)
                .createdAt(createdAt)
                .submittedAt(submittedAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .failureKind(failureKind)
                .failureReason(failureReason)
                .errorLines(errorLines)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .parentJobId(parentJobId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String command;
        private String workingDirectory;
        private String runDirectory;
        private ResourceRequest resources;
        private Map<String, String> env = Map.of();
        private List<String> expectedFiles = List.of();
        private JobStatus status = JobStatus.PENDING;
        private String backendId;
        private Integer exitCode;
        private Instant createdAt;
        private Instant submittedAt;
        private Instant startedAt;
        private Instant completedAt;
        private FailureKind failureKind;
        private String failureReason;
        private List<String> errorLines = List.of();
        private int retryCount;
        private int maxRetries;
        private String parentJobId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder runDirectory(String runDirectory) {
            this.runDirectory = runDirectory;
            return this;
        }

        public Builder resources(ResourceRequest resources) {
            this.resources = resources;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env != null ? env : Map.of();
            return this;
        }

        public Builder expectedFiles(List<String> expectedFiles) {
            this.expectedFiles = expectedFiles != null ? expectedFiles : List.of();
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder backendId(String backendId) {
            this.backendId = backendId;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder failureKind(FailureKind failureKind) {
            this.failureKind = failureKind;
            return this;
        }

        public Builder failureReason(String failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Builder errorLines(List<String> errorLines) {
            this.errorLines = errorLines != null ? errorLines : List.of();
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder parentJobId(String parentJobId) {
            this.parentJobId = parentJobId;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', name='" + name + "', status=" + status
                + ", attempt=" + retryCount + "/" + maxRetries + "}";
    }
}
