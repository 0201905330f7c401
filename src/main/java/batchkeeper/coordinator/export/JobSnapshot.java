package batchkeeper.coordinator.export;

import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.ResourceRequest;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Exported view of one job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("command") String command,
        @JsonProperty("status") String status,
        @JsonProperty("backendId") String backendId,
        @JsonProperty("workingDirectory") String workingDirectory,
        @JsonProperty("runDirectory") String runDirectory,
        @JsonProperty("resources") Resources resources,
        @JsonProperty("env") Map<String, String> env,
        @JsonProperty("expectedFiles") List<String> expectedFiles,
        @JsonProperty("dependencies") List<Dependency> dependencies,
        @JsonProperty("exitCode") Integer exitCode,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("submittedAt") Instant submittedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("failureKind") String failureKind,
        @JsonProperty("failureReason") String failureReason,
        @JsonProperty("errorLines") List<String> errorLines,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("parentJobId") String parentJobId) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Resources(
            @JsonProperty("nodes") int nodes,
            @JsonProperty("cpus") int cpus,
            @JsonProperty("gpus") int gpus,
            @JsonProperty("memory") String memory,
            @JsonProperty("walltime") String walltime,
            @JsonProperty("queue") String queue,
            @JsonProperty("account") String account) {

        static Resources from(ResourceRequest r) {
            return new Resources(r.nodes(), r.cpus(), r.gpus(), r.memory(), r.walltime(), r.queue(), r.account());
        }
    }

    public record Dependency(
            @JsonProperty("jobId") String jobId,
            @JsonProperty("kind") String kind) {
    }

    /** Create snapshot from domain model and its incoming edges */
    public static JobSnapshot from(Job job, List<DependencyEdge> incoming) {
        List<Dependency> deps = incoming.stream()
                .map(e -> new Dependency(e.predecessorId(), e.kind().wireName()))
                .toList();
        return new JobSnapshot(
                job.id(),
                job.name(),
                job.command(),
                job.status().name().toLowerCase(),
                job.backendId(),
                job.workingDirectory(),
                job.runDirectory(),
                Resources.from(job.resources()),
                job.env(),
                job.expectedFiles(),
                deps,
                job.exitCode(),
                job.createdAt(),
                job.submittedAt(),
                job.startedAt(),
                job.completedAt(),
                job.failureKind() != null ? job.failureKind().name().toLowerCase() : null,
                job.failureReason(),
                job.errorLines(),
                job.retryCount(),
                job.maxRetries(),
                job.parentJobId());
    }
}
