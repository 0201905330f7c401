package batchkeeper.coordinator.service;

import batchkeeper.coordinator.model.FailureKind;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * Why a job failed and where to look.
 */
public record FailureReport(
        String jobId,
        String name,
        JobStatus status,
        Integer exitCode,
        FailureKind kind,
        String reason,
        List<String> errorLines,
        Path stdoutPath,
        Path stderrPath,
        int retryCount,
        int maxRetries) {

    static FailureReport of(Job job) {
        return new FailureReport(job.id(), job.name(), job.status(), job.exitCode(), job.failureKind(),
                job.failureReason(), job.errorLines(), job.stdoutPath(), job.stderrPath(),
                job.retryCount(), job.maxRetries());
    }
}
