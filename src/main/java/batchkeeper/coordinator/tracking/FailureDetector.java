package batchkeeper.coordinator.tracking;

import batchkeeper.coordinator.backend.BackendStatus;
import batchkeeper.coordinator.model.FailureKind;
import batchkeeper.coordinator.model.Job;

import java.nio.file.Path;
import java.util.List;

/**
 * Combines the four failure signals of a finished job into one verdict.
 *
 * <p>
 * Checks run in a fixed order and the first hit wins: scheduler status,
 * exit code, expected files, log content. A scheduler kill is therefore never
 * hidden behind a clean exit code, and memory exhaustion is reported apart
 * from other log errors.
 */
public class FailureDetector {

    public static final int DEFAULT_MAX_REPORTED_LINES = 20;
    static final int MAX_LISTED_FILES = 5;

    private final LogInspector inspector;
    private final int maxReportedLines;

    public FailureDetector(LogInspector inspector) {
        this(inspector, DEFAULT_MAX_REPORTED_LINES);
    }

    public FailureDetector(LogInspector inspector, int maxReportedLines) {
        if (maxReportedLines < 1) {
            throw new IllegalArgumentException("maxReportedLines must be >= 1");
        }
        this.inspector = inspector;
        this.maxReportedLines = maxReportedLines;
    }

    /**
     * @param job      the finished job (paths and expectations)
     * @param status   terminal status reported by the scheduler
     * @param exitCode exit code if known, else {@code null}
     */
    public FailureVerdict detect(Job job, BackendStatus status, Integer exitCode) {
        if (status == BackendStatus.FAILED) {
            return FailureVerdict.failure(FailureKind.SCHEDULER, "scheduler reported failure");
        }

        if (exitCode != null && exitCode != 0) {
            return FailureVerdict.failure(FailureKind.EXIT_CODE, "exit code " + exitCode);
        }

        List<String> missing = ExpectedFiles.missing(job.expectedFiles(), Path.of(job.workingDirectory()));
        if (!missing.isEmpty()) {
            return FailureVerdict.failure(FailureKind.MISSING_FILE, missingFilesReason(missing));
        }

        InspectionResult inspection = inspector.inspect(job.stderrPath(), job.stdoutPath());
        if (inspection.hasErrors()) {
            List<String> lines = inspection.errorLines();
            List<String> reported = lines.size() > maxReportedLines ? lines.subList(0, maxReportedLines) : lines;
            boolean oom = lines.stream().anyMatch(inspector::isOutOfMemory);
            if (oom) {
                return FailureVerdict.failure(FailureKind.OOM, "out of memory", reported);
            }
            return FailureVerdict.failure(FailureKind.LOG_ERROR,
                    "found " + lines.size() + " error(s) in logs", reported);
        }

        return FailureVerdict.success();
    }

    static String missingFilesReason(List<String> missing) {
        StringBuilder reason = new StringBuilder("missing output files: ");
        reason.append(String.join(", ", missing.subList(0, Math.min(MAX_LISTED_FILES, missing.size()))));
        if (missing.size() > MAX_LISTED_FILES) {
            reason.append(" and ").append(missing.size() - MAX_LISTED_FILES).append(" more");
        }
        return reason.toString();
    }
}
