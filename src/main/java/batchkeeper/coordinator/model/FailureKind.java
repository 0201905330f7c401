package batchkeeper.coordinator.model;

/**
 * Which signal classified a job as failed.
 */
public enum FailureKind {
    /** The scheduler reported the job as failed, or rejected the submission */
    SCHEDULER,
    /** Non-zero exit code */
    EXIT_CODE,
    /** An expected output file is absent */
    MISSING_FILE,
    /** Error lines in the captured logs */
    LOG_ERROR,
    /** Error lines that look like memory exhaustion */
    OOM
}
