package batchkeeper.coordinator.model;

/**
 * Lifecycle state of a batch job.
 */
public enum JobStatus {
    /** Created, waiting for dependencies or for submission */
    PENDING,
    /** Accepted by the batch scheduler, not started yet */
    QUEUED,
    /** Executing on the cluster */
    RUNNING,
    /** Finished and passed every failure check */
    COMPLETED,
    /** Finished with at least one failure signal, or submission was rejected */
    FAILED,
    /** Cancelled by the user */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** Known to the batch scheduler and not finished yet */
    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }
}
