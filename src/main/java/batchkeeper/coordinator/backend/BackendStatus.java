package batchkeeper.coordinator.backend;

/**
 * Job state as reported by a batch scheduler, normalized across backends.
 */
public enum BackendStatus {
    /** Waiting in the scheduler queue (pending, held, requeued) */
    QUEUED,
    /** Executing or completing */
    RUNNING,
    /** Finished, scheduler considers it successful */
    COMPLETED,
    /** Finished with a scheduler-level failure (cancelled, timeout, node failure, non-zero status) */
    FAILED,
    /** Neither the live queue nor accounting knows the job */
    UNKNOWN;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
