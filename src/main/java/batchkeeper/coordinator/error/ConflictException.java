package batchkeeper.coordinator.error;

/**
 * Raised when a job is created with an id that is already taken.
 */
public class ConflictException extends KeeperException {

    private final String jobId;

    public ConflictException(String jobId, Throwable cause) {
        super("Job already exists: " + jobId, cause);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
