package batchkeeper.coordinator.error;

/**
 * Raised when a job id does not exist in the store.
 */
public class NotFoundException extends KeeperException {

    private final String jobId;

    public NotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
