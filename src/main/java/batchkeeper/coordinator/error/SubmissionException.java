package batchkeeper.coordinator.error;

/**
 * Raised when the batch scheduler rejects a submission or its reply cannot be parsed.
 */
public class SubmissionException extends KeeperException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
