package batchkeeper.coordinator.error;

/**
 * Base class for every error raised by the job keeper.
 * All subclasses are unchecked.
 */
public class KeeperException extends RuntimeException {

    public KeeperException(String message) {
        super(message);
    }

    public KeeperException(String message, Throwable cause) {
        super(message, cause);
    }
}
