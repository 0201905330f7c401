package batchkeeper.coordinator.error;

/**
 * Wraps a failure of the underlying job store. Never retried.
 */
public class StoreException extends KeeperException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
