package contimg.coordinator.store;

/**
 * The store could not be reached or a lock was not granted within the bounded wait.
 * Retried by callers with backoff.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
