package contimg.coordinator.store;

/**
 * Raised when the durable store cannot complete an operation.
 * Callers treat a plain StoreException as fatal.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
