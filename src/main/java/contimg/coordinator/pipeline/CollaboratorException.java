package contimg.coordinator.pipeline;

/**
 * Transport-level failure of an external collaborator: crash, timeout, unreadable output.
 * Always treated as retryable.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
