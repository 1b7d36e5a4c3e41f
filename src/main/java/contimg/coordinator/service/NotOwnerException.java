package contimg.coordinator.service;

/**
 * A worker acted on a lease it does not hold (anymore).
 */
public class NotOwnerException extends RuntimeException {

    private final String resourceId;
    private final String workerId;

    public NotOwnerException(String resourceId, String workerId, String detail) {
        super("Worker " + workerId + " does not hold the lease on " + resourceId + ": " + detail);
        this.resourceId = resourceId;
        this.workerId = workerId;
    }

    public String resourceId() {
        return resourceId;
    }

    public String workerId() {
        return workerId;
    }
}
