package contimg.coordinator.store;

/**
 * Optimistic concurrency mismatch on a single key.
 * The caller must re-read the record and retry.
 */
public class VersionConflictException extends StoreException {

    private final String key;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String key, long expectedVersion, long actualVersion) {
        super("Version conflict on " + key + ": expected " + expectedVersion + ", found " + actualVersion);
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String key() {
        return key;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    /** Version currently stored, or 0 when the record does not exist. */
    public long actualVersion() {
        return actualVersion;
    }
}
