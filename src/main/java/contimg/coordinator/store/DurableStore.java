package contimg.coordinator.store;

import java.util.List;
import java.util.Optional;

/**
 * Transactional, versioned key/record store shared by every component.
 * Keys are namespaced by component: {@code ingest/}, {@code calreg/}, {@code tasks/}.
 */
public interface DurableStore extends AutoCloseable {

    /** Single-key write in its own transaction. */
    long put(String key, String payload, long expectedVersion);

    Optional<StoredRecord> get(String key);

    List<StoredRecord> scan(String prefix);

    /** Records under {@code prefix} whose key is not below {@code fromKey}, ordered by key. */
    List<StoredRecord> scan(String prefix, String fromKey);

    /**
     * Run work atomically. Any exception rolls the whole transaction back.
     * Nested calls open independent transactions.
     */
    <T> T transact(StoreWork<T> work);

    boolean isHealthy();

    @Override
    void close();
}
