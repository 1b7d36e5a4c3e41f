package contimg.coordinator.store;

import java.util.List;
import java.util.Optional;

/**
 * View of the keyspace inside one atomic transaction.
 * Rows read with {@link #getForUpdate(String)} stay locked until commit or rollback.
 */
public interface StoreTransaction {

    /** Read committed state of a record without locking it. */
    Optional<StoredRecord> get(String key);

    /** Read a record and lock it for the rest of the transaction. */
    Optional<StoredRecord> getForUpdate(String key);

    /** All records under a prefix, ordered by key. Rows are not locked. */
    List<StoredRecord> scan(String prefix);

    /**
     * Write a record.
     *
     * @param expectedVersion 0 when the record must not exist yet
     * @return the new version
     * @throws VersionConflictException if the stored version differs
     */
    long put(String key, String payload, long expectedVersion);

    /** Remove a record. Only used when moving records into an archive namespace. */
    void delete(String key, long expectedVersion);

    /** Take an advisory lock held until the transaction ends. */
    void lockScope(String scope);

    /** Run an action once the transaction has committed. Dropped on rollback. */
    void afterCommit(Runnable action);
}
