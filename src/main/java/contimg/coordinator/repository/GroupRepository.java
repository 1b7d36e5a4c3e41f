package contimg.coordinator.repository;

import contimg.coordinator.model.FileGroup;
import contimg.coordinator.store.StoreTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of file groups under the {@code ingest/} namespace.
 * Non-terminal groups are also listed in an active index so sweeps do not scan history.
 */
public interface GroupRepository {

    /** Find a group inside a transaction, locking it. */
    Optional<FileGroup> find(StoreTransaction tx, String groupKey);

    Optional<FileGroup> find(String groupKey);

    /** Groups that are not COMPLETED or ABANDONED. Not locked. */
    List<FileGroup> findActive(StoreTransaction tx);

    List<FileGroup> findActive();

    /** Every group ever recorded. */
    List<FileGroup> findAll();

    /**
     * Insert or update a group and keep the active index in step with its state.
     *
     * @return the group with its new version
     */
    FileGroup save(StoreTransaction tx, FileGroup group);

    /** Key of the group that recorded {@code path}, whatever state that group is in now. */
    Optional<String> findKeyByPath(StoreTransaction tx, String path);

    /** Remember that {@code path} belongs to {@code groupKey}; a path is indexed once. */
    void indexPath(StoreTransaction tx, String path, String groupKey);

    /** Next value of the group open sequence. */
    long nextOpenSequence(StoreTransaction tx);
}
