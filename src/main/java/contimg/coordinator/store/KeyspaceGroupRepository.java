package contimg.coordinator.store;

import contimg.coordinator.model.FileGroup;
import contimg.coordinator.model.GroupMember;
import contimg.coordinator.model.GroupState;
import contimg.coordinator.repository.GroupRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * GroupRepository over the durable keyspace.
 * {@code ingest/group/<key>} holds the group, {@code ingest/active/<key>} marks it non-terminal
 * and {@code ingest/path/<path>} maps each member file to its group.
 */
public class KeyspaceGroupRepository implements GroupRepository {

    private final DurableStore store;
    private final RecordCodec codec;

    public KeyspaceGroupRepository(DurableStore store, RecordCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public Optional<FileGroup> find(StoreTransaction tx, String groupKey) {
        return tx.getForUpdate(Keyspace.GROUPS + groupKey).map(this::toGroup);
    }

    @Override
    public Optional<FileGroup> find(String groupKey) {
        return store.get(Keyspace.GROUPS + groupKey).map(this::toGroup);
    }

    @Override
    public List<FileGroup> findActive(StoreTransaction tx) {
        List<FileGroup> groups = new ArrayList<>();
        for (StoredRecord entry : tx.scan(Keyspace.ACTIVE_GROUPS)) {
            String key = entry.key().substring(Keyspace.ACTIVE_GROUPS.length());
            tx.get(Keyspace.GROUPS + key).map(this::toGroup).ifPresent(groups::add);
        }
        return groups;
    }

    @Override
    public List<FileGroup> findActive() {
        return store.transact(this::findActive);
    }

    @Override
    public List<FileGroup> findAll() {
        return store.scan(Keyspace.GROUPS).stream().map(this::toGroup).toList();
    }

    @Override
    public FileGroup save(StoreTransaction tx, FileGroup group) {
        String payload = codec.write(GroupDocument.from(group));
        long version = tx.put(Keyspace.GROUPS + group.groupKey(), payload, group.version());

        String indexKey = Keyspace.ACTIVE_GROUPS + group.groupKey();
        Optional<StoredRecord> index = tx.get(indexKey);
        if (group.state().isTerminal()) {
            index.ifPresent(r -> tx.delete(indexKey, r.version()));
        } else if (index.isEmpty()) {
            tx.put(indexKey, group.groupKey(), 0);
        }
        return group.toBuilder().version(version).build();
    }

    @Override
    public Optional<String> findKeyByPath(StoreTransaction tx, String path) {
        return tx.get(Keyspace.GROUP_PATHS + path).map(StoredRecord::payload);
    }

    @Override
    public void indexPath(StoreTransaction tx, String path, String groupKey) {
        tx.put(Keyspace.GROUP_PATHS + path, groupKey, 0);
    }

    @Override
    public long nextOpenSequence(StoreTransaction tx) {
        return Sequences.next(tx, Keyspace.GROUP_SEQUENCE);
    }

    private FileGroup toGroup(StoredRecord record) {
        return codec.read(record, GroupDocument.class).toGroup(record.version());
    }

    /**
     * Stored form of a group.
     */
    record GroupDocument(
            String groupKey,
            String pointing,
            List<GroupMember> members,
            int expectedCount,
            GroupState state,
            boolean partial,
            String stage,
            Map<String, String> checkpoint,
            int retryCount,
            String lastError,
            String taskId,
            String leaseOwner,
            Instant leaseExpiry,
            long openSequence,
            Instant firstSeen,
            Instant lastUpdate) {

        static GroupDocument from(FileGroup group) {
            return new GroupDocument(group.groupKey(), group.pointing(), List.copyOf(group.members().values()),
                    group.expectedCount(), group.state(), group.partial(), group.stage(), group.checkpoint(),
                    group.retryCount(), group.lastError(), group.taskId(), group.leaseOwner(), group.leaseExpiry(),
                    group.openSequence(), group.firstSeen(), group.lastUpdate());
        }

        FileGroup toGroup(long version) {
            FileGroup.Builder builder = FileGroup.builder()
                    .groupKey(groupKey)
                    .pointing(pointing)
                    .expectedCount(expectedCount)
                    .state(state)
                    .partial(partial)
                    .stage(stage)
                    .retryCount(retryCount)
                    .lastError(lastError)
                    .taskId(taskId)
                    .leaseOwner(leaseOwner)
                    .leaseExpiry(leaseExpiry)
                    .openSequence(openSequence)
                    .firstSeen(firstSeen)
                    .lastUpdate(lastUpdate)
                    .version(version);
            if (members != null) {
                members.forEach(builder::addMember);
            }
            if (checkpoint != null) {
                builder.checkpoint(checkpoint);
            }
            return builder.build();
        }
    }
}
