package contimg.coordinator.store;

import contimg.coordinator.model.Task;
import contimg.coordinator.model.TaskState;
import contimg.coordinator.repository.TaskRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * TaskRepository over the durable keyspace.
 * Live tasks live under {@code tasks/task/<id>}, archived ones under {@code tasks/archive/<id>}.
 */
public class KeyspaceTaskRepository implements TaskRepository {

    private final DurableStore store;
    private final RecordCodec codec;

    public KeyspaceTaskRepository(DurableStore store, RecordCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public Optional<Task> find(StoreTransaction tx, String taskId) {
        return tx.getForUpdate(Keyspace.TASKS + taskId).map(this::toTask);
    }

    @Override
    public Optional<Task> findById(String taskId) {
        Optional<StoredRecord> live = store.get(Keyspace.TASKS + taskId);
        if (live.isPresent()) {
            return live.map(this::toTask);
        }
        return store.get(Keyspace.TASK_ARCHIVE + taskId).map(this::toTask);
    }

    @Override
    public List<Task> findAll(StoreTransaction tx) {
        return tx.scan(Keyspace.TASKS).stream().map(this::toTask).toList();
    }

    @Override
    public List<Task> findAll() {
        return store.scan(Keyspace.TASKS).stream().map(this::toTask).toList();
    }

    @Override
    public Task insert(StoreTransaction tx, Task task) {
        long version = tx.put(Keyspace.TASKS + task.id(), codec.write(TaskDocument.from(task)), 0);
        return task.toBuilder().version(version).build();
    }

    @Override
    public Task update(StoreTransaction tx, Task task) {
        if (task.version() <= 0) {
            throw new IllegalArgumentException("Task " + task.id() + " has not been saved yet");
        }
        long version = tx.put(Keyspace.TASKS + task.id(), codec.write(TaskDocument.from(task)), task.version());
        return task.toBuilder().version(version).build();
    }

    @Override
    public void archive(StoreTransaction tx, Task task) {
        tx.delete(Keyspace.TASKS + task.id(), task.version());
        tx.put(Keyspace.TASK_ARCHIVE + task.id(), codec.write(TaskDocument.from(task)), 0);
    }

    private Task toTask(StoredRecord record) {
        return codec.read(record, TaskDocument.class).toTask(record.version());
    }

    /**
     * Stored form of a task.
     */
    record TaskDocument(
            String id,
            String type,
            String groupId,
            String payload,
            TaskState state,
            int priority,
            int attempts,
            int maxRetries,
            String workerId,
            Instant leaseExpiry,
            Duration leaseDuration,
            String lastError,
            String result,
            boolean cancelRequested,
            Instant createdAt,
            Instant claimedAt,
            Instant finishedAt) {

        static TaskDocument from(Task task) {
            return new TaskDocument(task.id(), task.type(), task.groupId(), task.payload(), task.state(),
                    task.priority(), task.attempts(), task.maxRetries(), task.workerId(), task.leaseExpiry(),
                    task.leaseDuration(), task.lastError(), task.result(), task.cancelRequested(), task.createdAt(), task.claimedAt(),
                    task.finishedAt());
        }

        Task toTask(long version) {
            return Task.builder()
                    .id(id)
                    .type(type)
                    .groupId(groupId)
                    .payload(payload)
                    .state(state)
                    .priority(priority)
                    .attempts(attempts)
                    .maxRetries(maxRetries)
                    .workerId(workerId)
                    .leaseExpiry(leaseExpiry)
                    .leaseDuration(leaseDuration)
                    .lastError(lastError)
                    .result(result)
                    .cancelRequested(cancelRequested)
                    .createdAt(createdAt)
                    .claimedAt(claimedAt)
                    .finishedAt(finishedAt)
                    .version(version)
                    .build();
        }
    }
}
