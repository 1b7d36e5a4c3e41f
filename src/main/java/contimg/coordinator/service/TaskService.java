package contimg.coordinator.service;

import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.core.StatusFeed;
import contimg.coordinator.model.StatusEvent;
import contimg.coordinator.model.Task;
import contimg.coordinator.model.TaskCompleteResult;
import contimg.coordinator.model.TaskFailResult;
import contimg.coordinator.model.TaskState;
import contimg.coordinator.repository.TaskRepository;
import contimg.coordinator.store.DurableStore;
import contimg.coordinator.store.StoreTransaction;
import contimg.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent task engine: enqueue, claim with lease, heartbeat, complete/fail/retry, cancel.
 * Every state change is written together with its status event in one store transaction.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private static final Comparator<Task> CLAIM_ORDER = Comparator
            .comparing(Task::priority, Comparator.reverseOrder())
            .thenComparing(Task::createdAt)
            .thenComparing(Task::id);

    private final DurableStore store;
    private final TaskRepository taskRepository;
    private final StatusFeed feed;
    private final PipelineConfig config;
    private final Clock clock;
    private final Backoff backoff;

    public TaskService(DurableStore store, TaskRepository taskRepository, StatusFeed feed,
            PipelineConfig config, Clock clock, Backoff backoff) {
        this.store = store;
        this.taskRepository = taskRepository;
        this.feed = feed;
        this.config = config;
        this.clock = clock;
        this.backoff = backoff;
    }

    public Task enqueue(String type, String payload) {
        return enqueue(type, null, payload);
    }

    public Task enqueue(String type, String groupId, String payload) {
        return backoff.retry("enqueue", () -> store.transact(tx -> enqueue(tx, type, groupId, payload)));
    }

    /**
     * Enqueue inside a caller's transaction, so the task appears atomically with the caller's writes.
     */
    public Task enqueue(StoreTransaction tx, String type, String groupId, String payload) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        Instant now = clock.instant();
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .groupId(groupId)
                .payload(payload == null ? "{}" : payload)
                .state(TaskState.QUEUED)
                .maxRetries(config.maxRetries())
                .createdAt(now)
                .build();
        Task saved = taskRepository.insert(tx, task);
        feed.record(tx, StatusEvent.task(null, saved, now));
        log.debug("Enqueued task {} ({}) for group {}", saved.id(), type, groupId);
        return saved;
    }

    public Optional<Task> claim(String workerId) {
        return claim(workerId, config.leaseDuration());
    }

    /**
     * Claim the oldest eligible task: a queued one, or one whose lease expired while retries remain.
     * Reclaiming an expired lease counts as a failed attempt.
     */
    public Optional<Task> claim(String workerId, Duration leaseDuration) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (leaseDuration == null || leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }

        Optional<Task> claimed = backoff.retry("claim", () -> store.transact(tx -> {
            Instant now = clock.instant();
            List<Task> candidates = taskRepository.findAll(tx).stream()
                    .filter(t -> isClaimable(t, now))
                    .sorted(CLAIM_ORDER)
                    .toList();

            for (Task candidate : candidates) {
                Optional<Task> locked = taskRepository.find(tx, candidate.id());
                if (locked.isEmpty() || locked.get().version() != candidate.version()) {
                    // Taken by someone else since the scan
                    continue;
                }
                Task current = locked.get();
                Task.Builder builder = current.toBuilder()
                        .state(TaskState.CLAIMED)
                        .workerId(workerId)
                        .leaseExpiry(now.plus(leaseDuration))
                        .leaseDuration(leaseDuration)
                        .claimedAt(now);
                if (current.state().isLeased()) {
                    builder.attempts(current.attempts() + 1)
                            .lastError("Lease expired (worker " + current.workerId() + ")");
                }
                Task saved = taskRepository.update(tx, builder.build());
                feed.record(tx, StatusEvent.task(current, saved, now));
                return Optional.of(saved);
            }
            return Optional.<Task>empty();
        }));

        claimed.ifPresent(t -> log.info("Task {} claimed by {} (attempt {} of {})",
                t.id(), workerId, t.attempts() + 1, t.maxRetries() + 1));
        return claimed;
    }

    private static boolean isClaimable(Task task, Instant now) {
        if (task.cancelRequested()) {
            return false;
        }
        if (task.state() == TaskState.QUEUED) {
            return true;
        }
        return task.isLeaseExpired(now) && task.canRetry();
    }

    /**
     * Move a claimed task to RUNNING.
     */
    public Task start(String taskId, String workerId) {
        return backoff.retry("start", () -> store.transact(tx -> {
            Task task = requireOwned(tx, taskId, workerId);
            if (task.state() == TaskState.RUNNING) {
                return task;
            }
            Instant now = clock.instant();
            Task saved = taskRepository.update(tx, task.toBuilder().state(TaskState.RUNNING).build());
            feed.record(tx, StatusEvent.task(task, saved, now));
            return saved;
        }));
    }

    /**
     * Extend the lease of a task held by {@code workerId} by the duration it was claimed with.
     *
     * @throws NotOwnerException if the task is not leased to this worker
     */
    public Task heartbeat(String taskId, String workerId) {
        return backoff.retry("heartbeat", () -> store.transact(tx -> {
            Task task = requireOwned(tx, taskId, workerId);
            Duration lease = task.leaseDuration() != null ? task.leaseDuration() : config.leaseDuration();
            Task extended = task.toBuilder().leaseExpiry(clock.instant().plus(lease)).build();
            return taskRepository.update(tx, extended);
        }));
    }

    public TaskCompleteResult complete(String taskId, String workerId, String result) {
        return backoff.retry("complete", () -> store.transact(tx -> complete(tx, taskId, workerId, result)));
    }

    /**
     * Complete a task. Terminal tasks are an idempotent no-op.
     */
    public TaskCompleteResult complete(StoreTransaction tx, String taskId, String workerId, String result) {
        validateIds(taskId, workerId);

        Optional<Task> found = taskRepository.find(tx, taskId);
        if (found.isEmpty()) {
            log.warn("Cannot complete task {}: not found", taskId);
            return TaskCompleteResult.NOT_FOUND;
        }
        Task task = found.get();
        if (task.isTerminal()) {
            log.debug("Task {} already terminal ({}), complete is a no-op", taskId, task.state());
            return TaskCompleteResult.ALREADY_DONE;
        }
        if (!task.isOwnedBy(workerId)) {
            log.warn("Cannot complete task {} by {}: held by {}", taskId, workerId, task.workerId());
            return TaskCompleteResult.NOT_OWNER;
        }

        Instant now = clock.instant();
        Task done = task.toBuilder()
                .state(TaskState.COMPLETED)
                .clearLease()
                .result(result)
                .lastError(null)
                .finishedAt(now)
                .build();
        Task saved = taskRepository.update(tx, done);
        feed.record(tx, StatusEvent.task(task, saved, now));
        log.info("Task {} completed by {}", taskId, workerId);
        return TaskCompleteResult.COMPLETED;
    }

    public TaskFailResult fail(String taskId, String workerId, String error, boolean retryable) {
        return backoff.retry("fail", () -> store.transact(tx -> fail(tx, taskId, workerId, error, retryable)));
    }

    /**
     * Report a failure. Retryable failures go back to QUEUED with the attempt count incremented
     * while the retry cap allows; otherwise the task becomes terminal FAILED.
     */
    public TaskFailResult fail(StoreTransaction tx, String taskId, String workerId, String error, boolean retryable) {
        validateIds(taskId, workerId);

        Optional<Task> found = taskRepository.find(tx, taskId);
        if (found.isEmpty()) {
            return TaskFailResult.NOT_FOUND;
        }
        Task task = found.get();
        if (task.isTerminal()) {
            return TaskFailResult.ALREADY_TERMINAL;
        }
        if (!task.isOwnedBy(workerId)) {
            log.warn("Cannot fail task {} by {}: held by {}", taskId, workerId, task.workerId());
            return TaskFailResult.NOT_OWNER;
        }

        Instant now = clock.instant();
        boolean retry = retryable && task.canRetry();
        Task.Builder builder = task.toBuilder().clearLease().lastError(error);
        if (retry) {
            builder.state(TaskState.QUEUED).attempts(task.attempts() + 1);
        } else {
            builder.state(TaskState.FAILED).finishedAt(now);
        }
        Task saved = taskRepository.update(tx, builder.build());
        feed.record(tx, StatusEvent.task(task, saved, now));

        if (retry) {
            log.info("Task {} failed, retry {} of {}: {}", taskId, saved.attempts(), saved.maxRetries(), error);
            return TaskFailResult.RETRIED;
        }
        log.warn("Task {} permanently failed after {} retries: {}", taskId, saved.attempts(), error);
        return TaskFailResult.FAILED;
    }

    /**
     * Cancel a task. Queued tasks are cancelled at once; leased tasks are flagged and the owning
     * worker cancels them at its next stage boundary.
     *
     * @return false if the task is unknown or already terminal
     */
    public boolean cancel(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        return backoff.retry("cancel", () -> store.transact(tx -> {
            Optional<Task> found = taskRepository.find(tx, taskId);
            if (found.isEmpty() || found.get().isTerminal()) {
                return false;
            }
            Task task = found.get();
            Instant now = clock.instant();
            Task.Builder builder = task.toBuilder().cancelRequested(true);
            if (task.state() == TaskState.QUEUED) {
                builder.state(TaskState.CANCELLED).finishedAt(now).lastError("Cancelled");
            }
            Task saved = taskRepository.update(tx, builder.build());
            if (saved.state() != task.state()) {
                feed.record(tx, StatusEvent.task(task, saved, now));
            }
            log.info("Cancellation requested for task {} ({})", taskId, task.state());
            return true;
        }));
    }

    public boolean isCancellationRequested(String taskId) {
        return taskRepository.findById(taskId).map(Task::cancelRequested).orElse(false);
    }

    /**
     * Owner acknowledges a cancellation request: the task becomes CANCELLED and the lease is released.
     */
    public Task acknowledgeCancellation(StoreTransaction tx, String taskId, String workerId) {
        Task task = requireOwned(tx, taskId, workerId);
        Instant now = clock.instant();
        Task cancelled = task.toBuilder()
                .state(TaskState.CANCELLED)
                .clearLease()
                .lastError("Cancelled")
                .finishedAt(now)
                .build();
        Task saved = taskRepository.update(tx, cancelled);
        feed.record(tx, StatusEvent.task(task, saved, now));
        log.info("Task {} cancelled by its worker {}", taskId, workerId);
        return saved;
    }

    /**
     * Give a leased task back without counting an attempt (worker shutdown).
     */
    public boolean release(String taskId, String workerId) {
        return backoff.retry("release", () -> store.transact(tx -> {
            Optional<Task> found = taskRepository.find(tx, taskId);
            if (found.isEmpty() || !found.get().isOwnedBy(workerId)) {
                return false;
            }
            Task task = found.get();
            Instant now = clock.instant();
            Task saved = taskRepository.update(tx, task.toBuilder().state(TaskState.QUEUED).clearLease().build());
            feed.record(tx, StatusEvent.task(task, saved, now));
            log.info("Task {} released by {}", taskId, workerId);
            return true;
        }));
    }

    /**
     * Leased tasks whose lease has run out.
     */
    public List<Task> findExpiredLeases() {
        Instant now = clock.instant();
        return taskRepository.findAll().stream().filter(t -> t.isLeaseExpired(now)).toList();
    }

    /**
     * Recover one task whose lease expired: cancelled if cancellation was requested, re-queued
     * while retries remain, otherwise terminal FAILED.
     *
     * @return the task after recovery, or empty if it was renewed or finished meanwhile
     */
    public Optional<Task> reapExpiredLease(String taskId) {
        return backoff.retry("reap", () -> store.transact(tx -> {
            Optional<Task> found = taskRepository.find(tx, taskId);
            Instant now = clock.instant();
            if (found.isEmpty() || !found.get().isLeaseExpired(now)) {
                return Optional.<Task>empty();
            }
            Task task = found.get();
            String error = "Lease expired (worker " + task.workerId() + ")";
            Task.Builder builder = task.toBuilder().clearLease();
            if (task.cancelRequested()) {
                builder.state(TaskState.CANCELLED).lastError("Cancelled").finishedAt(now);
            } else if (task.canRetry()) {
                builder.state(TaskState.QUEUED).attempts(task.attempts() + 1).lastError(error);
            } else {
                builder.state(TaskState.FAILED).lastError(error + " - max retries exceeded (" + task.attempts()
                        + "/" + task.maxRetries() + ")").finishedAt(now);
            }
            Task saved = taskRepository.update(tx, builder.build());
            feed.record(tx, StatusEvent.task(task, saved, now));
            return Optional.of(saved);
        }));
    }

    /**
     * Move terminal tasks that finished before {@code now - olderThan} into the archive.
     *
     * @return number of tasks archived
     */
    public int archiveTerminal(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        List<Task> old = taskRepository.findAll().stream()
                .filter(Task::isTerminal)
                .filter(t -> t.finishedAt() != null && t.finishedAt().isBefore(cutoff))
                .toList();
        int archived = 0;
        for (Task task : old) {
            boolean moved = backoff.retry("archive", () -> store.transact(tx -> {
                Optional<Task> current = taskRepository.find(tx, task.id());
                if (current.isEmpty() || !current.get().isTerminal()) {
                    return false;
                }
                taskRepository.archive(tx, current.get());
                return true;
            }));
            if (moved) {
                archived++;
            }
        }
        if (archived > 0) {
            log.info("Archived {} terminal tasks finished before {}", archived, cutoff);
        }
        return archived;
    }

    public Optional<Task> find(StoreTransaction tx, String taskId) {
        return taskRepository.find(tx, taskId);
    }

    public Optional<Task> findById(String taskId) {
        return taskRepository.findById(taskId);
    }

    public List<Task> findByGroup(String groupId) {
        return taskRepository.findAll().stream()
                .filter(t -> groupId.equals(t.groupId()))
                .sorted(Comparator.comparing(Task::createdAt))
                .toList();
    }

    public List<Task> listByState(TaskState state) {
        return taskRepository.findAll().stream().filter(t -> t.state() == state).toList();
    }

    public Map<TaskState, Long> countByState() {
        Map<TaskState, Long> counts = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            counts.put(state, 0L);
        }
        for (Task task : taskRepository.findAll()) {
            counts.merge(task.state(), 1L, Long::sum);
        }
        return counts;
    }

    private Task requireOwned(StoreTransaction tx, String taskId, String workerId) {
        validateIds(taskId, workerId);
        Task task = taskRepository.find(tx, taskId)
                .orElseThrow(() -> new NotOwnerException(taskId, workerId, "task not found"));
        if (!task.isOwnedBy(workerId)) {
            throw new NotOwnerException(taskId, workerId,
                    "state " + task.state() + ", held by " + task.workerId());
        }
        return task;
    }

    private static void validateIds(String taskId, String workerId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
    }
}
