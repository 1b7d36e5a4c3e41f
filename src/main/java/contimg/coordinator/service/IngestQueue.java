package contimg.coordinator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.core.StatusFeed;
import contimg.coordinator.model.EventKind;
import contimg.coordinator.model.FileGroup;
import contimg.coordinator.model.FileValidation;
import contimg.coordinator.model.GroupEvent;
import contimg.coordinator.model.GroupMember;
import contimg.coordinator.model.GroupState;
import contimg.coordinator.model.StatusEvent;
import contimg.coordinator.model.Task;
import contimg.coordinator.model.TaskState;
import contimg.coordinator.repository.GroupRepository;
import contimg.coordinator.store.DurableStore;
import contimg.coordinator.store.StoreTransaction;
import contimg.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable ingest queue over file groups.
 * Drives the {@link GroupStateMachine} and keeps each group's processing task in step:
 * entering PENDING always leaves a live task queued for the group in the same transaction.
 */
public class IngestQueue {

    private static final Logger log = LoggerFactory.getLogger(IngestQueue.class);

    public static final String PROCESS_TASK_TYPE = "process-group";

    private final DurableStore store;
    private final GroupRepository groupRepository;
    private final TaskService taskService;
    private final StatusFeed feed;
    private final PipelineConfig config;
    private final Clock clock;
    private final Backoff backoff;
    private final ObjectMapper mapper;

    public IngestQueue(DurableStore store, GroupRepository groupRepository, TaskService taskService,
            StatusFeed feed, PipelineConfig config, Clock clock, Backoff backoff, ObjectMapper mapper) {
        this.store = store;
        this.groupRepository = groupRepository;
        this.taskService = taskService;
        this.feed = feed;
        this.config = config;
        this.clock = clock;
        this.backoff = backoff;
        this.mapper = mapper;
    }

    // ---------- Grouping side ----------

    public List<FileGroup> activeGroups(StoreTransaction tx) {
        return groupRepository.findActive(tx);
    }

    public Optional<FileGroup> find(StoreTransaction tx, String groupKey) {
        return groupRepository.find(tx, groupKey);
    }

    /** Key of the group a member file was recorded in, including finished groups. */
    public Optional<String> groupKeyForPath(StoreTransaction tx, String path) {
        return groupRepository.findKeyByPath(tx, path);
    }

    /**
     * Open a new group with its first member. A group that is complete at once goes straight to PENDING.
     */
    public FileGroup createGroup(StoreTransaction tx, String groupKey, String pointing, GroupMember first) {
        Instant now = clock.instant();
        FileGroup group = FileGroup.builder()
                .groupKey(groupKey)
                .pointing(pointing)
                .expectedCount(config.expectedMemberCount())
                .state(GroupState.COLLECTING)
                .addMember(first)
                .openSequence(groupRepository.nextOpenSequence(tx))
                .firstSeen(now)
                .lastUpdate(now)
                .build();
        FileGroup saved = groupRepository.save(tx, group);
        groupRepository.indexPath(tx, first.path(), groupKey);
        feed.record(tx, StatusEvent.group(null, saved, now));
        log.info("Opened group {} (sequence {})", groupKey, saved.openSequence());

        if (saved.isComplete()) {
            return transition(tx, saved, GroupEvent.MEMBERS_COMPLETE, b -> b.partial(false)).orElse(saved);
        }
        return saved;
    }

    /**
     * Record one more member. Completing a collecting group moves it to PENDING; completing a
     * partial pending group clears its partial flag.
     */
    public FileGroup addMember(StoreTransaction tx, FileGroup group, GroupMember member) {
        if (!group.state().isOpen()) {
            throw new IllegalStateException("Group " + group.groupKey() + " is " + group.state());
        }
        Instant now = clock.instant();
        FileGroup.Builder builder = group.toBuilder().addMember(member).lastUpdate(now);
        FileGroup updated = builder.build();
        if (group.state() == GroupState.PENDING && updated.isComplete()) {
            updated = updated.toBuilder().partial(false).build();
        }
        FileGroup saved = groupRepository.save(tx, updated);
        groupRepository.indexPath(tx, member.path(), saved.groupKey());
        log.debug("Group {} now has {}/{} members", saved.groupKey(), saved.observedCount(), saved.expectedCount());

        if (saved.state() == GroupState.COLLECTING && saved.isComplete()) {
            return transition(tx, saved, GroupEvent.MEMBERS_COMPLETE, b -> b.partial(false)).orElse(saved);
        }
        return saved;
    }

    // ---------- Processing side ----------

    /**
     * Lease a group to a worker. A group whose previous lease has run out is recovered first.
     *
     * @return the CLAIMED group, or empty when the group is not claimable
     */
    public Optional<FileGroup> claim(String groupKey, String workerId, Instant leaseExpiry) {
        return backoff.retry("claim group", () -> store.transact(tx -> claim(tx, groupKey, workerId, leaseExpiry)));
    }

    public Optional<FileGroup> claim(StoreTransaction tx, String groupKey, String workerId, Instant leaseExpiry) {
        Optional<FileGroup> found = groupRepository.find(tx, groupKey);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        FileGroup group = found.get();
        Instant now = clock.instant();
        if (group.isLeaseExpired(now)) {
            String previousOwner = group.leaseOwner();
            group = transition(tx, group, GroupEvent.LEASE_EXPIRED,
                    b -> b.clearLease().lastError("Lease expired (worker " + previousOwner + ")"))
                    .orElse(group);
        }
        if (group.state() != GroupState.PENDING) {
            log.debug("Group {} not claimable in state {}", groupKey, group.state());
            return Optional.empty();
        }
        return transition(tx, group, GroupEvent.CLAIM, b -> b.leaseOwner(workerId).leaseExpiry(leaseExpiry));
    }

    /**
     * Extend the group lease held by {@code workerId}.
     *
     * @throws NotOwnerException if the group is not leased to this worker
     */
    public FileGroup renewLease(String groupKey, String workerId, Instant leaseExpiry) {
        return backoff.retry("renew group lease", () -> store.transact(tx -> {
            FileGroup group = requireOwned(tx, groupKey, workerId);
            return groupRepository.save(tx, group.toBuilder().leaseExpiry(leaseExpiry).build());
        }));
    }

    public FileGroup startProcessing(String groupKey, String workerId) {
        return backoff.retry("start group", () -> store.transact(tx -> {
            FileGroup group = requireOwned(tx, groupKey, workerId);
            if (group.state() == GroupState.PROCESSING) {
                return group;
            }
            return transition(tx, group, GroupEvent.START, b -> {
            }).orElse(group);
        }));
    }

    /**
     * Persist a finished stage and its artifacts so a restarted lineage resumes after it.
     */
    public FileGroup recordStage(String groupKey, String workerId, String stage, Map<String, String> artifacts) {
        return backoff.retry("record stage", () -> store.transact(tx -> {
            FileGroup group = requireOwned(tx, groupKey, workerId);
            Map<String, String> checkpoint = new LinkedHashMap<>(group.checkpoint());
            checkpoint.putAll(artifacts);
            Instant now = clock.instant();
            FileGroup saved = groupRepository.save(tx, group.toBuilder()
                    .stage(stage)
                    .checkpoint(checkpoint)
                    .lastUpdate(now)
                    .build());
            feed.record(tx, new StatusEvent(EventKind.GROUP, saved.taskId(), groupKey, saved.state().name(),
                    saved.state().name(), "stage " + stage + " complete", now));
            log.info("Group {} finished stage {}", groupKey, stage);
            return saved;
        }));
    }

    public Optional<FileGroup> complete(StoreTransaction tx, String groupKey, String workerId) {
        FileGroup group = requireOwned(tx, groupKey, workerId);
        return transition(tx, group, GroupEvent.COMPLETE, b -> b.clearLease().lastError(null));
    }

    public Optional<FileGroup> fail(String groupKey, String error, boolean requeued) {
        return backoff.retry("fail group", () -> store.transact(tx -> fail(tx, groupKey, error, requeued)));
    }

    /**
     * Record a failed attempt. When the lineage task was already re-queued the group goes straight
     * back to PENDING with its retry count incremented; otherwise it stays FAILED for the retry sweep.
     */
    public Optional<FileGroup> fail(StoreTransaction tx, String groupKey, String error, boolean requeued) {
        Optional<FileGroup> found = groupRepository.find(tx, groupKey);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Optional<FileGroup> failed = transition(tx, found.get(), GroupEvent.FAIL,
                b -> b.clearLease().lastError(error));
        if (failed.isEmpty() || !requeued) {
            return failed;
        }
        FileGroup group = failed.get();
        return transition(tx, group, GroupEvent.RETRY, b -> b.retryCount(group.retryCount() + 1));
    }

    /**
     * Give up on a group, e.g. after its task was cancelled.
     */
    public Optional<FileGroup> abandon(StoreTransaction tx, String groupKey, String reason) {
        Optional<FileGroup> found = groupRepository.find(tx, groupKey);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        FileGroup group = found.get();
        if (group.state() != GroupState.FAILED) {
            group = transition(tx, group, GroupEvent.FAIL, b -> b.clearLease().lastError(reason)).orElse(group);
        }
        return transition(tx, group, GroupEvent.ABANDON, b -> b.lastError(reason));
    }

    // ---------- Sweeps ----------

    /**
     * Collection timeout: COLLECTING groups older than the collection window move to PENDING,
     * flagged partial when members are missing.
     *
     * @return number of groups moved
     */
    public int expireCollecting() {
        Instant cutoff = clock.instant().minus(config.collectionTimeout());
        int moved = 0;
        for (FileGroup candidate : groupRepository.findActive()) {
            if (candidate.state() != GroupState.COLLECTING || candidate.firstSeen().isAfter(cutoff)) {
                continue;
            }
            Optional<FileGroup> result = backoff.retry("expire collecting", () -> store.transact(tx -> {
                Optional<FileGroup> current = groupRepository.find(tx, candidate.groupKey());
                if (current.isEmpty() || current.get().state() != GroupState.COLLECTING) {
                    return Optional.<FileGroup>empty();
                }
                FileGroup group = current.get();
                return transition(tx, group, GroupEvent.COLLECTION_TIMEOUT, b -> b.partial(!group.isComplete()));
            }));
            if (result.isPresent()) {
                moved++;
                FileGroup group = result.get();
                if (group.partial()) {
                    log.warn("Group {} timed out with {}/{} members, proceeding as partial",
                            group.groupKey(), group.observedCount(), group.expectedCount());
                }
            }
        }
        return moved;
    }

    /**
     * Return CLAIMED/PROCESSING groups whose lease ran out to PENDING. When the lineage task has
     * already failed or been cancelled the group fails or is abandoned instead.
     *
     * @return number of groups recovered
     */
    public int recoverExpiredLeases() {
        Instant now = clock.instant();
        int recovered = 0;
        for (FileGroup candidate : groupRepository.findActive()) {
            if (!candidate.isLeaseExpired(now)) {
                continue;
            }
            Optional<FileGroup> result = backoff.retry("recover group lease", () -> store.transact(tx -> {
                Optional<FileGroup> current = groupRepository.find(tx, candidate.groupKey());
                if (current.isEmpty() || !current.get().isLeaseExpired(clock.instant())) {
                    return Optional.<FileGroup>empty();
                }
                FileGroup group = current.get();
                Optional<Task> task = group.taskId() == null ? Optional.empty()
                        : taskService.find(tx, group.taskId());
                // The reaper already gave up on the task: count it as a group failure
                if (task.isPresent() && task.get().state() == TaskState.FAILED) {
                    return transition(tx, group, GroupEvent.FAIL,
                            b -> b.clearLease().lastError(task.get().lastError()));
                }
                if (task.isPresent() && task.get().state() == TaskState.CANCELLED) {
                    return abandon(tx, group.groupKey(), "Cancelled");
                }
                String owner = group.leaseOwner();
                return transition(tx, group, GroupEvent.LEASE_EXPIRED,
                        b -> b.clearLease().lastError("Lease expired (worker " + owner + ")"));
            }));
            if (result.isPresent()) {
                recovered++;
                log.warn("Recovered group {} from expired lease, now {}", candidate.groupKey(), result.get().state());
            }
        }
        return recovered;
    }

    /**
     * Reconcile PENDING groups whose task is gone or terminal, e.g. after the task reaper failed it.
     *
     * @return number of groups repaired
     */
    public int reconcileOrphans() {
        int repaired = 0;
        for (FileGroup candidate : groupRepository.findActive()) {
            if (candidate.state() != GroupState.PENDING) {
                continue;
            }
            boolean changed = backoff.retry("reconcile group", () -> store.transact(tx -> {
                Optional<FileGroup> current = groupRepository.find(tx, candidate.groupKey());
                if (current.isEmpty() || current.get().state() != GroupState.PENDING) {
                    return false;
                }
                FileGroup group = current.get();
                Optional<Task> task = group.taskId() == null ? Optional.empty()
                        : taskService.find(tx, group.taskId());
                if (task.isPresent() && !task.get().isTerminal()) {
                    return false;
                }
                if (task.isPresent() && task.get().state() == TaskState.CANCELLED) {
                    abandon(tx, group.groupKey(), "Cancelled");
                } else if (task.isPresent() && task.get().state() == TaskState.FAILED) {
                    transition(tx, group, GroupEvent.FAIL, b -> b.lastError(task.get().lastError()));
                } else {
                    String taskId = spawnTask(tx, group.groupKey());
                    groupRepository.save(tx, group.toBuilder().taskId(taskId).lastUpdate(clock.instant()).build());
                }
                return true;
            }));
            if (changed) {
                repaired++;
            }
        }
        return repaired;
    }

    /**
     * Retry sweep over FAILED groups: retry with a fresh task while retries remain, otherwise abandon.
     *
     * @return number of groups retried or abandoned
     */
    public int retryFailed() {
        Instant due = clock.instant().minus(config.retryDelay());
        int handled = 0;
        for (FileGroup candidate : groupRepository.findActive()) {
            if (candidate.state() != GroupState.FAILED || candidate.lastUpdate().isAfter(due)) {
                continue;
            }
            Optional<FileGroup> result = backoff.retry("retry group", () -> store.transact(tx -> {
                Optional<FileGroup> current = groupRepository.find(tx, candidate.groupKey());
                if (current.isEmpty() || current.get().state() != GroupState.FAILED) {
                    return Optional.<FileGroup>empty();
                }
                FileGroup group = current.get();
                if (group.retryCount() < config.maxRetries()) {
                    return transition(tx, group, GroupEvent.RETRY, b -> b.retryCount(group.retryCount() + 1));
                }
                String reason = (group.lastError() == null ? "Failed" : group.lastError())
                        + " (gave up after " + group.retryCount() + " retries)";
                return transition(tx, group, GroupEvent.ABANDON, b -> b.lastError(reason));
            }));
            if (result.isPresent()) {
                handled++;
                FileGroup group = result.get();
                if (group.state() == GroupState.ABANDONED) {
                    log.warn("Group {} abandoned: {}", group.groupKey(), group.lastError());
                } else {
                    log.info("Group {} retried (retry {} of {})", group.groupKey(), group.retryCount(),
                            config.maxRetries());
                }
            }
        }
        return handled;
    }

    // ---------- Queries ----------

    public Optional<FileGroup> find(String groupKey) {
        return groupRepository.find(groupKey);
    }

    public List<FileGroup> listByState(GroupState state) {
        List<FileGroup> source = state.isTerminal() ? groupRepository.findAll() : groupRepository.findActive();
        return source.stream().filter(g -> g.state() == state).toList();
    }

    public Map<GroupState, Long> countByState() {
        Map<GroupState, Long> counts = new EnumMap<>(GroupState.class);
        for (GroupState state : GroupState.values()) {
            counts.put(state, 0L);
        }
        for (FileGroup group : groupRepository.findAll()) {
            counts.merge(group.state(), 1L, Long::sum);
        }
        return counts;
    }

    /** Member paths ordered by member index. */
    public List<Path> groupFiles(String groupKey) {
        return groupRepository.find(groupKey)
                .map(g -> g.members().values().stream().map(m -> Path.of(m.path())).toList())
                .orElse(List.of());
    }

    /**
     * Check that every member file exists, is readable and is not empty.
     */
    public FileValidation validateGroupFiles(String groupKey) {
        List<String> valid = new ArrayList<>();
        Map<String, String> invalid = new LinkedHashMap<>();
        for (Path path : groupFiles(groupKey)) {
            String reason = checkFile(path);
            if (reason == null) {
                valid.add(path.toString());
            } else {
                invalid.put(path.toString(), reason);
            }
        }
        return new FileValidation(valid, invalid);
    }

    /**
     * Drop members whose files fail validation.
     *
     * @return number of members removed
     */
    public int removeInvalidFiles(String groupKey) {
        FileValidation validation = validateGroupFiles(groupKey);
        if (validation.allValid()) {
            return 0;
        }
        return backoff.retry("remove invalid files", () -> store.transact(tx -> {
            Optional<FileGroup> found = groupRepository.find(tx, groupKey);
            if (found.isEmpty() || found.get().state().isTerminal()) {
                return 0;
            }
            FileGroup group = found.get();
            FileGroup.Builder builder = group.toBuilder().lastUpdate(clock.instant());
            int removed = 0;
            for (GroupMember member : group.members().values()) {
                if (validation.invalid().containsKey(member.path())) {
                    builder.removeMember(member.index());
                    removed++;
                }
            }
            FileGroup updated = builder.build();
            if (removed > 0) {
                groupRepository.save(tx, updated.toBuilder().partial(!updated.isComplete()).build());
                log.warn("Removed {} invalid files from group {}: {}", removed, groupKey, validation.invalid());
            }
            return removed;
        }));
    }

    private static String checkFile(Path path) {
        if (!Files.exists(path)) {
            return "missing";
        }
        if (!Files.isReadable(path)) {
            return "not readable";
        }
        try {
            if (Files.size(path) == 0) {
                return "empty";
            }
        } catch (IOException e) {
            return "unreadable: " + e.getMessage();
        }
        return null;
    }

    // ---------- Internals ----------

    private Optional<FileGroup> transition(StoreTransaction tx, FileGroup group, GroupEvent event,
            Consumer<FileGroup.Builder> mutate) {
        Optional<GroupState> next = GroupStateMachine.next(group.state(), event);
        if (next.isEmpty()) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        FileGroup.Builder builder = group.toBuilder().state(next.get()).lastUpdate(now);
        mutate.accept(builder);
        if (next.get() == GroupState.PENDING) {
            builder.taskId(ensureTask(tx, builder.build()));
        }
        FileGroup saved = groupRepository.save(tx, builder.build());
        feed.record(tx, StatusEvent.group(group, saved, now));
        log.info("Group {}: {} -> {} ({})", group.groupKey(), group.state(), saved.state(), event);
        return Optional.of(saved);
    }

    /**
     * Keep the group's live task, or enqueue a new one in the lineage when there is none.
     */
    private String ensureTask(StoreTransaction tx, FileGroup group) {
        if (group.taskId() != null) {
            Optional<Task> task = taskService.find(tx, group.taskId());
            if (task.isPresent() && !task.get().isTerminal()) {
                return group.taskId();
            }
        }
        return spawnTask(tx, group.groupKey());
    }

    private String spawnTask(StoreTransaction tx, String groupKey) {
        ObjectNode payload = mapper.createObjectNode().put("groupKey", groupKey);
        return taskService.enqueue(tx, PROCESS_TASK_TYPE, groupKey, payload.toString()).id();
    }

    private FileGroup requireOwned(StoreTransaction tx, String groupKey, String workerId) {
        FileGroup group = groupRepository.find(tx, groupKey)
                .orElseThrow(() -> new NotOwnerException(groupKey, workerId, "group not found"));
        if (!group.state().isLeased() || !workerId.equals(group.leaseOwner())) {
            throw new NotOwnerException(groupKey, workerId,
                    "state " + group.state() + ", held by " + group.leaseOwner());
        }
        return group;
    }
}
