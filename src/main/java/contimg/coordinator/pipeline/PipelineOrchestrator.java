package contimg.coordinator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.model.FileGroup;
import contimg.coordinator.model.FileValidation;
import contimg.coordinator.model.Task;
import contimg.coordinator.model.TaskFailResult;
import contimg.coordinator.service.IngestQueue;
import contimg.coordinator.service.NotOwnerException;
import contimg.coordinator.service.TaskService;
import contimg.coordinator.store.DurableStore;
import contimg.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Drives one group through the stage sequence on behalf of a claimed task.
 * <p>
 * Completed stages are checkpointed on the group; a re-run lineage resumes after the last one.
 * Cancellation and lease loss are checked at every stage boundary.
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final DurableStore store;
    private final TaskService taskService;
    private final IngestQueue ingestQueue;
    private final LeaseKeeper leaseKeeper;
    private final Map<PipelineStage, StageHandler> handlers;
    private final PipelineConfig config;
    private final Clock clock;
    private final Backoff backoff;
    private final ObjectMapper mapper;

    public PipelineOrchestrator(DurableStore store, TaskService taskService, IngestQueue ingestQueue,
            LeaseKeeper leaseKeeper, Map<PipelineStage, StageHandler> handlers, PipelineConfig config,
            Clock clock, Backoff backoff, ObjectMapper mapper) {
        this.store = store;
        this.taskService = taskService;
        this.ingestQueue = ingestQueue;
        this.leaseKeeper = leaseKeeper;
        this.handlers = new EnumMap<>(PipelineStage.class);
        this.handlers.putAll(handlers);
        this.config = config;
        this.clock = clock;
        this.backoff = backoff;
        this.mapper = mapper;
        for (PipelineStage stage : PipelineStage.values()) {
            if (stage != PipelineStage.DONE && !this.handlers.containsKey(stage)
                    && (stage != PipelineStage.MOSAIC || config.mosaicEnabled())) {
                throw new IllegalArgumentException("No handler for stage " + stage);
            }
        }
    }

    /**
     * Standard handler table: collaborator stages around the calibration stage.
     */
    public static Map<PipelineStage, StageHandler> defaultHandlers(CollaboratorInvoker invoker,
            CalibrationStage calibrationStage) {
        Map<PipelineStage, StageHandler> table = new EnumMap<>(PipelineStage.class);
        table.put(PipelineStage.CONVERT, CollaboratorStage.convert(invoker));
        table.put(PipelineStage.CALIBRATE_OR_APPLY, calibrationStage);
        table.put(PipelineStage.IMAGE, CollaboratorStage.image(invoker));
        table.put(PipelineStage.MOSAIC, CollaboratorStage.mosaic(invoker));
        return table;
    }

    /**
     * Run the group behind a task that {@code workerId} has claimed.
     */
    public ProcessOutcome process(Task task, String workerId) {
        String groupKey = groupKeyOf(task);
        Optional<FileGroup> claimed = ingestQueue.claim(groupKey, workerId,
                clock.instant().plus(config.leaseDuration()));
        if (claimed.isEmpty()) {
            return skip(task, groupKey, workerId);
        }

        try {
            taskService.start(task.id(), workerId);
            FileGroup group = ingestQueue.startProcessing(groupKey, workerId);
            log.info("Worker {} processing group {} (task {}, resuming after {})", workerId, groupKey, task.id(),
                    group.stage() == null ? "nothing" : group.stage());
            try (LeaseKeeper.Lease lease = leaseKeeper.hold(task.id(), groupKey, workerId)) {
                return runStages(task, group, workerId, lease);
            }
        } catch (StageFailureException e) {
            return failed(task, groupKey, workerId, "Stage " + e.stage() + " failed: " + e.getMessage(),
                    !e.permanent());
        } catch (CollaboratorException e) {
            return failed(task, groupKey, workerId, e.getMessage(), true);
        } catch (NotOwnerException e) {
            log.warn("Worker {} lost group {}: {}", workerId, groupKey, e.getMessage());
            return ProcessOutcome.LEASE_LOST;
        }
    }

    private ProcessOutcome runStages(Task task, FileGroup claimedGroup, String workerId, LeaseKeeper.Lease lease) {
        String groupKey = claimedGroup.groupKey();
        FileGroup group = prepareFiles(claimedGroup);

        Path outputDir = config.outputDirectory().resolve(sanitize(groupKey));
        StageResult previous = group.stage() == null ? StageResult.empty()
                : StageResult.fromCheckpoint(group.checkpoint(), PipelineStage.valueOf(group.stage()));

        for (PipelineStage stage = PipelineStage.resumeAfter(group.stage(), config.mosaicEnabled());
                stage != PipelineStage.DONE; stage = stage.next(config.mosaicEnabled())) {
            if (taskService.isCancellationRequested(task.id())) {
                return cancelled(task, groupKey, workerId);
            }
            if (lease.isLost()) {
                log.warn("Worker {} stopping group {} before {}: lease lost", workerId, groupKey, stage);
                return ProcessOutcome.LEASE_LOST;
            }

            log.debug("Group {} entering stage {}", groupKey, stage);
            StageResult result = handlers.get(stage).execute(new StageContext(group, task, workerId,
                    group.members().values().stream().map(m -> m.path()).toList(), previous, outputDir));
            if (!result.success()) {
                throw new StageFailureException(stage, "Stage reported no success", false);
            }
            group = ingestQueue.recordStage(groupKey, workerId, stage.name(), result.toCheckpoint(stage));
            previous = result;
        }

        if (lease.isLost()) {
            return ProcessOutcome.LEASE_LOST;
        }
        String resultJson = resultOf(groupKey, previous);
        backoff.run("complete group", () -> store.transact(tx -> {
            ingestQueue.complete(tx, groupKey, workerId);
            taskService.complete(tx, task.id(), workerId, resultJson);
            return null;
        }));
        log.info("Group {} completed by {}", groupKey, workerId);
        return ProcessOutcome.COMPLETED;
    }

    private FileGroup prepareFiles(FileGroup group) {
        FileValidation validation = ingestQueue.validateGroupFiles(group.groupKey());
        if (validation.valid().isEmpty()) {
            throw new StageFailureException(PipelineStage.CONVERT, "No valid member files: " + validation.invalid(),
                    true);
        }
        if (validation.allValid()) {
            return group;
        }
        ingestQueue.removeInvalidFiles(group.groupKey());
        return ingestQueue.find(group.groupKey()).orElse(group);
    }

    private ProcessOutcome skip(Task task, String groupKey, String workerId) {
        Optional<FileGroup> group = ingestQueue.find(groupKey);
        if (group.isPresent() && group.get().state().isLeased()) {
            log.info("Group {} is leased by {}, handing task {} back", groupKey, group.get().leaseOwner(), task.id());
            taskService.fail(task.id(), workerId, "Group " + groupKey + " is leased by "
                    + group.get().leaseOwner(), true);
            return ProcessOutcome.SKIPPED;
        }
        String state = group.map(g -> g.state().name()).orElse("missing");
        log.info("Group {} not claimable ({}), closing task {}", groupKey, state, task.id());
        ObjectNode result = mapper.createObjectNode().put("groupKey", groupKey).put("skipped", state);
        taskService.complete(task.id(), workerId, result.toString());
        return ProcessOutcome.SKIPPED;
    }

    private ProcessOutcome cancelled(Task task, String groupKey, String workerId) {
        backoff.run("cancel group", () -> store.transact(tx -> {
            taskService.acknowledgeCancellation(tx, task.id(), workerId);
            ingestQueue.abandon(tx, groupKey, "Cancelled");
            return null;
        }));
        log.info("Group {} abandoned after cancellation of task {}", groupKey, task.id());
        return ProcessOutcome.CANCELLED;
    }

    private ProcessOutcome failed(Task task, String groupKey, String workerId, String error, boolean retryable) {
        TaskFailResult result = backoff.retry("fail group", () -> store.transact(tx -> {
            TaskFailResult r = taskService.fail(tx, task.id(), workerId, error, retryable);
            if (r == TaskFailResult.RETRIED || r == TaskFailResult.FAILED) {
                ingestQueue.fail(tx, groupKey, error, r == TaskFailResult.RETRIED);
            }
            return r;
        }));
        log.warn("Group {} failed ({}): {}", groupKey, result, error);
        switch (result) {
            case RETRIED:
                return ProcessOutcome.REQUEUED;
            case FAILED:
                return ProcessOutcome.FAILED;
            default:
                return ProcessOutcome.LEASE_LOST;
        }
    }

    private String resultOf(String groupKey, StageResult last) {
        ObjectNode node = mapper.createObjectNode().put("groupKey", groupKey);
        ObjectNode artifacts = node.putObject("artifacts");
        last.artifacts().forEach(artifacts::put);
        return node.toString();
    }

    private String groupKeyOf(Task task) {
        if (task.payload() != null) {
            try {
                String key = mapper.readTree(task.payload()).path("groupKey").asText(null);
                if (key != null) {
                    return key;
                }
            } catch (JsonProcessingException e) {
                log.warn("Task {} has an unreadable payload, falling back to its group id", task.id());
            }
        }
        if (task.groupId() == null) {
            throw new IllegalArgumentException("Task " + task.id() + " does not reference a group");
        }
        return task.groupId();
    }

    private static String sanitize(String groupKey) {
        return groupKey.replaceAll("[^A-Za-z0-9._@-]", "_");
    }
}
