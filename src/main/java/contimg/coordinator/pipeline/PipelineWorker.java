package contimg.coordinator.pipeline;

import contimg.coordinator.model.Task;
import contimg.coordinator.service.IngestQueue;
import contimg.coordinator.service.TaskService;
import contimg.coordinator.store.StoreException;
import contimg.coordinator.store.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * One pipeline worker. Loops: claim → process → complete/fail, sleeping when the queue is empty.
 * Stops on interrupt, and exits when the store is unavailable beyond the retry bound.
 */
public final class PipelineWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PipelineWorker.class);

    private final String workerId;
    private final TaskService taskService;
    private final PipelineOrchestrator orchestrator;
    private final Duration idleSleep;

    private volatile boolean running;

    public PipelineWorker(String workerId, TaskService taskService, PipelineOrchestrator orchestrator,
            Duration idleSleep) {
        this.workerId = workerId;
        this.taskService = taskService;
        this.orchestrator = orchestrator;
        this.idleSleep = idleSleep;
    }

    @Override
    public void run() {
        running = true;
        log.info("Worker {} started", workerId);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    if (runOnce().isEmpty()) {
                        Thread.sleep(idleSleep.toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (VersionConflictException e) {
                    log.warn("Worker {} lost a write race: {}", workerId, e.getMessage());
                } catch (StoreException e) {
                    log.error("Worker {} stopping, store unusable", workerId, e);
                    break;
                } catch (RuntimeException e) {
                    log.error("Worker {} error", workerId, e);
                    try {
                        Thread.sleep(idleSleep.toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            running = false;
            log.info("Worker {} stopped", workerId);
        }
    }

    /**
     * Claim and process at most one task.
     *
     * @return the outcome, or empty when nothing was claimable
     */
    public Optional<ProcessOutcome> runOnce() {
        Optional<Task> claimed = taskService.claim(workerId);
        if (claimed.isEmpty()) {
            return Optional.empty();
        }
        Task task = claimed.get();
        if (!IngestQueue.PROCESS_TASK_TYPE.equals(task.type())) {
            log.warn("Worker {} cannot run task {} of type {}", workerId, task.id(), task.type());
            taskService.fail(task.id(), workerId, "Unsupported task type " + task.type(), false);
            return Optional.of(ProcessOutcome.FAILED);
        }
        ProcessOutcome outcome = orchestrator.process(task, workerId);
        log.debug("Worker {} finished task {}: {}", workerId, task.id(), outcome);
        return Optional.of(outcome);
    }

    public String workerId() {
        return workerId;
    }

    public boolean isRunning() {
        return running;
    }
}
