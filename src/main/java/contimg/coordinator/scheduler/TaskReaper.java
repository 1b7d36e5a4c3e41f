package contimg.coordinator.scheduler;

import contimg.coordinator.model.Task;
import contimg.coordinator.model.TaskState;
import contimg.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Background task that recovers tasks whose lease ran out.
 * <p>
 * Leases expire when a worker crashes, hangs inside a collaborator call without heartbeats, or
 * loses the store. For each expired task the reaper:
 * <ul>
 * <li>cancels it if cancellation was requested</li>
 * <li>re-queues it while {@code attempts < maxRetries}</li>
 * <li>otherwise marks it terminal FAILED</li>
 * </ul>
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    private final TaskService taskService;

    public TaskReaper(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public void run() {
        try {
            reapExpiredLeases();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * @return number of tasks recovered
     */
    public int reapExpiredLeases() {
        List<Task> expired = taskService.findExpiredLeases();

        if (expired.isEmpty()) {
            log.debug("No expired leases found");
            return 0;
        }

        int requeued = 0;
        int failed = 0;
        int cancelled = 0;

        for (Task task : expired) {
            try {
                Optional<Task> reaped = taskService.reapExpiredLease(task.id());
                if (reaped.isEmpty()) {
                    continue;
                }
                TaskState state = reaped.get().state();
                if (state == TaskState.QUEUED) {
                    requeued++;
                    log.info("Reaped task {} for retry (retry {} of {})",
                            task.id(), reaped.get().attempts(), reaped.get().maxRetries());
                } else if (state == TaskState.CANCELLED) {
                    cancelled++;
                } else {
                    failed++;
                    log.warn("Task {} permanently failed after {} retries (lease expired)",
                            task.id(), reaped.get().attempts());
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }

        log.info("Task reaper: {} requeued, {} failed, {} cancelled, {} total expired",
                requeued, failed, cancelled, expired.size());

        return requeued + failed + cancelled;
    }
}
