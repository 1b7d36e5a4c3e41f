package contimg.coordinator.scheduler;

import contimg.coordinator.service.IngestQueue;
import contimg.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Periodic group maintenance: collection timeouts, expired group leases, orphaned pending
 * groups, failed-group retries and task archival.
 */
public class GroupSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(GroupSweeper.class);

    private final IngestQueue ingestQueue;
    private final TaskService taskService;
    private final Duration archiveRetention;

    public GroupSweeper(IngestQueue ingestQueue, TaskService taskService, Duration archiveRetention) {
        this.ingestQueue = ingestQueue;
        this.taskService = taskService;
        this.archiveRetention = archiveRetention;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Group sweeper error", e);
        }
    }

    /**
     * @return number of groups and tasks touched
     */
    public int sweep() {
        int timedOut = ingestQueue.expireCollecting();
        int recovered = ingestQueue.recoverExpiredLeases();
        int reconciled = ingestQueue.reconcileOrphans();
        int retried = ingestQueue.retryFailed();
        int archived = taskService.archiveTerminal(archiveRetention);

        int total = timedOut + recovered + reconciled + retried + archived;
        if (total > 0) {
            log.info("Group sweep: {} timed out, {} lease-recovered, {} reconciled, {} retried/abandoned, {} archived",
                    timedOut, recovered, reconciled, retried, archived);
        }
        return total;
    }
}
