package contimg.coordinator.pipeline;

import contimg.coordinator.service.IngestQueue;
import contimg.coordinator.service.NotOwnerException;
import contimg.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps task and group leases alive while a worker is busy with a long collaborator call.
 * Each held lease is renewed every third of the lease duration.
 */
public class LeaseKeeper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LeaseKeeper.class);

    private final TaskService taskService;
    private final IngestQueue ingestQueue;
    private final Clock clock;
    private final Duration leaseDuration;
    private final ScheduledExecutorService executor;

    public LeaseKeeper(TaskService taskService, IngestQueue ingestQueue, Clock clock, Duration leaseDuration) {
        this.taskService = taskService;
        this.ingestQueue = ingestQueue;
        this.clock = clock;
        this.leaseDuration = leaseDuration;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "contimg-lease-keeper");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start renewing the leases on a task and its group until the returned handle is closed.
     */
    public Lease hold(String taskId, String groupKey, String workerId) {
        Lease lease = new Lease(taskId, groupKey, workerId);
        long periodMs = Math.max(1, leaseDuration.toMillis() / 3);
        lease.future = executor.scheduleAtFixedRate(lease::renew, periodMs, periodMs, TimeUnit.MILLISECONDS);
        return lease;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Handle for one held lease pair.
     */
    public final class Lease implements AutoCloseable {

        private final String taskId;
        private final String groupKey;
        private final String workerId;
        private volatile boolean lost;
        private volatile ScheduledFuture<?> future;

        private Lease(String taskId, String groupKey, String workerId) {
            this.taskId = taskId;
            this.groupKey = groupKey;
            this.workerId = workerId;
        }

        /**
         * Renew both leases now.
         */
        public void renew() {
            if (lost) {
                return;
            }
            try {
                taskService.heartbeat(taskId, workerId);
                ingestQueue.renewLease(groupKey, workerId, clock.instant().plus(leaseDuration));
            } catch (NotOwnerException e) {
                lost = true;
                log.warn("Worker {} lost its lease on task {}: {}", workerId, taskId, e.getMessage());
                ScheduledFuture<?> f = future;
                if (f != null) {
                    f.cancel(false);
                }
            } catch (RuntimeException e) {
                log.error("Lease renewal for task {} failed", taskId, e);
            }
        }

        /** True once another worker or a sweep has taken the task or group away. */
        public boolean isLost() {
            return lost;
        }

        @Override
        public void close() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
