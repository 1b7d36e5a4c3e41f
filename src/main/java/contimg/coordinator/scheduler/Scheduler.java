package contimg.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - TaskReaper: recovers tasks with expired leases
 * - GroupSweeper: collection timeouts, group lease recovery, retries, archival
 *
 * Uses a single-threaded executor so sweeps never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TaskReaper taskReaper;
    private final GroupSweeper groupSweeper;
    private final Duration interval;

    private volatile boolean running = false;

    public Scheduler(TaskReaper taskReaper, GroupSweeper groupSweeper, Duration interval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "contimg-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.taskReaper = taskReaper;
        this.groupSweeper = groupSweeper;
        this.interval = interval;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = interval.toMillis();
        executor.scheduleWithFixedDelay(wrapRunnable("task-reaper", taskReaper),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        executor.scheduleWithFixedDelay(wrapRunnable("group-sweeper", groupSweeper),
                intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Scheduler started, sweeping every {}ms", intervalMs);
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }

    public GroupSweeper groupSweeper() {
        return groupSweeper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
