package contimg.coordinator.pipeline;

import contimg.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of {@link PipelineWorker}s sharing one orchestrator.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final List<PipelineWorker> workers = new ArrayList<>();
    private final ExecutorService executor;
    private volatile boolean running = false;

    public WorkerPool(int size, String hostId, TaskService taskService, PipelineOrchestrator orchestrator,
            Duration idleSleep) {
        if (size <= 0) {
            throw new IllegalArgumentException("Worker pool size must be positive: " + size);
        }
        for (int i = 1; i <= size; i++) {
            workers.add(new PipelineWorker(hostId + "-w" + i, taskService, orchestrator, idleSleep));
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "contimg-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        running = true;
        workers.forEach(executor::submit);
        log.info("Started {} workers", workers.size());
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Workers did not stop within 10s");
            } else {
                log.info("Worker pool stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public List<PipelineWorker> workers() {
        return List.copyOf(workers);
    }

    public boolean isRunning() {
        return running;
    }
}
