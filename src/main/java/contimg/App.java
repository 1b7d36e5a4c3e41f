package contimg;

import contimg.coordinator.config.Dependencies;
import contimg.coordinator.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point.
 * <p>
 * Registers files already present in the input directory, then watches it for new arrivals while
 * the scheduler and worker pool drain the queue. Runs until the JVM is asked to stop.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws IOException, InterruptedException {
        PipelineConfig config = PipelineConfig.fromEnv();
        Files.createDirectories(config.inputDirectory());
        Files.createDirectories(config.outputDirectory());

        Dependencies deps = Dependencies.create(config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            deps.close();
            stopped.countDown();
        }, "contimg-shutdown"));

        int existing = deps.grouper().bootstrap(config.inputDirectory());
        log.info("Registered {} files already in {}", existing, config.inputDirectory());

        deps.startScheduler();
        deps.watcher().start();
        deps.startWorkers();
        log.info("Pipeline coordinator running");

        stopped.await();
    }
}
