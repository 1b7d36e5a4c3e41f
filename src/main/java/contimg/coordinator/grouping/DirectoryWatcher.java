package contimg.coordinator.grouping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.TimeUnit;

/**
 * Feeds files created in the input directory into the grouper.
 * Runs on one daemon thread; an event overflow triggers a full re-scan of the directory.
 */
public final class DirectoryWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWatcher.class);

    private final Path directory;
    private final FileArrivalGrouper grouper;
    private WatchService watchService;
    private Thread thread;
    private volatile boolean running;

    public DirectoryWatcher(Path directory, FileArrivalGrouper grouper) {
        this.directory = directory;
        this.grouper = grouper;
    }

    public synchronized void start() throws IOException {
        if (running) {
            log.warn("Watcher already running");
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        directory.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
        running = true;
        thread = new Thread(this::loop, "contimg-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {}", directory);
    }

    private void loop() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.poll(500, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }
            if (key == null) {
                continue;
            }
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    log.warn("Watch events overflowed, rescanning {}", directory);
                    rescan();
                    continue;
                }
                Path created = directory.resolve((Path) event.context());
                SubbandFileName.parse(created).ifPresent(this::observe);
            }
            if (!key.reset()) {
                log.error("Watch key for {} is no longer valid, watcher stopping", directory);
                break;
            }
        }
        running = false;
        log.info("Watcher for {} stopped", directory);
    }

    private void observe(SubbandFileName file) {
        try {
            grouper.observe(file);
        } catch (RuntimeException e) {
            log.error("Failed to observe {}", file.path(), e);
        }
    }

    private void rescan() {
        try {
            grouper.bootstrap(directory);
        } catch (IOException | RuntimeException e) {
            log.error("Rescan of {} failed", directory, e);
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        running = false;
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service: {}", e.getMessage());
            }
        }
        if (thread != null) {
            thread.interrupt();
        }
    }
}
