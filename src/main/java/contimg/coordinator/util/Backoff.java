package contimg.coordinator.util;

import contimg.coordinator.store.StoreUnavailableException;
import contimg.coordinator.store.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff around store operations.
 * Retries version conflicts and store unavailability; anything else propagates at once.
 */
public final class Backoff {

    private static final Logger log = LoggerFactory.getLogger(Backoff.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;

    public Backoff(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public static Backoff defaults() {
        return new Backoff(6, Duration.ofMillis(20), Duration.ofSeconds(2));
    }

    public <T> T retry(String operation, Supplier<T> action) {
        long delayMs = initialDelay.toMillis();
        for (int attempt = 1;; attempt++) {
            try {
                return action.get();
            } catch (VersionConflictException | StoreUnavailableException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} gave up after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.debug("{} attempt {} failed, retrying in {}ms: {}", operation, attempt, delayMs, e.getMessage());
                sleep(delayMs, e);
                delayMs = Math.min(delayMs * 2, maxDelay.toMillis());
            }
        }
    }

    public void run(String operation, Runnable action) {
        retry(operation, () -> {
            action.run();
            return null;
        });
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private static void sleep(long delayMs, RuntimeException cause) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw cause;
        }
    }
}
