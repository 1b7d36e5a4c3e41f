package contimg.coordinator.core;

import contimg.coordinator.model.StatusEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * A consumer's view of the status feed. Delivery is at-least-once: replayed history and
 * live events may overlap, so consumers must tolerate duplicates.
 */
public final class StatusSubscription implements AutoCloseable {

    private final StatusFeed feed;
    private final Predicate<StatusEvent> filter;
    private final LinkedBlockingQueue<StatusEvent> queue;
    private volatile boolean overflowed;
    private volatile boolean closed;

    StatusSubscription(StatusFeed feed, Predicate<StatusEvent> filter, int capacity) {
        this.feed = feed;
        this.filter = filter;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /**
     * Wait up to {@code timeout} for the next event.
     */
    public Optional<StatusEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /** Everything currently buffered, without waiting. */
    public List<StatusEvent> drain() {
        List<StatusEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    /**
     * True once an event was dropped because the buffer was full.
     * The consumer should resubscribe with a replay from its last seen timestamp.
     */
    public boolean overflowed() {
        return overflowed;
    }

    public boolean isClosed() {
        return closed;
    }

    void offer(StatusEvent event) {
        if (closed || !filter.test(event)) {
            return;
        }
        if (!queue.offer(event)) {
            overflowed = true;
        }
    }

    @Override
    public void close() {
        closed = true;
        feed.unsubscribe(this);
    }
}
