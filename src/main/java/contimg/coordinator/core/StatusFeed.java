package contimg.coordinator.core;

import contimg.coordinator.model.StatusEvent;
import contimg.coordinator.repository.StatusEventRepository;
import contimg.coordinator.store.DurableStore;
import contimg.coordinator.store.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Status change feed for observers.
 * Events are persisted in the same transaction as the state change they describe and
 * pushed to live subscribers after that transaction commits.
 */
public final class StatusFeed {

    private static final Logger log = LoggerFactory.getLogger(StatusFeed.class);

    private static final int DEFAULT_CAPACITY = 10_000;

    private final StatusEventRepository repository;
    private final DurableStore store;
    private final Clock clock;
    private final CopyOnWriteArrayList<StatusSubscription> subscribers = new CopyOnWriteArrayList<>();

    public StatusFeed(StatusEventRepository repository, DurableStore store, Clock clock) {
        this.repository = repository;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Persist an event with the surrounding transaction; publish it once that commits.
     */
    public void record(StoreTransaction tx, StatusEvent event) {
        repository.append(tx, event);
        tx.afterCommit(() -> publish(event));
    }

    /**
     * Emit a warning event in its own transaction.
     */
    public void warn(String groupId, String taskId, String detail) {
        StatusEvent event = StatusEvent.warning(groupId, taskId, detail, clock.instant());
        store.transact(tx -> {
            record(tx, event);
            return null;
        });
        log.warn("Warning for group {}: {}", groupId, detail);
    }

    public StatusSubscription subscribe(Predicate<StatusEvent> filter) {
        StatusSubscription subscription = new StatusSubscription(this, filter, DEFAULT_CAPACITY);
        subscribers.add(subscription);
        return subscription;
    }

    /**
     * Subscribe and first replay persisted events at or after {@code replayFrom}.
     * The live registration happens before the replay so no event falls in between.
     */
    public StatusSubscription subscribe(Predicate<StatusEvent> filter, Instant replayFrom) {
        StatusSubscription subscription = subscribe(filter);
        for (StatusEvent event : repository.findSince(replayFrom)) {
            subscription.offer(event);
        }
        return subscription;
    }

    public List<StatusEvent> history(Instant from) {
        return repository.findSince(from);
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    void unsubscribe(StatusSubscription subscription) {
        subscribers.remove(subscription);
    }

    private void publish(StatusEvent event) {
        for (StatusSubscription subscription : subscribers) {
            subscription.offer(event);
        }
    }
}
