package contimg.coordinator.store;

import contimg.coordinator.model.StatusEvent;
import contimg.coordinator.repository.StatusEventRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Status event history under {@code tasks/events/<epoch millis>-<counter>-<nonce>}.
 * Keys sort by timestamp, so a prefix scan returns events in time order.
 */
public class KeyspaceStatusEventRepository implements StatusEventRepository {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final DurableStore store;
    private final RecordCodec codec;

    public KeyspaceStatusEventRepository(DurableStore store, RecordCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public void append(StoreTransaction tx, StatusEvent event) {
        // Millis, then a local counter so same-millisecond events keep their order
        String key = Keyspace.TASK_EVENTS
                + String.format("%015d-%012d-", event.timestamp().toEpochMilli(), SEQUENCE.incrementAndGet())
                + UUID.randomUUID().toString().substring(0, 8);
        tx.put(key, codec.write(event), 0);
    }

    /** Range scan from the first key of {@code from}'s millisecond; older history is not read. */
    @Override
    public List<StatusEvent> findSince(Instant from) {
        String fromKey = Keyspace.TASK_EVENTS + String.format("%015d", Math.max(0, from.toEpochMilli()));
        return store.scan(Keyspace.TASK_EVENTS, fromKey).stream()
                .map(r -> codec.read(r, StatusEvent.class))
                .filter(e -> !e.timestamp().isBefore(from))
                .toList();
    }
}
