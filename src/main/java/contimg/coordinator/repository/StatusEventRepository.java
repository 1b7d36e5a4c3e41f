package contimg.coordinator.repository;

import contimg.coordinator.model.StatusEvent;
import contimg.coordinator.store.StoreTransaction;

import java.time.Instant;
import java.util.List;

/**
 * Persisted status feed history under {@code tasks/events/}.
 */
public interface StatusEventRepository {

    void append(StoreTransaction tx, StatusEvent event);

    /** Events at or after {@code from}, ordered by timestamp. */
    List<StatusEvent> findSince(Instant from);
}
