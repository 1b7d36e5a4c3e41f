package contimg.coordinator.store;

import java.util.Optional;

/**
 * Monotonic counters kept as plain records.
 * The counter row stays locked until the surrounding transaction ends.
 */
public final class Sequences {

    private Sequences() {
    }

    public static long next(StoreTransaction tx, String key) {
        Optional<StoredRecord> current = tx.getForUpdate(key);
        long value = current.map(r -> Long.parseLong(r.payload().trim())).orElse(0L) + 1;
        tx.put(key, Long.toString(value), current.map(StoredRecord::version).orElse(0L));
        return value;
    }
}
