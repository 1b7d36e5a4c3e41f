package contimg.coordinator.store;

import java.time.Instant;

/**
 * One versioned entry of the keyspace.
 *
 * @param key       full key, e.g. {@code tasks/task/42}
 * @param payload   JSON document
 * @param version   starts at 1, incremented on every write
 * @param updatedAt time of the last write
 */
public record StoredRecord(String key, String payload, long version, Instant updatedAt) {
}
