package contimg.coordinator.model;

import java.time.Instant;

/**
 * One observed member file of a group.
 */
public record GroupMember(int index, String path, Instant timestamp) {
}
