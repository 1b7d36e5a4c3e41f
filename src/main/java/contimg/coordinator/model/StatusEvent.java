package contimg.coordinator.model;

import java.time.Instant;

/**
 * One status feed record. State fields are null for warnings.
 */
public record StatusEvent(
        EventKind kind,
        String taskId,
        String groupId,
        String oldState,
        String newState,
        String detail,
        Instant timestamp) {

    public static StatusEvent task(Task before, Task after, Instant at) {
        return new StatusEvent(EventKind.TASK, after.id(), after.groupId(),
                before == null ? null : before.state().name(), after.state().name(), after.lastError(), at);
    }

    public static StatusEvent group(FileGroup before, FileGroup after, Instant at) {
        return new StatusEvent(EventKind.GROUP, after.taskId(), after.groupKey(),
                before == null ? null : before.state().name(), after.state().name(), after.lastError(), at);
    }

    public static StatusEvent warning(String groupId, String taskId, String detail, Instant at) {
        return new StatusEvent(EventKind.WARNING, taskId, groupId, null, null, detail, at);
    }
}
