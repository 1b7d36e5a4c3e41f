package contimg.coordinator.model;

/**
 * Result of completing a task.
 */
public enum TaskCompleteResult {
    /** Task was successfully completed */
    COMPLETED,

    /** Task was already in a terminal state - idempotent success */
    ALREADY_DONE,

    /** Task not found */
    NOT_FOUND,

    /** Task lease is held by a different worker */
    NOT_OWNER
}
