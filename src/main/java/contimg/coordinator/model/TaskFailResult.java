package contimg.coordinator.model;

/**
 * Result of failing a task.
 */
public enum TaskFailResult {
    /** Task failed and was queued again */
    RETRIED,

    /** Task failed permanently (permanent error or retry cap reached) */
    FAILED,

    /** Task was already in a terminal state - idempotent success */
    ALREADY_TERMINAL,

    /** Task not found */
    NOT_FOUND,

    /** Task lease is held by a different worker */
    NOT_OWNER
}
