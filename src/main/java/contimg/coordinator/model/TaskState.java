package contimg.coordinator.model;

/**
 * Task execution state.
 */
public enum TaskState {
    /** Enqueued, waiting to be claimed */
    QUEUED,
    /** Leased to a worker that has not started yet */
    CLAIMED,
    /** Being executed by the lease holder */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Failed permanently or out of retries */
    FAILED,
    /** Cancelled before completion */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** States in which a worker holds a lease. */
    public boolean isLeased() {
        return this == CLAIMED || this == RUNNING;
    }
}
