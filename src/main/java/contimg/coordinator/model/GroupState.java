package contimg.coordinator.model;

/**
 * Lifecycle state of a file group in the ingest queue.
 */
public enum GroupState {
    /** Members still arriving */
    COLLECTING,
    /** Ready for processing, a task is queued */
    PENDING,
    /** Leased to a worker that has not started yet */
    CLAIMED,
    /** Stages running under a lease */
    PROCESSING,
    /** All stages done */
    COMPLETED,
    /** Last attempt failed; waiting for retry or abandonment */
    FAILED,
    /** Given up after the retry cap or cancellation */
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }

    /** States that still accept member files. */
    public boolean isOpen() {
        return this == COLLECTING || this == PENDING;
    }

    public boolean isLeased() {
        return this == CLAIMED || this == PROCESSING;
    }
}
