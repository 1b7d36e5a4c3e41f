package contimg.coordinator.pipeline;

/**
 * How one worker run over a group task ended.
 */
public enum ProcessOutcome {
    /** All stages done, group and task completed */
    COMPLETED,
    /** Failed, task and group queued again */
    REQUEUED,
    /** Failed, task terminal and group left FAILED for the retry sweep */
    FAILED,
    /** Cancellation acknowledged, group abandoned */
    CANCELLED,
    /** Group was not claimable; nothing to do */
    SKIPPED,
    /** Lease taken away mid-run; recovery is left to the sweeps */
    LEASE_LOST
}
