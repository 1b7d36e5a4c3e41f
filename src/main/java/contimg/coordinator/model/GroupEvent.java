package contimg.coordinator.model;

/**
 * Inputs of the ingest queue state machine.
 */
public enum GroupEvent {
    /** Every expected member index observed */
    MEMBERS_COMPLETE,
    /** Collection window elapsed before the group filled up */
    COLLECTION_TIMEOUT,
    CLAIM,
    START,
    COMPLETE,
    FAIL,
    RETRY,
    ABANDON,
    /** Lease ran out without a heartbeat */
    LEASE_EXPIRED
}
