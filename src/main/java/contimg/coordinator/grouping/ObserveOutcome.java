package contimg.coordinator.grouping;

/**
 * What happened to one observed member file.
 */
public enum ObserveOutcome {
    /** Added to a group that is still collecting */
    ADDED,
    /** Added and completed the group, which is now PENDING */
    GROUP_READY,
    /** Already recorded; nothing changed */
    DUPLICATE,
    /** Arrived after its group stopped collecting and was dropped */
    LATE_DISCARDED,
    /** Member index outside the expected set */
    REJECTED
}
