package contimg.coordinator.grouping;

/**
 * What to do with a member file that arrives after its group left COLLECTING.
 */
public enum LateMemberPolicy {
    /** Drop the file and emit a warning event */
    DISCARD,
    /** Add the file to a partial group that is still PENDING */
    MERGE
}
