package contimg.coordinator.model;

/**
 * Category of a status feed event.
 */
public enum EventKind {
    /** Task state change */
    TASK,
    /** Group state change */
    GROUP,
    /** Data-quality or conflict notice; no state change */
    WARNING
}
