package contimg.coordinator.store;

/**
 * Key prefixes of the shared keyspace, one namespace per component.
 */
public final class Keyspace {

    public static final String GROUPS = "ingest/group/";
    /** Index of non-terminal groups, scanned by the grouper and the sweeps. */
    public static final String ACTIVE_GROUPS = "ingest/active/";
    /** Member file path to the key of the group that recorded it. */
    public static final String GROUP_PATHS = "ingest/path/";
    public static final String GROUP_SEQUENCE = "ingest/sequence";
    /** Advisory lock serialising group placement. */
    public static final String GROUPING_LOCK = "ingest";

    public static final String CALIBRATION_SETS = "calreg/set/";
    public static final String CALIBRATION_SEQUENCE = "calreg/sequence";
    public static final String CALIBRATION_LOCK = "calreg";

    public static final String TASKS = "tasks/task/";
    public static final String TASK_ARCHIVE = "tasks/archive/";
    public static final String TASK_EVENTS = "tasks/events/";

    private Keyspace() {
    }
}
