package contimg.coordinator.model;

/**
 * Status of a registered calibration set.
 */
public enum CalibrationStatus {
    /** Eligible for selection */
    ACTIVE,
    /** Replaced by a newer set, kept for provenance */
    SUPERSEDED,
    /** Failed verification or quality checks */
    FAILED
}
