package contimg.coordinator.model;

/**
 * Reference to one solved calibration table.
 *
 * @param refAntenna  reference antenna used by the solve
 * @param sourceField field of the calibrator source
 */
public record CalibrationTable(TableKind kind, String path, String refAntenna, String sourceField) {
}
