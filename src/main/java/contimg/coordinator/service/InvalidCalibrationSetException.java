package contimg.coordinator.service;

/**
 * A calibration set failed registration checks.
 */
public class InvalidCalibrationSetException extends RuntimeException {

    public InvalidCalibrationSetException(String message) {
        super(message);
    }
}
