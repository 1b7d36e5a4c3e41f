package contimg.coordinator.repository;

import contimg.coordinator.model.CalibrationSet;
import contimg.coordinator.store.StoreTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Append-only persistence of calibration sets under {@code calreg/}.
 * Records are never deleted; only their status changes.
 */
public interface CalibrationRepository {

    Optional<CalibrationSet> find(StoreTransaction tx, String setId);

    Optional<CalibrationSet> find(String setId);

    List<CalibrationSet> findAll(StoreTransaction tx);

    List<CalibrationSet> findAll();

    CalibrationSet save(StoreTransaction tx, CalibrationSet set);

    long nextRegistrationSequence(StoreTransaction tx);
}
