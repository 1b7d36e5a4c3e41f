package contimg.coordinator.store;

import contimg.coordinator.model.CalibrationSet;
import contimg.coordinator.model.CalibrationStatus;
import contimg.coordinator.model.CalibrationTable;
import contimg.coordinator.repository.CalibrationRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * CalibrationRepository over the durable keyspace ({@code calreg/set/<id>}).
 */
public class KeyspaceCalibrationRepository implements CalibrationRepository {

    private final DurableStore store;
    private final RecordCodec codec;

    public KeyspaceCalibrationRepository(DurableStore store, RecordCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    @Override
    public Optional<CalibrationSet> find(StoreTransaction tx, String setId) {
        return tx.getForUpdate(Keyspace.CALIBRATION_SETS + setId).map(this::toSet);
    }

    @Override
    public Optional<CalibrationSet> find(String setId) {
        return store.get(Keyspace.CALIBRATION_SETS + setId).map(this::toSet);
    }

    @Override
    public List<CalibrationSet> findAll(StoreTransaction tx) {
        return tx.scan(Keyspace.CALIBRATION_SETS).stream().map(this::toSet).toList();
    }

    @Override
    public List<CalibrationSet> findAll() {
        return store.scan(Keyspace.CALIBRATION_SETS).stream().map(this::toSet).toList();
    }

    @Override
    public CalibrationSet save(StoreTransaction tx, CalibrationSet set) {
        long version = tx.put(Keyspace.CALIBRATION_SETS + set.id(), codec.write(SetDocument.from(set)), set.version());
        return set.toBuilder().version(version).build();
    }

    @Override
    public long nextRegistrationSequence(StoreTransaction tx) {
        return Sequences.next(tx, Keyspace.CALIBRATION_SEQUENCE);
    }

    private CalibrationSet toSet(StoredRecord record) {
        return codec.read(record, SetDocument.class).toSet(record.version());
    }

    /**
     * Stored form of a calibration set.
     */
    record SetDocument(
            String id,
            List<CalibrationTable> tables,
            Instant validityStart,
            Instant validityEnd,
            String sourceObservation,
            CalibrationStatus status,
            String qualitySummary,
            String statusReason,
            long registrationSequence,
            Instant registeredAt) {

        static SetDocument from(CalibrationSet set) {
            return new SetDocument(set.id(), set.tables(), set.validityStart(), set.validityEnd(),
                    set.sourceObservation(), set.status(), set.qualitySummary(), set.statusReason(),
                    set.registrationSequence(), set.registeredAt());
        }

        CalibrationSet toSet(long version) {
            return CalibrationSet.builder()
                    .id(id)
                    .tables(tables == null ? List.of() : tables)
                    .validityStart(validityStart)
                    .validityEnd(validityEnd)
                    .sourceObservation(sourceObservation)
                    .status(status)
                    .qualitySummary(qualitySummary)
                    .statusReason(statusReason)
                    .registrationSequence(registrationSequence)
                    .registeredAt(registeredAt)
                    .version(version)
                    .build();
        }
    }
}
