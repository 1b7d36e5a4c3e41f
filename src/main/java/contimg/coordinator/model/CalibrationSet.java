package contimg.coordinator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable bundle of calibration tables solved together and sharing one validity window.
 * A null validity end means the window stays open until a later set starts.
 */
public final class CalibrationSet {
    private final String id;
    private final List<CalibrationTable> tables;
    private final Instant validityStart;
    private final Instant validityEnd;
    private final String sourceObservation;
    private final CalibrationStatus status;
    private final String qualitySummary;
    private final String statusReason;
    private final long registrationSequence;
    private final Instant registeredAt;
    private final long version;

    private CalibrationSet(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tables = List.copyOf(builder.tables);
        this.validityStart = Objects.requireNonNull(builder.validityStart, "validityStart is required");
        this.validityEnd = builder.validityEnd;
        this.sourceObservation = builder.sourceObservation;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.qualitySummary = builder.qualitySummary;
        this.statusReason = builder.statusReason;
        this.registrationSequence = builder.registrationSequence;
        this.registeredAt = builder.registeredAt;
        this.version = builder.version;
    }

    public String id() {
        return id;
    }

    /** Tables in apply order once registered. */
    public List<CalibrationTable> tables() {
        return tables;
    }

    public Instant validityStart() {
        return validityStart;
    }

    public Instant validityEnd() {
        return validityEnd;
    }

    public String sourceObservation() {
        return sourceObservation;
    }

    public CalibrationStatus status() {
        return status;
    }

    public String qualitySummary() {
        return qualitySummary;
    }

    public String statusReason() {
        return statusReason;
    }

    public long registrationSequence() {
        return registrationSequence;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public long version() {
        return version;
    }

    public boolean isActive() {
        return status == CalibrationStatus.ACTIVE;
    }

    public boolean isOpenEnded() {
        return validityEnd == null;
    }

    public String refAntenna() {
        return tables.isEmpty() ? null : tables.get(0).refAntenna();
    }

    public String sourceField() {
        return tables.isEmpty() ? null : tables.get(0).sourceField();
    }

    public List<String> tablePaths() {
        return tables.stream().map(CalibrationTable::path).toList();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tables(tables)
                .validityStart(validityStart)
                .validityEnd(validityEnd)
                .sourceObservation(sourceObservation)
                .status(status)
                .qualitySummary(qualitySummary)
                .statusReason(statusReason)
                .registrationSequence(registrationSequence)
                .registeredAt(registeredAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private List<CalibrationTable> tables = List.of();
        private Instant validityStart;
        private Instant validityEnd;
        private String sourceObservation;
        private CalibrationStatus status = CalibrationStatus.ACTIVE;
        private String qualitySummary;
        private String statusReason;
        private long registrationSequence;
        private Instant registeredAt;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tables(List<CalibrationTable> tables) {
            this.tables = tables;
            return this;
        }

        public Builder validityStart(Instant validityStart) {
            this.validityStart = validityStart;
            return this;
        }

        public Builder validityEnd(Instant validityEnd) {
            this.validityEnd = validityEnd;
            return this;
        }

        public Builder sourceObservation(String sourceObservation) {
            this.sourceObservation = sourceObservation;
            return this;
        }

        public Builder status(CalibrationStatus status) {
            this.status = status;
            return this;
        }

        public Builder qualitySummary(String qualitySummary) {
            this.qualitySummary = qualitySummary;
            return this;
        }

        public Builder statusReason(String statusReason) {
            this.statusReason = statusReason;
            return this;
        }

        public Builder registrationSequence(long registrationSequence) {
            this.registrationSequence = registrationSequence;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public CalibrationSet build() {
            return new CalibrationSet(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CalibrationSet set))
            return false;
        return Objects.equals(id, set.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CalibrationSet{id='" + id + "', status=" + status + ", start=" + validityStart + ", end="
                + validityEnd + ", tables=" + tables.size() + "}";
    }
}
