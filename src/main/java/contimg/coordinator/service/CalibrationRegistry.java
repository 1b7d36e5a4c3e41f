package contimg.coordinator.service;

import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.core.StatusFeed;
import contimg.coordinator.model.CalibrationSelection;
import contimg.coordinator.model.CalibrationSet;
import contimg.coordinator.model.CalibrationStatus;
import contimg.coordinator.model.CalibrationTable;
import contimg.coordinator.model.StatusEvent;
import contimg.coordinator.model.TableKind;
import contimg.coordinator.repository.CalibrationRepository;
import contimg.coordinator.store.DurableStore;
import contimg.coordinator.store.Keyspace;
import contimg.coordinator.store.StoreTransaction;
import contimg.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of calibration sets with bidirectional validity windows.
 * <p>
 * An active set covers {@code [start - halfWindow, end + halfWindow]}. A set without an end is
 * valid until the next active set starts, or indefinitely when none follows. Among covering sets
 * the one whose start is closest to the target wins, then the most recently registered one; the
 * others are returned as flagged alternatives.
 * <p>
 * Registration and selection hold the {@code calreg} advisory lock.
 */
public class CalibrationRegistry {

    private static final Logger log = LoggerFactory.getLogger(CalibrationRegistry.class);

    private final DurableStore store;
    private final CalibrationRepository repository;
    private final StatusFeed feed;
    private final Clock clock;
    private final Backoff backoff;
    private final Duration halfWindow;
    private final Duration freshWindow;

    public CalibrationRegistry(DurableStore store, CalibrationRepository repository, StatusFeed feed,
            PipelineConfig config, Clock clock, Backoff backoff) {
        this.store = store;
        this.repository = repository;
        this.feed = feed;
        this.clock = clock;
        this.backoff = backoff;
        this.halfWindow = config.validityHalfWindow();
        this.freshWindow = config.freshWindow();
    }

    /**
     * Validate and append a set. Overlaps with other active sets are logged and emitted as
     * warning events, never rejected.
     *
     * @throws InvalidCalibrationSetException if the set is internally inconsistent or the id is taken
     */
    public CalibrationSet register(CalibrationSet set) {
        return register(set, false);
    }

    /**
     * Register a set only if every table exists on disk. The check runs under the registry lock
     * before the set becomes selectable; a set with missing tables is recorded as FAILED.
     *
     * @throws InvalidCalibrationSetException if tables are missing
     */
    public CalibrationSet registerVerified(CalibrationSet set) {
        return register(set, true);
    }

    private CalibrationSet register(CalibrationSet set, boolean verify) {
        validate(set);

        List<CalibrationTable> ordered = set.tables().stream()
                .sorted(Comparator.comparingInt(t -> t.kind().applyOrder()))
                .toList();

        CalibrationSet registered = backoff.retry("register calibration", () -> store.transact(tx -> {
            tx.lockScope(Keyspace.CALIBRATION_LOCK);
            if (repository.find(tx, set.id()).isPresent()) {
                throw new InvalidCalibrationSetException("Calibration set " + set.id() + " is already registered");
            }
            Instant now = clock.instant();
            CalibrationSet.Builder candidate = set.toBuilder()
                    .tables(ordered)
                    .status(CalibrationStatus.ACTIVE)
                    .registrationSequence(repository.nextRegistrationSequence(tx))
                    .registeredAt(now)
                    .version(0);

            List<String> missing = verify ? missingTables(ordered) : List.of();
            if (!missing.isEmpty()) {
                return repository.save(tx, candidate
                        .status(CalibrationStatus.FAILED)
                        .statusReason("Missing calibration tables: " + missing)
                        .build());
            }
            CalibrationSet saved = repository.save(tx, candidate.build());

            List<CalibrationSet> active = activeSets(repository.findAll(tx));
            List<Window> windows = windows(active);
            Window own = windows.stream().filter(w -> w.set().id().equals(saved.id())).findFirst().orElseThrow();
            for (Window other : windows) {
                if (other != own && other.overlaps(own) && !own.endsAt(other) && !other.endsAt(own)) {
                    String detail = "Calibration set " + saved.id() + " overlaps active set " + other.set().id();
                    log.warn(detail);
                    feed.record(tx, StatusEvent.warning(saved.sourceObservation(), null, detail, now));
                }
            }
            return saved;
        }));

        if (registered.status() == CalibrationStatus.FAILED) {
            log.warn("Calibration set {} failed verification: {}", registered.id(), registered.statusReason());
            throw new InvalidCalibrationSetException("Calibration set " + registered.id() + " failed verification: "
                    + registered.statusReason());
        }
        log.info("Registered calibration set {} (sequence {}, {} tables, valid from {} to {})",
                registered.id(), registered.registrationSequence(), registered.tables().size(),
                registered.validityStart(), registered.validityEnd() == null ? "open" : registered.validityEnd());
        return registered;
    }

    /**
     * Choose the set to apply at {@code target}.
     *
     * @return the selection with flagged alternatives, or empty when no active set covers the target
     */
    public Optional<CalibrationSelection> select(Instant target) {
        Objects.requireNonNull(target, "target");
        return backoff.retry("select calibration", () -> store.transact(tx -> {
            tx.lockScope(Keyspace.CALIBRATION_LOCK);
            return selectFrom(repository.findAll(tx), target);
        }));
    }

    /**
     * How far the selected set's validity start lies beyond the fresh window around {@code target}.
     *
     * @return {@link Duration#ZERO} for fresh calibrations, empty when nothing is selected
     */
    public Optional<Duration> staleness(Instant target) {
        return select(target).map(this::staleness);
    }

    public Duration staleness(CalibrationSelection selection) {
        Duration beyond = selection.offset().minus(freshWindow);
        return beyond.isNegative() ? Duration.ZERO : beyond;
    }

    public CalibrationSet supersede(String setId, String reason) {
        return changeStatus(setId, CalibrationStatus.SUPERSEDED, reason);
    }

    public CalibrationSet markFailed(String setId, String reason) {
        return changeStatus(setId, CalibrationStatus.FAILED, reason);
    }

    public Optional<CalibrationSet> find(String setId) {
        return repository.find(setId);
    }

    /** All sets in registration order. */
    public List<CalibrationSet> list() {
        return repository.findAll().stream()
                .sorted(Comparator.comparingLong(CalibrationSet::registrationSequence))
                .toList();
    }

    private CalibrationSet changeStatus(String setId, CalibrationStatus status, String reason) {
        CalibrationSet updated = backoff.retry("update calibration status", () -> store.transact(tx -> {
            tx.lockScope(Keyspace.CALIBRATION_LOCK);
            CalibrationSet set = repository.find(tx, setId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown calibration set " + setId));
            if (set.status() == status) {
                return set;
            }
            return repository.save(tx, set.toBuilder().status(status).statusReason(reason).build());
        }));
        log.info("Calibration set {} is now {}: {}", setId, status, reason);
        return updated;
    }

    // ---------- Selection ----------

    Optional<CalibrationSelection> selectFrom(List<CalibrationSet> all, Instant target) {
        List<Window> covering = windows(activeSets(all)).stream()
                .filter(w -> w.covers(target))
                .sorted(Comparator
                        .comparing((Window w) -> distance(w.set().validityStart(), target))
                        .thenComparing(w -> w.set().registrationSequence(), Comparator.reverseOrder()))
                .toList();
        if (covering.isEmpty()) {
            return Optional.empty();
        }
        CalibrationSet chosen = covering.get(0).set();
        List<CalibrationSet> alternatives = covering.subList(1, covering.size()).stream().map(Window::set).toList();
        if (!alternatives.isEmpty()) {
            log.debug("Selected {} at {}, alternatives {}", chosen.id(), target,
                    alternatives.stream().map(CalibrationSet::id).toList());
        }
        return Optional.of(new CalibrationSelection(chosen, alternatives, distance(chosen.validityStart(), target)));
    }

    private static List<CalibrationSet> activeSets(List<CalibrationSet> all) {
        return all.stream()
                .filter(CalibrationSet::isActive)
                .sorted(Comparator.comparing(CalibrationSet::validityStart)
                        .thenComparingLong(CalibrationSet::registrationSequence))
                .toList();
    }

    private List<Window> windows(List<CalibrationSet> activeByStart) {
        List<Window> windows = new ArrayList<>();
        for (CalibrationSet set : activeByStart) {
            Instant lower = set.validityStart().minus(halfWindow);
            Instant upper;
            if (set.validityEnd() != null) {
                upper = set.validityEnd().plus(halfWindow);
            } else {
                upper = activeByStart.stream()
                        .map(CalibrationSet::validityStart)
                        .filter(s -> s.isAfter(set.validityStart()))
                        .findFirst()
                        .orElse(null);
            }
            windows.add(new Window(set, lower, upper));
        }
        return windows;
    }

    private static List<String> missingTables(List<CalibrationTable> tables) {
        return tables.stream()
                .map(CalibrationTable::path)
                .filter(p -> !Files.exists(Path.of(p)))
                .toList();
    }

    private static Duration distance(Instant a, Instant b) {
        return Duration.between(a, b).abs();
    }

    private static void validate(CalibrationSet set) {
        if (set.id() == null || set.id().isBlank()) {
            throw new InvalidCalibrationSetException("Calibration set id is required");
        }
        if (set.tables().isEmpty()) {
            throw new InvalidCalibrationSetException("Calibration set " + set.id() + " has no tables");
        }
        if (set.validityEnd() != null && set.validityEnd().isBefore(set.validityStart())) {
            throw new InvalidCalibrationSetException("Calibration set " + set.id() + " ends before it starts");
        }
        Set<TableKind> kinds = EnumSet.noneOf(TableKind.class);
        CalibrationTable first = set.tables().get(0);
        for (CalibrationTable table : set.tables()) {
            if (table.kind() == null || table.path() == null || table.path().isBlank()) {
                throw new InvalidCalibrationSetException("Calibration set " + set.id() + " has an incomplete table");
            }
            if (!kinds.add(table.kind())) {
                throw new InvalidCalibrationSetException(
                        "Calibration set " + set.id() + " has more than one " + table.kind() + " table");
            }
            if (!Objects.equals(first.refAntenna(), table.refAntenna())) {
                throw new InvalidCalibrationSetException("Calibration set " + set.id()
                        + " mixes reference antennas " + first.refAntenna() + " and " + table.refAntenna());
            }
            if (!Objects.equals(first.sourceField(), table.sourceField())) {
                throw new InvalidCalibrationSetException("Calibration set " + set.id()
                        + " mixes source fields " + first.sourceField() + " and " + table.sourceField());
            }
        }
    }

    /**
     * Effective validity window; a null upper bound is open.
     */
    private record Window(CalibrationSet set, Instant lower, Instant upper) {

        boolean covers(Instant t) {
            return !t.isBefore(lower) && (upper == null || !t.isAfter(upper));
        }

        /** Open-ended window cut off by the start of {@code successor}. */
        boolean endsAt(Window successor) {
            return set.isOpenEnded() && upper != null && upper.equals(successor.set.validityStart());
        }

        boolean overlaps(Window other) {
            boolean startsBeforeOtherEnds = other.upper == null || !lower.isAfter(other.upper);
            boolean otherStartsBeforeThisEnds = upper == null || !other.lower.isAfter(upper);
            return startsBeforeOtherEnds && otherStartsBeforeThisEnds;
        }
    }
}
