package contimg.coordinator.grouping;

import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.core.StatusFeed;
import contimg.coordinator.model.FileGroup;
import contimg.coordinator.model.GroupMember;
import contimg.coordinator.model.GroupState;
import contimg.coordinator.model.StatusEvent;
import contimg.coordinator.service.IngestQueue;
import contimg.coordinator.store.DurableStore;
import contimg.coordinator.store.Keyspace;
import contimg.coordinator.store.StoreTransaction;
import contimg.coordinator.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Groups arriving member files into observations by timestamp proximity.
 * <p>
 * A file joins the open group (same pointing) whose mean member timestamp is nearest, provided
 * it lies within the grouping tolerance; on an exact tie the earlier-opened group wins.
 * Otherwise it opens a new group keyed by its timestamp rounded to the second. Placement holds
 * the {@code ingest} advisory lock, so files observed in parallel still form one group.
 */
public class FileArrivalGrouper {

    private static final Logger log = LoggerFactory.getLogger(FileArrivalGrouper.class);

    private static final DateTimeFormatter KEY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private final DurableStore store;
    private final IngestQueue ingestQueue;
    private final StatusFeed feed;
    private final PipelineConfig config;
    private final Clock clock;
    private final Backoff backoff;

    public FileArrivalGrouper(DurableStore store, IngestQueue ingestQueue, StatusFeed feed,
            PipelineConfig config, Clock clock, Backoff backoff) {
        this.store = store;
        this.ingestQueue = ingestQueue;
        this.feed = feed;
        this.config = config;
        this.clock = clock;
        this.backoff = backoff;
        log.info("Grouping {} members per observation, tolerance {}, late members: {}",
                config.expectedMemberCount(), config.groupingTolerance(), config.lateMemberPolicy());
    }

    public ObserveOutcome observe(SubbandFileName file) {
        return observe(file.path(), file.timestamp(), file.memberIndex(), null);
    }

    public ObserveOutcome observe(Path path, Instant timestamp, int memberIndex) {
        return observe(path, timestamp, memberIndex, null);
    }

    /**
     * Record one member file. Observing the same file again is a no-op, also after its group
     * has finished.
     *
     * @param pointing optional pointing label; only groups with the same label are candidates
     */
    public ObserveOutcome observe(Path path, Instant timestamp, int memberIndex, String pointing) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(timestamp, "timestamp");
        if (memberIndex < 0 || memberIndex >= config.expectedMemberCount()) {
            log.warn("Rejecting {}: member index {} outside [0, {})", path, memberIndex, config.expectedMemberCount());
            return ObserveOutcome.REJECTED;
        }

        GroupMember member = new GroupMember(memberIndex, path.toString(), timestamp);
        ObserveOutcome outcome = backoff.retry("observe " + path.getFileName(),
                () -> store.transact(tx -> place(tx, member, pointing)));
        log.debug("Observed {} -> {}", path, outcome);
        return outcome;
    }

    /**
     * Observe every matching file already present in {@code directory}, in name order.
     *
     * @return number of files newly added to groups
     */
    public int bootstrap(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            log.warn("Bootstrap skipped, {} is not a directory", directory);
            return 0;
        }
        List<SubbandFileName> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.sorted()
                    .map(SubbandFileName::parse)
                    .flatMap(Optional::stream)
                    .toList();
        }
        int added = 0;
        for (SubbandFileName file : files) {
            ObserveOutcome outcome = observe(file);
            if (outcome == ObserveOutcome.ADDED || outcome == ObserveOutcome.GROUP_READY) {
                added++;
            }
        }
        log.info("Bootstrap of {}: {} matching files, {} added", directory, files.size(), added);
        return added;
    }

    /** Group key: timestamp rounded to the nearest second, plus the pointing label if any. */
    public static String groupKey(Instant timestamp, String pointing) {
        Instant rounded = timestamp.plusMillis(500).truncatedTo(ChronoUnit.SECONDS);
        String key = KEY_FORMAT.format(rounded);
        return pointing == null || pointing.isBlank() ? key : key + "@" + pointing;
    }

    private ObserveOutcome place(StoreTransaction tx, GroupMember member, String pointing) {
        // Concurrent files must see each other's groups before choosing one
        tx.lockScope(Keyspace.GROUPING_LOCK);
        Optional<String> recordedIn = ingestQueue.groupKeyForPath(tx, member.path());
        if (recordedIn.isPresent()) {
            log.debug("{} already recorded in group {}", member.path(), recordedIn.get());
            return ObserveOutcome.DUPLICATE;
        }

        List<FileGroup> active = ingestQueue.activeGroups(tx);

        FileGroup nearest = nearest(active, member.timestamp(), pointing);
        if (nearest == null) {
            return openGroup(tx, member, pointing);
        }

        FileGroup group = ingestQueue.find(tx, nearest.groupKey()).orElse(nearest);
        if (group.hasMember(member.index())) {
            String existing = group.members().get(member.index()).path();
            if (!existing.equals(member.path())) {
                warn(tx, group, "Second file " + member.path() + " for member " + member.index()
                        + " ignored, group already has " + existing);
            }
            return ObserveOutcome.DUPLICATE;
        }

        if (group.state() == GroupState.COLLECTING) {
            FileGroup updated = ingestQueue.addMember(tx, group, member);
            return updated.state() == GroupState.PENDING ? ObserveOutcome.GROUP_READY : ObserveOutcome.ADDED;
        }
        if (group.state() == GroupState.PENDING && group.partial()
                && config.lateMemberPolicy() == LateMemberPolicy.MERGE) {
            ingestQueue.addMember(tx, group, member);
            log.info("Merged late member {} into partial group {}", member.path(), group.groupKey());
            return ObserveOutcome.ADDED;
        }
        warn(tx, group, "Late member " + member.path() + " discarded, group is " + group.state());
        return ObserveOutcome.LATE_DISCARDED;
    }

    private ObserveOutcome openGroup(StoreTransaction tx, GroupMember member, String pointing) {
        String key = groupKey(member.timestamp(), pointing);
        Optional<FileGroup> existing = ingestQueue.find(tx, key);
        if (existing.isPresent()) {
            // Same key but no longer active: the observation already finished
            warn(tx, existing.get(), "Late member " + member.path() + " discarded, group is "
                    + existing.get().state());
            return ObserveOutcome.LATE_DISCARDED;
        }
        FileGroup created = ingestQueue.createGroup(tx, key, pointing, member);
        return created.state() == GroupState.PENDING ? ObserveOutcome.GROUP_READY : ObserveOutcome.ADDED;
    }

    /**
     * Nearest group by exact mean distance, compared as fractions to avoid rounding ties.
     */
    private FileGroup nearest(List<FileGroup> groups, Instant timestamp, String pointing) {
        long t = timestamp.toEpochMilli();
        long tolerance = config.groupingTolerance().toMillis();
        FileGroup best = null;
        long bestNumerator = 0;
        long bestCount = 1;
        for (FileGroup group : groups) {
            long n = group.observedCount();
            if (n == 0 || !Objects.equals(group.pointing(), pointing)) {
                continue;
            }
            // distance to mean = numerator / n
            long numerator = Math.abs(group.timestampSumMillis() - n * t);
            if (numerator > tolerance * n) {
                continue;
            }
            if (best == null) {
                best = group;
                bestNumerator = numerator;
                bestCount = n;
                continue;
            }
            long lhs = numerator * bestCount;
            long rhs = bestNumerator * n;
            if (lhs < rhs || (lhs == rhs && group.openSequence() < best.openSequence())) {
                best = group;
                bestNumerator = numerator;
                bestCount = n;
            }
        }
        return best;
    }

    private void warn(StoreTransaction tx, FileGroup group, String detail) {
        log.warn("Group {}: {}", group.groupKey(), detail);
        feed.record(tx, StatusEvent.warning(group.groupKey(), group.taskId(), detail, clock.instant()));
    }
}
