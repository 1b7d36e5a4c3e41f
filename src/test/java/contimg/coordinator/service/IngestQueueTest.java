package contimg.coordinator.service;

import contimg.coordinator.config.Dependencies;
import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.fixture.MutableClock;
import contimg.coordinator.fixture.TestStores;
import contimg.coordinator.model.*;
import contimg.coordinator.pipeline.ReferenceSourceResolver;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Group lifecycle: collection, claim, lease recovery, failure and retry sweeps.
 */
class IngestQueueTest {

    private static final Instant T = Instant.parse("2025-10-02T00:12:00Z");

    private MutableClock clock;
    private Dependencies deps;
    private IngestQueue queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T);
        PipelineConfig config = TestStores.config("ingest")
                .withMaxRetries(1)
                .withRetryDelay(Duration.ofSeconds(30))
                .withCollectionTimeout(Duration.ofMinutes(5));
        deps = Dependencies.create(config, clock, Map.of(), ReferenceSourceResolver.none());
        queue = deps.ingestQueue();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private FileGroup open(String key, int members) {
        return open(key, members, index -> "/incoming/" + key + "_sb" + index + ".hdf5");
    }

    private FileGroup open(String key, int members, IntFunction<String> pathOf) {
        return deps.store().transact(tx -> {
            FileGroup group = queue.createGroup(tx, key, null, new GroupMember(0, pathOf.apply(0), T));
            for (int i = 1; i < members; i++) {
                group = queue.addMember(tx, group, new GroupMember(i, pathOf.apply(i), T.plusMillis(i)));
            }
            return group;
        });
    }

    @Test
    void completeGroupBecomesPendingWithTask() {
        FileGroup group = open("g1", 16);

        assertEquals(GroupState.PENDING, group.state());
        assertFalse(group.partial());
        assertEquals(16, group.observedCount());

        Task task = deps.taskService().findById(group.taskId()).orElseThrow();
        assertEquals(IngestQueue.PROCESS_TASK_TYPE, task.type());
        assertEquals("g1", task.groupId());
        assertTrue(task.payload().contains("\"groupKey\":\"g1\""));
        assertEquals(TaskState.QUEUED, task.state());
    }

    @Test
    void collectionTimeoutProceedsWithPartialGroup() {
        open("g1", 14);

        assertEquals(0, queue.expireCollecting());
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));
        assertEquals(1, queue.expireCollecting());

        FileGroup group = queue.find("g1").orElseThrow();
        assertEquals(GroupState.PENDING, group.state());
        assertTrue(group.partial());
        assertEquals(14, group.observedCount());
        assertNotNull(group.taskId());
    }

    @Test
    void claimStartRecordComplete() {
        open("g1", 16);
        Instant expiry = T.plus(Duration.ofMinutes(2));

        FileGroup claimed = queue.claim("g1", "w1", expiry).orElseThrow();
        assertEquals(GroupState.CLAIMED, claimed.state());
        assertEquals("w1", claimed.leaseOwner());
        assertTrue(queue.claim("g1", "w2", expiry).isEmpty());

        assertEquals(GroupState.PROCESSING, queue.startProcessing("g1", "w1").state());
        FileGroup staged = queue.recordStage("g1", "w1", "CONVERT", Map.of("CONVERT.ms", "/products/g1.ms"));
        assertEquals("CONVERT", staged.stage());
        assertEquals("/products/g1.ms", staged.checkpoint().get("CONVERT.ms"));

        FileGroup done = deps.store().transact(tx -> queue.complete(tx, "g1", "w1")).orElseThrow();
        assertEquals(GroupState.COMPLETED, done.state());
        assertNull(done.leaseOwner());
        assertNull(done.leaseExpiry());
    }

    @Test
    void onlyLeaseOwnerMayRenewOrRecord() {
        open("g1", 16);
        queue.claim("g1", "w1", T.plusSeconds(60));

        assertThrows(NotOwnerException.class, () -> queue.renewLease("g1", "w2", T.plusSeconds(120)));
        assertThrows(NotOwnerException.class, () -> queue.recordStage("g1", "w2", "CONVERT", Map.of()));
        assertEquals(T.plusSeconds(120), queue.renewLease("g1", "w1", T.plusSeconds(120)).leaseExpiry());
    }

    @Test
    void expiredLeaseReturnsGroupToPending() {
        FileGroup group = open("g1", 16);
        queue.claim("g1", "w1", T.plusSeconds(60));
        queue.startProcessing("g1", "w1");

        clock.advance(Duration.ofSeconds(61));
        assertEquals(1, queue.recoverExpiredLeases());

        FileGroup recovered = queue.find("g1").orElseThrow();
        assertEquals(GroupState.PENDING, recovered.state());
        assertNull(recovered.leaseOwner());
        assertEquals(group.taskId(), recovered.taskId());
        assertTrue(recovered.lastError().contains("w1"));
    }

    @Test
    void expiredLeaseIsRecoveredOnClaim() {
        open("g1", 16);
        queue.claim("g1", "w1", T.plusSeconds(60));
        clock.advance(Duration.ofSeconds(61));

        FileGroup claimed = queue.claim("g1", "w2", clock.instant().plusSeconds(60)).orElseThrow();
        assertEquals("w2", claimed.leaseOwner());
    }

    @Test
    void requeuedFailureGoesBackToPending() {
        FileGroup group = open("g1", 16);
        queue.claim("g1", "w1", T.plusSeconds(60));
        queue.startProcessing("g1", "w1");

        FileGroup failed = queue.fail("g1", "imaging crashed", true).orElseThrow();

        assertEquals(GroupState.PENDING, failed.state());
        assertEquals(1, failed.retryCount());
        assertEquals("imaging crashed", failed.lastError());
        assertEquals(group.taskId(), failed.taskId());
        assertNull(failed.leaseOwner());
    }

    @Test
    void retrySweepRetriesThenAbandons() {
        open("g1", 16);
        queue.fail("g1", "no calibration", false);
        assertEquals(GroupState.FAILED, queue.find("g1").orElseThrow().state());

        assertEquals(0, queue.retryFailed());
        clock.advance(Duration.ofSeconds(31));
        assertEquals(1, queue.retryFailed());
        FileGroup retried = queue.find("g1").orElseThrow();
        assertEquals(GroupState.PENDING, retried.state());
        assertEquals(1, retried.retryCount());

        queue.fail("g1", "no calibration", false);
        clock.advance(Duration.ofSeconds(31));
        assertEquals(1, queue.retryFailed());

        FileGroup abandoned = queue.find("g1").orElseThrow();
        assertEquals(GroupState.ABANDONED, abandoned.state());
        assertEquals(1, abandoned.retryCount());
        assertTrue(abandoned.lastError().startsWith("no calibration"));
        assertTrue(abandoned.lastError().contains("gave up after 1 retries"));
    }

    @Test
    void orphanedPendingGroupsAreReconciled() {
        FileGroup failing = open("g1", 16);
        clock.advance(Duration.ofSeconds(1));
        FileGroup cancelled = open("g2", 16);
        TaskService tasks = deps.taskService();

        Task t1 = tasks.claim("w1").orElseThrow();
        assertEquals(failing.taskId(), t1.id());
        tasks.fail(t1.id(), "w1", "crashed", false);
        tasks.cancel(cancelled.taskId());

        assertEquals(2, queue.reconcileOrphans());

        FileGroup g1 = queue.find("g1").orElseThrow();
        assertEquals(GroupState.FAILED, g1.state());
        assertEquals("crashed", g1.lastError());
        assertEquals(GroupState.ABANDONED, queue.find("g2").orElseThrow().state());
        assertEquals(0, queue.reconcileOrphans());
    }

    @Test
    void fileValidationAndRemoval(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("sb0.hdf5"), "data");
        Files.writeString(dir.resolve("sb1.hdf5"), "data");
        Files.createFile(dir.resolve("sb2.hdf5"));
        open("g1", 4, index -> dir.resolve("sb" + index + ".hdf5").toString());

        FileValidation validation = queue.validateGroupFiles("g1");
        assertFalse(validation.allValid());
        assertEquals(2, validation.valid().size());
        assertEquals("empty", validation.invalid().get(dir.resolve("sb2.hdf5").toString()));
        assertEquals("missing", validation.invalid().get(dir.resolve("sb3.hdf5").toString()));

        assertEquals(2, queue.removeInvalidFiles("g1"));
        FileGroup group = queue.find("g1").orElseThrow();
        assertEquals(2, group.observedCount());
        assertTrue(group.partial());
        assertEquals(List.of(dir.resolve("sb0.hdf5"), dir.resolve("sb1.hdf5")), queue.groupFiles("g1"));
    }

    @Test
    void countsByState() {
        open("g1", 16);
        open("g2", 3);

        Map<GroupState, Long> counts = queue.countByState();
        assertEquals(1L, counts.get(GroupState.PENDING));
        assertEquals(1L, counts.get(GroupState.COLLECTING));
        assertEquals(List.of("g2"), queue.listByState(GroupState.COLLECTING).stream()
                .map(FileGroup::groupKey).toList());
    }
}
