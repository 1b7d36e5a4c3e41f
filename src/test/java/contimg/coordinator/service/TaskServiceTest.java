package contimg.coordinator.service;

import contimg.coordinator.config.Dependencies;
import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.fixture.MutableClock;
import contimg.coordinator.fixture.TestStores;
import contimg.coordinator.model.*;
import contimg.coordinator.pipeline.ReferenceSourceResolver;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Task engine: claim, lease, retry cap, cancellation, reaping and archival.
 */
class TaskServiceTest {

    private MutableClock clock;
    private Dependencies deps;
    private TaskService tasks;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-10-02T00:00:00Z");
        PipelineConfig config = TestStores.config("tasks")
                .withMaxRetries(3)
                .withLeaseDuration(Duration.ofMinutes(2));
        deps = Dependencies.create(config, clock, Map.of(), ReferenceSourceResolver.none());
        tasks = deps.taskService();
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    void claimLeasesQueuedTask() {
        Task queued = tasks.enqueue("convert", "{\"x\":1}");
        assertEquals(TaskState.QUEUED, queued.state());

        Task claimed = tasks.claim("w1").orElseThrow();

        assertEquals(queued.id(), claimed.id());
        assertEquals(TaskState.CLAIMED, claimed.state());
        assertEquals("w1", claimed.workerId());
        assertEquals(clock.instant().plus(Duration.ofMinutes(2)), claimed.leaseExpiry());
        assertTrue(tasks.claim("w2").isEmpty());
    }

    @Test
    @DisplayName("parallel workers never claim the same task")
    void concurrentClaimsAreExclusive() throws Exception {
        int taskCount = 24;
        int workerCount = 6;
        for (int i = 0; i < taskCount; i++) {
            tasks.enqueue("convert", "{\"n\":" + i + "}");
        }

        ExecutorService pool = Executors.newFixedThreadPool(workerCount);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<List<String>>> results = new ArrayList<>();
        try {
            for (int w = 0; w < workerCount; w++) {
                String workerId = "w" + w;
                results.add(pool.submit(() -> {
                    go.await();
                    List<String> mine = new ArrayList<>();
                    Optional<Task> next;
                    while ((next = tasks.claim(workerId)).isPresent()) {
                        mine.add(next.get().id());
                    }
                    return mine;
                }));
            }
            go.countDown();

            List<String> claimed = new ArrayList<>();
            for (Future<List<String>> result : results) {
                claimed.addAll(result.get(30, TimeUnit.SECONDS));
            }
            Set<String> distinct = new HashSet<>(claimed);
            assertEquals(taskCount, claimed.size());
            assertEquals(taskCount, distinct.size());
        } finally {
            pool.shutdownNow();
        }

        assertTrue(tasks.listByState(TaskState.QUEUED).isEmpty());
        assertEquals(taskCount, tasks.listByState(TaskState.CLAIMED).size());
    }

    @Test
    void claimsOldestFirst() {
        Task first = tasks.enqueue("convert", "{}");
        clock.advance(Duration.ofSeconds(1));
        tasks.enqueue("convert", "{}");

        assertEquals(first.id(), tasks.claim("w1").orElseThrow().id());
    }

    @Test
    void rejectsBlankWorker() {
        assertThrows(IllegalArgumentException.class, () -> tasks.claim(" "));
        assertThrows(IllegalArgumentException.class, () -> tasks.enqueue("", "{}"));
    }

    @Test
    @DisplayName("Fourth retryable failure with a cap of 3 is terminal")
    void retryCapIsEnforced() {
        Task task = tasks.enqueue("image", "{}");

        for (int i = 1; i <= 3; i++) {
            tasks.claim("w1").orElseThrow();
            assertEquals(TaskFailResult.RETRIED, tasks.fail(task.id(), "w1", "timeout " + i, true));
            assertEquals(i, tasks.findById(task.id()).orElseThrow().attempts());
        }

        tasks.claim("w1").orElseThrow();
        assertEquals(TaskFailResult.FAILED, tasks.fail(task.id(), "w1", "timeout 4", true));

        Task failed = tasks.findById(task.id()).orElseThrow();
        assertEquals(TaskState.FAILED, failed.state());
        assertEquals(3, failed.attempts());
        assertEquals("timeout 4", failed.lastError());
        assertNotNull(failed.finishedAt());
        assertTrue(tasks.claim("w1").isEmpty());
    }

    @Test
    void permanentFailureSkipsRetries() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");

        assertEquals(TaskFailResult.FAILED, tasks.fail(task.id(), "w1", "bad input", false));
        assertEquals(0, tasks.findById(task.id()).orElseThrow().attempts());
    }

    @Test
    void completeAndFailAreIdempotent() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");

        assertEquals(TaskCompleteResult.COMPLETED, tasks.complete(task.id(), "w1", "{\"ok\":true}"));
        assertEquals(TaskCompleteResult.ALREADY_DONE, tasks.complete(task.id(), "w1", "{}"));
        assertEquals(TaskFailResult.ALREADY_TERMINAL, tasks.fail(task.id(), "w1", "late", true));

        Task done = tasks.findById(task.id()).orElseThrow();
        assertEquals(TaskState.COMPLETED, done.state());
        assertEquals("{\"ok\":true}", done.result());
        assertNull(done.workerId());
    }

    @Test
    void onlyTheOwnerMayFinish() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");

        assertEquals(TaskCompleteResult.NOT_OWNER, tasks.complete(task.id(), "w2", "{}"));
        assertEquals(TaskFailResult.NOT_OWNER, tasks.fail(task.id(), "w2", "x", true));
        assertEquals(TaskCompleteResult.NOT_FOUND, tasks.complete("missing", "w1", "{}"));
    }

    @Test
    void heartbeatExtendsLeaseForOwnerOnly() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");
        clock.advance(Duration.ofMinutes(1));

        Task beat = tasks.heartbeat(task.id(), "w1");
        assertEquals(clock.instant().plus(Duration.ofMinutes(2)), beat.leaseExpiry());

        assertThrows(NotOwnerException.class, () -> tasks.heartbeat(task.id(), "w2"));
    }

    @Test
    void heartbeatKeepsTheLeaseLengthChosenAtClaim() {
        Task task = tasks.enqueue("image", "{}");
        Task claimed = tasks.claim("w1", Duration.ofMinutes(10)).orElseThrow();
        assertEquals(Duration.ofMinutes(10), claimed.leaseDuration());
        clock.advance(Duration.ofMinutes(3));

        Task beat = tasks.heartbeat(task.id(), "w1");

        assertEquals(clock.instant().plus(Duration.ofMinutes(10)), beat.leaseExpiry());
        assertEquals(Duration.ofMinutes(10), tasks.findById(task.id()).orElseThrow().leaseDuration());
    }

    @Test
    void startMovesToRunning() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");

        assertEquals(TaskState.RUNNING, tasks.start(task.id(), "w1").state());
        assertEquals(TaskState.RUNNING, tasks.start(task.id(), "w1").state());
    }

    @Test
    void expiredLeaseIsReclaimedAsNewAttempt() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");
        clock.advance(Duration.ofMinutes(3));

        Task reclaimed = tasks.claim("w2").orElseThrow();

        assertEquals(task.id(), reclaimed.id());
        assertEquals("w2", reclaimed.workerId());
        assertEquals(1, reclaimed.attempts());
        assertEquals(TaskCompleteResult.NOT_OWNER, tasks.complete(task.id(), "w1", "{}"));
    }

    @Test
    void cancellingQueuedTaskIsImmediate() {
        Task task = tasks.enqueue("image", "{}");

        assertTrue(tasks.cancel(task.id()));

        assertEquals(TaskState.CANCELLED, tasks.findById(task.id()).orElseThrow().state());
        assertTrue(tasks.claim("w1").isEmpty());
        assertFalse(tasks.cancel(task.id()));
    }

    @Test
    void cancellingLeasedTaskWaitsForOwner() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");

        assertTrue(tasks.cancel(task.id()));
        assertEquals(TaskState.CLAIMED, tasks.findById(task.id()).orElseThrow().state());
        assertTrue(tasks.isCancellationRequested(task.id()));

        Task cancelled = deps.store().transact(tx -> tasks.acknowledgeCancellation(tx, task.id(), "w1"));

        assertEquals(TaskState.CANCELLED, cancelled.state());
        assertNull(cancelled.workerId());
        assertNotNull(cancelled.finishedAt());
    }

    @Test
    void releaseRequeuesWithoutCountingAttempt() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");

        assertFalse(tasks.release(task.id(), "w2"));
        assertTrue(tasks.release(task.id(), "w1"));

        Task released = tasks.findById(task.id()).orElseThrow();
        assertEquals(TaskState.QUEUED, released.state());
        assertEquals(0, released.attempts());
        assertEquals("w3", tasks.claim("w3").orElseThrow().workerId());
    }

    @Test
    void reaperRequeuesThenFailsExpiredLeases() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");
        clock.advance(Duration.ofMinutes(3));

        assertEquals(List.of(task.id()), tasks.findExpiredLeases().stream().map(Task::id).toList());
        Task requeued = tasks.reapExpiredLease(task.id()).orElseThrow();
        assertEquals(TaskState.QUEUED, requeued.state());
        assertEquals(1, requeued.attempts());
        assertTrue(requeued.lastError().contains("Lease expired"));

        // Renewed meanwhile: nothing to reap
        tasks.claim("w1");
        assertTrue(tasks.reapExpiredLease(task.id()).isEmpty());
    }

    @Test
    void reaperFailsTaskWithoutRetriesLeft() {
        deps.close();
        deps = Dependencies.create(TestStores.config("tasks-cap").withMaxRetries(0), clock, Map.of(),
                ReferenceSourceResolver.none());
        tasks = deps.taskService();

        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");
        clock.advance(Duration.ofMinutes(3));

        Task reaped = tasks.reapExpiredLease(task.id()).orElseThrow();
        assertEquals(TaskState.FAILED, reaped.state());
        assertTrue(reaped.lastError().contains("max retries exceeded"));
    }

    @Test
    void reaperHonoursPendingCancellation() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");
        tasks.cancel(task.id());
        clock.advance(Duration.ofMinutes(3));

        assertEquals(TaskState.CANCELLED, tasks.reapExpiredLease(task.id()).orElseThrow().state());
    }

    @Test
    void archiveMovesOldTerminalTasks() {
        Task old = tasks.enqueue("image", "{}");
        tasks.claim("w1");
        tasks.complete(old.id(), "w1", "{}");
        Task live = tasks.enqueue("image", "{}");
        clock.advance(Duration.ofDays(8));

        assertEquals(1, tasks.archiveTerminal(Duration.ofDays(7)));

        assertEquals(List.of(live.id()), tasks.listByState(TaskState.QUEUED).stream().map(Task::id).toList());
        assertTrue(tasks.listByState(TaskState.COMPLETED).isEmpty());
        Optional<Task> archived = tasks.findById(old.id());
        assertTrue(archived.isPresent());
        assertEquals(TaskState.COMPLETED, archived.get().state());
        assertEquals(0, tasks.archiveTerminal(Duration.ofDays(7)));
    }

    @Test
    void queriesByGroupAndState() {
        tasks.enqueue("process-group", "g1", "{}");
        tasks.enqueue("process-group", "g1", "{}");
        tasks.enqueue("process-group", "g2", "{}");
        tasks.claim("w1");

        assertEquals(2, tasks.findByGroup("g1").size());
        Map<TaskState, Long> counts = tasks.countByState();
        assertEquals(2L, counts.get(TaskState.QUEUED));
        assertEquals(1L, counts.get(TaskState.CLAIMED));
    }

    @Test
    void stateChangesReachTheFeed() {
        Task task = tasks.enqueue("image", "{}");
        tasks.claim("w1");

        List<StatusEvent> events = deps.statusFeed().history(clock.instant().minusSeconds(1)).stream()
                .filter(e -> task.id().equals(e.taskId()))
                .toList();

        assertEquals(2, events.size());
        assertNull(events.get(0).oldState());
        assertEquals("QUEUED", events.get(0).newState());
        assertEquals("QUEUED", events.get(1).oldState());
        assertEquals("CLAIMED", events.get(1).newState());
    }
}
