package contimg.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    void buildMinimalTask() {
        Task task = Task.builder()
                .id("task-1")
                .type("process-group")
                .build();

        assertEquals("task-1", task.id());
        assertEquals("{}", task.payload());
        assertEquals(TaskState.QUEUED, task.state());
        assertNull(task.workerId());
        assertEquals(0, task.priority());
        assertEquals(0, task.attempts());
        assertEquals(3, task.maxRetries());
        assertFalse(task.cancelRequested());
    }

    @Test
    void requiresIdAndType() {
        assertThrows(NullPointerException.class, () -> Task.builder().type("x").build());
        assertThrows(NullPointerException.class, () -> Task.builder().id("t").build());
    }

    @Test
    void canRetryUntilCapIsSpent() {
        Task task = Task.builder().id("t1").type("x").maxRetries(3).build();

        assertTrue(task.toBuilder().attempts(2).build().canRetry());
        assertFalse(task.toBuilder().attempts(3).build().canRetry());
        assertFalse(task.toBuilder().maxRetries(0).build().canRetry());
    }

    @Test
    void terminalStates() {
        for (TaskState state : TaskState.values()) {
            Task task = Task.builder().id("t").type("x").state(state).build();
            boolean expected = state == TaskState.COMPLETED || state == TaskState.FAILED
                    || state == TaskState.CANCELLED;
            assertEquals(expected, task.isTerminal(), state.name());
        }
    }

    @Test
    void ownershipRequiresLiveLeaseState() {
        Instant expiry = Instant.parse("2025-10-02T00:02:00Z");
        Task claimed = Task.builder()
                .id("t")
                .type("x")
                .state(TaskState.CLAIMED)
                .workerId("w1")
                .leaseExpiry(expiry)
                .build();

        assertTrue(claimed.isOwnedBy("w1"));
        assertFalse(claimed.isOwnedBy("w2"));
        assertFalse(claimed.toBuilder().state(TaskState.COMPLETED).build().isOwnedBy("w1"));
    }

    @Test
    void leaseExpiresAtItsDeadline() {
        Instant expiry = Instant.parse("2025-10-02T00:02:00Z");
        Task running = Task.builder()
                .id("t")
                .type("x")
                .state(TaskState.RUNNING)
                .workerId("w1")
                .leaseExpiry(expiry)
                .build();

        assertFalse(running.isLeaseExpired(expiry.minusMillis(1)));
        assertTrue(running.isLeaseExpired(expiry));
        assertFalse(running.toBuilder().state(TaskState.QUEUED).build().isLeaseExpired(expiry.plusSeconds(60)));
    }

    @Test
    void clearLeaseDropsWorkerAndExpiry() {
        Task task = Task.builder()
                .id("t")
                .type("x")
                .state(TaskState.RUNNING)
                .workerId("w1")
                .leaseExpiry(Instant.EPOCH)
                .build()
                .toBuilder()
                .clearLease()
                .build();

        assertNull(task.workerId());
        assertNull(task.leaseExpiry());
    }
}
