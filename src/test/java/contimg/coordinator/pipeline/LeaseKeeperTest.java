package contimg.coordinator.pipeline;

import contimg.coordinator.config.Dependencies;
import contimg.coordinator.fixture.MutableClock;
import contimg.coordinator.fixture.TestStores;
import contimg.coordinator.model.FileGroup;
import contimg.coordinator.model.Task;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LeaseKeeperTest {

    private static final Instant T = Instant.parse("2025-10-02T00:12:00Z");
    private static final String KEY = "2025-10-02T00:12:00";

    private MutableClock clock;
    private Dependencies deps;
    private LeaseKeeper keeper;
    private Task task;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T);
        deps = Dependencies.create(TestStores.config("lease-keeper")
                        .withExpectedMemberCount(1)
                        .withLeaseDuration(Duration.ofMinutes(1)),
                clock, Map.of(), ReferenceSourceResolver.none());
        deps.grouper().observe(Path.of("/incoming/" + KEY + "_sb00.hdf5"), T, 0);
        task = deps.taskService().claim("w1").orElseThrow();
        deps.ingestQueue().claim(KEY, "w1", T.plus(Duration.ofMinutes(1)));
        keeper = new LeaseKeeper(deps.taskService(), deps.ingestQueue(), clock, Duration.ofMinutes(1));
    }

    @AfterEach
    void tearDown() {
        if (keeper != null) {
            keeper.close();
        }
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    void renewExtendsTaskAndGroupLeases() {
        try (LeaseKeeper.Lease lease = keeper.hold(task.id(), KEY, "w1")) {
            clock.advance(Duration.ofSeconds(30));
            lease.renew();

            Instant expected = T.plusSeconds(90);
            assertEquals(expected, deps.taskService().findById(task.id()).orElseThrow().leaseExpiry());
            FileGroup group = deps.ingestQueue().find(KEY).orElseThrow();
            assertEquals(expected, group.leaseExpiry());
            assertFalse(lease.isLost());
        }
    }

    @Test
    void leaseIsLostOnceTaskIsTakenAway() {
        try (LeaseKeeper.Lease lease = keeper.hold(task.id(), KEY, "w1")) {
            assertTrue(deps.taskService().release(task.id(), "w1"));

            lease.renew();

            assertTrue(lease.isLost());
        }
    }

    @Test
    void leaseIsLostWhenGroupWasRecovered() {
        try (LeaseKeeper.Lease lease = keeper.hold(task.id(), KEY, "w1")) {
            clock.advance(Duration.ofSeconds(61));
            deps.ingestQueue().recoverExpiredLeases();
            deps.taskService().claim("w2");

            lease.renew();

            assertTrue(lease.isLost());
        }
    }
}
