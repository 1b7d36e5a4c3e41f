package contimg.coordinator.scheduler;

import contimg.coordinator.config.Dependencies;
import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.fixture.MutableClock;
import contimg.coordinator.fixture.TestStores;
import contimg.coordinator.model.GroupState;
import contimg.coordinator.pipeline.ReferenceSourceResolver;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private Dependencies deps;

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    @Test
    void periodicSweepMovesTimedOutGroup() throws InterruptedException {
        Instant t = Instant.parse("2025-10-02T00:12:00Z");
        MutableClock clock = new MutableClock(t);
        PipelineConfig config = TestStores.config("scheduler")
                .withExpectedMemberCount(4)
                .withSweepInterval(Duration.ofMillis(50));
        deps = Dependencies.create(config, clock, Map.of(), ReferenceSourceResolver.none());
        deps.grouper().observe(Path.of("/incoming/a_sb00.hdf5"), t, 0);
        clock.advance(Duration.ofMinutes(6));

        Scheduler scheduler = deps.scheduler();
        scheduler.start();
        assertTrue(scheduler.isRunning());

        GroupState state = GroupState.COLLECTING;
        for (int i = 0; i < 100 && state == GroupState.COLLECTING; i++) {
            Thread.sleep(50);
            state = deps.ingestQueue().find("2025-10-02T00:12:00").orElseThrow().state();
        }
        assertEquals(GroupState.PENDING, state);

        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    @Test
    void startTwiceIsHarmless() {
        deps = Dependencies.create(TestStores.config("scheduler-twice"));
        Scheduler scheduler = deps.scheduler();

        scheduler.start();
        scheduler.start();

        assertTrue(scheduler.isRunning());
        scheduler.close();
        assertFalse(scheduler.isRunning());
    }
}
