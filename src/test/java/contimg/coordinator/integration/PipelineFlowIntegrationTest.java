package contimg.coordinator.integration;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import contimg.coordinator.config.Dependencies;
import contimg.coordinator.config.PipelineConfig;
import contimg.coordinator.core.StatusSubscription;
import contimg.coordinator.fixture.TestStores;
import contimg.coordinator.model.*;
import contimg.coordinator.pipeline.Collaborator;
import contimg.coordinator.pipeline.CollaboratorKind;
import contimg.coordinator.pipeline.CollaboratorResponse;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the full observation flow:
 * 1. Member files of a calibrator observation land in the watched directory
 * 2. The group is solved, its calibration registered, applied and imaged
 * 3. A later science observation selects that calibration
 * 4. The status feed reports every group through to COMPLETED
 */
class PipelineFlowIntegrationTest {

    private static final String CALIBRATOR = "2025-10-02T00:12:00";
    private static final String SCIENCE = "2025-10-02T00:22:00";

    @TempDir
    Path tempDir;

    private Dependencies deps;

    @BeforeEach
    void setUp() throws IOException {
        PipelineConfig config = TestStores.config("flow")
                .withExpectedMemberCount(4)
                .withInputDirectory(Files.createDirectories(tempDir.resolve("incoming")))
                .withOutputDirectory(tempDir.resolve("products"))
                .withWorkerPoolSize(2)
                .withClaimPollInterval(Duration.ofMillis(50))
                .withSweepInterval(Duration.ofMillis(200));

        Map<CollaboratorKind, Collaborator> collaborators = new EnumMap<>(CollaboratorKind.class);
        collaborators.put(CollaboratorKind.CONVERT, producing("ms", "obs.ms"));
        collaborators.put(CollaboratorKind.APPLY, producing("ms", "calibrated.ms"));
        collaborators.put(CollaboratorKind.IMAGE, producing("image", "image.fits"));
        collaborators.put(CollaboratorKind.SOLVE, request -> {
            Path dir = createDirectory(request.outputPath());
            return CollaboratorResponse.succeeded(Map.of(
                            "K", createDirectory(dir.resolve("cal_kcal")).toString(),
                            "BP", createDirectory(dir.resolve("cal_bpcal")).toString(),
                            "GP", createDirectory(dir.resolve("cal_gpcal")).toString()),
                    JsonNodeFactory.instance.objectNode().put("refant", "103").put("field", "0834+555"));
        });

        deps = Dependencies.create(config, Clock.systemUTC(), collaborators,
                group -> group.groupKey().equals(CALIBRATOR) ? Optional.of("0834+555") : Optional.empty());
    }

    @AfterEach
    void tearDown() {
        if (deps != null) {
            deps.close();
        }
    }

    private static Collaborator producing(String artifact, String fileName) {
        return request -> CollaboratorResponse.succeeded(
                Map.of(artifact, request.outputPath().resolve(fileName).toString()), null);
    }

    private static Path createDirectory(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void arrive(String timestamp) throws IOException {
        for (int i = 0; i < 4; i++) {
            Files.writeString(deps.config().inputDirectory().resolve(timestamp + "_sb0" + i + ".hdf5"), "vis");
        }
    }

    private GroupState awaitTerminal(String groupKey) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 30_000;
        while (System.currentTimeMillis() < deadline) {
            Optional<FileGroup> group = deps.ingestQueue().find(groupKey);
            if (group.isPresent() && group.get().state().isTerminal()) {
                return group.get().state();
            }
            Thread.sleep(50);
        }
        fail("Group " + groupKey + " did not finish: " + deps.ingestQueue().find(groupKey));
        return null;
    }

    @Test
    @DisplayName("Full flow: calibrator solved and registered, science observation calibrated with it")
    void calibratorThenScience() throws Exception {
        Instant started = Instant.now();
        try (StatusSubscription groups = deps.statusFeed().subscribe(e -> e.kind() == EventKind.GROUP)) {
            deps.startScheduler();
            deps.watcher().start();
            deps.startWorkers();

            // 1. Calibrator observation
            arrive(CALIBRATOR);
            assertEquals(GroupState.COMPLETED, awaitTerminal(CALIBRATOR));

            CalibrationSet set = deps.calibrationRegistry().find("cal-" + CALIBRATOR).orElseThrow();
            assertEquals(CalibrationStatus.ACTIVE, set.status());
            assertEquals(List.of(TableKind.DELAY, TableKind.BANDPASS, TableKind.GAIN_PHASE),
                    set.tables().stream().map(CalibrationTable::kind).toList());

            // 2. Science observation ten minutes later
            arrive(SCIENCE);
            assertEquals(GroupState.COMPLETED, awaitTerminal(SCIENCE));

            FileGroup science = deps.ingestQueue().find(SCIENCE).orElseThrow();
            assertFalse(science.partial());
            assertEquals(4, science.observedCount());
            Task task = deps.taskService().findById(science.taskId()).orElseThrow();
            assertEquals(TaskState.COMPLETED, task.state());
            assertTrue(task.result().contains("image.fits"));

            // 3. Feed saw both groups complete
            List<StatusEvent> events = groups.drain();
            assertTrue(events.stream().anyMatch(e -> CALIBRATOR.equals(e.groupId()) && "COMPLETED".equals(e.newState())));
            assertTrue(events.stream().anyMatch(e -> SCIENCE.equals(e.groupId()) && "COMPLETED".equals(e.newState())));
        }

        List<StatusEvent> history = deps.statusFeed().history(started);
        assertTrue(history.stream().noneMatch(e -> e.kind() == EventKind.WARNING && e.detail().contains("stale")));
        assertEquals(0L, deps.taskService().countByState().get(TaskState.FAILED));
    }
}
