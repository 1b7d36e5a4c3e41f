package contimg.coordinator.pipeline;

import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollaboratorInvokerTest {

    private static final CollaboratorRequest REQUEST =
            new CollaboratorRequest(List.of("/in/a.hdf5"), Map.of("group_key", "g"), Path.of("/out"));

    private CollaboratorInvoker invoker;

    @AfterEach
    void tearDown() {
        if (invoker != null) {
            invoker.close();
        }
    }

    private CollaboratorInvoker invoker(CollaboratorKind kind, Collaborator collaborator, Duration timeout) {
        invoker = new CollaboratorInvoker(Map.of(kind, collaborator), timeout);
        return invoker;
    }

    @Test
    void returnsSuccessfulResponse() {
        invoker(CollaboratorKind.IMAGE, r -> CollaboratorResponse.succeeded(Map.of("image", "/out/i.fits"), null),
                Duration.ofSeconds(5));

        CollaboratorResponse response = invoker.invoke(CollaboratorKind.IMAGE, PipelineStage.IMAGE, REQUEST);

        assertEquals("/out/i.fits", response.artifacts().get("image"));
        assertTrue(invoker.has(CollaboratorKind.IMAGE));
        assertFalse(invoker.has(CollaboratorKind.MOSAIC));
    }

    @Test
    void reportedFailureKeepsPermanentFlag() {
        invoker(CollaboratorKind.IMAGE, r -> CollaboratorResponse.failed("bad beam", true), Duration.ofSeconds(5));

        StageFailureException e = assertThrows(StageFailureException.class,
                () -> invoker.invoke(CollaboratorKind.IMAGE, PipelineStage.IMAGE, REQUEST));

        assertTrue(e.permanent());
        assertEquals(PipelineStage.IMAGE, e.stage());
        assertEquals("bad beam", e.getMessage());
    }

    @Test
    void crashIsRetryable() {
        invoker(CollaboratorKind.CONVERT, r -> {
            throw new IllegalStateException("segfault");
        }, Duration.ofSeconds(5));

        CollaboratorException e = assertThrows(CollaboratorException.class,
                () -> invoker.invoke(CollaboratorKind.CONVERT, PipelineStage.CONVERT, REQUEST));
        assertTrue(e.getMessage().contains("segfault"));
    }

    @Test
    void slowCollaboratorTimesOut() {
        invoker(CollaboratorKind.CONVERT, r -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CollaboratorResponse.succeeded(Map.of(), null);
        }, Duration.ofMillis(100));

        CollaboratorException e = assertThrows(CollaboratorException.class,
                () -> invoker.invoke(CollaboratorKind.CONVERT, PipelineStage.CONVERT, REQUEST));
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void missingCollaboratorIsPermanent() {
        invoker(CollaboratorKind.CONVERT, r -> null, Duration.ofSeconds(5));

        StageFailureException e = assertThrows(StageFailureException.class,
                () -> invoker.invoke(CollaboratorKind.SOLVE, PipelineStage.CALIBRATE_OR_APPLY, REQUEST));
        assertTrue(e.permanent());
        assertThrows(CollaboratorException.class,
                () -> invoker.invoke(CollaboratorKind.CONVERT, PipelineStage.CONVERT, REQUEST));
    }
}
