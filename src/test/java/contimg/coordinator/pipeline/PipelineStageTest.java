package contimg.coordinator.pipeline;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineStageTest {

    @Test
    void stageOrder() {
        assertEquals(PipelineStage.CALIBRATE_OR_APPLY, PipelineStage.CONVERT.next(false));
        assertEquals(PipelineStage.IMAGE, PipelineStage.CALIBRATE_OR_APPLY.next(false));
        assertEquals(PipelineStage.DONE, PipelineStage.IMAGE.next(false));
        assertEquals(PipelineStage.MOSAIC, PipelineStage.IMAGE.next(true));
        assertEquals(PipelineStage.DONE, PipelineStage.MOSAIC.next(true));
    }

    @Test
    void resumeAfterCompletedStage() {
        assertEquals(PipelineStage.CONVERT, PipelineStage.resumeAfter(null, false));
        assertEquals(PipelineStage.CONVERT, PipelineStage.resumeAfter("", false));
        assertEquals(PipelineStage.IMAGE, PipelineStage.resumeAfter("CALIBRATE_OR_APPLY", false));
        assertEquals(PipelineStage.DONE, PipelineStage.resumeAfter("IMAGE", false));
        assertEquals(PipelineStage.MOSAIC, PipelineStage.resumeAfter("IMAGE", true));
    }

    @Test
    void checkpointKeepsArtifactsPerStage() {
        StageResult convert = new StageResult(true, Map.of("ms", "/p/obs.ms"), null);
        StageResult apply = new StageResult(true, Map.of("ms", "/p/cal.ms"), null);
        Map<String, String> checkpoint = new LinkedHashMap<>(convert.toCheckpoint(PipelineStage.CONVERT));
        checkpoint.putAll(apply.toCheckpoint(PipelineStage.CALIBRATE_OR_APPLY));

        assertEquals(Map.of("CONVERT.ms", "/p/obs.ms", "CALIBRATE_OR_APPLY.ms", "/p/cal.ms"), checkpoint);
        assertEquals(Map.of("ms", "/p/cal.ms"),
                StageResult.fromCheckpoint(checkpoint, PipelineStage.CALIBRATE_OR_APPLY).artifacts());
        assertTrue(StageResult.fromCheckpoint(checkpoint, PipelineStage.IMAGE).artifacts().isEmpty());
        assertTrue(convert.diagnostics().isNull());
    }
}
