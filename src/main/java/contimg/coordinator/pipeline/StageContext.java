package contimg.coordinator.pipeline;

import contimg.coordinator.model.FileGroup;
import contimg.coordinator.model.Task;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a stage handler needs for one group.
 *
 * @param memberPaths validated member files ordered by member index
 * @param previous    result of the stage before, empty for the first stage
 * @param outputDir   directory for this group's products
 */
public record StageContext(
        FileGroup group,
        Task task,
        String workerId,
        List<String> memberPaths,
        StageResult previous,
        Path outputDir) {
}
