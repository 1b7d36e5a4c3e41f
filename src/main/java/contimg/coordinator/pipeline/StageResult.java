package contimg.coordinator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one stage: named artifacts plus opaque diagnostics for the next stage.
 */
public record StageResult(boolean success, Map<String, String> artifacts, JsonNode diagnostics) {

    public StageResult {
        artifacts = Map.copyOf(artifacts);
        diagnostics = diagnostics == null ? NullNode.getInstance() : diagnostics;
    }

    public static StageResult empty() {
        return new StageResult(true, Map.of(), null);
    }

    /**
     * Artifacts as stored in the group checkpoint, keys prefixed with the stage name.
     */
    public Map<String, String> toCheckpoint(PipelineStage stage) {
        Map<String, String> entries = new LinkedHashMap<>();
        artifacts.forEach((name, path) -> entries.put(stage.name() + "." + name, path));
        return entries;
    }

    /**
     * Rebuild the result of a completed stage from a group checkpoint.
     */
    public static StageResult fromCheckpoint(Map<String, String> checkpoint, PipelineStage stage) {
        String prefix = stage.name() + ".";
        Map<String, String> artifacts = new LinkedHashMap<>();
        checkpoint.forEach((key, path) -> {
            if (key.startsWith(prefix)) {
                artifacts.put(key.substring(prefix.length()), path);
            }
        });
        return new StageResult(true, artifacts, null);
    }
}
