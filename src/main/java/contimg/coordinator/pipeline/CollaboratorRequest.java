package contimg.coordinator.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Input handed to an external collaborator.
 */
public record CollaboratorRequest(
        @JsonProperty("input_paths") List<String> inputPaths,
        @JsonProperty("parameters") Map<String, String> parameters,
        @JsonProperty("output_dir") String outputDir) {

    public CollaboratorRequest {
        inputPaths = List.copyOf(inputPaths);
        parameters = Map.copyOf(parameters);
    }

    public CollaboratorRequest(List<String> inputPaths, Map<String, String> parameters, Path outputDir) {
        this(inputPaths, parameters, outputDir.toString());
    }

    public Path outputPath() {
        return Path.of(outputDir);
    }
}
