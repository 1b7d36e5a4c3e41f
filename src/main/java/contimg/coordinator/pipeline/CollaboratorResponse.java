package contimg.coordinator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Map;

/**
 * Structured result of an external collaborator.
 *
 * @param permanent set by the collaborator when retrying cannot help
 * @param message   human-readable error detail for failures
 */
public record CollaboratorResponse(
        boolean success,
        Map<String, String> artifacts,
        JsonNode diagnostics,
        boolean permanent,
        String message) {

    public CollaboratorResponse {
        artifacts = artifacts == null ? Map.of() : Map.copyOf(artifacts);
        diagnostics = diagnostics == null ? NullNode.getInstance() : diagnostics;
    }

    public static CollaboratorResponse succeeded(Map<String, String> artifacts, JsonNode diagnostics) {
        return new CollaboratorResponse(true, artifacts, diagnostics, false, null);
    }

    public static CollaboratorResponse failed(String message, boolean permanent) {
        return new CollaboratorResponse(false, Map.of(), null, permanent, message);
    }
}
