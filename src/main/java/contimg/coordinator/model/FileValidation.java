package contimg.coordinator.model;

import java.util.List;
import java.util.Map;

/**
 * Result of checking a group's member files on disk.
 *
 * @param valid   readable, non-empty member paths ordered by member index
 * @param invalid rejected paths with the reason
 */
public record FileValidation(List<String> valid, Map<String, String> invalid) {

    public boolean allValid() {
        return invalid.isEmpty();
    }
}
