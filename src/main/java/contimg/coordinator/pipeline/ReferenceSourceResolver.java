package contimg.coordinator.pipeline;

import contimg.coordinator.model.FileGroup;

import java.util.Optional;

/**
 * Decides whether a group observed a calibration reference source.
 */
@FunctionalInterface
public interface ReferenceSourceResolver {

    /**
     * @return the reference source name, or empty for ordinary science observations
     */
    Optional<String> resolve(FileGroup group);

    static ReferenceSourceResolver none() {
        return group -> Optional.empty();
    }
}
