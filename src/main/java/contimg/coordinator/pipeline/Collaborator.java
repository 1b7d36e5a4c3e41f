package contimg.coordinator.pipeline;

/**
 * External processing step (format conversion, calibration solve or apply, imaging, mosaicking).
 */
@FunctionalInterface
public interface Collaborator {

    /**
     * @throws CollaboratorException on crash or unreadable output
     */
    CollaboratorResponse invoke(CollaboratorRequest request);
}
