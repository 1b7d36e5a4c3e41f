package contimg.coordinator.pipeline;

/**
 * External processing steps the orchestrator delegates to.
 */
public enum CollaboratorKind {
    /** Raw subband files to a measurement set */
    CONVERT,
    /** Calibration solve on a reference-source observation */
    SOLVE,
    /** Apply a calibration set */
    APPLY,
    /** Deconvolution and imaging */
    IMAGE,
    /** Combine images into a mosaic */
    MOSAIC
}
