package contimg.coordinator.pipeline;

/**
 * Ordered processing stages of one group lineage.
 */
public enum PipelineStage {
    CONVERT,
    CALIBRATE_OR_APPLY,
    IMAGE,
    /** Only when mosaicking is enabled */
    MOSAIC,
    DONE;

    public PipelineStage next(boolean mosaicEnabled) {
        switch (this) {
            case CONVERT:
                return CALIBRATE_OR_APPLY;
            case CALIBRATE_OR_APPLY:
                return IMAGE;
            case IMAGE:
                return mosaicEnabled ? MOSAIC : DONE;
            default:
                return DONE;
        }
    }

    /**
     * Stage to run after the last completed one, as persisted on the group.
     */
    public static PipelineStage resumeAfter(String completedStage, boolean mosaicEnabled) {
        if (completedStage == null || completedStage.isBlank()) {
            return CONVERT;
        }
        return valueOf(completedStage).next(mosaicEnabled);
    }
}
