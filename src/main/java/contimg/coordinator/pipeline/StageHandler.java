package contimg.coordinator.pipeline;

/**
 * Executes one pipeline stage.
 */
public interface StageHandler {

    /**
     * @throws StageFailureException   when the stage cannot produce its output
     * @throws CollaboratorException   on transport-level failure of an external call
     */
    StageResult execute(StageContext context);
}
