package contimg.coordinator.pipeline;

/**
 * A stage did not succeed. Permanent failures are not re-queued by the task engine.
 */
public class StageFailureException extends RuntimeException {

    private final PipelineStage stage;
    private final boolean permanent;

    public StageFailureException(PipelineStage stage, String message, boolean permanent) {
        super(message);
        this.stage = stage;
        this.permanent = permanent;
    }

    public StageFailureException(PipelineStage stage, String message, boolean permanent, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.permanent = permanent;
    }

    public PipelineStage stage() {
        return stage;
    }

    public boolean permanent() {
        return permanent;
    }
}
