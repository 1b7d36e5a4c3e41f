package contimg.coordinator.pipeline;

import contimg.coordinator.model.FileGroup;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stage backed by a single collaborator call. The convert stage consumes the member files; later
 * stages consume the previous stage's artifacts.
 */
public class CollaboratorStage implements StageHandler {

    private final PipelineStage stage;
    private final CollaboratorKind kind;
    private final CollaboratorInvoker invoker;

    public CollaboratorStage(PipelineStage stage, CollaboratorKind kind, CollaboratorInvoker invoker) {
        this.stage = stage;
        this.kind = kind;
        this.invoker = invoker;
    }

    public static CollaboratorStage convert(CollaboratorInvoker invoker) {
        return new CollaboratorStage(PipelineStage.CONVERT, CollaboratorKind.CONVERT, invoker);
    }

    public static CollaboratorStage image(CollaboratorInvoker invoker) {
        return new CollaboratorStage(PipelineStage.IMAGE, CollaboratorKind.IMAGE, invoker);
    }

    public static CollaboratorStage mosaic(CollaboratorInvoker invoker) {
        return new CollaboratorStage(PipelineStage.MOSAIC, CollaboratorKind.MOSAIC, invoker);
    }

    @Override
    public StageResult execute(StageContext context) {
        List<String> inputs = stage == PipelineStage.CONVERT
                ? context.memberPaths()
                : artifactInputs(context.previous());
        if (inputs.isEmpty()) {
            throw new StageFailureException(stage, "No inputs for " + stage, true);
        }
        CollaboratorRequest request = new CollaboratorRequest(inputs, groupParameters(context.group()),
                context.outputDir().resolve(stage.name().toLowerCase(Locale.ROOT)));
        CollaboratorResponse response = invoker.invoke(kind, stage, request);
        return new StageResult(true, response.artifacts(), response.diagnostics());
    }

    static List<String> artifactInputs(StageResult previous) {
        return new ArrayList<>(new TreeMap<>(previous.artifacts()).values());
    }

    static Map<String, String> groupParameters(FileGroup group) {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("group_key", group.groupKey());
        parameters.put("observation_time", group.meanTimestamp().toString());
        parameters.put("member_count", Integer.toString(group.observedCount()));
        parameters.put("partial", Boolean.toString(group.partial()));
        if (group.pointing() != null) {
            parameters.put("pointing", group.pointing());
        }
        return parameters;
    }
}
