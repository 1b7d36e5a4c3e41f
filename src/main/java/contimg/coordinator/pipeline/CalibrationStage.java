package contimg.coordinator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import contimg.coordinator.core.StatusFeed;
import contimg.coordinator.model.CalibrationSelection;
import contimg.coordinator.model.CalibrationSet;
import contimg.coordinator.model.CalibrationTable;
import contimg.coordinator.model.FileGroup;
import contimg.coordinator.model.TableKind;
import contimg.coordinator.service.CalibrationRegistry;
import contimg.coordinator.service.InvalidCalibrationSetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CALIBRATE_OR_APPLY stage.
 * <p>
 * Reference-source observations are solved and the resulting set is registered before it is
 * applied, so the set is selectable before the solving task completes. Science observations
 * apply the set the registry selects for the group's mean timestamp; no selection is a permanent
 * stage failure.
 */
public class CalibrationStage implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(CalibrationStage.class);

    private final CalibrationRegistry registry;
    private final CollaboratorInvoker invoker;
    private final ReferenceSourceResolver resolver;
    private final StatusFeed feed;
    private final boolean verifyTables;

    public CalibrationStage(CalibrationRegistry registry, CollaboratorInvoker invoker,
            ReferenceSourceResolver resolver, StatusFeed feed, boolean verifyTables) {
        this.registry = registry;
        this.invoker = invoker;
        this.resolver = resolver;
        this.feed = feed;
        this.verifyTables = verifyTables;
    }

    @Override
    public StageResult execute(StageContext context) {
        FileGroup group = context.group();
        Optional<String> reference = resolver.resolve(group);
        ObjectNode diagnostics = JsonNodeFactory.instance.objectNode();

        CalibrationSet set;
        if (reference.isPresent()) {
            set = solveAndRegister(context, reference.get());
            diagnostics.put("reference_source", reference.get());
        } else {
            set = selectFor(context, diagnostics);
        }
        diagnostics.put("calibration_set", set.id());

        List<String> inputs = CollaboratorStage.artifactInputs(context.previous());
        if (inputs.isEmpty()) {
            throw new StageFailureException(PipelineStage.CALIBRATE_OR_APPLY, "No converted data to calibrate", true);
        }
        Map<String, String> parameters = CollaboratorStage.groupParameters(group);
        parameters.put("calibration_set", set.id());
        parameters.put("tables", String.join(",", set.tablePaths()));
        CollaboratorResponse applied = invoker.invoke(CollaboratorKind.APPLY, PipelineStage.CALIBRATE_OR_APPLY,
                new CollaboratorRequest(inputs, parameters, context.outputDir().resolve("apply")));
        if (!applied.diagnostics().isMissingNode() && !applied.diagnostics().isNull()) {
            diagnostics.set("apply", applied.diagnostics());
        }
        return new StageResult(true, applied.artifacts(), diagnostics);
    }

    private CalibrationSet selectFor(StageContext context, ObjectNode diagnostics) {
        FileGroup group = context.group();
        Instant target = group.meanTimestamp();
        Optional<CalibrationSelection> found = registry.select(target);
        if (found.isEmpty()) {
            throw new StageFailureException(PipelineStage.CALIBRATE_OR_APPLY,
                    "No calibration covers " + target, true);
        }
        CalibrationSelection selection = found.get();
        if (selection.hasAlternatives()) {
            feed.warn(group.groupKey(), context.task().id(), "Calibration " + selection.selected().id()
                    + " chosen over " + selection.alternatives().stream().map(CalibrationSet::id)
                    .collect(Collectors.joining(", ")));
        }
        Duration staleness = registry.staleness(selection);
        if (!staleness.isZero()) {
            log.warn("Group {} uses stale calibration {} ({} beyond fresh window)",
                    group.groupKey(), selection.selected().id(), staleness);
            feed.warn(group.groupKey(), context.task().id(), "Calibration " + selection.selected().id()
                    + " is stale by " + staleness);
        }
        diagnostics.put("offset_seconds", selection.offset().getSeconds());
        diagnostics.put("staleness_seconds", staleness.getSeconds());
        return selection.selected();
    }

    private CalibrationSet solveAndRegister(StageContext context, String referenceSource) {
        FileGroup group = context.group();
        String setId = null;
        for (int attempt = 1; setId == null; attempt++) {
            String id = attempt == 1 ? "cal-" + group.groupKey() : "cal-" + group.groupKey() + "-" + attempt;
            Optional<CalibrationSet> existing = registry.find(id);
            if (existing.isEmpty()) {
                setId = id;
            } else if (existing.get().isActive()) {
                log.info("Reusing calibration set {} solved on an earlier attempt", id);
                return existing.get();
            }
        }

        List<String> inputs = CollaboratorStage.artifactInputs(context.previous());
        Map<String, String> parameters = CollaboratorStage.groupParameters(group);
        parameters.put("reference_source", referenceSource);
        CollaboratorResponse solved = invoker.invoke(CollaboratorKind.SOLVE, PipelineStage.CALIBRATE_OR_APPLY,
                new CollaboratorRequest(inputs, parameters, context.outputDir().resolve("solve")));

        JsonNode diag = solved.diagnostics();
        String refAntenna = text(diag, "refant");
        String field = Optional.ofNullable(text(diag, "field")).orElse(referenceSource);
        List<CalibrationTable> tables = new ArrayList<>();
        solved.artifacts().forEach((label, path) -> {
            Optional<TableKind> kind = TableKind.fromArtifact(label, path);
            if (kind.isPresent()) {
                tables.add(new CalibrationTable(kind.get(), path, refAntenna, field));
            } else {
                log.warn("Ignoring solve artifact {} ({}) of unknown table kind", label, Path.of(path).getFileName());
            }
        });

        CalibrationSet candidate = CalibrationSet.builder()
                .id(setId)
                .tables(tables)
                .validityStart(group.meanTimestamp())
                .validityEnd(instant(diag, "validity_end"))
                .sourceObservation(group.groupKey())
                .qualitySummary(text(diag, "quality"))
                .build();
        try {
            return verifyTables ? registry.registerVerified(candidate) : registry.register(candidate);
        } catch (InvalidCalibrationSetException e) {
            throw new StageFailureException(PipelineStage.CALIBRATE_OR_APPLY, e.getMessage(), true, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new StageFailureException(PipelineStage.CALIBRATE_OR_APPLY,
                    "Solve reported an unreadable " + field + ": " + value, true, e);
        }
    }
}
