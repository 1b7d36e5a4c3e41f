package contimg.coordinator.model;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a registry lookup.
 *
 * @param selected     the set to apply
 * @param alternatives other active sets whose windows also cover the target, in preference order
 * @param offset       absolute distance between the target time and the selected set's validity start
 */
public record CalibrationSelection(CalibrationSet selected, List<CalibrationSet> alternatives, Duration offset) {

    public CalibrationSelection {
        alternatives = List.copyOf(alternatives);
    }

    public boolean hasAlternatives() {
        return !alternatives.isEmpty();
    }
}
