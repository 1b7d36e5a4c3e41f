package contimg.coordinator.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Calibration table kinds in the order they are applied.
 */
public enum TableKind {
    DELAY("K", 10, List.of("_kcal", "_2kcal")),
    BANDPASS_AMPLITUDE("BA", 20, List.of("_bacal")),
    BANDPASS("BP", 30, List.of("_bpcal")),
    GAIN_AMPLITUDE("GA", 40, List.of("_gacal")),
    GAIN_PHASE("GP", 50, List.of("_gpcal")),
    SHORT_GAIN("2G", 60, List.of("_2gcal")),
    FLUX_SCALE("FLUX", 70, List.of("_flux.cal", "_fluxcal"));

    private final String code;
    private final int applyOrder;
    private final List<String> suffixes;

    TableKind(String code, int applyOrder, List<String> suffixes) {
        this.code = code;
        this.applyOrder = applyOrder;
        this.suffixes = suffixes;
    }

    public String code() {
        return code;
    }

    public int applyOrder() {
        return applyOrder;
    }

    /** Detect the kind from a table file or directory name. */
    public static Optional<TableKind> fromPath(String path) {
        String name = Path.of(path).getFileName().toString().toLowerCase(Locale.ROOT);
        for (TableKind kind : values()) {
            for (String suffix : kind.suffixes) {
                if (name.endsWith(suffix)) {
                    return Optional.of(kind);
                }
            }
        }
        return Optional.empty();
    }

    /** Detect the kind from an artifact label (kind name or code), falling back to the path. */
    public static Optional<TableKind> fromArtifact(String label, String path) {
        for (TableKind kind : values()) {
            if (kind.name().equalsIgnoreCase(label) || kind.code.equalsIgnoreCase(label)) {
                return Optional.of(kind);
            }
        }
        return fromPath(path);
    }
}
