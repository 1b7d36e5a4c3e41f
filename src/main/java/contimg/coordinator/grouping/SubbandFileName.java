package contimg.coordinator.grouping;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed subband file name of the form {@code 2025-10-02T00:12:00_sb05.hdf5}.
 * Timestamps in file names are UTC.
 */
public record SubbandFileName(Path path, Instant timestamp, int memberIndex) {

    private static final Pattern PATTERN = Pattern.compile(
            "^(?<ts>\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2})_sb(?<idx>\\d{2})\\.hdf5$");

    /**
     * @return the parsed name, or empty for files that do not follow the convention
     */
    public static Optional<SubbandFileName> parse(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher m = PATTERN.matcher(fileName.toString());
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            Instant timestamp = LocalDateTime.parse(m.group("ts")).toInstant(ZoneOffset.UTC);
            return Optional.of(new SubbandFileName(path, timestamp, Integer.parseInt(m.group("idx"))));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
