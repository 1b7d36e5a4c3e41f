package contimg.coordinator.grouping;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SubbandFileNameTest {

    @Test
    void parsesTimestampAndIndex() {
        Path path = Path.of("/data/incoming/2025-10-02T00:12:03_sb07.hdf5");

        SubbandFileName parsed = SubbandFileName.parse(path).orElseThrow();

        assertEquals(path, parsed.path());
        assertEquals(Instant.parse("2025-10-02T00:12:03Z"), parsed.timestamp());
        assertEquals(7, parsed.memberIndex());
    }

    @Test
    void ignoresOtherNames() {
        assertTrue(SubbandFileName.parse(Path.of("2025-10-02T00:12:03_sb07.ms")).isEmpty());
        assertTrue(SubbandFileName.parse(Path.of("2025-10-02T00:12:03_sb7.hdf5")).isEmpty());
        assertTrue(SubbandFileName.parse(Path.of("2025-10-02_sb07.hdf5")).isEmpty());
        assertTrue(SubbandFileName.parse(Path.of("/")).isEmpty());
    }

    @Test
    void rejectsImpossibleDates() {
        assertTrue(SubbandFileName.parse(Path.of("2025-13-02T00:12:03_sb07.hdf5")).isEmpty());
        assertTrue(SubbandFileName.parse(Path.of("2025-10-02T25:12:03_sb07.hdf5")).isEmpty());
    }
}
