package contimg.coordinator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileGroupTest {

    private static final Instant T = Instant.parse("2025-10-02T00:12:00Z");

    private static GroupMember member(int index, long offsetMs) {
        return new GroupMember(index, "/data/incoming/sb" + index + ".hdf5", T.plusMillis(offsetMs));
    }

    @Test
    void membersAreOrderedByIndex() {
        FileGroup group = FileGroup.builder()
                .groupKey("g")
                .addMember(member(5, 0))
                .addMember(member(1, 0))
                .addMember(member(3, 0))
                .build();

        assertEquals(3, group.observedCount());
        assertEquals(List.of(1, 3, 5), List.copyOf(group.members().keySet()));
        assertTrue(group.hasMember(3));
        assertTrue(group.containsPath("/data/incoming/sb5.hdf5"));
        assertFalse(group.containsPath("/data/incoming/sb4.hdf5"));
    }

    @Test
    void meanTimestampIsExactAverage() {
        FileGroup group = FileGroup.builder()
                .groupKey("g")
                .addMember(member(0, 0))
                .addMember(member(1, 4000))
                .build();

        assertEquals(2 * T.toEpochMilli() + 4000, group.timestampSumMillis());
        assertEquals(T.plusSeconds(2), group.meanTimestamp());
    }

    @Test
    void completeWhenExpectedCountReached() {
        FileGroup.Builder builder = FileGroup.builder().groupKey("g").expectedCount(2).addMember(member(0, 0));
        assertFalse(builder.build().isComplete());

        assertTrue(builder.addMember(member(1, 0)).build().isComplete());
        assertFalse(builder.removeMember(0).build().isComplete());
    }

    @Test
    void leaseOnlyCountsInLeasedStates() {
        FileGroup claimed = FileGroup.builder()
                .groupKey("g")
                .state(GroupState.CLAIMED)
                .leaseOwner("w1")
                .leaseExpiry(T)
                .build();

        assertTrue(claimed.isLeaseExpired(T));
        assertFalse(claimed.isLeaseExpired(T.minusSeconds(1)));
        assertFalse(claimed.toBuilder().state(GroupState.PENDING).build().isLeaseExpired(T.plusSeconds(60)));
    }
}
