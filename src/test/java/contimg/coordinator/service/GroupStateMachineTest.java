package contimg.coordinator.service;

import contimg.coordinator.model.GroupEvent;
import contimg.coordinator.model.GroupState;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class GroupStateMachineTest {

    @Test
    void happyPath() {
        assertEquals(Optional.of(GroupState.PENDING),
                GroupStateMachine.next(GroupState.COLLECTING, GroupEvent.MEMBERS_COMPLETE));
        assertEquals(Optional.of(GroupState.CLAIMED), GroupStateMachine.next(GroupState.PENDING, GroupEvent.CLAIM));
        assertEquals(Optional.of(GroupState.PROCESSING),
                GroupStateMachine.next(GroupState.CLAIMED, GroupEvent.START));
        assertEquals(Optional.of(GroupState.COMPLETED),
                GroupStateMachine.next(GroupState.PROCESSING, GroupEvent.COMPLETE));
    }

    @Test
    void collectionTimeoutIsTheOnlyTimedExitFromCollecting() {
        assertEquals(Optional.of(GroupState.PENDING),
                GroupStateMachine.next(GroupState.COLLECTING, GroupEvent.COLLECTION_TIMEOUT));
        assertFalse(GroupStateMachine.allows(GroupState.COLLECTING, GroupEvent.LEASE_EXPIRED));
    }

    @Test
    void failureBranch() {
        for (GroupState from : new GroupState[] { GroupState.COLLECTING, GroupState.PENDING, GroupState.CLAIMED,
                GroupState.PROCESSING }) {
            assertEquals(Optional.of(GroupState.FAILED), GroupStateMachine.next(from, GroupEvent.FAIL), from.name());
        }
        assertEquals(Optional.of(GroupState.PENDING), GroupStateMachine.next(GroupState.FAILED, GroupEvent.RETRY));
        assertEquals(Optional.of(GroupState.ABANDONED),
                GroupStateMachine.next(GroupState.FAILED, GroupEvent.ABANDON));
    }

    @Test
    void expiredLeaseReturnsToPending() {
        assertEquals(Optional.of(GroupState.PENDING),
                GroupStateMachine.next(GroupState.CLAIMED, GroupEvent.LEASE_EXPIRED));
        assertEquals(Optional.of(GroupState.PENDING),
                GroupStateMachine.next(GroupState.PROCESSING, GroupEvent.LEASE_EXPIRED));
    }

    @Test
    void unlistedPairsAreNoOpsNotErrors() {
        for (GroupState state : GroupState.values()) {
            for (GroupEvent event : GroupEvent.values()) {
                assertDoesNotThrow(() -> GroupStateMachine.next(state, event));
            }
        }
        assertTrue(GroupStateMachine.next(GroupState.COMPLETED, GroupEvent.FAIL).isEmpty());
        assertTrue(GroupStateMachine.next(GroupState.ABANDONED, GroupEvent.RETRY).isEmpty());
        assertTrue(GroupStateMachine.next(GroupState.PENDING, GroupEvent.COMPLETE).isEmpty());
    }
}
