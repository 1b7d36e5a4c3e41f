package contimg.coordinator.service;

import contimg.coordinator.model.GroupEvent;
import contimg.coordinator.model.GroupState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Transition table of the ingest queue.
 * Any (state, event) pair not listed is a logged anomaly and leaves the group unchanged.
 */
public final class GroupStateMachine {

    private static final Logger log = LoggerFactory.getLogger(GroupStateMachine.class);

    private static final Map<GroupState, Map<GroupEvent, GroupState>> TRANSITIONS = new EnumMap<>(GroupState.class);

    static {
        on(GroupState.COLLECTING, GroupEvent.MEMBERS_COMPLETE, GroupState.PENDING);
        on(GroupState.COLLECTING, GroupEvent.COLLECTION_TIMEOUT, GroupState.PENDING);
        on(GroupState.COLLECTING, GroupEvent.FAIL, GroupState.FAILED);

        on(GroupState.PENDING, GroupEvent.CLAIM, GroupState.CLAIMED);
        on(GroupState.PENDING, GroupEvent.FAIL, GroupState.FAILED);

        on(GroupState.CLAIMED, GroupEvent.START, GroupState.PROCESSING);
        on(GroupState.CLAIMED, GroupEvent.FAIL, GroupState.FAILED);
        on(GroupState.CLAIMED, GroupEvent.LEASE_EXPIRED, GroupState.PENDING);

        on(GroupState.PROCESSING, GroupEvent.COMPLETE, GroupState.COMPLETED);
        on(GroupState.PROCESSING, GroupEvent.FAIL, GroupState.FAILED);
        on(GroupState.PROCESSING, GroupEvent.LEASE_EXPIRED, GroupState.PENDING);

        on(GroupState.FAILED, GroupEvent.RETRY, GroupState.PENDING);
        on(GroupState.FAILED, GroupEvent.ABANDON, GroupState.ABANDONED);
    }

    private GroupStateMachine() {
    }

    private static void on(GroupState from, GroupEvent event, GroupState to) {
        TRANSITIONS.computeIfAbsent(from, s -> new EnumMap<>(GroupEvent.class)).put(event, to);
    }

    /**
     * Target state for an event, or empty (with an anomaly logged) when the pair is not allowed.
     */
    public static Optional<GroupState> next(GroupState from, GroupEvent event) {
        GroupState to = TRANSITIONS.getOrDefault(from, Collections.emptyMap()).get(event);
        if (to == null) {
            log.warn("Ignoring event {} in state {}: no such transition", event, from);
            return Optional.empty();
        }
        return Optional.of(to);
    }

    public static boolean allows(GroupState from, GroupEvent event) {
        return TRANSITIONS.getOrDefault(from, Collections.emptyMap()).containsKey(event);
    }
}
