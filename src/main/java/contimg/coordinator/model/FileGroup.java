package contimg.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable domain model of one logical observation: the member files that belong together
 * plus their ingest lifecycle and processing checkpoint.
 */
public final class FileGroup {
    private final String groupKey;
    private final String pointing;
    private final SortedMap<Integer, GroupMember> members;
    private final int expectedCount;
    private final GroupState state;
    private final boolean partial;
    private final String stage; // last completed pipeline stage
    private final Map<String, String> checkpoint;
    private final int retryCount;
    private final String lastError;
    private final String taskId;
    private final String leaseOwner;
    private final Instant leaseExpiry;
    private final long openSequence;
    private final Instant firstSeen;
    private final Instant lastUpdate;
    private final long version;

    private FileGroup(Builder builder) {
        this.groupKey = Objects.requireNonNull(builder.groupKey, "groupKey is required");
        this.pointing = builder.pointing;
        this.members = Collections.unmodifiableSortedMap(new TreeMap<>(builder.members));
        this.expectedCount = builder.expectedCount;
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.partial = builder.partial;
        this.stage = builder.stage;
        this.checkpoint = Collections.unmodifiableMap(new LinkedHashMap<>(builder.checkpoint));
        this.retryCount = builder.retryCount;
        this.lastError = builder.lastError;
        this.taskId = builder.taskId;
        this.leaseOwner = builder.leaseOwner;
        this.leaseExpiry = builder.leaseExpiry;
        this.openSequence = builder.openSequence;
        this.firstSeen = builder.firstSeen;
        this.lastUpdate = builder.lastUpdate;
        this.version = builder.version;
    }

    public String groupKey() {
        return groupKey;
    }

    public String pointing() {
        return pointing;
    }

    /** Members keyed by member index. */
    public SortedMap<Integer, GroupMember> members() {
        return members;
    }

    public int expectedCount() {
        return expectedCount;
    }

    public int observedCount() {
        return members.size();
    }

    public GroupState state() {
        return state;
    }

    public boolean partial() {
        return partial;
    }

    public String stage() {
        return stage;
    }

    public Map<String, String> checkpoint() {
        return checkpoint;
    }

    public int retryCount() {
        return retryCount;
    }

    public String lastError() {
        return lastError;
    }

    public String taskId() {
        return taskId;
    }

    public String leaseOwner() {
        return leaseOwner;
    }

    public Instant leaseExpiry() {
        return leaseExpiry;
    }

    public long openSequence() {
        return openSequence;
    }

    public Instant firstSeen() {
        return firstSeen;
    }

    public Instant lastUpdate() {
        return lastUpdate;
    }

    public long version() {
        return version;
    }

    public boolean isComplete() {
        return members.size() >= expectedCount;
    }

    public boolean hasMember(int index) {
        return members.containsKey(index);
    }

    public boolean containsPath(String path) {
        return members.values().stream().anyMatch(m -> m.path().equals(path));
    }

    /** Sum of member timestamps in epoch millis; with {@link #observedCount()} gives the exact mean. */
    public long timestampSumMillis() {
        return members.values().stream().mapToLong(m -> m.timestamp().toEpochMilli()).sum();
    }

    public Instant meanTimestamp() {
        if (members.isEmpty()) {
            return firstSeen;
        }
        return Instant.ofEpochMilli(Math.round((double) timestampSumMillis() / members.size()));
    }

    public boolean isLeaseExpired(Instant now) {
        return state.isLeased() && leaseExpiry != null && !leaseExpiry.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .groupKey(groupKey)
                .pointing(pointing)
                .members(members)
                .expectedCount(expectedCount)
                .state(state)
                .partial(partial)
                .stage(stage)
                .checkpoint(checkpoint)
                .retryCount(retryCount)
                .lastError(lastError)
                .taskId(taskId)
                .leaseOwner(leaseOwner)
                .leaseExpiry(leaseExpiry)
                .openSequence(openSequence)
                .firstSeen(firstSeen)
                .lastUpdate(lastUpdate)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String groupKey;
        private String pointing;
        private final SortedMap<Integer, GroupMember> members = new TreeMap<>();
        private int expectedCount = 16;
        private GroupState state = GroupState.COLLECTING;
        private boolean partial;
        private String stage;
        private final Map<String, String> checkpoint = new LinkedHashMap<>();
        private int retryCount;
        private String lastError;
        private String taskId;
        private String leaseOwner;
        private Instant leaseExpiry;
        private long openSequence;
        private Instant firstSeen;
        private Instant lastUpdate;
        private long version;

        public Builder groupKey(String groupKey) {
            this.groupKey = groupKey;
            return this;
        }

        public Builder pointing(String pointing) {
            this.pointing = pointing;
            return this;
        }

        public Builder members(Map<Integer, GroupMember> members) {
            this.members.clear();
            this.members.putAll(members);
            return this;
        }

        public Builder addMember(GroupMember member) {
            this.members.put(member.index(), member);
            return this;
        }

        public Builder removeMember(int index) {
            this.members.remove(index);
            return this;
        }

        public Builder expectedCount(int expectedCount) {
            this.expectedCount = expectedCount;
            return this;
        }

        public Builder state(GroupState state) {
            this.state = state;
            return this;
        }

        public Builder partial(boolean partial) {
            this.partial = partial;
            return this;
        }

        public Builder stage(String stage) {
            this.stage = stage;
            return this;
        }

        public Builder checkpoint(Map<String, String> checkpoint) {
            this.checkpoint.clear();
            this.checkpoint.putAll(checkpoint);
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder leaseOwner(String leaseOwner) {
            this.leaseOwner = leaseOwner;
            return this;
        }

        public Builder leaseExpiry(Instant leaseExpiry) {
            this.leaseExpiry = leaseExpiry;
            return this;
        }

        public Builder clearLease() {
            this.leaseOwner = null;
            this.leaseExpiry = null;
            return this;
        }

        public Builder openSequence(long openSequence) {
            this.openSequence = openSequence;
            return this;
        }

        public Builder firstSeen(Instant firstSeen) {
            this.firstSeen = firstSeen;
            return this;
        }

        public Builder lastUpdate(Instant lastUpdate) {
            this.lastUpdate = lastUpdate;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public FileGroup build() {
            return new FileGroup(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FileGroup group))
            return false;
        return Objects.equals(groupKey, group.groupKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupKey);
    }

    @Override
    public String toString() {
        return "FileGroup{key='" + groupKey + "', state=" + state + ", members=" + members.size() + "/"
                + expectedCount + ", partial=" + partial + "}";
    }
}
