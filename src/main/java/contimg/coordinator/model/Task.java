package contimg.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a persistent task.
 * The payload is opaque JSON; the engine only looks at state, lease and retry bookkeeping.
 */
public final class Task {
    private final String id;
    private final String type;
    private final String groupId; // lineage link, null for free-standing tasks
    private final String payload;
    private final TaskState state;
    private final int priority;
    private final int attempts;
    private final int maxRetries;
    private final String workerId;
    private final Instant leaseExpiry;
    private final Duration leaseDuration;
    private final String lastError;
    private final String result;
    private final boolean cancelRequested;
    private final Instant createdAt;
    private final Instant claimedAt;
    private final Instant finishedAt;
    private final long version;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.groupId = builder.groupId;
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.priority = builder.priority;
        this.attempts = builder.attempts;
        this.maxRetries = builder.maxRetries;
        this.workerId = builder.workerId;
        this.leaseExpiry = builder.leaseExpiry;
        this.leaseDuration = builder.leaseDuration;
        this.lastError = builder.lastError;
        this.result = builder.result;
        this.cancelRequested = builder.cancelRequested;
        this.createdAt = builder.createdAt;
        this.claimedAt = builder.claimedAt;
        this.finishedAt = builder.finishedAt;
        this.version = builder.version;
    }

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public String groupId() {
        return groupId;
    }

    public String payload() {
        return payload;
    }

    public TaskState state() {
        return state;
    }

    public int priority() {
        return priority;
    }

    /** Number of retryable failures (including lease expiries) so far. */
    public int attempts() {
        return attempts;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public String workerId() {
        return workerId;
    }

    public Instant leaseExpiry() {
        return leaseExpiry;
    }

    /** Lease length granted at claim time; heartbeats extend by the same amount. */
    public Duration leaseDuration() {
        return leaseDuration;
    }

    public String lastError() {
        return lastError;
    }

    public String result() {
        return result;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /** Store version the task was read at; 0 for a task not yet saved. */
    public long version() {
        return version;
    }

    /** Check if another retryable failure would still be re-queued */
    public boolean canRetry() {
        return attempts < maxRetries;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public boolean isOwnedBy(String worker) {
        return state.isLeased() && workerId != null && workerId.equals(worker);
    }

    public boolean isLeaseExpired(Instant now) {
        return state.isLeased() && leaseExpiry != null && !leaseExpiry.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .groupId(groupId)
                .payload(payload)
                .state(state)
                .priority(priority)
                .attempts(attempts)
                .maxRetries(maxRetries)
                .workerId(workerId)
                .leaseExpiry(leaseExpiry)
                .leaseDuration(leaseDuration)
                .lastError(lastError)
                .result(result)
                .cancelRequested(cancelRequested)
                .createdAt(createdAt)
                .claimedAt(claimedAt)
                .finishedAt(finishedAt)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String type;
        private String groupId;
        private String payload = "{}";
        private TaskState state = TaskState.QUEUED;
        private int priority = 0;
        private int attempts = 0;
        private int maxRetries = 3;
        private String workerId;
        private Instant leaseExpiry;
        private Duration leaseDuration;
        private String lastError;
        private String result;
        private boolean cancelRequested;
        private Instant createdAt;
        private Instant claimedAt;
        private Instant finishedAt;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder leaseExpiry(Instant leaseExpiry) {
            this.leaseExpiry = leaseExpiry;
            return this;
        }

        public Builder leaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        /** Drop lease ownership, used whenever a task leaves CLAIMED/RUNNING. */
        public Builder clearLease() {
            this.workerId = null;
            this.leaseExpiry = null;
            this.leaseDuration = null;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', type='" + type + "', state=" + state + ", workerId='" + workerId
                + "', attempts=" + attempts + "}";
    }
}
