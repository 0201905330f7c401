package batchkeeper.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Criteria for listing jobs. Unset criteria match everything.
 */
public final class JobFilter {

    private final Set<JobStatus> statuses;
    private final String backendId;
    private final String parentJobId;
    private final Instant createdAfter;
    private final int limit;

    private JobFilter(Builder builder) {
        this.statuses = builder.statuses.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.statuses));
        this.backendId = builder.backendId;
        this.parentJobId = builder.parentJobId;
        this.createdAfter = builder.createdAfter;
        this.limit = builder.limit;
    }

    public static JobFilter all() {
        return builder().build();
    }

    public static JobFilter byStatus(JobStatus first, JobStatus... rest) {
        return builder().statuses(EnumSet.of(first, rest)).build();
    }

    public Set<JobStatus> statuses() {
        return statuses;
    }

    public String backendId() {
        return backendId;
    }

    public String parentJobId() {
        return parentJobId;
    }

    public Instant createdAfter() {
        return createdAfter;
    }

    /** 0 means unlimited */
    public int limit() {
        return limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Set<JobStatus> statuses = EnumSet.noneOf(JobStatus.class);
        private String backendId;
        private String parentJobId;
        private Instant createdAfter;
        private int limit;

        public Builder statuses(Set<JobStatus> statuses) {
            this.statuses = statuses.isEmpty() ? EnumSet.noneOf(JobStatus.class) : EnumSet.copyOf(statuses);
            return this;
        }

        public Builder backendId(String backendId) {
            this.backendId = backendId;
            return this;
        }

        public Builder parentJobId(String parentJobId) {
            this.parentJobId = parentJobId;
            return this;
        }

        public Builder createdAfter(Instant createdAfter) {
            this.createdAfter = createdAfter;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) {
                throw new IllegalArgumentException("limit must be >= 0");
            }
            this.limit = limit;
            return this;
        }

        public JobFilter build() {
            return new JobFilter(this);
        }
    }
}
