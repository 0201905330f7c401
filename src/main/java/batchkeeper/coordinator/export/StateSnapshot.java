package batchkeeper.coordinator.export;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Document written by {@link StateExporter}.
 */
public record StateSnapshot(
        @JsonProperty("exportedAt") Instant exportedAt,
        @JsonProperty("totalJobs") int totalJobs,
        @JsonProperty("jobs") List<JobSnapshot> jobs) {
}
