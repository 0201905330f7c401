package batchkeeper.coordinator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Set of field changes applied to a stored job in a single statement.
 * Only the fields that were set are written; a field set to {@code null} is cleared.
 */
public final class JobUpdate {

    public enum Field {
        STATUS,
        BACKEND_ID,
        EXIT_CODE,
        SUBMITTED_AT,
        STARTED_AT,
        COMPLETED_AT,
        FAILURE_KIND,
        FAILURE_REASON,
        ERROR_LINES
    }

    private final Map<Field, Object> values = new EnumMap<>(Field.class);

    private JobUpdate() {
    }

    public static JobUpdate create() {
        return new JobUpdate();
    }

    public JobUpdate status(JobStatus status) {
        values.put(Field.STATUS, Objects.requireNonNull(status, "status"));
        return this;
    }

    public JobUpdate backendId(String backendId) {
        values.put(Field.BACKEND_ID, backendId);
        return this;
    }

    public JobUpdate exitCode(Integer exitCode) {
        values.put(Field.EXIT_CODE, exitCode);
        return this;
    }

    public JobUpdate submittedAt(Instant at) {
        values.put(Field.SUBMITTED_AT, at);
        return this;
    }

    public JobUpdate startedAt(Instant at) {
        values.put(Field.STARTED_AT, at);
        return this;
    }

    public JobUpdate completedAt(Instant at) {
        values.put(Field.COMPLETED_AT, at);
        return this;
    }

    public JobUpdate failure(FailureKind kind, String reason, List<String> errorLines) {
        values.put(Field.FAILURE_KIND, kind);
        values.put(Field.FAILURE_REASON, reason);
        values.put(Field.ERROR_LINES, errorLines != null ? List.copyOf(errorLines) : List.of());
        return this;
    }

    public Map<Field, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "JobUpdate" + values.keySet();
    }
}
