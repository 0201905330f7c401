package batchkeeper.coordinator.tracking;

import batchkeeper.coordinator.model.FailureKind;

import java.util.List;

/**
 * Outcome of failure detection for one finished job.
 */
public record FailureVerdict(boolean failed, FailureKind kind, String reason, List<String> errorLines) {

    public FailureVerdict {
        errorLines = errorLines != null ? List.copyOf(errorLines) : List.of();
        if (failed && kind == null) {
            throw new IllegalArgumentException("a failed verdict needs a kind");
        }
    }

    public static FailureVerdict success() {
        return new FailureVerdict(false, null, null, List.of());
    }

    public static FailureVerdict failure(FailureKind kind, String reason) {
        return new FailureVerdict(true, kind, reason, List.of());
    }

    public static FailureVerdict failure(FailureKind kind, String reason, List<String> errorLines) {
        return new FailureVerdict(true, kind, reason, errorLines);
    }
}
