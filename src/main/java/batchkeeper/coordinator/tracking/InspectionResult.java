package batchkeeper.coordinator.tracking;

import java.util.List;

/**
 * Error lines found in a job's logs.
 *
 * @param errorLines  surviving lines in log order, truncated and capped
 * @param whitelisted candidate lines dropped by the whitelist
 */
public record InspectionResult(List<String> errorLines, int whitelisted) {

    public InspectionResult {
        errorLines = List.copyOf(errorLines);
    }

    public static InspectionResult clean() {
        return new InspectionResult(List.of(), 0);
    }

    public boolean hasErrors() {
        return !errorLines.isEmpty();
    }
}
