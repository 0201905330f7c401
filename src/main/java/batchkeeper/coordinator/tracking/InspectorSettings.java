package batchkeeper.coordinator.tracking;

import java.util.List;

/**
 * Tuning of log inspection.
 *
 * @param tailLines          lines read from the end of each log
 * @param whitelistThreshold shared words needed for a whitelist entry to match
 * @param caseSensitive      compare words and patterns case-sensitively
 * @param whitelist          known-benign message templates
 * @param customPatterns     regexes added to the default error patterns
 * @param oomPatterns        regexes that mark an error line as memory exhaustion
 */
public record InspectorSettings(
        int tailLines,
        int whitelistThreshold,
        boolean caseSensitive,
        List<String> whitelist,
        List<String> customPatterns,
        List<String> oomPatterns) {

    public static final int DEFAULT_TAIL_LINES = 10_000;
    public static final int DEFAULT_THRESHOLD = 3;

    public static final List<String> DEFAULT_ERROR_PATTERNS = List.of(
            "\\berror\\b",
            "\\bexception\\b",
            "\\bfailed\\b",
            "\\bfailure\\b",
            "segmentation fault",
            "core dumped",
            "\\bkilled\\b",
            "traceback",
            "\\bsevere\\b");

    public static final List<String> DEFAULT_OOM_PATTERNS = List.of(
            "out of memory",
            "oom-kill",
            "oom_kill",
            "exceeded memory limit",
            "memory limit",
            "cannot allocate memory",
            "malloc.*failed");

    public InspectorSettings {
        if (tailLines < 1) {
            throw new IllegalArgumentException("tailLines must be >= 1");
        }
        if (whitelistThreshold < 1) {
            throw new IllegalArgumentException("whitelistThreshold must be >= 1");
        }
        whitelist = whitelist != null ? List.copyOf(whitelist) : List.of();
        customPatterns = customPatterns != null ? List.copyOf(customPatterns) : List.of();
        oomPatterns = oomPatterns != null && !oomPatterns.isEmpty() ? List.copyOf(oomPatterns) : DEFAULT_OOM_PATTERNS;
    }

    public static InspectorSettings defaults() {
        return new InspectorSettings(DEFAULT_TAIL_LINES, DEFAULT_THRESHOLD, false, List.of(), List.of(), List.of());
    }

    public InspectorSettings withWhitelist(List<String> entries) {
        return new InspectorSettings(tailLines, whitelistThreshold, caseSensitive, entries, customPatterns, oomPatterns);
    }

    public InspectorSettings withCustomPatterns(List<String> patterns) {
        return new InspectorSettings(tailLines, whitelistThreshold, caseSensitive, whitelist, patterns, oomPatterns);
    }

    public InspectorSettings withTailLines(int lines) {
        return new InspectorSettings(lines, whitelistThreshold, caseSensitive, whitelist, customPatterns, oomPatterns);
    }
}
