package batchkeeper.coordinator.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans the tail of captured job output for error lines.
 *
 * <p>
 * A line is a candidate when it matches any error or OOM pattern; candidates
 * that match the whitelist are dropped. Missing or unreadable logs yield no
 * lines, they never fail the inspection.
 */
public class LogInspector {

    private static final Logger log = LoggerFactory.getLogger(LogInspector.class);

    static final int MAX_LINE_LENGTH = 500;
    static final int MAX_LINES = 50;
    static final int SENTINEL_TAIL_LINES = 100;

    private static final List<Pattern> EXIT_SENTINELS = List.of(
            Pattern.compile("exit(?:ed)?\\s+(?:with\\s+)?code\\s+(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("exit\\s+status:\\s+(\\d+)", Pattern.CASE_INSENSITIVE));

    private final InspectorSettings settings;
    private final List<Pattern> errorPatterns;
    private final List<Pattern> oomPatterns;
    private final WhitelistMatcher whitelist;

    public LogInspector(InspectorSettings settings) {
        this.settings = settings;
        int flags = settings.caseSensitive() ? 0 : Pattern.CASE_INSENSITIVE;
        List<Pattern> patterns = new ArrayList<>();
        for (String p : InspectorSettings.DEFAULT_ERROR_PATTERNS) {
            patterns.add(Pattern.compile(p, flags));
        }
        for (String p : settings.customPatterns()) {
            patterns.add(Pattern.compile(p, flags));
        }
        this.errorPatterns = List.copyOf(patterns);
        this.oomPatterns = settings.oomPatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
        this.whitelist = new WhitelistMatcher(settings.whitelist(), settings.whitelistThreshold(),
                settings.caseSensitive());
    }

    public InspectionResult inspect(Path... logs) {
        return inspect(List.of(logs));
    }

    /**
     * Inspect several logs in order; lines are reported in the order the logs are given.
     */
    public InspectionResult inspect(List<Path> logs) {
        List<String> found = new ArrayList<>();
        int whitelisted = 0;
        for (Path logFile : logs) {
            for (String line : tail(logFile, settings.tailLines())) {
                if (!isCandidate(line)) {
                    continue;
                }
                if (whitelist.matches(line)) {
                    whitelisted++;
                    continue;
                }
                if (found.size() < MAX_LINES) {
                    found.add(truncate(line.strip()));
                }
            }
        }
        if (whitelisted > 0) {
            log.debug("Whitelist suppressed {} candidate error lines", whitelisted);
        }
        return new InspectionResult(found, whitelisted);
    }

    public boolean isOutOfMemory(String line) {
        for (Pattern p : oomPatterns) {
            if (p.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Exit code printed by the job itself, e.g. {@code exited with code 3}, in the last lines of a log.
     */
    public OptionalInt exitCodeSentinel(Path logFile) {
        List<String> lines = tail(logFile, SENTINEL_TAIL_LINES);
        for (int i = lines.size() - 1; i >= 0; i--) {
            for (Pattern p : EXIT_SENTINELS) {
                Matcher m = p.matcher(lines.get(i));
                if (m.find()) {
                    try {
                        return OptionalInt.of(Integer.parseInt(m.group(1)));
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring out-of-range exit code '{}' in {}", m.group(1), logFile);
                    }
                }
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Last {@code maxLines} lines of a file, read through a fixed-size ring buffer.
     * Malformed bytes are replaced, so binary noise never aborts the read.
     */
    List<String> tail(Path logFile, int maxLines) {
        Deque<String> ring = new ArrayDeque<>(Math.min(maxLines, 1024));
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(logFile),
                StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPLACE)
                        .onUnmappableCharacter(CodingErrorAction.REPLACE)))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (ring.size() == maxLines) {
                    ring.removeFirst();
                }
                ring.addLast(line);
            }
        } catch (NoSuchFileException e) {
            log.warn("Log {} does not exist", logFile);
            return List.of();
        } catch (IOException e) {
            log.warn("Could not read log {}: {}", logFile, e.getMessage());
            return List.of();
        }
        return new ArrayList<>(ring);
    }

    private boolean isCandidate(String line) {
        for (Pattern p : errorPatterns) {
            if (p.matcher(line).find()) {
                return true;
            }
        }
        return isOutOfMemory(line);
    }

    private static String truncate(String line) {
        return line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) : line;
    }
}
