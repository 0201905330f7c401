package batchkeeper.coordinator.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Checks that the files a job promised to produce exist.
 * Patterns may be globs ({@code *}, {@code ?}, {@code [..]}, {@code {a,b}});
 * a glob is satisfied by at least one match.
 */
public final class ExpectedFiles {

    private static final Logger log = LoggerFactory.getLogger(ExpectedFiles.class);

    private ExpectedFiles() {
    }

    /**
     * @param patterns paths or globs, relative ones resolved against {@code baseDir}
     * @return the patterns that are not satisfied, in input order
     */
    public static List<String> missing(List<String> patterns, Path baseDir) {
        List<String> missing = new ArrayList<>();
        for (String pattern : patterns) {
            if (!satisfied(pattern, baseDir)) {
                missing.add(pattern);
            }
        }
        return missing;
    }

    static boolean satisfied(String pattern, Path baseDir) {
        Path absolute = baseDir.resolve(pattern).normalize();
        if (!isGlob(pattern)) {
            return Files.exists(absolute);
        }

        // walk from the deepest directory that has no glob characters
        Path start = absolute.getRoot() != null ? absolute.getRoot() : Path.of("");
        int depth = 0;
        boolean recursive = false;
        boolean inGlob = false;
        for (Path element : absolute) {
            String name = element.toString();
            if (!inGlob && !isGlob(name)) {
                start = start.resolve(name);
            } else {
                inGlob = true;
                depth++;
                recursive |= name.contains("**");
            }
        }
        if (!Files.isDirectory(start)) {
            return false;
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + absolute);
        try (Stream<Path> walk = Files.walk(start, recursive ? Integer.MAX_VALUE : depth)) {
            return walk.anyMatch(matcher::matches);
        } catch (IOException e) {
            log.warn("Could not expand {}: {}", pattern, e.getMessage());
            return false;
        }
    }

    static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0
                || pattern.indexOf('[') >= 0 || pattern.indexOf('{') >= 0;
    }
}
