package batchkeeper.coordinator.backend;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Looks up executables on a search path without spawning anything.
 */
public final class ToolProbe {

    private final List<Path> directories;

    public ToolProbe(String searchPath) {
        List<Path> dirs = new ArrayList<>();
        if (searchPath != null) {
            for (String entry : searchPath.split(File.pathSeparator)) {
                if (!entry.isBlank() && entry.indexOf('\0') < 0) {
                    dirs.add(Path.of(entry));
                }
            }
        }
        this.directories = List.copyOf(dirs);
    }

    /** Probe using the {@code PATH} of this process. */
    public static ToolProbe fromEnvironment() {
        return new ToolProbe(System.getenv("PATH"));
    }

    public boolean isAvailable(String tool) {
        for (Path dir : directories) {
            Path candidate = dir.resolve(tool);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasAll(Collection<String> tools) {
        return tools.stream().allMatch(this::isAvailable);
    }

    public List<String> missing(Collection<String> tools) {
        return tools.stream().filter(t -> !isAvailable(t)).toList();
    }
}
