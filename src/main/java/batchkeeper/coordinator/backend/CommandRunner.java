package batchkeeper.coordinator.backend;

import java.io.IOException;
import java.util.List;

/**
 * Runs scheduler command-line tools. Backends only talk to the cluster through this seam.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Run a command to completion.
     *
     * @param command program and arguments
     * @return exit code and captured output
     * @throws IOException if the program cannot be started, times out or is interrupted
     */
    CommandResult run(List<String> command) throws IOException;
}
