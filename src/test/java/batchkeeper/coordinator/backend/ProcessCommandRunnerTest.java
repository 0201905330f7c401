package batchkeeper.coordinator.backend;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessCommandRunnerTest {

    @Test
    void capturesOutputAndExitCode() throws IOException {
        ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofSeconds(10));

        CommandResult result = runner.run(List.of("sh", "-c", "echo 'Submitted batch job 12'; echo warn >&2; exit 3"));

        assertEquals(3, result.exitCode());
        assertEquals("Submitted batch job 12\n", result.stdout());
        assertEquals("warn\n", result.stderr());
        assertFalse(result.succeeded());
    }

    @Test
    void timesOut() {
        ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofMillis(200));

        IOException e = assertThrows(IOException.class, () -> runner.run(List.of("sleep", "5")));
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void missingExecutableIsAnIOException() {
        ProcessCommandRunner runner = new ProcessCommandRunner(Duration.ofSeconds(1));

        assertThrows(IOException.class, () -> runner.run(List.of("/nonexistent/sbatch")));
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessCommandRunner(Duration.ZERO));
    }
}
