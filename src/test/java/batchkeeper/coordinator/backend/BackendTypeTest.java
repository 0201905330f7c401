package batchkeeper.coordinator.backend;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BackendTypeTest {

    @TempDir
    Path bin;

    private void install(Path dir, String... tools) throws IOException {
        Files.createDirectories(dir);
        for (String tool : tools) {
            Path file = Files.writeString(dir.resolve(tool), "#!/bin/sh\nexit 0\n");
            assertTrue(file.toFile().setExecutable(true));
        }
    }

    @Test
    void parsesConfigValues() {
        assertEquals(Optional.of(BackendType.SLURM), BackendType.parse("slurm"));
        assertEquals(Optional.of(BackendType.PBS), BackendType.parse(" PBS "));
        assertEquals(Optional.of(BackendType.PBS), BackendType.parse("torque"));
        assertEquals(Optional.empty(), BackendType.parse("auto"));
        assertEquals(Optional.empty(), BackendType.parse(""));
        assertThrows(IllegalArgumentException.class, () -> BackendType.parse("lsf"));
    }

    @Test
    void probeFindsExecutablesAcrossPathEntries() throws IOException {
        install(bin.resolve("a"), "sbatch", "squeue");
        install(bin.resolve("b"), "sacct");
        ToolProbe probe = new ToolProbe(bin.resolve("a") + File.pathSeparator + bin.resolve("b"));

        assertTrue(probe.isAvailable("sbatch"));
        assertTrue(probe.isAvailable("sacct"));
        assertFalse(probe.isAvailable("scancel"));
        assertEquals(List.of("scancel"), probe.missing(SlurmBackend.REQUIRED_TOOLS));
        assertFalse(probe.hasAll(SlurmBackend.REQUIRED_TOOLS));
    }

    @Test
    void detectsPbsWhenSlurmIsIncomplete() throws IOException {
        install(bin, "sbatch", "qsub", "qstat", "qdel");

        ToolProbe probe = new ToolProbe(bin.toString());

        assertEquals(Optional.of(BackendType.PBS), BackendType.detect(probe));
        assertTrue(BackendType.PBS.create(command -> CommandResult.ok(""), probe, BackendSettings.defaults())
                .available());
    }

    @Test
    void prefersSlurmWhenBothAreInstalled() throws IOException {
        install(bin, "sbatch", "squeue", "sacct", "scancel", "qsub", "qstat", "qdel");

        assertEquals(Optional.of(BackendType.SLURM), BackendType.detect(new ToolProbe(bin.toString())));
    }

    @Test
    void detectsNothingOnEmptyPath() {
        assertEquals(Optional.empty(), BackendType.detect(new ToolProbe("")));
        assertEquals(Optional.empty(), BackendType.detect(new ToolProbe(null)));
    }
}
