package batchkeeper.coordinator.config;

import batchkeeper.coordinator.backend.BackendType;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeeperConfigTest {

    @Test
    void defaults() {
        KeeperConfig config = KeeperConfig.defaults();

        assertEquals(0, config.defaultMaxRetries());
        assertEquals(Duration.ofSeconds(30), config.pollInterval());
        assertEquals(Duration.ofSeconds(60), config.sweepInterval());
        assertEquals(Duration.ofSeconds(60), config.commandTimeout());
        assertNull(config.backendType());
        assertEquals(Path.of("batchkeeper").toAbsolutePath().resolve("runs"), config.runsDirectory());
    }

    @Test
    void databaseUrlFollowsRootDirectory() {
        KeeperConfig config = KeeperConfig.defaults().withRootDirectory(Path.of("/data/pipeline"));

        assertEquals("jdbc:h2:file:/data/pipeline/batchkeeper;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE",
                config.databaseUrl());
        assertEquals("jdbc:h2:mem:x", config.withDatabaseUrl("jdbc:h2:mem:x").databaseUrl());
    }

    @Test
    void environmentOverrides() {
        KeeperConfig config = KeeperConfig.applyEnv(KeeperConfig.defaults(), Map.of(
                "BATCHKEEPER_ROOT", "/data/run",
                "BATCHKEEPER_SCHEDULER", "slurm",
                "BATCHKEEPER_MAX_RETRIES", "3",
                "BATCHKEEPER_POLL_INTERVAL", "10"));

        assertEquals(Path.of("/data/run"), config.rootDirectory());
        assertEquals(BackendType.SLURM, config.backendType());
        assertEquals(3, config.defaultMaxRetries());
        assertEquals(Duration.ofSeconds(10), config.pollInterval());
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        KeeperConfig config = KeeperConfig.applyEnv(KeeperConfig.defaults(), Map.of(
                "BATCHKEEPER_DB_URL", " ",
                "BATCHKEEPER_MAX_RETRIES", ""));

        assertEquals(0, config.defaultMaxRetries());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:file:"));
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> KeeperConfig.defaults().withMaxRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> KeeperConfig.defaults().withDatabasePoolSize(0));
    }
}
