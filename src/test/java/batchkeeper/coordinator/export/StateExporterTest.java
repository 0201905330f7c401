package batchkeeper.coordinator.export;

import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.FailureKind;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobStatus;
import batchkeeper.coordinator.store.Database;
import batchkeeper.coordinator.store.JdbcDependencyRepository;
import batchkeeper.coordinator.store.JdbcJobRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateExporterTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static StateExporter exporter;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-export;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        jobs = new JdbcJobRepository(db);
        exporter = new StateExporter(jobs, new JdbcDependencyRepository(db));

        Instant t0 = Instant.parse("2026-05-01T08:00:00Z");
        jobs.create(Job.builder()
                .id("job-prep")
                .name("prep")
                .command("./prep")
                .runDirectory("/runs/job-prep")
                .status(JobStatus.FAILED)
                .exitCode(1)
                .failureKind(FailureKind.EXIT_CODE)
                .failureReason("exit code 1")
                .createdAt(t0)
                .build());
        jobs.create(Job.builder()
                .id("job-fit")
                .name("fit")
                .command("./fit")
                .runDirectory("/runs/job-fit")
                .createdAt(t0.plusSeconds(5))
                .build(), List.of(DependencyEdge.afterAny("job-fit", "job-prep")));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @Test
    void snapshotListsNewestFirst() {
        StateSnapshot snapshot = exporter.snapshot();

        assertEquals(2, snapshot.totalJobs());
        assertEquals("job-fit", snapshot.jobs().get(0).id());
        assertEquals(List.of(new JobSnapshot.Dependency("job-prep", "after_any")),
                snapshot.jobs().get(0).dependencies());
        assertEquals("failed", snapshot.jobs().get(1).status());
        assertEquals("exit_code", snapshot.jobs().get(1).failureKind());
    }

    @Test
    void jsonDocument() throws Exception {
        JsonNode root = new ObjectMapper().readTree(exporter.exportJson());

        assertEquals(2, root.get("totalJobs").asInt());
        assertTrue(root.hasNonNull("exportedAt"));
        JsonNode fit = root.get("jobs").get(0);
        assertEquals("pending", fit.get("status").asText());
        assertEquals("2026-05-01T08:00:05Z", fit.get("createdAt").asText());
        assertEquals("4GB", fit.get("resources").get("memory").asText());
        // unset fields are left out
        assertFalse(fit.has("backendId"));
        assertFalse(fit.has("failureKind"));
    }

    @Test
    void exportWritesFile(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("nested/state.json");

        exporter.export(target);

        JsonNode root = new ObjectMapper().readTree(target.toFile());
        assertEquals(2, root.get("jobs").size());
    }
}
