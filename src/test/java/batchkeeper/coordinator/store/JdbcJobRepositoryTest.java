package batchkeeper.coordinator.store;

import batchkeeper.coordinator.config.KeeperConfig;
import batchkeeper.coordinator.error.ConflictException;
import batchkeeper.coordinator.error.NotFoundException;
import batchkeeper.coordinator.model.FailureKind;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobFilter;
import batchkeeper.coordinator.model.JobStatus;
import batchkeeper.coordinator.model.JobUpdate;
import batchkeeper.coordinator.model.ResourceRequest;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository repo;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        KeeperConfig config = KeeperConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-jobs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcJobRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM dependencies");
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    private static Job.Builder job(String id) {
        return Job.builder()
                .id(id)
                .name("step-" + id)
                .command("./run.sh " + id)
                .runDirectory("/scratch/runs/" + id)
                .createdAt(Instant.now().truncatedTo(ChronoUnit.MILLIS));
    }

    private static Job fullJob(String id) {
        Instant created = Instant.parse("2026-03-01T10:15:30.123Z");
        return job(id)
                .workingDirectory("/scratch/project")
                .resources(ResourceRequest.builder()
                        .nodes(2).cpus(16).gpus(1).memory("32GB").walltime("08:00:00").queue("gpu").account("astro")
                        .build())
                .env(Map.of("OMP_NUM_THREADS", "16", "RUN_TAG", "it's quoted"))
                .expectedFiles(List.of("out.h5", "plots/*.png"))
                .status(JobStatus.FAILED)
                .backendId("90210")
                .exitCode(137)
                .createdAt(created)
                .submittedAt(created.plusSeconds(1))
                .startedAt(created.plusSeconds(60))
                .completedAt(created.plusSeconds(3600))
                .failureKind(FailureKind.OOM)
                .failureReason("out of memory")
                .errorLines(List.of("slurmstepd: error: Detected 1 oom-kill event(s)"))
                .retryCount(1)
                .maxRetries(3)
                .parentJobId("job-root")
                .build();
    }

    private static void assertSameFields(Job expected, Job actual) {
        assertEquals(expected.id(), actual.id());
        assertEquals(expected.name(), actual.name());
        assertEquals(expected.command(), actual.command());
        assertEquals(expected.workingDirectory(), actual.workingDirectory());
        assertEquals(expected.runDirectory(), actual.runDirectory());
        assertEquals(expected.resources(), actual.resources());
        assertEquals(expected.env(), actual.env());
        assertEquals(expected.expectedFiles(), actual.expectedFiles());
        assertEquals(expected.status(), actual.status());
        assertEquals(expected.backendId(), actual.backendId());
        assertEquals(expected.exitCode(), actual.exitCode());
        assertEquals(expected.createdAt(), actual.createdAt());
        assertEquals(expected.submittedAt(), actual.submittedAt());
        assertEquals(expected.startedAt(), actual.startedAt());
        assertEquals(expected.completedAt(), actual.completedAt());
        assertEquals(expected.failureKind(), actual.failureKind());
        assertEquals(expected.failureReason(), actual.failureReason());
        assertEquals(expected.errorLines(), actual.errorLines());
        assertEquals(expected.retryCount(), actual.retryCount());
        assertEquals(expected.maxRetries(), actual.maxRetries());
        assertEquals(expected.parentJobId(), actual.parentJobId());
    }

    @Test
    void createAndFindById() {
        Job job = fullJob("job-full");

        repo.create(job);

        Optional<Job> found = repo.findById("job-full");
        assertTrue(found.isPresent());
        assertSameFields(job, found.get());
    }

    @Test
    void findMissingJob() {
        assertTrue(repo.findById("nope").isEmpty());
        NotFoundException e = assertThrows(NotFoundException.class, () -> repo.get("nope"));
        assertEquals("nope", e.jobId());
    }

    @Test
    void duplicateIdConflicts() {
        repo.create(job("job-a").build());

        assertThrows(ConflictException.class, () -> repo.create(job("job-a").command("other").build()));
        assertEquals("./run.sh job-a", repo.get("job-a").command());
    }

    @Test
    void updateWritesOnlyGivenFields() {
        repo.create(job("job-a").backendId("1").build());

        repo.update("job-a", JobUpdate.create().status(JobStatus.QUEUED).exitCode(null));

        Job updated = repo.get("job-a");
        assertEquals(JobStatus.QUEUED, updated.status());
        assertEquals("1", updated.backendId());
        assertNull(updated.exitCode());
    }

    @Test
    void updateMissingJobThrows() {
        assertThrows(NotFoundException.class,
                () -> repo.update("ghost", JobUpdate.create().status(JobStatus.RUNNING)));
    }

    @Test
    void updateIfStatusIsCompareAndSet() {
        repo.create(job("job-a").build());
        Instant submitted = Instant.now().truncatedTo(ChronoUnit.MILLIS);

        assertTrue(repo.updateIfStatus("job-a", EnumSet.of(JobStatus.PENDING),
                JobUpdate.create().status(JobStatus.QUEUED).backendId("77").submittedAt(submitted)));
        assertFalse(repo.updateIfStatus("job-a", EnumSet.of(JobStatus.PENDING),
                JobUpdate.create().status(JobStatus.QUEUED).backendId("78")));

        Job job = repo.get("job-a");
        assertEquals("77", job.backendId());
        assertEquals(submitted, job.submittedAt());
        assertThrows(NotFoundException.class, () -> repo.updateIfStatus("ghost", EnumSet.of(JobStatus.PENDING),
                JobUpdate.create().status(JobStatus.QUEUED)));
    }

    @Test
    void failureUpdateStoresErrorLines() {
        repo.create(job("job-a").status(JobStatus.RUNNING).build());

        repo.update("job-a", JobUpdate.create()
                .status(JobStatus.FAILED)
                .failure(FailureKind.LOG_ERROR, "found 2 error(s) in logs", List.of("ERROR one", "ERROR two")));

        Job job = repo.get("job-a");
        assertEquals(FailureKind.LOG_ERROR, job.failureKind());
        assertEquals(List.of("ERROR one", "ERROR two"), job.errorLines());
    }

    @Test
    void emptyUpdateIsRejected() {
        repo.create(job("job-a").build());

        assertThrows(IllegalArgumentException.class, () -> repo.update("job-a", JobUpdate.create()));
    }

    @Test
    void listFiltersNewestFirst() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        repo.create(job("job-1").createdAt(t0).build());
        repo.create(job("job-2").createdAt(t0.plusSeconds(10)).status(JobStatus.QUEUED).backendId("5").build());
        repo.create(job("job-3").createdAt(t0.plusSeconds(20)).status(JobStatus.FAILED).build());

        assertEquals(List.of("job-3", "job-2", "job-1"), ids(repo.list(JobFilter.all())));
        assertEquals(List.of("job-3", "job-1"),
                ids(repo.list(JobFilter.byStatus(JobStatus.PENDING, JobStatus.FAILED))));
        assertEquals(List.of("job-2"), ids(repo.list(JobFilter.builder().backendId("5").build())));
        assertEquals(List.of("job-3", "job-2"),
                ids(repo.list(JobFilter.builder().createdAfter(t0).build())));
        assertEquals(List.of("job-3"), ids(repo.list(JobFilter.builder().limit(1).build())));
    }

    @Test
    void latestAttemptOfChain() {
        repo.create(job("job-r").status(JobStatus.FAILED).maxRetries(2).build());
        assertEquals("job-r", repo.findLatestAttempt("job-r").orElseThrow().id());

        repo.create(job("job-r-r1").parentJobId("job-r").retryCount(1).maxRetries(2)
                .status(JobStatus.FAILED).build());
        repo.create(job("job-r-r2").parentJobId("job-r").retryCount(2).maxRetries(2).build());

        assertEquals("job-r-r2", repo.findLatestAttempt("job-r").orElseThrow().id());
        assertEquals(List.of("job-r-r2", "job-r-r1"),
                ids(repo.list(JobFilter.builder().parentJobId("job-r").build())));
        assertTrue(repo.findLatestAttempt("nothing").isEmpty());
    }

    @Test
    void deleteRemovesJob() {
        repo.create(job("job-a").build());

        assertTrue(repo.delete("job-a"));
        assertFalse(repo.delete("job-a"));
        assertTrue(repo.findById("job-a").isEmpty());
    }

    @Test
    void generatedIdsAreUnique() {
        String a = repo.generateId();
        String b = repo.generateId();

        assertTrue(a.matches("job-[0-9a-f]{8}"), a);
        assertNotEquals(a, b);
    }

    @Test
    void survivesReconnect(@TempDir Path dir) {
        String url = "jdbc:h2:file:" + dir.resolve("keeper").toAbsolutePath()
                + ";MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
        Job job = fullJob("job-durable");

        try (Database first = new Database(url, 2)) {
            new JdbcJobRepository(first).create(job);
        }

        try (Database second = new Database(url, 2)) {
            Job reloaded = new JdbcJobRepository(second).get("job-durable");
            assertSameFields(job, reloaded);
        }
    }

    private static List<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::id).toList();
    }
}
