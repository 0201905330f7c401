package batchkeeper.coordinator.service;

import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobStatus;
import batchkeeper.coordinator.model.JobUpdate;
import batchkeeper.coordinator.service.DependencyResolver.Readiness;
import batchkeeper.coordinator.store.Database;
import batchkeeper.coordinator.store.JdbcDependencyRepository;
import batchkeeper.coordinator.store.JdbcJobRepository;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private static Database db;
    private static JdbcJobRepository jobs;
    private static DependencyResolver resolver;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-resolver;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        jobs = new JdbcJobRepository(db);
        resolver = new DependencyResolver(jobs, new JdbcDependencyRepository(db));
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM dependencies");
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    private static Job.Builder job(String id) {
        return Job.builder().id(id).name(id).command("run " + id).runDirectory("/runs/" + id);
    }

    private static Job create(Job.Builder builder, DependencyEdge... edges) {
        Job job = builder.build();
        jobs.create(job, List.of(edges));
        return job;
    }

    @Test
    void jobWithoutDependenciesIsEligible() {
        assertEquals(Readiness.ELIGIBLE, resolver.readiness(create(job("a"))));
    }

    @Test
    void afterOk() {
        create(job("a").status(JobStatus.RUNNING));
        Job b = create(job("b"), DependencyEdge.afterOk("b", "a"));
        assertEquals(Readiness.WAITING, resolver.readiness(b));

        setStatus("a", JobStatus.COMPLETED);
        assertEquals(Readiness.ELIGIBLE, resolver.readiness(b));

        setStatus("a", JobStatus.FAILED);
        assertEquals(Readiness.BLOCKED, resolver.readiness(b));

        setStatus("a", JobStatus.CANCELLED);
        assertEquals(Readiness.BLOCKED, resolver.readiness(b));
    }

    @Test
    void afterFail() {
        create(job("a").status(JobStatus.FAILED));
        Job b = create(job("b"), DependencyEdge.afterFail("b", "a"));
        assertEquals(Readiness.ELIGIBLE, resolver.readiness(b));

        setStatus("a", JobStatus.COMPLETED);
        assertEquals(Readiness.BLOCKED, resolver.readiness(b));
    }

    @Test
    void afterAnyAcceptsEveryTerminalOutcome() {
        create(job("a").status(JobStatus.QUEUED));
        Job b = create(job("b"), DependencyEdge.afterAny("b", "a"));
        assertEquals(Readiness.WAITING, resolver.readiness(b));

        for (JobStatus status : List.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED)) {
            setStatus("a", status);
            assertEquals(Readiness.ELIGIBLE, resolver.readiness(b), status.name());
        }
    }

    @Test
    void failureWithRetriesLeftIsStillActive() {
        create(job("a").status(JobStatus.FAILED).maxRetries(1));
        Job ok = create(job("ok"), DependencyEdge.afterOk("ok", "a"));
        Job onFail = create(job("onfail"), DependencyEdge.afterFail("onfail", "a"));

        assertEquals(Readiness.WAITING, resolver.readiness(ok));
        assertEquals(Readiness.WAITING, resolver.readiness(onFail));
    }

    @Test
    void newestAttemptDecides() {
        create(job("a").status(JobStatus.FAILED).maxRetries(1));
        Job b = create(job("b"), DependencyEdge.afterOk("b", "a"));
        create(job("a-r1").parentJobId("a").retryCount(1).maxRetries(1).status(JobStatus.COMPLETED));

        assertEquals(Readiness.ELIGIBLE, resolver.readiness(b));
        assertEquals(List.of("b"), ids(resolver.eligibleDependents(jobs.get("a-r1"))));
    }

    @Test
    void exhaustedRetriesReleaseAfterFail() {
        create(job("a").status(JobStatus.FAILED).maxRetries(1));
        Job b = create(job("b"), DependencyEdge.afterFail("b", "a"));
        create(job("a-r1").parentJobId("a").retryCount(1).maxRetries(1).status(JobStatus.FAILED));

        assertEquals(Readiness.ELIGIBLE, resolver.readiness(b));
    }

    @Test
    void waitingWinsOverBlocked() {
        create(job("a").status(JobStatus.FAILED));
        create(job("c").status(JobStatus.RUNNING));
        Job b = create(job("b"), DependencyEdge.afterOk("b", "a"), DependencyEdge.afterOk("b", "c"));

        assertEquals(Readiness.WAITING, resolver.readiness(b));
    }

    @Test
    void deletedPredecessorBlocks() {
        create(job("a").status(JobStatus.COMPLETED));
        Job b = create(job("b"), DependencyEdge.afterAny("b", "a"));

        jobs.delete("a");

        assertEquals(Readiness.BLOCKED, resolver.readiness(b));
    }

    @Test
    void diamondReleasesJoinOnlyWhenBothBranchesComplete() {
        create(job("a").status(JobStatus.COMPLETED));
        create(job("b").status(JobStatus.COMPLETED), DependencyEdge.afterOk("b", "a"));
        create(job("c").status(JobStatus.RUNNING), DependencyEdge.afterOk("c", "a"));
        create(job("d"), DependencyEdge.afterOk("d", "b"), DependencyEdge.afterOk("d", "c"));

        assertTrue(resolver.eligibleDependents(jobs.get("b")).isEmpty());

        setStatus("c", JobStatus.COMPLETED);
        assertEquals(List.of("d"), ids(resolver.eligibleDependents(jobs.get("c"))));
    }

    @Test
    void blockedPredecessorBlocksTheWholeChain() {
        create(job("a").status(JobStatus.FAILED));
        Job b = create(job("b"), DependencyEdge.afterOk("b", "a"));
        Job c = create(job("c"), DependencyEdge.afterOk("c", "b"));
        Job d = create(job("d"), DependencyEdge.afterAny("d", "c"));

        assertEquals(Readiness.BLOCKED, resolver.readiness(b));
        assertEquals(Readiness.BLOCKED, resolver.readiness(c));
        assertEquals(Readiness.BLOCKED, resolver.readiness(d));
        assertEquals(DependencyResolver.Outcome.BLOCKED, resolver.effectiveOutcome("b"));
    }

    @Test
    void pendingPredecessorStillWaitingKeepsChainWaiting() {
        create(job("a").status(JobStatus.RUNNING));
        create(job("b"), DependencyEdge.afterOk("b", "a"));
        Job c = create(job("c"), DependencyEdge.afterOk("c", "b"));

        assertEquals(Readiness.WAITING, resolver.readiness(c));

        setStatus("a", JobStatus.CANCELLED);
        assertEquals(Readiness.BLOCKED, resolver.readiness(c));
    }

    @Test
    void onlyPendingDependentsAreReturned() {
        create(job("a").status(JobStatus.COMPLETED));
        create(job("b").status(JobStatus.QUEUED), DependencyEdge.afterOk("b", "a"));
        create(job("c"), DependencyEdge.afterOk("c", "a"));

        assertEquals(List.of("c"), ids(resolver.eligibleDependents(jobs.get("a"))));
    }

    private static void setStatus(String id, JobStatus status) {
        jobs.update(id, JobUpdate.create().status(status));
    }

    private static List<String> ids(List<Job> list) {
        return list.stream().map(Job::id).toList();
    }
}
