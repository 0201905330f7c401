package batchkeeper.coordinator.store;

import batchkeeper.coordinator.error.ConflictException;
import batchkeeper.coordinator.error.NotFoundException;
import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.FailureKind;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobFilter;
import batchkeeper.coordinator.model.JobStatus;
import batchkeeper.coordinator.model.JobUpdate;
import batchkeeper.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void create(Job job, Collection<DependencyEdge> edges) {
        for (DependencyEdge edge : edges) {
            if (!edge.dependentId().equals(job.id())) {
                throw new IllegalArgumentException("Edge " + edge + " does not belong to job " + job.id());
            }
        }
        db.inTransaction("create job " + job.id(), conn -> {
            insert(conn, job);
            JdbcDependencyRepository.insertEdges(conn, edges);
            return null;
        });
        log.debug("Created job {} with {} dependencies", job.id(), edges.size());
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return db.query("find job " + jobId, conn -> findById(conn, jobId));
    }

    @Override
    public void update(String jobId, JobUpdate update) {
        db.inTransaction("update job " + jobId, conn -> {
            if (applyUpdate(conn, jobId, Set.of(), update) == 0) {
                throw new NotFoundException(jobId);
            }
            return null;
        });
    }

    @Override
    public boolean updateIfStatus(String jobId, Set<JobStatus> expected, JobUpdate update) {
        if (expected.isEmpty()) {
            throw new IllegalArgumentException("expected statuses must not be empty");
        }
        return db.inTransaction("update job " + jobId, conn -> {
            if (applyUpdate(conn, jobId, expected, update) > 0) {
                return true;
            }
            if (findById(conn, jobId).isEmpty()) {
                throw new NotFoundException(jobId);
            }
            return false;
        });
    }

    @Override
    public List<Job> list(JobFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT * FROM jobs WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (!filter.statuses().isEmpty()) {
            sql.append(" AND status IN (").append(placeholders(filter.statuses().size())).append(')');
            filter.statuses().forEach(s -> params.add(s.name()));
        }
        if (filter.backendId() != null) {
            sql.append(" AND backend_id = ?");
            params.add(filter.backendId());
        }
        if (filter.parentJobId() != null) {
            sql.append(" AND parent_job_id = ?");
            params.add(filter.parentJobId());
        }
        if (filter.createdAfter() != null) {
            sql.append(" AND created_at > ?");
            params.add(toTimestamp(filter.createdAfter()));
        }
        sql.append(" ORDER BY created_at DESC, id DESC");
        if (filter.limit() > 0) {
            sql.append(" LIMIT ").append(filter.limit());
        }

        return db.query("list jobs", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
                for (int i = 0; i < params.size(); i++) {
                    ps.setObject(i + 1, params.get(i));
                }
                return executeQuery(ps);
            }
        });
    }

    @Override
    public Optional<Job> findLatestAttempt(String rootId) {
        String sql = """
                    SELECT * FROM jobs WHERE id = ? OR parent_job_id = ?
                    ORDER BY retry_count DESC, created_at DESC
                    LIMIT 1
                """;
        return db.query("find latest attempt of " + rootId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, rootId);
                ps.setString(2, rootId);
                return executeQuery(ps).stream().findFirst();
            }
        });
    }

    @Override
    public boolean delete(String jobId) {
        return db.inTransaction("delete job " + jobId, conn -> {
            JdbcDependencyRepository.deleteIncoming(conn, jobId);
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                ps.setString(1, jobId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID().toString().substring(0, 8);
    }

    // --- Helpers ---

    private void insert(Connection conn, Job job) throws SQLException {
        String sql = """
                    INSERT INTO jobs (id, name, command, working_dir, run_dir, resources, env, expected_files,
                                      status, backend_id, exit_code, created_at, submitted_at, started_at,
                                      completed_at, failure_kind, failure_reason, error_lines, retry_count,
                                      max_retries, parent_job_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, job.id());
            ps.setString(2, job.name());
            ps.setString(3, job.command());
            ps.setString(4, job.workingDirectory());
            ps.setString(5, job.runDirectory());
            ps.setString(6, JsonColumns.writeResources(job.resources()));
            ps.setString(7, JsonColumns.writeMap(job.env()));
            ps.setString(8, JsonColumns.writeList(job.expectedFiles()));
            ps.setString(9, job.status().name());
            ps.setString(10, job.backendId());
            setInteger(ps, 11, job.exitCode());
            ps.setObject(12, toTimestamp(job.createdAt() != null ? job.createdAt() : Instant.now()));
            ps.setObject(13, toTimestamp(job.submittedAt()));
            ps.setObject(14, toTimestamp(job.startedAt()));
            ps.setObject(15, toTimestamp(job.completedAt()));
            ps.setString(16, job.failureKind() != null ? job.failureKind().name() : null);
            ps.setString(17, job.failureReason());
            ps.setString(18, JsonColumns.writeList(job.errorLines()));
            ps.setInt(19, job.retryCount());
            ps.setInt(20, job.maxRetries());
            ps.setString(21, job.parentJobId());
            ps.executeUpdate();
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new ConflictException(job.id(), e);
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new ConflictException(job.id(), e);
            }
            throw e;
        }
    }

    private int applyUpdate(Connection conn, String jobId, Set<JobStatus> expected, JobUpdate update)
            throws SQLException {
        if (update.isEmpty()) {
            throw new IllegalArgumentException("Empty update for job " + jobId);
        }
        StringBuilder sql = new StringBuilder("UPDATE jobs SET ");
        List<Map.Entry<JobUpdate.Field, Object>> entries = new ArrayList<>(update.values().entrySet());
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(column(entries.get(i).getKey())).append(" = ?");
        }
        sql.append(" WHERE id = ?");
        if (!expected.isEmpty()) {
            sql.append(" AND status IN (").append(placeholders(expected.size())).append(')');
        }

        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            int index = 1;
            for (Map.Entry<JobUpdate.Field, Object> entry : entries) {
                bind(ps, index++, entry.getKey(), entry.getValue());
            }
            ps.setString(index++, jobId);
            for (JobStatus status : expected) {
                ps.setString(index++, status.name());
            }
            return ps.executeUpdate();
        }
    }

    private static String column(JobUpdate.Field field) {
        return switch (field) {
            case STATUS -> "status";
            case BACKEND_ID -> "backend_id";
            case EXIT_CODE -> "exit_code";
            case SUBMITTED_AT -> "submitted_at";
            case STARTED_AT -> "started_at";
            case COMPLETED_AT -> "completed_at";
            case FAILURE_KIND -> "failure_kind";
            case FAILURE_REASON -> "failure_reason";
            case ERROR_LINES -> "error_lines";
        };
    }

    private static void bind(PreparedStatement ps, int index, JobUpdate.Field field, Object value)
            throws SQLException {
        switch (field) {
            case STATUS -> ps.setString(index, ((JobStatus) value).name());
            case BACKEND_ID, FAILURE_REASON -> ps.setString(index, (String) value);
            case EXIT_CODE -> setInteger(ps, index, (Integer) value);
            case SUBMITTED_AT, STARTED_AT, COMPLETED_AT -> ps.setObject(index, toTimestamp((Instant) value));
            case FAILURE_KIND -> ps.setString(index, value != null ? ((FailureKind) value).name() : null);
            case ERROR_LINES -> ps.setString(index, JsonColumns.writeList((List<?>) value));
        }
    }

    private Optional<Job> findById(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM jobs WHERE id = ?")) {
            ps.setString(1, jobId);
            return executeQuery(ps).stream().findFirst();
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> jobs = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                jobs.add(mapRow(rs));
            }
        }
        return jobs;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        String failureKind = rs.getString("failure_kind");
        int exitCode = rs.getInt("exit_code");
        Integer exit = rs.wasNull() ? null : exitCode;

        return Job.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .command(rs.getString("command"))
                .workingDirectory(rs.getString("working_dir"))
                .runDirectory(rs.getString("run_dir"))
                .resources(JsonColumns.readResources(rs.getString("resources")))
                .env(JsonColumns.readMap(rs.getString("env")))
                .expectedFiles(JsonColumns.readList(rs.getString("expected_files")))
                .status(JobStatus.valueOf(rs.getString("status")))
                .backendId(rs.getString("backend_id"))
                .exitCode(exit)
                .createdAt(toInstant(rs, "created_at"))
                .submittedAt(toInstant(rs, "submitted_at"))
                .startedAt(toInstant(rs, "started_at"))
                .completedAt(toInstant(rs, "completed_at"))
                .failureKind(failureKind != null ? FailureKind.valueOf(failureKind) : null)
                .failureReason(rs.getString("failure_reason"))
                .errorLines(JsonColumns.readList(rs.getString("error_lines")))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .parentJobId(rs.getString("parent_job_id"))
                .build();
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }

    private static Instant toInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
