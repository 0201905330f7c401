package batchkeeper.coordinator.store;

import batchkeeper.coordinator.config.KeeperConfig;
import batchkeeper.coordinator.error.StoreException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Database connection pool, schema management and transaction helpers.
 * Uses HikariCP for connection pooling; connections are not auto-commit.
 *
 * <p>
 * Writes issued through {@link #inTransaction} are serialized inside this
 * process. Other processes sharing the same file rely on H2's own locking.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    /**
     * Unit of JDBC work executed on a pooled connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private final HikariDataSource dataSource;
    private final ReentrantLock writeLock = new ReentrantLock();

    public Database(KeeperConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("batchkeeper-db-pool");
        hikariConfig.setAutoCommit(false);

        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Run read-only work on a pooled connection.
     *
     * @param description what is being done, used in the error message
     */
    public <T> T query(String description, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw new StoreException("Failed to " + description, e);
        }
    }

    /**
     * Run work in a single transaction: commit on success, roll back on any
     * exception. {@link SQLException}s are rethrown as {@link StoreException};
     * runtime exceptions thrown by the work pass through unchanged after the
     * rollback.
     *
     * @param description what is being done, used in the error message
     */
    public <T> T inTransaction(String description, SqlWork<T> work) {
        writeLock.lock();
        try (Connection conn = getConnection()) {
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + description, e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(128) PRIMARY KEY,
                            name            VARCHAR(256) NOT NULL,
                            command         CLOB NOT NULL,
                            working_dir     VARCHAR(4096) NOT NULL,
                            run_dir         VARCHAR(4096) NOT NULL,
                            resources       CLOB NOT NULL,
                            env             CLOB NOT NULL,
                            expected_files  CLOB NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            backend_id      VARCHAR(128),
                            exit_code       INT,
                            created_at      TIMESTAMP WITH TIME ZONE NOT NULL,
                            submitted_at    TIMESTAMP WITH TIME ZONE,
                            started_at      TIMESTAMP WITH TIME ZONE,
                            completed_at    TIMESTAMP WITH TIME ZONE,
                            failure_kind    VARCHAR(20),
                            failure_reason  CLOB,
                            error_lines     CLOB NOT NULL,
                            retry_count     INT DEFAULT 0 NOT NULL,
                            max_retries     INT DEFAULT 0 NOT NULL,
                            parent_job_id   VARCHAR(128)
                        );
                    """);

            // ---------- DEPENDENCIES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS dependencies (
                            dependent_id    VARCHAR(128) NOT NULL,
                            predecessor_id  VARCHAR(128) NOT NULL,
                            kind            VARCHAR(20) NOT NULL,
                            PRIMARY KEY (dependent_id, predecessor_id, kind)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_backend_id ON jobs(backend_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_created_at ON jobs(created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_parent ON jobs(parent_job_id, retry_count);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_dependencies_predecessor ON dependencies(predecessor_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
