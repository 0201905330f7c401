package batchkeeper.coordinator.config;

import batchkeeper.coordinator.backend.BackendType;
import batchkeeper.coordinator.backend.CommandRunner;
import batchkeeper.coordinator.backend.ProcessCommandRunner;
import batchkeeper.coordinator.backend.SchedulerBackend;
import batchkeeper.coordinator.backend.ToolProbe;
import batchkeeper.coordinator.export.StateExporter;
import batchkeeper.coordinator.repository.DependencyRepository;
import batchkeeper.coordinator.repository.JobRepository;
import batchkeeper.coordinator.scheduler.Scheduler;
import batchkeeper.coordinator.service.DependencyResolver;
import batchkeeper.coordinator.service.JobService;
import batchkeeper.coordinator.store.Database;
import batchkeeper.coordinator.store.JdbcDependencyRepository;
import batchkeeper.coordinator.store.JdbcJobRepository;
import batchkeeper.coordinator.tracking.FailureDetector;
import batchkeeper.coordinator.tracking.LogInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(KeeperConfig.fromEnv());
 * deps.startScheduler(); // background tracking sweep
 * JobService jobs = deps.jobService();
 * // ... submit, monitor ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final KeeperConfig config;
    private final Database database;
    private final JobRepository jobRepository;
    private final DependencyRepository dependencyRepository;
    private final SchedulerBackend backend;
    private final LogInspector inspector;
    private final FailureDetector failureDetector;
    private final DependencyResolver resolver;
    private final StateExporter exporter;
    private final JobService jobService;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(KeeperConfig config, SchedulerBackend backend) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.jobRepository = new JdbcJobRepository(database);
        this.dependencyRepository = new JdbcDependencyRepository(database);

        // Tracking
        this.backend = backend;
        this.inspector = new LogInspector(config.inspectorSettings());
        this.failureDetector = new FailureDetector(inspector, config.maxReportedLines());

        // Services
        this.resolver = new DependencyResolver(jobRepository, dependencyRepository);
        this.exporter = new StateExporter(jobRepository, dependencyRepository);
        this.jobService = new JobService(jobRepository, backend, inspector, failureDetector, resolver, exporter,
                config);

        log.info("Dependencies initialized with {} backend", backend.type());
    }

    /**
     * Create dependencies with the given config, selecting the scheduler from
     * the config or from the tools found on {@code PATH}.
     *
     * @throws IllegalStateException if no usable scheduler is installed
     */
    public static Dependencies create(KeeperConfig config) {
        return new Dependencies(config, selectBackend(config, ToolProbe.fromEnvironment(),
                new ProcessCommandRunner(config.commandTimeout())));
    }

    /**
     * Create dependencies around an already built backend.
     */
    public static Dependencies create(KeeperConfig config, SchedulerBackend backend) {
        return new Dependencies(config, backend);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(KeeperConfig.fromEnv());
    }

    static SchedulerBackend selectBackend(KeeperConfig config, ToolProbe probe, CommandRunner runner) {
        BackendType type = config.backendType() != null
                ? config.backendType()
                : BackendType.detect(probe).orElseThrow(() -> new IllegalStateException(
                        "No batch scheduler found on PATH (need sbatch or qsub)"));
        SchedulerBackend backend = type.create(runner, probe, config.backendSettings());
        if (!backend.available()) {
            throw new IllegalStateException(type + " tools are not available on PATH");
        }
        return backend;
    }

    // Getters
    public KeeperConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobRepository jobRepository() {
        return jobRepository;
    }

    public DependencyRepository dependencyRepository() {
        return dependencyRepository;
    }

    public SchedulerBackend backend() {
        return backend;
    }

    public LogInspector inspector() {
        return inspector;
    }

    public FailureDetector failureDetector() {
        return failureDetector;
    }

    public DependencyResolver resolver() {
        return resolver;
    }

    public StateExporter exporter() {
        return exporter;
    }

    public JobService jobService() {
        return jobService;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(jobService, config);
        }
        return scheduler;
    }

    /**
     * Start the background tracking sweep.
     */
    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Stop the background scheduler.
     */
    public synchronized void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        try {
            stopScheduler();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
