package batchkeeper.coordinator.config;

import batchkeeper.coordinator.backend.BackendSettings;
import batchkeeper.coordinator.backend.BackendType;
import batchkeeper.coordinator.tracking.FailureDetector;
import batchkeeper.coordinator.tracking.InspectorSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for the job keeper.
 * All settings have sensible defaults.
 */
public final class KeeperConfig {

    private static final String H2_OPTIONS = ";AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";

    // Store settings
    private String databaseUrl; // derived from rootDirectory when unset
    private int databasePoolSize = 4;

    // Keeper settings
    private Path rootDirectory = Path.of("batchkeeper");
    private int defaultMaxRetries = 0;
    private Duration pollInterval = Duration.ofSeconds(30);
    private Duration sweepInterval = Duration.ofSeconds(60);

    // Scheduler settings
    private BackendType backendType; // null = detect from PATH
    private Duration commandTimeout = Duration.ofSeconds(60);
    private List<String> extraDirectives = new ArrayList<>();
    private List<String> modules = new ArrayList<>();
    private Map<String, String> schedulerEnv = new LinkedHashMap<>();
    private BackendSettings.PbsResourceStyle pbsResourceStyle = BackendSettings.PbsResourceStyle.SELECT;

    // Inspector settings
    private int tailLines = InspectorSettings.DEFAULT_TAIL_LINES;
    private int whitelistThreshold = InspectorSettings.DEFAULT_THRESHOLD;
    private boolean caseSensitive = false;
    private List<String> whitelist = new ArrayList<>();
    private List<String> customPatterns = new ArrayList<>();
    private List<String> oomPatterns = new ArrayList<>(InspectorSettings.DEFAULT_OOM_PATTERNS);
    private int maxReportedLines = FailureDetector.DEFAULT_MAX_REPORTED_LINES;

    private KeeperConfig() {
    }

    public static KeeperConfig defaults() {
        return new KeeperConfig();
    }

    public static KeeperConfig fromEnv() {
        return applyEnv(new KeeperConfig(), System.getenv());
    }

    /**
     * Override settings from {@code BATCHKEEPER_*} variables.
     */
    static KeeperConfig applyEnv(KeeperConfig config, Map<String, String> env) {
        String dbUrl = env.get("BATCHKEEPER_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String root = env.get("BATCHKEEPER_ROOT");
        if (root != null && !root.isBlank()) {
            config.rootDirectory = Path.of(root);
        }

        String scheduler = env.get("BATCHKEEPER_SCHEDULER");
        if (scheduler != null && !scheduler.isBlank()) {
            config.backendType = BackendType.parse(scheduler).orElse(null);
        }

        String maxRetries = env.get("BATCHKEEPER_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            config.withMaxRetries(Integer.parseInt(maxRetries.trim()));
        }

        String pollSeconds = env.get("BATCHKEEPER_POLL_INTERVAL");
        if (pollSeconds != null && !pollSeconds.isBlank()) {
            config.pollInterval = Duration.ofSeconds(Long.parseLong(pollSeconds.trim()));
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        if (databaseUrl != null) {
            return databaseUrl;
        }
        return "jdbc:h2:file:" + rootDirectory.toAbsolutePath().resolve("batchkeeper") + H2_OPTIONS;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Path rootDirectory() {
        return rootDirectory;
    }

    /** Directory holding one run directory per job. */
    public Path runsDirectory() {
        return rootDirectory.toAbsolutePath().resolve("runs");
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration sweepInterval() {
        return sweepInterval;
    }

    public BackendType backendType() {
        return backendType;
    }

    public Duration commandTimeout() {
        return commandTimeout;
    }

    public int maxReportedLines() {
        return maxReportedLines;
    }

    public BackendSettings backendSettings() {
        return new BackendSettings(extraDirectives, modules, schedulerEnv, pbsResourceStyle);
    }

    public InspectorSettings inspectorSettings() {
        return new InspectorSettings(tailLines, whitelistThreshold, caseSensitive, whitelist, customPatterns,
                oomPatterns);
    }

    // Fluent setters for testing/customization
    public KeeperConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public KeeperConfig withDatabasePoolSize(int poolSize) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("pool size must be >= 1");
        }
        this.databasePoolSize = poolSize;
        return this;
    }

    public KeeperConfig withRootDirectory(Path root) {
        this.rootDirectory = root;
        return this;
    }

    public KeeperConfig withMaxRetries(int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("max retries must be >= 0");
        }
        this.defaultMaxRetries = retries;
        return this;
    }

    public KeeperConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public KeeperConfig withSweepInterval(Duration interval) {
        this.sweepInterval = interval;
        return this;
    }

    public KeeperConfig withBackendType(BackendType type) {
        this.backendType = type;
        return this;
    }

    public KeeperConfig withCommandTimeout(Duration timeout) {
        this.commandTimeout = timeout;
        return this;
    }

    public KeeperConfig withExtraDirectives(List<String> directives) {
        this.extraDirectives = new ArrayList<>(directives);
        return this;
    }

    public KeeperConfig withModules(List<String> modules) {
        this.modules = new ArrayList<>(modules);
        return this;
    }

    public KeeperConfig withSchedulerEnv(Map<String, String> env) {
        this.schedulerEnv = new LinkedHashMap<>(env);
        return this;
    }

    public KeeperConfig withPbsResourceStyle(BackendSettings.PbsResourceStyle style) {
        this.pbsResourceStyle = style;
        return this;
    }

    public KeeperConfig withTailLines(int lines) {
        this.tailLines = lines;
        return this;
    }

    public KeeperConfig withWhitelistThreshold(int threshold) {
        this.whitelistThreshold = threshold;
        return this;
    }

    public KeeperConfig withCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
        return this;
    }

    public KeeperConfig withWhitelist(List<String> entries) {
        this.whitelist = new ArrayList<>(entries);
        return this;
    }

    public KeeperConfig withCustomPatterns(List<String> patterns) {
        this.customPatterns = new ArrayList<>(patterns);
        return this;
    }

    public KeeperConfig withOomPatterns(List<String> patterns) {
        this.oomPatterns = new ArrayList<>(patterns);
        return this;
    }

    public KeeperConfig withMaxReportedLines(int lines) {
        this.maxReportedLines = lines;
        return this;
    }

    @Override
    public String toString() {
        return "KeeperConfig{" +
                "databaseUrl='" + databaseUrl() + '\'' +
                ", root=" + rootDirectory +
                ", scheduler=" + (backendType != null ? backendType : "auto") +
                ", maxRetries=" + defaultMaxRetries +
                ", pollInterval=" + pollInterval +
                '}';
    }
}
