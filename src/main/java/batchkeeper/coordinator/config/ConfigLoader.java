package batchkeeper.coordinator.config;

import batchkeeper.coordinator.backend.BackendSettings;
import batchkeeper.coordinator.backend.BackendType;
import org.ini4j.Config;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link KeeperConfig} from an INI file.
 * Supports sections [store], [keeper], [scheduler], [inspector]; all are optional
 * and missing keys keep their defaults.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String ENV_PREFIX = "env.";

    private ConfigLoader() {
    }

    public static KeeperConfig load(File file) throws IOException {
        return load(file, KeeperConfig.defaults());
    }

    /**
     * Apply the file on top of an existing config.
     *
     * @throws IOException              if the file cannot be read or is not valid INI
     * @throws IllegalArgumentException if a value has the wrong type
     */
    public static KeeperConfig load(File file, KeeperConfig config) throws IOException {
        Config iniConfig = new Config();
        iniConfig.setEscape(false); // regex backslashes must survive
        iniConfig.setMultiOption(true);
        Ini ini = new Ini();
        ini.setConfig(iniConfig);
        ini.load(file);

        Profile.Section store = ini.get("store");
        if (store != null) {
            String url = opt(store, "url");
            if (url != null) {
                config.withDatabaseUrl(url);
            }
            Integer poolSize = optInt(store, "pool_size");
            if (poolSize != null) {
                config.withDatabasePoolSize(poolSize);
            }
        }

        Profile.Section keeper = ini.get("keeper");
        if (keeper != null) {
            String root = opt(keeper, "root");
            if (root != null) {
                config.withRootDirectory(Path.of(root));
            }
            Integer maxRetries = optInt(keeper, "max_retries");
            if (maxRetries != null) {
                config.withMaxRetries(maxRetries);
            }
            Integer poll = optInt(keeper, "poll_interval_seconds");
            if (poll != null) {
                config.withPollInterval(Duration.ofSeconds(poll));
            }
            Integer sweep = optInt(keeper, "sweep_interval_seconds");
            if (sweep != null) {
                config.withSweepInterval(Duration.ofSeconds(sweep));
            }
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            String type = opt(scheduler, "type");
            if (type != null) {
                config.withBackendType(BackendType.parse(type).orElse(null));
            }
            Integer timeout = optInt(scheduler, "command_timeout_seconds");
            if (timeout != null) {
                config.withCommandTimeout(Duration.ofSeconds(timeout));
            }
            List<String> directives = all(scheduler, "directive");
            if (!directives.isEmpty()) {
                config.withExtraDirectives(directives);
            }
            List<String> modules = all(scheduler, "module");
            if (!modules.isEmpty()) {
                config.withModules(modules);
            }
            Map<String, String> env = new LinkedHashMap<>();
            for (String key : scheduler.keySet()) {
                if (key.startsWith(ENV_PREFIX) && key.length() > ENV_PREFIX.length()) {
                    env.put(key.substring(ENV_PREFIX.length()), scheduler.get(key).trim());
                }
            }
            if (!env.isEmpty()) {
                config.withSchedulerEnv(env);
            }
            String style = opt(scheduler, "pbs_resource_style");
            if (style != null) {
                config.withPbsResourceStyle(
                        BackendSettings.PbsResourceStyle.valueOf(style.toUpperCase(Locale.ROOT)));
            }
        }

        Profile.Section inspector = ini.get("inspector");
        if (inspector != null) {
            Integer tail = optInt(inspector, "tail_lines");
            if (tail != null) {
                config.withTailLines(tail);
            }
            Integer threshold = optInt(inspector, "threshold");
            if (threshold != null) {
                config.withWhitelistThreshold(threshold);
            }
            String caseSensitive = opt(inspector, "case_sensitive");
            if (caseSensitive != null) {
                config.withCaseSensitive(Boolean.parseBoolean(caseSensitive));
            }
            List<String> whitelist = all(inspector, "whitelist");
            if (!whitelist.isEmpty()) {
                config.withWhitelist(whitelist);
            }
            List<String> patterns = all(inspector, "pattern");
            if (!patterns.isEmpty()) {
                config.withCustomPatterns(patterns);
            }
            List<String> oom = all(inspector, "oom_pattern");
            if (!oom.isEmpty()) {
                config.withOomPatterns(oom);
            }
            Integer maxLines = optInt(inspector, "max_reported_lines");
            if (maxLines != null) {
                config.withMaxReportedLines(maxLines);
            }
        }

        log.info("Loaded configuration from {}", file);
        return config;
    }

    private static String opt(Profile.Section section, String key) {
        String value = section.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Integer optInt(Profile.Section section, String key) {
        String value = opt(section, key);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "[" + section.getName() + "] " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static List<String> all(Profile.Section section, String key) {
        List<String> values = section.getAll(key);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::trim)
                .toList();
    }
}
