package batchkeeper.coordinator.backend;

import batchkeeper.coordinator.model.Job;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles a batch script: shebang, directive block, then the job body.
 */
final class ScriptBuilder {

    private static final int MAX_NAME_LENGTH = 64;

    private final String prefix;
    private final List<String> lines = new ArrayList<>();

    ScriptBuilder(String prefix) {
        this.prefix = prefix;
        lines.add("#!/bin/bash");
    }

    ScriptBuilder directive(String body) {
        lines.add(prefix + " " + body);
        return this;
    }

    ScriptBuilder extraDirectives(List<String> directives) {
        for (String d : directives) {
            String trimmed = d.trim();
            lines.add(trimmed.startsWith(prefix) ? trimmed : prefix + " " + trimmed);
        }
        return this;
    }

    /**
     * Append the body and render. The job env is exported after the site env
     * so a job can override a site default.
     */
    String build(Job job, BackendSettings settings) {
        lines.add("");
        lines.add("cd " + quote(job.workingDirectory()) + " || exit 1");
        for (String module : settings.modules()) {
            lines.add("module load " + module);
        }
        exports(settings.env());
        exports(job.env());
        lines.add("");
        lines.add(job.command());
        return String.join("\n", lines) + "\n";
    }

    private void exports(Map<String, String> env) {
        env.forEach((key, value) -> lines.add("export " + key + "=" + quote(value)));
    }

    /** Scheduler-safe job name: letters, digits, dot, dash and underscore. */
    static String sanitizeName(String name) {
        String cleaned = name.replaceAll("[^A-Za-z0-9_.-]", "_");
        if (cleaned.isEmpty()) {
            return "job";
        }
        return cleaned.length() > MAX_NAME_LENGTH ? cleaned.substring(0, MAX_NAME_LENGTH) : cleaned;
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
