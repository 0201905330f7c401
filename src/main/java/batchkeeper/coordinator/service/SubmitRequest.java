package batchkeeper.coordinator.service;

import batchkeeper.coordinator.model.DependencyEdge;
import batchkeeper.coordinator.model.DependencyKind;
import batchkeeper.coordinator.model.ResourceRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Everything a caller provides to submit a job.
 */
public final class SubmitRequest {

    private static final Pattern ENV_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;
    private final String command;
    private final String workingDirectory;
    private final ResourceRequest resources;
    private final Map<String, String> env;
    private final List<String> expectedFiles;
    private final List<String> afterOk;
    private final List<String> afterFail;
    private final List<String> afterAny;
    private final Integer maxRetries;

    private SubmitRequest(Builder builder) {
        this.name = builder.name;
        this.command = builder.command;
        this.workingDirectory = builder.workingDirectory;
        this.resources = builder.resources != null ? builder.resources : ResourceRequest.defaults();
        this.env = new LinkedHashMap<>(builder.env);
        this.expectedFiles = List.copyOf(builder.expectedFiles);
        this.afterOk = List.copyOf(builder.afterOk);
        this.afterFail = List.copyOf(builder.afterFail);
        this.afterAny = List.copyOf(builder.afterAny);
        this.maxRetries = builder.maxRetries;
    }

    /**
     * @throws IllegalArgumentException if the request cannot be turned into a job
     */
    public void validate() {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        for (String key : env.keySet()) {
            if (!ENV_NAME.matcher(key).matches()) {
                throw new IllegalArgumentException("Invalid environment variable name: " + key);
            }
        }
        for (String file : expectedFiles) {
            if (file == null || file.isBlank()) {
                throw new IllegalArgumentException("expected file paths must not be blank");
            }
        }
    }

    /** Name used for the job, defaulting to the first word of the command. */
    public String name() {
        if (name != null && !name.isBlank()) {
            return name.trim();
        }
        String first = command.trim().split("\\s+")[0];
        int slash = first.lastIndexOf('/');
        return slash >= 0 && slash < first.length() - 1 ? first.substring(slash + 1) : first;
    }

    public String command() {
        return command;
    }

    public String workingDirectory() {
        return workingDirectory;
    }

    public ResourceRequest resources() {
        return resources;
    }

    public Map<String, String> env() {
        return env;
    }

    public List<String> expectedFiles() {
        return expectedFiles;
    }

    public Integer maxRetries() {
        return maxRetries;
    }

    /** Incoming edges of the job that will be created under {@code jobId}. */
    public List<DependencyEdge> edgesFor(String jobId) {
        Set<DependencyEdge> edges = new LinkedHashSet<>();
        afterOk.forEach(p -> edges.add(new DependencyEdge(jobId, p, DependencyKind.AFTER_OK)));
        afterFail.forEach(p -> edges.add(new DependencyEdge(jobId, p, DependencyKind.AFTER_FAIL)));
        afterAny.forEach(p -> edges.add(new DependencyEdge(jobId, p, DependencyKind.AFTER_ANY)));
        return new ArrayList<>(edges);
    }

    public static Builder builder(String command) {
        return new Builder().command(command);
    }

    public static final class Builder {
        private String name;
        private String command;
        private String workingDirectory;
        private ResourceRequest resources;
        private Map<String, String> env = new LinkedHashMap<>();
        private List<String> expectedFiles = new ArrayList<>();
        private List<String> afterOk = new ArrayList<>();
        private List<String> afterFail = new ArrayList<>();
        private List<String> afterAny = new ArrayList<>();
        private Integer maxRetries;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder workingDirectory(String workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder resources(ResourceRequest resources) {
            this.resources = resources;
            return this;
        }

        public Builder env(String key, String value) {
            this.env.put(key, value);
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = new LinkedHashMap<>(env);
            return this;
        }

        public Builder expectedFiles(String... files) {
            this.expectedFiles = new ArrayList<>(List.of(files));
            return this;
        }

        public Builder afterOk(String... jobIds) {
            this.afterOk.addAll(List.of(jobIds));
            return this;
        }

        public Builder afterFail(String... jobIds) {
            this.afterFail.addAll(List.of(jobIds));
            return this;
        }

        public Builder afterAny(String... jobIds) {
            this.afterAny.addAll(List.of(jobIds));
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public SubmitRequest build() {
            return new SubmitRequest(this);
        }
    }
}
