package batchkeeper.coordinator.model;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resources requested from the batch scheduler for one job.
 *
 * <p>
 * Memory is a size string such as {@code 4GB}, {@code 512M} or {@code 64gb};
 * a bare number is taken as megabytes. Walltime is {@code HH:MM:SS}.
 * Queue and account are optional.
 */
public record ResourceRequest(
        int nodes,
        int cpus,
        int gpus,
        String memory,
        String walltime,
        String queue,
        String account) {

    public static final String DEFAULT_MEMORY = "4GB";
    public static final String DEFAULT_WALLTIME = "01:00:00";

    private static final Pattern MEMORY = Pattern.compile(
            "^\\s*(\\d+(?:\\.\\d+)?)\\s*([kmgt]?)(?:i?b)?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WALLTIME = Pattern.compile("^\\d+:[0-5]\\d:[0-5]\\d$");

    public ResourceRequest {
        if (nodes < 1) {
            throw new IllegalArgumentException("nodes must be >= 1, got " + nodes);
        }
        if (cpus < 1) {
            throw new IllegalArgumentException("cpus must be >= 1, got " + cpus);
        }
        if (gpus < 0) {
            throw new IllegalArgumentException("gpus must be >= 0, got " + gpus);
        }
        memory = memory == null || memory.isBlank() ? DEFAULT_MEMORY : memory.trim();
        walltime = walltime == null || walltime.isBlank() ? DEFAULT_WALLTIME : walltime.trim();
        if (!MEMORY.matcher(memory).matches()) {
            throw new IllegalArgumentException("Invalid memory size: " + memory);
        }
        if (!WALLTIME.matcher(walltime).matches()) {
            throw new IllegalArgumentException("Invalid walltime (expected HH:MM:SS): " + walltime);
        }
        queue = queue == null || queue.isBlank() ? null : queue.trim();
        account = account == null || account.isBlank() ? null : account.trim();
    }

    public static ResourceRequest defaults() {
        return builder().build();
    }

    /**
     * Requested memory in whole megabytes, rounded up.
     */
    public long memoryMegabytes() {
        Matcher m = MEMORY.matcher(memory);
        if (!m.matches()) {
            throw new IllegalStateException("Invalid memory size: " + memory);
        }
        double value = Double.parseDouble(m.group(1));
        double mb = switch (m.group(2).toUpperCase(Locale.ROOT)) {
            case "K" -> value / 1024.0;
            case "G" -> value * 1024.0;
            case "T" -> value * 1024.0 * 1024.0;
            default -> value;
        };
        return Math.max(1L, (long) Math.ceil(mb));
    }

    public Builder toBuilder() {
        return new Builder()
                .nodes(nodes)
                .cpus(cpus)
                .gpus(gpus)
                .memory(memory)
                .walltime(walltime)
                .queue(queue)
                .account(account);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int nodes = 1;
        private int cpus = 1;
        private int gpus = 0;
        private String memory = DEFAULT_MEMORY;
        private String walltime = DEFAULT_WALLTIME;
        private String queue;
        private String account;

        public Builder nodes(int nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder cpus(int cpus) {
            this.cpus = cpus;
            return this;
        }

        public Builder gpus(int gpus) {
            this.gpus = gpus;
            return this;
        }

        public Builder memory(String memory) {
            this.memory = memory;
            return this;
        }

        public Builder walltime(String walltime) {
            this.walltime = walltime;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public ResourceRequest build() {
            return new ResourceRequest(nodes, cpus, gpus, memory, walltime, queue, account);
        }
    }
}
