package batchkeeper.coordinator.backend;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported batch schedulers.
 */
public enum BackendType {
    SLURM,
    PBS;

    public SchedulerBackend create(CommandRunner runner, ToolProbe probe, BackendSettings settings) {
        return switch (this) {
            case SLURM -> new SlurmBackend(runner, probe, settings);
            case PBS -> new PbsBackend(runner, probe, settings);
        };
    }

    /**
     * Parse a config value. {@code auto} and blank mean "detect", returned as empty.
     */
    public static Optional<BackendType> parse(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("auto")) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("TORQUE")) {
            return Optional.of(PBS);
        }
        try {
            return Optional.of(valueOf(normalized));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown scheduler type: " + value + " (expected slurm, pbs or auto)", e);
        }
    }

    /**
     * Pick the scheduler whose tools are installed. SLURM wins when both are.
     */
    public static Optional<BackendType> detect(ToolProbe probe) {
        if (probe.hasAll(SlurmBackend.REQUIRED_TOOLS)) {
            return Optional.of(SLURM);
        }
        if (probe.hasAll(PbsBackend.REQUIRED_TOOLS)) {
            return Optional.of(PBS);
        }
        return Optional.empty();
    }
}
