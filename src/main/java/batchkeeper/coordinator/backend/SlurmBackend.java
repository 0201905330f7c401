package batchkeeper.coordinator.backend;

import batchkeeper.coordinator.error.SubmissionException;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SLURM integration: {@code sbatch}, {@code squeue}, {@code sacct}, {@code scancel}.
 */
public class SlurmBackend implements SchedulerBackend {

    private static final Logger log = LoggerFactory.getLogger(SlurmBackend.class);

    static final List<String> REQUIRED_TOOLS = List.of("sbatch", "squeue", "sacct", "scancel");

    private static final Pattern SUBMITTED = Pattern.compile("Submitted batch job (\\d+)");
    private static final Pattern PARSABLE = Pattern.compile("^(\\d+)(?:;\\S+)?$");
    private static final Pattern EXIT_CODE = Pattern.compile("^(\\d+):(\\d+)$");

    private static final Map<String, BackendStatus> STATES = Map.ofEntries(
            Map.entry("PENDING", BackendStatus.QUEUED),
            Map.entry("CONFIGURING", BackendStatus.QUEUED),
            Map.entry("REQUEUED", BackendStatus.QUEUED),
            Map.entry("REQUEUE_HOLD", BackendStatus.QUEUED),
            Map.entry("REQUEUE_FED", BackendStatus.QUEUED),
            Map.entry("RESV_DEL_HOLD", BackendStatus.QUEUED),
            Map.entry("SUSPENDED", BackendStatus.QUEUED),
            Map.entry("RUNNING", BackendStatus.RUNNING),
            Map.entry("COMPLETING", BackendStatus.RUNNING),
            Map.entry("STAGE_OUT", BackendStatus.RUNNING),
            Map.entry("SIGNALING", BackendStatus.RUNNING),
            Map.entry("RESIZING", BackendStatus.RUNNING),
            Map.entry("COMPLETED", BackendStatus.COMPLETED),
            Map.entry("FAILED", BackendStatus.FAILED),
            Map.entry("CANCELLED", BackendStatus.FAILED),
            Map.entry("TIMEOUT", BackendStatus.FAILED),
            Map.entry("NODE_FAIL", BackendStatus.FAILED),
            Map.entry("PREEMPTED", BackendStatus.FAILED),
            Map.entry("OUT_OF_MEMORY", BackendStatus.FAILED),
            Map.entry("BOOT_FAIL", BackendStatus.FAILED),
            Map.entry("DEADLINE", BackendStatus.FAILED),
            Map.entry("REVOKED", BackendStatus.FAILED),
            Map.entry("SPECIAL_EXIT", BackendStatus.FAILED));

    private final CommandRunner runner;
    private final ToolProbe probe;
    private final BackendSettings settings;

    public SlurmBackend(CommandRunner runner, ToolProbe probe, BackendSettings settings) {
        this.runner = runner;
        this.probe = probe;
        this.settings = settings;
    }

    @Override
    public BackendType type() {
        return BackendType.SLURM;
    }

    @Override
    public String scriptExtension() {
        return "sbatch";
    }

    @Override
    public String generateScript(Job job) {
        ResourceRequest res = job.resources();
        ScriptBuilder script = new ScriptBuilder("#SBATCH")
                .directive("--job-name=" + ScriptBuilder.sanitizeName(job.name()));
        if (res.queue() != null) {
            script.directive("--partition=" + res.queue());
        }
        if (res.account() != null) {
            script.directive("--account=" + res.account());
        }
        script.directive("--nodes=" + res.nodes())
                .directive("--ntasks-per-node=" + res.cpus())
                .directive("--mem=" + res.memoryMegabytes() + "M")
                .directive("--time=" + res.walltime());
        if (res.gpus() > 0) {
            script.directive("--gres=gpu:" + res.gpus());
        }
        script.directive("--output=" + job.stdoutPath())
                .directive("--error=" + job.stderrPath())
                .extraDirectives(settings.extraDirectives());
        return script.build(job, settings);
    }

    @Override
    public String submit(Path scriptPath) {
        CommandResult result;
        try {
            result = runner.run(List.of("sbatch", scriptPath.toString()));
        } catch (IOException e) {
            throw new SubmissionException("sbatch could not be run: " + e.getMessage(), e);
        }
        if (!result.succeeded()) {
            throw new SubmissionException("sbatch exited with " + result.exitCode() + ": " + result.stderr().trim());
        }
        return parseSubmitOutput(result.stdout())
                .orElseThrow(() -> new SubmissionException("Unparsable sbatch output: " + result.stdout().trim()));
    }

    static Optional<String> parseSubmitOutput(String output) {
        for (String line : output.split("\\R")) {
            Matcher m = SUBMITTED.matcher(line);
            if (m.find()) {
                return Optional.of(m.group(1));
            }
            Matcher parsable = PARSABLE.matcher(line.trim());
            if (parsable.matches()) {
                return Optional.of(parsable.group(1));
            }
        }
        return Optional.empty();
    }

    @Override
    public BackendStatus status(String backendId) {
        Optional<String> live = firstLine(List.of("squeue", "-h", "-j", backendId, "-o", "%T"));
        if (live.isPresent()) {
            return mapState(live.get());
        }
        Optional<String> accounted = firstLine(List.of("sacct", "-j", backendId, "-n", "-X", "-P", "-o", "State"));
        if (accounted.isPresent()) {
            return mapState(accounted.get());
        }
        log.debug("SLURM job {} unknown to squeue and sacct", backendId);
        return BackendStatus.UNKNOWN;
    }

    @Override
    public OptionalInt exitCode(String backendId) {
        Optional<String> line = firstLine(List.of("sacct", "-j", backendId, "-n", "-X", "-P", "-o", "ExitCode"));
        if (line.isEmpty()) {
            return OptionalInt.empty();
        }
        Matcher m = EXIT_CODE.matcher(line.get());
        if (!m.matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            log.warn("Unparsable sacct ExitCode '{}' for job {}", line.get(), backendId);
            return OptionalInt.empty();
        }
    }

    @Override
    public boolean cancel(String backendId) {
        try {
            CommandResult result = runner.run(List.of("scancel", backendId));
            if (!result.succeeded()) {
                log.warn("scancel {} failed: {}", backendId, result.stderr().trim());
            }
            return result.succeeded();
        } catch (IOException e) {
            log.warn("scancel {} could not be run: {}", backendId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean available() {
        return probe.hasAll(REQUIRED_TOOLS);
    }

    /**
     * Map a SLURM state such as {@code RUNNING}, {@code CANCELLED by 1000} or {@code COMPLETED+}.
     */
    static BackendStatus mapState(String raw) {
        String state = raw.trim().split("\\s+")[0].replaceAll("[^A-Za-z_]", "").toUpperCase(Locale.ROOT);
        return STATES.getOrDefault(state, BackendStatus.UNKNOWN);
    }

    private Optional<String> firstLine(List<String> command) {
        try {
            CommandResult result = runner.run(command);
            if (!result.succeeded()) {
                log.debug("{} exited with {}: {}", command.get(0), result.exitCode(), result.stderr().trim());
                return Optional.empty();
            }
            return result.stdout().lines().map(String::trim).filter(l -> !l.isEmpty()).findFirst();
        } catch (IOException e) {
            log.warn("{} could not be run: {}", command.get(0), e.getMessage());
            return Optional.empty();
        }
    }
}
