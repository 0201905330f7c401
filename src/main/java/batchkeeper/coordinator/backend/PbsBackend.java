package batchkeeper.coordinator.backend;

import batchkeeper.coordinator.error.SubmissionException;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.ResourceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PBS Pro / Torque integration: {@code qsub}, {@code qstat}, {@code qdel}.
 */
public class PbsBackend implements SchedulerBackend {

    private static final Logger log = LoggerFactory.getLogger(PbsBackend.class);

    static final List<String> REQUIRED_TOOLS = List.of("qsub", "qstat", "qdel");

    private static final Pattern JOB_ID = Pattern.compile("^(\\d+(?:\\[\\d*])?(?:\\.[\\w.-]+)?)$");
    private static final Pattern JOB_STATE = Pattern.compile("^\\s*job_state\\s*=\\s*(\\S+)", Pattern.MULTILINE);
    private static final Pattern EXIT_STATUS = Pattern.compile(
            "^\\s*exit_status\\s*=\\s*(-?\\d+)", Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

    private final CommandRunner runner;
    private final ToolProbe probe;
    private final BackendSettings settings;

    public PbsBackend(CommandRunner runner, ToolProbe probe, BackendSettings settings) {
        this.runner = runner;
        this.probe = probe;
        this.settings = settings;
    }

    @Override
    public BackendType type() {
        return BackendType.PBS;
    }

    @Override
    public String scriptExtension() {
        return "pbs";
    }

    @Override
    public String generateScript(Job job) {
        ResourceRequest res = job.resources();
        ScriptBuilder script = new ScriptBuilder("#PBS")
                .directive("-N " + ScriptBuilder.sanitizeName(job.name()));
        if (res.queue() != null) {
            script.directive("-q " + res.queue());
        }
        if (res.account() != null) {
            script.directive("-A " + res.account());
        }
        script.directive("-l " + resourceList(res))
                .directive("-l walltime=" + res.walltime())
                .directive("-o " + job.stdoutPath())
                .directive("-e " + job.stderrPath())
                .extraDirectives(settings.extraDirectives());
        return script.build(job, settings);
    }

    private String resourceList(ResourceRequest res) {
        String memory = res.memoryMegabytes() + "mb";
        if (settings.pbsStyle() == BackendSettings.PbsResourceStyle.NODES) {
            String nodes = "nodes=" + res.nodes() + ":ppn=" + res.cpus();
            if (res.gpus() > 0) {
                nodes += ":gpus=" + res.gpus();
            }
            return nodes + ",mem=" + memory;
        }
        String select = "select=" + res.nodes() + ":ncpus=" + res.cpus() + ":mem=" + memory;
        if (res.gpus() > 0) {
            select += ":ngpus=" + res.gpus();
        }
        return select;
    }

    @Override
    public String submit(Path scriptPath) {
        CommandResult result;
        try {
            result = runner.run(List.of("qsub", scriptPath.toString()));
        } catch (IOException e) {
            throw new SubmissionException("qsub could not be run: " + e.getMessage(), e);
        }
        if (!result.succeeded()) {
            throw new SubmissionException("qsub exited with " + result.exitCode() + ": " + result.stderr().trim());
        }
        return parseSubmitOutput(result.stdout())
                .orElseThrow(() -> new SubmissionException("Unparsable qsub output: " + result.stdout().trim()));
    }

    static Optional<String> parseSubmitOutput(String output) {
        return output.lines()
                .map(String::trim)
                .filter(l -> !l.isEmpty())
                .map(JOB_ID::matcher)
                .filter(Matcher::matches)
                .map(m -> m.group(1))
                .findFirst();
    }

    @Override
    public BackendStatus status(String backendId) {
        Optional<String> full = fullStatus(backendId);
        if (full.isEmpty()) {
            log.debug("PBS job {} unknown to qstat", backendId);
            return BackendStatus.UNKNOWN;
        }
        return parseStatus(full.get());
    }

    static BackendStatus parseStatus(String qstatOutput) {
        Matcher state = JOB_STATE.matcher(qstatOutput);
        if (!state.find()) {
            return BackendStatus.UNKNOWN;
        }
        switch (state.group(1).toUpperCase()) {
            case "Q", "H", "W", "T", "S", "U":
                return BackendStatus.QUEUED;
            case "R", "E", "B":
                return BackendStatus.RUNNING;
            case "C", "F", "X":
                OptionalInt exit = parseExitStatus(qstatOutput);
                return exit.isPresent() && exit.getAsInt() != 0 ? BackendStatus.FAILED : BackendStatus.COMPLETED;
            default:
                return BackendStatus.UNKNOWN;
        }
    }

    @Override
    public OptionalInt exitCode(String backendId) {
        return fullStatus(backendId).map(PbsBackend::parseExitStatus).orElse(OptionalInt.empty());
    }

    static OptionalInt parseExitStatus(String qstatOutput) {
        Matcher m = EXIT_STATUS.matcher(qstatOutput);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            log.warn("Unparsable PBS Exit_status '{}'", m.group(1));
            return OptionalInt.empty();
        }
    }

    @Override
    public boolean cancel(String backendId) {
        try {
            CommandResult result = runner.run(List.of("qdel", backendId));
            if (!result.succeeded()) {
                log.warn("qdel {} failed: {}", backendId, result.stderr().trim());
            }
            return result.succeeded();
        } catch (IOException e) {
            log.warn("qdel {} could not be run: {}", backendId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean available() {
        return probe.hasAll(REQUIRED_TOOLS);
    }

    /**
     * {@code qstat -f} for live jobs, then {@code qstat -x -f} for finished ones.
     */
    private Optional<String> fullStatus(String backendId) {
        Optional<String> live = run(List.of("qstat", "-f", backendId));
        if (live.isPresent()) {
            return live;
        }
        return run(List.of("qstat", "-x", "-f", backendId));
    }

    private Optional<String> run(List<String> command) {
        try {
            CommandResult result = runner.run(command);
            if (!result.succeeded() || result.stdout().isBlank()) {
                log.debug("{} exited with {}: {}", command, result.exitCode(), result.stderr().trim());
                return Optional.empty();
            }
            return Optional.of(result.stdout());
        } catch (IOException e) {
            log.warn("{} could not be run: {}", command.get(0), e.getMessage());
            return Optional.empty();
        }
    }
}
