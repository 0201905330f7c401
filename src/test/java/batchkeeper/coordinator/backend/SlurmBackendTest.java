package batchkeeper.coordinator.backend;

import batchkeeper.coordinator.error.SubmissionException;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.ResourceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class SlurmBackendTest {

    private final Map<String, CommandResult> replies = new HashMap<>();
    private final List<List<String>> calls = new ArrayList<>();
    private final CommandRunner runner = command -> {
        calls.add(command);
        return replies.getOrDefault(String.join(" ", command),
                CommandResult.failed(1, "slurm_load_jobs error: Invalid job id specified"));
    };

    private SlurmBackend backend;

    @BeforeEach
    void setup() {
        backend = new SlurmBackend(runner, new ToolProbe(""), BackendSettings.defaults());
    }

    private static Job job(ResourceRequest resources) {
        return Job.builder()
                .id("job-1")
                .name("train model")
                .command("python train.py --epochs 10")
                .runDirectory("/scratch/runs/job-1")
                .workingDirectory("/scratch/project")
                .resources(resources)
                .env(Map.of("SEED", "42"))
                .build();
    }

    @Test
    void generatesDirectivesFromResources() {
        ResourceRequest resources = ResourceRequest.builder()
                .nodes(2)
                .cpus(8)
                .gpus(1)
                .memory("16GB")
                .walltime("02:00:00")
                .queue("gpu")
                .account("proj1")
                .build();

        List<String> lines = backend.generateScript(job(resources)).lines().toList();

        assertEquals("#!/bin/bash", lines.get(0));
        assertTrue(lines.contains("#SBATCH --job-name=train_model"));
        assertTrue(lines.contains("#SBATCH --partition=gpu"));
        assertTrue(lines.contains("#SBATCH --account=proj1"));
        assertTrue(lines.contains("#SBATCH --nodes=2"));
        assertTrue(lines.contains("#SBATCH --ntasks-per-node=8"));
        assertTrue(lines.contains("#SBATCH --mem=16384M"));
        assertTrue(lines.contains("#SBATCH --time=02:00:00"));
        assertTrue(lines.contains("#SBATCH --gres=gpu:1"));
        assertTrue(lines.contains("#SBATCH --output=/scratch/runs/job-1/stdout.log"));
        assertTrue(lines.contains("#SBATCH --error=/scratch/runs/job-1/stderr.log"));
        assertTrue(lines.contains("cd '/scratch/project' || exit 1"));
        assertTrue(lines.contains("export SEED='42'"));
        assertEquals("python train.py --epochs 10", lines.get(lines.size() - 1));
    }

    @Test
    void omitsOptionalDirectives() {
        String script = backend.generateScript(job(ResourceRequest.defaults()));

        assertFalse(script.contains("--partition"));
        assertFalse(script.contains("--account"));
        assertFalse(script.contains("--gres"));
        assertTrue(script.contains("#SBATCH --mem=4096M\n"));
        assertTrue(script.contains("#SBATCH --time=01:00:00\n"));
    }

    @Test
    void scriptIsDeterministic() {
        Job job = job(ResourceRequest.defaults());
        assertEquals(backend.generateScript(job), backend.generateScript(job));
    }

    @Test
    void siteSettingsPrecedeJobEnvironment() {
        BackendSettings settings = new BackendSettings(
                List.of("--export=ALL", "#SBATCH --constraint=a100"),
                List.of("cuda/12.3"),
                Map.of("SEED", "0"),
                null);
        SlurmBackend withSettings = new SlurmBackend(runner, new ToolProbe(""), settings);

        String script = withSettings.generateScript(job(ResourceRequest.defaults()));

        assertTrue(script.contains("#SBATCH --export=ALL\n"));
        assertTrue(script.contains("#SBATCH --constraint=a100\n"));
        assertFalse(script.contains("#SBATCH #SBATCH"));
        int module = script.indexOf("module load cuda/12.3");
        int siteEnv = script.indexOf("export SEED='0'");
        int jobEnv = script.indexOf("export SEED='42'");
        assertTrue(script.indexOf("cd '/scratch/project'") < module);
        assertTrue(module < siteEnv);
        assertTrue(siteEnv < jobEnv);
    }

    @Test
    void parsesSubmitOutput() {
        assertEquals(Optional.of("12345"), SlurmBackend.parseSubmitOutput("Submitted batch job 12345\n"));
        assertEquals(Optional.of("777"), SlurmBackend.parseSubmitOutput("777;cluster-a\n"));
        assertEquals(Optional.of("778"), SlurmBackend.parseSubmitOutput("778"));
        assertTrue(SlurmBackend.parseSubmitOutput("sbatch: queued somewhere").isEmpty());
    }

    @Test
    void submitReturnsBackendId() {
        replies.put("sbatch /runs/job-1/job.sbatch", CommandResult.ok("Submitted batch job 4242\n"));

        assertEquals("4242", backend.submit(Path.of("/runs/job-1/job.sbatch")));
    }

    @Test
    void submitRejectedBySchedulerThrows() {
        replies.put("sbatch /runs/job-1/job.sbatch",
                CommandResult.failed(1, "sbatch: error: invalid partition specified: gpux"));

        SubmissionException e = assertThrows(SubmissionException.class,
                () -> backend.submit(Path.of("/runs/job-1/job.sbatch")));
        assertTrue(e.getMessage().contains("invalid partition"));
    }

    @Test
    void submitWithUnparsableOutputThrows() {
        replies.put("sbatch /runs/job-1/job.sbatch", CommandResult.ok("something unexpected\n"));

        assertThrows(SubmissionException.class, () -> backend.submit(Path.of("/runs/job-1/job.sbatch")));
    }

    @Test
    void statusFromLiveQueue() {
        replies.put("squeue -h -j 42 -o %T", CommandResult.ok("RUNNING\n"));

        assertEquals(BackendStatus.RUNNING, backend.status("42"));
        assertEquals(1, calls.size());
    }

    @Test
    void statusFallsBackToAccounting() {
        replies.put("squeue -h -j 42 -o %T", CommandResult.ok(""));
        replies.put("sacct -j 42 -n -X -P -o State", CommandResult.ok("CANCELLED by 1000\n"));

        assertEquals(BackendStatus.FAILED, backend.status("42"));
    }

    @Test
    void unknownJobIsNeverAssumedCompleted() {
        assertEquals(BackendStatus.UNKNOWN, backend.status("99"));
    }

    @Test
    void mapsSlurmStates() {
        assertEquals(BackendStatus.QUEUED, SlurmBackend.mapState("PENDING"));
        assertEquals(BackendStatus.RUNNING, SlurmBackend.mapState("COMPLETING"));
        assertEquals(BackendStatus.COMPLETED, SlurmBackend.mapState("COMPLETED+"));
        assertEquals(BackendStatus.FAILED, SlurmBackend.mapState("OUT_OF_MEMORY"));
        assertEquals(BackendStatus.FAILED, SlurmBackend.mapState("timeout"));
        assertEquals(BackendStatus.UNKNOWN, SlurmBackend.mapState("WHATEVER"));
    }

    @Test
    void exitCodeFromAccounting() {
        replies.put("sacct -j 42 -n -X -P -o ExitCode", CommandResult.ok("2:0\n"));

        assertEquals(OptionalInt.of(2), backend.exitCode("42"));
        assertEquals(OptionalInt.empty(), backend.exitCode("43"));
    }

    @Test
    void outOfRangeExitCodeIsIgnored() {
        replies.put("sacct -j 42 -n -X -P -o ExitCode", CommandResult.ok("99999999999:0\n"));

        assertEquals(OptionalInt.empty(), backend.exitCode("42"));
    }

    @Test
    void cancelReportsSchedulerAnswer() {
        replies.put("scancel 42", CommandResult.ok(""));

        assertTrue(backend.cancel("42"));
        assertFalse(backend.cancel("43"));
    }

    @Test
    void runnerFailureDegradesToUnknown() {
        SlurmBackend broken = new SlurmBackend(command -> {
            throw new IOException("squeue timed out");
        }, new ToolProbe(""), BackendSettings.defaults());

        assertEquals(BackendStatus.UNKNOWN, broken.status("42"));
        assertFalse(broken.cancel("42"));
        assertThrows(SubmissionException.class, () -> broken.submit(Path.of("job.sbatch")));
    }
}
