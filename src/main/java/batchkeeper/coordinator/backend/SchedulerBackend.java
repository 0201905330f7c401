package batchkeeper.coordinator.backend;

import batchkeeper.coordinator.model.Job;

import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Contract every batch scheduler integration fulfils.
 *
 * <p>
 * Implementations are stateless apart from their configuration. Command
 * failures while querying ({@link #status}, {@link #exitCode}) degrade to
 * "unknown" instead of throwing.
 */
public interface SchedulerBackend {

    BackendType type();

    /** File extension of generated scripts, without the dot. */
    String scriptExtension();

    /**
     * Render the batch script for a job. Deterministic for equal input.
     */
    String generateScript(Job job);

    /**
     * Submit a script previously written to disk.
     *
     * @return the scheduler's id for the submitted job
     * @throws batchkeeper.coordinator.error.SubmissionException if the scheduler rejects it
     *                                                           or its reply cannot be parsed
     */
    String submit(Path scriptPath);

    /**
     * Current state: live queue first, then accounting/history.
     */
    BackendStatus status(String backendId);

    /**
     * Exit code recorded by the scheduler's accounting, if it has one.
     */
    OptionalInt exitCode(String backendId);

    /**
     * @return true if the scheduler accepted the cancel request
     */
    boolean cancel(String backendId);

    /**
     * True when every tool this backend needs is an executable on the search path.
     */
    boolean available();
}
