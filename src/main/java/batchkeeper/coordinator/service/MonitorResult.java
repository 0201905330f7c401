package batchkeeper.coordinator.service;

import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobStatus;

import java.util.List;

/**
 * Outcome of {@link JobService#monitor}.
 *
 * @param finished   jobs that reached a terminal state
 * @param blocked    pending jobs whose dependencies can no longer be satisfied
 * @param unfinished jobs still active when monitoring stopped
 * @param timedOut   monitoring stopped because the timeout elapsed
 */
public record MonitorResult(List<Job> finished, List<Job> blocked, List<Job> unfinished, boolean timedOut) {

    public MonitorResult {
        finished = List.copyOf(finished);
        blocked = List.copyOf(blocked);
        unfinished = List.copyOf(unfinished);
    }

    public boolean allCompleted() {
        return blocked.isEmpty() && unfinished.isEmpty()
                && finished.stream().allMatch(j -> j.status() == JobStatus.COMPLETED);
    }
}
