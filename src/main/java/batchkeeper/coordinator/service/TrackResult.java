package batchkeeper.coordinator.service;

import batchkeeper.coordinator.model.Job;

import java.util.List;

/**
 * Result of one tracking pass over a job.
 *
 * @param job       the job as stored after the pass
 * @param newJobIds retry spawns and dependents submitted during the pass
 */
public record TrackResult(Job job, List<String> newJobIds) {

    public TrackResult {
        newJobIds = List.copyOf(newJobIds);
    }
}
