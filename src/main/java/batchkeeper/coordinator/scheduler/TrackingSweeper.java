package batchkeeper.coordinator.scheduler;

import batchkeeper.coordinator.error.StoreException;
import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobFilter;
import batchkeeper.coordinator.model.JobStatus;
import batchkeeper.coordinator.service.JobService;
import batchkeeper.coordinator.service.TrackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Background pass that tracks every unsettled job in the store.
 *
 * Jobs can be left behind if:
 * - the process that submitted them exited or crashed
 * - nobody is monitoring them
 * - a failure was recorded but its retry was never created
 *
 * The sweeper:
 * 1. Lists PENDING, QUEUED and RUNNING jobs, plus FAILED jobs with retry budget left
 * 2. Runs one tracking pass on each of them
 */
public class TrackingSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TrackingSweeper.class);

    private final JobService jobService;

    public TrackingSweeper(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (Exception e) {
            log.error("Tracking sweep error", e);
        }
    }

    /**
     * Track all unsettled jobs once.
     *
     * @return number of jobs whose status changed or that spawned new jobs
     * @throws StoreException if the store fails; the sweep stops at that point
     */
    public int sweep() {
        List<Job> unsettled = new ArrayList<>(jobService.list(
                JobFilter.byStatus(JobStatus.PENDING, JobStatus.QUEUED, JobStatus.RUNNING)));
        for (Job failed : jobService.list(JobFilter.byStatus(JobStatus.FAILED))) {
            if (failed.canRetry()) {
                unsettled.add(failed);
            }
        }

        if (unsettled.isEmpty()) {
            log.debug("No unsettled jobs");
            return 0;
        }

        int changed = 0;
        for (Job job : unsettled) {
            try {
                TrackResult result = jobService.track(job.id());
                if (result.job().status() != job.status() || !result.newJobIds().isEmpty()) {
                    changed++;
                }
            } catch (StoreException e) {
                throw e;
            } catch (Exception e) {
                log.error("Failed to track job {}", job.id(), e);
            }
        }

        log.info("Tracking sweep: {} of {} unsettled jobs changed", changed, unsettled.size());
        return changed;
    }
}
