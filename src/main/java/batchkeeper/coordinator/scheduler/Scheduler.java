package batchkeeper.coordinator.scheduler;

import batchkeeper.coordinator.config.KeeperConfig;
import batchkeeper.coordinator.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the tracking sweep periodically on a single daemon thread,
 * so a restarted keeper picks up where the previous one stopped.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final TrackingSweeper sweeper;
    private final KeeperConfig config;

    private volatile boolean running = false;

    public Scheduler(JobService jobService, KeeperConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "batchkeeper-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.sweeper = new TrackingSweeper(jobService);
        this.config = config;
    }

    /**
     * Start the scheduler. The first sweep runs immediately.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = config.sweepInterval().toMillis();
        executor.scheduleAtFixedRate(sweeper, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Tracking sweep scheduled every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the sweeper for direct access (e.g., manual trigger).
     */
    public TrackingSweeper sweeper() {
        return sweeper;
    }
}
