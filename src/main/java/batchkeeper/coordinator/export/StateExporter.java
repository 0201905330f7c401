package batchkeeper.coordinator.export;

import batchkeeper.coordinator.model.Job;
import batchkeeper.coordinator.model.JobFilter;
import batchkeeper.coordinator.repository.DependencyRepository;
import batchkeeper.coordinator.repository.JobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only JSON dump of every job in the store, newest first.
 */
public class StateExporter {

    private static final Logger log = LoggerFactory.getLogger(StateExporter.class);

    private final JobRepository jobs;
    private final DependencyRepository dependencies;
    private final ObjectMapper mapper;

    public StateExporter(JobRepository jobs, DependencyRepository dependencies) {
        this.jobs = jobs;
        this.dependencies = dependencies;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public StateSnapshot snapshot() {
        List<JobSnapshot> snapshots = new ArrayList<>();
        for (Job job : jobs.list(JobFilter.all())) {
            snapshots.add(JobSnapshot.from(job, dependencies.dependenciesOf(job.id())));
        }
        return new StateSnapshot(Instant.now(), snapshots.size(), snapshots);
    }

    public String exportJson() {
        try {
            return mapper.writeValueAsString(snapshot());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize state", e);
        }
    }

    public void export(Path target) throws IOException {
        StateSnapshot snapshot = snapshot();
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(target.toFile(), snapshot);
        log.info("Exported {} jobs to {}", snapshot.totalJobs(), target);
    }
}
