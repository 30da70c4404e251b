package com.vncalign.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vncalign.orchestrator.api.dto.JobStatusView;
import com.vncalign.orchestrator.executor.ArtifactLayout;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.progress.StageProgressResolver;
import com.vncalign.orchestrator.store.JobStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Read side: what the UI sees when it polls.
 *
 * Running jobs are re-read from the executor's progress at request time, so
 * the answer is never a poll interval behind. Nothing here writes to the store.
 */
@Service
public class StatusProjection {

    private final JobStore              store;
    private final StageProgressResolver progress;
    private final ProcessSupervisor     supervisor;
    private final ArtifactLayout        layout;
    private final ObjectMapper          objectMapper;

    public StatusProjection(JobStore store,
                            StageProgressResolver progress,
                            ProcessSupervisor supervisor,
                            ArtifactLayout layout,
                            ObjectMapper objectMapper) {
        this.store        = store;
        this.progress     = progress;
        this.supervisor   = supervisor;
        this.layout       = layout;
        this.objectMapper = objectMapper;
    }

    public List<JobStatusView> list() {
        return store.all().stream()
                .map(this::project)
                .toList();
    }

    public Optional<JobStatusView> find(String id) {
        return store.get(id).map(this::project);
    }

    /**
     * The executor's thumbnail manifest for {@code id}.
     *
     * @return empty if the executor has not written one
     * @throws UncheckedIOException if it exists but cannot be read or parsed
     */
    public Optional<JsonNode> thumbnails(String id) {
        Path file = layout.thumbnailManifest(id);
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readTree(file.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read thumbnails for " + id, e);
        }
    }

    private JobStatusView project(AlignmentJob job) {
        boolean current = job.getStatus() == JobStatus.PROCESSING;
        if (current) {
            // Only a run we spawned has a trustworthy start time to reject stale files with.
            String id = job.getId();
            progress.getStageProgress(id, supervisor.isSupervising(id) ? job.getStartedAt() : null)
                    .applyTo(job);
        }
        OptionalInt position = store.queuePosition(job.getId());
        return JobStatusView.from(job,
                position.isPresent() ? position.getAsInt() : null,
                current);
    }
}
