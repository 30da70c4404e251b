package com.vncalign.orchestrator.service;

import com.vncalign.orchestrator.config.AlignmentProperties;
import com.vncalign.orchestrator.executor.ArtifactLayout;
import com.vncalign.orchestrator.inspect.LiveJobInspector;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.AlignmentStage;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.progress.StageProgress;
import com.vncalign.orchestrator.progress.StageProgressArtifact;
import com.vncalign.orchestrator.progress.StageProgressReader;
import com.vncalign.orchestrator.progress.StageProgressResolver;
import com.vncalign.orchestrator.store.JobStore;
import com.vncalign.orchestrator.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Rebuilds a consistent picture after a restart, before any admission.
 *
 *   1. Load the snapshot. A job recorded as processing was running when the
 *      previous server stopped: it becomes interrupted.
 *   2. Ask the process table (and pid files) which executors are still
 *      running. Those jobs are processing again and are watched by the
 *      {@link AdoptedJobMonitor}.
 *   3. Every other interrupted job is completed if its final outputs exist,
 *      otherwise requeued (or failed, when resuming is switched off).
 *   4. Progress files in the output directory that no record knows about are
 *      turned into terminal records.
 *   5. Open the queue, then restart preparations that were cut off.
 *
 * Runs once all singletons exist, which is before the web server starts
 * taking requests.
 */
@Component
public class StartupReconciler implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(StartupReconciler.class);

    private final SnapshotStore         snapshots;
    private final JobStore              store;
    private final LiveJobInspector      inspector;
    private final AdoptedJobMonitor     adoptedJobs;
    private final QueueScheduler        scheduler;
    private final PreparationPipeline   preparation;
    private final StageProgressResolver progress;
    private final StageProgressReader   progressReader;
    private final ArtifactLayout        layout;
    private final Clock                 clock;

    private final AlignmentProperties.Reconcile settings;

    public StartupReconciler(SnapshotStore snapshots,
                             JobStore store,
                             LiveJobInspector inspector,
                             AdoptedJobMonitor adoptedJobs,
                             QueueScheduler scheduler,
                             PreparationPipeline preparation,
                             StageProgressResolver progress,
                             StageProgressReader progressReader,
                             ArtifactLayout layout,
                             Clock clock,
                             AlignmentProperties props) {
        this.snapshots      = snapshots;
        this.store          = store;
        this.inspector      = inspector;
        this.adoptedJobs    = adoptedJobs;
        this.scheduler      = scheduler;
        this.preparation    = preparation;
        this.progress       = progress;
        this.progressReader = progressReader;
        this.layout         = layout;
        this.clock          = clock;
        this.settings       = props.reconcile();
    }

    @Override
    public void afterSingletonsInstantiated() {
        reconcile();
    }

    /**
     * Run the whole startup sequence. Leaves the queue scheduler open.
     */
    public void reconcile() {
        store.restore(snapshots.load());
        Set<String> running = inspector.runningJobIds();
        List<String> preparing = new ArrayList<>();

        store.runAtomically(() -> {
            for (AlignmentJob job : store.all()) {
                if (job.getStatus() == JobStatus.PROCESSING) {
                    store.update(job.getId(), j -> j.setStatus(JobStatus.INTERRUPTED));
                } else if (job.getStatus() == JobStatus.PREPARING) {
                    preparing.add(job.getId());
                }
            }
            running.forEach(this::adopt);
            for (AlignmentJob job : store.all()) {
                if (job.getStatus() == JobStatus.INTERRUPTED) {
                    resolveInterrupted(job.getId());
                }
            }
            if (settings.scavengeOrphans()) {
                scavengeOrphans(running);
            }
        });

        log.info("Startup reconciliation done: {} job(s), {} queued, {} adopted, {} to re-prepare",
                store.all().size(), store.queue().size(), running.size(), preparing.size());

        scheduler.open();
        scheduler.admitNext();

        for (String id : preparing) {
            preparation.prepare(id);
        }
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    private void adopt(String id) {
        Instant now = clock.instant();
        Optional<AlignmentJob> existing = store.get(id);
        AlignmentJob job = existing.orElseGet(() -> {
            AlignmentJob created = new AlignmentJob(id, JobStatus.PROCESSING);
            created.setCurrentStage(AlignmentStage.INITIALIZING.stageName());
            created.setQueuedAt(now);
            return created;
        });
        job.setStatus(JobStatus.PROCESSING);
        job.setError("");
        job.setCompletedAt(null);
        if (job.getStartedAt() == null) job.setStartedAt(now);
        progress.getStageProgress(id, null).applyTo(job);
        store.set(job);
        store.removeFromQueue(id);
        adoptedJobs.adopt(id);
        log.info("Alignment for {} is still running; monitoring it", id);
    }

    private void resolveInterrupted(String id) {
        Instant now = clock.instant();
        if (layout.hasFinalOutputs(id)) {
            StageProgress last = progress.getStageProgress(id, null);
            store.update(id, job -> {
                last.applyTo(job);
                job.markCompleted(now);
            });
            log.info("Interrupted alignment for {} had finished its outputs; marked completed", id);
        } else if (settings.resumeInterrupted()) {
            store.update(id, job -> {
                job.setStatus(JobStatus.QUEUED);
                job.setProgress(0);
                job.setError("");
                if (job.getQueuedAt() == null) job.setQueuedAt(now);
            });
            store.appendToQueue(id);
            log.info("Requeued interrupted alignment for {}", id);
        } else {
            store.update(id, job -> job.markFailed(AdoptedJobMonitor.NO_OUTPUT_ERROR, now));
            log.info("Interrupted alignment for {} left no output; marked failed", id);
        }
    }

    private void scavengeOrphans(Set<String> running) {
        Path outputDir = layout.outputDir();
        if (!Files.isDirectory(outputDir)) return;

        List<Path> files;
        try (Stream<Path> listing = Files.list(outputDir)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(ArtifactLayout.PROGRESS_SUFFIX))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Could not list {} for orphan progress files: {}", outputDir, e.getMessage());
            return;
        }

        for (Path file : files) {
            String name = file.getFileName().toString();
            String id = name.substring(0, name.length() - ArtifactLayout.PROGRESS_SUFFIX.length());
            if (id.isEmpty() || store.get(id).isPresent() || running.contains(id)) continue;
            progressReader.readFile(file).flatMap(a -> recordFor(id, a)).ifPresent(job -> {
                store.set(job);
                log.info("Recovered {} record for {} from its progress file", job.getStatus().wireName(), id);
            });
        }
    }

    private Optional<AlignmentJob> recordFor(String id, StageProgressArtifact artifact) {
        StageProgress known = StageProgressResolver.fromArtifact(artifact);
        AlignmentJob job = new AlignmentJob(id, JobStatus.QUEUED);
        job.setStartedAt(artifact.startedAt());
        job.setQueuedAt(artifact.startedAt());
        known.applyTo(job);

        if (artifact.isCompleted()) {
            job.markCompleted(Optional.ofNullable(artifact.completedAt()).orElse(clock.instant()));
            return Optional.of(job);
        }
        if (artifact.isFailed()) {
            job.markFailed(known.error(), Optional.ofNullable(artifact.failedAt()).orElse(clock.instant()));
            return Optional.of(job);
        }
        return Optional.empty();
    }
}
