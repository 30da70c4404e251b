package com.vncalign.orchestrator.service;

import com.vncalign.orchestrator.config.AlignmentProperties;
import com.vncalign.orchestrator.executor.ArtifactLayout;
import com.vncalign.orchestrator.executor.MonitoredProcess;
import com.vncalign.orchestrator.executor.ProcessLauncher;
import com.vncalign.orchestrator.executor.ProcessOutcome;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.model.PreparationStep;
import com.vncalign.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Produces the executor's inputs (the NRRD volume and the two channel files)
 * before a job may enter the alignment queue.
 *
 * Steps run one after another, each as a child process with its own
 * timeout. Nothing blocks: the next step is chained onto the previous
 * step's exit on {@code preparationExecutor}. A job whose inputs already
 * exist goes straight to the queue.
 *
 * A failed step fails the job; it is never enqueued.
 *
 * The pending set is only changed under the {@link JobStore} lock, together
 * with the check of the job record that goes with it. A job reset while a
 * step runs has no record; the chain stops at its next step boundary unless
 * the id was requested again in the meantime, in which case the new request
 * takes over the running chain.
 */
@Service
public class PreparationPipeline {

    private static final Logger log = LoggerFactory.getLogger(PreparationPipeline.class);

    public enum Result {
        /** A preparation for this id is already under way. */
        ALREADY_PREPARING,
        /** Inputs existed; the job went straight to the queue. */
        QUEUED,
        /** Inputs existed, but the job was already queued, processing or completed. */
        ALREADY_QUEUED,
        /** Preparation steps were started. */
        STARTED
    }

    private final JobStore       store;
    private final ArtifactLayout layout;
    private final ProcessLauncher launcher;
    private final QueueScheduler scheduler;
    private final TaskScheduler  taskScheduler;
    private final Executor       preparationExecutor;
    private final Executor       ioExecutor;
    private final Clock          clock;

    private final AlignmentProperties.Preparation settings;
    private final Path workDir;
    private final int  tailLines;

    private final Set<String> pending = ConcurrentHashMap.newKeySet();

    public PreparationPipeline(JobStore store,
                               ArtifactLayout layout,
                               ProcessLauncher launcher,
                               QueueScheduler scheduler,
                               TaskScheduler taskScheduler,
                               @Qualifier("preparationExecutor") Executor preparationExecutor,
                               @Qualifier("processIoExecutor") Executor ioExecutor,
                               Clock clock,
                               AlignmentProperties props) {
        this.store               = store;
        this.layout              = layout;
        this.launcher            = launcher;
        this.scheduler           = scheduler;
        this.taskScheduler       = taskScheduler;
        this.preparationExecutor = preparationExecutor;
        this.ioExecutor          = ioExecutor;
        this.clock               = clock;
        this.settings            = props.preparation();
        this.workDir             = props.workDir();
        this.tailLines           = props.executor().outputTailLines();
    }

    /**
     * Prepare {@code id} and enqueue it once its inputs exist.
     * Returns as soon as the first step has been spawned.
     */
    public Result prepare(String id) {
        Optional<Result> inFlight = store.atomically(() -> {
            if (pending.add(id)) return Optional.<Result>empty();
            if (store.get(id).isPresent()) return Optional.of(Result.ALREADY_PREPARING);
            reattach(id);
            return Optional.of(Result.STARTED);
        });
        if (inFlight.isPresent()) {
            return inFlight.get();
        }

        List<PreparationStep> missing = missingSteps(id);
        if (missing.isEmpty()) {
            store.runAtomically(() -> pending.remove(id));
            return scheduler.enqueue(id) ? Result.QUEUED : Result.ALREADY_QUEUED;
        }

        Instant now = clock.instant();
        store.runAtomically(() -> {
            AlignmentJob job = store.get(id).orElseGet(() -> new AlignmentJob(id, JobStatus.PREPARING));
            if (job.getStatus() == JobStatus.PREPARING && job.getQueuedAt() != null) {
                // Resubmitted after a restart: keep the original request time.
                job.setCurrentStage(missing.get(0).stageName());
            } else {
                job.beginAttempt(JobStatus.PREPARING, now);
                job.setCurrentStage(missing.get(0).stageName());
            }
            store.set(job);
        });

        log.info("Preparing {}: {}", id, missing);
        runNext(id, missing, 0);
        return Result.STARTED;
    }

    public boolean isPending(String id) {
        return pending.contains(id);
    }

    /** Steps whose output is missing, in execution order. */
    public List<PreparationStep> missingSteps(String id) {
        List<PreparationStep> steps = new ArrayList<>();
        if (isMissing(id, PreparationStep.CONVERT_NRRD))   steps.add(PreparationStep.CONVERT_NRRD);
        if (isMissing(id, PreparationStep.SPLIT_CHANNELS)) steps.add(PreparationStep.SPLIT_CHANNELS);
        return steps;
    }

    // ------------------------------------------------------------------
    // Step chain
    // ------------------------------------------------------------------

    private void runNext(String id, List<PreparationStep> steps, int index) {
        MDC.put("jobId", id);
        try {
            // A step may have produced the next one's output too.
            int next = index;
            while (next < steps.size() && !isMissing(id, steps.get(next))) next++;

            if (next == steps.size()) {
                finish(id);
                return;
            }

            PreparationStep step = steps.get(next);
            boolean current = store.atomically(() -> {
                Optional<AlignmentJob> job = store.update(id, j -> {
                    if (j.getStatus() == JobStatus.PREPARING) j.setCurrentStage(step.stageName());
                });
                if (job.isPresent() && job.get().getStatus() == JobStatus.PREPARING) return true;
                pending.remove(id);
                return false;
            });
            if (!current) {
                log.info("Preparation of {} abandoned: job was reset", id);
                return;
            }

            List<String> command = new ArrayList<>(commandFor(step));
            command.add(id);

            MonitoredProcess process;
            try {
                process = MonitoredProcess.start(launcher, id, command, workDir, settings.timeout(),
                        tailLines, ioExecutor, taskScheduler);
            } catch (IOException | RuntimeException e) {
                log.error("Could not start {} for {}: {}", step.stageName(), id, e.getMessage());
                fail(id, step);
                return;
            }

            int following = next + 1;
            process.outcome().whenCompleteAsync(
                    (outcome, err) -> onStepExit(id, step, steps, following, outcome, err),
                    preparationExecutor);
        } finally {
            MDC.remove("jobId");
        }
    }

    private void onStepExit(String id, PreparationStep step, List<PreparationStep> steps, int following,
                            ProcessOutcome outcome, Throwable err) {
        MDC.put("jobId", id);
        try {
            if (err != null || outcome == null || !outcome.succeeded()) {
                if (err != null) {
                    log.error("{} for {} failed: {}", step.stageName(), id, err.getMessage());
                } else if (outcome != null && outcome.timedOut()) {
                    log.error("{} for {} timed out after {}s", step.stageName(), id, settings.timeout().toSeconds());
                } else if (outcome != null) {
                    log.error("{} for {} exited with code {}: {}",
                            step.stageName(), id, outcome.exitCode(), outcome.stderrTail());
                }
                fail(id, step);
                return;
            }
            log.info("{} finished for {}", step.stageName(), id);
        } finally {
            MDC.remove("jobId");
        }
        runNext(id, steps, following);
    }

    private void finish(String id) {
        boolean preparing = store.atomically(() -> {
            pending.remove(id);
            return store.get(id).filter(j -> j.getStatus() == JobStatus.PREPARING).isPresent();
        });
        if (!preparing) {
            log.info("Preparation of {} finished after the job was reset; not queuing", id);
            return;
        }
        scheduler.enqueue(id);
    }

    /** A request for an id whose record was reset while its chain kept running. */
    private void reattach(String id) {
        AlignmentJob job = new AlignmentJob(id, JobStatus.PREPARING);
        job.beginAttempt(JobStatus.PREPARING, clock.instant());
        missingSteps(id).stream().findFirst().ifPresent(step -> job.setCurrentStage(step.stageName()));
        store.set(job);
        log.info("Preparation of {} requested again after a reset; resuming the running steps", id);
    }

    private void fail(String id, PreparationStep step) {
        Instant now = clock.instant();
        store.runAtomically(() -> {
            pending.remove(id);
            store.update(id, job -> {
                if (job.getStatus() != JobStatus.PREPARING) return;
                job.setProgress(0);
                job.markFailed(step.failureMessage(), now);
            });
        });
        log.error("Preparation failed for {}: {}", id, step.failureMessage());
    }

    private boolean isMissing(String id, PreparationStep step) {
        return switch (step) {
            case CONVERT_NRRD   -> !Files.exists(layout.nrrd(id));
            case SPLIT_CHANNELS -> !layout.hasChannels(id);
        };
    }

    private List<String> commandFor(PreparationStep step) {
        return switch (step) {
            case CONVERT_NRRD   -> settings.convertCommand();
            case SPLIT_CHANNELS -> settings.splitCommand();
        };
    }
}
