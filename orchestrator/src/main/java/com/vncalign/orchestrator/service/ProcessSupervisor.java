package com.vncalign.orchestrator.service;

import com.vncalign.orchestrator.config.AlignmentProperties;
import com.vncalign.orchestrator.executor.MonitoredProcess;
import com.vncalign.orchestrator.executor.ProcessLauncher;
import com.vncalign.orchestrator.executor.ProcessOutcome;
import com.vncalign.orchestrator.inspect.PidFileTracker;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.progress.StageProgress;
import com.vncalign.orchestrator.progress.StageProgressResolver;
import com.vncalign.orchestrator.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the alignment executor for the job holding the execution slot.
 *
 * One run:
 *   1. spawn align_single_cmtk.sh {id} with a hard timeout, capturing the
 *      tail of its output and recording its pid;
 *   2. while it runs, {@link #pollProgress()} mirrors the executor's stage
 *      progress into the job record;
 *   3. on exit, write the terminal state (completed / failed) and complete
 *      the future returned by {@link #run}, which frees the slot.
 *
 * A spawn failure is finalized exactly like a failed exit.
 */
@Service
public class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    static final String OUTCOME_COMPLETED = "completed";
    static final String OUTCOME_FAILED    = "failed";
    static final String OUTCOME_TIMEOUT   = "timeout";

    private final JobStore              store;
    private final ProcessLauncher       launcher;
    private final StageProgressResolver progress;
    private final PidFileTracker        pidFiles;
    private final TaskScheduler         taskScheduler;
    private final Executor              ioExecutor;
    private final Clock                 clock;
    private final MeterRegistry         meterRegistry;

    private final List<String> command;
    private final Path         workDir;
    private final Duration     timeout;
    private final int          tailLines;

    // Normally holds at most one entry: the job in the slot.
    private final Map<String, Instant> active = new ConcurrentHashMap<>();

    public ProcessSupervisor(JobStore store,
                             ProcessLauncher launcher,
                             StageProgressResolver progress,
                             PidFileTracker pidFiles,
                             TaskScheduler taskScheduler,
                             @Qualifier("processIoExecutor") Executor ioExecutor,
                             Clock clock,
                             AlignmentProperties props,
                             MeterRegistry meterRegistry) {
        this.store         = store;
        this.launcher      = launcher;
        this.progress      = progress;
        this.pidFiles      = pidFiles;
        this.taskScheduler = taskScheduler;
        this.ioExecutor    = ioExecutor;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
        this.command       = props.executor().command();
        this.workDir       = props.workDir();
        this.timeout       = props.executor().timeout();
        this.tailLines     = props.executor().outputTailLines();
    }

    // ------------------------------------------------------------------
    // Run
    // ------------------------------------------------------------------

    /**
     * Spawn the executor for {@code id}, which the queue scheduler has just
     * marked PROCESSING.
     *
     * @return completes with the terminal job record (or null if the record
     *         was reset while the process ran) once the run is over; never
     *         completes exceptionally for process failures
     */
    public CompletableFuture<AlignmentJob> run(String id) {
        AlignmentJob job = store.get(id)
                .filter(j -> j.getStatus() == JobStatus.PROCESSING)
                .orElseThrow(() -> new IllegalStateException("Job " + id + " does not hold the execution slot"));
        Instant startedAt = Objects.requireNonNull(job.getStartedAt(), "started_at");

        MDC.put("jobId", id);
        try {
            List<String> cmd = new ArrayList<>(command);
            cmd.add(id);

            MonitoredProcess process;
            try {
                process = MonitoredProcess.start(launcher, id, cmd, workDir, timeout, tailLines,
                        ioExecutor, taskScheduler);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to start alignment for {}: {}", id, e.getMessage());
                return CompletableFuture.completedFuture(
                        finish(id, startedAt, null, "Failed to start alignment: " + e.getMessage()));
            }

            active.put(id, startedAt);
            process.handle().ifPresent(handle -> pidFiles.register(id, handle));
            log.info("Alignment for {} running (pid {})", id,
                    process.pid().isPresent() ? process.pid().getAsLong() : "unknown");

            return process.outcome().handle((outcome, err) -> {
                MDC.put("jobId", id);
                try {
                    String spawnError = err == null ? null : "Alignment process lost: " + err.getMessage();
                    return finish(id, startedAt, outcome, spawnError);
                } finally {
                    MDC.remove("jobId");
                }
            });
        } finally {
            MDC.remove("jobId");
        }
    }

    /**
     * Finalize a job that was given the slot but never got a process.
     */
    public AlignmentJob finishWithoutProcess(String id, String error) {
        Instant startedAt = store.get(id).map(AlignmentJob::getStartedAt).orElse(null);
        return finish(id, startedAt, null, error);
    }

    public boolean isSupervising(String id) {
        return active.containsKey(id);
    }

    // ------------------------------------------------------------------
    // Progress polling
    // ------------------------------------------------------------------

    /**
     * Mirror the executor's stage progress into the record of every running
     * job. Registered as a fixed-delay task (see PollingConfig).
     */
    public void pollProgress() {
        active.forEach((id, startedAt) -> {
            try {
                refresh(id, startedAt);
            } catch (RuntimeException e) {
                log.warn("Progress poll for {} failed: {}", id, e.getMessage(), e);
            }
        });
    }

    private void refresh(String id, Instant startedAt) {
        StageProgress current = progress.getStageProgress(id, startedAt);
        if (current.source() == StageProgress.Source.NONE) return;

        Optional<AlignmentJob> job = store.get(id);
        if (job.isEmpty() || job.get().getStatus() != JobStatus.PROCESSING) return;
        if (!current.differsFrom(job.get())) return;

        store.update(id, j -> {
            if (j.getStatus() == JobStatus.PROCESSING && startedAt.equals(j.getStartedAt())) {
                current.applyTo(j);
            }
        });
        log.debug("Alignment {} at stage {} ({}%, from {})",
                id, current.currentStage(), current.progress(), current.source());
    }

    // ------------------------------------------------------------------
    // Finalization
    // ------------------------------------------------------------------

    private AlignmentJob finish(String id, Instant startedAt, ProcessOutcome outcome, String spawnError) {
        active.remove(id);
        pidFiles.unregister(id);

        StageProgress last = progress.getStageProgress(id, startedAt);
        Instant now = clock.instant();

        String outcomeTag;
        String error;
        if (outcome != null && outcome.succeeded()) {
            outcomeTag = OUTCOME_COMPLETED;
            error      = null;
        } else {
            outcomeTag = outcome != null && outcome.timedOut() ? OUTCOME_TIMEOUT : OUTCOME_FAILED;
            error      = failureMessage(outcome, spawnError, last);
        }

        AtomicBoolean finalized = new AtomicBoolean();
        Optional<AlignmentJob> updated = store.update(id, job -> {
            if (job.getStatus() != JobStatus.PROCESSING
                    || (startedAt != null && !startedAt.equals(job.getStartedAt()))) {
                return;   // reset (and possibly re-requested) while we ran
            }
            finalized.set(true);
            last.applyTo(job);
            if (error == null) {
                job.markCompleted(now);
            } else {
                job.markFailed(error, now);
            }
        });

        meterRegistry.counter("vncalign.alignment.runs", "outcome", outcomeTag).increment();
        if (startedAt != null) {
            meterRegistry.timer("vncalign.alignment.duration", "outcome", outcomeTag)
                    .record(Duration.between(startedAt, now));
        }

        if (!finalized.get()) {
            log.warn("Alignment for {} finished ({}) but its record was reset; output left on disk", id, outcomeTag);
            return updated.orElse(null);
        }
        if (error == null) {
            log.info("Alignment completed for {}", id);
        } else {
            log.error("Alignment failed for {}: {}", id, error);
        }
        return updated.get();
    }

    /**
     * Error precedence: the executor's own message, then how the process
     * ended (spawn failure, timeout), then its stderr, then the exit code.
     */
    private String failureMessage(ProcessOutcome outcome, String spawnError, StageProgress last) {
        if (last.hasError()) return last.error();
        if (spawnError != null) return spawnError;
        if (outcome == null) return "Alignment failed";
        if (outcome.timedOut()) return "Alignment timed out after " + timeout.toSeconds() + " seconds";
        if (!outcome.stderrTail().isBlank()) return outcome.stderrTail();
        return "Alignment exited with code " + outcome.exitCode();
    }
}
