package com.vncalign.orchestrator.service;

import com.vncalign.orchestrator.config.AlignmentProperties;
import com.vncalign.orchestrator.executor.ArtifactLayout;
import com.vncalign.orchestrator.inspect.LiveJobInspector;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.progress.StageProgress;
import com.vncalign.orchestrator.progress.StageProgressResolver;
import com.vncalign.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches executors found running at startup, which this server did not
 * spawn and therefore cannot wait on.
 *
 * Each {@link #check()} mirrors their progress into the store. Once an
 * adopted id is no longer reported running, the job is finalized from what
 * it left on disk and the slot is handed on.
 */
@Service
public class AdoptedJobMonitor {

    private static final Logger log = LoggerFactory.getLogger(AdoptedJobMonitor.class);

    static final String NO_OUTPUT_ERROR = "Process ended without producing output";

    private final JobStore              store;
    private final LiveJobInspector      inspector;
    private final StageProgressResolver progress;
    private final ArtifactLayout        layout;
    private final QueueScheduler        scheduler;
    private final Clock                 clock;
    private final Duration              settleDelay;

    private final Set<String> adopted = ConcurrentHashMap.newKeySet();

    public AdoptedJobMonitor(JobStore store,
                             LiveJobInspector inspector,
                             StageProgressResolver progress,
                             ArtifactLayout layout,
                             QueueScheduler scheduler,
                             Clock clock,
                             AlignmentProperties props) {
        this.store       = store;
        this.inspector   = inspector;
        this.progress    = progress;
        this.layout      = layout;
        this.scheduler   = scheduler;
        this.clock       = clock;
        this.settleDelay = props.executor().settleDelay();
    }

    public void adopt(String id) {
        if (adopted.add(id)) {
            log.info("Adopted running alignment for {}", id);
        }
    }

    boolean isAdopted(String id) {
        return adopted.contains(id);
    }

    /**
     * One monitoring pass. Registered as a fixed-delay task (see PollingConfig).
     */
    public void check() {
        if (adopted.isEmpty()) return;

        Set<String> running = inspector.runningJobIds();
        for (String id : Set.copyOf(adopted)) {
            MDC.put("jobId", id);
            try {
                if (running.contains(id)) {
                    mirror(id);
                } else {
                    finish(id);
                }
            } catch (RuntimeException e) {
                log.error("Monitoring adopted alignment {} failed: {}", id, e.getMessage(), e);
            } finally {
                MDC.remove("jobId");
            }
        }
    }

    private void mirror(String id) {
        // The run started before we did; any artifact is as good as we will get.
        StageProgress current = progress.getStageProgress(id, null);
        store.update(id, job -> {
            if (job.getStatus() == JobStatus.PROCESSING) current.applyTo(job);
        });
    }

    private void finish(String id) {
        adopted.remove(id);
        StageProgress last = progress.getStageProgress(id, null);
        boolean produced   = layout.hasFinalOutputs(id);
        Instant now        = clock.instant();

        store.update(id, job -> {
            if (job.getStatus() != JobStatus.PROCESSING) return;
            last.applyTo(job);
            if (produced) {
                job.markCompleted(now);
            } else {
                job.markFailed(last.hasError() ? last.error() : NO_OUTPUT_ERROR, now);
            }
        }).map(AlignmentJob::getStatus).ifPresent(status ->
                log.info("Adopted alignment for {} ended: {}", id, status.wireName()));

        scheduler.scheduleAdmission(settleDelay);
    }
}
