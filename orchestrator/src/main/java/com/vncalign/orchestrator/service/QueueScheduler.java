package com.vncalign.orchestrator.service;

import com.vncalign.orchestrator.config.AlignmentProperties;
import com.vncalign.orchestrator.inspect.LiveJobInspector;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.store.JobStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * FIFO queue in front of the single execution slot.
 *
 * The slot is free when no job is PROCESSING and the process table shows no
 * executor running. The second check catches executors this server does not
 * know about (an orphan from a crashed run, a second server instance): in
 * that case admission is retried after a backoff instead of starting a
 * competing run.
 *
 * Queue and slot changes happen inside {@link JobStore#atomically}, so the
 * claim of the head job is a single persisted step.
 */
@Service
public class QueueScheduler {

    private static final Logger log = LoggerFactory.getLogger(QueueScheduler.class);

    private final JobStore          store;
    private final LiveJobInspector  inspector;
    private final ProcessSupervisor supervisor;
    private final TaskScheduler     taskScheduler;
    private final Clock             clock;
    private final Duration          settleDelay;
    private final Duration          foreignBackoff;

    // Closed until startup reconciliation has finished.
    private volatile boolean open;

    public QueueScheduler(JobStore store,
                          LiveJobInspector inspector,
                          ProcessSupervisor supervisor,
                          TaskScheduler taskScheduler,
                          Clock clock,
                          AlignmentProperties props,
                          MeterRegistry meterRegistry) {
        this.store          = store;
        this.inspector      = inspector;
        this.supervisor     = supervisor;
        this.taskScheduler  = taskScheduler;
        this.clock          = clock;
        this.settleDelay    = props.executor().settleDelay();
        this.foreignBackoff = props.executor().foreignProcessBackoff();

        Gauge.builder("vncalign.queue.size", store, s -> s.queue().size())
                .description("Jobs waiting for the alignment slot")
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Queue
    // ------------------------------------------------------------------

    /**
     * Append {@code id} to the queue unless it is already queued, processing
     * or completed, then try to admit.
     *
     * @return true if the job was appended by this call
     */
    public boolean enqueue(String id) {
        boolean appended = store.atomically(() -> {
            Optional<AlignmentJob> existing = store.get(id);
            if (store.isQueued(id)) return false;
            if (existing.isPresent()) {
                JobStatus status = existing.get().getStatus();
                if (status == JobStatus.PROCESSING || status == JobStatus.COMPLETED) return false;
            }

            Instant now = clock.instant();
            AlignmentJob job = existing.orElseGet(() -> new AlignmentJob(id, JobStatus.QUEUED));
            if (job.getStatus() == JobStatus.FAILED || existing.isEmpty()) {
                job.beginAttempt(JobStatus.QUEUED, now);
            } else {
                // Coming from preparation or a restart: keep the original queued_at.
                job.setStatus(JobStatus.QUEUED);
                job.setProgress(0);
                job.setError("");
                if (job.getQueuedAt() == null) job.setQueuedAt(now);
            }
            store.set(job);
            store.appendToQueue(id);
            return true;
        });
        if (appended) {
            log.info("Added {} to alignment queue (position {})",
                    id, store.queuePosition(id).orElse(-1));
            admitNext();
        }
        return appended;
    }

    /** Drop {@code id} from the queue. Does not touch a running alignment. */
    public boolean remove(String id) {
        return store.removeFromQueue(id);
    }

    // ------------------------------------------------------------------
    // Slot
    // ------------------------------------------------------------------

    /**
     * Hand the head of the queue to the supervisor if the slot is free.
     * Safe to call at any time, from any thread; at most one caller wins.
     */
    public void admitNext() {
        if (!open || !slotFreeWithWork()) {
            return;
        }

        Set<String> running = inspector.runningJobIds();
        if (!running.isEmpty()) {
            log.info("Alignment process already running for {}, retrying admission in {}s",
                    running, foreignBackoff.toSeconds());
            scheduleAdmission(foreignBackoff);
            return;
        }

        Optional<String> claimed = store.atomically(() -> {
            if (!slotFreeWithWork()) return Optional.<String>empty();
            String id = store.pollQueue().orElseThrow();
            Instant now = clock.instant();
            store.update(id, job -> job.markProcessing(now));
            return Optional.of(id);
        });

        claimed.ifPresent(this::start);
    }

    /** Id of the job holding the slot, if any. */
    Optional<String> currentJobId() {
        return store.all().stream()
                .filter(j -> j.getStatus() == JobStatus.PROCESSING)
                .map(AlignmentJob::getId)
                .findFirst();
    }

    /** Try admission again after {@code delay}. */
    public void scheduleAdmission(Duration delay) {
        taskScheduler.schedule(this::admitNextSafely, clock.instant().plus(delay));
    }

    /** Start admitting. Called once startup reconciliation is done. */
    public void open() {
        open = true;
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private void start(String id) {
        log.info("Starting alignment for {}", id);
        CompletableFuture<AlignmentJob> run;
        try {
            run = supervisor.run(id);
        } catch (RuntimeException e) {
            log.error("Supervisor rejected {}: {}", id, e.getMessage(), e);
            supervisor.finishWithoutProcess(id, "Failed to start alignment: " + e.getMessage());
            release(id);
            return;
        }
        run.whenComplete((job, err) -> {
            if (err != null) {
                log.error("Alignment run for {} ended abnormally", id, err);
            }
            release(id);
        });
    }

    private void release(String id) {
        log.debug("Slot released by {}, next admission in {} ms", id, settleDelay.toMillis());
        scheduleAdmission(settleDelay);
    }

    private void admitNextSafely() {
        try {
            admitNext();
        } catch (RuntimeException e) {
            log.error("Admission attempt failed: {}", e.getMessage(), e);
        }
    }

    private boolean slotFreeWithWork() {
        return store.atomically(() -> !store.queue().isEmpty()
                && store.all().stream().noneMatch(j -> j.getStatus() == JobStatus.PROCESSING));
    }
}
