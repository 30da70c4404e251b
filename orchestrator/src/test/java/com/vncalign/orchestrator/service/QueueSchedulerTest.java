package com.vncalign.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vncalign.orchestrator.config.AlignmentProperties;
import com.vncalign.orchestrator.inspect.LiveJobInspector;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.store.JobStore;
import com.vncalign.orchestrator.store.SnapshotStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * QueueScheduler against a real JobStore. The supervisor is a mock whose
 * runs finish when the test completes their future; delayed admissions are
 * captured from the TaskScheduler mock and run by hand.
 */
@ExtendWith(MockitoExtension.class)
class QueueSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir Path workDir;

    @Mock LiveJobInspector  inspector;
    @Mock ProcessSupervisor supervisor;
    @Mock TaskScheduler     taskScheduler;

    JobStore       store;
    QueueScheduler scheduler;

    @BeforeEach
    void setUp() {
        AlignmentProperties props = AlignmentProperties.forWorkDir(workDir);
        store     = new JobStore(new SnapshotStore(props, new ObjectMapper()));
        scheduler = new QueueScheduler(store, inspector, supervisor, taskScheduler,
                Clock.fixed(NOW, ZoneOffset.UTC), props, new SimpleMeterRegistry());
        scheduler.open();
    }

    // ------------------------------------------------------------------
    // enqueue()
    // ------------------------------------------------------------------

    @Test
    void enqueue_freeSlot_startsJobImmediately() {
        when(inspector.runningJobIds()).thenReturn(Set.of());
        when(supervisor.run("A")).thenReturn(new CompletableFuture<>());

        assertThat(scheduler.enqueue("A")).isTrue();

        AlignmentJob job = store.get("A").orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(job.getCurrentStage()).isEqualTo("initializing");
        assertThat(job.getStartedAt()).isEqualTo(NOW);
        assertThat(job.getQueuedAt()).isEqualTo(NOW);
        assertThat(store.queue()).isEmpty();
        assertThat(scheduler.currentJobId()).contains("A");
    }

    @Test
    void enqueue_slotBusy_jobsWaitInFifoOrder() {
        when(inspector.runningJobIds()).thenReturn(Set.of());
        when(supervisor.run(anyString())).thenReturn(new CompletableFuture<>());

        scheduler.enqueue("A");
        scheduler.enqueue("B");
        scheduler.enqueue("C");

        assertThat(store.queue()).containsExactly("B", "C");
        assertThat(store.get("B").orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
        verify(supervisor, times(1)).run(anyString());
    }

    @Test
    void enqueue_alreadyQueuedProcessingOrCompleted_isNoOp() {
        when(inspector.runningJobIds()).thenReturn(Set.of());
        when(supervisor.run("A")).thenReturn(new CompletableFuture<>());
        scheduler.enqueue("A");
        scheduler.enqueue("B");
        store.set(new AlignmentJob("C", JobStatus.COMPLETED));

        assertThat(scheduler.enqueue("A")).isFalse();
        assertThat(scheduler.enqueue("B")).isFalse();
        assertThat(scheduler.enqueue("C")).isFalse();
        assertThat(store.queue()).containsExactly("B");
    }

    @Test
    void enqueue_failedJob_startsFreshAttempt() {
        AlignmentJob failed = new AlignmentJob("A", JobStatus.FAILED);
        failed.setError("Alignment exited with code 1");
        failed.setCompletedAt(NOW.minusSeconds(60));
        store.set(failed);
        scheduler = closedScheduler();

        scheduler.enqueue("A");

        AlignmentJob job = store.get("A").orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getError()).isEmpty();
        assertThat(job.getCompletedAt()).isNull();
        assertThat(job.getProgress()).isZero();
    }

    @Test
    void enqueue_beforeOpen_queuesWithoutStarting() {
        scheduler = closedScheduler();

        scheduler.enqueue("A");

        assertThat(store.queue()).containsExactly("A");
        verifyNoInteractions(supervisor, inspector);
    }

    // ------------------------------------------------------------------
    // Slot hand-over
    // ------------------------------------------------------------------

    @Test
    void runFinished_nextJobAdmittedAfterSettleDelay() {
        when(inspector.runningJobIds()).thenReturn(Set.of());
        CompletableFuture<AlignmentJob> runA = new CompletableFuture<>();
        when(supervisor.run("A")).thenReturn(runA);
        when(supervisor.run("B")).thenReturn(new CompletableFuture<>());
        scheduler.enqueue("A");
        scheduler.enqueue("B");

        // The supervisor finalizes the record before completing the run.
        AlignmentJob done = store.update("A", j -> j.markCompleted(NOW)).orElseThrow();
        runA.complete(done);

        verify(supervisor, never()).run("B");
        ArgumentCaptor<Runnable> admission = ArgumentCaptor.forClass(Runnable.class);
        ArgumentCaptor<Instant>  at        = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler).schedule(admission.capture(), at.capture());
        assertThat(at.getValue()).isEqualTo(NOW.plusSeconds(1));

        admission.getValue().run();

        verify(supervisor).run("B");
        assertThat(store.get("B").orElseThrow().getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(store.queue()).isEmpty();
    }

    @Test
    void admitNext_foreignExecutorRunning_backsOffWithoutStarting() {
        when(inspector.runningJobIds()).thenReturn(Set.of("SOMEONE_ELSE"));

        scheduler.enqueue("A");

        verify(supervisor, never()).run(anyString());
        verify(taskScheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(30)));
        assertThat(store.queue()).containsExactly("A");
        assertThat(store.get("A").orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void admitNext_supervisorThrows_jobFinalizedAndSlotReleased() {
        when(inspector.runningJobIds()).thenReturn(Set.of());
        when(supervisor.run("A")).thenThrow(new IllegalStateException("boom"));

        scheduler.enqueue("A");

        verify(supervisor).finishWithoutProcess("A", "Failed to start alignment: boom");
        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    void remove_dropsQueuedJob() {
        scheduler = closedScheduler();
        scheduler.enqueue("A");
        scheduler.enqueue("B");

        assertThat(scheduler.remove("A")).isTrue();

        assertThat(store.queue()).containsExactly("B");
    }

    private QueueScheduler closedScheduler() {
        return new QueueScheduler(store, inspector, supervisor, taskScheduler,
                Clock.fixed(NOW, ZoneOffset.UTC), AlignmentProperties.forWorkDir(workDir),
                new SimpleMeterRegistry());
    }
}
