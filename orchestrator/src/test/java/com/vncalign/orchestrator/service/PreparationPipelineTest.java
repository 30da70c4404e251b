package com.vncalign.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vncalign.orchestrator.config.AlignmentProperties;
import com.vncalign.orchestrator.executor.ArtifactLayout;
import com.vncalign.orchestrator.executor.FakeProcess;
import com.vncalign.orchestrator.executor.ProcessLauncher;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.model.PreparationStep;
import com.vncalign.orchestrator.service.PreparationPipeline.Result;
import com.vncalign.orchestrator.store.JobStore;
import com.vncalign.orchestrator.store.SnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PreparationPipelineTest {

    private static final String  ID     = "VNC_01";
    private static final Instant NOW    = Instant.parse("2025-03-01T10:00:00Z");
    private static final Executor INLINE = Runnable::run;

    @TempDir Path workDir;

    @Mock ProcessLauncher launcher;
    @Mock QueueScheduler  scheduler;
    @Mock TaskScheduler   taskScheduler;

    JobStore            store;
    ArtifactLayout      layout;
    PreparationPipeline pipeline;

    @BeforeEach
    void setUp() throws Exception {
        AlignmentProperties props = AlignmentProperties.forWorkDir(workDir);
        store    = new JobStore(new SnapshotStore(props, new ObjectMapper()));
        layout   = new ArtifactLayout(props);
        pipeline = new PreparationPipeline(store, layout, launcher, scheduler, taskScheduler,
                INLINE, INLINE, Clock.fixed(NOW, ZoneOffset.UTC), props);

        Files.createDirectories(layout.nrrd(ID).getParent());
        Files.createDirectories(layout.signalChannel(ID).getParent());
    }

    @Test
    void prepare_inputsPresent_enqueuesWithoutSpawning() throws Exception {
        createNrrd();
        createChannels();
        when(scheduler.enqueue(ID)).thenReturn(true);

        assertThat(pipeline.prepare(ID)).isEqualTo(Result.QUEUED);

        verifyNoInteractions(launcher);
        verify(scheduler).enqueue(ID);
        assertThat(pipeline.isPending(ID)).isFalse();
    }

    @Test
    void prepare_nrrdMissing_convertsThenSplitsThenEnqueues() throws Exception {
        FakeProcess convert = new FakeProcess();
        FakeProcess split   = new FakeProcess();
        when(launcher.start(anyList(), any())).thenReturn(convert, split);

        assertThat(pipeline.prepare(ID)).isEqualTo(Result.STARTED);

        verify(launcher).start(eq(List.of("python3", "convert_tiff_to_nrrd.py", ID)), eq(workDir));
        AlignmentJob job = store.get(ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PREPARING);
        assertThat(job.getCurrentStage()).isEqualTo(PreparationStep.CONVERT_NRRD.stageName());
        assertThat(job.getQueuedAt()).isEqualTo(NOW);
        assertThat(pipeline.isPending(ID)).isTrue();

        createNrrd();
        convert.exit(0);

        verify(launcher).start(eq(List.of("python3", "split_channels.py", ID)), eq(workDir));
        assertThat(store.get(ID).orElseThrow().getCurrentStage()).isEqualTo("split_channels");
        verify(scheduler, never()).enqueue(anyString());

        createChannels();
        split.exit(0);

        verify(scheduler).enqueue(ID);
        assertThat(pipeline.isPending(ID)).isFalse();
    }

    @Test
    void prepare_convertAlsoWritesChannels_splitSkipped() throws Exception {
        FakeProcess convert = new FakeProcess();
        when(launcher.start(anyList(), any())).thenReturn(convert);

        pipeline.prepare(ID);
        createNrrd();
        createChannels();
        convert.exit(0);

        verify(launcher, times(1)).start(anyList(), any());
        verify(scheduler).enqueue(ID);
    }

    @Test
    void prepare_onlyChannelsMissing_runsSplitOnly() throws Exception {
        createNrrd();
        when(launcher.start(anyList(), any())).thenReturn(new FakeProcess());

        pipeline.prepare(ID);

        verify(launcher).start(eq(List.of("python3", "split_channels.py", ID)), eq(workDir));
        assertThat(store.get(ID).orElseThrow().getCurrentStage()).isEqualTo("split_channels");
    }

    @Test
    void prepare_convertFails_jobFailedAndNeverQueued() throws Exception {
        FakeProcess convert = new FakeProcess(11, "", "tifffile: not a TIFF");
        when(launcher.start(anyList(), any())).thenReturn(convert);

        pipeline.prepare(ID);
        convert.exit(1);

        AlignmentJob job = store.get(ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("Failed to convert TIFF to NRRD");
        assertThat(job.getCompletedAt()).isEqualTo(NOW);
        assertThat(pipeline.isPending(ID)).isFalse();
        verify(scheduler, never()).enqueue(anyString());
    }

    @Test
    void prepare_splitCannotStart_jobFailedWithChannelMessage() throws Exception {
        createNrrd();
        when(launcher.start(anyList(), any())).thenThrow(new IOException("python3: not found"));

        assertThat(pipeline.prepare(ID)).isEqualTo(Result.STARTED);

        AlignmentJob job = store.get(ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("Failed to create channel files");
        verify(scheduler, never()).enqueue(anyString());
    }

    @Test
    void prepare_stepTimesOut_jobFailed() throws Exception {
        FakeProcess convert = new FakeProcess();
        when(launcher.start(anyList(), any())).thenReturn(convert);

        pipeline.prepare(ID);
        ArgumentCaptor<Runnable> timeout = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(timeout.capture(), any(Instant.class));
        timeout.getValue().run();

        assertThat(convert.wasDestroyed()).isTrue();
        AlignmentJob job = store.get(ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("Failed to convert TIFF to NRRD");
    }

    @Test
    void prepare_whilePending_isNoOp() throws Exception {
        when(launcher.start(anyList(), any())).thenReturn(new FakeProcess());

        pipeline.prepare(ID);

        assertThat(pipeline.prepare(ID)).isEqualTo(Result.ALREADY_PREPARING);
        verify(launcher, times(1)).start(anyList(), any());
    }

    @Test
    void prepare_resetDuringStep_notQueuedAfterwards() throws Exception {
        createNrrd();
        FakeProcess split = new FakeProcess();
        when(launcher.start(anyList(), any())).thenReturn(split);

        pipeline.prepare(ID);
        store.delete(ID);
        createChannels();
        split.exit(0);

        verify(scheduler, never()).enqueue(anyString());
        assertThat(store.get(ID)).isEmpty();
        assertThat(pipeline.isPending(ID)).isFalse();
    }

    @Test
    void prepare_requestedAgainAfterResetDuringStep_takesOverRunningStep() throws Exception {
        createNrrd();
        FakeProcess split = new FakeProcess();
        when(launcher.start(anyList(), any())).thenReturn(split);

        pipeline.prepare(ID);
        store.delete(ID);

        assertThat(pipeline.prepare(ID)).isEqualTo(Result.STARTED);
        AlignmentJob job = store.get(ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PREPARING);
        assertThat(job.getCurrentStage()).isEqualTo("split_channels");
        assertThat(job.getQueuedAt()).isEqualTo(NOW);

        createChannels();
        split.exit(0);

        verify(launcher, times(1)).start(anyList(), any());
        verify(scheduler).enqueue(ID);
        assertThat(pipeline.isPending(ID)).isFalse();
    }

    @Test
    void prepare_requestedAgainAfterResetDuringStep_failureLandsOnNewRecord() throws Exception {
        createNrrd();
        FakeProcess split = new FakeProcess(7, "", "no channels found");
        when(launcher.start(anyList(), any())).thenReturn(split);

        pipeline.prepare(ID);
        store.delete(ID);
        pipeline.prepare(ID);
        split.exit(1);

        AlignmentJob job = store.get(ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getError()).isEqualTo("Failed to create channel files");
        assertThat(pipeline.isPending(ID)).isFalse();
        verify(scheduler, never()).enqueue(anyString());
    }

    @Test
    void prepare_previouslyFailedJob_startsFreshAttempt() throws Exception {
        AlignmentJob failed = new AlignmentJob(ID, JobStatus.FAILED);
        failed.setError("Failed to convert TIFF to NRRD");
        failed.setQueuedAt(NOW.minusSeconds(3600));
        store.set(failed);
        when(launcher.start(anyList(), any())).thenReturn(new FakeProcess());

        pipeline.prepare(ID);

        AlignmentJob job = store.get(ID).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.PREPARING);
        assertThat(job.getError()).isEmpty();
        assertThat(job.getQueuedAt()).isEqualTo(NOW);
    }

    private void createNrrd() throws IOException {
        Files.writeString(layout.nrrd(ID), "NRRD0004");
    }

    private void createChannels() throws IOException {
        Files.writeString(layout.signalChannel(ID), "NRRD0004");
        Files.writeString(layout.backgroundChannel(ID), "NRRD0004");
    }
}
