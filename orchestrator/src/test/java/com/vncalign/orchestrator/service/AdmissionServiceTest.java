package com.vncalign.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vncalign.orchestrator.approval.ApprovalRegistry;
import com.vncalign.orchestrator.approval.ApprovalRegistry.ApprovalEntry;
import com.vncalign.orchestrator.config.AlignmentProperties;
import com.vncalign.orchestrator.executor.ArtifactLayout;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.store.JobStore;
import com.vncalign.orchestrator.store.SnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdmissionServiceTest {

    private static final String ID = "VNC_01";

    @TempDir Path workDir;

    @Mock ApprovalRegistry    approvals;
    @Mock PreparationPipeline preparation;
    @Mock QueueScheduler      scheduler;

    JobStore         store;
    ArtifactLayout   layout;
    AdmissionService admission;

    @BeforeEach
    void setUp() {
        AlignmentProperties props = AlignmentProperties.forWorkDir(workDir);
        store     = new JobStore(new SnapshotStore(props, new ObjectMapper()));
        layout    = new ArtifactLayout(props);
        admission = new AdmissionService(store, approvals, layout, preparation, scheduler);
    }

    @Test
    void requestAlignment_notApproved_rejected() {
        when(approvals.find(ID)).thenReturn(Optional.of(new ApprovalEntry("batch1/" + ID, false)));

        assertThatThrownBy(() -> admission.requestAlignment(ID))
                .isInstanceOf(AdmissionRejectedException.class)
                .hasMessage("Image must be approved before queuing for alignment");
        verifyNoInteractions(preparation);
    }

    @Test
    void requestAlignment_unknownImage_rejectedAsNotApproved() {
        when(approvals.find(ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> admission.requestAlignment(ID))
                .hasMessage(AdmissionService.NOT_APPROVED);
    }

    @Test
    void requestAlignment_noNrrdAndNoTiff_rejected() {
        when(approvals.find(ID)).thenReturn(Optional.of(new ApprovalEntry("batch1/" + ID, true)));

        assertThatThrownBy(() -> admission.requestAlignment(ID))
                .isInstanceOf(AdmissionRejectedException.class)
                .hasMessage("Source TIFF file not found");
        verify(preparation, never()).prepare(anyString());
    }

    @Test
    void requestAlignment_tiffUnderApprovalKey_handedToPreparation() throws Exception {
        Path tiff = layout.sourceTiff("batch1/" + ID);
        Files.createDirectories(tiff.getParent());
        Files.writeString(tiff, "II*");
        when(approvals.find(ID)).thenReturn(Optional.of(new ApprovalEntry("batch1/" + ID, true)));
        when(preparation.prepare(ID)).thenReturn(PreparationPipeline.Result.STARTED);

        assertThat(admission.requestAlignment(ID)).isEqualTo("Preparing " + ID + " for alignment");
    }

    @Test
    void requestAlignment_nrrdPresentWithoutTiff_accepted() throws Exception {
        Files.createDirectories(layout.nrrd(ID).getParent());
        Files.writeString(layout.nrrd(ID), "NRRD0004");
        when(approvals.find(ID)).thenReturn(Optional.of(new ApprovalEntry(ID, true)));
        when(preparation.prepare(ID)).thenReturn(PreparationPipeline.Result.QUEUED);

        assertThat(admission.requestAlignment(ID)).isEqualTo("Added " + ID + " to alignment queue");
    }

    @Test
    void requestAlignment_preparationPending_successWithoutSideEffects() {
        store.set(new AlignmentJob(ID, JobStatus.PREPARING));
        when(preparation.isPending(ID)).thenReturn(true);

        assertThat(admission.requestAlignment(ID)).contains("already being prepared");
        verify(preparation, never()).prepare(anyString());
        verifyNoInteractions(approvals);
    }

    @Test
    void requestAlignment_pendingButResetRecord_checkedAndHandedToPreparation() throws Exception {
        Files.createDirectories(layout.nrrd(ID).getParent());
        Files.writeString(layout.nrrd(ID), "NRRD0004");
        when(preparation.isPending(ID)).thenReturn(true);
        when(approvals.find(ID)).thenReturn(Optional.of(new ApprovalEntry(ID, true)));
        when(preparation.prepare(ID)).thenReturn(PreparationPipeline.Result.STARTED);

        assertThat(admission.requestAlignment(ID)).isEqualTo("Preparing " + ID + " for alignment");
        verify(preparation).prepare(ID);
    }

    @Test
    void requestAlignment_queuedOrProcessing_success() {
        store.set(new AlignmentJob("Q", JobStatus.QUEUED));
        store.appendToQueue("Q");
        store.set(new AlignmentJob("P", JobStatus.PROCESSING));

        assertThat(admission.requestAlignment("Q")).contains("already queued or processing");
        assertThat(admission.requestAlignment("P")).contains("already queued or processing");
        verifyNoInteractions(approvals);
    }

    @Test
    void requestAlignment_completed_successWithoutRerun() {
        store.set(new AlignmentJob(ID, JobStatus.COMPLETED));

        assertThat(admission.requestAlignment(ID)).contains("already completed");
        verify(preparation, never()).prepare(anyString());
    }

    @Test
    void reset_removesRecordAndQueueEntry_onlyThat() throws Exception {
        store.set(new AlignmentJob(ID, JobStatus.QUEUED));
        store.appendToQueue(ID);
        Path output = layout.alignedSignal(ID);
        Files.createDirectories(output.getParent());
        Files.writeString(output, "NRRD0004");

        assertThat(admission.reset(ID)).isTrue();

        assertThat(store.get(ID)).isEmpty();
        assertThat(store.queue()).isEmpty();
        assertThat(output).exists();
        assertThat(admission.reset(ID)).isFalse();
    }
}
