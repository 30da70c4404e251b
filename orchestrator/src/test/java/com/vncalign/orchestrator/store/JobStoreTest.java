package com.vncalign.orchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class JobStoreTest {

    @TempDir Path dir;

    SnapshotStore snapshots;
    JobStore      store;

    @BeforeEach
    void setUp() {
        snapshots = new SnapshotStore(dir.resolve("alignment-state.json"), new ObjectMapper());
        store     = new JobStore(snapshots);
    }

    @Test
    void set_persistsBeforeReturning() {
        store.set(new AlignmentJob("VNC_A", JobStatus.QUEUED));
        store.appendToQueue("VNC_A");

        PersistedSnapshot onDisk = snapshots.load();
        assertThat(onDisk.jobs()).containsKey("VNC_A");
        assertThat(onDisk.queue()).containsExactly("VNC_A");
    }

    @Test
    void get_returnsCopy_mutationsDoNotLeak() {
        store.set(new AlignmentJob("VNC_A", JobStatus.QUEUED));

        store.get("VNC_A").orElseThrow().setStatus(JobStatus.FAILED);

        assertThat(store.get("VNC_A").orElseThrow().getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void appendToQueue_isFifoAndRejectsDuplicates() {
        for (String id : List.of("A", "B", "C")) {
            store.set(new AlignmentJob(id, JobStatus.QUEUED));
            store.appendToQueue(id);
        }

        assertThat(store.appendToQueue("B")).isFalse();
        assertThat(store.queue()).containsExactly("A", "B", "C");
        assertThat(store.queuePosition("C")).hasValue(3);
        assertThat(store.pollQueue()).contains("A");
        assertThat(store.queuePosition("C")).hasValue(2);
        assertThat(store.queuePosition("A")).isEmpty();
    }

    @Test
    void delete_removesRecordAndQueueEntry() {
        store.set(new AlignmentJob("VNC_A", JobStatus.QUEUED));
        store.appendToQueue("VNC_A");

        assertThat(store.delete("VNC_A")).isTrue();

        assertThat(store.get("VNC_A")).isEmpty();
        assertThat(store.queue()).isEmpty();
        assertThat(store.delete("VNC_A")).isFalse();
    }

    @Test
    void update_missingRecord_returnsEmpty() {
        assertThat(store.update("nope", job -> job.setProgress(50))).isEmpty();
    }

    @Test
    void restore_dropsQueueEntriesWithoutRecordsAndDuplicates() {
        AlignmentJob a = new AlignmentJob("A", JobStatus.QUEUED);
        store.restore(new PersistedSnapshot(List.of("A", "ghost", "A"), Map.of("A", a)));

        assertThat(store.queue()).containsExactly("A");
        assertThat(store.get("A")).isPresent();
    }

    @Test
    void atomically_writesOnceForWholeBatch() {
        SnapshotStore counting = mock(SnapshotStore.class);
        JobStore batched = new JobStore(counting);

        batched.runAtomically(() -> {
            batched.set(new AlignmentJob("A", JobStatus.QUEUED));
            batched.appendToQueue("A");
            batched.update("A", job -> job.setProgress(5));
            verify(counting, never()).write(any());
        });

        verify(counting, times(1)).write(any());
    }

    @Test
    void atomically_nothingChanged_writesNothing() {
        SnapshotStore counting = mock(SnapshotStore.class);
        JobStore batched = new JobStore(counting);

        boolean empty = batched.atomically(() -> batched.queue().isEmpty());

        assertThat(empty).isTrue();
        verify(counting, never()).write(any());
    }
}
