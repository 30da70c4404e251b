package com.vncalign.orchestrator.store;

import com.vncalign.orchestrator.model.AlignmentJob;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * In-memory job records and the FIFO alignment queue, mirrored to the
 * snapshot file after every change.
 *
 * All access is synchronized on this instance. A mutation made outside
 * {@link #atomically} is written to disk before the call returns; inside it,
 * the snapshot is written once when the outermost block finishes. Callers
 * that need check-then-act semantics (the queue scheduler, admission) wrap
 * their logic in {@link #atomically}.
 *
 * Returned jobs are copies. Change a record through {@link #set} or
 * {@link #update}, never by mutating a returned instance.
 */
@Component
public class JobStore {

    private final SnapshotStore snapshots;

    private final Map<String, AlignmentJob> jobs  = new LinkedHashMap<>();
    private final List<String>              queue = new ArrayList<>();

    private int     batchDepth;
    private boolean dirty;

    public JobStore(SnapshotStore snapshots) {
        this.snapshots = snapshots;
    }

    // ------------------------------------------------------------------
    // Records
    // ------------------------------------------------------------------

    public synchronized Optional<AlignmentJob> get(String id) {
        AlignmentJob job = jobs.get(id);
        return job == null ? Optional.empty() : Optional.of(job.copy());
    }

    public synchronized List<AlignmentJob> all() {
        return jobs.values().stream().map(AlignmentJob::copy).toList();
    }

    public synchronized void set(AlignmentJob job) {
        if (job.getId() == null) throw new IllegalArgumentException("job id must be set");
        jobs.put(job.getId(), job.copy());
        changed();
    }

    /**
     * Apply {@code mutator} to the stored record and persist.
     *
     * @return the updated record, or empty if there is no record for {@code id}
     */
    public synchronized Optional<AlignmentJob> update(String id, Consumer<AlignmentJob> mutator) {
        AlignmentJob job = jobs.get(id);
        if (job == null) return Optional.empty();
        mutator.accept(job);
        changed();
        return Optional.of(job.copy());
    }

    /** Remove the record and any queue entry. Returns false if neither existed. */
    public synchronized boolean delete(String id) {
        boolean removed = jobs.remove(id) != null;
        removed |= queue.remove(id);
        if (removed) changed();
        return removed;
    }

    // ------------------------------------------------------------------
    // Queue
    // ------------------------------------------------------------------

    public synchronized List<String> queue() {
        return List.copyOf(queue);
    }

    public synchronized boolean isQueued(String id) {
        return queue.contains(id);
    }

    /** Append unless already present. */
    public synchronized boolean appendToQueue(String id) {
        if (queue.contains(id)) return false;
        queue.add(id);
        changed();
        return true;
    }

    public synchronized Optional<String> pollQueue() {
        if (queue.isEmpty()) return Optional.empty();
        String head = queue.remove(0);
        changed();
        return Optional.of(head);
    }

    public synchronized boolean removeFromQueue(String id) {
        boolean removed = queue.remove(id);
        if (removed) changed();
        return removed;
    }

    /** 1-based position in the queue, empty when not queued. */
    public synchronized OptionalInt queuePosition(String id) {
        int idx = queue.indexOf(id);
        return idx < 0 ? OptionalInt.empty() : OptionalInt.of(idx + 1);
    }

    // ------------------------------------------------------------------
    // Snapshot
    // ------------------------------------------------------------------

    public synchronized PersistedSnapshot snapshot() {
        Map<String, AlignmentJob> copies = new LinkedHashMap<>();
        jobs.forEach((id, job) -> copies.put(id, job.copy()));
        return new PersistedSnapshot(queue, copies);
    }

    /**
     * Replace the in-memory state with {@code snapshot} without writing it back.
     * Queue entries without a job record are dropped, as are duplicates.
     */
    public synchronized void restore(PersistedSnapshot snapshot) {
        jobs.clear();
        queue.clear();
        snapshot.jobs().forEach((id, job) -> {
            AlignmentJob copy = job.copy();
            copy.setId(id);
            jobs.put(id, copy);
        });
        for (String id : snapshot.queue()) {
            if (jobs.containsKey(id) && !queue.contains(id)) {
                queue.add(id);
            }
        }
    }

    /**
     * Run {@code work} under the store lock and persist once at the end if
     * anything changed.
     */
    public synchronized <T> T atomically(Supplier<T> work) {
        batchDepth++;
        try {
            return work.get();
        } finally {
            batchDepth--;
            if (batchDepth == 0 && dirty) {
                flush();
            }
        }
    }

    public void runAtomically(Runnable work) {
        atomically(() -> {
            work.run();
            return null;
        });
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private void changed() {
        dirty = true;
        if (batchDepth == 0) {
            flush();
        }
    }

    private void flush() {
        dirty = false;
        snapshots.write(snapshot());
    }
}
