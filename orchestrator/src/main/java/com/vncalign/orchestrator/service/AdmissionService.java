package com.vncalign.orchestrator.service;

import com.vncalign.orchestrator.approval.ApprovalRegistry;
import com.vncalign.orchestrator.approval.ApprovalRegistry.ApprovalEntry;
import com.vncalign.orchestrator.executor.ArtifactLayout;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.JobStatus;
import com.vncalign.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.util.Optional;

/**
 * Entry point for alignment requests.
 *
 * Requests are serialized: two concurrent requests for the same id see each
 * other's effect, so at most one preparation or queue entry results.
 */
@Service
public class AdmissionService {

    private static final Logger log = LoggerFactory.getLogger(AdmissionService.class);

    static final String NOT_APPROVED   = "Image must be approved before queuing for alignment";
    static final String TIFF_NOT_FOUND = "Source TIFF file not found";

    private final JobStore            store;
    private final ApprovalRegistry    approvals;
    private final ArtifactLayout      layout;
    private final PreparationPipeline preparation;
    private final QueueScheduler      scheduler;

    public AdmissionService(JobStore store,
                            ApprovalRegistry approvals,
                            ArtifactLayout layout,
                            PreparationPipeline preparation,
                            QueueScheduler scheduler) {
        this.store       = store;
        this.approvals   = approvals;
        this.layout      = layout;
        this.preparation = preparation;
        this.scheduler   = scheduler;
    }

    /**
     * Request alignment of {@code id}.
     *
     * @return the message reported to the caller
     * @throws AdmissionRejectedException if the image is not approved or its
     *         source TIFF is missing
     */
    public synchronized String requestAlignment(String id) {
        Optional<JobStatus> status = store.get(id).map(AlignmentJob::getStatus);
        // Pending without a record means the job was reset mid-preparation; admit it again.
        if (preparation.isPending(id) && status.isPresent()) {
            return "Alignment for " + id + " is already being prepared";
        }

        if (store.isQueued(id) || status.filter(s -> s == JobStatus.PROCESSING).isPresent()) {
            return "Alignment for " + id + " is already queued or processing";
        }
        if (status.filter(s -> s == JobStatus.COMPLETED).isPresent()) {
            return "Alignment for " + id + " is already completed; reset it to run again";
        }

        ApprovalEntry entry = approvals.find(id)
                .filter(ApprovalEntry::approved)
                .orElseThrow(() -> {
                    log.info("Rejected alignment request for {}: not approved", id);
                    return new AdmissionRejectedException(NOT_APPROVED);
                });

        if (!Files.exists(layout.nrrd(id)) && !Files.exists(layout.sourceTiff(entry.key()))) {
            log.info("Rejected alignment request for {}: {} missing", id, layout.sourceTiff(entry.key()));
            throw new AdmissionRejectedException(TIFF_NOT_FOUND);
        }

        return switch (preparation.prepare(id)) {
            case ALREADY_PREPARING -> "Alignment for " + id + " is already being prepared";
            case ALREADY_QUEUED    -> "Alignment for " + id + " is already queued or processing";
            case QUEUED            -> "Added " + id + " to alignment queue";
            case STARTED           -> "Preparing " + id + " for alignment";
        };
    }

    /**
     * Forget everything about {@code id}: its record and its queue entry.
     * Files on disk and a running executor are left alone.
     *
     * @return true if there was anything to forget
     */
    public synchronized boolean reset(String id) {
        boolean removed = store.atomically(() -> {
            boolean dequeued = scheduler.remove(id);
            return store.delete(id) || dequeued;
        });
        log.info("Reset alignment state for {} (existed: {})", id, removed);
        return removed;
    }
}
