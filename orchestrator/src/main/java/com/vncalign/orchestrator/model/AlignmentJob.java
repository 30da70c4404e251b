package com.vncalign.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of one alignment request, keyed by image base.
 *
 * Instances held by {@link com.vncalign.orchestrator.store.JobStore} are never
 * handed out directly: readers always get a {@link #copy()}, and writers go
 * through the store so that every change is persisted.
 *
 * Serialized as-is into the snapshot file. Unknown properties are ignored on
 * read so that snapshots written by a newer build still load.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlignmentJob {

    private String    id;
    private JobStatus status   = JobStatus.QUEUED;
    private int       progress = 0;
    private String    currentStage;
    private String    error    = "";

    // Insertion order = order in which the executor entered the stages.
    private Map<String, StageTiming> stages = new LinkedHashMap<>();

    private Instant queuedAt;
    private Instant startedAt;
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    public AlignmentJob() {}   // required by Jackson

    public AlignmentJob(String id, JobStatus status) {
        this.id     = id;
        this.status = status;
    }

    public AlignmentJob copy() {
        AlignmentJob c = new AlignmentJob(id, status);
        c.progress     = progress;
        c.currentStage = currentStage;
        c.error        = error;
        c.stages       = new LinkedHashMap<>(stages);
        c.queuedAt     = queuedAt;
        c.startedAt    = startedAt;
        c.completedAt  = completedAt;
        return c;
    }

    // ------------------------------------------------------------------
    // Transitions shared by the scheduler, supervisor and reconciler
    // ------------------------------------------------------------------

    /**
     * Start a fresh attempt: clears the outcome of any earlier attempt and
     * stamps queued_at.
     */
    public void beginAttempt(JobStatus initial, Instant now) {
        status       = initial;
        progress     = 0;
        currentStage = null;
        error        = "";
        stages       = new LinkedHashMap<>();
        startedAt    = null;
        completedAt  = null;
        queuedAt     = now;
    }

    /** The job holds the execution slot from now on. */
    public void markProcessing(Instant now) {
        status       = JobStatus.PROCESSING;
        progress     = 0;
        currentStage = AlignmentStage.INITIALIZING.stageName();
        error        = "";
        stages       = new LinkedHashMap<>();
        startedAt    = now;
        completedAt  = null;
    }

    /** Terminal success: progress pinned to 100 and error cleared. */
    public void markCompleted(Instant now) {
        status       = JobStatus.COMPLETED;
        progress     = 100;
        currentStage = AlignmentStage.COMPLETED.stageName();
        error        = "";
        completedAt  = now;
    }

    /** Terminal failure. current_stage is left at the last stage entered. */
    public void markFailed(String message, Instant now) {
        status      = JobStatus.FAILED;
        error       = (message == null || message.isBlank()) ? "Unknown error" : message;
        completedAt = now;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String    getId()           { return id; }
    public JobStatus getStatus()       { return status; }
    public int       getProgress()     { return progress; }
    public String    getCurrentStage() { return currentStage; }
    public String    getError()        { return error; }
    public Instant   getQueuedAt()     { return queuedAt; }
    public Instant   getStartedAt()    { return startedAt; }
    public Instant   getCompletedAt()  { return completedAt; }
    public Map<String, StageTiming> getStages() { return stages; }

    public void setId(String id)                     { this.id = id; }
    public void setStatus(JobStatus status)          { this.status = status; }
    public void setProgress(int progress)            { this.progress = Math.max(0, Math.min(100, progress)); }
    public void setCurrentStage(String currentStage) { this.currentStage = currentStage; }
    public void setError(String error)               { this.error = error == null ? "" : error; }
    public void setQueuedAt(Instant queuedAt)        { this.queuedAt = queuedAt; }
    public void setStartedAt(Instant startedAt)      { this.startedAt = startedAt; }
    public void setCompletedAt(Instant completedAt)  { this.completedAt = completedAt; }

    public void setStages(Map<String, StageTiming> stages) {
        this.stages = stages == null ? new LinkedHashMap<>() : new LinkedHashMap<>(stages);
    }

    @Override
    public String toString() {
        return "AlignmentJob{" + id + ", " + status + ", stage=" + currentStage + ", " + progress + "%}";
    }
}
