package com.vncalign.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.StageTiming;

import java.time.Instant;
import java.util.Map;

/**
 * One entry of GET /api/alignment-status.
 *
 * queue_position is 1-based while the job waits, null otherwise.
 * is_current marks the job holding the execution slot. The job id is sent
 * both as id and as image_base, the name the review UI reads.
 */
public record JobStatusView(
        @JsonProperty("id")             String                   id,
        @JsonProperty("image_base")     String                   imageBase,
        @JsonProperty("status")         String                   status,
        @JsonProperty("progress")       int                      progress,
        @JsonProperty("current_stage")  String                   currentStage,
        @JsonProperty("stages")         Map<String, StageTiming> stages,
        @JsonProperty("error")          String                   error,
        @JsonProperty("queued_at")      Instant                  queuedAt,
        @JsonProperty("started_at")     Instant                  startedAt,
        @JsonProperty("completed_at")   Instant                  completedAt,
        @JsonProperty("queue_position") Integer                  queuePosition,
        @JsonProperty("is_current")     boolean                  isCurrent
) {
    public static JobStatusView from(AlignmentJob job, Integer queuePosition, boolean isCurrent) {
        return new JobStatusView(
                job.getId(),
                job.getId(),
                job.getStatus().wireName(),
                job.getProgress(),
                job.getCurrentStage(),
                job.getStages(),
                job.getError(),
                job.getQueuedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                queuePosition,
                isCurrent
        );
    }
}
