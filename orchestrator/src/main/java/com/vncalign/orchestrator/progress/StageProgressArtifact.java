package com.vncalign.orchestrator.progress;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.vncalign.orchestrator.model.AlignmentStage;
import com.vncalign.orchestrator.model.StageTiming;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The executor's own progress file, corrected/{id}_alignment_progress.json,
 * written by update_alignment_progress.py at every stage boundary.
 *
 * Its schema belongs to the executor and may grow; unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageProgressArtifact(
        String                   imageBase,
        String                   currentStage,
        Map<String, StageTiming> stages,
        Instant                  startedAt,
        Instant                  completedAt,
        Instant                  failedAt,
        String                   error
) {
    public StageProgressArtifact {
        stages = stages == null ? Map.of() : new LinkedHashMap<>(stages);
    }

    public boolean isCompleted() {
        return completedAt != null || AlignmentStage.COMPLETED.stageName().equals(currentStage);
    }

    public boolean isFailed() {
        return failedAt != null
                || (error != null && !error.isBlank())
                || AlignmentStage.FAILED_MARKER.equals(currentStage);
    }

    /**
     * The last real stage the executor entered. When the executor has marked
     * the run "failed" that marker is skipped in favour of the stage that was
     * running when it failed.
     */
    public Optional<String> effectiveStage() {
        if (currentStage != null && !AlignmentStage.FAILED_MARKER.equals(currentStage)) {
            return Optional.of(currentStage);
        }
        return stages.entrySet().stream()
                .filter(e -> e.getValue() != null && e.getValue().startedAt() != null)
                .max(Comparator.comparing((Map.Entry<String, StageTiming> e) -> e.getValue().startedAt()))
                .map(Map.Entry::getKey);
    }
}
