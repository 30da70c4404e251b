package com.vncalign.orchestrator.progress;

import com.vncalign.orchestrator.model.AlignmentJob;
import com.vncalign.orchestrator.model.StageTiming;

import java.util.Map;
import java.util.Objects;

/**
 * What is known about a running alignment at one point in time.
 *
 * @param progress  null when the stage is not in the catalogue; the job then
 *                  keeps its previous progress value
 * @param stages    empty unless read from the executor's progress file
 * @param error     the executor's own failure message, or null
 */
public record StageProgress(
        Source                   source,
        String                   currentStage,
        Integer                  progress,
        Map<String, StageTiming> stages,
        String                   error
) {

    public enum Source {
        /** The executor's progress file. */
        ARTIFACT,
        /** Inferred from which output files exist. */
        FILESYSTEM,
        /** Nothing to go on yet. */
        NONE
    }

    public static StageProgress none() {
        return new StageProgress(Source.NONE, null, null, Map.of(), null);
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    /** True if applying this to {@code job} would change anything. */
    public boolean differsFrom(AlignmentJob job) {
        if (source == Source.NONE) return false;
        if (currentStage != null && !currentStage.equals(job.getCurrentStage())) return true;
        if (progress != null && progress != job.getProgress()) return true;
        return !stages.isEmpty() && !Objects.equals(stages, job.getStages());
    }

    /** Mirror stage, stage timings and progress into {@code job}. */
    public void applyTo(AlignmentJob job) {
        if (source == Source.NONE) return;
        if (currentStage != null) {
            job.setCurrentStage(currentStage);
        }
        if (progress != null) {
            job.setProgress(progress);
        }
        if (!stages.isEmpty()) {
            job.setStages(stages);
        }
    }
}
