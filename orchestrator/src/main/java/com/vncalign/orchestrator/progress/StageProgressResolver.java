package com.vncalign.orchestrator.progress;

import com.vncalign.orchestrator.model.AlignmentStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Single entry point for "where is job X right now".
 *
 * Precedence:
 * <ol>
 *   <li>The executor's progress file, if present, parseable and written by
 *       the current run (its started_at is not older than {@code notBefore}).</li>
 *   <li>Inference from the output files on disk.</li>
 * </ol>
 * Both sources are re-read on every call; nothing is cached.
 */
@Component
public class StageProgressResolver {

    private static final Logger log = LoggerFactory.getLogger(StageProgressResolver.class);

    // The executor stamps started_at a moment after we spawn it; allow for
    // clock skew between the two.
    private static final Duration STALE_TOLERANCE = Duration.ofMinutes(1);

    private final StageProgressReader      reader;
    private final FilesystemStageInference inference;

    public StageProgressResolver(StageProgressReader reader, FilesystemStageInference inference) {
        this.reader    = reader;
        this.inference = inference;
    }

    /**
     * @param notBefore start of the current run, or null when unknown (e.g. a
     *                  process adopted after a restart); a progress file whose
     *                  run started well before this is from an earlier attempt
     */
    public StageProgress getStageProgress(String id, Instant notBefore) {
        Optional<StageProgressArtifact> artifact = reader.read(id)
                .filter(a -> !isStale(id, a, notBefore));
        if (artifact.isPresent()) {
            return fromArtifact(artifact.get());
        }
        AlignmentStage inferred = inference.infer(id);
        if (inferred == AlignmentStage.INITIALIZING && !inference.hasAnyOutput(id)) {
            return StageProgress.none();
        }
        return new StageProgress(StageProgress.Source.FILESYSTEM,
                inferred.stageName(), inferred.progress(), Map.of(), null);
    }

    public static StageProgress fromArtifact(StageProgressArtifact artifact) {
        String stage = artifact.effectiveStage().orElse(null);
        Integer progress = AlignmentStage.fromStageName(stage)
                .map(AlignmentStage::progress)
                .orElse(null);
        String error = artifact.error() == null || artifact.error().isBlank() ? null : artifact.error();
        return new StageProgress(StageProgress.Source.ARTIFACT, stage, progress, artifact.stages(), error);
    }

    private static boolean isStale(String id, StageProgressArtifact artifact, Instant notBefore) {
        if (notBefore == null || artifact.startedAt() == null) return false;
        boolean stale = artifact.startedAt().isBefore(notBefore.minus(STALE_TOLERANCE));
        if (stale) {
            log.debug("Progress file for {} is from an earlier run (started {}), ignoring it",
                    id, artifact.startedAt());
        }
        return stale;
    }
}
