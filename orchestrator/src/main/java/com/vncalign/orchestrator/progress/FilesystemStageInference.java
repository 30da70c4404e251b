package com.vncalign.orchestrator.progress;

import com.vncalign.orchestrator.executor.ArtifactLayout;
import com.vncalign.orchestrator.model.AlignmentStage;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Guesses the executor's stage from the outputs already on disk.
 *
 * The executor produces its outputs in a fixed order, so the furthest output
 * present tells us which stage is running now (the one that produces the
 * next output). Lossy: it cannot see the short stages that write nothing
 * (set_lps, initial_affine) and it cannot tell a running stage from a
 * crashed one.
 */
@Component
public class FilesystemStageInference {

    // STAGE_AFTER[i] is the stage running once output i (in ArtifactLayout order) exists.
    private static final List<AlignmentStage> STAGE_AFTER = List.of(
            AlignmentStage.AFFINE_REGISTRATION,   // xform dir
            AlignmentStage.WARP,                  // affine.xform
            AlignmentStage.REFORMAT_SIGNAL,       // warp.xform
            AlignmentStage.REFORMAT_BACKGROUND,   // signal_aligned.nrrd
            AlignmentStage.THUMBNAILS,            // background_aligned.nrrd
            AlignmentStage.COMPLETED);            // alignment_thumbnails.json

    private final ArtifactLayout layout;

    public FilesystemStageInference(ArtifactLayout layout) {
        this.layout = layout;
    }

    public AlignmentStage infer(String id) {
        List<Path> outputs = layout.outputsInOrder(id);
        for (int i = outputs.size() - 1; i >= 0; i--) {
            if (Files.exists(outputs.get(i))) {
                return STAGE_AFTER.get(i);
            }
        }
        return AlignmentStage.INITIALIZING;
    }

    /** True if the executor has written anything at all for {@code id}. */
    public boolean hasAnyOutput(String id) {
        return layout.outputsInOrder(id).stream().anyMatch(Files::exists);
    }
}
