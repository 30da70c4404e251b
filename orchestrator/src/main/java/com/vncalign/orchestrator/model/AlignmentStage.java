package com.vncalign.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Stages reported by align_single_cmtk.sh, in pipeline order.
 *
 * The progress value is what the job shows once the executor has entered
 * the stage; the heavy CMTK steps (affine, warp) get the widest bands.
 */
public enum AlignmentStage {
    INITIALIZING        ("initializing",          2),
    SET_LPS             ("set_lps",               5),
    INITIAL_AFFINE      ("initial_affine",       10),
    AFFINE_REGISTRATION ("affine_registration",  20),
    WARP                ("warp",                 45),
    REFORMAT_SIGNAL     ("reformat_signal",      80),
    REFORMAT_BACKGROUND ("reformat_background",  88),
    THUMBNAILS          ("thumbnails",           95),
    COMPLETED           ("completed",           100);

    /** Synthetic stage the executor writes on failure; never mirrored as current_stage. */
    public static final String FAILED_MARKER = "failed";

    private final String stageName;
    private final int    progress;

    AlignmentStage(String stageName, int progress) {
        this.stageName = stageName;
        this.progress  = progress;
    }

    public String stageName() { return stageName; }
    public int    progress()  { return progress; }

    public static Optional<AlignmentStage> fromStageName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(s -> s.stageName.equals(name))
                .findFirst();
    }
}
