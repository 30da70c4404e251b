package com.vncalign.orchestrator.executor;

import com.vncalign.orchestrator.config.AlignmentProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Where the preparation scripts and the alignment executor read and write
 * their files. The orchestrator never writes any of these itself; it only
 * checks for their existence.
 *
 * Executor outputs, in the order the executor produces them:
 * <pre>
 *   corrected/{id}_xform/                      xform directory
 *   corrected/{id}_xform/affine.xform          affine transform
 *   corrected/{id}_xform/warp.xform            warp transform
 *   corrected/{id}_signal_aligned.nrrd         reformatted signal
 *   corrected/{id}_background_aligned.nrrd     reformatted background
 *   corrected/{id}_alignment_thumbnails.json   thumbnail manifest
 * </pre>
 */
@Component
public class ArtifactLayout {

    public static final String PROGRESS_SUFFIX = "_alignment_progress.json";

    private final Path imagesDir;
    private final Path nrrdDir;
    private final Path channelsDir;
    private final Path outputDir;

    public ArtifactLayout(AlignmentProperties props) {
        Path root = props.workDir();
        AlignmentProperties.Layout layout = props.layout();
        this.imagesDir   = root.resolve(layout.imagesDir());
        this.nrrdDir     = root.resolve(layout.nrrdDir());
        this.channelsDir = root.resolve(layout.channelsDir());
        this.outputDir   = root.resolve(layout.outputDir());
    }

    // ------------------------------------------------------------------
    // Preparation inputs and outputs
    // ------------------------------------------------------------------

    /** Source TIFF, addressed by the review app's key (relative path without extension). */
    public Path sourceTiff(String approvalKey) { return imagesDir.resolve(approvalKey + ".tif"); }
    public Path nrrd(String id)                { return nrrdDir.resolve(id + ".nrrd"); }
    public Path signalChannel(String id)       { return channelsDir.resolve(id + "_signal.nrrd"); }
    public Path backgroundChannel(String id)   { return channelsDir.resolve(id + "_background.nrrd"); }

    // ------------------------------------------------------------------
    // Executor outputs
    // ------------------------------------------------------------------

    public Path outputDir()                    { return outputDir; }
    public Path xformDir(String id)            { return outputDir.resolve(id + "_xform"); }
    public Path affineXform(String id)         { return xformDir(id).resolve("affine.xform"); }
    public Path warpXform(String id)           { return xformDir(id).resolve("warp.xform"); }
    public Path alignedSignal(String id)       { return outputDir.resolve(id + "_signal_aligned.nrrd"); }
    public Path alignedBackground(String id)   { return outputDir.resolve(id + "_background_aligned.nrrd"); }
    public Path thumbnailManifest(String id)   { return outputDir.resolve(id + "_alignment_thumbnails.json"); }
    public Path progressFile(String id)        { return outputDir.resolve(id + PROGRESS_SUFFIX); }

    /** Executor outputs in production order. */
    public List<Path> outputsInOrder(String id) {
        return List.of(
                xformDir(id),
                affineXform(id),
                warpXform(id),
                alignedSignal(id),
                alignedBackground(id),
                thumbnailManifest(id));
    }

    /** True once both reformatted channels exist: the alignment itself is done. */
    public boolean hasFinalOutputs(String id) {
        return Files.exists(alignedSignal(id)) && Files.exists(alignedBackground(id));
    }

    public boolean hasChannels(String id) {
        return Files.exists(signalChannel(id)) && Files.exists(backgroundChannel(id));
    }
}
