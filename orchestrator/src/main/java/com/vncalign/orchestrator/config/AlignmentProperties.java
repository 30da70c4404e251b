package com.vncalign.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Deployment settings, bound from the {@code vncalign.*} keys in application.yml.
 *
 * Every path is resolved against {@code workDir}, which is also the working
 * directory of every child process (the alignment and preparation scripts
 * use paths relative to it).
 */
@ConfigurationProperties(prefix = "vncalign")
public record AlignmentProperties(
        @DefaultValue(".")                 Path        workDir,
        @DefaultValue("state")             Path        stateDir,
        @DefaultValue("orientations.json") Path        orientationsFile,
        @DefaultValue                      Layout      layout,
        @DefaultValue                      Executor    executor,
        @DefaultValue                      Preparation preparation,
        @DefaultValue                      Reconcile   reconcile
) {

    /** Directory names of the artifact tree, relative to workDir. */
    public record Layout(
            @DefaultValue("Images")      String imagesDir,
            @DefaultValue("nrrd_output") String nrrdDir,
            @DefaultValue("channels")    String channelsDir,
            @DefaultValue("corrected")   String outputDir
    ) {}

    /**
     * The alignment executor. The job id is appended to {@code command}.
     *
     * @param processNames  names matched against running commands to find
     *                      executor instances (job id = first argument)
     * @param toolNames     native registration tools the executor spawns; the
     *                      job id is recovered from their output path
     */
    public record Executor(
            @DefaultValue("./align_single_cmtk.sh")  List<String> command,
            @DefaultValue("10m")                     Duration     timeout,
            @DefaultValue("5s")                      Duration     pollInterval,
            @DefaultValue("1s")                      Duration     settleDelay,
            @DefaultValue("30s")                     Duration     foreignProcessBackoff,
            @DefaultValue("50")                      int          outputTailLines,
            @DefaultValue("align_single_cmtk.sh")    List<String> processNames,
            @DefaultValue({"registration", "warp", "reformatx", "make_initial_affine"})
                                                     List<String> toolNames
    ) {}

    /** Preparation commands. The job id is appended to each. */
    public record Preparation(
            @DefaultValue({"python3", "convert_tiff_to_nrrd.py"}) List<String> convertCommand,
            @DefaultValue({"python3", "split_channels.py"})       List<String> splitCommand,
            @DefaultValue("2m")                                   Duration     timeout,
            @DefaultValue("2")                                    int          threads
    ) {}

    public record Reconcile(
            @DefaultValue("true") boolean resumeInterrupted,
            @DefaultValue("true") boolean scavengeOrphans
    ) {}

    // ------------------------------------------------------------------
    // Resolved paths
    // ------------------------------------------------------------------

    public Path resolvedStateDir() {
        return workDir.resolve(stateDir);
    }

    public Path snapshotFile() {
        return resolvedStateDir().resolve("alignment-state.json");
    }

    public Path pidDir() {
        return resolvedStateDir().resolve("running");
    }

    public Path resolvedOrientationsFile() {
        return workDir.resolve(orientationsFile);
    }

    /**
     * Settings with every default in place, rooted at {@code workDir}.
     * Used by tests and by tools that embed the orchestrator without Spring.
     */
    public static AlignmentProperties forWorkDir(Path workDir) {
        return new AlignmentProperties(
                workDir,
                Path.of("state"),
                Path.of("orientations.json"),
                new Layout("Images", "nrrd_output", "channels", "corrected"),
                new Executor(
                        List.of("./align_single_cmtk.sh"),
                        Duration.ofMinutes(10),
                        Duration.ofSeconds(5),
                        Duration.ofSeconds(1),
                        Duration.ofSeconds(30),
                        50,
                        List.of("align_single_cmtk.sh"),
                        List.of("registration", "warp", "reformatx", "make_initial_affine")),
                new Preparation(
                        List.of("python3", "convert_tiff_to_nrrd.py"),
                        List.of("python3", "split_channels.py"),
                        Duration.ofMinutes(2),
                        2),
                new Reconcile(true, true));
    }

    public AlignmentProperties withReconcile(Reconcile reconcile) {
        return new AlignmentProperties(workDir, stateDir, orientationsFile,
                layout, executor, preparation, reconcile);
    }
}
