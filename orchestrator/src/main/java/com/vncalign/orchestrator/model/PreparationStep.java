package com.vncalign.orchestrator.model;

/**
 * Conversion steps that must have produced their output before a job may
 * enter the alignment queue. Order matters: SPLIT_CHANNELS reads the NRRD
 * written by CONVERT_NRRD.
 */
public enum PreparationStep {
    CONVERT_NRRD   ("convert_nrrd",   "Failed to convert TIFF to NRRD"),
    SPLIT_CHANNELS ("split_channels", "Failed to create channel files");

    private final String stageName;
    private final String failureMessage;

    PreparationStep(String stageName, String failureMessage) {
        this.stageName      = stageName;
        this.failureMessage = failureMessage;
    }

    /** Value shown in current_stage while the step runs. */
    public String stageName()      { return stageName; }
    public String failureMessage() { return failureMessage; }
}
