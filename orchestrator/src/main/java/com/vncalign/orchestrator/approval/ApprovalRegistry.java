package com.vncalign.orchestrator.approval;

import java.util.Optional;

/**
 * Read-only view of the review application's approval state.
 */
public interface ApprovalRegistry {

    /**
     * Look up an image by its base name (last path segment of its key).
     */
    Optional<ApprovalEntry> find(String imageBase);

    /**
     * @param key       the review app's key for the image: its path under
     *                  Images/ without extension, e.g. "batch1/sample_01"
     * @param approved  whether a reviewer has approved its orientation
     */
    record ApprovalEntry(String key, boolean approved) {}
}
