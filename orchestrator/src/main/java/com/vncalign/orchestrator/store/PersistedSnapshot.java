package com.vncalign.orchestrator.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vncalign.orchestrator.model.AlignmentJob;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk form of the orchestrator state: the FIFO queue plus every job
 * record. Field names match the snapshot files the review app already reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistedSnapshot(List<String> queue, Map<String, AlignmentJob> jobs) {

    public PersistedSnapshot {
        queue = queue == null ? List.of() : List.copyOf(queue);
        jobs  = jobs  == null ? Map.of()  : new LinkedHashMap<>(jobs);
    }

    public static PersistedSnapshot empty() {
        return new PersistedSnapshot(List.of(), Map.of());
    }
}
