package com.vncalign.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Entry/exit timestamps of one executor stage, as recorded in the executor's
 * progress file. completedAt and durationSeconds stay null while the stage runs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StageTiming(
        Instant startedAt,
        Instant completedAt,
        Double  durationSeconds
) {
    public boolean isRunning() {
        return startedAt != null && completedAt == null;
    }
}
