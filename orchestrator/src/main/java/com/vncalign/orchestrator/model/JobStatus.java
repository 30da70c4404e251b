package com.vncalign.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of an alignment job.
 *
 * Transitions (happy path):
 *   PREPARING → QUEUED → PROCESSING → COMPLETED
 *
 * PREPARING and PROCESSING can end in FAILED. INTERRUPTED only exists between
 * loading a snapshot at startup and reconciling it against the live process
 * table: a job that was PROCESSING when the server went down is INTERRUPTED
 * until it is either re-adopted, re-queued or resolved from its outputs.
 *
 * Serialized lower-case ("queued", "processing", ...) because that is what the
 * review UI and older snapshot files use.
 */
public enum JobStatus {
    PREPARING,
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    INTERRUPTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobStatus fromWireName(String value) {
        return JobStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
