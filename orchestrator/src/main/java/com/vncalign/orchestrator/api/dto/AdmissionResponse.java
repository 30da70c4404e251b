package com.vncalign.orchestrator.api.dto;

/**
 * Response body of the queue and reset endpoints.
 */
public record AdmissionResponse(boolean success, String message) {

    public static AdmissionResponse ok(String message) {
        return new AdmissionResponse(true, message);
    }

    public static AdmissionResponse rejected(String message) {
        return new AdmissionResponse(false, message);
    }
}
