package com.vncalign.orchestrator.service;

/**
 * Thrown when an alignment request cannot be accepted (image not approved,
 * source missing). Mapped to HTTP 400 by the controller.
 */
public class AdmissionRejectedException extends RuntimeException {

    public AdmissionRejectedException(String message) {
        super(message);
    }
}
