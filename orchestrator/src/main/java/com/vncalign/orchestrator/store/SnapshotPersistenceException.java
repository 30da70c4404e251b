package com.vncalign.orchestrator.store;

/**
 * Thrown when the state snapshot cannot be written. The in-memory change has
 * already happened at that point; callers surface this as a server error so
 * the client does not treat the request as durable.
 */
public class SnapshotPersistenceException extends RuntimeException {

    public SnapshotPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
