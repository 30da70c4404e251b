package com.vncalign.orchestrator.executor;

/**
 * How a monitored child process ended.
 *
 * @param exitCode  the exit value; meaningless when {@code timedOut}
 * @param timedOut  true when the wall-clock limit was hit and the process killed
 */
public record ProcessOutcome(int exitCode, boolean timedOut, String stdoutTail, String stderrTail) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
