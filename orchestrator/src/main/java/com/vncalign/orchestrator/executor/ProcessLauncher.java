package com.vncalign.orchestrator.executor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts child processes. Exists so tests can hand the supervisor and the
 * preparation pipeline a scripted {@link Process} instead of a real one.
 */
public interface ProcessLauncher {

    /**
     * @throws IOException if the process cannot be started (missing
     *                     executable, permission denied, bad working dir)
     */
    Process start(List<String> command, Path workDir) throws IOException;
}
