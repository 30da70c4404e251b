package com.vncalign.orchestrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Launches a command on the local host. stdout and stderr are kept as
 * separate pipes: the supervisor reports the stderr tail on failure.
 */
@Component
public class LocalProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    @Override
    public Process start(List<String> command, Path workDir) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectInput(ProcessBuilder.Redirect.PIPE);
        log.info("Start {} in {}", command, workDir);
        Process process = builder.start();
        // Nothing is ever written to the child's stdin.
        process.getOutputStream().close();
        return process;
    }
}
