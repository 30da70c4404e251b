package com.vncalign.orchestrator.inspect;

import com.vncalign.orchestrator.config.AlignmentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Pid files for the executor processes this server starts: state/running/{id}.pid
 * holding "{pid} {process start epoch millis}".
 *
 * Unlike the process-table scan this does not depend on parsing command
 * lines, so it is exact for every job we spawned ourselves, including after
 * a restart. The start time guards against pid reuse after a reboot.
 */
@Component
public class PidFileTracker implements LiveJobInspector {

    private static final Logger log = LoggerFactory.getLogger(PidFileTracker.class);

    private static final String SUFFIX = ".pid";

    private final Path dir;

    public PidFileTracker(AlignmentProperties props) {
        this(props.pidDir());
    }

    PidFileTracker(Path dir) {
        this.dir = dir;
    }

    public void register(String id, ProcessHandle handle) {
        long started = handle.info().startInstant().map(Instant::toEpochMilli).orElse(0L);
        try {
            Files.createDirectories(dir);
            Files.writeString(fileFor(id), handle.pid() + " " + started, StandardCharsets.UTF_8);
        } catch (IOException e) {
            // The process-table scan still covers this job after a restart.
            log.warn("Could not write pid file for {}: {}", id, e.getMessage());
        }
    }

    public void unregister(String id) {
        try {
            Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            log.warn("Could not delete pid file for {}: {}", id, e.getMessage());
        }
    }

    @Override
    public Set<String> runningJobIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (!Files.isDirectory(dir)) return ids;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String id = name.substring(0, name.length() - SUFFIX.length());
                if (isAlive(file)) {
                    ids.add(id);
                } else {
                    log.info("Removing stale pid file for {}", id);
                    Files.deleteIfExists(file);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan pid directory {}: {}", dir, e.getMessage());
        }
        return ids;
    }

    private Path fileFor(String id) {
        return dir.resolve(id + SUFFIX);
    }

    private static boolean isAlive(Path file) throws IOException {
        String[] parts = Files.readString(file, StandardCharsets.UTF_8).trim().split("\\s+");
        long pid;
        long started;
        try {
            pid     = Long.parseLong(parts[0]);
            started = parts.length > 1 ? Long.parseLong(parts[1]) : 0L;
        } catch (NumberFormatException e) {
            return false;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) return false;
        if (started == 0L) return true;
        return handle.get().info().startInstant()
                .map(actual -> Math.abs(actual.toEpochMilli() - started) < 1000)
                .orElse(true);
    }
}
