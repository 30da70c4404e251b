package com.vncalign.orchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vncalign.orchestrator.config.AlignmentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes the snapshot file.
 *
 * Writes go to a sibling temp file which is then renamed over the target,
 * so a reader (or a crash) never sees a half-written snapshot.
 */
@Component
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final Path         file;
    private final ObjectMapper json;

    public SnapshotStore(AlignmentProperties props, ObjectMapper objectMapper) {
        this(props.snapshotFile(), objectMapper);
    }

    SnapshotStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.json = objectMapper.copy()
                .findAndRegisterModules()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Load the snapshot. A missing file is an empty state. An unreadable one
     * is moved aside (so the next write does not destroy the evidence) and
     * also treated as empty.
     */
    public PersistedSnapshot load() {
        if (!Files.exists(file)) {
            log.info("No snapshot at {}, starting with an empty queue", file);
            return PersistedSnapshot.empty();
        }
        try {
            PersistedSnapshot snapshot = json.readValue(file.toFile(), PersistedSnapshot.class);
            log.info("Loaded snapshot {} ({} jobs, {} queued)",
                    file, snapshot.jobs().size(), snapshot.queue().size());
            return snapshot;
        } catch (IOException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
            log.error("Snapshot {} is unreadable, moving it to {} and starting empty", file, aside, e);
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                log.error("Could not move corrupt snapshot aside: {}", moveError.getMessage());
            }
            return PersistedSnapshot.empty();
        }
    }

    /**
     * Atomically replace the snapshot file.
     *
     * @throws SnapshotPersistenceException if the file cannot be written
     */
    public void write(PersistedSnapshot snapshot) {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            json.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to write snapshot " + file, e);
        }
    }
}
