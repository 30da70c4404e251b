package com.vncalign.orchestrator.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vncalign.orchestrator.executor.ArtifactLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the executor's per-job progress file. The file is rewritten by
 * rename, so a read sees either the old or the new version; a parse failure
 * therefore means a genuinely broken file and is reported as "absent".
 */
@Component
public class StageProgressReader {

    private static final Logger log = LoggerFactory.getLogger(StageProgressReader.class);

    private final ArtifactLayout layout;
    private final ObjectMapper   json;

    public StageProgressReader(ArtifactLayout layout, ObjectMapper objectMapper) {
        this.layout = layout;
        this.json   = objectMapper.copy().findAndRegisterModules();
    }

    public Optional<StageProgressArtifact> read(String id) {
        return readFile(layout.progressFile(id));
    }

    public Optional<StageProgressArtifact> readFile(Path file) {
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(json.readValue(file.toFile(), StageProgressArtifact.class));
        } catch (IOException e) {
            log.warn("Ignoring unreadable progress file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
