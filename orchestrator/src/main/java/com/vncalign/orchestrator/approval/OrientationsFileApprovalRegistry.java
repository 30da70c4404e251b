package com.vncalign.orchestrator.approval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vncalign.orchestrator.config.AlignmentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Approval state read from the review app's orientations.json:
 * <pre>
 *   { "batch1/sample_01": { "approved": true, "manual_corrections": {...}, ... }, ... }
 * </pre>
 * The file is re-read on every lookup; the review app rewrites it whenever a
 * reviewer saves or approves an image.
 */
@Component
public class OrientationsFileApprovalRegistry implements ApprovalRegistry {

    private static final Logger log = LoggerFactory.getLogger(OrientationsFileApprovalRegistry.class);

    private final Path         file;
    private final ObjectMapper json;

    public OrientationsFileApprovalRegistry(AlignmentProperties props, ObjectMapper objectMapper) {
        this.file = props.resolvedOrientationsFile();
        this.json = objectMapper;
    }

    @Override
    public Optional<ApprovalEntry> find(String imageBase) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = json.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("Cannot read approvals from {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            if (baseName(key).equals(imageBase)) {
                boolean approved = entry.getValue().path("approved").asBoolean(false);
                return Optional.of(new ApprovalEntry(key, approved));
            }
        }
        return Optional.empty();
    }

    private static String baseName(String key) {
        return key.substring(key.lastIndexOf('/') + 1);
    }
}
