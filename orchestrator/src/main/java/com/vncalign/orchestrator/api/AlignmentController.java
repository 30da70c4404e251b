package com.vncalign.orchestrator.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.vncalign.orchestrator.api.dto.AdmissionResponse;
import com.vncalign.orchestrator.api.dto.AlignmentRequest;
import com.vncalign.orchestrator.api.dto.JobStatusView;
import com.vncalign.orchestrator.service.AdmissionRejectedException;
import com.vncalign.orchestrator.service.AdmissionService;
import com.vncalign.orchestrator.service.StatusProjection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * REST API used by the orientation review UI.
 *
 * POST /api/queue-alignment         request alignment of an approved image
 * GET  /api/alignment-status        every known job
 * GET  /api/alignment-status/{id}   one job
 * POST /api/reset-alignment         forget a job (files and processes untouched)
 * GET  /api/alignment-thumbnails    the executor's thumbnail manifest
 */
@RestController
@RequestMapping("/api")
public class AlignmentController {

    private static final Logger log = LoggerFactory.getLogger(AlignmentController.class);

    private static final String MISSING_ID = "image_base is required";

    private final AdmissionService admission;
    private final StatusProjection status;

    public AlignmentController(AdmissionService admission, StatusProjection status) {
        this.admission = admission;
        this.status    = status;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/queue-alignment \
     *     -H "Content-Type: application/json" -d '{"image_base":"VNC_0421"}'
     */
    @PostMapping("/queue-alignment")
    public ResponseEntity<AdmissionResponse> queue(@RequestBody AlignmentRequest req) {
        if (!req.hasId()) {
            return ResponseEntity.badRequest().body(AdmissionResponse.rejected(MISSING_ID));
        }
        try {
            return ResponseEntity.ok(AdmissionResponse.ok(admission.requestAlignment(req.imageBase().strip())));
        } catch (AdmissionRejectedException e) {
            return ResponseEntity.badRequest().body(AdmissionResponse.rejected(e.getMessage()));
        }
    }

    @GetMapping("/alignment-status")
    public List<JobStatusView> list() {
        return status.list();
    }

    /** Returns 404 if nothing is known about the id. */
    @GetMapping("/alignment-status/{id}")
    public JobStatusView get(@PathVariable String id) {
        return status.find(id).orElseThrow(() -> new ResponseStatusException(
                HttpStatus.NOT_FOUND, "No alignment status for " + id));
    }

    @PostMapping("/reset-alignment")
    public ResponseEntity<AdmissionResponse> reset(@RequestBody AlignmentRequest req) {
        if (!req.hasId()) {
            return ResponseEntity.badRequest().body(AdmissionResponse.rejected(MISSING_ID));
        }
        String id = req.imageBase().strip();
        admission.reset(id);
        return ResponseEntity.ok(AdmissionResponse.ok("Alignment status reset for " + id));
    }

    /**
     * HTTP 200  manifest JSON as written by the executor
     * HTTP 404  no manifest yet
     * HTTP 500  manifest present but unreadable
     */
    @GetMapping("/alignment-thumbnails")
    public JsonNode thumbnails(@RequestParam("image_base") String imageBase) {
        try {
            return status.thumbnails(imageBase).orElseThrow(() -> new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "Thumbnails not found"));
        } catch (UncheckedIOException e) {
            log.error("Failed to read thumbnails for {}: {}", imageBase, e.getMessage());
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read thumbnails", e);
        }
    }
}
