package com.vncalign.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/queue-alignment and POST /api/reset-alignment.
 *
 * The review UI sends {"image_base": "..."}; job_id and id are accepted too.
 */
public record AlignmentRequest(
        @JsonProperty("image_base") @JsonAlias({"job_id", "id"}) String imageBase
) {
    public boolean hasId() {
        return imageBase != null && !imageBase.isBlank();
    }
}
