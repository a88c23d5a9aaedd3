package com.example.permchange.requests;

import java.util.Objects;
import java.util.UUID;

public record ApplyStatusServiceRequest(
        String changeId,
        int statusCode,
        String statusMessage,
        String requestId
) {

    public ApplyStatusServiceRequest(String changeId, int statusCode, String statusMessage) {
        this(changeId, statusCode, statusMessage, null);
    }

    public ApplyStatusServiceRequest {
        Objects.requireNonNull(changeId, "changeId");
        if (changeId.isBlank()) {
            throw new IllegalArgumentException("changeId must be non-blank");
        }

        requestId = (requestId == null || requestId.isBlank()) ? UUID.randomUUID().toString() : requestId;
    }
}
