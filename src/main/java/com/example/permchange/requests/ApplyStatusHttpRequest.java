package com.example.permchange.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * HTTP-layer payload the authority sends to PUT /permission-changes/{id}/status once it has
 * evaluated a change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplyStatusHttpRequest(
        @JsonProperty("status_code") @NotNull Integer statusCode,
        @JsonProperty("status_message") String statusMessage
) {}
