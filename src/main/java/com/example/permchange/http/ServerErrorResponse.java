package com.example.permchange.http;

import com.example.permchange.models.ErrorCode;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ServerErrorResponse(
        @JsonProperty("kind") ErrorCode kind,
        @JsonProperty("code") int code
) {}
