package com.example.permchange.http;

import com.example.permchange.models.ProcessingStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client view of a permission change. Permission flags are always present: {@code null} means
 * the flag was left unspecified and will be merged by the authority.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PermissionChangeResponse(
        @JsonProperty("id") String id,
        @JsonProperty("created_at") Long createdAt,
        @JsonProperty("updated_at") Long updatedAt,
        @JsonProperty("user_id") String userId,
        @JsonProperty("metadata_key") String metadataKey,
        @JsonProperty("metadata_value") String metadataValue,
        @JsonProperty("realm_url") String realmUrl,
        @JsonProperty("may_read") @JsonInclude(JsonInclude.Include.ALWAYS) Boolean mayRead,
        @JsonProperty("may_write") @JsonInclude(JsonInclude.Include.ALWAYS) Boolean mayWrite,
        @JsonProperty("may_manage") @JsonInclude(JsonInclude.Include.ALWAYS) Boolean mayManage,
        @JsonProperty("status") ProcessingStatus status,
        @JsonProperty("status_code") Integer statusCode,
        @JsonProperty("status_message") String statusMessage,
        @JsonProperty("error") ServerErrorResponse error
) {}
