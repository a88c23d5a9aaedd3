package com.example.permchange.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * HTTP-layer payload captured from client POST /permission-changes requests. Either
 * {@code user_id} or the {@code metadata_key}/{@code metadata_value} pair targets the change;
 * omitted permission flags mean "keep current".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreatePermissionChangeHttpRequest(
        @JsonProperty("user_id") String userId,
        @JsonProperty("metadata_key") String metadataKey,
        @JsonProperty("metadata_value") String metadataValue,
        @JsonProperty("realm_url") @NotBlank String realmUrl,
        @JsonProperty("may_read") Boolean mayRead,
        @JsonProperty("may_write") Boolean mayWrite,
        @JsonProperty("may_manage") Boolean mayManage
) {}
