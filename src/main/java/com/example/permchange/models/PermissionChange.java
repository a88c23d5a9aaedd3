package com.example.permchange.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.jackson.Jacksonized;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbImmutable;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * A request to change the permissions of one user, all users ({@code *}), or every user whose
 * metadata matches a key/value pair, on one Realm or all of them ({@code *}).
 *
 * <p>Created exclusively by the client and immutable once built: the only way to derive a new
 * state is {@link #toBuilder()}, which re-runs the targeting checks. {@code statusCode} and
 * {@code statusMessage} are written once by the authority.
 * Directives left {@link PermissionDirective#UNSPECIFIED} are merged with the existing or default
 * permissions, which materializes those defaults for the affected Realm and user.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbImmutable(builder = PermissionChange.PermissionChangeBuilder.class)
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Jacksonized
@Getter
public class PermissionChange implements PermissionObject, StatusObject {

    public static final String USER_WILDCARD = "*";
    public static final String REALM_WILDCARD = "*";

    // Required fields: Lombok @NonNull enforces runtime null checks in builder
    @NonNull
    private final String id;

    @NonNull
    private final Long createdAt;

    @NonNull
    private final Long updatedAt;

    // Written by the authority
    private final Integer statusCode;
    private final String statusMessage;

    // Targeting: userId is "" when metadata targeting is used
    @NonNull
    private final String userId;
    private final String metadataKey;
    private final String metadataValue;

    @NonNull
    private final String realmUrl;

    private final PermissionDirective mayRead;
    private final PermissionDirective mayWrite;
    private final PermissionDirective mayManage;

    // ----- Factories -----

    /**
     * Starts a request with a fresh random id and both timestamps set to now.
     */
    public static PermissionChangeBuilder newRequest(Clock clock) {
        long now = clock.millis();
        return builder()
                .id(UUID.randomUUID().toString())
                .createdAt(now)
                .updatedAt(now);
    }

    public static PermissionChange forUser(Clock clock,
                                           String userId,
                                           String realmUrl,
                                           PermissionDirective mayRead,
                                           PermissionDirective mayWrite,
                                           PermissionDirective mayManage) {
        return newRequest(clock)
                .userId(userId)
                .realmUrl(realmUrl)
                .mayRead(mayRead)
                .mayWrite(mayWrite)
                .mayManage(mayManage)
                .build();
    }

    public static PermissionChange forMetadata(Clock clock,
                                               String metadataKey,
                                               String metadataValue,
                                               String realmUrl,
                                               PermissionDirective mayRead,
                                               PermissionDirective mayWrite,
                                               PermissionDirective mayManage) {
        return newRequest(clock)
                .metadataKey(metadataKey)
                .metadataValue(metadataValue)
                .realmUrl(realmUrl)
                .mayRead(mayRead)
                .mayWrite(mayWrite)
                .mayManage(mayManage)
                .build();
    }

    // ----- DynamoDB Enhanced annotations on getters -----

    @Override
    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public String getId() { return id; }

    @Override
    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @Override
    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }

    @Override
    @DynamoDbAttribute("status_code")
    public Integer getStatusCode() { return statusCode; }

    @Override
    @DynamoDbAttribute("status_message")
    public String getStatusMessage() { return statusMessage; }

    @DynamoDbAttribute("user_id")
    public String getUserId() { return userId; }

    @DynamoDbAttribute("metadata_key")
    public String getMetadataKey() { return metadataKey; }

    @DynamoDbAttribute("metadata_value")
    public String getMetadataValue() { return metadataValue; }

    @DynamoDbAttribute("realm_url")
    public String getRealmUrl() { return realmUrl; }

    @DynamoDbAttribute("may_read")
    @DynamoDbConvertedBy(PermissionDirectiveAttributeConverter.class)
    public PermissionDirective getMayRead() { return directive(mayRead); }

    @DynamoDbAttribute("may_write")
    @DynamoDbConvertedBy(PermissionDirectiveAttributeConverter.class)
    public PermissionDirective getMayWrite() { return directive(mayWrite); }

    @DynamoDbAttribute("may_manage")
    @DynamoDbConvertedBy(PermissionDirectiveAttributeConverter.class)
    public PermissionDirective getMayManage() { return directive(mayManage); }

    // ----- Derived views, never stored -----

    @Override
    @DynamoDbIgnore
    @JsonIgnore
    public ProcessingStatus getStatus() {
        return StatusDecoder.decode(statusCode).status();
    }

    @Override
    @DynamoDbIgnore
    @JsonIgnore
    public Optional<ServerError> getErrorCode() {
        return StatusDecoder.decode(statusCode).serverError();
    }

    // ----- Domain helpers -----

    public boolean hasTerminalStatus() {
        return statusCode != null;
    }

    public boolean targetsMetadata() {
        return metadataKey != null;
    }

    private static PermissionDirective directive(PermissionDirective value) {
        return value == null ? PermissionDirective.UNSPECIFIED : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Attribute names as reported in change notifications.
     */
    public static final class Fields {
        public static final String ID = "id";
        public static final String CREATED_AT = "createdAt";
        public static final String UPDATED_AT = "updatedAt";
        public static final String STATUS_CODE = "statusCode";
        public static final String STATUS_MESSAGE = "statusMessage";
        public static final String USER_ID = "userId";
        public static final String METADATA_KEY = "metadataKey";
        public static final String METADATA_VALUE = "metadataValue";
        public static final String REALM_URL = "realmUrl";
        public static final String MAY_READ = "mayRead";
        public static final String MAY_WRITE = "mayWrite";
        public static final String MAY_MANAGE = "mayManage";

        // derived from STATUS_CODE
        public static final String STATUS = "status";
        public static final String ERROR_CODE = "errorCode";

        public static final Set<String> STORED = Set.of(
                ID, CREATED_AT, UPDATED_AT, STATUS_CODE, STATUS_MESSAGE, USER_ID,
                METADATA_KEY, METADATA_VALUE, REALM_URL, MAY_READ, MAY_WRITE, MAY_MANAGE);

        private Fields() {
        }
    }

    public static class PermissionChangeBuilder {

        /**
         * Builds the change, rejecting any combination other than exactly one targeting mode.
         */
        public PermissionChange build() {
            if (isBlank(realmUrl)) {
                throw new MalformedPermissionChangeException("realmUrl must be non-blank");
            }

            String targetUserId = userId;
            boolean metadataTargeted = metadataKey != null || metadataValue != null;
            if (metadataTargeted) {
                if (isBlank(metadataKey) || isBlank(metadataValue)) {
                    throw new MalformedPermissionChangeException(
                            "metadataKey and metadataValue must both be non-blank");
                }
                if (userId != null && !userId.isEmpty()) {
                    throw new MalformedPermissionChangeException(
                            "userId and metadata targeting are mutually exclusive");
                }
                targetUserId = "";
            } else if (isBlank(userId)) {
                throw new MalformedPermissionChangeException(
                        "either userId or metadataKey/metadataValue must be set");
            }

            return new PermissionChange(
                    id, createdAt, updatedAt, statusCode, statusMessage,
                    targetUserId, metadataKey, metadataValue, realmUrl,
                    directive(mayRead), directive(mayWrite), directive(mayManage)
            );
        }
    }
}
