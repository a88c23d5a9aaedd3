package com.example.permchange.models;

import java.util.Objects;
import java.util.Optional;

/**
 * Processing status paired with the error it decodes to. {@code error} is present exactly when
 * {@code status} is {@link ProcessingStatus#ERROR}.
 */
public record DecodedStatus(ProcessingStatus status, ServerError error) {

    public static final DecodedStatus NOT_PROCESSED = new DecodedStatus(ProcessingStatus.NOT_PROCESSED, null);
    public static final DecodedStatus SUCCESS = new DecodedStatus(ProcessingStatus.SUCCESS, null);

    public DecodedStatus {
        Objects.requireNonNull(status, "status");
        if ((status == ProcessingStatus.ERROR) != (error != null)) {
            throw new IllegalArgumentException("error must be set if and only if status is ERROR");
        }
    }

    public static DecodedStatus error(int rawCode) {
        return new DecodedStatus(ProcessingStatus.ERROR, ServerError.of(rawCode));
    }

    public Optional<ServerError> serverError() {
        return Optional.ofNullable(error);
    }
}
