package com.example.permchange.models;

import java.util.Optional;

/**
 * Records whose outcome is written back by the authority. The derived views are computed from
 * {@link #getStatusCode()} on every read.
 */
public interface StatusObject {

    Integer getStatusCode();

    String getStatusMessage();

    default ProcessingStatus getStatus() {
        return StatusDecoder.decode(getStatusCode()).status();
    }

    default Optional<ServerError> getErrorCode() {
        return StatusDecoder.decode(getStatusCode()).serverError();
    }
}
