package com.example.permchange.models;

/**
 * Classifies the status code written by the authority. Total over every input; unrecognized
 * codes become {@link ErrorCode#UNKNOWN} errors carrying the raw value.
 */
public final class StatusDecoder {

    public static final int SUCCESS_CODE = 0;

    private StatusDecoder() {
    }

    public static DecodedStatus decode(Integer statusCode) {
        if (statusCode == null) {
            return DecodedStatus.NOT_PROCESSED;
        }
        if (statusCode == SUCCESS_CODE) {
            return DecodedStatus.SUCCESS;
        }
        return DecodedStatus.error(statusCode);
    }
}
