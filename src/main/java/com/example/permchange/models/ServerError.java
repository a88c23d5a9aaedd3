package com.example.permchange.models;

import java.util.Objects;

/**
 * Error reported by the authority. {@code rawCode} is always the value that was written, so an
 * {@link ErrorCode#UNKNOWN} kind can still be diagnosed.
 */
public record ServerError(ErrorCode kind, int rawCode) {

    public ServerError {
        Objects.requireNonNull(kind, "kind");
    }

    public static ServerError of(int rawCode) {
        return new ServerError(ErrorCode.fromCode(rawCode), rawCode);
    }

    public boolean isKnown() {
        return kind.isKnown();
    }
}
