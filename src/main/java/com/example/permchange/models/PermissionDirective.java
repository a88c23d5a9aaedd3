package com.example.permchange.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Requested change for a single capability. {@link #UNSPECIFIED} asks the authority to merge with
 * the existing or default permission instead of overriding it; it is never equivalent to
 * {@link #REVOKE}.
 */
public enum PermissionDirective {
    GRANT,
    REVOKE,
    UNSPECIFIED;

    @JsonCreator
    public static PermissionDirective of(Boolean value) {
        if (value == null) {
            return UNSPECIFIED;
        }
        return value ? GRANT : REVOKE;
    }

    /**
     * Wire form used by the authority: {@code true}, {@code false} or {@code null} for "keep current".
     */
    @JsonValue
    public Boolean asBoolean() {
        return switch (this) {
            case GRANT -> Boolean.TRUE;
            case REVOKE -> Boolean.FALSE;
            case UNSPECIFIED -> null;
        };
    }

    public boolean isSpecified() {
        return this != UNSPECIFIED;
    }
}
