package com.example.permchange.service;

import lombok.Getter;

public class PermissionChangeException extends RuntimeException {

    public enum Code {
        CHANGE_NOT_FOUND,
        CHANGE_ALREADY_EXISTS,
        CONFLICTING_STATUS,
        UNKNOWN
    }

    @Getter
    private final Code code;

    private PermissionChangeException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static PermissionChangeException changeNotFound(String changeId) {
        return new PermissionChangeException(Code.CHANGE_NOT_FOUND,
                "Permission change " + changeId + " does not exist");
    }

    public static PermissionChangeException changeAlreadyExists(String changeId) {
        return new PermissionChangeException(Code.CHANGE_ALREADY_EXISTS,
                "Permission change " + changeId + " already exists");
    }

    public static PermissionChangeException conflictingStatus(String changeId, int storedCode, int attemptedCode) {
        return new PermissionChangeException(Code.CONFLICTING_STATUS,
                "Permission change " + changeId + " already has status " + storedCode
                        + "; refusing to overwrite with " + attemptedCode);
    }

    public static PermissionChangeException unknown(String message) {
        return new PermissionChangeException(Code.UNKNOWN, message);
    }
}
