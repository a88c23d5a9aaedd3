package com.example.permchange.models;

/**
 * Raised when a permission change is built with an invalid targeting mode. Such a change is
 * never persisted or transmitted.
 */
public class MalformedPermissionChangeException extends IllegalArgumentException {

    public MalformedPermissionChangeException(String message) {
        super(message);
    }
}
