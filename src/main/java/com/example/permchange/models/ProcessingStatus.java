package com.example.permchange.models;

public enum ProcessingStatus {
    /** The authority has not written a status yet. */
    NOT_PROCESSED,
    SUCCESS,
    ERROR
}
