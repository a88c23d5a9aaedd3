package com.example.permchange.service;

import com.example.permchange.models.DecodedStatus;
import com.example.permchange.models.PermissionChange;
import java.util.Set;

/**
 * One batch of field changes on a permission change. {@code status} is decoded from
 * {@code change.getStatusCode()} before the event is handed to any listener.
 */
public record PermissionChangeEvent(
        PermissionChange change,
        Set<String> changedFields,
        DecodedStatus status
) {

    public boolean hasChanged(String field) {
        return changedFields.contains(field);
    }

    public String changeId() {
        return change.getId();
    }
}
