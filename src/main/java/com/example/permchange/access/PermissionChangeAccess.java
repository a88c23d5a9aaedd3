package com.example.permchange.access;

import com.example.permchange.models.PermissionChange;
import java.util.List;
import java.util.Optional;

public interface PermissionChangeAccess {

    Optional<PermissionChange> findById(String id);

    /**
     * Finds changes the authority has not processed yet (no status code written).
     *
     * @param limit maximum number of changes to return
     * @return unprocessed changes, in no particular order
     */
    List<PermissionChange> findUnprocessed(int limit);

    /**
     * Creates a new change. Will fail if a change with the same id already exists.
     */
    PermissionChange save(PermissionChange change);

    /**
     * Writes the terminal status of a change. Will fail unless the stored change is still
     * unprocessed, including when it already carries the same status code.
     */
    PermissionChange updateStatus(PermissionChange change);
}
