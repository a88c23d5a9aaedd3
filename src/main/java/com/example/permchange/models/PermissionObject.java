package com.example.permchange.models;

/**
 * Identity and timestamps shared by records exchanged with the authority.
 */
public interface PermissionObject {

    String getId();

    Long getCreatedAt();

    Long getUpdatedAt();
}
