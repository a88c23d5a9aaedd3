package com.example.permchange.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for permission change handling.
 * These values are bound from application.yml (permission-change.*).
 * The defaults below serve as fallbacks if properties are missing from YAML.
 */
@Component
@ConfigurationProperties(prefix = "permission-change")
@Data
public class PermissionChangeProperties {

    private String tableName = "permission_changes";

    /**
     * When false, updatedAt keeps the creation time after the authority writes a status.
     */
    private boolean refreshUpdatedAtOnStatus = false;

    private int pendingScanLimit = 100;
}
