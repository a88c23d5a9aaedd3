package com.example.permchange.service;

import com.example.permchange.models.PermissionChange;
import com.example.permchange.models.ServerError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs creations and terminal status transitions of every permission change.
 */
@Component
@Slf4j
public class LoggingPermissionChangeListener implements PermissionChangeListener {

    @Override
    public void onChange(PermissionChangeEvent event) {
        PermissionChange change = event.change();

        if (event.hasChanged(PermissionChange.Fields.ID)) {
            log.debug("Permission change {} created for {} on {}",
                    change.getId(), describeTarget(change), change.getRealmUrl());
        }

        if (!event.hasChanged(PermissionChange.Fields.STATUS_CODE)) {
            return;
        }

        switch (event.status().status()) {
            case SUCCESS -> log.info("Permission change {} processed successfully", change.getId());
            case ERROR -> {
                ServerError error = event.status().error();
                log.warn("Permission change {} failed: kind={}, code={}, message={}",
                        change.getId(), error.kind(), error.rawCode(), change.getStatusMessage());
            }
            default -> log.debug("Permission change {} is not processed yet", change.getId());
        }
    }

    private static String describeTarget(PermissionChange change) {
        if (change.targetsMetadata()) {
            return "metadata " + change.getMetadataKey() + "=" + change.getMetadataValue();
        }
        return "user " + change.getUserId();
    }
}
