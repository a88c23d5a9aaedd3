package com.example.permchange.service;

import com.example.permchange.access.PermissionChangeAccess;
import com.example.permchange.config.PermissionChangeProperties;
import com.example.permchange.models.PermissionChange;
import com.example.permchange.requests.ApplyStatusServiceRequest;
import com.example.permchange.requests.CreatePermissionChangeServiceRequest;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;

/**
 * Creates permission changes on behalf of the client and records the terminal status written by
 * the authority. Every stored mutation is published through the {@link PermissionChangeNotifier}
 * after it has been persisted.
 */
@Service
@Slf4j
public class PermissionChangeService {

    private final PermissionChangeAccess permissionChangeAccess;
    private final PermissionChangeNotifier notifier;
    private final PermissionChangeProperties properties;
    private final Clock clock;

    public PermissionChangeService(PermissionChangeAccess permissionChangeAccess,
                                   PermissionChangeNotifier notifier,
                                   PermissionChangeProperties properties,
                                   Clock clock) {
        this.permissionChangeAccess = permissionChangeAccess;
        this.notifier = notifier;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Builds, persists and announces a new permission change. A request combining both targeting
     * modes, or using neither, is rejected before anything is stored.
     */
    public PermissionChange create(CreatePermissionChangeServiceRequest request) {
        Objects.requireNonNull(request, "request");

        PermissionChange change = PermissionChange.newRequest(clock)
                .userId(request.userId())
                .metadataKey(request.metadataKey())
                .metadataValue(request.metadataValue())
                .realmUrl(request.realmUrl())
                .mayRead(request.mayRead())
                .mayWrite(request.mayWrite())
                .mayManage(request.mayManage())
                .build();

        try {
            permissionChangeAccess.save(change);
        } catch (ConditionalCheckFailedException ex) {
            throw PermissionChangeException.changeAlreadyExists(change.getId());
        }

        log.info("[{}] Created permission change {} on {} (read={}, write={}, manage={})",
                request.requestId(), change.getId(), change.getRealmUrl(),
                change.getMayRead(), change.getMayWrite(), change.getMayManage());

        notifier.publish(change, PermissionChange.Fields.STORED);
        return change;
    }

    public Optional<PermissionChange> findById(String changeId) {
        Objects.requireNonNull(changeId, "changeId");
        return permissionChangeAccess.findById(changeId);
    }

    public PermissionChange getById(String changeId) {
        return findById(changeId)
                .orElseThrow(() -> PermissionChangeException.changeNotFound(changeId));
    }

    public List<PermissionChange> findUnprocessed() {
        return permissionChangeAccess.findUnprocessed(properties.getPendingScanLimit());
    }

    /**
     * Records the authority's outcome for a change. The first status wins: repeating the same
     * status code is a no-op that returns the stored change, while a different code is rejected
     * with {@link PermissionChangeException.Code#CONFLICTING_STATUS}.
     */
    public PermissionChange applyStatus(ApplyStatusServiceRequest request) {
        Objects.requireNonNull(request, "request");

        PermissionChange existing = getById(request.changeId());
        if (existing.hasTerminalStatus()) {
            return resolveRepeatedStatus(existing, request);
        }

        Set<String> changedFields = new LinkedHashSet<>();
        changedFields.add(PermissionChange.Fields.STATUS_CODE);
        changedFields.add(PermissionChange.Fields.STATUS_MESSAGE);

        PermissionChange.PermissionChangeBuilder builder = existing.toBuilder()
                .statusCode(request.statusCode())
                .statusMessage(request.statusMessage());
        if (properties.isRefreshUpdatedAtOnStatus()) {
            builder.updatedAt(clock.millis());
            changedFields.add(PermissionChange.Fields.UPDATED_AT);
        }
        PermissionChange updated = builder.build();

        try {
            permissionChangeAccess.updateStatus(updated);
        } catch (ConditionalCheckFailedException ex) {
            // Another writer got there first; classify against what it stored.
            PermissionChange current = getById(request.changeId());
            if (!current.hasTerminalStatus()) {
                throw PermissionChangeException.unknown(
                        "Status update for permission change " + request.changeId() + " was rejected by the store");
            }
            return resolveRepeatedStatus(current, request);
        }

        log.info("[{}] Recorded status {} for permission change {}",
                request.requestId(), request.statusCode(), request.changeId());

        notifier.publish(updated, changedFields);
        return updated;
    }

    /**
     * Completes once the authority has written a status for the change. Completion is driven by
     * change notifications, never by polling the store.
     */
    public CompletableFuture<PermissionChange> whenProcessed(String changeId) {
        PermissionChange current = getById(changeId);
        if (current.hasTerminalStatus()) {
            return CompletableFuture.completedFuture(current);
        }

        CompletableFuture<PermissionChange> future = new CompletableFuture<>();
        Subscription subscription = notifier.subscribe(changeId, event -> {
            if (event.change().hasTerminalStatus()) {
                future.complete(event.change());
            }
        });
        future.whenComplete((change, ex) -> subscription.close());

        // A status written between the first read and the subscription would otherwise be missed.
        findById(changeId)
                .filter(PermissionChange::hasTerminalStatus)
                .ifPresent(future::complete);
        return future;
    }

    public Subscription subscribe(String changeId, PermissionChangeListener listener) {
        return notifier.subscribe(changeId, listener);
    }

    private PermissionChange resolveRepeatedStatus(PermissionChange stored, ApplyStatusServiceRequest request) {
        int storedCode = stored.getStatusCode();
        if (storedCode == request.statusCode()) {
            log.debug("[{}] Ignoring repeated status {} for permission change {}",
                    request.requestId(), storedCode, stored.getId());
            return stored;
        }

        log.warn("[{}] Rejected status {} for permission change {}: already processed with status {}",
                request.requestId(), request.statusCode(), stored.getId(), storedCode);
        throw PermissionChangeException.conflictingStatus(stored.getId(), storedCode, request.statusCode());
    }
}
