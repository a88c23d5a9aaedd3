package com.example.permchange.service;

import com.example.permchange.models.DecodedStatus;
import com.example.permchange.models.PermissionChange;
import com.example.permchange.models.StatusDecoder;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dispatches field-change notifications for permission changes.
 *
 * When a batch includes {@code statusCode}, the derived status and error code are recomputed
 * and added to the batch before the first listener runs, so no listener can observe a status
 * code paired with a stale decoding. Per-change subscribers are notified before global ones.
 */
@Component
@Slf4j
public class PermissionChangeNotifier {

    private final Map<String, List<PermissionChangeListener>> listenersByChange = new ConcurrentHashMap<>();
    private final List<PermissionChangeListener> globalListeners = new CopyOnWriteArrayList<>();

    public PermissionChangeNotifier(List<PermissionChangeListener> globalListeners) {
        this.globalListeners.addAll(globalListeners);
    }

    public Subscription subscribe(String changeId, PermissionChangeListener listener) {
        Objects.requireNonNull(changeId, "changeId");
        Objects.requireNonNull(listener, "listener");

        listenersByChange.computeIfAbsent(changeId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return once(() -> listenersByChange.computeIfPresent(changeId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        }));
    }

    public Subscription subscribeAll(PermissionChangeListener listener) {
        Objects.requireNonNull(listener, "listener");

        globalListeners.add(listener);
        return once(() -> globalListeners.remove(listener));
    }

    public PermissionChangeEvent publish(PermissionChange change, Set<String> changedFields) {
        Objects.requireNonNull(change, "change");
        Objects.requireNonNull(changedFields, "changedFields");

        Set<String> fields = new LinkedHashSet<>(changedFields);
        DecodedStatus status = StatusDecoder.decode(change.getStatusCode());
        if (fields.contains(PermissionChange.Fields.STATUS_CODE)) {
            fields.add(PermissionChange.Fields.STATUS);
            fields.add(PermissionChange.Fields.ERROR_CODE);
        }

        PermissionChangeEvent event = new PermissionChangeEvent(
                change, Collections.unmodifiableSet(fields), status);

        dispatch(listenersByChange.getOrDefault(change.getId(), List.of()), event);
        dispatch(globalListeners, event);
        return event;
    }

    int subscriberCount(String changeId) {
        return listenersByChange.getOrDefault(changeId, List.of()).size();
    }

    private void dispatch(List<PermissionChangeListener> listeners, PermissionChangeEvent event) {
        for (PermissionChangeListener listener : listeners) {
            try {
                listener.onChange(event);
            } catch (RuntimeException ex) {
                log.error("Listener {} failed for permission change {} (fields={}): {}",
                        listener, event.changeId(), event.changedFields(), ex.getMessage(), ex);
            }
        }
    }

    private static Subscription once(Runnable action) {
        AtomicBoolean closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                action.run();
            }
        };
    }
}
