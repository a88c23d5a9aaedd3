package com.example.permchange.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.permchange.models.ErrorCode;
import com.example.permchange.models.PermissionChange;
import com.example.permchange.models.PermissionDirective;
import com.example.permchange.models.ProcessingStatus;
import com.example.permchange.models.StatusDecoder;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PermissionChangeNotifierTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-01T00:00:00Z"), ZoneOffset.UTC);

    private List<String> received;
    private PermissionChangeNotifier notifier;
    private PermissionChange change;

    @BeforeEach
    void setUp() {
        received = new ArrayList<>();
        notifier = new PermissionChangeNotifier(List.of(event -> received.add("global:" + event.changeId())));
        change = PermissionChange.forUser(CLOCK, "alice", "/shared/calendar", PermissionDirective.GRANT, null, null);
    }

    @Test
    @DisplayName("statusCode change adds the derived fields and a matching decoding")
    void statusCodeChangeRepublishesDerivedFields() {
        PermissionChange failed = change.toBuilder().statusCode(619).statusMessage("unsupported").build();

        PermissionChangeEvent event = notifier.publish(failed, Set.of(PermissionChange.Fields.STATUS_CODE));

        assertTrue(event.hasChanged(PermissionChange.Fields.STATUS_CODE));
        assertTrue(event.hasChanged(PermissionChange.Fields.STATUS));
        assertTrue(event.hasChanged(PermissionChange.Fields.ERROR_CODE));
        assertEquals(ProcessingStatus.ERROR, event.status().status());
        assertEquals(ErrorCode.UNKNOWN, event.status().error().kind());
        assertEquals(619, event.status().error().rawCode());
    }

    @Test
    @DisplayName("batches without statusCode do not announce derived fields")
    void otherFieldsLeaveDerivedFieldsAlone() {
        PermissionChangeEvent event = notifier.publish(change, Set.of(PermissionChange.Fields.UPDATED_AT));

        assertEquals(Set.of(PermissionChange.Fields.UPDATED_AT), event.changedFields());
        assertEquals(ProcessingStatus.NOT_PROCESSED, event.status().status());
    }

    @Test
    @DisplayName("every listener in a batch sees the decoding of the stored code")
    void listenersNeverSeeStalePairing() {
        List<Boolean> consistent = new ArrayList<>();
        PermissionChangeListener check = event -> consistent.add(
                event.status().equals(StatusDecoder.decode(event.change().getStatusCode()))
                        && event.hasChanged(PermissionChange.Fields.STATUS));
        notifier.subscribe(change.getId(), check);
        notifier.subscribeAll(check);

        notifier.publish(change.toBuilder().statusCode(0).build(), Set.of(PermissionChange.Fields.STATUS_CODE));

        assertEquals(List.of(true, true), consistent);
    }

    @Test
    @DisplayName("per-change subscribers run before global listeners and only for their change")
    void perChangeSubscribersAreScoped() {
        PermissionChange other = PermissionChange.forUser(CLOCK, "bob", "/shared/calendar", null, null, null);
        notifier.subscribe(change.getId(), event -> received.add("change:" + event.changeId()));

        notifier.publish(change, Set.of(PermissionChange.Fields.STATUS_CODE));
        notifier.publish(other, Set.of(PermissionChange.Fields.STATUS_CODE));

        assertEquals(List.of(
                "change:" + change.getId(),
                "global:" + change.getId(),
                "global:" + other.getId()), received);
    }

    @Test
    @DisplayName("a failing listener does not stop delivery to the others")
    void failingListenerIsIsolated() {
        notifier.subscribe(change.getId(), event -> {
            throw new IllegalStateException("listener exploded");
        });
        notifier.subscribe(change.getId(), event -> received.add("second"));

        notifier.publish(change, Set.of(PermissionChange.Fields.STATUS_CODE));

        assertEquals(List.of("second", "global:" + change.getId()), received);
    }

    @Test
    @DisplayName("closing a subscription stops delivery and is idempotent")
    void closeUnsubscribes() {
        Subscription subscription = notifier.subscribe(change.getId(), event -> received.add("change"));
        assertEquals(1, notifier.subscriberCount(change.getId()));

        subscription.close();
        subscription.close();
        notifier.publish(change, Set.of(PermissionChange.Fields.STATUS_CODE));

        assertEquals(0, notifier.subscriberCount(change.getId()));
        assertFalse(received.contains("change"));
    }

    @Test
    @DisplayName("global subscriptions can be closed")
    void closeGlobalSubscription() {
        List<String> extra = new ArrayList<>();
        Subscription subscription = notifier.subscribeAll(event -> extra.add(event.changeId()));

        notifier.publish(change, Set.of(PermissionChange.Fields.STATUS_CODE));
        subscription.close();
        notifier.publish(change, Set.of(PermissionChange.Fields.STATUS_CODE));

        assertEquals(List.of(change.getId()), extra);
    }
}
