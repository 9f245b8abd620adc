package com.myorg.eventbus.contracts.core.registry;

import com.myorg.eventbus.contracts.analytics.AnalyticsEventType;
import com.myorg.eventbus.contracts.billing.BillingEventType;
import com.myorg.eventbus.contracts.domain.DomainEventType;
import com.myorg.eventbus.contracts.file.FileEventType;
import com.myorg.eventbus.contracts.notification.NotificationEventType;
import com.myorg.eventbus.contracts.tenant.TenantEventType;
import com.myorg.eventbus.contracts.user.UserEventType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

// Lookup from wire string to enum constant. Unknown types are not an error.
public final class EventTypeRegistry {

    private static final Map<String, EventType> BY_VALUE;

    static {
        Map<String, EventType> m = new LinkedHashMap<>();
        register(m, TenantEventType.values());
        register(m, DomainEventType.values());
        register(m, UserEventType.values());
        register(m, BillingEventType.values());
        register(m, NotificationEventType.values());
        register(m, FileEventType.values());
        register(m, AnalyticsEventType.values());
        BY_VALUE = Collections.unmodifiableMap(m);
    }

    private EventTypeRegistry() {}

    private static void register(Map<String, EventType> m, EventType[] types) {
        for (EventType t : types) {
            EventType prev = m.put(t.value(), t);
            if (prev != null) {
                throw new IllegalStateException("Duplicate event type " + t.value() + ": " + prev + " / " + t);
            }
        }
    }

    public static Optional<EventType> find(String value) {
        if (value == null) return Optional.empty();
        return Optional.ofNullable(BY_VALUE.get(value));
    }

    public static boolean isKnown(String value) {
        return find(value).isPresent();
    }

    public static Optional<Class<?>> payloadTypeOf(String value) {
        return find(value).map(EventType::payloadType);
    }

    public static Map<String, EventType> all() {
        return BY_VALUE;
    }
}
