package com.myorg.eventbus.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.contracts.tenant.TenantEventType;
import com.myorg.eventbus.eventing.store.EventStore;
import com.myorg.eventbus.kafka.Subscription;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory tenant status projection rebuilt by replaying the event store on startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantReadModel {
    // chỉ có khi eventbus.eventing.event-store.enabled=true
    private final ObjectProvider<EventStore> eventStore;
    private final Map<String, String> statusByTenant = new ConcurrentHashMap<>();
    private volatile Subscription subscription;

    @EventListener(ApplicationReadyEvent.class)
    public void replay() {
        EventStore store = eventStore.getIfAvailable();
        if (store == null) {
            log.info("Event store disabled, tenant read model stays empty");
            return;
        }
        subscription = store.subscribeToEventStore(this::apply);
    }

    void apply(EventEnvelope event) {
        String tenantId = tenantIdOf(event);
        if (tenantId == null) {
            return;
        }
        String type = event.getType();
        if (TenantEventType.CREATED.value().equals(type) || TenantEventType.ACTIVATED.value().equals(type)) {
            statusByTenant.put(tenantId, "ACTIVE");
        } else if (TenantEventType.SUSPENDED.value().equals(type)) {
            statusByTenant.put(tenantId, "SUSPENDED");
        } else if (TenantEventType.DELETED.value().equals(type)) {
            statusByTenant.remove(tenantId);
        } else {
            return;
        }
        log.debug("Tenant {} -> {} after {}", tenantId, statusByTenant.get(tenantId), type);
    }

    public Optional<String> statusOf(String tenantId) {
        return Optional.ofNullable(statusByTenant.get(tenantId));
    }

    public int size() {
        return statusByTenant.size();
    }

    @PreDestroy
    void close() {
        Subscription s = subscription;
        if (s != null) {
            s.unsubscribe();
        }
    }

    private static String tenantIdOf(EventEnvelope event) {
        if (event.getTenantId() != null) {
            return event.getTenantId();
        }
        JsonNode data = event.getData();
        if (data != null && data.hasNonNull("id")) {
            return data.get("id").asText();
        }
        return null;
    }
}
