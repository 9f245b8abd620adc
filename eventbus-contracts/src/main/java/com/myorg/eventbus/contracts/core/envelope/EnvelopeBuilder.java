package com.myorg.eventbus.contracts.core.envelope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.contracts.core.conventions.EventTypeFormat;
import com.myorg.eventbus.contracts.core.registry.EventType;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.UUID;

@UtilityClass
public class EnvelopeBuilder {
    public static final String DEFAULT_DATA_VERSION = "1.0";
    public static final String DEFAULT_CONTENT_TYPE = "application/json";

    // every envelope built here already satisfies the transport invariant
    public static EventEnvelope wrap(ObjectMapper mapper,
                                     String type,
                                     String source,
                                     String tenantId,
                                     String correlationId,
                                     String causationId,
                                     String userId,
                                     Object data) {
        if (!EventTypeFormat.isValid(type)) {
            throw new IllegalArgumentException("Invalid event type '" + type + "', expected " + EventTypeFormat.RECOMMENDED_PATTERN);
        }
        return EventEnvelope.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .source(source)
                .time(Instant.now().toString())
                .dataVersion(DEFAULT_DATA_VERSION)
                .dataContentType(DEFAULT_CONTENT_TYPE)
                .tenantId(tenantId)
                .correlationId(correlationId)
                .causationId(causationId)
                .userId(userId)
                .data(data == null ? null : mapper.valueToTree(data))
                .build();
    }

    public static EventEnvelope wrap(ObjectMapper mapper, EventType type, String source, String tenantId, Object data) {
        return wrap(mapper, type.value(), source, tenantId, null, null, null, data);
    }

    /**
     * Builds an event caused by {@code cause}: same tenant and correlation chain,
     * {@code causationId} pointing at the parent.
     */
    public static EventEnvelope causedBy(ObjectMapper mapper, EventEnvelope cause, EventType type, String source, Object data) {
        String correlationId = cause.getCorrelationId() != null ? cause.getCorrelationId() : cause.getId();
        return wrap(mapper, type.value(), source, cause.getTenantId(), correlationId, cause.getId(), cause.getUserId(), data);
    }
}
