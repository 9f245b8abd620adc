package com.myorg.eventbus.contracts.core.envelope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

/**
 * Unit of transport for every event on the bus.
 *
 * <p>Before a producer hands an envelope to the broker, {@code id}, {@code type}, {@code time}
 * and {@code source} are non-empty. The dead-letter fields ({@link #error},
 * {@link #processingService}, {@link #originalTopic}) are only present on messages read from a
 * {@code .dlq} topic.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EventEnvelope {
    private String id; // UUID
    private String type; // e.g. "tenant.created"
    private String source; // emitting service
    private String time; // ISO-8601

    private String dataVersion; // "1.0"
    private String dataContentType; // "application/json"

    private String tenantId; // null for system-wide events
    private String correlationId;
    private String causationId;
    private String userId;

    private JsonNode data;

    // dead-letter metadata
    private ErrorInfo error;
    private String processingService;
    private String originalTopic;
}
