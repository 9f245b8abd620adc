package com.myorg.eventbus.contracts.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.eventbus.contracts.core.envelope.ErrorInfo;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.contracts.tenant.TenantCreatedEventData;
import com.myorg.eventbus.contracts.tenant.TenantEventType;
import com.myorg.eventbus.contracts.tenant.TenantSuspendedEventData;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeBuilderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void wrap_shouldPopulateTransportMetadata() {
        TenantCreatedEventData data = TenantCreatedEventData.builder()
                .id("t1").name("Acme").schemaName("tenant_acme").packageId("pro")
                .billingEmail("billing@acme.test").initialModules(List.of("crm", "billing"))
                .build();

        EventEnvelope env = EnvelopeBuilder.wrap(mapper, TenantEventType.CREATED, "tenant-service", "t1", data);

        assertThat(env.getId()).isNotBlank();
        assertThat(env.getType()).isEqualTo("tenant.created");
        assertThat(env.getSource()).isEqualTo("tenant-service");
        assertThat(Instant.parse(env.getTime())).isBeforeOrEqualTo(Instant.now());
        assertThat(env.getDataVersion()).isEqualTo("1.0");
        assertThat(env.getDataContentType()).isEqualTo("application/json");
        assertThat(env.getTenantId()).isEqualTo("t1");
        assertThat(env.getData().get("initialModules").size()).isEqualTo(2);
        assertThat(env.getError()).isNull();
    }

    @Test
    void causedBy_shouldChainCorrelationAndCausation() {
        EventEnvelope parent = EnvelopeBuilder.wrap(mapper, "tenant.created", "tenant-service",
                "t1", "corr-1", null, "u1", null);

        EventEnvelope child = EnvelopeBuilder.causedBy(mapper, parent, TenantEventType.SUSPENDED,
                "billing-service", TenantSuspendedEventData.builder().id("t1").reason("unpaid").build());

        assertThat(child.getCorrelationId()).isEqualTo("corr-1");
        assertThat(child.getCausationId()).isEqualTo(parent.getId());
        assertThat(child.getTenantId()).isEqualTo("t1");
        assertThat(child.getUserId()).isEqualTo("u1");
    }

    @Test
    void causedBy_withoutCorrelation_shouldStartChainAtParentId() {
        EventEnvelope parent = EnvelopeBuilder.wrap(mapper, TenantEventType.CREATED, "tenant-service", null, null);

        EventEnvelope child = EnvelopeBuilder.causedBy(mapper, parent, TenantEventType.ACTIVATED, "tenant-service", null);

        assertThat(child.getCorrelationId()).isEqualTo(parent.getId());
    }

    @Test
    void wrap_shouldRejectMalformedType() {
        assertThatThrownBy(() -> EnvelopeBuilder.wrap(mapper, "TenantCreated", "svc", null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TenantCreated");
    }

    @Test
    void json_shouldOmitAbsentOptionalFields_andIgnoreUnknownOnRead() throws Exception {
        EventEnvelope env = EnvelopeBuilder.wrap(mapper, TenantEventType.DELETED, "tenant-service", null, null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(env));
        assertThat(json.has("tenantId")).isFalse();
        assertThat(json.has("error")).isFalse();
        assertThat(json.has("originalTopic")).isFalse();

        String withExtras = "{\"id\":\"e1\",\"type\":\"tenant.deleted\",\"source\":\"s\",\"time\":\"2024-01-01T00:00:00Z\","
                + "\"futureField\":42,\"error\":{\"message\":\"boom\",\"stack\":\"...\",\"time\":\"2024-01-01T00:00:01Z\"},"
                + "\"originalTopic\":\"orders\",\"processingService\":\"svc\"}";
        EventEnvelope read = mapper.readValue(withExtras, EventEnvelope.class);
        assertThat(read.getId()).isEqualTo("e1");
        assertThat(read.getError()).isEqualTo(ErrorInfo.builder().message("boom").stack("...").time("2024-01-01T00:00:01Z").build());
        assertThat(read.getOriginalTopic()).isEqualTo("orders");
    }
}
