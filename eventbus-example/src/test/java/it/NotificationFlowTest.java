package it;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.contracts.billing.BillingEventType;
import com.myorg.eventbus.contracts.billing.PaymentSucceededEventData;
import com.myorg.eventbus.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.contracts.tenant.TenantCreatedEventData;
import com.myorg.eventbus.contracts.tenant.TenantEventType;
import com.myorg.eventbus.example.ExampleTopics;
import com.myorg.eventbus.kafka.MessageBusClient;
import com.myorg.eventbus.kafka.circuit.CircuitState;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationFlowTest extends AbstractIntegrationTest {

    @Autowired
    MessageBusClient client;
    @Autowired
    ObjectMapper mapper;

    @Test
    void tenantCreated_requestsWelcomeEmail_inSameCorrelationChain() throws Exception {
        String tenantId = "t-welcome-" + System.nanoTime();
        EventEnvelope created = EnvelopeBuilder.wrap(mapper, TenantEventType.CREATED, "tenant-service", tenantId,
                TenantCreatedEventData.builder().id(tenantId).name("Globex").billingEmail("ops@globex.test").build());

        Long offset = client.produce(ExampleTopics.TENANT_EVENTS, created).get();
        assertThat(offset).isNotNull().isGreaterThanOrEqualTo(0L);

        JsonNode request = awaitNotificationCausedBy(created.getId());
        assertThat(request.path("type").asText()).isEqualTo("notification.email_requested");
        assertThat(request.path("tenantId").asText()).isEqualTo(tenantId);
        assertThat(request.path("correlationId").asText()).isEqualTo(created.getId());
        assertThat(request.path("source").asText()).isEqualTo("notification-service");
        assertThat(request.path("data").path("to").asText()).isEqualTo("ops@globex.test");
        assertThat(request.path("data").path("template").asText()).isEqualTo("welcome");
        assertThat(client.getCircuitBreaker().getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void paymentSucceeded_requestsReceipt() throws Exception {
        EventEnvelope paid = EnvelopeBuilder.wrap(mapper, BillingEventType.PAYMENT_SUCCEEDED, "billing-service", "t-pay",
                PaymentSucceededEventData.builder()
                        .tenantId("t-pay")
                        .invoiceId("inv-7")
                        .amount(new BigDecimal("19.90"))
                        .currency("EUR")
                        .paymentId("pay-7")
                        .build());

        client.produce(ExampleTopics.BILLING_EVENTS, paid).get();

        JsonNode request = awaitNotificationCausedBy(paid.getId());
        assertThat(request.path("data").path("template").asText()).isEqualTo("payment-receipt");
        assertThat(request.path("data").path("variables").path("invoiceId").asText()).isEqualTo("inv-7");
    }

    private JsonNode awaitNotificationCausedBy(String causationId) {
        AtomicReference<JsonNode> found = new AtomicReference<>();
        try (KafkaConsumer<String, String> c = newRawConsumer("it-notify-" + System.nanoTime())) {
            c.subscribe(List.of(ExampleTopics.NOTIFICATION_EVENTS));
            Awaitility.await().atMost(Duration.ofSeconds(30))
                    .until(() -> {
                        for (ConsumerRecord<String, String> r : c.poll(Duration.ofMillis(500))) {
                            JsonNode node = mapper.readTree(r.value());
                            if (causationId.equals(node.path("causationId").asText())) {
                                found.set(node);
                                return true;
                            }
                        }
                        return false;
                    });
        }
        return found.get();
    }
}
