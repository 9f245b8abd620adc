package com.myorg.eventbus.example;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.eventbus.contracts.billing.PaymentSucceededEventData;
import com.myorg.eventbus.contracts.core.envelope.EnvelopeBuilder;
import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.contracts.core.exception.EventBusNonRetryableException;
import com.myorg.eventbus.contracts.notification.NotificationEventType;
import com.myorg.eventbus.contracts.tenant.TenantCreatedEventData;
import com.myorg.eventbus.eventing.EventBusHandler;
import com.myorg.eventbus.kafka.MessageBusClient;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns tenant and billing events into email requests on {@link ExampleTopics#NOTIFICATION_EVENTS}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationHandlers {
    static final String HANDLED_COUNTER = "example.notifications.requested";

    private final MessageBusClient client;
    private final ObjectMapper mapper;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    void initMetrics() {
        // pre-register để /actuator/metrics không 404 trước event đầu tiên
        meterRegistry.counter(HANDLED_COUNTER);
    }

    @EventBusHandler("tenant.created")
    public void onTenantCreated(EventEnvelope envelope, TenantCreatedEventData data) {
        log.info("Tenant created id={} name={} billingEmail={}", data.getId(), data.getName(), data.getBillingEmail());
        requestEmail(envelope, data.getBillingEmail(), "welcome", Map.of("tenantName", nullToEmpty(data.getName())));
    }

    @EventBusHandler("billing.payment_succeeded")
    public void onPaymentSucceeded(EventEnvelope envelope, PaymentSucceededEventData data) {
        if (data.getAmount() == null || data.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            // retry không giúp được -> DLQ ngay
            throw new EventBusNonRetryableException("INVALID_AMOUNT",
                    "Payment " + data.getPaymentId() + " has non-positive amount " + data.getAmount());
        }
        log.info("Payment succeeded tenant={} invoice={} amount={} {}",
                data.getTenantId(), data.getInvoiceId(), data.getAmount(), data.getCurrency());

        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("invoiceId", nullToEmpty(data.getInvoiceId()));
        vars.put("amount", data.getAmount());
        vars.put("currency", nullToEmpty(data.getCurrency()));
        requestEmail(envelope, null, "payment-receipt", vars);
    }

    private void requestEmail(EventEnvelope cause, String to, String template, Map<String, Object> vars) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("to", to);
        body.put("template", template);
        body.put("variables", vars);

        EventEnvelope request = EnvelopeBuilder.causedBy(mapper, cause,
                NotificationEventType.EMAIL_REQUESTED, client.getServiceName(), body);
        // join: lỗi produce phải làm handler fail để được retry
        client.produce(ExampleTopics.NOTIFICATION_EVENTS, request).join();
        meterRegistry.counter(HANDLED_COUNTER).increment();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
