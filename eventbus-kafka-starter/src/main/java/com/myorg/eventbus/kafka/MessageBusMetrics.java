package com.myorg.eventbus.kafka;

import com.myorg.eventbus.kafka.circuit.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for the client. Every method is a no-op when no registry is available.
 */
public class MessageBusMetrics {

    public static final String PRODUCE = "eventbus.produce";
    public static final String CIRCUIT_TRANSITION = "eventbus.circuit.transition";
    public static final String CONSUME_RETRY = "eventbus.consume.retry";
    public static final String CONSUME_DLQ = "eventbus.consume.dlq";
    public static final String DLQ_PUBLISH_FAILED = "eventbus.dlq.publish_failed";

    private final MeterRegistry registry;
    private final String serviceName;

    public MessageBusMetrics(MeterRegistry registry, String serviceName) {
        this.registry = registry;
        this.serviceName = serviceName;
    }

    public static MessageBusMetrics noop() {
        return new MessageBusMetrics(null, "unknown-service");
    }

    // Pre-created base meters (actuator không 404 trước message đầu tiên)
    public void preRegisterBaseMeters() {
        if (registry == null) return;
        Counter.builder(CONSUME_RETRY).tag("service", serviceName).register(registry);
        Counter.builder(CONSUME_DLQ).tag("service", serviceName).register(registry);
        Counter.builder(DLQ_PUBLISH_FAILED).tag("service", serviceName).register(registry);
    }

    /** outcome: success | failure | rejected */
    public void produced(String topic, String outcome) {
        if (registry == null) return;
        registry.counter(PRODUCE, "service", serviceName, "topic", topic, "outcome", outcome).increment();
    }

    public void circuitTransition(CircuitState to) {
        if (registry == null) return;
        registry.counter(CIRCUIT_TRANSITION, "service", serviceName, "state", to.name()).increment();
    }

    public void retry() {
        if (registry == null) return;
        registry.counter(CONSUME_RETRY, "service", serviceName).increment();
    }

    public void deadLettered(String reason) {
        if (registry == null) return;
        registry.counter(CONSUME_DLQ, "service", serviceName).increment();
        registry.counter(CONSUME_DLQ + ".reason", "service", serviceName, "reason", reason).increment();
    }

    public void dlqPublishFailed() {
        if (registry == null) return;
        registry.counter(DLQ_PUBLISH_FAILED, "service", serviceName).increment();
    }
}
