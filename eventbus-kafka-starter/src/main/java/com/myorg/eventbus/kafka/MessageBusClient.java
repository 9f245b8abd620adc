package com.myorg.eventbus.kafka;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.kafka.circuit.CircuitBreaker;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Resilient facade over the broker.
 * <p>
 * Delivery is at-least-once: a handler can see the same event again after a crash or rebalance,
 * so handlers must be idempotent.
 */
public interface MessageBusClient {

    /** Connects and, when enabled, verifies the cluster is reachable. */
    void start();

    /** Stops every subscription, then releases producers. */
    void stop();

    boolean isRunning();

    /**
     * Publishes through the circuit breaker. Missing {@code id}, {@code time} and {@code source}
     * are filled in on a copy; the caller's envelope is not modified.
     *
     * @return future of the offset assigned by the broker. Fails with
     * {@link com.myorg.eventbus.kafka.exception.CircuitOpenException} or
     * {@link com.myorg.eventbus.kafka.exception.ProduceTransportException}.
     */
    CompletableFuture<Long> produce(String topic, EventEnvelope event, ProduceOptions options);

    default CompletableFuture<Long> produce(String topic, EventEnvelope event) {
        return produce(topic, event, ProduceOptions.none());
    }

    Subscription subscribe(String topic, MessageHandler handler, SubscribeOptions options);

    default Subscription subscribe(String topic, MessageHandler handler) {
        return subscribe(topic, handler, SubscribeOptions.defaults());
    }

    /** Reads {@code <topic>.dlq}; dead letters are decoded leniently and never re-dead-lettered. */
    Subscription consumeDlq(String topic, MessageHandler handler, SubscribeOptions options);

    default Subscription consumeDlq(String topic, MessageHandler handler) {
        return consumeDlq(topic, handler, SubscribeOptions.defaults());
    }

    void setDlqEnabled(boolean enabled);

    boolean isDlqEnabled();

    String dlqTopicOf(String topic);

    /** Idempotent: an existing topic is not an error. */
    void createTopic(String topic, int partitions, short replicationFactor);

    void createTopic(String topic);

    List<ConsumerGroupOffsets> getConsumerGroupsForTopic(String topic);

    CircuitBreaker getCircuitBreaker();

    String getServiceName();
}
