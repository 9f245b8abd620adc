package com.myorg.eventbus.kafka;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Processes one consumed event. Throwing triggers the in-place retry and, once retries are
 * exhausted, a dead letter. Throw {@link com.myorg.eventbus.contracts.core.exception.EventBusNonRetryableException}
 * to skip the retries.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(ConsumerRecord<String, String> record, EventEnvelope event, String topic) throws Exception;
}
