package com.myorg.eventbus.example;

import com.myorg.eventbus.contracts.core.envelope.ErrorInfo;
import com.myorg.eventbus.eventing.EventingProperties;
import com.myorg.eventbus.kafka.MessageBusClient;
import com.myorg.eventbus.kafka.MessageBusLifecycle;
import com.myorg.eventbus.kafka.SubscribeOptions;
import com.myorg.eventbus.kafka.Subscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Logs every dead letter of the consumed topics, so a message ending up in a DLQ shows in the logs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "example.dlq-monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DeadLetterMonitor implements SmartLifecycle {
    private final MessageBusClient client;
    private final EventingProperties eventing;
    private final List<Subscription> subscriptions = new ArrayList<>();
    private volatile boolean running;

    @Override
    public synchronized void start() {
        for (String topic : eventing.getConsumeTopics()) {
            SubscribeOptions options = SubscribeOptions.builder()
                    .groupId(client.getServiceName() + "-" + client.dlqTopicOf(topic) + "-monitor")
                    .build();
            subscriptions.add(client.consumeDlq(topic, (record, letter, t) -> {
                ErrorInfo error = letter.getError();
                log.error("DLQ RECEIVED topic={} partition={} offset={} originalTopic={} processingService={} eventId={} eventType={} error={}",
                        t, record.partition(), record.offset(),
                        letter.getOriginalTopic(), letter.getProcessingService(),
                        letter.getId(), letter.getType(),
                        error == null ? null : error.getMessage());
            }, options));
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        for (Subscription s : subscriptions) {
            try {
                s.unsubscribe();
            } catch (RuntimeException e) {
                log.warn("Failed to stop DLQ monitor for {}", s.topic(), e);
            }
        }
        subscriptions.clear();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        // sau MessageBusLifecycle, cùng pha với consume-topics subscriber
        return MessageBusLifecycle.PHASE + 100;
    }
}
