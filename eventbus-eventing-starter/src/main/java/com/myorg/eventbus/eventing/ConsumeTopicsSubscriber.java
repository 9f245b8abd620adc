package com.myorg.eventbus.eventing;

import com.myorg.eventbus.kafka.MessageBusClient;
import com.myorg.eventbus.kafka.MessageBusLifecycle;
import com.myorg.eventbus.kafka.SubscribeOptions;
import com.myorg.eventbus.kafka.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.List;

/**
 * Subscribes the dispatcher to every configured topic on startup and unsubscribes on shutdown.
 * Starts after, and stops before, {@link MessageBusLifecycle}.
 */
@Slf4j
public class ConsumeTopicsSubscriber implements SmartLifecycle {

    private final MessageBusClient client;
    private final DispatchingMessageHandler handler;
    private final List<String> topics;
    private final String groupId;

    private final List<Subscription> subscriptions = new ArrayList<>();
    private volatile boolean running;

    public ConsumeTopicsSubscriber(MessageBusClient client, EventDispatcher dispatcher, List<String> topics, String groupId) {
        this.client = client;
        this.handler = new DispatchingMessageHandler(dispatcher);
        this.topics = List.copyOf(topics);
        this.groupId = groupId;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        for (String topic : topics) {
            subscriptions.add(client.subscribe(topic, handler, SubscribeOptions.builder().groupId(groupId).build()));
        }
        running = true;
        log.info("Dispatching events from topics {}", topics);
    }

    @Override
    public synchronized void stop() {
        for (Subscription s : subscriptions) {
            try {
                s.unsubscribe();
            } catch (RuntimeException e) {
                log.error("Failed to unsubscribe from {}", s.topic(), e);
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
        return MessageBusLifecycle.PHASE + 100;
    }
}
