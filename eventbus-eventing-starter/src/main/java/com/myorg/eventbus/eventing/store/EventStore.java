package com.myorg.eventbus.eventing.store;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.kafka.MessageBusClient;
import com.myorg.eventbus.kafka.ProduceOptions;
import com.myorg.eventbus.kafka.SubscribeOptions;
import com.myorg.eventbus.kafka.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Append-only event log on a single topic.
 * <p>
 * Records are keyed {@code <tenantId>-<type>} (or just {@code <type>}) so events of one tenant and
 * type stay on one partition and keep their order. Subscribers replay the log from the earliest
 * offset unless they opt out, which is how read models are rebuilt.
 */
@Slf4j
public class EventStore {

    public static final String DEFAULT_TOPIC = "event-store";
    public static final String DEFAULT_GROUP_ID = "event-store-consumer";

    private final MessageBusClient client;
    private final String topic;
    private final String defaultGroupId;

    public EventStore(MessageBusClient client, String topic, String defaultGroupId) {
        this.client = client;
        this.topic = StringUtils.hasText(topic) ? topic : DEFAULT_TOPIC;
        this.defaultGroupId = StringUtils.hasText(defaultGroupId) ? defaultGroupId : DEFAULT_GROUP_ID;
    }

    public EventStore(MessageBusClient client) {
        this(client, DEFAULT_TOPIC, DEFAULT_GROUP_ID);
    }

    /**
     * Appends an already normalized envelope. Nothing is filled in here.
     *
     * @throws IllegalArgumentException if {@code id}, {@code type} or {@code time} is missing
     */
    public CompletableFuture<Long> saveEvent(EventEnvelope event) {
        validate(event);
        String key = keyFor(event);
        return client.produce(topic, event, ProduceOptions.builder().key(key).build())
                .whenComplete((offset, ex) -> {
                    if (ex != null) {
                        log.error("Failed to save event {} type={} to {}", event.getId(), event.getType(), topic, ex);
                    } else {
                        log.debug("Saved event {} type={} key={} offset={}", event.getId(), event.getType(), key, offset);
                    }
                });
    }

    public Subscription subscribeToEventStore(EventStoreHandler handler) {
        return subscribeToEventStore(handler, null);
    }

    /**
     * Null {@code groupId} means {@value #DEFAULT_GROUP_ID}, null {@code fromBeginning} means replay.
     */
    public Subscription subscribeToEventStore(EventStoreHandler handler, SubscribeOptions options) {
        SubscribeOptions.SubscribeOptionsBuilder b = options != null ? options.toBuilder() : SubscribeOptions.builder();
        SubscribeOptions effective = b.build();
        if (!StringUtils.hasText(effective.getGroupId())) effective.setGroupId(defaultGroupId);
        if (effective.getFromBeginning() == null) effective.setFromBeginning(true);

        log.info("Subscribing to event store {} group={} fromBeginning={}",
                topic, effective.getGroupId(), effective.getFromBeginning());
        return client.subscribe(topic, (record, event, t) -> handler.handle(event), effective);
    }

    public static String keyFor(EventEnvelope event) {
        return StringUtils.hasText(event.getTenantId())
                ? event.getTenantId() + "-" + event.getType()
                : event.getType();
    }

    public String getTopic() {
        return topic;
    }

    private static void validate(EventEnvelope event) {
        if (event == null) {
            throw new IllegalArgumentException("Event must not be null");
        }
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(event.getId())) missing.add("id");
        if (!StringUtils.hasText(event.getType())) missing.add("type");
        if (!StringUtils.hasText(event.getTime())) missing.add("time");
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Event must have id, type and time; missing " + missing);
        }
    }
}
