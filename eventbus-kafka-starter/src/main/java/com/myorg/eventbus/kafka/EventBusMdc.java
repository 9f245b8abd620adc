package com.myorg.eventbus.kafka;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;

/** MDC keys set while a consumed record is being processed. */
public final class EventBusMdc {

    public static final String TOPIC = "topic";
    public static final String PARTITION = "partition";
    public static final String OFFSET = "offset";
    public static final String EVENT_ID = "eventId";
    public static final String EVENT_TYPE = "eventType";
    public static final String TENANT_ID = "tenantId";
    public static final String CORRELATION_ID = "corrId";

    private EventBusMdc() {}

    public static void put(ConsumerRecord<?, ?> record) {
        if (record == null) return;
        MDC.put(TOPIC, record.topic());
        MDC.put(PARTITION, String.valueOf(record.partition()));
        MDC.put(OFFSET, String.valueOf(record.offset()));
    }

    public static void put(EventEnvelope env) {
        if (env == null) return;
        if (env.getId() != null) MDC.put(EVENT_ID, env.getId());
        if (env.getType() != null) MDC.put(EVENT_TYPE, env.getType());
        if (env.getTenantId() != null) MDC.put(TENANT_ID, env.getTenantId());
        if (env.getCorrelationId() != null) MDC.put(CORRELATION_ID, env.getCorrelationId());
    }

    public static void clear() {
        MDC.remove(TOPIC);
        MDC.remove(PARTITION);
        MDC.remove(OFFSET);
        MDC.remove(EVENT_ID);
        MDC.remove(EVENT_TYPE);
        MDC.remove(TENANT_ID);
        MDC.remove(CORRELATION_ID);
    }
}
