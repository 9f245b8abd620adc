package com.myorg.eventbus.kafka.exception;

public class ProduceTransportException extends EventBusException {

    private final String topic;
    private final String eventId;

    public ProduceTransportException(String topic, String eventId, Throwable cause) {
        super("Failed to produce message to " + topic + " eventId=" + eventId + ": " + cause, cause);
        this.topic = topic;
        this.eventId = eventId;
    }

    public String getTopic() {
        return topic;
    }

    public String getEventId() {
        return eventId;
    }
}
