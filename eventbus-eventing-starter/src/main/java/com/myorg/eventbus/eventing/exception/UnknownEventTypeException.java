package com.myorg.eventbus.eventing.exception;

import com.myorg.eventbus.contracts.core.exception.EventBusNonRetryableException;

// Không có handler cho event type: không retry, đẩy thẳng vào DLQ
public class UnknownEventTypeException extends EventBusNonRetryableException {
    public UnknownEventTypeException(String eventType, String eventId) {
        super("UNKNOWN_EVENT_TYPE", "No handler for eventType=" + eventType + ", eventId=" + eventId);
    }
}
