package com.myorg.eventbus.contracts.notification;

import com.myorg.eventbus.contracts.core.registry.EventType;

public enum NotificationEventType implements EventType {
    EMAIL_REQUESTED("notification.email_requested", null),
    EMAIL_SENT("notification.email_sent", null),
    EMAIL_FAILED("notification.email_failed", null),
    IN_APP_NOTIFICATION_CREATED("notification.in_app_created", null),
    IN_APP_NOTIFICATION_READ("notification.in_app_read", null);

    private final String value;
    private final Class<?> payloadType;

    NotificationEventType(String value, Class<?> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public Class<?> payloadType() {
        return payloadType;
    }
}
