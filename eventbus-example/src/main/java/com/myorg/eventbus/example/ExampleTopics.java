package com.myorg.eventbus.example;

public final class ExampleTopics {
    public static final String TENANT_EVENTS = "tenant.events";
    public static final String BILLING_EVENTS = "billing.events";
    public static final String NOTIFICATION_EVENTS = "notification.events";

    private ExampleTopics() {
    }
}
