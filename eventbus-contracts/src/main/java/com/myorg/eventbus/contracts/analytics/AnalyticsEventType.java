package com.myorg.eventbus.contracts.analytics;

import com.myorg.eventbus.contracts.core.registry.EventType;

public enum AnalyticsEventType implements EventType {
    USER_ACTIVITY_RECORDED("analytics.user_activity_recorded", null),
    REPORT_GENERATED("analytics.report_generated", null),
    METRIC_UPDATED("analytics.metric_updated", null);

    private final String value;
    private final Class<?> payloadType;

    AnalyticsEventType(String value, Class<?> payloadType) {
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
