package com.myorg.eventbus.contracts.domain;

import com.myorg.eventbus.contracts.core.registry.EventType;

public enum DomainEventType implements EventType {
    CREATED("domain.created", DomainCreatedEventData.class),
    VERIFIED("domain.verified", DomainVerifiedEventData.class),
    DISABLED("domain.disabled", DomainDisabledEventData.class);

    private final String value;
    private final Class<?> payloadType;

    DomainEventType(String value, Class<?> payloadType) {
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
