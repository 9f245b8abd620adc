package com.myorg.eventbus.contracts.tenant;

import com.myorg.eventbus.contracts.core.registry.EventType;

public enum TenantEventType implements EventType {
    CREATED("tenant.created", TenantCreatedEventData.class),
    UPDATED("tenant.updated", TenantUpdatedEventData.class),
    SUSPENDED("tenant.suspended", TenantSuspendedEventData.class),
    ACTIVATED("tenant.activated", TenantActivatedEventData.class),
    DELETED("tenant.deleted", TenantDeletedEventData.class),
    PACKAGE_CHANGED("tenant.package_changed", TenantPackageChangedEventData.class);

    private final String value;
    private final Class<?> payloadType;

    TenantEventType(String value, Class<?> payloadType) {
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
