package com.myorg.eventbus.contracts.user;

import com.myorg.eventbus.contracts.core.registry.EventType;

public enum UserEventType implements EventType {
    CREATED("user.created", UserCreatedEventData.class),
    UPDATED("user.updated", null),
    DELETED("user.deleted", null),
    PASSWORD_CHANGED("user.password_changed", null),
    ROLE_ASSIGNED("user.role_assigned", null),
    MFA_ENABLED("user.mfa_enabled", null),
    MFA_DISABLED("user.mfa_disabled", null),
    LOGIN_SUCCEEDED("user.login_succeeded", null),
    LOGIN_FAILED("user.login_failed", null),
    LOCKED("user.locked", null),
    UNLOCKED("user.unlocked", null);

    private final String value;
    private final Class<?> payloadType;

    UserEventType(String value, Class<?> payloadType) {
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
