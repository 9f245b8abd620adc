package com.myorg.eventbus.contracts.file;

import com.myorg.eventbus.contracts.core.registry.EventType;

public enum FileEventType implements EventType {
    UPLOADED("file.uploaded", null),
    DOWNLOADED("file.downloaded", null),
    DELETED("file.deleted", null),
    SCANNED("file.scanned", null),
    SHARED("file.shared", null);

    private final String value;
    private final Class<?> payloadType;

    FileEventType(String value, Class<?> payloadType) {
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
