package com.myorg.eventbus.kafka.dlq;

// Lý do message bị đẩy vào DLQ, ghi vào header dlq-reason
public enum DlqReason {
    RETRY_EXHAUSTED("RETRY_EXHAUSTED"),
    DESERIALIZATION("DESERIALIZATION"),
    NON_RETRYABLE("NON_RETRYABLE"),
    INTERRUPTED("INTERRUPTED"),
    UNKNOWN("UNKNOWN");

    private final String code;

    DlqReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
