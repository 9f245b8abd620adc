package com.myorg.eventbus.kafka.dlq;

public final class DlqHeaders {
    private DlqHeaders() {}

    public static final String ERROR_MESSAGE = "error-message";
    public static final String ERROR_TIME = "error-time";
    public static final String ORIGINAL_TOPIC = "original-topic";
    public static final String PROCESSING_SERVICE = "processing-service";

    // one of DlqReason codes
    public static final String REASON = "dlq-reason";
}
