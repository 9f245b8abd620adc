package com.myorg.eventbus.contracts.core.exception;

/**
 * Thrown by a handler when retrying cannot help (bad payload, business rule violation).
 * The consumer dead-letters the message right away instead of backing off.
 */
public class EventBusNonRetryableException extends RuntimeException {

    public static final String DEFAULT_REASON = "NON_RETRYABLE";

    private final String reason;

    public EventBusNonRetryableException(String message) {
        this(DEFAULT_REASON, message);
    }

    public EventBusNonRetryableException(String reason, String message) {
        this(reason, message, null);
    }

    public EventBusNonRetryableException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = (reason == null || reason.isBlank()) ? DEFAULT_REASON : reason;
    }

    public String getReason() {
        return reason;
    }
}
