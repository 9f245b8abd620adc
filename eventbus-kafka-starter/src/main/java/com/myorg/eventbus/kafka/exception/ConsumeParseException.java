package com.myorg.eventbus.kafka.exception;

// never retried, the message goes straight to the DLQ
public class ConsumeParseException extends EventBusException {
    public ConsumeParseException(String message) { super(message); }
    public ConsumeParseException(String message, Throwable cause) { super(message, cause); }
}
