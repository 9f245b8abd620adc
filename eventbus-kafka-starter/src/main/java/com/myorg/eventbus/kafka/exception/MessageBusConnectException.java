package com.myorg.eventbus.kafka.exception;

public class MessageBusConnectException extends EventBusException {
    public MessageBusConnectException(String message, Throwable cause) { super(message, cause); }
}
