package com.myorg.eventbus.kafka.exception;

public class MessageBusAdminException extends EventBusException {
    public MessageBusAdminException(String message, Throwable cause) { super(message, cause); }
}
