package com.myorg.eventbus.kafka.exception;

/**
 * Only ever logged. Dead-lettering is best effort so a broken DLQ never blocks the partition.
 */
public class DlqPublishException extends EventBusException {
    public DlqPublishException(String dlqTopic, Throwable cause) {
        super("Failed to send message to DLQ " + dlqTopic + ": " + cause, cause);
    }
}
