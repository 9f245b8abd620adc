package com.myorg.eventbus.kafka.exception;

import java.time.Instant;

/**
 * The breaker rejected the call without touching the broker. Callers should back off and retry later.
 */
public class CircuitOpenException extends EventBusException {

    private final transient Instant nextAttemptAt;

    public CircuitOpenException(Instant nextAttemptAt) {
        super("Circuit breaker is open" + (nextAttemptAt != null ? " until " + nextAttemptAt : ""));
        this.nextAttemptAt = nextAttemptAt;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }
}
