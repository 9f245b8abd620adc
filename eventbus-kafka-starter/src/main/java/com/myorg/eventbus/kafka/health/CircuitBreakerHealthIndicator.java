package com.myorg.eventbus.kafka.health;

import com.myorg.eventbus.kafka.circuit.CircuitBreaker;
import com.myorg.eventbus.kafka.circuit.CircuitState;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

// OPEN -> DOWN, HALF_OPEN -> UNKNOWN
@RequiredArgsConstructor
public class CircuitBreakerHealthIndicator extends AbstractHealthIndicator {

    private final CircuitBreaker circuitBreaker;

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        CircuitState state = circuitBreaker.getState();
        switch (state) {
            case CLOSED -> builder.up();
            case HALF_OPEN -> builder.unknown();
            case OPEN -> builder.down();
        }
        builder.withDetail("state", state.name())
                .withDetail("failureCount", circuitBreaker.getFailureCount())
                .withDetail("failureThreshold", circuitBreaker.getFailureThreshold());
        if (circuitBreaker.getNextAttemptAt() != null) {
            builder.withDetail("nextAttemptAt", circuitBreaker.getNextAttemptAt().toString());
        }
    }
}
