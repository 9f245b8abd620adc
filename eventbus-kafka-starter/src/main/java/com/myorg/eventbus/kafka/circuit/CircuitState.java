package com.myorg.eventbus.kafka.circuit;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
