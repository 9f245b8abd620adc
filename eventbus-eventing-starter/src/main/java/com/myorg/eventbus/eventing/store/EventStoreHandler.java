package com.myorg.eventbus.eventing.store;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;

@FunctionalInterface
public interface EventStoreHandler {
    void handle(EventEnvelope event) throws Exception;
}
