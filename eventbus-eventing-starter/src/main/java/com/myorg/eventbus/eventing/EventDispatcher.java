package com.myorg.eventbus.eventing;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;

public interface EventDispatcher {
    /** Handler exceptions propagate unchanged so the consumer can classify them. */
    void dispatch(EventEnvelope envelope) throws Exception;
}
