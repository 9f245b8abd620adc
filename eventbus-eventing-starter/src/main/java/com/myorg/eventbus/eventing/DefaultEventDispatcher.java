package com.myorg.eventbus.eventing;

import com.myorg.eventbus.contracts.core.envelope.EventEnvelope;
import com.myorg.eventbus.eventing.exception.UnknownEventTypeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes an envelope to the handler registered for its {@code type}.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultEventDispatcher implements EventDispatcher {

    private final HandlerRegistry registry;
    private final boolean ignoreUnknown;

    @Override
    public void dispatch(EventEnvelope env) throws Exception {
        String type = env.getType();
        HandlerMethodInvoker invoker = registry.get(type);

        if (invoker == null) {
            if (ignoreUnknown) {
                log.warn("No handler for eventType={}, eventId={}", type, env.getId());
                return;
            }
            throw new UnknownEventTypeException(type, env.getId());
        }

        invoker.invoke(env);
    }
}
