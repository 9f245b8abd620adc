package com.myorg.eventbus.eventing;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

// event type -> handler, mỗi type đúng một handler
public class HandlerRegistry {
    private final Map<String, HandlerMethodInvoker> handlers = new ConcurrentHashMap<>();

    public void register(String eventType, HandlerMethodInvoker invoker) {
        HandlerMethodInvoker existing = handlers.putIfAbsent(eventType, invoker);
        if (existing != null && !existing.getMethod().equals(invoker.getMethod())) {
            throw new IllegalStateException("Duplicate handler for eventType=" + eventType
                    + ": " + existing.getMethod() + " and " + invoker.getMethod());
        }
    }

    public HandlerMethodInvoker get(String eventType) {
        return eventType == null ? null : handlers.get(eventType);
    }

    public Set<String> eventTypes() {
        return Set.copyOf(handlers.keySet());
    }
}
