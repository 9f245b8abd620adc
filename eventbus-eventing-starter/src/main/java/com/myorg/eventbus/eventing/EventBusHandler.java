package com.myorg.eventbus.eventing;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean method as the handler of one event type. Supported signatures:
 * {@code (Payload)}, {@code (EventEnvelope, Payload)} and {@code (EventEnvelope)}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventBusHandler {

    // event type, ví dụ "tenant.created"
    String value();

    /**
     * Class the envelope {@code data} is converted to. Left as {@code Void.class}, the payload
     * type registered for the event type in
     * {@link com.myorg.eventbus.contracts.core.registry.EventTypeRegistry} is used, else {@code JsonNode}.
     */
    Class<?> payload() default Void.class;
}
