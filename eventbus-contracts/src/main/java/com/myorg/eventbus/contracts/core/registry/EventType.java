package com.myorg.eventbus.contracts.core.registry;

/**
 * Implemented by the per-domain event type enums.
 */
public interface EventType {

    /** Dotted wire value, e.g. {@code "tenant.created"}. */
    String value();

    /** Documented payload class, or {@code null} when the payload shape is not pinned down. */
    Class<?> payloadType();
}
