package com.myorg.eventbus.kafka;

public interface Subscription extends AutoCloseable {

    String topic();

    String groupId();

    boolean isActive();

    /** Stops fetching; waits for the record currently being handled. Idempotent. */
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
