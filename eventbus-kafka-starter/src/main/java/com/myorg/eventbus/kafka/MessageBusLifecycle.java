package com.myorg.eventbus.kafka;

import lombok.RequiredArgsConstructor;
import org.springframework.context.SmartLifecycle;

/**
 * Ties {@link MessageBusClient#start()} / {@link MessageBusClient#stop()} to the application context.
 * Runs in an earlier phase than subscribers so it starts before them and stops after them.
 */
@RequiredArgsConstructor
public class MessageBusLifecycle implements SmartLifecycle {

    public static final int PHASE = Integer.MAX_VALUE - 200;

    private final MessageBusClient client;

    @Override
    public void start() {
        client.start();
    }

    @Override
    public void stop() {
        client.stop();
    }

    @Override
    public boolean isRunning() {
        return client.isRunning();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
