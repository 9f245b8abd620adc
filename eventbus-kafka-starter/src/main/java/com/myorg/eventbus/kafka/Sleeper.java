package com.myorg.eventbus.kafka;

@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return Thread::sleep;
    }
}
