package com.ochre.websocket.client;

@FunctionalInterface
public interface ScheduledTask {

    void cancel();
}
