package com.ochre.websocket.client;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;

/**
 * Single-threaded executor with timers. Everything the client socket owns is
 * touched only from tasks on its loop.
 */
public interface EventLoop extends Executor {

    ScheduledTask schedule(Runnable task, Duration delay);

    Instant now();
}
