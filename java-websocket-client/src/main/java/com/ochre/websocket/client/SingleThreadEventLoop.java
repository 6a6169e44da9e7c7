package com.ochre.websocket.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Event loop on one daemon thread. Task failures are logged and never kill
 * the loop.
 */
@Slf4j
public class SingleThreadEventLoop implements EventLoop, AutoCloseable {

    private final ScheduledThreadPoolExecutor executor;
    private final Clock clock;

    public SingleThreadEventLoop(String name) {
        this(name, Clock.systemUTC());
    }

    public SingleThreadEventLoop(String name, Clock clock) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(name + "-");
        threadFactory.setDaemon(true);
        this.executor = new ScheduledThreadPoolExecutor(1, threadFactory);
        this.executor.setRemoveOnCancelPolicy(true);
        this.clock = clock;
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Event loop task failed", e);
            }
        };
    }
}
