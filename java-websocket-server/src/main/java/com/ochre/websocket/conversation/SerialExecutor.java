package com.ochre.websocket.conversation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * FIFO mailbox over a shared executor: tasks run one at a time, in
 * submission order, never concurrently with each other. A task submitted
 * from inside a running task is queued behind it, not run re-entrantly.
 */
@Slf4j
public final class SerialExecutor implements Executor {

    private final String name;
    private final Executor delegate;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private boolean draining;

    public SerialExecutor(String name, Executor delegate) {
        this.name = name;
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable task) {
        boolean schedule;
        synchronized (tasks) {
            tasks.add(task);
            schedule = !draining;
            if (schedule) {
                draining = true;
            }
        }
        if (schedule) {
            try {
                delegate.execute(this::drain);
            } catch (RuntimeException e) {
                synchronized (tasks) {
                    draining = false;
                }
                throw e;
            }
        }
    }

    public int pending() {
        synchronized (tasks) {
            return tasks.size();
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (tasks) {
                next = tasks.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                log.error("Mailbox task failed: mailbox={}", name, e);
            }
        }
    }
}
