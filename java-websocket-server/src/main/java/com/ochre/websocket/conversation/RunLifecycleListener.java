package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.RunStatus;

import java.time.Duration;

/**
 * Observer of run lifecycle transitions, called from the session mailbox.
 * Implementations must be quick; failures are logged and ignored.
 */
public interface RunLifecycleListener {

    default void onRunStarted(String sessionId, String requestId, String model) {
    }

    default void onSegmentFlushed(String sessionId, String requestId, String messageId, int length) {
    }

    default void onRunFinished(String sessionId, String requestId, RunStatus status, Duration duration) {
    }
}
