package com.ochre.websocket.conversation;

/**
 * Starts agent executions. {@link #start} must return promptly; events are
 * reported asynchronously to the listener until exactly one of
 * {@code onDone}/{@code onError}, or until the returned handle is cancelled.
 */
public interface AgentRunner {

    RunHandle start(RunRequest request, AgentEventListener listener);
}
