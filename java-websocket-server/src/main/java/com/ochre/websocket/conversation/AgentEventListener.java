package com.ochre.websocket.conversation;

/**
 * Callback interface for one agent run's events. Calls may arrive from any
 * thread; the receiving model serializes them.
 */
public interface AgentEventListener {

    void onToken(String text);

    void onToolStart(String toolCallId, String tool, String argsPreview);

    void onToolEnd(String toolCallId, String tool, boolean ok, long durationMs);

    void onToolOutput(String toolCallId, String tool, String content);

    void onSystemMessage(String content);

    void onDone();

    void onError(Throwable error);
}
