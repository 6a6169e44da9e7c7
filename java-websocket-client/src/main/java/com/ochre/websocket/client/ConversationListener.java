package com.ochre.websocket.client;

import java.util.List;

/**
 * UI-facing callbacks of {@link ConversationClient}, invoked on the event
 * loop.
 */
public interface ConversationListener {

    void onMessagesChanged(List<ChatBubble> messages);

    default void onConnectionStateChanged(ConnectionState state) {
    }

    default void onError(String message) {
    }
}
