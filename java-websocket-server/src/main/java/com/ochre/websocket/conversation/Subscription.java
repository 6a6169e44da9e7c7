package com.ochre.websocket.conversation;

/**
 * Handle returned by {@link ConversationModel#subscribe(FrameSubscriber)}.
 * Cancelling is idempotent.
 */
@FunctionalInterface
public interface Subscription {

    void cancel();
}
