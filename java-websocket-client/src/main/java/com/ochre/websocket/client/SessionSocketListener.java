package com.ochre.websocket.client;

import com.ochre.websocket.protocol.ServerFrame;

/**
 * Callbacks from {@link ResilientSessionSocket}, always on its event loop.
 */
public interface SessionSocketListener {

    void onFrame(ServerFrame frame);

    default void onStateChange(ConnectionState state) {
    }

    default void onQueuedSendDropped(String requestId, DropReason reason) {
    }
}
