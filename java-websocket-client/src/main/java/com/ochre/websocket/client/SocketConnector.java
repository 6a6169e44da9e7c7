package com.ochre.websocket.client;

import java.net.URI;

/**
 * Opens WebSocket connections. {@link #connect} returns at once; the outcome
 * arrives through the listener.
 */
public interface SocketConnector {

    SocketConnection connect(URI uri, SocketListener listener);
}
