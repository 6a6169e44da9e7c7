package com.ochre.websocket.client;

/**
 * One WebSocket connection attempt, usable while still connecting.
 */
public interface SocketConnection {

    void send(String text);

    /**
     * Orderly close handshake.
     */
    void close(int code, String reason);

    /**
     * Drops the connection without a handshake, also while connecting.
     */
    void abort();
}
