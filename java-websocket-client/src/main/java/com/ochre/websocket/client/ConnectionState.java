package com.ochre.websocket.client;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    OPEN
}
