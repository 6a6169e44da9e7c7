package com.ochre.websocket.client;

/**
 * Transport callbacks for one connection attempt. May be invoked from any
 * thread.
 */
public interface SocketListener {

    void onOpen();

    void onText(String text);

    void onClose(int code, String reason);

    void onError(Throwable error);
}
