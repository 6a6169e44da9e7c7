package com.ochre.websocket.client;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Connector over the JDK HTTP client's WebSocket. Sends are chained so only
 * one is outstanding at a time, as the JDK client requires.
 */
@Slf4j
public class JdkWebSocketConnector implements SocketConnector {

    private final HttpClient httpClient;
    private final Duration handshakeTimeout;

    public JdkWebSocketConnector(Duration handshakeTimeout) {
        this(HttpClient.newHttpClient(), handshakeTimeout);
    }

    public JdkWebSocketConnector(HttpClient httpClient, Duration handshakeTimeout) {
        this.httpClient = httpClient;
        this.handshakeTimeout = handshakeTimeout;
    }

    @Override
    public SocketConnection connect(URI uri, SocketListener listener) {
        CompletableFuture<WebSocket> handshake = httpClient.newWebSocketBuilder()
                .connectTimeout(handshakeTimeout)
                .buildAsync(uri, new ListenerAdapter(listener));
        handshake.whenComplete((webSocket, error) -> {
            if (error != null) {
                log.debug("WebSocket handshake failed: uri={}, error={}", uri, error.toString());
                listener.onError(error);
            }
        });
        return new JdkConnection(handshake);
    }

    private static final class JdkConnection implements SocketConnection {

        private final CompletableFuture<WebSocket> handshake;
        private CompletableFuture<WebSocket> sendChain;

        JdkConnection(CompletableFuture<WebSocket> handshake) {
            this.handshake = handshake;
            this.sendChain = handshake;
        }

        @Override
        public synchronized void send(String text) {
            sendChain = sendChain.thenCompose(webSocket -> webSocket.sendText(text, true));
        }

        @Override
        public synchronized void close(int code, String reason) {
            if (!handshake.isDone()) {
                handshake.cancel(true);
                return;
            }
            sendChain = sendChain.thenCompose(webSocket -> webSocket.sendClose(code, reason));
        }

        @Override
        public void abort() {
            if (!handshake.cancel(true)) {
                WebSocket webSocket = handshake.getNow(null);
                if (webSocket != null) {
                    webSocket.abort();
                }
            }
        }
    }

    private static final class ListenerAdapter implements WebSocket.Listener {

        private final SocketListener listener;
        private final StringBuilder partial = new StringBuilder();

        ListenerAdapter(SocketListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            listener.onOpen();
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                listener.onText(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }
}
