package com.ochre.websocket.client;

import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.ServerFrame;
import com.ochre.websocket.protocol.api.SessionDetailResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Locale;

/**
 * A session as seen by one client: the resilient socket feeding the frame
 * reducer, seeded from the session API.
 */
@Slf4j
public class ConversationClient implements AutoCloseable {

    private final String sessionId;
    private final EventLoop loop;
    private final SessionApiClient api;
    private final FrameReducer reducer;
    private final ResilientSessionSocket socket;
    private final ConversationListener listener;
    private final int historyLimit;

    private volatile List<ChatBubble> messages = List.of();

    public ConversationClient(String sessionId,
                              ClientOptions options,
                              SessionApiClient api,
                              SocketConnector connector,
                              EventLoop loop,
                              ConversationListener listener) {
        FrameCodec codec = new FrameCodec();
        this.sessionId = sessionId;
        this.loop = loop;
        this.api = api;
        this.listener = listener;
        this.historyLimit = options.getHistoryLimit();
        this.reducer = new FrameReducer(codec);
        this.socket = new ResilientSessionSocket(sessionId, options, connector, loop, codec,
                BackoffPolicy.from(options), new SocketEvents());
    }

    /**
     * Seeds the transcript over HTTP, then attaches the socket. A failed seed
     * is not fatal: the socket's snapshot replaces the list anyway.
     */
    public void open() {
        SessionDetailResponse detail = null;
        try {
            detail = api.getSession(sessionId, historyLimit);
        } catch (RestClientException e) {
            log.warn("Initial history fetch failed: sessionId={}, error={}", sessionId, e.toString());
        }
        SessionDetailResponse seed = detail;
        loop.execute(() -> {
            if (seed != null) {
                reducer.seed(seed.getMessages());
                publish();
            }
            socket.connect("open");
        });
    }

    /**
     * @return the request id minted for this message
     */
    public String send(String content) {
        String text = content != null ? content.strip() : "";
        if (text.isEmpty()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        String requestId = RequestIds.next();
        loop.execute(() -> {
            reducer.addLocalUserMessage(requestId, text);
            publish();
        });
        socket.sendChat(text, requestId);
        return requestId;
    }

    public void cancel() {
        socket.sendCancel("user");
    }

    public void onNetworkOnline() {
        socket.onNetworkOnline();
    }

    public void onVisibilityVisible() {
        socket.onVisibilityVisible();
    }

    public List<ChatBubble> getMessages() {
        return messages;
    }

    public SocketDebugSnapshot getDebugSnapshot() {
        return socket.getDebugSnapshot();
    }

    @Override
    public void close() {
        socket.close();
    }

    private void publish() {
        messages = List.copyOf(reducer.getMessages());
        listener.onMessagesChanged(messages);
    }

    private final class SocketEvents implements SessionSocketListener {

        @Override
        public void onFrame(ServerFrame frame) {
            String errorBefore = reducer.getLastError();
            if (reducer.apply(frame)) {
                publish();
            }
            String error = reducer.getLastError();
            if (error != null && !error.equals(errorBefore)) {
                listener.onError(error);
            }
        }

        @Override
        public void onStateChange(ConnectionState state) {
            listener.onConnectionStateChanged(state);
        }

        @Override
        public void onQueuedSendDropped(String requestId, DropReason reason) {
            listener.onError("Message not delivered (" + reason.name().toLowerCase(Locale.ROOT) + "): " + requestId);
        }
    }
}
