package com.ochre.websocket.client;

import com.ochre.websocket.protocol.ClientFrameType;
import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.MalformedFrameException;
import com.ochre.websocket.protocol.ServerFrame;
import com.ochre.websocket.protocol.ServerFrameType;
import com.ochre.websocket.protocol.payload.ChatCancelPayload;
import com.ochre.websocket.protocol.payload.ChatSendPayload;
import com.ochre.websocket.protocol.payload.HelloPayload;
import com.ochre.websocket.protocol.view.ConversationView;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * One logical connection from the client to a session.
 *
 * <p>Sends made while the socket is not open are queued and flushed, in
 * order, as soon as it opens; every open is followed by a {@code hello} so the
 * server answers with a fresh snapshot. After an involuntary close the socket
 * reconnects with exponential backoff, but only while something is queued.
 *
 * <p>All state lives on the event loop. Public methods post to it and return
 * immediately; callbacks from a superseded connection attempt are recognised
 * by their generation number and ignored.
 */
@Slf4j
public class ResilientSessionSocket {

    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_ABNORMAL = 1006;

    private final String sessionId;
    private final URI uri;
    private final SocketConnector connector;
    private final EventLoop loop;
    private final FrameCodec codec;
    private final BackoffPolicy backoff;
    private final ClientOptions options;
    private final SessionSocketListener listener;

    private final Deque<QueuedSend> queue = new ArrayDeque<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean closedByUser;
    private volatile int attempts;
    private volatile long generation;
    private volatile Instant connectingSince;
    private volatile Integer lastCloseCode;
    private volatile String lastCloseReason;
    private volatile Long lastSeq;
    private volatile int queueSize;

    private SocketConnection connection;
    private ScheduledTask reconnectTimer;
    private ScheduledTask connectTimeoutTimer;

    public ResilientSessionSocket(String sessionId,
                                  ClientOptions options,
                                  SocketConnector connector,
                                  EventLoop loop,
                                  FrameCodec codec,
                                  BackoffPolicy backoff,
                                  SessionSocketListener listener) {
        this.sessionId = sessionId;
        this.uri = socketUri(options.getBaseUrl(), sessionId);
        this.connector = connector;
        this.loop = loop;
        this.codec = codec;
        this.backoff = backoff;
        this.options = options;
        this.listener = listener;
    }

    // ===== Public surface =====

    public void connect(String reason) {
        loop.execute(() -> {
            closedByUser = false;
            connectNow(reason);
        });
    }

    /**
     * Sends now when open, otherwise queues; either way a connect is
     * triggered.
     */
    public void sendChat(String content, String requestId) {
        String payload = codec.encode(codec.clientFrame(ClientFrameType.CHAT_SEND, requestId,
                ChatSendPayload.builder().content(content).build()));
        loop.execute(() -> {
            closedByUser = false;
            if (state == ConnectionState.OPEN && connection != null) {
                log.debug("Sending chat: sessionId={}, requestId={}", sessionId, requestId);
                connection.send(payload);
                return;
            }
            enqueue(new QueuedSend(requestId, payload, loop.now()));
            connectNow("send");
        });
    }

    /**
     * Cancels the running generation. Only meaningful while open: a cancel is
     * never queued.
     */
    public void sendCancel(String reason) {
        String payload = codec.encode(codec.clientFrame(ClientFrameType.CHAT_CANCEL, null,
                ChatCancelPayload.builder().reason(reason).build()));
        loop.execute(() -> {
            if (state != ConnectionState.OPEN || connection == null) {
                log.debug("Cancel not sent, socket not open: sessionId={}, state={}", sessionId, state);
                return;
            }
            connection.send(payload);
        });
    }

    public void onNetworkOnline() {
        loop.execute(() -> wake("network-online"));
    }

    public void onVisibilityVisible() {
        loop.execute(() -> wake("visible"));
    }

    public void close() {
        loop.execute(() -> {
            closedByUser = true;
            cancelReconnectTimer();
            cancelConnectTimeout();
            SocketConnection current = connection;
            connection = null;
            generation++;
            if (current != null) {
                current.close(CLOSE_NORMAL, "client closed");
            }
            lastCloseCode = CLOSE_NORMAL;
            lastCloseReason = "client closed";
            transition(ConnectionState.DISCONNECTED);
            log.info("Socket closed by user: sessionId={}, queued={}", sessionId, queue.size());
        });
    }

    /**
     * Diagnostic view; may lag the loop by one task when read from another
     * thread.
     */
    public SocketDebugSnapshot getDebugSnapshot() {
        return SocketDebugSnapshot.builder()
                .sessionId(sessionId)
                .state(state)
                .closedByUser(closedByUser)
                .queueSize(queueSize)
                .attempts(attempts)
                .generation(generation)
                .reconnectTimerArmed(reconnectTimer != null)
                .connectTimeoutArmed(connectTimeoutTimer != null)
                .connectingSince(state == ConnectionState.CONNECTING ? connectingSince : null)
                .lastCloseCode(lastCloseCode)
                .lastCloseReason(lastCloseReason)
                .lastSeq(lastSeq)
                .build();
    }

    public String getSessionId() {
        return sessionId;
    }

    // ===== Loop-confined =====

    private void wake(String reason) {
        if (closedByUser || queue.isEmpty()) {
            return;
        }
        log.debug("Environment recovered, connecting early: sessionId={}, reason={}", sessionId, reason);
        connectNow(reason);
    }

    private void connectNow(String reason) {
        if (state == ConnectionState.OPEN) {
            return;
        }
        if (state == ConnectionState.CONNECTING) {
            Duration connecting = Duration.between(connectingSince, loop.now());
            if (connecting.compareTo(options.getStuckThreshold()) < 0) {
                return;
            }
            log.warn("Handshake stuck, restarting: sessionId={}, connectingMs={}", sessionId, connecting.toMillis());
            abortConnection();
        }
        cancelReconnectTimer();
        openConnection(reason);
    }

    private void openConnection(String reason) {
        long attempt = ++generation;
        connectingSince = loop.now();
        transition(ConnectionState.CONNECTING);
        log.info("Connecting: sessionId={}, reason={}, attempt={}, generation={}", sessionId, reason, attempts, attempt);

        armConnectTimeout(attempt);
        try {
            connection = connector.connect(uri, new ConnectionListener(attempt));
        } catch (RuntimeException e) {
            log.warn("Connect failed: sessionId={}, error={}", sessionId, e.toString());
            handleClose(attempt, CLOSE_ABNORMAL, e.toString());
        }
    }

    private void handleOpen(long attempt) {
        if (attempt != generation || state != ConnectionState.CONNECTING) {
            return;
        }
        cancelConnectTimeout();
        attempts = 0;
        transition(ConnectionState.OPEN);
        log.info("Connected: sessionId={}, queued={}", sessionId, queue.size());

        dropExpired();
        while (!queue.isEmpty()) {
            QueuedSend send = queue.pollFirst();
            log.debug("Flushing queued send: sessionId={}, requestId={}", sessionId, send.getRequestId());
            connection.send(send.getPayload());
        }
        queueSize = 0;
        connection.send(codec.encode(codec.clientFrame(ClientFrameType.HELLO, null,
                HelloPayload.builder().lastSeq(lastSeq).build())));
    }

    private void handleText(long attempt, String text) {
        if (attempt != generation) {
            return;
        }
        ServerFrame frame;
        try {
            frame = codec.decodeServerFrame(text);
        } catch (MalformedFrameException e) {
            log.warn("Dropping malformed frame: sessionId={}, reason={}", sessionId, e.getMessage());
            return;
        }
        trackSeq(frame);
        listener.onFrame(frame);
    }

    private void trackSeq(ServerFrame frame) {
        Long seq = frame.getSeq();
        if (frame.getType() == ServerFrameType.SNAPSHOT) {
            try {
                seq = codec.payload(frame, ConversationView.class).getLastSeq();
            } catch (MalformedFrameException e) {
                log.warn("Snapshot payload unreadable: sessionId={}, reason={}", sessionId, e.getMessage());
                seq = null;
            }
        }
        if (seq != null && (lastSeq == null || seq > lastSeq)) {
            lastSeq = seq;
        }
    }

    private void handleClose(long attempt, int code, String reason) {
        if (attempt != generation) {
            return;
        }
        generation++;
        connection = null;
        cancelConnectTimeout();
        lastCloseCode = code;
        lastCloseReason = reason;
        transition(ConnectionState.DISCONNECTED);
        log.info("Disconnected: sessionId={}, code={}, reason={}, queued={}", sessionId, code, reason, queue.size());

        if (closedByUser) {
            return;
        }
        dropExpired();
        if (queue.isEmpty()) {
            log.debug("Nothing queued, not reconnecting: sessionId={}", sessionId);
            return;
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (reconnectTimer != null) {
            return;
        }
        int attempt = attempts;
        Duration delay = backoff.delayFor(attempt);
        attempts = attempt + 1;
        log.info("Reconnect scheduled: sessionId={}, attempt={}, delayMs={}", sessionId, attempt, delay.toMillis());
        reconnectTimer = loop.schedule(() -> {
            reconnectTimer = null;
            if (!closedByUser) {
                connectNow("backoff");
            }
        }, delay);
    }

    private void armConnectTimeout(long attempt) {
        cancelConnectTimeout();
        connectTimeoutTimer = loop.schedule(() -> {
            connectTimeoutTimer = null;
            if (attempt != generation || state != ConnectionState.CONNECTING) {
                return;
            }
            log.warn("Connect timed out: sessionId={}, timeoutMs={}", sessionId, options.getConnectTimeout().toMillis());
            SocketConnection current = connection;
            if (current != null) {
                current.abort();
            }
            handleClose(attempt, CLOSE_ABNORMAL, "connect timeout");
        }, options.getConnectTimeout());
    }

    private void abortConnection() {
        SocketConnection current = connection;
        connection = null;
        generation++;
        cancelConnectTimeout();
        if (current != null) {
            current.abort();
        }
    }

    private void enqueue(QueuedSend send) {
        dropExpired();
        while (queue.size() >= options.getQueueCapacity()) {
            QueuedSend dropped = queue.pollFirst();
            log.warn("Send queue full, dropping oldest: sessionId={}, requestId={}", sessionId, dropped.getRequestId());
            listener.onQueuedSendDropped(dropped.getRequestId(), DropReason.OVERFLOW);
        }
        queue.addLast(send);
        queueSize = queue.size();
        log.debug("Send queued: sessionId={}, requestId={}, queued={}", sessionId, send.getRequestId(), queue.size());
    }

    private void dropExpired() {
        Instant cutoff = loop.now().minus(options.getQueueTtl());
        Iterator<QueuedSend> iterator = queue.iterator();
        while (iterator.hasNext()) {
            QueuedSend send = iterator.next();
            if (send.getEnqueuedAt().isBefore(cutoff)) {
                iterator.remove();
                log.warn("Queued send expired: sessionId={}, requestId={}", sessionId, send.getRequestId());
                listener.onQueuedSendDropped(send.getRequestId(), DropReason.EXPIRED);
            }
        }
        queueSize = queue.size();
    }

    private void cancelReconnectTimer() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private void cancelConnectTimeout() {
        if (connectTimeoutTimer != null) {
            connectTimeoutTimer.cancel();
            connectTimeoutTimer = null;
        }
    }

    private void transition(ConnectionState next) {
        if (state != next) {
            state = next;
            listener.onStateChange(next);
        }
    }

    static URI socketUri(String baseUrl, String sessionId) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        if (base.startsWith("https://")) {
            base = "wss://" + base.substring("https://".length());
        } else if (base.startsWith("http://")) {
            base = "ws://" + base.substring("http://".length());
        }
        return URI.create(base + "/ws/sessions/" + sessionId);
    }

    private final class ConnectionListener implements SocketListener {

        private final long attempt;

        ConnectionListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen() {
            loop.execute(() -> handleOpen(attempt));
        }

        @Override
        public void onText(String text) {
            loop.execute(() -> handleText(attempt, text));
        }

        @Override
        public void onClose(int code, String reason) {
            loop.execute(() -> handleClose(attempt, code, reason));
        }

        @Override
        public void onError(Throwable error) {
            loop.execute(() -> handleClose(attempt, CLOSE_ABNORMAL, error.toString()));
        }
    }

    @Value
    private static class QueuedSend {
        String requestId;
        String payload;
        Instant enqueuedAt;
    }
}
