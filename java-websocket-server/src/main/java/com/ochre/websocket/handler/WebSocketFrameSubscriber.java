package com.ochre.websocket.handler;

import com.ochre.websocket.conversation.FrameSubscriber;
import com.ochre.websocket.conversation.SerialExecutor;
import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.ServerFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One WebSocket connection as a frame subscriber. Frames are encoded on the
 * caller's thread and sent from the connection's own outbound mailbox, so a
 * slow socket never holds up the conversation model.
 *
 * <p>Every delivery checks the connection against two limits: how long the
 * send in flight has been running and how many bytes are waiting behind it.
 * Exceeding either, or any send failure, drops the subscriber and closes the
 * socket.
 */
@Slf4j
public class WebSocketFrameSubscriber implements FrameSubscriber {

    private final WebSocketSession session;
    private final FrameCodec codec;
    private final SerialExecutor outbound;
    private final long sendTimeLimitMs;
    private final long bufferSizeLimitBytes;
    private final AtomicLong pendingBytes = new AtomicLong();
    private volatile long sendStartedAt;
    private volatile boolean failed;
    private volatile Runnable onFailure = () -> { };

    public WebSocketFrameSubscriber(WebSocketSession session, FrameCodec codec, Executor fanoutPool,
                                    long sendTimeLimitMs, long bufferSizeLimitBytes) {
        this.session = session;
        this.codec = codec;
        this.outbound = new SerialExecutor("ws-" + session.getId(), fanoutPool);
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimitBytes = bufferSizeLimitBytes;
    }

    public void onFailure(Runnable callback) {
        this.onFailure = callback;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void deliver(ServerFrame frame) {
        if (!isOpen()) {
            return;
        }
        TextMessage message = new TextMessage(codec.encode(frame));
        long queued = pendingBytes.addAndGet(message.getPayloadLength());
        SessionLimitExceededException exceeded = checkLimits(queued);
        if (exceeded != null) {
            fail(exceeded);
            return;
        }
        outbound.execute(() -> send(message, frame));
    }

    @Override
    public boolean isOpen() {
        return !failed && session.isOpen();
    }

    long getPendingBytes() {
        return pendingBytes.get();
    }

    private SessionLimitExceededException checkLimits(long queued) {
        long started = sendStartedAt;
        if (started != 0 && System.currentTimeMillis() - started > sendTimeLimitMs) {
            return new SessionLimitExceededException(
                    "Send time " + (System.currentTimeMillis() - started) + " ms exceeded the limit of "
                            + sendTimeLimitMs + " ms", CloseStatus.SESSION_NOT_RELIABLE);
        }
        if (queued > bufferSizeLimitBytes) {
            return new SessionLimitExceededException(
                    "Outbound buffer of " + queued + " bytes exceeded the limit of "
                            + bufferSizeLimitBytes + " bytes", CloseStatus.SESSION_NOT_RELIABLE);
        }
        return null;
    }

    private void send(TextMessage message, ServerFrame frame) {
        try {
            if (failed) {
                return;
            }
            sendStartedAt = System.currentTimeMillis();
            session.sendMessage(message);
            log.debug("Frame sent: wsId={}, type={}, seq={}", session.getId(), frame.getType(), frame.getSeq());
        } catch (IOException | RuntimeException e) {
            fail(e);
        } finally {
            sendStartedAt = 0;
            pendingBytes.addAndGet(-message.getPayloadLength());
        }
    }

    private synchronized void fail(Exception cause) {
        if (failed) {
            return;
        }
        failed = true;
        log.warn("Subscriber dropped: wsId={}, reason={}", session.getId(), cause.getMessage());
        onFailure.run();
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Close after send failure failed: wsId={}", session.getId(), e);
        }
    }
}
