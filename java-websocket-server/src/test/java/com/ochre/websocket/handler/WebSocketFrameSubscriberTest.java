package com.ochre.websocket.handler;

import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.ServerFrame;
import com.ochre.websocket.protocol.ServerFrameType;
import com.ochre.websocket.protocol.payload.ChatDeltaPayload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebSocketFrameSubscriberTest {

    private final FrameCodec codec = new FrameCodec();

    private ExecutorService fanout;
    private CountDownLatch sendEntered;
    private CountDownLatch release;
    private WebSocketSession session;

    @BeforeEach
    void setUp() throws Exception {
        fanout = Executors.newSingleThreadExecutor();
        sendEntered = new CountDownLatch(1);
        release = new CountDownLatch(1);
        session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        doAnswer(invocation -> {
            sendEntered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(session).sendMessage(any());
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        fanout.shutdownNow();
    }

    private ServerFrame delta(long seq) {
        return codec.serverFrame(ServerFrameType.CHAT_DELTA, "r1", seq,
                ChatDeltaPayload.builder().text("x".repeat(100)).messageId("m1").build());
    }

    @Test
    void stuckSocketIsDroppedOnceTheBufferLimitIsExceeded() throws Exception {
        WebSocketFrameSubscriber subscriber = new WebSocketFrameSubscriber(session, codec, fanout, 60_000, 1024);
        AtomicBoolean dropped = new AtomicBoolean();
        subscriber.onFailure(() -> dropped.set(true));

        for (int i = 1; i <= 2000 && subscriber.isOpen(); i++) {
            subscriber.deliver(delta(i));
        }

        assertTrue(dropped.get());
        assertFalse(subscriber.isOpen());
        verify(session).close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    @Test
    void stuckSocketIsDroppedOnceTheSendTimeLimitIsExceeded() throws Exception {
        WebSocketFrameSubscriber subscriber = new WebSocketFrameSubscriber(session, codec, fanout, 100, 1024 * 1024);
        AtomicBoolean dropped = new AtomicBoolean();
        subscriber.onFailure(() -> dropped.set(true));

        subscriber.deliver(delta(1));
        assertTrue(sendEntered.await(5, TimeUnit.SECONDS));
        Thread.sleep(150);
        subscriber.deliver(delta(2));

        assertTrue(dropped.get());
        verify(session).close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    @Test
    void healthySocketDrainsItsBuffer() throws Exception {
        release.countDown();
        WebSocketFrameSubscriber subscriber = new WebSocketFrameSubscriber(session, codec, fanout, 1_000, 1024 * 1024);

        for (int i = 1; i <= 50; i++) {
            subscriber.deliver(delta(i));
        }
        fanout.shutdown();
        assertTrue(fanout.awaitTermination(5, TimeUnit.SECONDS));

        assertTrue(subscriber.isOpen());
        assertEquals(0, subscriber.getPendingBytes());
        verify(session, times(50)).sendMessage(any());
        verify(session, never()).close(any(CloseStatus.class));
    }

    @Test
    void sendFailureDropsTheSubscriber() throws Exception {
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());
        WebSocketFrameSubscriber subscriber = new WebSocketFrameSubscriber(session, codec, Runnable::run, 1_000, 1024);
        AtomicBoolean dropped = new AtomicBoolean();
        subscriber.onFailure(() -> dropped.set(true));

        subscriber.deliver(delta(1));

        assertTrue(dropped.get());
        assertEquals(0, subscriber.getPendingBytes());
        subscriber.deliver(delta(2));
        verify(session, times(1)).sendMessage(any());
    }
}
