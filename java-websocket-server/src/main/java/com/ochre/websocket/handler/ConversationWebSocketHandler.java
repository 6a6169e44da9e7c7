package com.ochre.websocket.handler;

import com.ochre.websocket.conversation.ConversationHub;
import com.ochre.websocket.conversation.ConversationModel;
import com.ochre.websocket.conversation.Subscription;
import com.ochre.websocket.protocol.ClientFrame;
import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.MalformedFrameException;
import com.ochre.websocket.protocol.ServerFrameType;
import com.ochre.websocket.protocol.payload.ChatCancelPayload;
import com.ochre.websocket.protocol.payload.ChatErrorPayload;
import com.ochre.websocket.protocol.payload.ChatSendPayload;
import com.ochre.websocket.protocol.payload.HelloPayload;
import com.ochre.websocket.service.MetricsService;
import com.ochre.websocket.service.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.Executor;

/**
 * Binds WebSocket connections on {@code /ws/sessions/{sessionId}} to the
 * session's conversation model. A connection is a subscriber only:
 * closing it never cancels or pauses a run.
 */
@Slf4j
@Component
public class ConversationWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_SESSION_ID = "conversation.sessionId";
    static final String ATTR_SUBSCRIBER = "conversation.subscriber";
    static final String ATTR_SUBSCRIPTION = "conversation.subscription";

    private static final String PATH_PREFIX = "/ws/sessions/";

    private final ConversationHub hub;
    private final FrameCodec codec;
    private final SessionService sessionService;
    private final MetricsService metricsService;
    private final Executor fanoutExecutor;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimitBytes;

    public ConversationWebSocketHandler(ConversationHub hub,
                                        FrameCodec codec,
                                        SessionService sessionService,
                                        MetricsService metricsService,
                                        @Qualifier("fanoutExecutor") Executor fanoutExecutor,
                                        @Value("${websocket.send-time-limit-ms:10000}") int sendTimeLimitMs,
                                        @Value("${websocket.buffer-size-limit-bytes:1048576}") int bufferSizeLimitBytes) {
        this.hub = hub;
        this.codec = codec;
        this.sessionService = sessionService;
        this.metricsService = metricsService;
        this.fanoutExecutor = fanoutExecutor;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimitBytes = bufferSizeLimitBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String sessionId = extractSessionId(wsSession.getUri());
        if (sessionId == null || !sessionService.exists(sessionId)) {
            log.warn("Rejecting connection for unknown session: wsId={}, sessionId={}", wsSession.getId(), sessionId);
            metricsService.recordWebSocketConnection(sessionId, false);
            wsSession.close(CloseStatus.POLICY_VIOLATION.withReason("Unknown session"));
            return;
        }

        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
                wsSession, sendTimeLimitMs, bufferSizeLimitBytes);
        WebSocketFrameSubscriber subscriber = new WebSocketFrameSubscriber(
                decorated, codec, fanoutExecutor, sendTimeLimitMs, bufferSizeLimitBytes);

        ConversationModel model = hub.getOrCreate(sessionId);
        Subscription subscription = model.subscribe(subscriber);
        subscriber.onFailure(() -> {
            subscription.cancel();
            metricsService.recordSubscriberDropped();
        });

        wsSession.getAttributes().put(ATTR_SESSION_ID, sessionId);
        wsSession.getAttributes().put(ATTR_SUBSCRIBER, subscriber);
        wsSession.getAttributes().put(ATTR_SUBSCRIPTION, subscription);

        metricsService.recordWebSocketConnection(sessionId, true);
        log.info("WebSocket connected: wsId={}, sessionId={}, subscribers={}",
                wsSession.getId(), sessionId, model.subscriberCount());
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        String sessionId = (String) wsSession.getAttributes().get(ATTR_SESSION_ID);
        WebSocketFrameSubscriber subscriber = (WebSocketFrameSubscriber) wsSession.getAttributes().get(ATTR_SUBSCRIBER);
        if (sessionId == null || subscriber == null) {
            log.warn("Frame on unbound connection dropped: wsId={}", wsSession.getId());
            return;
        }

        MDC.put("sessionId", sessionId);
        try {
            ClientFrame frame = codec.decodeClientFrame(message.getPayload());
            if (frame.getRequestId() != null) {
                MDC.put("requestId", frame.getRequestId());
            }
            metricsService.recordFrameReceived(frame.getType().wireName());
            log.debug("Frame received: wsId={}, type={}", wsSession.getId(), frame.getType());

            ConversationModel model = hub.getOrCreate(sessionId);
            switch (frame.getType()) {
                case HELLO -> handleHello(model, subscriber, frame);
                case CHAT_SEND -> handleChatSend(model, subscriber, frame);
                case CHAT_CANCEL -> handleCancel(model, frame);
                default -> log.warn("Ignoring unknown frame type: wsId={}, sessionId={}", wsSession.getId(), sessionId);
            }
        } catch (MalformedFrameException e) {
            log.warn("Dropping malformed frame: wsId={}, sessionId={}, reason={}",
                    wsSession.getId(), sessionId, e.getMessage());
            metricsService.recordMalformedFrame();
        } finally {
            MDC.remove("sessionId");
            MDC.remove("requestId");
        }
    }

    private void handleHello(ConversationModel model, WebSocketFrameSubscriber subscriber, ClientFrame frame) {
        HelloPayload hello = codec.payload(frame, HelloPayload.class);
        // The snapshot is always complete, so the replay cursor is informational only.
        log.debug("Hello: sessionId={}, lastSeq={}", model.getSessionId(), hello.getLastSeq());
        model.sendSnapshot(subscriber).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("Failed to send snapshot: sessionId={}, subscriber={}",
                        model.getSessionId(), subscriber.id(), error);
            }
        });
    }

    private void handleChatSend(ConversationModel model, WebSocketFrameSubscriber subscriber, ClientFrame frame) {
        String requestId = frame.getRequestId();
        if (requestId == null || requestId.isBlank()) {
            log.warn("chat.send without requestId: sessionId={}", model.getSessionId());
            subscriber.deliver(codec.serverFrame(ServerFrameType.CHAT_ERROR, null, null,
                    ChatErrorPayload.builder().message("Missing requestId").build()));
            return;
        }
        ChatSendPayload send = codec.payload(frame, ChatSendPayload.class);
        model.submit(requestId, send.getContent(), send.getModel()).whenComplete((outcome, error) -> {
            if (error != null) {
                log.error("Submit failed: sessionId={}, requestId={}", model.getSessionId(), requestId, error);
            } else {
                log.debug("Submit outcome: sessionId={}, requestId={}, kind={}",
                        model.getSessionId(), requestId, outcome.getKind());
            }
        });
    }

    private void handleCancel(ConversationModel model, ClientFrame frame) {
        ChatCancelPayload cancel = codec.payload(frame, ChatCancelPayload.class);
        String reason = cancel.getReason() != null && !cancel.getReason().isBlank() ? cancel.getReason() : "user";
        model.cancel(reason);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        String sessionId = (String) wsSession.getAttributes().get(ATTR_SESSION_ID);
        Subscription subscription = (Subscription) wsSession.getAttributes().remove(ATTR_SUBSCRIPTION);
        if (subscription == null) {
            return;
        }
        subscription.cancel();
        metricsService.recordWebSocketDisconnection(sessionId);
        log.info("WebSocket closed: wsId={}, sessionId={}, status={}", wsSession.getId(), sessionId, status);
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) throws IOException {
        String sessionId = (String) wsSession.getAttributes().get(ATTR_SESSION_ID);
        log.warn("WebSocket transport error: wsId={}, sessionId={}, error={}",
                wsSession.getId(), sessionId, exception.toString());
        metricsService.recordError("TRANSPORT_ERROR", "ConversationWebSocketHandler");
        if (wsSession.isOpen()) {
            wsSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    static String extractSessionId(URI uri) {
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        int index = path.indexOf(PATH_PREFIX);
        if (index < 0) {
            return null;
        }
        String sessionId = path.substring(index + PATH_PREFIX.length());
        if (sessionId.endsWith("/")) {
            sessionId = sessionId.substring(0, sessionId.length() - 1);
        }
        return sessionId.isEmpty() || sessionId.contains("/") ? null : sessionId;
    }
}
