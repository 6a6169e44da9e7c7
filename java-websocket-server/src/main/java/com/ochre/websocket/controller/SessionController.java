package com.ochre.websocket.controller;

import com.ochre.websocket.conversation.ConversationHub;
import com.ochre.websocket.conversation.ConversationModel;
import com.ochre.websocket.conversation.SubmitOutcome;
import com.ochre.websocket.protocol.RunStatus;
import com.ochre.websocket.protocol.api.CancelRequest;
import com.ochre.websocket.protocol.api.ChatSubmitRequest;
import com.ochre.websocket.protocol.api.ChatSubmitResponse;
import com.ochre.websocket.protocol.api.CreateSessionRequest;
import com.ochre.websocket.protocol.api.CreateSessionResponse;
import com.ochre.websocket.protocol.api.SessionDetailResponse;
import com.ochre.websocket.protocol.api.SessionListResponse;
import com.ochre.websocket.protocol.view.ConversationView;
import com.ochre.websocket.protocol.view.MessageView;
import com.ochre.websocket.service.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Session Controller - session CRUD, snapshots and the non-streaming chat
 * fallback. Chat goes through the same conversation model as the WebSocket
 * path, so both stay consistent.
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
@CrossOrigin(origins = "*")
public class SessionController {

    private static final long MAILBOX_TIMEOUT_SECONDS = 10;

    private final SessionService sessionService;
    private final ConversationHub hub;
    private final long fallbackTimeoutSeconds;

    public SessionController(SessionService sessionService,
                             ConversationHub hub,
                             @Value("${conversation.fallback-timeout-seconds:120}") long fallbackTimeoutSeconds) {
        this.sessionService = sessionService;
        this.hub = hub;
        this.fallbackTimeoutSeconds = fallbackTimeoutSeconds;
    }

    /**
     * Create session
     * POST /api/sessions
     */
    @PostMapping
    public ResponseEntity<CreateSessionResponse> createSession(@RequestBody(required = false) CreateSessionRequest request) {
        String title = request != null ? request.getTitle() : null;
        CreateSessionResponse response = CreateSessionResponse.builder()
                .session(sessionService.createSession(title))
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * List sessions, most recently active first
     * GET /api/sessions?limit=50
     */
    @GetMapping
    public SessionListResponse listSessions(@RequestParam(defaultValue = "50") int limit) {
        return SessionListResponse.builder()
                .sessions(sessionService.listSessions(limit))
                .build();
    }

    /**
     * Session with its latest transcript rows
     * GET /api/sessions/{id}?limit=200
     */
    @GetMapping("/{sessionId}")
    public SessionDetailResponse getSession(@PathVariable String sessionId,
                                            @RequestParam(defaultValue = "200") int limit) {
        return SessionDetailResponse.builder()
                .session(sessionService.getSession(sessionId))
                .messages(sessionService.getMessages(sessionId, limit))
                .build();
    }

    /**
     * Render-ready snapshot, same content as the WebSocket snapshot frame
     * GET /api/sessions/{id}/snapshot
     */
    @GetMapping("/{sessionId}/snapshot")
    public ResponseEntity<?> snapshot(@PathVariable String sessionId) {
        sessionService.requireSession(sessionId);
        ConversationModel model = hub.getOrCreate(sessionId);
        try {
            ConversationView view = await(model.snapshot(), MAILBOX_TIMEOUT_SECONDS);
            return ResponseEntity.ok(view);
        } catch (TimeoutException e) {
            log.warn("Snapshot timed out: sessionId={}", sessionId);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Snapshot timed out", sessionId);
        }
    }

    /**
     * Non-streaming chat: submits, waits for the run to finish (bounded) and
     * returns the rows the run produced.
     * POST /api/sessions/{id}/chat
     */
    @PostMapping("/{sessionId}/chat")
    public ResponseEntity<?> chat(@PathVariable String sessionId, @RequestBody ChatSubmitRequest request) {
        sessionService.requireSession(sessionId);
        if (request == null || request.getContent() == null || request.getContent().isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        String requestId = request.getRequestId() != null && !request.getRequestId().isBlank()
                ? request.getRequestId()
                : UUID.randomUUID().toString();

        ConversationModel model = hub.getOrCreate(sessionId);
        log.info("Fallback chat: sessionId={}, requestId={}", sessionId, requestId);
        try {
            SubmitOutcome outcome = await(model.submit(requestId, request.getContent(), request.getModel()),
                    MAILBOX_TIMEOUT_SECONDS);
            RunStatus status;
            HttpStatus httpStatus = HttpStatus.OK;
            try {
                status = await(outcome.getCompletion(), fallbackTimeoutSeconds);
            } catch (TimeoutException e) {
                log.warn("Fallback chat still running after {}s: sessionId={}, requestId={}",
                        fallbackTimeoutSeconds, sessionId, requestId);
                status = RunStatus.RUNNING;
                httpStatus = HttpStatus.ACCEPTED;
            }
            ChatSubmitResponse response = ChatSubmitResponse.builder()
                    .sessionId(sessionId)
                    .requestId(requestId)
                    .status(status)
                    .messages(messagesFor(sessionId, requestId))
                    .build();
            return ResponseEntity.status(httpStatus).body(response);
        } catch (TimeoutException e) {
            log.warn("Submit timed out: sessionId={}, requestId={}", sessionId, requestId);
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Submit timed out", sessionId);
        }
    }

    /**
     * Cancel the running generation
     * POST /api/sessions/{id}/cancel
     */
    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String sessionId,
                                    @RequestBody(required = false) CancelRequest request) {
        sessionService.requireSession(sessionId);
        String reason = request != null && request.getReason() != null && !request.getReason().isBlank()
                ? request.getReason()
                : "user";
        try {
            boolean cancelled = await(hub.getOrCreate(sessionId).cancel(reason), MAILBOX_TIMEOUT_SECONDS);
            return ResponseEntity.ok(Map.of(
                    "sessionId", sessionId,
                    "cancelled", cancelled
            ));
        } catch (TimeoutException e) {
            return error(HttpStatus.SERVICE_UNAVAILABLE, "Cancel timed out", sessionId);
        }
    }

    private List<MessageView> messagesFor(String sessionId, String requestId) {
        return sessionService.getMessages(sessionId, 1000).stream()
                .filter(message -> requestId.equals(message.getRequestId()))
                .toList();
    }

    private static <T> T await(CompletableFuture<T> future, long seconds) throws TimeoutException {
        try {
            return future.get(seconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for conversation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        }
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String sessionId) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "detail", "sessionId=" + sessionId
        ));
    }
}
