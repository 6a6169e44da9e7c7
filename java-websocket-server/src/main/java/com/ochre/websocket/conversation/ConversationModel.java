package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.MessageRole;
import com.ochre.websocket.protocol.RunStatus;
import com.ochre.websocket.protocol.ServerFrame;
import com.ochre.websocket.protocol.ServerFrameType;
import com.ochre.websocket.protocol.payload.ChatCancelledPayload;
import com.ochre.websocket.protocol.payload.ChatDeltaPayload;
import com.ochre.websocket.protocol.payload.ChatDonePayload;
import com.ochre.websocket.protocol.payload.ChatErrorPayload;
import com.ochre.websocket.protocol.payload.ChatStartedPayload;
import com.ochre.websocket.protocol.payload.SegmentStartedPayload;
import com.ochre.websocket.protocol.payload.SystemMessagePayload;
import com.ochre.websocket.protocol.payload.ToolEndPayload;
import com.ochre.websocket.protocol.payload.ToolOutputPayload;
import com.ochre.websocket.protocol.payload.ToolStartPayload;
import com.ochre.websocket.protocol.view.AssistantOverlay;
import com.ochre.websocket.protocol.view.ConversationView;
import com.ochre.websocket.protocol.view.MessageView;
import com.ochre.websocket.protocol.view.Overlays;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Per-session state machine. Turns one agent run's asynchronous event stream
 * into durable transcript rows plus a live frame stream, and answers
 * point-in-time snapshots.
 *
 * <p>All state transitions and snapshots run as tasks of the session's
 * {@link SerialExecutor}; fields without {@code volatile} are confined to it.
 * Assistant text is buffered in memory and written once per segment, when a
 * tool starts or the run terminates.
 */
@Slf4j
public class ConversationModel {

    static final String META_SEGMENT = "segment";
    static final String META_TYPE = "type";
    static final String META_TOOL_NAME = "name";
    static final String META_CANCELLED = "cancelled";
    static final String META_ERROR = "error";
    static final String META_REASON = "reason";

    static final String REASON_NEW_MESSAGE = "new_message";

    private final String sessionId;
    private final TranscriptStore store;
    private final AgentRunner agentRunner;
    private final FrameCodec codec;
    private final ConversationSettings settings;
    private final List<RunLifecycleListener> lifecycleListeners;
    private final SerialExecutor mailbox;
    private final Clock clock;

    private final Set<FrameSubscriber> subscribers = new CopyOnWriteArraySet<>();
    private final Map<String, RunStatus> seenRequestIds;

    private ActiveRun activeRun;
    private boolean seeded;
    private long seq;

    private volatile Instant lastActivity;
    private volatile boolean running;

    public ConversationModel(String sessionId,
                             TranscriptStore store,
                             AgentRunner agentRunner,
                             FrameCodec codec,
                             ConversationSettings settings,
                             List<RunLifecycleListener> lifecycleListeners,
                             SerialExecutor mailbox,
                             Clock clock) {
        this.sessionId = sessionId;
        this.store = store;
        this.agentRunner = agentRunner;
        this.codec = codec;
        this.settings = settings;
        this.lifecycleListeners = List.copyOf(lifecycleListeners);
        this.mailbox = mailbox;
        this.clock = clock;
        this.lastActivity = clock.instant();

        int capacity = settings.getSeenRequestIdCapacity();
        this.seenRequestIds = new LinkedHashMap<>(64, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RunStatus> eldest) {
                return size() > capacity;
            }
        };
    }

    public String getSessionId() {
        return sessionId;
    }

    // ===== Commands =====

    /**
     * Submits a user message. Idempotent per {@code requestId}: a request that
     * is running or was already seen never produces a second user row or Run.
     */
    public CompletableFuture<SubmitOutcome> submit(String requestId, String text, String model) {
        return call(requestId, () -> submitInMailbox(requestId, text, model));
    }

    /**
     * Cancels the running Run, if any. Completes with {@code true} when a Run
     * was cancelled.
     */
    public CompletableFuture<Boolean> cancel(String reason) {
        return call(null, () -> {
            if (activeRun == null || !activeRun.isRunning()) {
                log.debug("Cancel ignored, nothing running: sessionId={}", sessionId);
                return false;
            }
            cancelInMailbox(activeRun, reason);
            return true;
        });
    }

    public CompletableFuture<ConversationView> snapshot() {
        return call(null, this::buildSnapshot);
    }

    /**
     * Sends a snapshot to one subscriber only. The frame carries no seq; the
     * view's {@code lastSeq} marks what it already contains.
     */
    public CompletableFuture<Void> sendSnapshot(FrameSubscriber subscriber) {
        return call(null, () -> {
            ConversationView view = buildSnapshot();
            deliver(subscriber, codec.serverFrame(ServerFrameType.SNAPSHOT, null, null, view));
            return null;
        });
    }

    public Subscription subscribe(FrameSubscriber subscriber) {
        subscribers.add(subscriber);
        touch();
        log.debug("Subscriber added: sessionId={}, subscriber={}, total={}",
                sessionId, subscriber.id(), subscribers.size());
        return () -> unsubscribe(subscriber);
    }

    public void unsubscribe(FrameSubscriber subscriber) {
        if (subscribers.remove(subscriber)) {
            touch();
            log.debug("Subscriber removed: sessionId={}, subscriber={}, remaining={}",
                    sessionId, subscriber.id(), subscribers.size());
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public boolean isRunning() {
        return running;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * True when nothing references this session: no subscribers, no running
     * Run and no activity for at least {@code idle}.
     */
    public boolean isIdle(Instant now, Duration idle) {
        return subscribers.isEmpty()
                && !running
                && !lastActivity.plus(idle).isAfter(now);
    }

    void touch() {
        lastActivity = clock.instant();
    }

    // ===== Agent events (any thread) =====

    public void onToken(String requestId, String text) {
        post(requestId, () -> handleToken(requestId, text));
    }

    public void onToolStart(String requestId, String toolCallId, String tool, String argsPreview) {
        post(requestId, () -> handleToolStart(requestId, toolCallId, tool, argsPreview));
    }

    public void onToolEnd(String requestId, String toolCallId, String tool, boolean ok, long durationMs) {
        post(requestId, () -> handleToolEnd(requestId, toolCallId, tool, ok, durationMs));
    }

    public void onToolOutput(String requestId, String toolCallId, String tool, String content) {
        post(requestId, () -> handleToolOutput(requestId, toolCallId, tool, content));
    }

    public void onSystemMessage(String requestId, String content) {
        post(requestId, () -> handleSystemMessage(requestId, content));
    }

    public void onDone(String requestId) {
        post(requestId, () -> {
            ActiveRun run = currentRun(requestId, "done");
            if (run != null) {
                finishDone(run);
            }
        });
    }

    public void onError(String requestId, Throwable error) {
        post(requestId, () -> {
            ActiveRun run = currentRun(requestId, "error");
            if (run != null) {
                finishError(run, describe(error));
            }
        });
    }

    /**
     * The runner stopped on its own account (not through {@link #cancel}).
     */
    public void onCancel(String requestId, String reason) {
        post(requestId, () -> {
            ActiveRun run = currentRun(requestId, "cancel");
            if (run != null) {
                cancelInMailbox(run, reason);
            }
        });
    }

    // ===== Mailbox-confined transitions =====

    private SubmitOutcome submitInMailbox(String requestId, String text, String model) {
        String content = text != null ? text.strip() : "";
        if (content.isEmpty()) {
            log.debug("Ignoring blank submission: sessionId={}, requestId={}", sessionId, requestId);
            return SubmitOutcome.ignoredEmpty(requestId);
        }
        ensureSeeded();

        if (activeRun != null && activeRun.isRunning() && activeRun.getRequestId().equals(requestId)) {
            log.debug("Submission already running: sessionId={}, requestId={}", sessionId, requestId);
            return SubmitOutcome.alreadyRunning(requestId, activeRun.getCompletion());
        }

        RunStatus previous = seenRequestIds.get(requestId);
        if (previous != null) {
            log.info("Replayed submission acknowledged: sessionId={}, requestId={}, status={}",
                    sessionId, requestId, previous);
            emit(ServerFrameType.CHAT_STARTED, requestId, ChatStartedPayload.builder().replay(true).build());
            return SubmitOutcome.duplicate(requestId, previous);
        }

        if (activeRun != null && activeRun.isRunning()) {
            log.info("Superseding run: sessionId={}, oldRequestId={}, newRequestId={}",
                    sessionId, activeRun.getRequestId(), requestId);
            cancelInMailbox(activeRun, REASON_NEW_MESSAGE);
        }

        String chosenModel = (model != null && !model.isBlank()) ? model : settings.getDefaultModel();
        MessageView userMessage = store.append(sessionId, MessageRole.USER, content,
                meta(MessageView.META_REQUEST_ID, requestId));

        ActiveRun run = new ActiveRun(requestId, chosenModel, clock.instant());
        activeRun = run;
        running = true;
        seenRequestIds.put(requestId, RunStatus.RUNNING);

        log.info("Run started: sessionId={}, requestId={}, model={}", sessionId, requestId, chosenModel);
        emit(ServerFrameType.CHAT_STARTED, requestId,
                ChatStartedPayload.builder().messageId(userMessage.getId()).build());
        notifyListeners(l -> l.onRunStarted(sessionId, requestId, chosenModel));

        startRunner(run);
        return SubmitOutcome.started(requestId, run.getCompletion());
    }

    private void startRunner(ActiveRun run) {
        try {
            List<MessageView> history = store.recentMessages(sessionId, settings.getHistoryLimit());
            RunRequest request = RunRequest.builder()
                    .sessionId(sessionId)
                    .requestId(run.getRequestId())
                    .model(run.getModel())
                    .history(history)
                    .build();
            run.setHandle(agentRunner.start(request, new RunEvents(run.getRequestId())));
        } catch (RuntimeException e) {
            log.error("Agent runner failed to start: sessionId={}, requestId={}",
                    sessionId, run.getRequestId(), e);
            finishError(run, describe(e));
        }
    }

    private void handleToken(String requestId, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        ActiveRun run = currentRun(requestId, "token");
        if (run == null) {
            return;
        }
        AssistantSegment segment = run.getOpenSegment();
        if (segment == null) {
            segment = openSegment(run);
        }
        segment.append(text);
        emit(ServerFrameType.CHAT_DELTA, requestId,
                ChatDeltaPayload.builder().text(text).messageId(segment.getMessageId()).build());
    }

    private AssistantSegment openSegment(ActiveRun run) {
        Map<String, Object> meta = meta(MessageView.META_REQUEST_ID, run.getRequestId());
        meta.put(META_SEGMENT, true);
        meta.put(MessageView.META_STREAMING, true);

        String messageId = null;
        try {
            messageId = store.append(sessionId, MessageRole.ASSISTANT, "", meta).getId();
        } catch (RuntimeException e) {
            log.error("Failed to insert assistant segment row: sessionId={}, requestId={}",
                    sessionId, run.getRequestId(), e);
        }
        AssistantSegment segment = new AssistantSegment(messageId);
        run.setOpenSegment(segment);
        emit(ServerFrameType.SEGMENT_STARTED, run.getRequestId(),
                SegmentStartedPayload.builder().messageId(messageId).build());
        return segment;
    }

    private void handleToolStart(String requestId, String toolCallId, String tool, String argsPreview) {
        ActiveRun run = currentRun(requestId, "tool.start");
        if (run == null) {
            return;
        }
        flushSegment(run, Map.of());

        String line = (argsPreview != null && !argsPreview.isBlank())
                ? ("▶ " + tool + " " + argsPreview).stripTrailing()
                : "▶ " + tool;
        String messageId = appendTool(run, toolCallId, tool, "start", line);
        emit(ServerFrameType.TOOL_START, requestId, ToolStartPayload.builder()
                .toolCallId(toolCallId)
                .messageId(messageId)
                .tool(tool)
                .argsPreview(argsPreview)
                .build());
    }

    private void handleToolEnd(String requestId, String toolCallId, String tool, boolean ok, long durationMs) {
        ActiveRun run = currentRun(requestId, "tool.end");
        if (run == null) {
            return;
        }
        String line = "■ " + tool + " " + (ok ? "ok" : "error") + " (" + durationMs + "ms)";
        String messageId = appendTool(run, toolCallId, tool, "end", line);
        emit(ServerFrameType.TOOL_END, requestId, ToolEndPayload.builder()
                .toolCallId(toolCallId)
                .messageId(messageId)
                .tool(tool)
                .ok(ok)
                .durationMs(durationMs)
                .build());
    }

    private void handleToolOutput(String requestId, String toolCallId, String tool, String content) {
        ActiveRun run = currentRun(requestId, "tool.output");
        if (run == null) {
            return;
        }
        String full = content != null ? content : "";
        String messageId = appendTool(run, toolCallId, tool, "output", full);

        int max = settings.getToolOutputPreviewChars();
        boolean truncated = full.length() > max;
        String preview = truncated
                ? full.substring(0, max) + "\n... (truncated, " + (full.length() - max) + " chars omitted)"
                : full;
        emit(ServerFrameType.TOOL_OUTPUT, requestId, ToolOutputPayload.builder()
                .toolCallId(toolCallId)
                .messageId(messageId)
                .tool(tool)
                .content(preview)
                .truncated(truncated)
                .build());
    }

    private void handleSystemMessage(String requestId, String content) {
        if (currentRun(requestId, "system") == null) {
            return;
        }
        Map<String, Object> meta = meta(MessageView.META_REQUEST_ID, requestId);
        meta.put(META_TYPE, "system");
        String messageId = appendQuietly(MessageRole.SYSTEM, content, meta);
        emit(ServerFrameType.SYSTEM_MESSAGE, requestId,
                SystemMessagePayload.builder().content(content).messageId(messageId).build());
    }

    private void finishDone(ActiveRun run) {
        flushSegment(run, Map.of());
        terminate(run, RunStatus.DONE);
        emit(ServerFrameType.CHAT_DONE, run.getRequestId(), ChatDonePayload.builder().ok(true).build());
        completeRun(run);
    }

    private void finishError(ActiveRun run, String message) {
        flushSegment(run, Map.of(META_ERROR, true));
        terminate(run, RunStatus.ERROR);

        String content = "Chat error: " + message;
        Map<String, Object> meta = meta(MessageView.META_REQUEST_ID, run.getRequestId());
        meta.put(META_TYPE, "error");
        String messageId = appendQuietly(MessageRole.SYSTEM, content, meta);

        emit(ServerFrameType.SYSTEM_MESSAGE, run.getRequestId(),
                SystemMessagePayload.builder().content(content).messageId(messageId).build());
        emit(ServerFrameType.CHAT_ERROR, run.getRequestId(),
                ChatErrorPayload.builder().message(message).build());
        completeRun(run);
    }

    private void cancelInMailbox(ActiveRun run, String reason) {
        String why = (reason != null && !reason.isBlank()) ? reason : "user";
        RunHandle handle = run.getHandle();
        if (handle != null) {
            try {
                handle.cancel();
            } catch (RuntimeException e) {
                log.warn("Run handle cancel failed: sessionId={}, requestId={}",
                        sessionId, run.getRequestId(), e);
            }
        }
        flushSegment(run, Map.of(META_CANCELLED, true));
        terminate(run, RunStatus.CANCELLED);

        String content = REASON_NEW_MESSAGE.equals(why)
                ? "Generation cancelled (new user message)."
                : "Generation cancelled.";
        Map<String, Object> meta = meta(MessageView.META_REQUEST_ID, run.getRequestId());
        meta.put(META_TYPE, "cancel");
        meta.put(META_REASON, why);
        String messageId = appendQuietly(MessageRole.SYSTEM, content, meta);

        emit(ServerFrameType.SYSTEM_MESSAGE, run.getRequestId(),
                SystemMessagePayload.builder().content(content).messageId(messageId).build());
        emit(ServerFrameType.CHAT_CANCELLED, run.getRequestId(),
                ChatCancelledPayload.builder().reason(why).build());
        completeRun(run);
    }

    /**
     * Closes the open segment: writes the buffered text over the row once and
     * marks it no longer streaming. A store failure is logged and the segment
     * still closes.
     */
    private void flushSegment(ActiveRun run, Map<String, Object> extraMeta) {
        AssistantSegment segment = run.getOpenSegment();
        if (segment == null) {
            return;
        }
        run.setOpenSegment(null);
        String text = segment.text();
        if (segment.getMessageId() == null) {
            log.warn("Dropping segment without a stored row: sessionId={}, requestId={}, length={}",
                    sessionId, run.getRequestId(), text.length());
            return;
        }

        Map<String, Object> patch = new LinkedHashMap<>(extraMeta);
        patch.put(MessageView.META_STREAMING, false);
        try {
            store.updateContent(segment.getMessageId(), text, patch);
            log.debug("Segment flushed: sessionId={}, requestId={}, messageId={}, length={}",
                    sessionId, run.getRequestId(), segment.getMessageId(), text.length());
            notifyListeners(l -> l.onSegmentFlushed(sessionId, run.getRequestId(), segment.getMessageId(), text.length()));
        } catch (RuntimeException e) {
            log.error("Failed to flush segment: sessionId={}, requestId={}, messageId={}",
                    sessionId, run.getRequestId(), segment.getMessageId(), e);
        }
    }

    private void terminate(ActiveRun run, RunStatus status) {
        run.setStatus(status);
        run.setEndedAt(clock.instant());
        seenRequestIds.put(run.getRequestId(), status);
        if (activeRun == run) {
            activeRun = null;
            running = false;
        }
        Duration duration = Duration.between(run.getStartedAt(), run.getEndedAt());
        log.info("Run finished: sessionId={}, requestId={}, status={}, duration={}ms",
                sessionId, run.getRequestId(), status, duration.toMillis());
        notifyListeners(l -> l.onRunFinished(sessionId, run.getRequestId(), status, duration));
    }

    private void completeRun(ActiveRun run) {
        run.getCompletion().complete(run.getStatus());
    }

    private ConversationView buildSnapshot() {
        List<MessageView> messages = store.recentMessages(sessionId, settings.getSnapshotLimit());
        ConversationView.ConversationViewBuilder view = ConversationView.builder()
                .sessionId(sessionId)
                .messages(messages)
                .lastSeq(seq);
        if (activeRun != null) {
            view.activeRun(activeRun.toView());
            AssistantSegment segment = activeRun.getOpenSegment();
            if (segment != null) {
                view.overlays(Overlays.builder()
                        .assistant(AssistantOverlay.builder()
                                .messageId(segment.getMessageId())
                                .content(segment.text())
                                .build())
                        .build());
            }
        }
        return view.build();
    }

    /**
     * Rebuilds the seen-request memory from persisted rows so replays are
     * recognized after the model was evicted or the process restarted.
     */
    private void ensureSeeded() {
        if (seeded) {
            return;
        }
        seeded = true;
        List<MessageView> rows = store.recentMessages(sessionId, settings.getSnapshotLimit());
        for (MessageView row : rows) {
            String requestId = row.getRequestId();
            if (requestId == null) {
                continue;
            }
            if (row.getRole() == MessageRole.USER) {
                seenRequestIds.putIfAbsent(requestId, RunStatus.DONE);
            } else if (row.getRole() == MessageRole.SYSTEM) {
                String type = row.metaString(META_TYPE);
                if ("error".equals(type)) {
                    seenRequestIds.put(requestId, RunStatus.ERROR);
                } else if ("cancel".equals(type)) {
                    seenRequestIds.put(requestId, RunStatus.CANCELLED);
                }
            }
        }
        log.debug("Seen request ids restored: sessionId={}, count={}", sessionId, seenRequestIds.size());
    }

    private ActiveRun currentRun(String requestId, String event) {
        if (activeRun == null || !activeRun.isRunning() || !activeRun.getRequestId().equals(requestId)) {
            log.debug("Stale {} event ignored: sessionId={}, requestId={}", event, sessionId, requestId);
            return null;
        }
        return activeRun;
    }

    private String appendTool(ActiveRun run, String toolCallId, String tool, String phase, String content) {
        Map<String, Object> meta = meta(MessageView.META_REQUEST_ID, run.getRequestId());
        meta.put(META_TOOL_NAME, tool);
        meta.put(MessageView.META_PHASE, phase);
        if (toolCallId != null) {
            meta.put(MessageView.META_TOOL_CALL_ID, toolCallId);
        }
        return appendQuietly(MessageRole.TOOL, content, meta);
    }

    private String appendQuietly(MessageRole role, String content, Map<String, Object> meta) {
        try {
            return store.append(sessionId, role, content, meta).getId();
        } catch (RuntimeException e) {
            log.error("Failed to append {} row: sessionId={}, requestId={}",
                    role, sessionId, meta.get(MessageView.META_REQUEST_ID), e);
            return null;
        }
    }

    // ===== Fan-out =====

    private void emit(ServerFrameType type, String requestId, Object payload) {
        ServerFrame frame = codec.serverFrame(type, requestId, ++seq, payload);
        for (FrameSubscriber subscriber : subscribers) {
            deliver(subscriber, frame);
        }
    }

    private void deliver(FrameSubscriber subscriber, ServerFrame frame) {
        if (!subscriber.isOpen()) {
            unsubscribe(subscriber);
            return;
        }
        try {
            subscriber.deliver(frame);
        } catch (RuntimeException e) {
            log.warn("Dropping subscriber after delivery failure: sessionId={}, subscriber={}",
                    sessionId, subscriber.id(), e);
            unsubscribe(subscriber);
        }
    }

    private void notifyListeners(Consumer<RunLifecycleListener> action) {
        for (RunLifecycleListener listener : lifecycleListeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener failed: sessionId={}, listener={}",
                        sessionId, listener.getClass().getSimpleName(), e);
            }
        }
    }

    // ===== Mailbox plumbing =====

    private void post(String requestId, Runnable task) {
        mailbox.execute(() -> runWithContext(requestId, () -> {
            task.run();
            return null;
        }));
    }

    private <T> CompletableFuture<T> call(String requestId, Supplier<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        mailbox.execute(() -> {
            try {
                result.complete(runWithContext(requestId, task));
            } catch (RuntimeException e) {
                log.error("Mailbox command failed: sessionId={}, requestId={}", sessionId, requestId, e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    private <T> T runWithContext(String requestId, Supplier<T> task) {
        MDC.put("sessionId", sessionId);
        if (requestId != null) {
            MDC.put("requestId", requestId);
        }
        try {
            touch();
            return task.get();
        } finally {
            MDC.remove("sessionId");
            MDC.remove("requestId");
        }
    }

    private static Map<String, Object> meta(String key, Object value) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(key, value);
        return meta;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return (message != null && !message.isBlank()) ? message : error.getClass().getSimpleName();
    }

    /**
     * Binds one run's runner callbacks to this model.
     */
    private final class RunEvents implements AgentEventListener {

        private final String requestId;

        RunEvents(String requestId) {
            this.requestId = requestId;
        }

        @Override
        public void onToken(String text) {
            ConversationModel.this.onToken(requestId, text);
        }

        @Override
        public void onToolStart(String toolCallId, String tool, String argsPreview) {
            ConversationModel.this.onToolStart(requestId, toolCallId, tool, argsPreview);
        }

        @Override
        public void onToolEnd(String toolCallId, String tool, boolean ok, long durationMs) {
            ConversationModel.this.onToolEnd(requestId, toolCallId, tool, ok, durationMs);
        }

        @Override
        public void onToolOutput(String toolCallId, String tool, String content) {
            ConversationModel.this.onToolOutput(requestId, toolCallId, tool, content);
        }

        @Override
        public void onSystemMessage(String content) {
            ConversationModel.this.onSystemMessage(requestId, content);
        }

        @Override
        public void onDone() {
            ConversationModel.this.onDone(requestId);
        }

        @Override
        public void onError(Throwable error) {
            ConversationModel.this.onError(requestId, error);
        }
    }
}
