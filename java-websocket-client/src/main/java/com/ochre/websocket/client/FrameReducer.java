package com.ochre.websocket.client;

import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.MalformedFrameException;
import com.ochre.websocket.protocol.MessageRole;
import com.ochre.websocket.protocol.RunStatus;
import com.ochre.websocket.protocol.ServerFrame;
import com.ochre.websocket.protocol.ServerFrameType;
import com.ochre.websocket.protocol.payload.ChatDeltaPayload;
import com.ochre.websocket.protocol.payload.ChatErrorPayload;
import com.ochre.websocket.protocol.payload.ChatStartedPayload;
import com.ochre.websocket.protocol.payload.SystemMessagePayload;
import com.ochre.websocket.protocol.payload.ToolEndPayload;
import com.ochre.websocket.protocol.payload.ToolOutputPayload;
import com.ochre.websocket.protocol.payload.ToolStartPayload;
import com.ochre.websocket.protocol.view.AssistantOverlay;
import com.ochre.websocket.protocol.view.ConversationView;
import com.ochre.websocket.protocol.view.MessageView;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Folds server frames into the rendered message list.
 *
 * <p>Not thread-safe: drive it from one thread (the socket's event loop).
 */
@Slf4j
public class FrameReducer {

    static final String CANCELLED_TEXT = "Generation cancelled.";
    static final String TRUNCATED_NOTE = "\n\n(truncated in live stream; reload to see full output)";

    private static final String PHASE_START = "start";
    private static final String PHASE_END = "end";
    private static final String PHASE_OUTPUT = "output";

    private final FrameCodec codec;
    private final List<ChatBubble> messages = new ArrayList<>();

    private String activeRequestId;
    private Long snapshotSeq;
    private boolean streaming;
    private String lastError;

    public FrameReducer(FrameCodec codec) {
        this.codec = codec;
    }

    /**
     * Replaces the list with persisted history, e.g. from the session API
     * before the socket delivers its first snapshot.
     */
    public void seed(List<MessageView> history) {
        messages.clear();
        for (MessageView message : history) {
            messages.add(fromView(message));
        }
    }

    public void addLocalUserMessage(String requestId, String content) {
        messages.add(ChatBubble.builder()
                .role(MessageRole.USER)
                .content(content)
                .requestId(requestId)
                .local(true)
                .build());
        activeRequestId = requestId;
        lastError = null;
    }

    /**
     * @return true when the frame changed the rendered state
     */
    public boolean apply(ServerFrame frame) {
        if (frame.getSeq() != null && snapshotSeq != null && frame.getSeq() <= snapshotSeq) {
            log.debug("Frame already in snapshot: type={}, seq={}, snapshotSeq={}",
                    frame.getType(), frame.getSeq(), snapshotSeq);
            return false;
        }
        ServerFrameType type = frame.getType();
        if (type != ServerFrameType.SNAPSHOT && type != ServerFrameType.SYSTEM_MESSAGE
                && activeRequestId != null && frame.getRequestId() != null
                && !activeRequestId.equals(frame.getRequestId())) {
            log.debug("Dropping stale frame: type={}, requestId={}, active={}",
                    type, frame.getRequestId(), activeRequestId);
            return false;
        }
        try {
            return dispatch(frame);
        } catch (MalformedFrameException e) {
            log.warn("Dropping frame with bad payload: type={}, reason={}", type, e.getMessage());
            return false;
        }
    }

    private boolean dispatch(ServerFrame frame) {
        switch (frame.getType()) {
            case SNAPSHOT -> applySnapshot(codec.payload(frame, ConversationView.class));
            case CHAT_STARTED -> {
                ChatStartedPayload started = codec.payload(frame, ChatStartedPayload.class);
                if (Boolean.TRUE.equals(started.getReplay())) {
                    return applyReplayAck(frame.getRequestId());
                }
                if (activeRequestId == null) {
                    activeRequestId = frame.getRequestId();
                }
                streaming = true;
                lastError = null;
            }
            case SEGMENT_STARTED -> {
                return false;
            }
            case CHAT_DELTA -> applyDelta(frame.getRequestId(), codec.payload(frame, ChatDeltaPayload.class));
            case TOOL_START -> {
                ToolStartPayload start = codec.payload(frame, ToolStartPayload.class);
                String args = start.getArgsPreview();
                String line = args != null && !args.isBlank()
                        ? "▶ " + toolName(start.getTool()) + " " + args
                        : "▶ " + toolName(start.getTool());
                upsertTool(frame.getRequestId(), start.getMessageId(), start.getToolCallId(),
                        start.getTool(), PHASE_START, line);
            }
            case TOOL_END -> {
                ToolEndPayload end = codec.payload(frame, ToolEndPayload.class);
                String line = "■ " + toolName(end.getTool()) + " " + (end.isOk() ? "ok" : "error")
                        + " (" + end.getDurationMs() + "ms)";
                upsertTool(frame.getRequestId(), end.getMessageId(), end.getToolCallId(),
                        end.getTool(), PHASE_END, line);
            }
            case TOOL_OUTPUT -> {
                ToolOutputPayload output = codec.payload(frame, ToolOutputPayload.class);
                String content = output.getContent() != null ? output.getContent() : "";
                String line = content.isEmpty()
                        ? "(tool output)"
                        : content + (Boolean.TRUE.equals(output.getTruncated()) ? TRUNCATED_NOTE : "");
                upsertTool(frame.getRequestId(), output.getMessageId(), output.getToolCallId(),
                        output.getTool(), PHASE_OUTPUT, line);
            }
            case SYSTEM_MESSAGE -> {
                return applySystem(codec.payload(frame, SystemMessagePayload.class));
            }
            case CHAT_DONE -> finish();
            case CHAT_CANCELLED -> {
                finish();
                messages.add(ChatBubble.builder().role(MessageRole.SYSTEM).content(CANCELLED_TEXT).build());
            }
            case CHAT_ERROR -> {
                finish();
                String message = codec.payload(frame, ChatErrorPayload.class).getMessage();
                lastError = message != null ? message : "Chat error";
            }
            default -> {
                log.debug("Ignoring frame: type={}", frame.getType());
                return false;
            }
        }
        return true;
    }

    // A finished request was resubmitted; no run and no terminal frame follow.
    private boolean applyReplayAck(String requestId) {
        if (requestId == null || !requestId.equals(activeRequestId)) {
            log.debug("Ignoring replay acknowledgement: requestId={}, active={}", requestId, activeRequestId);
            return false;
        }
        finish();
        return true;
    }

    private void applySnapshot(ConversationView view) {
        if (view.getMessages() == null) {
            throw new MalformedFrameException("snapshot without messages");
        }
        Set<String> confirmed = new HashSet<>();
        List<ChatBubble> rebuilt = new ArrayList<>();
        for (MessageView message : view.getMessages()) {
            rebuilt.add(fromView(message));
            if (message.getRole() == MessageRole.USER && message.getRequestId() != null) {
                confirmed.add(message.getRequestId());
            }
        }

        AssistantOverlay overlay = view.getOverlays() != null ? view.getOverlays().getAssistant() : null;
        if (overlay != null && overlay.getContent() != null) {
            int index = indexOf(rebuilt, overlay.getMessageId());
            if (index >= 0) {
                rebuilt.get(index).setContent(overlay.getContent());
            } else if (!overlay.getContent().isBlank()) {
                rebuilt.add(ChatBubble.builder()
                        .id(overlay.getMessageId())
                        .role(MessageRole.ASSISTANT)
                        .content(overlay.getContent())
                        .requestId(view.getActiveRun() != null ? view.getActiveRun().getRequestId() : null)
                        .build());
            }
        }

        String pendingLocal = null;
        for (ChatBubble bubble : messages) {
            if (bubble.isLocal() && bubble.getRequestId() != null && !confirmed.contains(bubble.getRequestId())) {
                rebuilt.add(bubble);
                pendingLocal = bubble.getRequestId();
            }
        }

        messages.clear();
        messages.addAll(rebuilt);
        snapshotSeq = view.getLastSeq();

        if (view.getActiveRun() != null && view.getActiveRun().getStatus() == RunStatus.RUNNING) {
            activeRequestId = view.getActiveRun().getRequestId();
            streaming = true;
        } else {
            activeRequestId = pendingLocal;
            streaming = false;
        }
        log.debug("Snapshot applied: messages={}, lastSeq={}, active={}", messages.size(), snapshotSeq, activeRequestId);
    }

    private void applyDelta(String requestId, ChatDeltaPayload delta) {
        String text = delta.getText() != null ? delta.getText() : "";
        String tag = requestId != null ? requestId : activeRequestId;

        int index = indexOf(messages, delta.getMessageId());
        if (index >= 0) {
            ChatBubble bubble = messages.get(index);
            bubble.setContent(nullToEmpty(bubble.getContent()) + text);
            bubble.setRequestId(tag);
            return;
        }
        if (!messages.isEmpty()) {
            ChatBubble last = messages.get(messages.size() - 1);
            if (last.getRole() == MessageRole.ASSISTANT && Objects.equals(last.getRequestId(), tag)) {
                last.setContent(nullToEmpty(last.getContent()) + text);
                return;
            }
        }
        messages.add(ChatBubble.builder()
                .id(delta.getMessageId())
                .role(MessageRole.ASSISTANT)
                .content(text)
                .requestId(tag)
                .build());
    }

    private void upsertTool(String requestId, String messageId, String toolCallId,
                            String tool, String phase, String line) {
        int index = indexOf(messages, messageId);
        if (index < 0 && toolCallId != null) {
            for (int i = messages.size() - 1; i >= 0; i--) {
                ChatBubble candidate = messages.get(i);
                if (toolCallId.equals(candidate.getToolCallId()) && phase.equals(candidate.getPhase())) {
                    index = i;
                    break;
                }
            }
        }
        if (index >= 0) {
            ChatBubble existing = messages.get(index);
            existing.setContent(line);
            if (existing.getId() == null) {
                existing.setId(messageId);
            }
            return;
        }
        messages.add(ChatBubble.builder()
                .id(messageId)
                .role(MessageRole.TOOL)
                .content(line)
                .requestId(requestId != null ? requestId : activeRequestId)
                .tool(tool)
                .toolCallId(toolCallId)
                .phase(phase)
                .build());
    }

    private boolean applySystem(SystemMessagePayload system) {
        String content = system.getContent();
        if (content == null || content.isBlank() || indexOf(messages, system.getMessageId()) >= 0) {
            return false;
        }
        messages.add(ChatBubble.builder()
                .id(system.getMessageId())
                .role(MessageRole.SYSTEM)
                .content(content)
                .build());
        return true;
    }

    private void finish() {
        activeRequestId = null;
        streaming = false;
    }

    private static ChatBubble fromView(MessageView message) {
        return ChatBubble.builder()
                .id(message.getId())
                .role(message.getRole())
                .content(message.getContent())
                .requestId(message.getRequestId())
                .tool(message.metaString("name"))
                .toolCallId(message.metaString(MessageView.META_TOOL_CALL_ID))
                .phase(message.metaString(MessageView.META_PHASE))
                .build();
    }

    private static int indexOf(List<ChatBubble> bubbles, String id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < bubbles.size(); i++) {
            if (id.equals(bubbles.get(i).getId())) {
                return i;
            }
        }
        return -1;
    }

    private static String toolName(String tool) {
        return tool != null && !tool.isBlank() ? tool : "tool";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * Copies of the rendered messages.
     */
    public List<ChatBubble> getMessages() {
        List<ChatBubble> copy = new ArrayList<>(messages.size());
        for (ChatBubble bubble : messages) {
            copy.add(bubble.toBuilder().build());
        }
        return copy;
    }

    public String getActiveRequestId() {
        return activeRequestId;
    }

    public Long getSnapshotSeq() {
        return snapshotSeq;
    }

    public boolean isStreaming() {
        return streaming;
    }

    public String getLastError() {
        return lastError;
    }
}
