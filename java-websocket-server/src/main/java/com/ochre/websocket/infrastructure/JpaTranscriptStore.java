package com.ochre.websocket.infrastructure;

import com.ochre.websocket.conversation.TranscriptStore;
import com.ochre.websocket.domain.ChatMessage;
import com.ochre.websocket.protocol.MessageRole;
import com.ochre.websocket.protocol.view.MessageView;
import com.ochre.websocket.repository.ChatMessageRepository;
import com.ochre.websocket.repository.ChatSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Transcript persistence over Spring Data JPA. Every write also bumps the
 * owning session's {@code lastActiveAt}.
 */
@Component
@Slf4j
public class JpaTranscriptStore implements TranscriptStore {

    private final ChatMessageRepository messageRepository;
    private final ChatSessionRepository sessionRepository;

    public JpaTranscriptStore(ChatMessageRepository messageRepository,
                              ChatSessionRepository sessionRepository) {
        this.messageRepository = messageRepository;
        this.sessionRepository = sessionRepository;
    }

    @Override
    @Transactional
    public MessageView append(String sessionId, MessageRole role, String content, Map<String, Object> meta) {
        Instant now = Instant.now();
        ChatMessage message = ChatMessage.builder()
                .messageId(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .role(role)
                .content(content != null ? content : "")
                .createdAt(now)
                .meta(meta != null ? new LinkedHashMap<>(meta) : new LinkedHashMap<>())
                .build();

        ChatMessage saved = messageRepository.save(message);
        sessionRepository.touch(sessionId, now);

        log.debug("Message appended: sessionId={}, role={}, messageId={}, seq={}",
                sessionId, role, saved.getMessageId(), saved.getSeq());
        return toView(saved);
    }

    @Override
    @Transactional
    public void updateContent(String messageId, String content, Map<String, Object> metaPatch) {
        ChatMessage message = messageRepository.findByMessageId(messageId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown message: " + messageId));

        Map<String, Object> meta = new LinkedHashMap<>(message.getMeta() != null ? message.getMeta() : Map.of());
        if (metaPatch != null) {
            meta.putAll(metaPatch);
        }
        message.setContent(content != null ? content : "");
        message.setMeta(meta);
        messageRepository.save(message);
        sessionRepository.touch(message.getSessionId(), Instant.now());

        log.debug("Message content updated: messageId={}, length={}", messageId, message.getContent().length());
    }

    @Override
    @Transactional(readOnly = true)
    public List<MessageView> recentMessages(String sessionId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ChatMessage> newestFirst = messageRepository.findBySessionIdOrderBySeqDesc(
                sessionId, PageRequest.of(0, limit));

        List<MessageView> views = new ArrayList<>(newestFirst.size());
        for (ChatMessage message : newestFirst) {
            views.add(toView(message));
        }
        Collections.reverse(views);
        return views;
    }

    static MessageView toView(ChatMessage message) {
        return MessageView.builder()
                .id(message.getMessageId())
                .sessionId(message.getSessionId())
                .role(message.getRole())
                .content(message.getContent())
                .createdAt(message.getCreatedAt())
                .meta(message.getMeta() != null ? new LinkedHashMap<>(message.getMeta()) : new LinkedHashMap<>())
                .build();
    }
}
