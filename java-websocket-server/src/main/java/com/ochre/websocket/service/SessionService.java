package com.ochre.websocket.service;

import com.ochre.websocket.conversation.TranscriptStore;
import com.ochre.websocket.domain.ChatSession;
import com.ochre.websocket.protocol.api.SessionView;
import com.ochre.websocket.protocol.view.MessageView;
import com.ochre.websocket.repository.ChatSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Session rows and transcript reads for the HTTP surface.
 */
@Slf4j
@Service
public class SessionService {

    private static final int MAX_LIMIT = 1000;

    private final ChatSessionRepository sessionRepository;
    private final TranscriptStore transcriptStore;

    public SessionService(ChatSessionRepository sessionRepository,
                          TranscriptStore transcriptStore) {
        this.sessionRepository = sessionRepository;
        this.transcriptStore = transcriptStore;
    }

    @Transactional
    public SessionView createSession(String title) {
        Instant now = Instant.now();
        ChatSession session = ChatSession.builder()
                .id(UUID.randomUUID().toString())
                .title(title != null && !title.isBlank() ? title.strip() : null)
                .createdAt(now)
                .lastActiveAt(now)
                .build();
        ChatSession saved = sessionRepository.save(session);
        log.info("Session created: sessionId={}", saved.getId());
        return toView(saved);
    }

    @Transactional(readOnly = true)
    public List<SessionView> listSessions(int limit) {
        return sessionRepository.findAllByOrderByLastActiveAtDesc(PageRequest.of(0, clamp(limit)))
                .stream()
                .map(SessionService::toView)
                .toList();
    }

    @Transactional(readOnly = true)
    public SessionView getSession(String sessionId) {
        return sessionRepository.findById(sessionId)
                .map(SessionService::toView)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Transactional(readOnly = true)
    public boolean exists(String sessionId) {
        return sessionId != null && sessionRepository.existsById(sessionId);
    }

    /**
     * Last {@code limit} transcript rows, oldest first.
     */
    public List<MessageView> getMessages(String sessionId, int limit) {
        requireSession(sessionId);
        return transcriptStore.recentMessages(sessionId, clamp(limit));
    }

    public void requireSession(String sessionId) {
        if (!exists(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
    }

    private static int clamp(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return Math.min(limit, MAX_LIMIT);
    }

    static SessionView toView(ChatSession session) {
        return SessionView.builder()
                .id(session.getId())
                .title(session.getTitle())
                .createdAt(session.getCreatedAt())
                .lastActiveAt(session.getLastActiveAt())
                .build();
    }
}
