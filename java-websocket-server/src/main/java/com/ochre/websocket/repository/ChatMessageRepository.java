package com.ochre.websocket.repository;

import com.ochre.websocket.domain.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for transcript rows
 */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    Optional<ChatMessage> findByMessageId(String messageId);

    /**
     * Newest rows first; callers reverse the page to get transcript order.
     */
    List<ChatMessage> findBySessionIdOrderBySeqDesc(String sessionId, Pageable pageable);
}
