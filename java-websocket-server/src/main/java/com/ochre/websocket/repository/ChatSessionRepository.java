package com.ochre.websocket.repository;

import com.ochre.websocket.domain.ChatSession;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for ChatSession persistence
 */
@Repository
public interface ChatSessionRepository extends JpaRepository<ChatSession, String> {

    /**
     * Most recently active sessions first
     */
    List<ChatSession> findAllByOrderByLastActiveAtDesc(Pageable pageable);

    @Modifying
    @Query("UPDATE ChatSession cs SET cs.lastActiveAt = :time WHERE cs.id = :id")
    int touch(@Param("id") String id, @Param("time") Instant time);
}
