package com.ochre.websocket.infrastructure;

import com.ochre.websocket.domain.ChatSession;
import com.ochre.websocket.protocol.MessageRole;
import com.ochre.websocket.protocol.view.MessageView;
import com.ochre.websocket.repository.ChatSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaTranscriptStore.class)
class JpaTranscriptStoreTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private JpaTranscriptStore store;

    @Autowired
    private ChatSessionRepository sessionRepository;

    @Autowired
    private TestEntityManager entityManager;

    @BeforeEach
    void setUp() {
        sessionRepository.save(ChatSession.builder()
                .id("s1")
                .title("first")
                .createdAt(CREATED)
                .lastActiveAt(CREATED)
                .build());
        sessionRepository.save(ChatSession.builder()
                .id("s2")
                .createdAt(CREATED)
                .lastActiveAt(CREATED)
                .build());
        entityManager.flush();
    }

    @Test
    void appendAssignsIdsAndKeepsMeta() {
        MessageView row = store.append("s1", MessageRole.USER, "hello", Map.of("requestId", "R1"));

        assertNotNull(row.getId());
        assertEquals(MessageRole.USER, row.getRole());
        assertEquals("R1", row.getRequestId());

        entityManager.clear();
        List<MessageView> rows = store.recentMessages("s1", 10);
        assertEquals(1, rows.size());
        assertEquals("hello", rows.get(0).getContent());
        assertEquals("R1", rows.get(0).getRequestId());
    }

    @Test
    void recentMessagesReturnsTheLatestRowsInInsertionOrder() {
        for (int i = 0; i < 5; i++) {
            store.append("s1", MessageRole.USER, "m" + i, Map.of());
        }
        store.append("s2", MessageRole.USER, "other", Map.of());

        List<MessageView> rows = store.recentMessages("s1", 3);

        assertEquals(List.of("m2", "m3", "m4"), rows.stream().map(MessageView::getContent).toList());
        assertTrue(store.recentMessages("s1", 0).isEmpty());
    }

    @Test
    void updateContentReplacesTextAndMergesMeta() {
        MessageView row = store.append("s1", MessageRole.ASSISTANT, "",
                Map.of("requestId", "R1", "streaming", true));

        store.updateContent(row.getId(), "final answer", Map.of("streaming", false, "cancelled", true));

        entityManager.flush();
        entityManager.clear();
        MessageView stored = store.recentMessages("s1", 1).get(0);
        assertEquals("final answer", stored.getContent());
        assertEquals("R1", stored.getRequestId());
        assertEquals(false, stored.getMeta().get("streaming"));
        assertEquals(true, stored.getMeta().get("cancelled"));
    }

    @Test
    void updateContentOfUnknownRowFails() {
        assertThrows(IllegalArgumentException.class,
                () -> store.updateContent("nope", "x", Map.of()));
    }

    @Test
    void writesBumpSessionActivity() {
        store.append("s2", MessageRole.USER, "ping", Map.of());

        entityManager.flush();
        entityManager.clear();
        ChatSession session = sessionRepository.findById("s2").orElseThrow();
        assertTrue(session.getLastActiveAt().isAfter(CREATED));
        assertEquals(CREATED, sessionRepository.findById("s1").orElseThrow().getLastActiveAt());
    }
}
