package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.MessageRole;
import com.ochre.websocket.protocol.view.MessageView;

import java.util.List;
import java.util.Map;

/**
 * Durable, insertion-ordered transcript rows keyed by session.
 */
public interface TranscriptStore {

    /**
     * Inserts a row at the end of the session's transcript.
     */
    MessageView append(String sessionId, MessageRole role, String content, Map<String, Object> meta);

    /**
     * Overwrites a row's content and merges {@code metaPatch} into its meta.
     */
    void updateContent(String messageId, String content, Map<String, Object> metaPatch);

    /**
     * The last {@code limit} rows of the session, oldest first.
     */
    List<MessageView> recentMessages(String sessionId, int limit);
}
