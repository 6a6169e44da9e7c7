package com.ochre.websocket.client;

import com.ochre.websocket.protocol.MessageRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One rendered message. {@code local} marks an optimistic user message the
 * server has not confirmed yet.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatBubble {

    private String id;
    private MessageRole role;
    private String content;
    private String requestId;
    private String tool;
    private String toolCallId;
    private String phase;
    private boolean local;
}
