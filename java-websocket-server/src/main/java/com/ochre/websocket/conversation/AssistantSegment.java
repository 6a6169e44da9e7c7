package com.ochre.websocket.conversation;

import lombok.Getter;

/**
 * An open assistant segment: the row exists (empty) in the store and the
 * text accumulates here until the segment is flushed.
 */
@Getter
class AssistantSegment {

    private final String messageId;
    private final StringBuilder buffer = new StringBuilder();

    AssistantSegment(String messageId) {
        this.messageId = messageId;
    }

    void append(String text) {
        buffer.append(text);
    }

    String text() {
        return buffer.toString();
    }
}
