package com.ochre.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Transcript row roles. Serialized lowercase on the wire and in the store.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    TOOL,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MessageRole fromWire(String value) {
        if (value == null) {
            return null;
        }
        return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
