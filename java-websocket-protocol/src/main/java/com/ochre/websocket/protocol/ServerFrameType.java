package com.ochre.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Frame types the server emits. Unrecognized names decode to {@link #UNKNOWN}.
 */
public enum ServerFrameType {
    SNAPSHOT("snapshot"),
    CHAT_STARTED("chat.started"),
    SEGMENT_STARTED("assistant.segment.started"),
    CHAT_DELTA("chat.delta"),
    CHAT_DONE("chat.done"),
    CHAT_CANCELLED("chat.cancelled"),
    CHAT_ERROR("chat.error"),
    TOOL_START("tool.start"),
    TOOL_END("tool.end"),
    TOOL_OUTPUT("tool.output"),
    SYSTEM_MESSAGE("system.message"),
    UNKNOWN("unknown");

    private final String wireName;

    ServerFrameType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == CHAT_DONE || this == CHAT_ERROR || this == CHAT_CANCELLED;
    }

    @JsonCreator
    public static ServerFrameType fromWire(String value) {
        for (ServerFrameType type : values()) {
            if (type != UNKNOWN && type.wireName.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
