package com.ochre.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Frame types a client may send. Anything else decodes to {@link #UNKNOWN}
 * so the receiver can log and ignore it instead of guessing.
 */
public enum ClientFrameType {
    HELLO("hello"),
    CHAT_SEND("chat.send"),
    CHAT_CANCEL("chat.cancel"),
    UNKNOWN("unknown");

    private final String wireName;

    ClientFrameType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ClientFrameType fromWire(String value) {
        for (ClientFrameType type : values()) {
            if (type != UNKNOWN && type.wireName.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
