package com.ochre.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunStatus {
    RUNNING,
    DONE,
    ERROR,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus fromWire(String value) {
        if (value == null) {
            return null;
        }
        return RunStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
