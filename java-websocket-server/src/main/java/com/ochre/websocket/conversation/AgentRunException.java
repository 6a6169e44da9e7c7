package com.ochre.websocket.conversation;

public class AgentRunException extends RuntimeException {

    public AgentRunException(String message) {
        super(message);
    }

    public AgentRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
