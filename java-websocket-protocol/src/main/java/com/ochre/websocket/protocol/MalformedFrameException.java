package com.ochre.websocket.protocol;

/**
 * Raised when a frame or its payload cannot be decoded.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
