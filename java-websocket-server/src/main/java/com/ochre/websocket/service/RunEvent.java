package com.ochre.websocket.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Record published to the run-events topic. Keyed by session id.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunEvent {

    public enum Kind {
        RUN_STARTED,
        SEGMENT_FLUSHED,
        RUN_FINISHED
    }

    Kind kind;
    Instant at;
    String sessionId;
    String requestId;
    String model;
    String messageId;
    Integer contentLength;
    String status;
    Long durationMs;
}
