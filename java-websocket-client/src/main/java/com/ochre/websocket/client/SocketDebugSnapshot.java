package com.ochre.websocket.client;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class SocketDebugSnapshot {

    String sessionId;
    ConnectionState state;
    boolean closedByUser;
    int queueSize;
    int attempts;
    long generation;
    boolean reconnectTimerArmed;
    boolean connectTimeoutArmed;
    Instant connectingSince;
    Integer lastCloseCode;
    String lastCloseReason;
    Long lastSeq;
}
