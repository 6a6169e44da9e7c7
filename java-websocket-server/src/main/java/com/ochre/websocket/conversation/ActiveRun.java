package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.RunStatus;
import com.ochre.websocket.protocol.view.RunView;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * The session's current Run. Confined to the session mailbox.
 */
@Getter
@Setter
class ActiveRun {

    private final String requestId;
    private final String model;
    private final Instant startedAt;
    private final CompletableFuture<RunStatus> completion = new CompletableFuture<>();

    private RunStatus status = RunStatus.RUNNING;
    private Instant endedAt;
    private RunHandle handle;
    private AssistantSegment openSegment;

    ActiveRun(String requestId, String model, Instant startedAt) {
        this.requestId = requestId;
        this.model = model;
        this.startedAt = startedAt;
    }

    boolean isRunning() {
        return status == RunStatus.RUNNING;
    }

    RunView toView() {
        return RunView.builder()
                .requestId(requestId)
                .status(status)
                .startedAt(startedAt)
                .endedAt(endedAt)
                .model(model)
                .build();
    }
}
