package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.RunStatus;
import lombok.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Result of {@link ConversationModel#submit}. {@code completion} finishes with
 * the Run's terminal status; for a replayed request it is already complete.
 */
@Value
public class SubmitOutcome {

    public enum Kind {
        STARTED,
        ALREADY_RUNNING,
        DUPLICATE,
        IGNORED_EMPTY
    }

    Kind kind;
    String requestId;
    CompletableFuture<RunStatus> completion;

    public static SubmitOutcome started(String requestId, CompletableFuture<RunStatus> completion) {
        return new SubmitOutcome(Kind.STARTED, requestId, completion);
    }

    public static SubmitOutcome alreadyRunning(String requestId, CompletableFuture<RunStatus> completion) {
        return new SubmitOutcome(Kind.ALREADY_RUNNING, requestId, completion);
    }

    public static SubmitOutcome duplicate(String requestId, RunStatus status) {
        return new SubmitOutcome(Kind.DUPLICATE, requestId, CompletableFuture.completedFuture(status));
    }

    public static SubmitOutcome ignoredEmpty(String requestId) {
        return new SubmitOutcome(Kind.IGNORED_EMPTY, requestId, CompletableFuture.completedFuture(null));
    }
}
