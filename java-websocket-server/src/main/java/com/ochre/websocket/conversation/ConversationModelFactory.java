package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.FrameCodec;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires a new {@link ConversationModel} with its own mailbox over the shared
 * mailbox pool. Only {@link ConversationHub} calls this.
 */
public class ConversationModelFactory {

    private final TranscriptStore store;
    private final AgentRunner agentRunner;
    private final FrameCodec codec;
    private final ConversationSettings settings;
    private final List<RunLifecycleListener> lifecycleListeners;
    private final Executor mailboxPool;
    private final Clock clock;

    public ConversationModelFactory(TranscriptStore store,
                                    AgentRunner agentRunner,
                                    FrameCodec codec,
                                    ConversationSettings settings,
                                    List<RunLifecycleListener> lifecycleListeners,
                                    Executor mailboxPool,
                                    Clock clock) {
        this.store = store;
        this.agentRunner = agentRunner;
        this.codec = codec;
        this.settings = settings;
        this.lifecycleListeners = List.copyOf(lifecycleListeners);
        this.mailboxPool = mailboxPool;
        this.clock = clock;
    }

    ConversationModel create(String sessionId) {
        return new ConversationModel(
                sessionId,
                store,
                agentRunner,
                codec,
                settings,
                lifecycleListeners,
                new SerialExecutor("session-" + sessionId, mailboxPool),
                clock);
    }

    Clock clock() {
        return clock;
    }
}
