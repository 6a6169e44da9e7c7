package com.ochre.websocket.config;

import com.ochre.websocket.conversation.AgentRunner;
import com.ochre.websocket.conversation.ConversationHub;
import com.ochre.websocket.conversation.ConversationModelFactory;
import com.ochre.websocket.conversation.ConversationSettings;
import com.ochre.websocket.conversation.RunLifecycleListener;
import com.ochre.websocket.conversation.TranscriptStore;
import com.ochre.websocket.protocol.FrameCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Conversation wiring: thread pools, settings, model factory and hub.
 *
 * Three pools: session mailboxes (short state transitions), subscriber
 * fan-out (socket writes) and agent runs (one blocking stream per run).
 */
@Slf4j
@Configuration
public class ConversationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService mailboxExecutor(@Value("${conversation.mailbox.pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("conversation-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService fanoutExecutor(@Value("${websocket.fanout.pool-size:4}") int poolSize) {
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("ws-fanout-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentRunExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("agent-run-"));
    }

    @Bean
    public ConversationSettings conversationSettings(
            @Value("${conversation.snapshot-limit:400}") int snapshotLimit,
            @Value("${conversation.history-limit:200}") int historyLimit,
            @Value("${conversation.tool-output-preview-chars:20000}") int toolOutputPreviewChars,
            @Value("${conversation.seen-request-ids:1024}") int seenRequestIdCapacity,
            @Value("${conversation.default-model:openai/gpt-4o-mini}") String defaultModel) {
        ConversationSettings settings = ConversationSettings.builder()
                .snapshotLimit(snapshotLimit)
                .historyLimit(historyLimit)
                .toolOutputPreviewChars(toolOutputPreviewChars)
                .seenRequestIdCapacity(seenRequestIdCapacity)
                .defaultModel(defaultModel)
                .build();
        log.info("Conversation settings: {}", settings);
        return settings;
    }

    @Bean
    public ConversationModelFactory conversationModelFactory(TranscriptStore transcriptStore,
                                                             AgentRunner agentRunner,
                                                             FrameCodec frameCodec,
                                                             ConversationSettings settings,
                                                             ObjectProvider<RunLifecycleListener> lifecycleListeners,
                                                             @Qualifier("mailboxExecutor") ExecutorService mailboxExecutor,
                                                             Clock clock) {
        return new ConversationModelFactory(
                transcriptStore,
                agentRunner,
                frameCodec,
                settings,
                lifecycleListeners.orderedStream().toList(),
                mailboxExecutor,
                clock);
    }

    @Bean
    public ConversationHub conversationHub(ConversationModelFactory conversationModelFactory) {
        return new ConversationHub(conversationModelFactory);
    }
}
