package com.ochre.websocket.conversation;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of live conversation models, one per session id. The only way
 * to obtain a {@link ConversationModel}.
 */
@Slf4j
public class ConversationHub {

    private final ConcurrentHashMap<String, ConversationModel> models = new ConcurrentHashMap<>();
    private final ConversationModelFactory factory;

    public ConversationHub(ConversationModelFactory factory) {
        this.factory = factory;
    }

    public ConversationModel getOrCreate(String sessionId) {
        return models.compute(sessionId, (id, existing) -> {
            if (existing != null) {
                existing.touch();
                return existing;
            }
            log.info("Conversation model created: sessionId={}, total={}", id, models.size() + 1);
            return factory.create(id);
        });
    }

    public Optional<ConversationModel> find(String sessionId) {
        return Optional.ofNullable(models.get(sessionId));
    }

    public int size() {
        return models.size();
    }

    /**
     * Removes models that are idle for at least {@code idle}. The check and
     * the removal happen atomically per key, so a concurrent
     * {@link #getOrCreate} either sees the old model (and keeps it alive) or
     * creates a fresh one.
     *
     * @return ids of the evicted sessions
     */
    public List<String> evictIdle(Duration idle) {
        Instant now = factory.clock().instant();
        List<String> evicted = new ArrayList<>();
        for (String sessionId : models.keySet()) {
            models.computeIfPresent(sessionId, (id, model) -> {
                if (model.isIdle(now, idle)) {
                    evicted.add(id);
                    return null;
                }
                return model;
            });
        }
        if (!evicted.isEmpty()) {
            log.info("Evicted idle conversation models: count={}, remaining={}", evicted.size(), models.size());
        }
        return evicted;
    }
}
