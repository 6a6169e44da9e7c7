package com.ochre.websocket.service;

import com.ochre.websocket.conversation.ConversationHub;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Periodically evicts conversation models nobody is using.
 */
@Slf4j
@Service
public class HubMaintenanceService {

    private final ConversationHub hub;
    private final long idleEvictionMinutes;

    public HubMaintenanceService(ConversationHub hub,
                                 MetricsService metricsService,
                                 @Value("${conversation.hub.idle-eviction-minutes:30}") long idleEvictionMinutes) {
        this.hub = hub;
        this.idleEvictionMinutes = idleEvictionMinutes;
        metricsService.bindHubSize(hub);
        if (idleEvictionMinutes <= 0) {
            log.info("Conversation hub idle eviction disabled");
        }
    }

    @Scheduled(fixedDelayString = "${conversation.hub.sweep-interval-ms:60000}",
               initialDelayString = "${conversation.hub.sweep-interval-ms:60000}")
    public void evictIdleModels() {
        if (idleEvictionMinutes <= 0) {
            return;
        }
        try {
            hub.evictIdle(Duration.ofMinutes(idleEvictionMinutes));
        } catch (RuntimeException e) {
            log.error("Error during conversation hub sweep", e);
        }
    }
}
