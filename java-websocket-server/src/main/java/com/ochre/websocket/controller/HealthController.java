package com.ochre.websocket.controller;

import com.ochre.websocket.conversation.ConversationHub;
import com.ochre.websocket.repository.ChatSessionRepository;
import com.ochre.websocket.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    private final ChatSessionRepository sessionRepository;
    private final ConversationHub hub;
    private final MetricsService metricsService;

    public HealthController(ChatSessionRepository sessionRepository,
                            ConversationHub hub,
                            MetricsService metricsService) {
        this.sessionRepository = sessionRepository;
        this.hub = hub;
        this.metricsService = metricsService;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");
        response.put("conversations", hub.size());
        response.put("connections", metricsService.getActiveConnections());

        try {
            sessionRepository.count();
            response.put("database", "connected");
        } catch (RuntimeException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            response.put("database", "disconnected");
        }

        return response;
    }
}
