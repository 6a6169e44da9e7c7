package com.ochre.websocket.service;

import com.ochre.websocket.conversation.ConversationHub;
import com.ochre.websocket.conversation.RunLifecycleListener;
import com.ochre.websocket.protocol.RunStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics Service over Micrometer.
 *
 * Counters for connections, frames and runs, a gauge of open connections,
 * and run durations. Every recording is also logged at DEBUG.
 */
@Service
@Slf4j
public class MetricsService implements RunLifecycleListener {

    private final MeterRegistry registry;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("websocket.connections.active", activeConnections, AtomicInteger::get)
                .description("Open conversation WebSocket connections")
                .register(registry);
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name, String... tags) {
        registry.counter(name, tags).increment();
        log.debug("[METRIC] Counter: {} +1", name);
    }

    public void recordTimer(String name, Duration duration, String... tags) {
        Timer.builder(name).tags(tags).register(registry).record(duration);
        log.debug("[METRIC] Timer: {} = {}ms", name, duration.toMillis());
    }

    // ===== Transport Metrics =====

    public void recordWebSocketConnection(String sessionId, boolean success) {
        incrementCounter("websocket.connections", "success", String.valueOf(success));
        if (success) {
            activeConnections.incrementAndGet();
        }
        log.debug("WebSocket connection: sessionId={}, success={}", sessionId, success);
    }

    public void recordWebSocketDisconnection(String sessionId) {
        incrementCounter("websocket.disconnections");
        activeConnections.decrementAndGet();
        log.debug("WebSocket disconnection: sessionId={}", sessionId);
    }

    public void recordFrameReceived(String frameType) {
        incrementCounter("websocket.frames.received", "type", frameType);
    }

    public void recordMalformedFrame() {
        incrementCounter("websocket.frames.malformed");
    }

    public void recordSubscriberDropped() {
        incrementCounter("websocket.subscribers.dropped");
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors", "type", errorType, "component", component);
    }

    public void bindHubSize(ConversationHub hub) {
        Gauge.builder("conversation.hub.models", hub, ConversationHub::size)
                .description("Conversation models held by the hub")
                .register(registry);
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    // ===== Run Lifecycle =====

    @Override
    public void onRunStarted(String sessionId, String requestId, String model) {
        incrementCounter("conversation.runs.started", "model", model != null ? model : "default");
    }

    @Override
    public void onSegmentFlushed(String sessionId, String requestId, String messageId, int length) {
        incrementCounter("conversation.segments.flushed");
        registry.summary("conversation.segments.length").record(length);
    }

    @Override
    public void onRunFinished(String sessionId, String requestId, RunStatus status, Duration duration) {
        incrementCounter("conversation.runs.finished", "status", status.wireName());
        recordTimer("conversation.runs.duration", duration, "status", status.wireName());
    }
}
