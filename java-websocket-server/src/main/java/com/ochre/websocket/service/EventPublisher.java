package com.ochre.websocket.service;

import com.ochre.websocket.conversation.RunLifecycleListener;
import com.ochre.websocket.protocol.RunStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Mirrors run lifecycle onto Kafka. Failures are logged and counted,
 * never surfaced to the conversation.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true")
public class EventPublisher implements RunLifecycleListener {

    private final KafkaTemplate<String, RunEvent> kafkaTemplate;
    private final MetricsService metricsService;
    private final String topic;
    private final Clock clock;

    public EventPublisher(KafkaTemplate<String, RunEvent> kafkaTemplate,
                          MetricsService metricsService,
                          @Value("${kafka.topics.run-events:run-events}") String topic,
                          Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
        this.topic = topic;
        this.clock = clock;
    }

    @Override
    public void onRunStarted(String sessionId, String requestId, String model) {
        publish(event(RunEvent.Kind.RUN_STARTED, sessionId, requestId)
                .model(model)
                .build());
    }

    @Override
    public void onSegmentFlushed(String sessionId, String requestId, String messageId, int length) {
        publish(event(RunEvent.Kind.SEGMENT_FLUSHED, sessionId, requestId)
                .messageId(messageId)
                .contentLength(length)
                .build());
    }

    @Override
    public void onRunFinished(String sessionId, String requestId, RunStatus status, Duration duration) {
        publish(event(RunEvent.Kind.RUN_FINISHED, sessionId, requestId)
                .status(status.wireName())
                .durationMs(duration.toMillis())
                .build());
    }

    private RunEvent.RunEventBuilder event(RunEvent.Kind kind, String sessionId, String requestId) {
        return RunEvent.builder()
                .kind(kind)
                .at(clock.instant())
                .sessionId(sessionId)
                .requestId(requestId);
    }

    private void publish(RunEvent event) {
        try {
            kafkaTemplate.send(topic, event.getSessionId(), event).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Run event not published: kind={}, session={}", event.getKind(), event.getSessionId(), ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                } else {
                    log.debug("Run event published: kind={}, partition={}, offset={}",
                            event.getKind(),
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                }
            });
        } catch (RuntimeException e) {
            log.error("Run event send failed: kind={}", event.getKind(), e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
