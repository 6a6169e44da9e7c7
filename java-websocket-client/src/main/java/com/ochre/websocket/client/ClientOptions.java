package com.ochre.websocket.client;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Client tuning. {@code baseUrl} is the server's HTTP origin; the WebSocket
 * endpoint is derived from it.
 */
@Value
@Builder
public class ClientOptions {

    @Builder.Default
    String baseUrl = "http://localhost:8080";

    /**
     * A handshake still connecting after this long is aborted by the next
     * {@code connect}.
     */
    @Builder.Default
    Duration stuckThreshold = Duration.ofSeconds(10);

    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(12);

    @Builder.Default
    Duration backoffBase = Duration.ofMillis(500);

    @Builder.Default
    int backoffCapExponent = 5;

    @Builder.Default
    Duration backoffJitterMax = Duration.ofMillis(250);

    @Builder.Default
    int queueCapacity = 64;

    /**
     * Queued sends older than this are dropped instead of delivered.
     */
    @Builder.Default
    Duration queueTtl = Duration.ofMinutes(10);

    @Builder.Default
    int historyLimit = 200;
}
