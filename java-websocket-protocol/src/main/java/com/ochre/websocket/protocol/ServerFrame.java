package com.ochre.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Server → client envelope: {@code {type, requestId?, seq?, payload}}.
 * {@code seq} is assigned per session to broadcast frames; direct replies
 * (snapshot, per-connection errors) carry none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerFrame {

    private ServerFrameType type;
    private String requestId;
    private Long seq;
    private JsonNode payload;
}
