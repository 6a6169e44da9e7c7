package com.ochre.websocket.protocol.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the non-streaming chat fallback. A missing {@code requestId} is
 * minted by the server.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSubmitRequest {

    private String content;
    private String requestId;
    private String model;
}
