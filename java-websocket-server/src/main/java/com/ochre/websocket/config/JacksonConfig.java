package com.ochre.websocket.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.ProtocolObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * One ObjectMapper for REST bodies, WebSocket frames and the agent stream,
 * so timestamps and enums look the same everywhere.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return ProtocolObjectMapper.create();
    }

    @Bean
    public FrameCodec frameCodec(ObjectMapper objectMapper) {
        return new FrameCodec(objectMapper);
    }
}
