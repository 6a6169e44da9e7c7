package com.ochre.websocket.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes and decodes wire frames. Payloads travel as JSON trees inside the
 * envelope and are bound to their typed class on demand, so a bad payload
 * only fails the consumer that reads it.
 */
public class FrameCodec {

    private final ObjectMapper objectMapper;

    public FrameCodec() {
        this(ProtocolObjectMapper.create());
    }

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public ServerFrame serverFrame(ServerFrameType type, String requestId, Long seq, Object payload) {
        return ServerFrame.builder()
                .type(type)
                .requestId(requestId)
                .seq(seq)
                .payload(toTree(payload))
                .build();
    }

    public ClientFrame clientFrame(ClientFrameType type, String requestId, Object payload) {
        return ClientFrame.builder()
                .type(type)
                .requestId(requestId)
                .payload(toTree(payload))
                .build();
    }

    public String encode(Object frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Failed to encode frame", e);
        }
    }

    public ServerFrame decodeServerFrame(String text) {
        ServerFrame frame = read(text, ServerFrame.class);
        if (frame.getType() == null) {
            throw new MalformedFrameException("Server frame without type");
        }
        return frame;
    }

    public ClientFrame decodeClientFrame(String text) {
        ClientFrame frame = read(text, ClientFrame.class);
        if (frame.getType() == null) {
            throw new MalformedFrameException("Client frame without type");
        }
        return frame;
    }

    /**
     * Binds a frame payload to its typed class. A missing payload binds as an
     * empty object.
     */
    public <T> T readPayload(JsonNode payload, Class<T> type) {
        JsonNode node = (payload == null || payload.isNull() || payload.isMissingNode())
                ? objectMapper.createObjectNode()
                : payload;
        if (!node.isObject()) {
            throw new MalformedFrameException("Payload is not an object: " + node.getNodeType());
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedFrameException("Invalid " + type.getSimpleName() + " payload", e);
        }
    }

    public <T> T payload(ServerFrame frame, Class<T> type) {
        return readPayload(frame.getPayload(), type);
    }

    public <T> T payload(ClientFrame frame, Class<T> type) {
        return readPayload(frame.getPayload(), type);
    }

    private JsonNode toTree(Object payload) {
        if (payload == null) {
            return objectMapper.createObjectNode();
        }
        if (payload instanceof JsonNode node) {
            return node;
        }
        return objectMapper.valueToTree(payload);
    }

    private <T> T read(String text, Class<T> type) {
        if (text == null || text.isBlank()) {
            throw new MalformedFrameException("Empty frame");
        }
        try {
            return objectMapper.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Unparseable frame", e);
        }
    }
}
