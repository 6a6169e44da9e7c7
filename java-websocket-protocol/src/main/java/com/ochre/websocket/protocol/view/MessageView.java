package com.ochre.websocket.protocol.view;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.ochre.websocket.protocol.MessageRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One durable transcript row as it appears on the wire.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageView {

    public static final String META_REQUEST_ID = "requestId";
    public static final String META_TOOL_CALL_ID = "toolCallId";
    public static final String META_PHASE = "phase";
    public static final String META_STREAMING = "streaming";

    private String id;
    private String sessionId;
    private MessageRole role;
    private String content;
    private Instant createdAt;
    private Map<String, Object> meta;

    @JsonIgnore
    public String metaString(String key) {
        if (meta == null) {
            return null;
        }
        Object value = meta.get(key);
        return value != null ? value.toString() : null;
    }

    @JsonIgnore
    public String getRequestId() {
        return metaString(META_REQUEST_ID);
    }
}
