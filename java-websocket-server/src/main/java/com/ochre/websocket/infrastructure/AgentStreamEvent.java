package com.ochre.websocket.infrastructure;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of the agent service's NDJSON run stream. Fields are flat; which
 * ones are set depends on {@code type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentStreamEvent {

    private String type;
    private String text;
    private String toolCallId;
    private String tool;
    private String argsPreview;
    private Boolean ok;
    private Long durationMs;
    private String content;
    private String message;

    public boolean isTerminal() {
        return "done".equals(type) || "error".equals(type);
    }
}
