package com.ochre.websocket.protocol.view;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Render-ready reconstruction of a session: durable rows plus the open
 * segment's buffer as an overlay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationView {

    private String sessionId;

    @Builder.Default
    private List<MessageView> messages = new ArrayList<>();

    private RunView activeRun;
    private Overlays overlays;
    private Long lastSeq;
}
