package com.ochre.websocket.protocol.view;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unflushed text of the open assistant segment, keyed by its message row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssistantOverlay {

    private String messageId;
    private String content;
}
