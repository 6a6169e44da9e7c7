package com.ochre.websocket.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ochre.websocket.protocol.RunStatus;
import com.ochre.websocket.protocol.view.MessageView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatSubmitResponse {

    private String sessionId;
    private String requestId;
    private RunStatus status;

    @Builder.Default
    private List<MessageView> messages = new ArrayList<>();
}
