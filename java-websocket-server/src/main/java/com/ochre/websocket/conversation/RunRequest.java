package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.view.MessageView;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RunRequest {

    String sessionId;
    String requestId;
    String model;
    List<MessageView> history;
}
