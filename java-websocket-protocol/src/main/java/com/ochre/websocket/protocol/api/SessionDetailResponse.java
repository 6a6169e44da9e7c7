package com.ochre.websocket.protocol.api;

import com.ochre.websocket.protocol.view.MessageView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Session plus its history, used to seed a client before the socket attaches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionDetailResponse {

    private SessionView session;

    @Builder.Default
    private List<MessageView> messages = new ArrayList<>();
}
