package com.ochre.websocket.protocol.api;

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
public class SessionListResponse {

    @Builder.Default
    private List<SessionView> sessions = new ArrayList<>();
}
