package com.ochre.websocket.protocol.view;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ochre.websocket.protocol.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunView {

    private String requestId;
    private RunStatus status;
    private Instant startedAt;
    private Instant endedAt;
    private String model;
}
