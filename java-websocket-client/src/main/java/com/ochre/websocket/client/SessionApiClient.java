package com.ochre.websocket.client;

import com.ochre.websocket.protocol.ProtocolObjectMapper;
import com.ochre.websocket.protocol.api.CancelRequest;
import com.ochre.websocket.protocol.api.ChatSubmitRequest;
import com.ochre.websocket.protocol.api.ChatSubmitResponse;
import com.ochre.websocket.protocol.api.CreateSessionRequest;
import com.ochre.websocket.protocol.api.CreateSessionResponse;
import com.ochre.websocket.protocol.api.SessionDetailResponse;
import com.ochre.websocket.protocol.api.SessionListResponse;
import com.ochre.websocket.protocol.api.SessionView;
import com.ochre.websocket.protocol.view.ConversationView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Blocking client for the session HTTP API. Errors surface as Spring's
 * {@code RestClientException} subtypes.
 */
@Slf4j
public class SessionApiClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public SessionApiClient(String baseUrl) {
        this(defaultRestTemplate(), baseUrl);
    }

    public SessionApiClient(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public SessionView createSession(String title) {
        CreateSessionResponse response = restTemplate.postForObject(
                baseUrl + "/api/sessions",
                CreateSessionRequest.builder().title(title).build(),
                CreateSessionResponse.class);
        SessionView session = response != null ? response.getSession() : null;
        log.info("Session created: sessionId={}", session != null ? session.getId() : null);
        return session;
    }

    public List<SessionView> listSessions(int limit) {
        SessionListResponse response = restTemplate.getForObject(
                baseUrl + "/api/sessions?limit={limit}", SessionListResponse.class, limit);
        return response != null ? response.getSessions() : List.of();
    }

    public SessionDetailResponse getSession(String sessionId, int limit) {
        return restTemplate.getForObject(
                baseUrl + "/api/sessions/{id}?limit={limit}", SessionDetailResponse.class, sessionId, limit);
    }

    public ConversationView getSnapshot(String sessionId) {
        return restTemplate.getForObject(
                baseUrl + "/api/sessions/{id}/snapshot", ConversationView.class, sessionId);
    }

    /**
     * Non-streaming chat; blocks until the server finishes the run or gives
     * up waiting.
     */
    public ChatSubmitResponse chat(String sessionId, String content, String requestId) {
        ChatSubmitRequest request = ChatSubmitRequest.builder()
                .content(content)
                .requestId(requestId)
                .build();
        return restTemplate.postForObject(
                baseUrl + "/api/sessions/{id}/chat", request, ChatSubmitResponse.class, sessionId);
    }

    public boolean cancel(String sessionId, String reason) {
        Map<?, ?> response = restTemplate.postForObject(
                baseUrl + "/api/sessions/{id}/cancel",
                CancelRequest.builder().reason(reason).build(),
                Map.class, sessionId);
        return response != null && Boolean.TRUE.equals(response.get("cancelled"));
    }

    private static RestTemplate defaultRestTemplate() {
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.getMessageConverters().removeIf(MappingJackson2HttpMessageConverter.class::isInstance);
        restTemplate.getMessageConverters().add(
                new MappingJackson2HttpMessageConverter(ProtocolObjectMapper.create()));
        return restTemplate;
    }
}
