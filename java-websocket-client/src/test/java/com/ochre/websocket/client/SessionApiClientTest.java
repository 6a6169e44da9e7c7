package com.ochre.websocket.client;

import com.ochre.websocket.protocol.ProtocolObjectMapper;
import com.ochre.websocket.protocol.RunStatus;
import com.ochre.websocket.protocol.api.ChatSubmitResponse;
import com.ochre.websocket.protocol.api.SessionView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SessionApiClientTest {

    private MockRestServiceServer server;
    private SessionApiClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate(List.of(
                new MappingJackson2HttpMessageConverter(ProtocolObjectMapper.create())));
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new SessionApiClient(restTemplate, "http://localhost:8080/");
    }

    @Test
    void createsSession() {
        server.expect(requestTo("http://localhost:8080/api/sessions"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(
                        "{\"session\":{\"id\":\"s1\",\"title\":\"Trip\",\"createdAt\":\"2024-05-01T10:00:00Z\"}}",
                        MediaType.APPLICATION_JSON));

        SessionView session = client.createSession("Trip");

        server.verify();
        assertEquals("s1", session.getId());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), session.getCreatedAt());
    }

    @Test
    void listsSessions() {
        server.expect(requestTo("http://localhost:8080/api/sessions?limit=50"))
                .andRespond(withSuccess("{\"sessions\":[{\"id\":\"a\"},{\"id\":\"b\"}]}", MediaType.APPLICATION_JSON));

        List<SessionView> sessions = client.listSessions(50);

        assertEquals(List.of("a", "b"), sessions.stream().map(SessionView::getId).toList());
    }

    @Test
    void fallbackChatReturnsRunRows() {
        server.expect(requestTo("http://localhost:8080/api/sessions/s1/chat"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(
                        "{\"requestId\":\"R1\",\"status\":\"done\",\"messages\":[{\"id\":\"m1\",\"role\":\"user\",\"content\":\"hi\"},"
                                + "{\"id\":\"m2\",\"role\":\"assistant\",\"content\":\"Hello\",\"unknownField\":1}]}",
                        MediaType.APPLICATION_JSON));

        ChatSubmitResponse response = client.chat("s1", "hi", "R1");

        assertEquals(RunStatus.DONE, response.getStatus());
        assertEquals("Hello", response.getMessages().get(1).getContent());
    }

    @Test
    void cancelReportsOutcome() {
        server.expect(requestTo("http://localhost:8080/api/sessions/s1/cancel"))
                .andRespond(withSuccess("{\"sessionId\":\"s1\",\"cancelled\":true}", MediaType.APPLICATION_JSON));

        assertTrue(client.cancel("s1", "user"));
    }

    @Test
    void unknownSessionSurfacesAsNotFound() {
        server.expect(requestTo("http://localhost:8080/api/sessions/nope?limit=200"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"Not found\"}"));

        assertThrows(HttpClientErrorException.NotFound.class, () -> client.getSession("nope", 200));
    }
}
