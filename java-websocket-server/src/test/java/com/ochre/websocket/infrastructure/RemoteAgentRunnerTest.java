package com.ochre.websocket.infrastructure;

import com.ochre.websocket.conversation.AgentEventListener;
import com.ochre.websocket.conversation.AgentRunException;
import com.ochre.websocket.conversation.RunHandle;
import com.ochre.websocket.conversation.RunRequest;
import com.ochre.websocket.protocol.MessageRole;
import com.ochre.websocket.protocol.ProtocolObjectMapper;
import com.ochre.websocket.protocol.view.MessageView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class RemoteAgentRunnerTest {

    private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        listener = new RecordingListener();
    }

    private RemoteAgentRunner runner() {
        return new RemoteAgentRunner(restTemplate, ProtocolObjectMapper.create(), Runnable::run, "http://agent");
    }

    private RunRequest request() {
        return RunRequest.builder()
                .sessionId("s1")
                .requestId("R1")
                .model("test-model")
                .history(List.of(
                        MessageView.builder().role(MessageRole.USER).content("earlier").build(),
                        MessageView.builder().role(MessageRole.ASSISTANT).content("").build(),
                        MessageView.builder().role(MessageRole.USER).content("hello").build()))
                .build();
    }

    @Test
    void streamsEveryEventTypeToTheListener() {
        String body = String.join("\n",
                "{\"type\":\"token\",\"text\":\"Hi\"}",
                "{\"type\":\"tool.start\",\"toolCallId\":\"c1\",\"tool\":\"search\",\"argsPreview\":\"q\"}",
                "{\"type\":\"tool.output\",\"toolCallId\":\"c1\",\"tool\":\"search\",\"content\":\"result\"}",
                "{\"type\":\"tool.end\",\"toolCallId\":\"c1\",\"tool\":\"search\",\"ok\":false,\"durationMs\":12}",
                "{\"type\":\"system\",\"content\":\"note\"}",
                "{\"type\":\"chat.delta\",\"text\":\" there\"}",
                "{\"type\":\"done\"}",
                "{\"type\":\"token\",\"text\":\"after done\"}");
        server.expect(requestTo("http://agent/runs"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.sessionId").value("s1"))
                .andExpect(jsonPath("$.requestId").value("R1"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages.length()").value(2))
                .andExpect(jsonPath("$.messages[1].role").value("user"))
                .andRespond(withSuccess(body, NDJSON));

        runner().start(request(), listener);

        server.verify();
        assertEquals(List.of(
                "token:Hi",
                "tool.start:c1:search:q",
                "tool.output:c1:search:result",
                "tool.end:c1:search:false:12",
                "system:note",
                "token: there",
                "done"), listener.events);
    }

    @Test
    void streamEndingWithoutTerminalEventCompletesTheRun() {
        server.expect(requestTo("http://agent/runs"))
                .andRespond(withSuccess("{\"type\":\"token\",\"text\":\"x\"}\n", NDJSON));

        runner().start(request(), listener);

        assertEquals(List.of("token:x", "done"), listener.events);
    }

    @Test
    void errorEventBecomesAgentRunException() {
        server.expect(requestTo("http://agent/runs"))
                .andRespond(withSuccess("{\"type\":\"error\",\"message\":\"model overloaded\"}\n", NDJSON));

        runner().start(request(), listener);

        assertEquals(List.of("error:model overloaded"), listener.events);
        assertInstanceOf(AgentRunException.class, listener.lastError);
    }

    @Test
    void httpFailureIsReportedAsError() {
        server.expect(requestTo("http://agent/runs")).andRespond(withServerError());

        runner().start(request(), listener);

        assertEquals(1, listener.events.size());
        assertTrue(listener.events.get(0).startsWith("error:Agent service returned 500"));
    }

    @Test
    void malformedLinesAreSkipped() {
        String body = "not json\n\n{\"type\":\"token\",\"text\":\"ok\"}\n{\"type\":\"mystery\"}\n{\"type\":\"done\"}\n";
        server.expect(requestTo("http://agent/runs")).andRespond(withSuccess(body, NDJSON));

        runner().start(request(), listener);

        assertEquals(List.of("token:ok", "done"), listener.events);
    }

    @Test
    void cancelledBeforeStartNeverCallsTheService() {
        Deque<Runnable> deferred = new ArrayDeque<>();
        RemoteAgentRunner runner = new RemoteAgentRunner(
                restTemplate, ProtocolObjectMapper.create(), deferred::add, "http://agent");

        RunHandle handle = runner.start(request(), listener);
        handle.cancel();
        while (!deferred.isEmpty()) {
            deferred.poll().run();
        }

        server.verify();
        assertTrue(listener.events.isEmpty());
    }

    @Test
    void cancelMidStreamStopsDelivery() {
        Deque<Runnable> deferred = new ArrayDeque<>();
        RemoteAgentRunner runner = new RemoteAgentRunner(
                restTemplate, ProtocolObjectMapper.create(), deferred::add, "http://agent");
        server.expect(requestTo("http://agent/runs")).andRespond(withSuccess(
                "{\"type\":\"token\",\"text\":\"a\"}\n{\"type\":\"token\",\"text\":\"b\"}\n{\"type\":\"done\"}\n", NDJSON));

        AtomicReference<RunHandle> handle = new AtomicReference<>();
        listener.onFirstToken = () -> handle.get().cancel();
        handle.set(runner.start(request(), listener));
        while (!deferred.isEmpty()) {
            deferred.poll().run();
        }

        assertEquals(List.of("token:a"), listener.events);
    }

    private static final class RecordingListener implements AgentEventListener {

        final List<String> events = new ArrayList<>();
        Throwable lastError;
        Runnable onFirstToken;

        @Override
        public void onToken(String text) {
            events.add("token:" + text);
            if (onFirstToken != null) {
                Runnable callback = onFirstToken;
                onFirstToken = null;
                callback.run();
            }
        }

        @Override
        public void onToolStart(String toolCallId, String tool, String argsPreview) {
            events.add("tool.start:" + toolCallId + ":" + tool + ":" + argsPreview);
        }

        @Override
        public void onToolEnd(String toolCallId, String tool, boolean ok, long durationMs) {
            events.add("tool.end:" + toolCallId + ":" + tool + ":" + ok + ":" + durationMs);
        }

        @Override
        public void onToolOutput(String toolCallId, String tool, String content) {
            events.add("tool.output:" + toolCallId + ":" + tool + ":" + content);
        }

        @Override
        public void onSystemMessage(String content) {
            events.add("system:" + content);
        }

        @Override
        public void onDone() {
            events.add("done");
        }

        @Override
        public void onError(Throwable error) {
            lastError = error;
            events.add("error:" + error.getMessage());
        }
    }
}
