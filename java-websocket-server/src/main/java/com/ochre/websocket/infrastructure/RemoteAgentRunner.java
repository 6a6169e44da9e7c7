package com.ochre.websocket.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ochre.websocket.conversation.AgentEventListener;
import com.ochre.websocket.conversation.AgentRunException;
import com.ochre.websocket.conversation.AgentRunner;
import com.ochre.websocket.conversation.RunHandle;
import com.ochre.websocket.conversation.RunRequest;
import com.ochre.websocket.protocol.MessageRole;
import com.ochre.websocket.protocol.view.MessageView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Agent runner backed by the agent service's streaming HTTP endpoint.
 *
 * <p>POSTs the run to {@code {agent.service.url}/runs} and reads the NDJSON
 * response line by line on the agent run executor. Cancelling closes the
 * response stream; nothing is reported after that.
 */
@Component
@Slf4j
public class RemoteAgentRunner implements AgentRunner {

    private static final MediaType NDJSON = new MediaType("application", "x-ndjson");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final String agentServiceUrl;

    public RemoteAgentRunner(@Qualifier("agentRestTemplate") RestTemplate restTemplate,
                             ObjectMapper objectMapper,
                             @Qualifier("agentRunExecutor") Executor executor,
                             @Value("${agent.service.url:http://localhost:8000}") String agentServiceUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.agentServiceUrl = agentServiceUrl;
        log.info("RemoteAgentRunner initialized: url={}", agentServiceUrl);
    }

    @Override
    public RunHandle start(RunRequest request, AgentEventListener listener) {
        RemoteRun run = new RemoteRun(request, listener);
        executor.execute(run);
        return run::cancel;
    }

    private Map<String, Object> requestBody(RunRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (request.getHistory() != null) {
            for (MessageView message : request.getHistory()) {
                if (message.getRole() == MessageRole.ASSISTANT
                        && (message.getContent() == null || message.getContent().isEmpty())) {
                    continue;
                }
                Map<String, String> entry = new LinkedHashMap<>();
                entry.put("role", message.getRole().wireName());
                entry.put("content", message.getContent());
                messages.add(entry);
            }
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", request.getSessionId());
        body.put("requestId", request.getRequestId());
        body.put("model", request.getModel());
        body.put("messages", messages);
        return body;
    }

    private final class RemoteRun implements Runnable {

        private final RunRequest request;
        private final AgentEventListener listener;
        private volatile boolean cancelled;
        private volatile InputStream body;

        RemoteRun(RunRequest request, AgentEventListener listener) {
            this.request = request;
            this.listener = listener;
        }

        @Override
        public void run() {
            if (cancelled) {
                return;
            }
            String url = agentServiceUrl + "/runs";
            log.info("Calling agent service: sessionId={}, requestId={}, url={}",
                    request.getSessionId(), request.getRequestId(), url);
            try {
                restTemplate.execute(url, HttpMethod.POST,
                        httpRequest -> {
                            httpRequest.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                            httpRequest.getHeaders().setAccept(List.of(NDJSON, MediaType.APPLICATION_JSON));
                            objectMapper.writeValue(httpRequest.getBody(), requestBody(request));
                        },
                        httpResponse -> {
                            body = httpResponse.getBody();
                            readStream(body);
                            return null;
                        });
            } catch (HttpStatusCodeException e) {
                fail(new AgentRunException("Agent service returned " + e.getStatusCode().value(), e));
            } catch (RestClientException e) {
                fail(new AgentRunException("Agent service call failed: " + e.getMessage(), e));
            } catch (AgentRunException e) {
                fail(e);
            }
        }

        private void readStream(InputStream stream) throws IOException {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while (!cancelled && (line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    AgentStreamEvent event = parse(line);
                    if (event != null && dispatch(event)) {
                        return;
                    }
                }
            } catch (IOException e) {
                if (cancelled) {
                    log.debug("Agent stream closed after cancel: requestId={}", request.getRequestId());
                    return;
                }
                throw e;
            }
            if (!cancelled) {
                log.debug("Agent stream ended without terminal event: requestId={}", request.getRequestId());
                listener.onDone();
            }
        }

        private AgentStreamEvent parse(String line) {
            try {
                return objectMapper.readValue(line, AgentStreamEvent.class);
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed agent event: requestId={}, line={}",
                        request.getRequestId(), abbreviate(line));
                return null;
            }
        }

        /**
         * @return true when the event ends the run
         */
        private boolean dispatch(AgentStreamEvent event) {
            String type = event.getType() != null ? event.getType() : "";
            switch (type) {
                case "token", "chat.delta" -> listener.onToken(event.getText());
                case "tool.start" -> listener.onToolStart(event.getToolCallId(), event.getTool(), event.getArgsPreview());
                case "tool.end" -> listener.onToolEnd(event.getToolCallId(), event.getTool(),
                        event.getOk() == null || event.getOk(),
                        event.getDurationMs() != null ? event.getDurationMs() : 0L);
                case "tool.output" -> listener.onToolOutput(event.getToolCallId(), event.getTool(), event.getContent());
                case "system" -> listener.onSystemMessage(event.getContent());
                case "done" -> listener.onDone();
                case "error" -> listener.onError(new AgentRunException(
                        event.getMessage() != null ? event.getMessage() : "Agent error"));
                default -> log.warn("Ignoring unknown agent event: requestId={}, type={}",
                        request.getRequestId(), type);
            }
            return event.isTerminal();
        }

        private void fail(AgentRunException error) {
            if (cancelled) {
                log.debug("Agent call ended after cancel: requestId={}", request.getRequestId());
                return;
            }
            log.error("Agent run failed: sessionId={}, requestId={}",
                    request.getSessionId(), request.getRequestId(), error);
            listener.onError(error);
        }

        /**
         * Never blocks: the stream is closed on the runner executor so a
         * blocked read unwinds there.
         */
        void cancel() {
            cancelled = true;
            InputStream current = body;
            if (current != null) {
                executor.execute(() -> {
                    try {
                        current.close();
                    } catch (IOException e) {
                        log.debug("Closing cancelled agent stream failed: requestId={}", request.getRequestId(), e);
                    }
                });
            }
            log.info("Agent run cancelled: sessionId={}, requestId={}",
                    request.getSessionId(), request.getRequestId());
        }
    }

    private static String abbreviate(String line) {
        return line.length() <= 200 ? line : line.substring(0, 200) + "...";
    }
}
