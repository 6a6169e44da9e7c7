package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.FrameCodec;
import com.ochre.websocket.protocol.MessageRole;
import com.ochre.websocket.protocol.RunStatus;
import com.ochre.websocket.protocol.ServerFrame;
import com.ochre.websocket.protocol.ServerFrameType;
import com.ochre.websocket.protocol.payload.ChatCancelledPayload;
import com.ochre.websocket.protocol.payload.ChatDeltaPayload;
import com.ochre.websocket.protocol.payload.ChatErrorPayload;
import com.ochre.websocket.protocol.payload.ChatStartedPayload;
import com.ochre.websocket.protocol.payload.ToolOutputPayload;
import com.ochre.websocket.protocol.payload.ToolStartPayload;
import com.ochre.websocket.protocol.view.ConversationView;
import com.ochre.websocket.protocol.view.MessageView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConversationModelTest {

    private static final String SESSION = "s1";

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final FrameCodec codec = new FrameCodec();

    private InMemoryTranscriptStore store;
    private FakeAgentRunner runner;
    private RecordingSubscriber subscriber;
    private ConversationModel model;

    @BeforeEach
    void setUp() {
        store = new InMemoryTranscriptStore();
        runner = new FakeAgentRunner();
        subscriber = new RecordingSubscriber("sub-1");
        model = newModel(ConversationSettings.builder().toolOutputPreviewChars(10).build());
        model.subscribe(subscriber);
    }

    private ConversationModel newModel(ConversationSettings settings) {
        return new ConversationModel(SESSION, store, runner, codec, settings, List.of(),
                new SerialExecutor("test", Runnable::run), clock);
    }

    private SubmitOutcome submit(String requestId, String text) {
        return model.submit(requestId, text, null).join();
    }

    @Test
    void tokensAccumulateInMemoryAndAreWrittenOnceAtDone() {
        SubmitOutcome outcome = submit("R1", "hello");
        AgentEventListener events = runner.listener("R1");

        events.onToken("Hi");
        events.onToken(" there");

        MessageView open = store.rows(MessageRole.ASSISTANT).get(0);
        assertEquals("", open.getContent());
        assertEquals(true, open.getMeta().get(MessageView.META_STREAMING));
        assertEquals(0, store.getUpdateCount());

        events.onDone();

        MessageView flushed = store.rows(MessageRole.ASSISTANT).get(0);
        assertEquals("Hi there", flushed.getContent());
        assertEquals(false, flushed.getMeta().get(MessageView.META_STREAMING));
        assertEquals(1, store.getUpdateCount());
        assertEquals(List.of(
                ServerFrameType.CHAT_STARTED,
                ServerFrameType.SEGMENT_STARTED,
                ServerFrameType.CHAT_DELTA,
                ServerFrameType.CHAT_DELTA,
                ServerFrameType.CHAT_DONE), subscriber.types());
        assertEquals(RunStatus.DONE, outcome.getCompletion().join());
        assertFalse(model.isRunning());
    }

    @Test
    void chatStartedCarriesTheUserMessageId() {
        submit("R1", "hello");

        MessageView user = store.rows(MessageRole.USER).get(0);
        assertEquals("hello", user.getContent());
        assertEquals("R1", user.getRequestId());
        ChatStartedPayload started = codec.payload(subscriber.frames().get(0), ChatStartedPayload.class);
        assertEquals(user.getId(), started.getMessageId());
    }

    @Test
    void deltasReferenceTheSegmentRow() {
        submit("R1", "hello");
        runner.listener("R1").onToken("Hi");

        String rowId = store.rows(MessageRole.ASSISTANT).get(0).getId();
        ChatDeltaPayload delta = codec.payload(subscriber.last(), ChatDeltaPayload.class);
        assertEquals("Hi", delta.getText());
        assertEquals(rowId, delta.getMessageId());
    }

    @Test
    void toolStartSplitsAssistantTextIntoTwoRows() {
        submit("R1", "find it");
        AgentEventListener events = runner.listener("R1");

        events.onToken("A");
        events.onToolStart("c1", "search", "q");
        events.onToolEnd("c1", "search", true, 5);
        events.onToken("B");
        events.onDone();

        List<MessageView> rows = store.rows();
        assertEquals(5, rows.size());
        assertEquals(MessageRole.USER, rows.get(0).getRole());
        assertEquals("A", rows.get(1).getContent());
        assertEquals("▶ search q", rows.get(2).getContent());
        assertEquals("■ search ok (5ms)", rows.get(3).getContent());
        assertEquals("B", rows.get(4).getContent());
        assertEquals(MessageRole.ASSISTANT, rows.get(4).getRole());
        assertNotEquals(rows.get(1).getId(), rows.get(4).getId());

        ServerFrame toolStart = subscriber.frames().stream()
                .filter(frame -> frame.getType() == ServerFrameType.TOOL_START)
                .findFirst()
                .orElseThrow();
        ToolStartPayload payload = codec.payload(toolStart, ToolStartPayload.class);
        assertEquals("c1", payload.getToolCallId());
        assertEquals(rows.get(2).getId(), payload.getMessageId());
    }

    @Test
    void atMostOneAssistantRowIsStreamingAtAnyTime() {
        submit("R1", "go");
        AgentEventListener events = runner.listener("R1");

        events.onToken("one");
        assertEquals(1, streamingRows());
        events.onToolStart("c1", "ls", "");
        assertEquals(0, streamingRows());
        events.onToken("two");
        assertEquals(1, streamingRows());
        events.onDone();
        assertEquals(0, streamingRows());
    }

    private long streamingRows() {
        return store.rows(MessageRole.ASSISTANT).stream()
                .filter(row -> Boolean.TRUE.equals(row.getMeta().get(MessageView.META_STREAMING)))
                .count();
    }

    @Test
    void systemMessageDoesNotCloseTheOpenSegment() {
        submit("R1", "go");
        AgentEventListener events = runner.listener("R1");

        events.onToken("a");
        events.onSystemMessage("note");
        events.onToken("b");
        events.onDone();

        List<MessageView> assistant = store.rows(MessageRole.ASSISTANT);
        assertEquals(1, assistant.size());
        assertEquals("ab", assistant.get(0).getContent());
        assertEquals("note", store.rows(MessageRole.SYSTEM).get(0).getContent());
    }

    @Test
    void resubmittingARunningRequestIsANoOp() {
        SubmitOutcome first = submit("R1", "hello");
        SubmitOutcome second = submit("R1", "hello");

        assertEquals(SubmitOutcome.Kind.STARTED, first.getKind());
        assertEquals(SubmitOutcome.Kind.ALREADY_RUNNING, second.getKind());
        assertEquals(1, store.rows(MessageRole.USER).size());
        assertEquals(1, runner.startCount());
        assertSame(first.getCompletion(), second.getCompletion());
    }

    @Test
    void replayOfAFinishedRequestOnlyReacknowledges() {
        submit("R1", "hello");
        runner.listener("R1").onDone();
        subscriber.clear();

        SubmitOutcome replay = submit("R1", "hello");

        assertEquals(SubmitOutcome.Kind.DUPLICATE, replay.getKind());
        assertEquals(RunStatus.DONE, replay.getCompletion().join());
        assertEquals(1, store.rows(MessageRole.USER).size());
        assertEquals(1, runner.startCount());
        assertEquals(List.of(ServerFrameType.CHAT_STARTED), subscriber.types());
        ChatStartedPayload ack = codec.payload(subscriber.last(), ChatStartedPayload.class);
        assertEquals(Boolean.TRUE, ack.getReplay());
        assertNull(ack.getMessageId());
    }

    @Test
    void seenRequestIdsAreRestoredFromPersistedRows() {
        store.append(SESSION, MessageRole.USER, "earlier", Map.of(MessageView.META_REQUEST_ID, "R1"));
        store.append(SESSION, MessageRole.USER, "failed one", Map.of(MessageView.META_REQUEST_ID, "R2"));
        store.append(SESSION, MessageRole.SYSTEM, "Chat error: x",
                Map.of(MessageView.META_REQUEST_ID, "R2", ConversationModel.META_TYPE, "error"));
        ConversationModel restored = newModel(ConversationSettings.builder().build());

        SubmitOutcome first = restored.submit("R1", "earlier", null).join();
        SubmitOutcome second = restored.submit("R2", "failed one", null).join();

        assertEquals(SubmitOutcome.Kind.DUPLICATE, first.getKind());
        assertEquals(RunStatus.DONE, first.getCompletion().join());
        assertEquals(RunStatus.ERROR, second.getCompletion().join());
        assertEquals(0, runner.startCount());
        assertEquals(2, store.rows(MessageRole.USER).size());
    }

    @Test
    void blankSubmissionIsIgnored() {
        SubmitOutcome outcome = submit("R1", "   ");

        assertEquals(SubmitOutcome.Kind.IGNORED_EMPTY, outcome.getKind());
        assertTrue(store.rows().isEmpty());
        assertTrue(subscriber.frames().isEmpty());
        assertEquals(0, runner.startCount());
    }

    @Test
    void snapshotOverlaysTheUnflushedBuffer() {
        submit("R1", "hello");
        runner.listener("R1").onToken("par");
        runner.listener("R1").onToken("tial");

        ConversationView view = model.snapshot().join();

        assertEquals(SESSION, view.getSessionId());
        assertEquals(2, view.getMessages().size());
        assertEquals("", view.getMessages().get(1).getContent());
        assertNotNull(view.getActiveRun());
        assertEquals("R1", view.getActiveRun().getRequestId());
        assertEquals(RunStatus.RUNNING, view.getActiveRun().getStatus());
        assertEquals(view.getMessages().get(1).getId(), view.getOverlays().getAssistant().getMessageId());
        assertEquals("partial", view.getOverlays().getAssistant().getContent());
        assertEquals(subscriber.last().getSeq(), view.getLastSeq());
    }

    @Test
    void snapshotAfterRunHasNoActiveRunOrOverlay() {
        submit("R1", "hello");
        runner.listener("R1").onToken("done text");
        runner.listener("R1").onDone();

        ConversationView view = model.snapshot().join();

        assertNull(view.getActiveRun());
        assertNull(view.getOverlays());
        assertEquals("done text", view.getMessages().get(1).getContent());
    }

    @Test
    void sendSnapshotGoesToOneSubscriberWithoutSeq() {
        RecordingSubscriber other = new RecordingSubscriber("sub-2");
        model.subscribe(other);
        submit("R1", "hello");
        other.clear();
        subscriber.clear();

        model.sendSnapshot(other).join();

        assertTrue(subscriber.frames().isEmpty());
        assertEquals(ServerFrameType.SNAPSHOT, other.last().getType());
        assertNull(other.last().getSeq());
        assertEquals(1L, codec.payload(other.last(), ConversationView.class).getLastSeq());
    }

    @Test
    void errorFlushesPartialTextThenRecordsSystemRow() {
        SubmitOutcome outcome = submit("R1", "hello");
        runner.listener("R1").onToken("half");

        runner.listener("R1").onError(new AgentRunException("boom"));

        MessageView assistant = store.rows(MessageRole.ASSISTANT).get(0);
        assertEquals("half", assistant.getContent());
        assertEquals(true, assistant.getMeta().get("error"));
        assertEquals(false, assistant.getMeta().get(MessageView.META_STREAMING));
        assertEquals("Chat error: boom", store.rows(MessageRole.SYSTEM).get(0).getContent());

        List<ServerFrameType> types = subscriber.types();
        assertEquals(ServerFrameType.SYSTEM_MESSAGE, types.get(types.size() - 2));
        assertEquals(ServerFrameType.CHAT_ERROR, types.get(types.size() - 1));
        assertEquals("boom", codec.payload(subscriber.last(), ChatErrorPayload.class).getMessage());
        assertEquals(RunStatus.ERROR, outcome.getCompletion().join());
        assertFalse(model.isRunning());
    }

    @Test
    void cancelFlushesAndStopsTheRunner() {
        SubmitOutcome outcome = submit("R1", "hello");
        runner.listener("R1").onToken("x");

        assertTrue(model.cancel("user").join());

        assertTrue(runner.isCancelled("R1"));
        MessageView assistant = store.rows(MessageRole.ASSISTANT).get(0);
        assertEquals("x", assistant.getContent());
        assertEquals(true, assistant.getMeta().get("cancelled"));
        assertEquals("Generation cancelled.", store.rows(MessageRole.SYSTEM).get(0).getContent());
        assertEquals(ServerFrameType.CHAT_CANCELLED, subscriber.last().getType());
        assertEquals("user", codec.payload(subscriber.last(), ChatCancelledPayload.class).getReason());
        assertEquals(RunStatus.CANCELLED, outcome.getCompletion().join());
    }

    @Test
    void cancelWhileIdleDoesNothing() {
        assertFalse(model.cancel("user").join());
        assertTrue(subscriber.frames().isEmpty());
    }

    @Test
    void newRequestSupersedesTheRunningOne() {
        submit("R1", "first");
        runner.listener("R1").onToken("a");

        SubmitOutcome second = submit("R2", "second");

        assertEquals(SubmitOutcome.Kind.STARTED, second.getKind());
        assertTrue(runner.isCancelled("R1"));
        assertEquals(2, runner.startCount());
        assertEquals("Generation cancelled (new user message).",
                store.rows(MessageRole.SYSTEM).get(0).getContent());

        ServerFrame cancelled = subscriber.frames().stream()
                .filter(frame -> frame.getType() == ServerFrameType.CHAT_CANCELLED)
                .findFirst()
                .orElseThrow();
        assertEquals("R1", cancelled.getRequestId());
        assertEquals("new_message", codec.payload(cancelled, ChatCancelledPayload.class).getReason());
        assertEquals("R2", subscriber.last().getRequestId());
        assertEquals(ServerFrameType.CHAT_STARTED, subscriber.last().getType());
    }

    @Test
    void eventsFromASupersededRunAreIgnored() {
        submit("R1", "first");
        submit("R2", "second");
        int framesBefore = subscriber.frames().size();
        int rowsBefore = store.rows().size();

        runner.listener("R1").onToken("late");
        runner.listener("R1").onToolStart("c9", "ls", "/");
        runner.listener("R1").onDone();

        assertEquals(framesBefore, subscriber.frames().size());
        assertEquals(rowsBefore, store.rows().size());
        assertTrue(model.isRunning());
    }

    @Test
    void toolOutputIsStoredInFullButPreviewedTruncated() {
        submit("R1", "read");
        String output = "0123456789abcdefghijklmno";

        runner.listener("R1").onToolOutput("c1", "cat", output);

        assertEquals(output, store.rows(MessageRole.TOOL).get(0).getContent());
        ToolOutputPayload preview = codec.payload(subscriber.last(), ToolOutputPayload.class);
        assertEquals(Boolean.TRUE, preview.getTruncated());
        assertEquals("0123456789\n... (truncated, 15 chars omitted)", preview.getContent());
    }

    @Test
    void flushFailureIsLoggedAndTheRunStillFinishes() {
        SubmitOutcome outcome = submit("R1", "hello");
        runner.listener("R1").onToken("lost");
        store.setFailUpdates(true);

        runner.listener("R1").onDone();

        assertEquals(ServerFrameType.CHAT_DONE, subscriber.last().getType());
        assertEquals(RunStatus.DONE, outcome.getCompletion().join());
        assertFalse(model.isRunning());
    }

    @Test
    void runnerThatFailsToStartEndsTheRunWithError() {
        runner.failOnStart(new AgentRunException("unreachable"));

        SubmitOutcome outcome = submit("R1", "hello");

        assertEquals(RunStatus.ERROR, outcome.getCompletion().join());
        assertEquals("Chat error: unreachable", store.rows(MessageRole.SYSTEM).get(0).getContent());
        assertEquals(List.of(
                ServerFrameType.CHAT_STARTED,
                ServerFrameType.SYSTEM_MESSAGE,
                ServerFrameType.CHAT_ERROR), subscriber.types());
    }

    @Test
    void runRequestCarriesHistoryAndDefaultModel() {
        submit("R1", "hello");

        RunRequest request = runner.lastRequest();
        assertEquals(SESSION, request.getSessionId());
        assertEquals("R1", request.getRequestId());
        assertEquals(ConversationSettings.builder().build().getDefaultModel(), request.getModel());
        assertEquals("hello", request.getHistory().get(request.getHistory().size() - 1).getContent());
    }

    @Test
    void seqIncreasesByOnePerBroadcastFrame() {
        submit("R1", "hello");
        runner.listener("R1").onToken("a");
        runner.listener("R1").onDone();

        List<ServerFrame> frames = subscriber.frames();
        for (int i = 0; i < frames.size(); i++) {
            assertEquals(i + 1L, frames.get(i).getSeq());
        }
    }

    @Test
    void failingSubscriberIsDroppedWithoutAffectingTheRun() {
        RecordingSubscriber broken = new RecordingSubscriber("broken");
        model.subscribe(broken);
        broken.failDeliveries();

        submit("R1", "hello");

        assertEquals(1, model.subscriberCount());
        assertEquals(ServerFrameType.CHAT_STARTED, subscriber.last().getType());
        assertTrue(model.isRunning());
    }

    @Test
    void runKeepsGoingWithZeroSubscribers() {
        Subscription subscription = model.subscribe(new RecordingSubscriber("sub-2"));
        subscription.cancel();
        model.unsubscribe(subscriber);

        submit("R1", "hello");
        runner.listener("R1").onToken("still written");
        runner.listener("R1").onDone();

        assertEquals("still written", store.rows(MessageRole.ASSISTANT).get(0).getContent());
    }

    @Test
    void idleOnlyWithoutSubscribersOrRunningRun() {
        Instant now = clock.instant();
        assertFalse(model.isIdle(now, Duration.ZERO));

        model.unsubscribe(subscriber);
        assertTrue(model.isIdle(now, Duration.ZERO));
        assertFalse(model.isIdle(now, Duration.ofMinutes(1)));

        submit("R1", "hello");
        assertFalse(model.isIdle(now, Duration.ZERO));
    }
}
