package com.ochre.websocket.conversation;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConversationSettings {

    @Builder.Default
    int snapshotLimit = 400;

    @Builder.Default
    int historyLimit = 200;

    @Builder.Default
    int toolOutputPreviewChars = 20_000;

    @Builder.Default
    int seenRequestIdCapacity = 1024;

    @Builder.Default
    String defaultModel = "openai/gpt-4o-mini";
}
