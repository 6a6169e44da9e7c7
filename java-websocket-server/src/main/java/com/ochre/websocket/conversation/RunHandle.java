package com.ochre.websocket.conversation;

@FunctionalInterface
public interface RunHandle {

    /**
     * Asks the runner to stop. Events that still arrive afterwards are
     * ignored by the model.
     */
    void cancel();
}
