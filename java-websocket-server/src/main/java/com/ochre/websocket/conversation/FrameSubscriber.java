package com.ochre.websocket.conversation;

import com.ochre.websocket.protocol.ServerFrame;

/**
 * A live receiver of a session's frames.
 *
 * <p>{@link #deliver(ServerFrame)} is called from the session mailbox and must
 * not block: implementations hand the frame to their own outbound queue.
 */
public interface FrameSubscriber {

    String id();

    void deliver(ServerFrame frame);

    boolean isOpen();
}
