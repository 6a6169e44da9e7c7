package com.ochre.websocket.client;

/**
 * Why a queued send was discarded before it reached the server.
 */
public enum DropReason {
    /** Older than the queue TTL. */
    EXPIRED,
    /** Evicted as the oldest entry of a full queue. */
    OVERFLOW
}
