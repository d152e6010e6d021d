package com.agentrelay.gateway.link;

/**
 * Observer of a {@link ReconnectingLink}. Callbacks run on whichever thread
 * drove the link and must not block.
 */
public interface LinkListener {

    default void onStateChange(ConnectionState from, ConnectionState to) {
    }

    default void onFrame(String frame) {
    }

    /**
     * @param attempt 0-based attempt index the delay was computed for
     * @param delayMs jittered delay before the next connect
     */
    default void onRetryScheduled(int attempt, long delayMs) {
    }

    LinkListener NONE = new LinkListener() {
    };
}
