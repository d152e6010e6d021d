package com.agentrelay.gateway.link;

/**
 * Lifecycle of one logical connection owned by a {@link ReconnectingLink}.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
