package com.agentrelay.gateway.relay;

import com.agentrelay.gateway.link.ConnectionState;

import java.io.IOException;

/**
 * Gateway-side view of one attached downstream client.
 */
public interface ClientLink {

    /** Stable identifier, unique among attached clients. */
    String getId();

    /** Only {@code CONNECTED} clients receive fan-out. */
    ConnectionState getState();

    void send(String frame) throws IOException;
}
