package com.agentrelay.gateway.link;

import java.util.Objects;

/**
 * State plus consecutive-failure count of a link.
 *
 * @param state   current state
 * @param attempt failures since the last successful connect
 */
public record LinkStatus(ConnectionState state, int attempt) {

    public static final LinkStatus INITIAL = new LinkStatus(ConnectionState.DISCONNECTED, 0);

    public LinkStatus {
        Objects.requireNonNull(state, "state");
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0: " + attempt);
        }
    }
}
