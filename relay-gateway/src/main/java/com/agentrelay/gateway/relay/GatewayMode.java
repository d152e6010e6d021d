package com.agentrelay.gateway.relay;

/**
 * Where a {@link RelayGateway} gets its frames from.
 */
public enum GatewayMode {
    /** One upstream daemon link. */
    PROXY,
    /** Synthetic fixture frames, no upstream. */
    MOCK;

    public String wireName() {
        return name().toLowerCase();
    }
}
