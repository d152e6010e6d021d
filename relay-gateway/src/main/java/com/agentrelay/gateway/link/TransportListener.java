package com.agentrelay.gateway.link;

/**
 * Events emitted by a {@link FrameTransport} after it has been opened.
 */
public interface TransportListener {

    void onMessage(String frame);

    void onClosed(int code, String reason);

    void onError(Throwable error);
}
