package com.agentrelay.gateway.link;

import java.io.IOException;

/**
 * An established duplex text channel.
 */
public interface FrameTransport {

    void send(String frame) throws IOException;

    /**
     * Close the channel; safe to call more than once.
     */
    void close();

    boolean isOpen();
}
