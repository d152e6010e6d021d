package com.agentrelay.gateway.link;

import java.util.concurrent.CompletableFuture;

/**
 * Opens a fresh transport for each connection attempt.
 */
@FunctionalInterface
public interface TransportFactory {

    /**
     * Start establishing a transport. Must not block; completion (or failure)
     * is signalled through the returned future.
     *
     * @param listener receives messages and close/error events of the new
     *                 transport
     */
    CompletableFuture<FrameTransport> open(TransportListener listener);
}
