package com.agentrelay.gateway.buffer;

/**
 * One frame retained by a {@link SequencedRingBuffer}.
 *
 * @param id        sequence id, 1-based and never reused within a buffer
 * @param timestamp push time in epoch milliseconds
 * @param kind      frame type, e.g. {@code "direct_message"}
 * @param payload   frame text exactly as received
 */
public record BufferedRecord(long id, long timestamp, String kind, String payload) {
}
