package com.agentrelay.gateway.attention;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One message between fleet participants, as far as attention tracking is
 * concerned.
 *
 * @param from        sender
 * @param to          recipient, or {@code *} for a broadcast
 * @param timestamp   ISO-8601 instant
 * @param thread      thread id, or {@code null} for a direct conversation
 * @param isBroadcast explicit broadcast flag
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DirectedMessage(String from, String to, String timestamp, String thread,
        @JsonProperty("isBroadcast") Boolean isBroadcast) {

    public static final String BROADCAST_TARGET = "*";

    public static DirectedMessage direct(String from, String to, Instant at) {
        return new DirectedMessage(from, to, at.toString(), null, null);
    }

    public static DirectedMessage threaded(String from, String to, Instant at, String thread) {
        return new DirectedMessage(from, to, at.toString(), thread, null);
    }

    public static DirectedMessage broadcastFrom(String from, Instant at) {
        return new DirectedMessage(from, BROADCAST_TARGET, at.toString(), null, true);
    }

    public boolean broadcast() {
        return Boolean.TRUE.equals(isBroadcast) || BROADCAST_TARGET.equals(to);
    }

    public boolean threadedMessage() {
        return thread != null && !thread.isEmpty();
    }
}
