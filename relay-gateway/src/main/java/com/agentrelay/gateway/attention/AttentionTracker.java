package com.agentrelay.gateway.attention;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides which participants owe a reply.
 * <p>
 * A participant needs attention when, in some conversation, the newest
 * message addressed to them is strictly newer than anything they sent there
 * and is no older than the trailing window. A conversation is a thread when
 * the message has one, otherwise the unordered pair of participants.
 * Broadcasts never create attention; a broadcast counts as its sender
 * speaking in its thread, or in all of the sender's direct conversations
 * when unthreaded. Operator identities are never reported.
 * <p>
 * Stateless apart from configuration: the answer is recomputed from the full
 * message list, in any order.
 */
@Slf4j
public class AttentionTracker {

    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(30);
    public static final String DEFAULT_OPERATOR = "user";

    private final Duration window;
    private final Set<String> operators;
    private final Clock clock;

    public AttentionTracker() {
        this(DEFAULT_WINDOW, Set.of(DEFAULT_OPERATOR), Clock.systemUTC());
    }

    public AttentionTracker(Duration window, Collection<String> operators, Clock clock) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("window must be non-negative: " + window);
        }
        this.window = window;
        this.operators = operators != null ? Set.copyOf(operators) : Set.of();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Set<String> computeNeedsAttention(List<DirectedMessage> messages) {
        return computeNeedsAttention(messages, clock.instant());
    }

    public Set<String> computeNeedsAttention(List<DirectedMessage> messages, Instant now) {
        if (messages == null || messages.isEmpty()) {
            return Set.of();
        }
        Map<String, Map<String, Activity>> conversations = new HashMap<>();
        Map<String, Set<String>> directKeys = new HashMap<>();
        List<Parsed> broadcasts = new ArrayList<>();

        for (DirectedMessage message : messages) {
            Parsed parsed = parse(message);
            if (parsed == null) {
                continue;
            }
            if (message.broadcast()) {
                broadcasts.add(parsed);
                continue;
            }
            String key = conversationKey(message);
            Map<String, Activity> participants = conversations.computeIfAbsent(key, k -> new HashMap<>());
            participants.computeIfAbsent(message.from(), p -> new Activity()).sent(parsed.at);
            participants.computeIfAbsent(message.to(), p -> new Activity()).received(parsed.at);
            if (!message.threadedMessage()) {
                directKeys.computeIfAbsent(message.from(), p -> new LinkedHashSet<>()).add(key);
                directKeys.computeIfAbsent(message.to(), p -> new LinkedHashSet<>()).add(key);
            }
        }

        for (Parsed parsed : broadcasts) {
            DirectedMessage message = parsed.message;
            if (message.threadedMessage()) {
                conversations.computeIfAbsent(conversationKey(message), k -> new HashMap<>())
                        .computeIfAbsent(message.from(), p -> new Activity()).sent(parsed.at);
            } else {
                for (String key : directKeys.getOrDefault(message.from(), Set.of())) {
                    conversations.get(key).get(message.from()).sent(parsed.at);
                }
            }
        }

        Instant cutoff = now.minus(window);
        Set<String> result = new TreeSet<>();
        for (Map<String, Activity> participants : conversations.values()) {
            participants.forEach((participant, activity) -> {
                if (!operators.contains(participant) && activity.awaitsReply(cutoff)) {
                    result.add(participant);
                }
            });
        }
        return Collections.unmodifiableSet(result);
    }

    private static String conversationKey(DirectedMessage message) {
        if (message.threadedMessage()) {
            return "thread:" + message.thread();
        }
        String a = message.from();
        String b = message.to();
        return a.compareTo(b) <= 0 ? "pair:" + a + "\n" + b : "pair:" + b + "\n" + a;
    }

    private static Parsed parse(DirectedMessage message) {
        if (message == null || isBlank(message.from()) || isBlank(message.to())) {
            log.debug("attention: skipping message without sender or recipient: {}", message);
            return null;
        }
        if (message.timestamp() == null) {
            log.debug("attention: skipping message without timestamp from={}", message.from());
            return null;
        }
        Instant at = parseTimestamp(message.timestamp());
        if (at == null) {
            log.debug("attention: skipping message with bad timestamp from={} ts={}",
                    message.from(), message.timestamp());
            return null;
        }
        return new Parsed(message, at);
    }

    /**
     * ISO-8601 instant, with or without a zone offset; a local date-time is
     * read as UTC.
     */
    static Instant parseTimestamp(String timestamp) {
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(timestamp).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Parsed(DirectedMessage message, Instant at) {
    }

    /** Newest sent and received instants of one participant in one conversation. */
    private static final class Activity {
        private Instant lastSent;
        private Instant lastInbound;

        void sent(Instant at) {
            if (lastSent == null || at.isAfter(lastSent)) {
                lastSent = at;
            }
        }

        void received(Instant at) {
            if (lastInbound == null || at.isAfter(lastInbound)) {
                lastInbound = at;
            }
        }

        boolean awaitsReply(Instant cutoff) {
            return lastInbound != null
                    && (lastSent == null || lastInbound.isAfter(lastSent))
                    && !lastInbound.isBefore(cutoff);
        }
    }
}
