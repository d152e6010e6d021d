package com.agentrelay.gateway.mock;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canned fleet data served in mock mode so the dashboard runs without an
 * upstream daemon. Timestamps are relative to the supplied instant.
 */
public final class MockFixtures {

    private MockFixtures() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Agent(String name, String status, String cli, String currentTask,
            String lastActive, int messageCount, String projectPath) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Message(String id, String from, String to, String content, String timestamp,
            String thread, @JsonProperty("isBroadcast") Boolean isBroadcast) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Session(String id, String agentName, String cli, String startedAt, String endedAt,
            int messageCount, @JsonProperty("isActive") boolean isActive, String closedBy) {
    }

    public static List<Agent> agents(Instant now) {
        return List.of(
                new Agent("claude-1", "online", "claude-code", "Implementing user authentication",
                        ago(now, 60_000), 42, "/Users/dev/projects/webapp"),
                new Agent("architect", "busy", "claude-code", "Designing API schema",
                        ago(now, 30_000), 28, "/Users/dev/projects/api-service"),
                new Agent("reviewer", "online", "claude-code", "Reviewing pull requests",
                        ago(now, 120_000), 15, "/Users/dev/projects/webapp"),
                new Agent("tester", "offline", "claude-code", null,
                        ago(now, 3_600_000), 8, "/Users/dev/projects/webapp"));
    }

    public static List<Message> messages(Instant now) {
        return List.of(
                new Message("msg-001", "user", "claude-1",
                        "Please implement user authentication with JWT tokens",
                        ago(now, 300_000), null, null),
                new Message("msg-002", "claude-1", "user",
                        "I'll implement JWT authentication. Let me start by creating the auth middleware.",
                        ago(now, 295_000), "msg-001", null),
                new Message("msg-003", "claude-1", "architect",
                        "What's the preferred token expiration time for the JWT implementation?",
                        ago(now, 290_000), null, null),
                new Message("msg-004", "architect", "claude-1",
                        "Use 15 minutes for access tokens and 7 days for refresh tokens.",
                        ago(now, 280_000), "msg-003", null),
                new Message("msg-004b", "claude-1", "architect",
                        "Got it, implementing with those values. Will add refresh token rotation too.",
                        ago(now, 270_000), "msg-003", null),
                new Message("msg-005", "reviewer", "*",
                        "PR #42 has been reviewed. Ready for merge.",
                        ago(now, 200_000), null, true));
    }

    public static List<Session> sessions(Instant now) {
        return List.of(
                new Session("session-001", "claude-1", "claude-code", ago(now, 7_200_000), null, 42, true, null),
                new Session("session-002", "architect", "claude-code", ago(now, 3_600_000), null, 28, true, null),
                new Session("session-003", "reviewer", "claude-code", ago(now, 1_800_000), null, 15, true, null),
                new Session("session-004", "tester", "claude-code", ago(now, 86_400_000),
                        ago(now, 82_800_000), 8, false, "agent"));
    }

    /**
     * Full snapshot frame body: {type:"snapshot", agents, messages, sessions}.
     */
    public static Map<String, Object> snapshot(Instant now) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("type", "snapshot");
        snapshot.put("agents", agents(now));
        snapshot.put("messages", messages(now));
        snapshot.put("sessions", sessions(now));
        return snapshot;
    }

    private static String ago(Instant now, long millis) {
        return now.minusMillis(millis).toString();
    }
}
