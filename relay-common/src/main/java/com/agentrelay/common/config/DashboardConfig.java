package com.agentrelay.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for the relay dashboard server.
 */
@Data
public class DashboardConfig {

    /** HTTP/WebSocket listen port. */
    private Integer port;

    /** Relay daemon base URL; the upstream WebSocket is derived from it. */
    private String relayUrl;

    /** Serve synthetic frames instead of proxying to a relay daemon. */
    private Boolean mock;

    /** Log every relayed frame at DEBUG. */
    private Boolean verbose;

    /** Interval between mock snapshot frames. */
    private Long mockIntervalMs;

    private BufferConfig buffer;

    private UpstreamConfig upstream;

    private ClientsConfig clients;

    private AttentionConfig attention;

    // --- Nested config types ---

    @Data
    public static class BufferConfig {
        /** Number of frames retained for replay. */
        private Integer capacity;
    }

    @Data
    public static class UpstreamConfig {
        private Long baseDelayMs;
        private Long maxDelayMs;
        /** 0 means retry forever. */
        private Integer maxAttempts;
        /** Close codes after which the upstream link stops retrying. */
        private List<Integer> terminalCloseCodes;
    }

    @Data
    public static class ClientsConfig {
        private Integer sendTimeLimitMs;
        private Integer bufferSizeLimit;
    }

    @Data
    public static class AttentionConfig {
        private Integer windowMinutes;
        /** Human operator identities that never receive an attention badge. */
        private List<String> operators = new ArrayList<>();
    }

    /**
     * Whether the server runs without a relay daemon.
     */
    public boolean isMockMode() {
        return Boolean.TRUE.equals(mock);
    }

    public boolean isVerboseLogging() {
        return Boolean.TRUE.equals(verbose);
    }
}
