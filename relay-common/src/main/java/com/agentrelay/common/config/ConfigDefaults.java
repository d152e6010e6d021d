package com.agentrelay.common.config;

import java.util.List;

/**
 * Default values applied to fields the config file leaves out.
 */
public final class ConfigDefaults {

    public static final int PORT = 3888;
    public static final String RELAY_URL = "http://localhost:3889";
    public static final long MOCK_INTERVAL_MS = 5_000;
    public static final int BUFFER_CAPACITY = 500;
    public static final long UPSTREAM_BASE_DELAY_MS = 1_000;
    public static final long UPSTREAM_MAX_DELAY_MS = 30_000;
    public static final int UPSTREAM_MAX_ATTEMPTS = 0;
    /** Peer reported the requested stream does not exist. */
    public static final int CLOSE_NOT_FOUND = 4404;
    public static final int CLIENT_SEND_TIME_LIMIT_MS = 10_000;
    public static final int CLIENT_BUFFER_SIZE_LIMIT = 512 * 1024;
    public static final int ATTENTION_WINDOW_MINUTES = 30;
    public static final String DEFAULT_OPERATOR = "user";

    private ConfigDefaults() {
    }

    /**
     * Fill every missing field in place and return the same instance.
     */
    public static DashboardConfig apply(DashboardConfig config) {
        if (config.getPort() == null) {
            config.setPort(PORT);
        }
        if (config.getRelayUrl() == null || config.getRelayUrl().isBlank()) {
            config.setRelayUrl(RELAY_URL);
        }
        if (config.getMock() == null) {
            config.setMock(false);
        }
        if (config.getVerbose() == null) {
            config.setVerbose(false);
        }
        if (config.getMockIntervalMs() == null || config.getMockIntervalMs() <= 0) {
            config.setMockIntervalMs(MOCK_INTERVAL_MS);
        }

        if (config.getBuffer() == null) {
            config.setBuffer(new DashboardConfig.BufferConfig());
        }
        var buffer = config.getBuffer();
        if (buffer.getCapacity() == null || buffer.getCapacity() <= 0) {
            buffer.setCapacity(BUFFER_CAPACITY);
        }

        if (config.getUpstream() == null) {
            config.setUpstream(new DashboardConfig.UpstreamConfig());
        }
        var upstream = config.getUpstream();
        if (upstream.getBaseDelayMs() == null || upstream.getBaseDelayMs() <= 0) {
            upstream.setBaseDelayMs(UPSTREAM_BASE_DELAY_MS);
        }
        if (upstream.getMaxDelayMs() == null || upstream.getMaxDelayMs() < upstream.getBaseDelayMs()) {
            upstream.setMaxDelayMs(Math.max(UPSTREAM_MAX_DELAY_MS, upstream.getBaseDelayMs()));
        }
        if (upstream.getMaxAttempts() == null || upstream.getMaxAttempts() < 0) {
            upstream.setMaxAttempts(UPSTREAM_MAX_ATTEMPTS);
        }
        if (upstream.getTerminalCloseCodes() == null) {
            upstream.setTerminalCloseCodes(List.of(CLOSE_NOT_FOUND));
        }

        if (config.getClients() == null) {
            config.setClients(new DashboardConfig.ClientsConfig());
        }
        var clients = config.getClients();
        if (clients.getSendTimeLimitMs() == null || clients.getSendTimeLimitMs() <= 0) {
            clients.setSendTimeLimitMs(CLIENT_SEND_TIME_LIMIT_MS);
        }
        if (clients.getBufferSizeLimit() == null || clients.getBufferSizeLimit() <= 0) {
            clients.setBufferSizeLimit(CLIENT_BUFFER_SIZE_LIMIT);
        }

        if (config.getAttention() == null) {
            config.setAttention(new DashboardConfig.AttentionConfig());
        }
        var attention = config.getAttention();
        if (attention.getWindowMinutes() == null || attention.getWindowMinutes() <= 0) {
            attention.setWindowMinutes(ATTENTION_WINDOW_MINUTES);
        }
        if (attention.getOperators() == null || attention.getOperators().isEmpty()) {
            attention.setOperators(List.of(DEFAULT_OPERATOR));
        }
        return config;
    }
}
