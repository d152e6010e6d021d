package com.agentrelay.gateway.runtime;

import com.agentrelay.common.config.ConfigDefaults;
import com.agentrelay.common.config.DashboardConfig;
import com.agentrelay.common.infra.Backoff;
import com.agentrelay.gateway.relay.GatewayMode;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Resolved gateway runtime configuration snapshot: mode, upstream endpoint
 * and tuning derived from the loaded {@link DashboardConfig}.
 */
@Getter
@Builder
@Slf4j
public class GatewayRuntimeConfig {

    private final GatewayMode mode;
    private final int port;
    private final String relayUrl;
    private final URI upstreamUri;
    private final boolean verbose;
    private final int bufferCapacity;
    private final Backoff.Policy upstreamPolicy;
    private final int upstreamMaxAttempts;
    private final Set<Integer> terminalCloseCodes;
    private final int clientSendTimeLimitMs;
    private final int clientBufferSizeLimit;
    private final long mockIntervalMs;
    private final Duration attentionWindow;
    private final List<String> operators;

    /**
     * Resolve the runtime configuration; missing fields take their defaults.
     */
    public static GatewayRuntimeConfig resolve(DashboardConfig config) {
        DashboardConfig cfg = ConfigDefaults.apply(config != null ? config : new DashboardConfig());
        var upstream = cfg.getUpstream();

        GatewayRuntimeConfig resolved = GatewayRuntimeConfig.builder()
                .mode(cfg.isMockMode() ? GatewayMode.MOCK : GatewayMode.PROXY)
                .port(cfg.getPort())
                .relayUrl(cfg.getRelayUrl())
                .upstreamUri(cfg.isMockMode() ? null : toWebSocketUri(cfg.getRelayUrl()))
                .verbose(cfg.isVerboseLogging())
                .bufferCapacity(cfg.getBuffer().getCapacity())
                .upstreamPolicy(Backoff.Policy.of(upstream.getBaseDelayMs(), upstream.getMaxDelayMs()))
                .upstreamMaxAttempts(upstream.getMaxAttempts())
                .terminalCloseCodes(Set.copyOf(upstream.getTerminalCloseCodes()))
                .clientSendTimeLimitMs(cfg.getClients().getSendTimeLimitMs())
                .clientBufferSizeLimit(cfg.getClients().getBufferSizeLimit())
                .mockIntervalMs(cfg.getMockIntervalMs())
                .attentionWindow(Duration.ofMinutes(cfg.getAttention().getWindowMinutes()))
                .operators(List.copyOf(cfg.getAttention().getOperators()))
                .build();
        log.debug("runtime: mode={} upstream={} capacity={}", resolved.mode.wireName(),
                resolved.upstreamUri, resolved.bufferCapacity);
        return resolved;
    }

    /**
     * Upstream WebSocket endpoint for a relay daemon base URL:
     * {@code http://host:port/...} becomes {@code ws://host:port/ws},
     * {@code https} becomes {@code wss}.
     *
     * @throws IllegalArgumentException if the URL has no host
     */
    public static URI toWebSocketUri(String relayUrl) {
        URI base;
        try {
            base = new URI(relayUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid relayUrl: " + relayUrl, e);
        }
        if (base.getHost() == null) {
            throw new IllegalArgumentException("relayUrl has no host: " + relayUrl);
        }
        String scheme = base.getScheme() != null ? base.getScheme().toLowerCase() : "http";
        String wsScheme = switch (scheme) {
            case "https", "wss" -> "wss";
            default -> "ws";
        };
        String authority = base.getPort() > 0 ? base.getHost() + ":" + base.getPort() : base.getHost();
        return URI.create(wsScheme + "://" + authority + "/ws");
    }
}
