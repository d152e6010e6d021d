package com.agentrelay.gateway.runtime;

import com.agentrelay.common.config.DashboardConfig;
import com.agentrelay.common.infra.Backoff;
import com.agentrelay.gateway.relay.GatewayMode;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GatewayRuntimeConfigTest {

    @Nested
    class Resolve {
        @Test
        void emptyConfig_usesDefaults() {
            var runtime = GatewayRuntimeConfig.resolve(new DashboardConfig());
            assertEquals(GatewayMode.PROXY, runtime.getMode());
            assertEquals(3888, runtime.getPort());
            assertEquals(URI.create("ws://localhost:3889/ws"), runtime.getUpstreamUri());
            assertEquals(500, runtime.getBufferCapacity());
            assertEquals(Backoff.Policy.of(1_000, 30_000), runtime.getUpstreamPolicy());
            assertEquals(0, runtime.getUpstreamMaxAttempts());
            assertEquals(Set.of(4404), runtime.getTerminalCloseCodes());
            assertEquals(Duration.ofMinutes(30), runtime.getAttentionWindow());
            assertEquals(List.of("user"), runtime.getOperators());
            assertEquals(5_000, runtime.getMockIntervalMs());
            assertFalse(runtime.isVerbose());
        }

        @Test
        void nullConfig_usesDefaults() {
            assertEquals(GatewayMode.PROXY, GatewayRuntimeConfig.resolve(null).getMode());
        }

        @Test
        void mockMode_hasNoUpstream() {
            var config = new DashboardConfig();
            config.setMock(true);
            var runtime = GatewayRuntimeConfig.resolve(config);
            assertEquals(GatewayMode.MOCK, runtime.getMode());
            assertNull(runtime.getUpstreamUri());
        }

        @Test
        void customUpstreamTuning() {
            var config = new DashboardConfig();
            var upstream = new DashboardConfig.UpstreamConfig();
            upstream.setBaseDelayMs(500L);
            upstream.setMaxDelayMs(15_000L);
            upstream.setMaxAttempts(5);
            upstream.setTerminalCloseCodes(List.of(4404, 4401));
            config.setUpstream(upstream);

            var runtime = GatewayRuntimeConfig.resolve(config);
            assertEquals(Backoff.Policy.FAST, runtime.getUpstreamPolicy());
            assertEquals(5, runtime.getUpstreamMaxAttempts());
            assertEquals(Set.of(4404, 4401), runtime.getTerminalCloseCodes());
        }
    }

    @Nested
    class WebSocketUri {
        @Test
        void httpBecomesWs() {
            assertEquals(URI.create("ws://relay.local:3889/ws"),
                    GatewayRuntimeConfig.toWebSocketUri("http://relay.local:3889"));
        }

        @Test
        void httpsBecomesWss_andPathIsReplaced() {
            assertEquals(URI.create("wss://relay.example.com/ws"),
                    GatewayRuntimeConfig.toWebSocketUri("https://relay.example.com/api/v1"));
        }

        @Test
        void missingHost_rejected() {
            assertThrows(IllegalArgumentException.class, () -> GatewayRuntimeConfig.toWebSocketUri("not a url"));
            assertThrows(IllegalArgumentException.class, () -> GatewayRuntimeConfig.toWebSocketUri("localhost"));
        }
    }
}
