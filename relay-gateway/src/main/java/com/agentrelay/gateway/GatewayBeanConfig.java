package com.agentrelay.gateway;

import com.agentrelay.common.config.ConfigService;
import com.agentrelay.gateway.attention.AttentionTracker;
import com.agentrelay.gateway.buffer.SequencedRingBuffer;
import com.agentrelay.gateway.link.ReconnectingLink;
import com.agentrelay.gateway.mock.MockFrameGenerator;
import com.agentrelay.gateway.protocol.RelayCodec;
import com.agentrelay.gateway.relay.GatewayMode;
import com.agentrelay.gateway.relay.RelayGateway;
import com.agentrelay.gateway.runtime.GatewayRuntimeConfig;
import com.agentrelay.gateway.websocket.WebSocketTransportFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Spring configuration for gateway beans.
 */
@Slf4j
@Configuration
public class GatewayBeanConfig {

    @Value("${relay.config.path:~/.relay-dashboard/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        String resolvedPath = configPath;
        if (resolvedPath.startsWith("~")) {
            resolvedPath = System.getProperty("user.home") + resolvedPath.substring(1);
        }
        return new ConfigService(Path.of(resolvedPath));
    }

    @Bean
    public GatewayRuntimeConfig gatewayRuntimeConfig(ConfigService configService,
            ObjectProvider<LoggingSystem> loggingSystem) {
        GatewayRuntimeConfig runtime = GatewayRuntimeConfig.resolve(configService.loadConfig());
        if (runtime.isVerbose()) {
            loggingSystem.ifAvailable(system -> system.setLogLevel("com.agentrelay", LogLevel.DEBUG));
        }
        return runtime;
    }

    @Bean
    public RelayCodec relayCodec(ObjectMapper objectMapper) {
        return new RelayCodec(objectMapper);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService relayScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public RelayGateway relayGateway(GatewayRuntimeConfig runtime, RelayCodec codec,
            ScheduledExecutorService relayScheduler) {
        SequencedRingBuffer buffer = new SequencedRingBuffer(runtime.getBufferCapacity());
        if (runtime.getMode() == GatewayMode.MOCK) {
            log.info("relay: mock mode, no upstream daemon");
            return RelayGateway.mock(buffer, codec,
                    new MockFrameGenerator(codec, relayScheduler, runtime.getMockIntervalMs()));
        }
        var options = ReconnectingLink.Options.builder()
                .name("upstream")
                .policy(runtime.getUpstreamPolicy())
                .maxAttempts(runtime.getUpstreamMaxAttempts())
                .terminalCloseCodes(runtime.getTerminalCloseCodes())
                .build();
        log.info("relay: proxying {}", runtime.getUpstreamUri());
        return RelayGateway.proxy(buffer, codec, options,
                new WebSocketTransportFactory(runtime.getUpstreamUri(), runtime.getClientBufferSizeLimit()),
                relayScheduler);
    }

    @Bean
    public AttentionTracker attentionTracker(GatewayRuntimeConfig runtime) {
        return new AttentionTracker(runtime.getAttentionWindow(), runtime.getOperators(), Clock.systemUTC());
    }
}
