package com.agentrelay.gateway.websocket;

import com.agentrelay.gateway.relay.RelayGateway;
import com.agentrelay.gateway.runtime.GatewayRuntimeConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the downstream WebSocket endpoint at {@code /ws}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final RelayGateway relayGateway;
    private final GatewayRuntimeConfig runtimeConfig;

    public WebSocketConfig(RelayGateway relayGateway, GatewayRuntimeConfig runtimeConfig) {
        this.relayGateway = relayGateway;
        this.runtimeConfig = runtimeConfig;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(relayWebSocketHandler(), "/ws")
                .addInterceptors(new ReplayCursorInterceptor())
                .setAllowedOrigins("*");
    }

    @Bean
    public RelayWebSocketHandler relayWebSocketHandler() {
        return new RelayWebSocketHandler(relayGateway,
                runtimeConfig.getClientSendTimeLimitMs(), runtimeConfig.getClientBufferSizeLimit());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(runtimeConfig.getClientBufferSizeLimit());
        container.setMaxBinaryMessageBufferSize(runtimeConfig.getClientBufferSizeLimit());
        container.setMaxSessionIdleTimeout(300_000L); // 5 min
        return container;
    }
}
