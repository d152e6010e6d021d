package com.agentrelay.app.config;

import com.agentrelay.gateway.runtime.GatewayRuntimeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.ServerProperties;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.stereotype.Component;

/**
 * Listens on the configured dashboard port ({@code PORT} or the config file)
 * unless {@code server.port} is set explicitly.
 */
@Slf4j
@Component
public class ServerPortCustomizer implements WebServerFactoryCustomizer<ConfigurableWebServerFactory> {

    private final GatewayRuntimeConfig runtimeConfig;
    private final ServerProperties serverProperties;

    public ServerPortCustomizer(GatewayRuntimeConfig runtimeConfig, ServerProperties serverProperties) {
        this.runtimeConfig = runtimeConfig;
        this.serverProperties = serverProperties;
    }

    @Override
    public void customize(ConfigurableWebServerFactory factory) {
        if (serverProperties.getPort() != null) {
            return;
        }
        factory.setPort(runtimeConfig.getPort());
        log.info("server: port {} from dashboard config", runtimeConfig.getPort());
    }
}
