package com.agentrelay.app.health;

import com.agentrelay.gateway.link.ConnectionState;
import com.agentrelay.gateway.relay.RelayGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness endpoints. Always answered locally, whatever the upstream state.
 */
@RestController
public class HealthEndpoint {

    public static final String SERVICE_NAME = "relay-dashboard";

    private final RelayGateway gateway;
    private final ObjectMapper mapper;

    public HealthEndpoint(RelayGateway gateway, ObjectMapper mapper) {
        this.gateway = gateway;
        this.mapper = mapper;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("service", SERVICE_NAME);
        node.put("mode", gateway.getMode().wireName());
        long startedAt = gateway.getStartedAt();
        node.put("uptime", startedAt > 0 ? (System.currentTimeMillis() - startedAt) / 1000.0 : 0.0);

        ConnectionState upstream = gateway.getUpstreamState();
        node.put("upstream", upstream != null ? upstream.name().toLowerCase() : "none");
        node.put("clients", gateway.getClientCount());
        node.put("currentId", gateway.currentId());
        return node;
    }

    @GetMapping("/keep-alive")
    public Map<String, Object> keepAlive() {
        return Map.of("ok", true);
    }
}
