package com.agentrelay.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Health, catch-up and attention endpoints against a mock-mode gateway.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class RestEndpointsIntegrationTest {

    @TempDir
    static Path configDir;

    @DynamicPropertySource
    static void mockConfig(DynamicPropertyRegistry registry) {
        Path config = configDir.resolve("config.json");
        try {
            Files.writeString(config, "{\"mock\": true, \"mockIntervalMs\": 600000, "
                    + "\"attention\": {\"operators\": [\"user\", \"ops\"]}}");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        registry.add("relay.config.path", config::toString);
    }

    @Autowired
    private TestRestTemplate rest;

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode get(String path) throws Exception {
        ResponseEntity<String> response = rest.getForEntity(path, String.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return mapper.readTree(response.getBody());
    }

    @Test
    void health_reportsMockMode() throws Exception {
        JsonNode health = get("/health");
        assertEquals("ok", health.get("status").asText());
        assertEquals("relay-dashboard", health.get("service").asText());
        assertEquals("mock", health.get("mode").asText());
        assertEquals("none", health.get("upstream").asText());
        assertTrue(health.get("uptime").asDouble() >= 0);
    }

    @Test
    void keepAlive() throws Exception {
        assertTrue(get("/keep-alive").get("ok").asBoolean());
    }

    @Test
    void replay_bySequenceAndTimestamp() throws Exception {
        long deadline = System.currentTimeMillis() + 5_000;
        while (get("/api/replay").get("currentId").asLong() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        JsonNode all = get("/api/replay?sinceId=0");
        assertEquals(1, all.get("frames").size());
        assertEquals("snapshot", all.get("frames").get(0).get("kind").asText());

        assertEquals(0, get("/api/replay?sinceId=1").get("frames").size());
        assertEquals(1, get("/api/replay?since=0").get("frames").size());
        assertEquals(0, get("/api/replay?since=" + Long.MAX_VALUE).get("frames").size());
    }

    @Test
    void replay_rejectsNonNumericCursor() {
        ResponseEntity<String> response = rest.getForEntity("/api/replay?sinceId=abc", String.class);
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void attention_flagsUnansweredAgentsOnly() throws Exception {
        Instant now = Instant.now();
        String body = "["
                + "{\"from\":\"user\",\"to\":\"agent1\",\"timestamp\":\"" + now.minusSeconds(300) + "\"},"
                + "{\"from\":\"agent2\",\"to\":\"ops\",\"timestamp\":\"" + now.minusSeconds(200) + "\"},"
                + "{\"from\":\"user\",\"to\":\"*\",\"timestamp\":\"" + now.minusSeconds(100) + "\"},"
                + "{\"from\":\"user\",\"to\":\"agent3\",\"timestamp\":\"garbage\"}"
                + "]";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<String> response = rest.postForEntity("/api/attention",
                new HttpEntity<>(body, headers), String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        JsonNode result = mapper.readTree(response.getBody()).get("needsAttention");
        assertEquals(1, result.size());
        assertEquals("agent1", result.get(0).asText());
    }
}
