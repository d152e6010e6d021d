package com.agentrelay.app;

import com.agentrelay.gateway.relay.RelayGateway;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the downstream WebSocket endpoint, with the gateway
 * in mock mode. The mock interval is long, so the only buffered frame is the
 * snapshot published at startup.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class WebSocketIntegrationTest {

    @TempDir
    static Path configDir;

    @DynamicPropertySource
    static void mockConfig(DynamicPropertyRegistry registry) {
        Path config = configDir.resolve("config.json");
        try {
            Files.writeString(config, "{\"mock\": true, \"mockIntervalMs\": 600000}");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        registry.add("relay.config.path", config::toString);
    }

    @LocalServerPort
    private int port;

    @Autowired
    private RelayGateway gateway;

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<WebSocketSession> sessions = new ArrayList<>();

    @BeforeEach
    void awaitStartupSnapshot() throws Exception {
        long deadline = System.currentTimeMillis() + 5_000;
        while (gateway.currentId() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, gateway.currentId());
    }

    @AfterEach
    void disconnect() throws Exception {
        for (WebSocketSession session : sessions) {
            if (session.isOpen()) {
                session.close();
            }
        }
    }

    private WebSocketSession connect(String query, ArrayBlockingQueue<String> messages) throws Exception {
        jakarta.websocket.WebSocketContainer container = jakarta.websocket.ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(256 * 1024);
        StandardWebSocketClient client = new StandardWebSocketClient(container);
        URI uri = URI.create("ws://127.0.0.1:" + port + "/ws" + query);

        WebSocketSession session = client.execute(new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(WebSocketSession s, TextMessage message) {
                messages.add(message.getPayload());
            }
        }, new WebSocketHttpHeaders(), uri).get(5, TimeUnit.SECONDS);
        sessions.add(session);
        assertTrue(session.isOpen());
        return session;
    }

    private JsonNode next(ArrayBlockingQueue<String> messages) throws Exception {
        String message = messages.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "Expected a frame");
        return mapper.readTree(message);
    }

    @Test
    void freshClient_isSeededWithBufferedSnapshot() throws Exception {
        var messages = new ArrayBlockingQueue<String>(20);
        connect("", messages);

        JsonNode frame = next(messages);
        assertEquals("relay.frame", frame.get("type").asText());
        assertEquals(1, frame.get("seq").asLong());
        assertEquals("snapshot", frame.get("kind").asText());
        JsonNode payload = mapper.readTree(frame.get("payload").asText());
        assertEquals(4, payload.get("agents").size());
    }

    @Test
    void ping_isAnsweredWithPong() throws Exception {
        var messages = new ArrayBlockingQueue<String>(20);
        WebSocketSession session = connect("?lastSeenId=1", messages);

        session.sendMessage(new TextMessage("{\"type\":\"ping\"}"));

        assertEquals("pong", next(messages).get("type").asText());
    }

    @Test
    void subscribe_sendsFreshSnapshot() throws Exception {
        var messages = new ArrayBlockingQueue<String>(20);
        WebSocketSession session = connect("?lastSeenId=1", messages);

        session.sendMessage(new TextMessage("{\"type\":\"subscribe\"}"));

        JsonNode snapshot = next(messages);
        assertEquals("snapshot", snapshot.get("type").asText());
        assertEquals(6, snapshot.get("messages").size());
    }

    @Test
    void replayRequest_returnsMissedFrames() throws Exception {
        var messages = new ArrayBlockingQueue<String>(20);
        WebSocketSession session = connect("?lastSeenId=1", messages);

        session.sendMessage(new TextMessage("{\"type\":\"replay\",\"sinceId\":0}"));

        JsonNode reply = next(messages);
        assertEquals("replay", reply.get("type").asText());
        assertEquals(1, reply.get("currentId").asLong());
        assertEquals(1, reply.get("frames").size());
        assertEquals(1, reply.get("frames").get(0).get("seq").asLong());
    }

    @Test
    void malformedFrame_keepsConnectionOpen() throws Exception {
        var messages = new ArrayBlockingQueue<String>(20);
        WebSocketSession session = connect("?lastSeenId=1", messages);

        session.sendMessage(new TextMessage("{not json"));
        session.sendMessage(new TextMessage("{\"type\":\"ping\"}"));

        assertEquals("pong", next(messages).get("type").asText());
        assertTrue(session.isOpen());
    }
}
