package com.agentrelay.gateway.mock;

import com.agentrelay.gateway.protocol.RelayCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class MockFrameGeneratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void snapshot_containsFixtures() throws Exception {
        var generator = new MockFrameGenerator(new RelayCodec(mapper), scheduler, 5_000,
                Clock.fixed(NOW, ZoneOffset.UTC));
        JsonNode snapshot = mapper.readTree(generator.snapshot());

        assertEquals("snapshot", snapshot.get("type").asText());
        assertEquals(4, snapshot.get("agents").size());
        assertEquals(4, snapshot.get("sessions").size());
        assertEquals("2026-03-01T11:59:00Z", snapshot.get("agents").get(0).get("lastActive").asText());
        JsonNode broadcast = snapshot.get("messages").get(5);
        assertTrue(broadcast.get("isBroadcast").asBoolean());
        assertFalse(snapshot.get("messages").get(0).has("thread"));
        assertTrue(snapshot.get("sessions").get(0).get("isActive").asBoolean());
    }

    @Test
    void start_publishesImmediatelyAndRepeatedly() throws Exception {
        var generator = new MockFrameGenerator(new RelayCodec(mapper), scheduler, 20);
        List<String> frames = new CopyOnWriteArrayList<>();
        generator.start(frames::add);
        generator.start(frames::add);

        long deadline = System.currentTimeMillis() + 5_000;
        while (frames.size() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        generator.stop();
        assertTrue(frames.size() >= 3);
        assertFalse(generator.isRunning());
    }

    @Test
    void nonPositiveInterval_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new MockFrameGenerator(new RelayCodec(mapper), scheduler, 0));
    }
}
