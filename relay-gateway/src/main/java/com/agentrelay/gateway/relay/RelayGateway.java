package com.agentrelay.gateway.relay;

import com.agentrelay.gateway.buffer.BufferedRecord;
import com.agentrelay.gateway.buffer.SequencedRingBuffer;
import com.agentrelay.gateway.link.ConnectionState;
import com.agentrelay.gateway.link.LinkListener;
import com.agentrelay.gateway.link.ReconnectingLink;
import com.agentrelay.gateway.link.TransportFactory;
import com.agentrelay.gateway.mock.MockFrameGenerator;
import com.agentrelay.gateway.protocol.RelayCodec;
import com.agentrelay.gateway.protocol.RelayProtocol;
import com.agentrelay.gateway.protocol.RelayProtocol.ReplayRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pumps frames between one upstream source and any number of downstream
 * clients, sequencing every upstream frame through a
 * {@link SequencedRingBuffer} so clients can catch up after reconnecting.
 * <p>
 * The buffer, the client set and all client sends are owned by a single
 * actor thread. Public operations enqueue work on it and return a future
 * that completes once the work has run; attach seeding and live fan-out
 * therefore never interleave, so a client sees each id at most once and in
 * order within one attach session.
 * <p>
 * Upstream loss never closes clients, and a failing client never affects
 * upstream or its peers.
 */
@Slf4j
public class RelayGateway {

    private final String name;
    private final GatewayMode mode;
    private final SequencedRingBuffer buffer;
    private final RelayCodec codec;
    private final ReconnectingLink upstream;
    private final MockFrameGenerator mockGenerator;
    private final ExecutorService actor;

    /** Actor-owned. */
    private final Map<String, ClientLink> clients = new LinkedHashMap<>();
    private final AtomicInteger clientCount = new AtomicInteger();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private volatile long startedAt;

    private RelayGateway(String name, GatewayMode mode, SequencedRingBuffer buffer, RelayCodec codec,
            ReconnectingLink.Options upstreamOptions, TransportFactory upstreamFactory,
            ScheduledExecutorService scheduler, MockFrameGenerator mockGenerator) {
        this.name = name;
        this.mode = mode;
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.upstream = mode == GatewayMode.PROXY
                ? new ReconnectingLink(upstreamOptions, upstreamFactory, scheduler, new UpstreamListener())
                : null;
        this.mockGenerator = mockGenerator;
        this.actor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name + "-actor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Gateway relaying one upstream daemon reached through {@code upstreamFactory}.
     */
    public static RelayGateway proxy(SequencedRingBuffer buffer, RelayCodec codec,
            ReconnectingLink.Options upstreamOptions, TransportFactory upstreamFactory,
            ScheduledExecutorService scheduler) {
        Objects.requireNonNull(upstreamOptions, "upstreamOptions");
        Objects.requireNonNull(upstreamFactory, "upstreamFactory");
        Objects.requireNonNull(scheduler, "scheduler");
        return new RelayGateway("relay", GatewayMode.PROXY, buffer, codec,
                upstreamOptions, upstreamFactory, scheduler, null);
    }

    /**
     * Gateway serving generated fixture frames instead of an upstream.
     */
    public static RelayGateway mock(SequencedRingBuffer buffer, RelayCodec codec, MockFrameGenerator generator) {
        Objects.requireNonNull(generator, "generator");
        return new RelayGateway("relay-mock", GatewayMode.MOCK, buffer, codec, null, null, null, generator);
    }

    // --- Lifecycle ---

    public void start() {
        if (stopped.get() || !started.compareAndSet(false, true)) {
            return;
        }
        startedAt = System.currentTimeMillis();
        log.info("relay: starting mode={} capacity={}", mode.wireName(), buffer.capacity());
        if (mode == GatewayMode.PROXY) {
            upstream.start();
        } else {
            mockGenerator.start(this::onUpstreamFrame);
        }
    }

    /**
     * Stop the upstream leg and the actor. Idempotent; attached client
     * transports are left to their owner.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (upstream != null) {
            upstream.stop();
        }
        if (mockGenerator != null) {
            mockGenerator.stop();
        }
        submit("stop", () -> {
            clients.clear();
            clientCount.set(0);
        });
        actor.shutdown();
        log.info("relay: stopped mode={} currentId={}", mode.wireName(), buffer.currentId());
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    // --- Clients ---

    /**
     * Register a client and seed it with every retained frame after
     * {@code lastSeenId} ({@code null} means from the start of the buffer).
     */
    public CompletableFuture<Void> attachClient(ClientLink client, Long lastSeenId) {
        Objects.requireNonNull(client, "client");
        return submit("attach", () -> {
            long since = lastSeenId != null ? lastSeenId : 0L;
            register(client, buffer.getAfter(since), "lastSeenId=" + since);
        });
    }

    /**
     * Register a client and seed it with frames buffered after the given
     * epoch-millis timestamp.
     */
    public CompletableFuture<Void> attachClientSince(ClientLink client, long sinceTimestamp) {
        Objects.requireNonNull(client, "client");
        return submit("attach", () -> register(client, buffer.getAfterTimestamp(sinceTimestamp),
                "since=" + sinceTimestamp));
    }

    public CompletableFuture<Void> detachClient(ClientLink client) {
        Objects.requireNonNull(client, "client");
        return submit("detach", () -> {
            if (clients.remove(client.getId()) != null) {
                clientCount.set(clients.size());
                log.debug("relay: detached client={} clients={}", client.getId(), clients.size());
            }
        });
    }

    /**
     * Handle a frame sent by a client.
     */
    public CompletableFuture<Void> onClientFrame(ClientLink client, String frame) {
        Objects.requireNonNull(client, "client");
        return submit("client-frame", () -> handleClientFrame(client, frame));
    }

    // --- Upstream ---

    /**
     * Sequence an upstream frame and fan it out. Malformed frames are dropped
     * without consuming an id.
     */
    public CompletableFuture<Void> onUpstreamFrame(String frame) {
        return submit("upstream-frame", () -> ingest(frame));
    }

    // --- Observation ---

    public GatewayMode getMode() {
        return mode;
    }

    /**
     * State of the upstream link, or {@code null} in mock mode.
     */
    public ConnectionState getUpstreamState() {
        return upstream != null ? upstream.getState() : null;
    }

    public int getClientCount() {
        return clientCount.get();
    }

    public long currentId() {
        return buffer.currentId();
    }

    public SequencedRingBuffer getBuffer() {
        return buffer;
    }

    /**
     * Epoch millis of {@link #start()}, or 0 if never started.
     */
    public long getStartedAt() {
        return startedAt;
    }

    // --- Actor internals ---

    private void register(ClientLink client, List<BufferedRecord> seed, String cursor) {
        clients.put(client.getId(), client);
        clientCount.set(clients.size());
        for (BufferedRecord record : seed) {
            sendTo(client, codec.encodeRecord(record));
        }
        log.debug("relay: attached client={} {} seeded={} clients={}",
                client.getId(), cursor, seed.size(), clients.size());
    }

    private void ingest(String frame) {
        JsonNode node;
        try {
            node = codec.readFrame(frame);
        } catch (JsonProcessingException e) {
            log.warn("relay: dropped malformed upstream frame: {}", e.getOriginalMessage());
            return;
        }
        BufferedRecord record = buffer.append(RelayCodec.kindOf(node), frame);
        String envelope = codec.encodeRecord(record);
        int delivered = 0;
        for (ClientLink client : new ArrayList<>(clients.values())) {
            if (client.getState() != ConnectionState.CONNECTED) {
                continue;
            }
            if (sendTo(client, envelope)) {
                delivered++;
            }
        }
        log.trace("relay: seq={} kind={} delivered={}", record.id(), record.kind(), delivered);
    }

    private void handleClientFrame(ClientLink client, String frame) {
        JsonNode node;
        try {
            node = codec.readFrame(frame);
            if (RelayProtocol.TYPE_REPLAY.equals(RelayCodec.typeOf(node))) {
                replay(client, codec.readReplayRequest(node));
                return;
            }
        } catch (JsonProcessingException e) {
            log.warn("relay: dropped malformed frame from client={}: {}", client.getId(), e.getOriginalMessage());
            return;
        }

        String type = RelayCodec.typeOf(node);
        if (mode == GatewayMode.MOCK) {
            if (RelayProtocol.TYPE_PING.equals(type)) {
                sendTo(client, codec.encodePong());
            } else if (RelayProtocol.TYPE_SUBSCRIBE.equals(type)) {
                sendTo(client, mockGenerator.snapshot());
            } else {
                log.debug("relay: mock ignoring type={} from client={}", type, client.getId());
            }
            return;
        }

        if (!upstream.send(frame)) {
            log.warn("relay: upstream {}, dropped frame type={} from client={}",
                    upstream.getState(), type, client.getId());
        }
    }

    private void replay(ClientLink client, ReplayRequest request) {
        List<BufferedRecord> records;
        if (request.getSinceId() != null) {
            records = buffer.getAfter(request.getSinceId());
        } else if (request.getSinceTimestamp() != null) {
            records = buffer.getAfterTimestamp(request.getSinceTimestamp());
        } else {
            records = buffer.getAfter(0);
        }
        sendTo(client, codec.encodeReplay(buffer.currentId(), records));
        log.debug("relay: replay client={} sinceId={} since={} frames={}",
                client.getId(), request.getSinceId(), request.getSinceTimestamp(), records.size());
    }

    private boolean sendTo(ClientLink client, String frame) {
        try {
            client.send(frame);
            return true;
        } catch (IOException e) {
            log.warn("relay: send failed client={}: {}", client.getId(), e.getMessage());
            return false;
        }
    }

    private CompletableFuture<Void> submit(String operation, Runnable task) {
        try {
            return CompletableFuture.runAsync(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("relay: {} failed: {}", operation, e.getMessage(), e);
                    throw e;
                }
            }, actor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("gateway stopped", e));
        }
    }

    private final class UpstreamListener implements LinkListener {

        @Override
        public void onStateChange(ConnectionState from, ConnectionState to) {
            log.info("relay: upstream {} -> {}", from, to);
        }

        @Override
        public void onFrame(String frame) {
            onUpstreamFrame(frame);
        }
    }
}
