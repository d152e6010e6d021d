package com.agentrelay.gateway.relay;

import com.agentrelay.gateway.link.ConnectionState;
import com.agentrelay.gateway.link.LinkListener;
import com.agentrelay.gateway.link.ReconnectingLink;
import com.agentrelay.gateway.link.TransportFactory;
import com.agentrelay.gateway.protocol.RelayCodec;
import com.agentrelay.gateway.protocol.RelayProtocol;
import com.agentrelay.gateway.protocol.RelayProtocol.RelayFrame;
import com.agentrelay.gateway.protocol.RelayProtocol.ReplayRequest;
import com.agentrelay.gateway.protocol.RelayProtocol.ReplayResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Downstream consumer of a {@link RelayGateway}.
 * <p>
 * Rides a {@link ReconnectingLink}; after every (re)connect it asks the
 * gateway to replay everything after the last sequence id it delivered, and
 * it delivers each id at most once and in increasing order across
 * reconnects. Frames evicted from the gateway buffer while disconnected are
 * lost.
 * <p>
 * A replay reply whose {@code currentId} is below the last delivered id means
 * the gateway restarted with a fresh sequence. The client then resets its
 * cursor, asks for everything the new gateway retains, and holds live frames
 * until that reply arrives.
 * <p>
 * Unsequenced control frames ({@code pong}, the {@code snapshot} answering
 * {@code subscribe}) go to the optional control sink.
 */
@Slf4j
public class RelayClient {

    private final ReconnectingLink link;
    private final RelayCodec codec;
    private final Consumer<RelayFrame> sink;
    private final Consumer<String> controlSink;
    private long lastSeenId;
    private boolean resyncing;
    private final List<RelayFrame> heldDuringResync = new ArrayList<>();

    public RelayClient(ReconnectingLink.Options options, TransportFactory factory,
            ScheduledExecutorService scheduler, RelayCodec codec, Consumer<RelayFrame> sink) {
        this(options, factory, scheduler, codec, sink, null);
    }

    public RelayClient(ReconnectingLink.Options options, TransportFactory factory,
            ScheduledExecutorService scheduler, RelayCodec codec, Consumer<RelayFrame> sink,
            Consumer<String> controlSink) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.controlSink = controlSink != null ? controlSink : frame -> {
        };
        this.link = new ReconnectingLink(options, factory, scheduler, new Listener());
    }

    public void start() {
        link.start();
    }

    public void stop() {
        link.stop();
    }

    /**
     * Reconnect immediately, e.g. after the host comes back from sleep.
     */
    public void resume() {
        link.resume();
    }

    public boolean send(String frame) {
        return link.send(frame);
    }

    public ConnectionState getState() {
        return link.getState();
    }

    public synchronized long getLastSeenId() {
        return lastSeenId;
    }

    private synchronized void onLiveFrame(RelayFrame frame) {
        if (resyncing) {
            heldDuringResync.add(frame);
            return;
        }
        deliver(frame);
    }

    private synchronized void onReplay(ReplayResponse replay) {
        List<RelayFrame> frames = replay.getFrames() != null ? replay.getFrames() : List.of();
        if (resyncing) {
            resyncing = false;
            frames.forEach(this::deliver);
            heldDuringResync.forEach(this::deliver);
            heldDuringResync.clear();
        } else if (replay.getCurrentId() < lastSeenId) {
            log.warn("client:{} gateway sequence restarted (currentId={} < lastSeenId={}), resyncing",
                    link.getName(), replay.getCurrentId(), lastSeenId);
            lastSeenId = 0;
            resyncing = true;
            if (!link.send(codec.encodeReplayRequest(ReplayRequest.sinceId(0)))) {
                resyncing = false;
            }
            return;
        } else {
            frames.forEach(this::deliver);
        }
        log.debug("client:{} replay currentId={} lastSeenId={}", link.getName(), replay.getCurrentId(), lastSeenId);
    }

    private synchronized void resetResync() {
        resyncing = false;
        heldDuringResync.clear();
    }

    // Called with the monitor held.
    private void deliver(RelayFrame frame) {
        if (frame.getSeq() <= lastSeenId) {
            return;
        }
        lastSeenId = frame.getSeq();
        try {
            sink.accept(frame);
        } catch (RuntimeException e) {
            log.warn("client:{} sink failed at seq={}: {}", link.getName(), frame.getSeq(), e.getMessage(), e);
        }
    }

    private void handle(String text) {
        try {
            JsonNode node = codec.readFrame(text);
            String type = RelayCodec.typeOf(node);
            if (RelayProtocol.TYPE_RELAY_FRAME.equals(type)) {
                onLiveFrame(codec.readRelayFrame(node));
            } else if (RelayProtocol.TYPE_REPLAY.equals(type)) {
                onReplay(codec.readReplayResponse(node));
            } else if (RelayProtocol.isControlType(type)) {
                controlSink.accept(text);
            } else {
                log.debug("client:{} ignoring type={}", link.getName(), type);
            }
        } catch (JsonProcessingException e) {
            log.warn("client:{} dropped malformed frame: {}", link.getName(), e.getOriginalMessage());
        }
    }

    private final class Listener implements LinkListener {

        @Override
        public void onStateChange(ConnectionState from, ConnectionState to) {
            if (to == ConnectionState.CONNECTED) {
                resetResync();
                link.send(codec.encodeReplayRequest(ReplayRequest.sinceId(getLastSeenId())));
            }
        }

        @Override
        public void onFrame(String frame) {
            handle(frame);
        }
    }
}
