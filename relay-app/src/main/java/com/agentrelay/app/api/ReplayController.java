package com.agentrelay.app.api;

import com.agentrelay.gateway.buffer.BufferedRecord;
import com.agentrelay.gateway.buffer.SequencedRingBuffer;
import com.agentrelay.gateway.protocol.RelayProtocol.ReplayResponse;
import com.agentrelay.gateway.relay.RelayGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP catch-up for clients that poll instead of holding a WebSocket.
 * Same semantics as the {@code replay} frame: {@code sinceId} wins over
 * {@code since}; neither returns everything retained.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class ReplayController {

    private final RelayGateway gateway;

    public ReplayController(RelayGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/replay")
    public ReplayResponse replay(@RequestParam(required = false) Long sinceId,
            @RequestParam(required = false) Long since) {
        SequencedRingBuffer buffer = gateway.getBuffer();
        long currentId = buffer.currentId();
        List<BufferedRecord> records;
        if (sinceId != null) {
            records = buffer.getAfter(sinceId);
        } else if (since != null) {
            records = buffer.getAfterTimestamp(since);
        } else {
            records = buffer.getAfter(0);
        }
        log.debug("api: replay sinceId={} since={} frames={}", sinceId, since, records.size());
        return ReplayResponse.of(Math.max(currentId, lastId(records)), records);
    }

    private static long lastId(List<BufferedRecord> records) {
        return records.isEmpty() ? 0 : records.get(records.size() - 1).id();
    }
}
