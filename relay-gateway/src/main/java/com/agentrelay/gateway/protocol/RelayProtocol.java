package com.agentrelay.gateway.protocol;

import com.agentrelay.gateway.buffer.BufferedRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Relay WebSocket protocol types.
 *
 * <p>
 * All frames are JSON text objects discriminated by {@code type}:
 * <ul>
 * <li>{@code relay.frame} – gateway→client, one sequenced upstream frame</li>
 * <li>{@code replay} – client→gateway catch-up request, and the gateway's reply</li>
 * <li>{@code ping}/{@code pong}, {@code subscribe}, {@code snapshot} – mock mode</li>
 * </ul>
 * <p>
 * {@code pong} and the {@code snapshot} sent in answer to {@code subscribe}
 * are control frames: addressed to one client, never sequenced, never
 * replayed. Periodic mock snapshots are ordinary upstream frames and arrive
 * wrapped in {@code relay.frame} like any other.
 */
public final class RelayProtocol {

    private RelayProtocol() {
    }

    public static final String TYPE_RELAY_FRAME = "relay.frame";
    public static final String TYPE_REPLAY = "replay";
    public static final String TYPE_PING = "ping";
    public static final String TYPE_PONG = "pong";
    public static final String TYPE_SUBSCRIBE = "subscribe";
    public static final String TYPE_SNAPSHOT = "snapshot";

    /**
     * Whether a gateway→client frame of this type is an unsequenced control frame.
     */
    public static boolean isControlType(String type) {
        return TYPE_PONG.equals(type) || TYPE_SNAPSHOT.equals(type);
    }

    /** Kind recorded for upstream frames without a {@code type}. */
    public static final String DEFAULT_KIND = "message";

    /** Query parameter carrying the last sequence id a client has seen. */
    public static final String PARAM_LAST_SEEN_ID = "lastSeenId";
    /** Query parameter carrying an epoch-millis replay cursor. */
    public static final String PARAM_SINCE = "since";

    // ── Relay Frame ──────────────────────────────────────────────

    /** Gateway → client: {type:"relay.frame", seq, ts, kind, payload} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RelayFrame {
        private String type = TYPE_RELAY_FRAME;
        private long seq;
        private long ts;
        private String kind;
        /** Original upstream frame text. */
        private String payload;

        public static RelayFrame of(BufferedRecord record) {
            return new RelayFrame(TYPE_RELAY_FRAME, record.id(), record.timestamp(),
                    record.kind(), record.payload());
        }

        public static List<RelayFrame> of(List<BufferedRecord> records) {
            List<RelayFrame> frames = new ArrayList<>(records.size());
            for (BufferedRecord record : records) {
                frames.add(of(record));
            }
            return frames;
        }
    }

    // ── Replay ───────────────────────────────────────────────────

    /**
     * Client → gateway: {type:"replay", sinceId?, sinceTimestamp?}.
     * {@code sinceId} wins when both are present; neither means "everything
     * still buffered".
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReplayRequest {
        private String type = TYPE_REPLAY;
        private Long sinceId;
        private Long sinceTimestamp;

        public static ReplayRequest sinceId(long sinceId) {
            return new ReplayRequest(TYPE_REPLAY, sinceId, null);
        }

        public static ReplayRequest sinceTimestamp(long sinceTimestamp) {
            return new ReplayRequest(TYPE_REPLAY, null, sinceTimestamp);
        }
    }

    /** Gateway → client: {type:"replay", currentId, frames:[...]} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReplayResponse {
        private String type = TYPE_REPLAY;
        private long currentId;
        private List<RelayFrame> frames;

        public static ReplayResponse of(long currentId, List<BufferedRecord> records) {
            return new ReplayResponse(TYPE_REPLAY, currentId, RelayFrame.of(records));
        }
    }

    // ── Mock ─────────────────────────────────────────────────────

    /** {type:"pong"} */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pong {
        private String type = TYPE_PONG;

        public static Pong create() {
            return new Pong(TYPE_PONG);
        }
    }
}
