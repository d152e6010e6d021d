package com.agentrelay.gateway.websocket;

import com.agentrelay.gateway.protocol.RelayProtocol;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Captures the replay cursor from the handshake query
 * ({@code ?lastSeenId=N} or {@code ?since=epochMillis}) into session
 * attributes. Unparsable values are ignored and the client is seeded from the
 * start of the buffer.
 */
@Slf4j
public class ReplayCursorInterceptor implements HandshakeInterceptor {

    public static final String ATTR_LAST_SEEN_ID = "relay.lastSeenId";
    public static final String ATTR_SINCE = "relay.since";

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @NonNull Map<String, Object> attributes) {
        captureCursor(request.getURI(), attributes);
        return true;
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request,
            @NonNull ServerHttpResponse response,
            @NonNull WebSocketHandler wsHandler,
            @Nullable Exception exception) {
        // no-op
    }

    static void captureCursor(URI uri, Map<String, Object> attributes) {
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        Long lastSeenId = parse(params.getFirst(RelayProtocol.PARAM_LAST_SEEN_ID));
        Long since = parse(params.getFirst(RelayProtocol.PARAM_SINCE));
        if (lastSeenId != null) {
            attributes.put(ATTR_LAST_SEEN_ID, lastSeenId);
        } else if (since != null) {
            attributes.put(ATTR_SINCE, since);
        }
    }

    private static Long parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed >= 0 ? parsed : null;
        } catch (NumberFormatException e) {
            log.debug("ws: ignoring bad replay cursor '{}'", value);
            return null;
        }
    }
}
