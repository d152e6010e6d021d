package com.agentrelay.gateway.websocket;

import com.agentrelay.gateway.relay.RelayGateway;
import com.agentrelay.gateway.runtime.WsLogging;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Downstream WebSocket endpoint. Each session becomes a
 * {@link SessionClientLink} attached to the gateway, seeded from the replay
 * cursor captured by {@link ReplayCursorInterceptor}.
 */
@Slf4j
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private final RelayGateway gateway;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final Map<String, SessionClientLink> links = new ConcurrentHashMap<>();

    public RelayWebSocketHandler(RelayGateway gateway, int sendTimeLimitMs, int bufferSizeLimit) {
        this.gateway = gateway;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        SessionClientLink link = new SessionClientLink(session, sendTimeLimitMs, bufferSizeLimit);
        links.put(session.getId(), link);

        Map<String, Object> attrs = session.getAttributes();
        Long lastSeenId = (Long) attrs.get(ReplayCursorInterceptor.ATTR_LAST_SEEN_ID);
        Long since = (Long) attrs.get(ReplayCursorInterceptor.ATTR_SINCE);

        if (since != null) {
            WsLogging.logConnect(session, "since=" + since);
            gateway.attachClientSince(link, since);
        } else {
            WsLogging.logConnect(session, lastSeenId != null ? "lastSeenId=" + lastSeenId : null);
            gateway.attachClient(link, lastSeenId);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        SessionClientLink link = links.get(session.getId());
        if (link == null) {
            return;
        }
        WsLogging.logFrame("in", session.getId(), message.getPayloadLength());
        gateway.onClientFrame(link, message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        WsLogging.logError(session, exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        SessionClientLink link = links.remove(session.getId());
        if (link != null) {
            gateway.detachClient(link);
        }
        WsLogging.logDisconnect(session, status);
    }
}
