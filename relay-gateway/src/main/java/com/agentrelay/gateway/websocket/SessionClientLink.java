package com.agentrelay.gateway.websocket;

import com.agentrelay.gateway.link.ConnectionState;
import com.agentrelay.gateway.relay.ClientLink;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link ClientLink} over a server-side WebSocket session. Sends are bounded
 * by a time and buffer limit; a client that exceeds either is closed.
 */
public class SessionClientLink implements ClientLink {

    private final WebSocketSession session;
    private final ConcurrentWebSocketSessionDecorator sender;

    public SessionClientLink(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = session;
        this.sender = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public ConnectionState getState() {
        return session.isOpen() ? ConnectionState.CONNECTED : ConnectionState.DISCONNECTED;
    }

    @Override
    public void send(String frame) throws IOException {
        try {
            sender.sendMessage(new TextMessage(frame));
        } catch (SessionLimitExceededException e) {
            throw new IOException("client send limit exceeded: " + e.getMessage(), e);
        }
    }
}
