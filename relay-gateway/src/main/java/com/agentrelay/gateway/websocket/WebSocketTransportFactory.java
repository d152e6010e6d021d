package com.agentrelay.gateway.websocket;

import com.agentrelay.gateway.link.FrameTransport;
import com.agentrelay.gateway.link.TransportFactory;
import com.agentrelay.gateway.link.TransportListener;
import jakarta.websocket.ContainerProvider;
import jakarta.websocket.WebSocketContainer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens upstream WebSocket connections with Spring's
 * {@link StandardWebSocketClient}.
 */
@Slf4j
public class WebSocketTransportFactory implements TransportFactory {

    private static final int SEND_TIME_LIMIT_MS = 10_000;

    private final StandardWebSocketClient client;
    private final URI uri;
    private final int maxMessageBytes;

    public WebSocketTransportFactory(URI uri, int maxMessageBytes) {
        WebSocketContainer container = ContainerProvider.getWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize(maxMessageBytes);
        this.client = new StandardWebSocketClient(container);
        this.uri = uri;
        this.maxMessageBytes = maxMessageBytes;
    }

    @Override
    public CompletableFuture<FrameTransport> open(TransportListener listener) {
        log.debug("ws:out:connect uri={}", uri);
        return client.execute(new UpstreamHandler(listener), new WebSocketHttpHeaders(), uri)
                .thenApply(session -> new SessionTransport(session, maxMessageBytes));
    }

    private static final class UpstreamHandler extends TextWebSocketHandler {

        private final TransportListener listener;

        UpstreamHandler(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClosed(status.getCode(), status.getReason());
        }
    }

    private static final class SessionTransport implements FrameTransport {

        private final WebSocketSession session;
        private final ConcurrentWebSocketSessionDecorator sender;

        SessionTransport(WebSocketSession session, int bufferSizeLimit) {
            this.session = session;
            this.sender = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, bufferSizeLimit);
        }

        @Override
        public void send(String frame) throws IOException {
            try {
                sender.sendMessage(new TextMessage(frame));
            } catch (SessionLimitExceededException e) {
                throw new IOException("upstream send limit exceeded: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("ws:out:close failed conn={}: {}", session.getId(), e.getMessage());
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
