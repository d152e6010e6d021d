package com.agentrelay.gateway.runtime;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.net.InetSocketAddress;

/**
 * WebSocket connection logging for downstream clients.
 */
@Slf4j
public final class WsLogging {

    private WsLogging() {
    }

    public static void logConnect(WebSocketSession session, String cursor) {
        log.info("ws connect: conn={} remote={} cursor={}", session.getId(), resolveRemoteAddr(session),
                cursor != null ? cursor : "none");
    }

    public static void logDisconnect(WebSocketSession session, CloseStatus status) {
        log.info("ws disconnect: conn={} remote={} code={} reason={}",
                session.getId(), resolveRemoteAddr(session), status.getCode(),
                status.getReason() != null ? status.getReason() : "normal");
    }

    public static void logError(WebSocketSession session, Throwable error) {
        log.warn("ws error: conn={} error={}", session.getId(), error.getMessage());
    }

    public static void logFrame(String direction, String connId, int length) {
        log.debug("ws:{} conn={} bytes={}", direction, connId, length);
    }

    private static String resolveRemoteAddr(WebSocketSession session) {
        InetSocketAddress remoteAddr = session.getRemoteAddress();
        if (remoteAddr != null && remoteAddr.getAddress() != null) {
            return remoteAddr.getAddress().getHostAddress() + ":" + remoteAddr.getPort();
        }
        return "unknown";
    }
}
