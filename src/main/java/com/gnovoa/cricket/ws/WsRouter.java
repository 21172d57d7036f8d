package com.gnovoa.cricket.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Groups open sessions by the match they subscribed to. Clients only listen; inbound text is ignored. */
@Component
public final class WsRouter extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WsRouter.class);

    static final String UNKNOWN = "unknown";

    private final ConcurrentHashMap<String, Set<WebSocketSession>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String key = keyOf(session);
        subscribers.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(session);
        log.debug("Session {} subscribed to {}", session.getId(), key);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String key = keyOf(session);
        subscribers.computeIfPresent(key, (k, set) -> {
            set.remove(session);
            return set.isEmpty() ? null : set;
        });
        log.debug("Session {} left {} ({})", session.getId(), key, status);
    }

    public Set<WebSocketSession> forKey(String key) {
        return subscribers.getOrDefault(key, Set.of());
    }

    public static String matchKey(String matchId) {
        return "match:" + matchId;
    }

    private static String keyOf(WebSocketSession session) {
        return routeKey(session.getUri() == null ? "" : session.getUri().getPath());
    }

    /** /ws/matches/{matchId} to match:{matchId}; anything else is {@value #UNKNOWN}. */
    static String routeKey(String path) {
        String[] p = path.split("/");
        if (path.contains("/ws/matches/") && p.length >= 4 && !p[p.length - 1].isBlank()) {
            return matchKey(p[p.length - 1]);
        }
        return UNKNOWN;
    }
}
