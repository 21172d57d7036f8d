package com.gnovoa.cricket.out;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.cricket.events.MatchEvent;
import com.gnovoa.cricket.ws.WsRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@Component
public final class WebSocketEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventPublisher.class);

    private final WsRouter router;
    private final ObjectMapper mapper;

    public WebSocketEventPublisher(WsRouter router, ObjectMapper mapper) {
        this.router = router;
        this.mapper = mapper;
    }

    @Override
    public void publish(MatchEvent event) {
        var subscribers = router.forKey(WsRouter.matchKey(event.matchId()));
        if (subscribers.isEmpty()) return;
        try {
            String json = mapper.writeValueAsString(event);
            TextMessage msg = new TextMessage(json);
            log.debug("Publishing {} for match {} to {} sessions", event.type(), event.matchId(), subscribers.size());

            for (WebSocketSession s : subscribers) {
                // a session is not thread-safe for sends; one ticker thread per match shares it
                synchronized (s) {
                    if (s.isOpen()) s.sendMessage(msg);
                }
            }
        } catch (Exception e) {
            log.error("Failed to publish {} for match {}", event.type(), event.matchId(), e);
        }
    }
}
