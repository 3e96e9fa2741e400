package com.sessiongate.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sessiongate.dispatch.Broadcaster;
import com.sessiongate.shared.model.ProtocolEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes dispatched events to WebSocket observers. Clients subscribe with
 * {@code ?session=<id>}; connections without it are closed.
 */
@Component
public class EventBroadcastHandler extends TextWebSocketHandler implements Broadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcastHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Map<String, Set<WebSocketSession>> observers = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        var sessionId = subscribedSession(session);
        if (sessionId == null) {
            session.close(CloseStatus.BAD_DATA.withReason("session query parameter required"));
            return;
        }
        observers.computeIfAbsent(sessionId, id -> ConcurrentHashMap.newKeySet()).add(session);
        log.debug("Observer {} subscribed to session {}", session.getId(), sessionId);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        var sessionId = subscribedSession(session);
        if (sessionId == null) return;
        observers.computeIfPresent(sessionId, (id, set) -> {
            set.remove(session);
            return set.isEmpty() ? null : set;
        });
    }

    @Override
    public void broadcast(String sessionId, ProtocolEvent event) {
        var subscribed = observers.get(sessionId);
        if (subscribed == null || subscribed.isEmpty()) return;
        String json;
        try {
            json = MAPPER.writeValueAsString(event);
        } catch (IOException e) {
            log.warn("Could not encode event {} for broadcast: {}", event.deliveryKey(), e.getMessage());
            return;
        }
        var message = new TextMessage(json);
        for (var observer : subscribed) {
            if (!observer.isOpen()) continue;
            try {
                // WebSocketSession does not allow concurrent sends
                synchronized (observer) {
                    observer.sendMessage(message);
                }
            } catch (IOException e) {
                log.warn("Broadcast to observer {} failed: {}", observer.getId(), e.getMessage());
            }
        }
    }

    int observerCount(String sessionId) {
        var subscribed = observers.get(sessionId);
        return subscribed == null ? 0 : subscribed.size();
    }

    private static String subscribedSession(WebSocketSession session) {
        if (session.getUri() == null) return null;
        var value = UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst("session");
        return value == null || value.isBlank() ? null : value;
    }
}
