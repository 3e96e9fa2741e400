package com.sessiongate.gateway.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Exposes the event feed at {@code sessiongate.ws.path}. Observers pick a session with
 * {@code ?session=<id>}; see {@link EventBroadcastHandler}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final EventBroadcastHandler eventFeed;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(EventBroadcastHandler eventFeed,
                           @Value("${sessiongate.ws.path:/ws}") String path,
                           @Value("${sessiongate.ws.allowed-origins:*}") String[] allowedOrigins) {
        this.eventFeed = eventFeed;
        this.path = path;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(eventFeed, path).setAllowedOrigins(allowedOrigins);
    }
}
