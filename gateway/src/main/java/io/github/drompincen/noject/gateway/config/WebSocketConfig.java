package io.github.drompincen.noject.gateway.config;

import io.github.drompincen.noject.gateway.websocket.OutlineWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final OutlineWebSocketHandler handler;
    private final String path;
    private final String[] allowedOrigins;

    public WebSocketConfig(OutlineWebSocketHandler handler,
                           @Value("${noject.websocket.path:/ws/tasks}") String path,
                           @Value("${noject.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.handler = handler;
        this.path = path;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, path).setAllowedOrigins(allowedOrigins);
    }
}
