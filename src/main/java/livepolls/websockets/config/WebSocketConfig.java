package livepolls.websockets.config;

import jakarta.annotation.PostConstruct;
import livepolls.websockets.websocket.PollWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final PollWebSocketHandler pollWebSocketHandler;

    @Value("${app.cors.allowed-origins}")
    private String allowedOrigins;

    public WebSocketConfig(PollWebSocketHandler pollWebSocketHandler) {
        this.pollWebSocketHandler = pollWebSocketHandler;
    }

    @PostConstruct
    public void logConfig() {
        log.info("WebSocket CORS allowed origins: {}", allowedOrigins);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String[] origins = CorsConfig.parseOrigins(allowedOrigins);

        log.info("Registering WebSocket endpoints /ws and /ws/{pollId}");

        registry.addHandler(pollWebSocketHandler, "/ws", "/ws/*")
                .setAllowedOriginPatterns(origins);
    }
}
