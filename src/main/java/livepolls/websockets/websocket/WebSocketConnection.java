package livepolls.websockets.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link LiveConnection} over a Spring {@link WebSocketSession}.
 * Sends go through a {@link ConcurrentWebSocketSessionDecorator}: a peer that stops reading
 * fills its buffer or exceeds the send time limit, and the send then fails.
 */
public class WebSocketConnection implements LiveConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final WebSocketSession session;

    public WebSocketConnection(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void send(String payload) throws IOException {
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(CloseStatus.GOING_AWAY);
        } catch (IOException e) {
            log.debug("Error closing WebSocket session {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketConnection[" + session.getId() + "]";
    }
}
