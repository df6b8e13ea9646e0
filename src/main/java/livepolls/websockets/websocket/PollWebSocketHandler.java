package livepolls.websockets.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import livepolls.websockets.domain.Poll;
import livepolls.websockets.dto.ClientMessage;
import livepolls.websockets.dto.ServerMessage;
import livepolls.websockets.exception.BackendUnavailableException;
import livepolls.websockets.exception.PollNotFoundException;
import livepolls.websockets.service.BroadcastDispatcher;
import livepolls.websockets.service.ConnectionRegistry;
import livepolls.websockets.service.PollService;
import livepolls.websockets.service.RegisteredConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Handles the poll watching protocol on {@code /ws} and {@code /ws/{pollId}}.
 *
 * Spring delivers the messages of one session one at a time, so each connection has a single
 * receive loop; everything pushed to it goes through the {@link BroadcastDispatcher}.
 */
@Component
public class PollWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(PollWebSocketHandler.class);

    private final ConnectionRegistry registry;
    private final BroadcastDispatcher dispatcher;
    private final PollService pollService;
    private final ObjectMapper objectMapper;
    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;

    public PollWebSocketHandler(
            ConnectionRegistry registry,
            BroadcastDispatcher dispatcher,
            PollService pollService,
            ObjectMapper objectMapper,
            @Value("${app.websocket.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.websocket.buffer-size-limit:524288}") int bufferSizeLimit
    ) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.pollService = pollService;
        this.objectMapper = objectMapper;
        this.sendTimeLimitMs = sendTimeLimitMs;
        this.bufferSizeLimit = bufferSizeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String connectionId = registry.register(new WebSocketConnection(session, sendTimeLimitMs, bufferSizeLimit));
        log.info("WebSocket connected: {} (total: {})", connectionId, registry.size());

        requestedPollId(session.getUri()).ifPresent(pollId -> subscribe(connectionId, pollId));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Optional<RegisteredConnection> connection = registry.find(session.getId());
        if (connection.isEmpty()) {
            return;
        }

        ClientMessage request;
        try {
            request = objectMapper.readValue(message.getPayload(), ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed message on connection {}: {}", session.getId(), e.getOriginalMessage());
            dispatcher.reply(connection.get(), ServerMessage.error("Malformed message"));
            return;
        }

        String type = request.type() == null ? "" : request.type();
        switch (type) {
            case "ping" -> dispatcher.reply(connection.get(), ServerMessage.pong());
            case "subscribe" -> {
                if (!StringUtils.hasText(request.pollId())) {
                    dispatcher.reply(connection.get(), ServerMessage.error("pollId is required"));
                } else {
                    subscribe(session.getId(), request.pollId());
                }
            }
            case "unsubscribe" -> {
                String previous = registry.subscribedPoll(session.getId());
                registry.unsubscribe(session.getId());
                dispatcher.reply(connection.get(), ServerMessage.unsubscribed());
                announceConnectionCount(previous);
            }
            default -> dispatcher.reply(connection.get(), ServerMessage.error("Unknown message type: " + type));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("Transport error on connection {}: {}", session.getId(), exception.getMessage());
        disconnect(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        disconnect(session.getId());
        log.info("WebSocket disconnected: {} ({}) (total: {})", session.getId(), status.getCode(), registry.size());
    }

    /**
     * Subscribes before reading the poll, so any change committed after the snapshot read
     * is also delivered; the sequence check discards whichever of the two is older.
     */
    private void subscribe(String connectionId, String pollId) {
        RegisteredConnection connection = registry.find(connectionId).orElse(null);
        if (connection == null) {
            return;
        }
        String previous = registry.subscribedPoll(connectionId);
        String left = pollId.equals(previous) ? null : previous;

        if (!registry.subscribe(connectionId, pollId)) {
            // Deleted while subscribing
            dispatcher.reply(connection, ServerMessage.error("Poll not found"));
            announceConnectionCount(left);
            return;
        }

        Poll poll;
        try {
            poll = pollService.getPoll(pollId);
        } catch (PollNotFoundException e) {
            registry.unsubscribe(connectionId);
            dispatcher.reply(connection, ServerMessage.error("Poll not found"));
            announceConnectionCount(left);
            return;
        } catch (BackendUnavailableException e) {
            registry.unsubscribe(connectionId);
            dispatcher.reply(connection, ServerMessage.error("Service temporarily unavailable"));
            announceConnectionCount(left);
            return;
        }

        if (dispatcher.reply(connection, ServerMessage.subscribed(pollId))) {
            dispatcher.sendSnapshot(connection, poll);
        }
        announceConnectionCount(pollId);
        announceConnectionCount(left);
    }

    private void disconnect(String connectionId) {
        String previous = registry.subscribedPoll(connectionId);
        // Close and transport error can both report the same connection
        if (registry.deregister(connectionId)) {
            announceConnectionCount(previous);
        }
    }

    private void announceConnectionCount(String pollId) {
        if (pollId == null) {
            return;
        }
        dispatcher.sendToSubscribers(pollId, ServerMessage.connectionCount(pollId, registry.subscriberCount(pollId)));
    }

    static Optional<String> requestedPollId(URI uri) {
        if (uri == null) {
            return Optional.empty();
        }
        UriComponents components = UriComponentsBuilder.fromUri(uri).build();

        String fromQuery = components.getQueryParams().getFirst("pollId");
        if (StringUtils.hasText(fromQuery)) {
            return Optional.of(fromQuery);
        }

        List<String> segments = components.getPathSegments();
        int size = segments.size();
        if (size >= 2 && "ws".equals(segments.get(size - 2)) && StringUtils.hasText(segments.get(size - 1))) {
            return Optional.of(segments.get(size - 1));
        }
        return Optional.empty();
    }
}
