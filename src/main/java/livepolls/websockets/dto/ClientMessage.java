package livepolls.websockets.dto;

/**
 * Control message sent by a WebSocket client:
 * {@code subscribe} (with {@code pollId}), {@code unsubscribe} or {@code ping}.
 */
public record ClientMessage(
        String type,
        String pollId
) {}
