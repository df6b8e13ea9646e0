package livepolls.websockets.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Control reply pushed to a WebSocket client. Poll state itself travels as change events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
        String type,
        String pollId,
        String message,
        Integer count
) {
    public static ServerMessage pong() {
        return new ServerMessage("pong", null, null, null);
    }

    public static ServerMessage subscribed(String pollId) {
        return new ServerMessage("subscribed", pollId, null, null);
    }

    public static ServerMessage unsubscribed() {
        return new ServerMessage("unsubscribed", null, null, null);
    }

    public static ServerMessage error(String message) {
        return new ServerMessage("error", null, message, null);
    }

    /**
     * Number of connections on this instance watching the poll.
     */
    public static ServerMessage connectionCount(String pollId, int count) {
        return new ServerMessage("connection_count", pollId, null, count);
    }
}
