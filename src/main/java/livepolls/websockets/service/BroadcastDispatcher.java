package livepolls.websockets.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import livepolls.websockets.domain.ChangeEvent;
import livepolls.websockets.domain.ChangeType;
import livepolls.websockets.domain.Poll;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Pushes change events to the connections of this instance.
 *
 * A connection whose send fails is deregistered on the spot; delivery to the
 * remaining connections carries on.
 */
@Service
public class BroadcastDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

    private final ConnectionRegistry registry;
    private final ObjectMapper objectMapper;
    private final Counter deliveriesCounter;
    private final Counter droppedConnectionsCounter;

    public BroadcastDispatcher(
            ConnectionRegistry registry,
            ObjectMapper objectMapper,
            @Qualifier("broadcastDeliveriesCounter") Counter deliveriesCounter,
            @Qualifier("droppedConnectionsCounter") Counter droppedConnectionsCounter
    ) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.deliveriesCounter = deliveriesCounter;
        this.droppedConnectionsCounter = droppedConnectionsCounter;
    }

    /**
     * Delivers one event: poll-scoped events to the poll's subscribers,
     * creations and deletions to every connection.
     *
     * @return the number of connections the event was written to
     */
    public int dispatch(ChangeEvent event) {
        String payload = toJson(event);
        if (payload == null) {
            return 0;
        }

        List<RegisteredConnection> targets = event.type().isPollScoped()
                ? registry.subscribersOf(event.pollId())
                : registry.connections();

        int delivered = 0;
        for (RegisteredConnection target : targets) {
            try {
                if (target.deliver(event, payload)) {
                    delivered++;
                }
            } catch (IOException | RuntimeException e) {
                drop(target, e);
            }
        }

        if (event.type() == ChangeType.DELETED) {
            registry.unsubscribeAll(event.pollId());
        }

        deliveriesCounter.increment(delivered);
        log.trace("Dispatched {} for poll {} (sequence {}) to {}/{} connections",
                event.type(), event.pollId(), event.sequence(), delivered, targets.size());
        return delivered;
    }

    /**
     * Sends the current state of a poll to one connection that just subscribed to it.
     */
    public boolean sendSnapshot(RegisteredConnection target, Poll poll) {
        ChangeEvent snapshot = ChangeEvent.of(ChangeType.SNAPSHOT, poll);
        String payload = toJson(snapshot);
        if (payload == null) {
            return false;
        }
        try {
            return target.deliver(snapshot, payload);
        } catch (IOException | RuntimeException e) {
            drop(target, e);
            return false;
        }
    }

    /**
     * Sends a control reply (pong, acknowledgement, error) to one connection.
     */
    public boolean reply(RegisteredConnection target, Object message) {
        String payload = toJson(message);
        if (payload == null) {
            return false;
        }
        try {
            return target.send(payload);
        } catch (IOException | RuntimeException e) {
            drop(target, e);
            return false;
        }
    }

    /**
     * Sends a control message that is not a change event to every connection watching a poll.
     *
     * @return the number of connections it was written to
     */
    public int sendToSubscribers(String pollId, Object message) {
        String payload = toJson(message);
        if (payload == null) {
            return 0;
        }
        int delivered = 0;
        for (RegisteredConnection target : registry.subscribersOf(pollId)) {
            try {
                if (target.send(payload)) {
                    delivered++;
                }
            } catch (IOException | RuntimeException e) {
                drop(target, e);
            }
        }
        return delivered;
    }

    private void drop(RegisteredConnection target, Exception cause) {
        log.debug("Dropping connection {} after failed send: {}", target.id(), cause.getMessage());
        if (registry.deregister(target.id())) {
            droppedConnectionsCounter.increment();
        }
    }

    private String toJson(Object message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}", message.getClass().getSimpleName(), e);
            return null;
        }
    }
}
