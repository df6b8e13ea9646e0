package livepolls.websockets.service;

import livepolls.websockets.domain.ChangeEvent;
import livepolls.websockets.websocket.LiveConnection;

import java.io.IOException;
import java.util.Optional;

/**
 * A connection owned by the {@link ConnectionRegistry}, with its subscription and delivery state.
 * All state and every send are guarded by this object's monitor, so payloads reach the client
 * in the order they pass the sequence check.
 */
public final class RegisteredConnection {

    private final LiveConnection connection;

    private String pollId;
    private long lastSequence = -1;
    private boolean disconnected;

    RegisteredConnection(LiveConnection connection) {
        this.connection = connection;
    }

    public String id() {
        return connection.id();
    }

    public synchronized Optional<String> subscribedPollId() {
        return Optional.ofNullable(pollId);
    }

    public synchronized boolean isDisconnected() {
        return disconnected;
    }

    /**
     * Sends a change event unless it is stale for this connection.
     * Events of the subscribed poll must carry a sequence strictly above the last one sent;
     * poll-scoped events of any other poll are skipped.
     *
     * @return true if the payload was written
     */
    public synchronized boolean deliver(ChangeEvent event, String payload) throws IOException {
        if (disconnected) {
            return false;
        }
        boolean ownPoll = event.pollId().equals(pollId);
        if (!ownPoll && event.type().isPollScoped()) {
            return false;
        }
        if (ownPoll) {
            if (event.sequence() <= lastSequence) {
                return false;
            }
            lastSequence = event.sequence();
        }
        connection.send(payload);
        return true;
    }

    /**
     * Sends a reply that is not a change event (pong, acknowledgement, error).
     */
    public synchronized boolean send(String payload) throws IOException {
        if (disconnected) {
            return false;
        }
        connection.send(payload);
        return true;
    }

    /**
     * Points this connection at a poll. Subscribing again to the poll already watched keeps
     * the last delivered sequence, so an older event is still never delivered after a newer one.
     */
    synchronized void subscribeTo(String newPollId) {
        if (disconnected || newPollId.equals(pollId)) {
            return;
        }
        pollId = newPollId;
        lastSequence = -1;
    }

    synchronized void clearSubscription() {
        pollId = null;
        lastSequence = -1;
    }

    synchronized void clearSubscriptionIf(String expectedPollId) {
        if (expectedPollId.equals(pollId)) {
            clearSubscription();
        }
    }

    /**
     * @return true the first time only
     */
    synchronized boolean markDisconnected() {
        if (disconnected) {
            return false;
        }
        disconnected = true;
        pollId = null;
        return true;
    }

    LiveConnection connection() {
        return connection;
    }

    @Override
    public String toString() {
        return "RegisteredConnection[" + id() + "]";
    }
}
