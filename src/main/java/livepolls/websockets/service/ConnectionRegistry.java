package livepolls.websockets.service;

import jakarta.annotation.PreDestroy;
import livepolls.websockets.websocket.LiveConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of the live connections on this instance and the poll each one watches.
 *
 * The maps are only touched under {@link #lock}: mutations take the write lock, snapshots
 * the read lock. Per-connection state lives in {@link RegisteredConnection} and is updated
 * after the lock is released, so a connection stuck in a send never stalls the registry.
 * Subscription changes for one connection come from that connection's own message loop.
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, RegisteredConnection> connections = new HashMap<>();
    private final Map<String, Set<String>> subscribersByPoll = new HashMap<>();
    private final Map<String, String> pollByConnection = new HashMap<>();
    private final long shutdownTimeoutMs;

    public ConnectionRegistry(@Value("${app.websocket.shutdown-timeout-ms:5000}") long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public String register(LiveConnection connection) {
        RegisteredConnection registered = new RegisteredConnection(connection);
        int total;
        lock.writeLock().lock();
        try {
            if (connections.putIfAbsent(connection.id(), registered) != null) {
                throw new IllegalStateException("Connection already registered: " + connection.id());
            }
            total = connections.size();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Connection registered: {} (total: {})", connection.id(), total);
        return connection.id();
    }

    /**
     * Points the connection at a poll, replacing any previous subscription.
     *
     * The connection's own state is updated after the write lock is released. An
     * {@link #unsubscribeAll} for the same poll can land in between; the membership is checked
     * again afterwards and the connection is cleared if the poll's subscribers were dropped.
     *
     * @return false if the connection is not registered or lost the subscription to a
     *         concurrent {@link #unsubscribeAll}
     */
    public boolean subscribe(String connectionId, String pollId) {
        RegisteredConnection registered;
        lock.writeLock().lock();
        try {
            registered = connections.get(connectionId);
            if (registered == null) {
                return false;
            }
            String previous = pollByConnection.put(connectionId, pollId);
            if (previous != null && !previous.equals(pollId)) {
                removeSubscriber(previous, connectionId);
            }
            subscribersByPoll.computeIfAbsent(pollId, key -> new HashSet<>()).add(connectionId);
        } finally {
            lock.writeLock().unlock();
        }
        registered.subscribeTo(pollId);

        if (!pollId.equals(subscribedPoll(connectionId))) {
            registered.clearSubscriptionIf(pollId);
            log.debug("Subscription of connection {} to poll {} dropped while subscribing", connectionId, pollId);
            return false;
        }
        log.debug("Connection {} subscribed to poll {}", connectionId, pollId);
        return true;
    }

    /**
     * The poll a connection watches according to the registry, or null.
     */
    public String subscribedPoll(String connectionId) {
        lock.readLock().lock();
        try {
            return pollByConnection.get(connectionId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean unsubscribe(String connectionId) {
        RegisteredConnection registered;
        lock.writeLock().lock();
        try {
            registered = connections.get(connectionId);
            if (registered == null) {
                return false;
            }
            String previous = pollByConnection.remove(connectionId);
            if (previous != null) {
                removeSubscriber(previous, connectionId);
            }
        } finally {
            lock.writeLock().unlock();
        }
        registered.clearSubscription();
        log.debug("Connection {} unsubscribed", connectionId);
        return true;
    }

    /**
     * Drops every subscription to a poll, e.g. once it has been deleted.
     *
     * @return the number of connections that were watching it
     */
    public int unsubscribeAll(String pollId) {
        List<RegisteredConnection> watchers = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Set<String> ids = subscribersByPoll.remove(pollId);
            if (ids != null) {
                for (String id : ids) {
                    pollByConnection.remove(id);
                    RegisteredConnection registered = connections.get(id);
                    if (registered != null) {
                        watchers.add(registered);
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        watchers.forEach(registered -> registered.clearSubscriptionIf(pollId));
        return watchers.size();
    }

    /**
     * Removes a connection and its subscription and closes the channel if it is still open.
     * Safe to call any number of times from any code path.
     *
     * @return true if this call removed the connection
     */
    public boolean deregister(String connectionId) {
        RegisteredConnection registered;
        int total;
        lock.writeLock().lock();
        try {
            registered = connections.remove(connectionId);
            if (registered == null) {
                return false;
            }
            String pollId = pollByConnection.remove(connectionId);
            if (pollId != null) {
                removeSubscriber(pollId, connectionId);
            }
            total = connections.size();
        } finally {
            lock.writeLock().unlock();
        }

        if (registered.markDisconnected()) {
            registered.connection().close();
        }
        log.debug("Connection deregistered: {} (total: {})", connectionId, total);
        return true;
    }

    /**
     * Connections watching a poll at the time of the call. The returned list is a copy.
     */
    public List<RegisteredConnection> subscribersOf(String pollId) {
        lock.readLock().lock();
        try {
            Set<String> ids = subscribersByPoll.get(pollId);
            if (ids == null) {
                return List.of();
            }
            List<RegisteredConnection> subscribers = new ArrayList<>(ids.size());
            for (String id : ids) {
                RegisteredConnection registered = connections.get(id);
                if (registered != null) {
                    subscribers.add(registered);
                }
            }
            return subscribers;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<RegisteredConnection> connections() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RegisteredConnection> find(String connectionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int subscriberCount(String pollId) {
        lock.readLock().lock();
        try {
            Set<String> ids = subscribersByPoll.get(pollId);
            return ids != null ? ids.size() : 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Deregisters connections whose channel closed without a close callback reaching us.
     *
     * @return the number of connections removed
     */
    public int sweepClosed() {
        List<String> closed = new ArrayList<>();
        for (RegisteredConnection registered : connections()) {
            if (!registered.connection().isOpen()) {
                closed.add(registered.id());
            }
        }

        int removed = 0;
        for (String id : closed) {
            if (deregister(id)) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Deregisters and closes every connection, waiting at most the configured shutdown timeout.
     */
    @PreDestroy
    public void shutdown() {
        List<RegisteredConnection> all;
        lock.writeLock().lock();
        try {
            all = new ArrayList<>(connections.values());
            connections.clear();
            subscribersByPoll.clear();
            pollByConnection.clear();
        } finally {
            lock.writeLock().unlock();
        }

        if (all.isEmpty()) {
            return;
        }
        log.info("Closing {} live connections", all.size());

        ExecutorService closer = Executors.newFixedThreadPool(Math.min(all.size(), 8));
        for (RegisteredConnection registered : all) {
            closer.submit(() -> {
                if (registered.markDisconnected()) {
                    registered.connection().close();
                }
            });
        }
        closer.shutdown();
        try {
            if (!closer.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Connections still closing after {} ms, giving up", shutdownTimeoutMs);
                closer.shutdownNow();
            }
        } catch (InterruptedException e) {
            closer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // Callers hold the write lock
    private void removeSubscriber(String pollId, String connectionId) {
        Set<String> ids = subscribersByPoll.get(pollId);
        if (ids == null) {
            return;
        }
        ids.remove(connectionId);
        // Clean up empty poll groups
        if (ids.isEmpty()) {
            subscribersByPoll.remove(pollId);
        }
    }
}
