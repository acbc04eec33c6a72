package dev.sidechain.websocket;

import dev.sidechain.exception.ConnectionException;
import dev.sidechain.exception.DeliveryException;
import dev.sidechain.metrics.RealtimeMetrics;
import dev.sidechain.service.IdService;
import dev.sidechain.websocket.message.Envelope;
import dev.sidechain.websocket.message.MessageCodec;
import dev.sidechain.websocket.message.MessageType;
import dev.sidechain.websocket.message.SystemNotice;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Live WebSocket connections on this node, keyed by connection id and grouped by user.
 * <p>
 * Per-user connection sets are only mutated inside {@link ConcurrentHashMap#compute}, which
 * serializes changes for one user without a global lock and yields exact first/last
 * transitions for the {@link ConnectionListener}s. Sends never block: each connection has
 * its own bounded queue and a full queue drops the frame for that connection only.
 * </p>
 */
@Component
@Slf4j
@DependsOn("taskSupervisor")
public class ConnectionRegistry {

    private final Map<String, LiveConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private final IdService idService;
    private final MessageCodec codec;
    private final RealtimeMetrics metrics;
    private final int queueCapacity;
    private final int maxConsecutiveDrops;
    private final Duration drainTimeout;
    private final double inboundRatePerSecond;
    private final int inboundBurst;

    private volatile boolean shuttingDown;

    public ConnectionRegistry(
            IdService idService,
            MessageCodec codec,
            RealtimeMetrics metrics,
            @Value("${websocket.send-buffer-size:256}") int queueCapacity,
            @Value("${websocket.max-consecutive-drops:3}") int maxConsecutiveDrops,
            @Value("${websocket.drain-timeout-seconds:5}") int drainTimeoutSeconds,
            @Value("${websocket.rate-limit.per-second:10}") double inboundRatePerSecond,
            @Value("${websocket.rate-limit.burst:20}") int inboundBurst) {
        this.idService = idService;
        this.codec = codec;
        this.metrics = metrics;
        this.queueCapacity = queueCapacity;
        this.maxConsecutiveDrops = maxConsecutiveDrops;
        this.drainTimeout = Duration.ofSeconds(drainTimeoutSeconds);
        this.inboundRatePerSecond = inboundRatePerSecond;
        this.inboundBurst = inboundBurst;
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    /**
     * Registers an authenticated session.
     *
     * @throws ConnectionException if the user id is missing or the registry is shutting down
     */
    public LiveConnection register(String userId, String username, ConnectionMetadata metadata) {
        if (!StringUtils.hasText(userId)) {
            throw new ConnectionException("Connection has no authenticated user");
        }
        if (shuttingDown) {
            throw new ConnectionException("Server is shutting down");
        }

        LiveConnection connection = new LiveConnection(idService.nextConnectionId(), userId, username, metadata,
                queueCapacity, new TokenBucket(inboundRatePerSecond, inboundBurst));
        connections.put(connection.getConnectionId(), connection);

        boolean[] first = {false};
        userConnections.compute(userId, (key, ids) -> {
            if (ids == null) {
                ids = ConcurrentHashMap.newKeySet();
                first[0] = true;
            }
            ids.add(connection.getConnectionId());
            return ids;
        });
        metrics.connectionOpened(userConnections.size());
        log.info("Connection {} registered for user {} ({} active)",
                connection.getConnectionId(), userId, connections.size());

        if (first[0]) {
            for (ConnectionListener listener : listeners) {
                try {
                    listener.onFirstConnection(userId, username);
                } catch (RuntimeException e) {
                    log.error("Connection listener failed on first connection of {}: {}", userId, e.getMessage(), e);
                }
            }
        }
        return connection;
    }

    /**
     * Removes a connection. Idempotent.
     *
     * @return true if the connection was registered
     */
    public boolean unregister(String connectionId) {
        LiveConnection connection = connections.remove(connectionId);
        if (connection == null) {
            return false;
        }
        String userId = connection.getUserId();
        boolean[] last = {false};
        userConnections.computeIfPresent(userId, (key, ids) -> {
            ids.remove(connectionId);
            if (ids.isEmpty()) {
                last[0] = true;
                return null;
            }
            return ids;
        });
        connection.markClosed();
        metrics.connectionClosed(userConnections.size());
        log.info("Connection {} unregistered for user {} ({} active)", connectionId, userId, connections.size());

        if (last[0] && !shuttingDown) {
            for (ConnectionListener listener : listeners) {
                try {
                    listener.onLastDisconnect(userId);
                } catch (RuntimeException e) {
                    log.error("Connection listener failed on last disconnect of {}: {}", userId, e.getMessage(), e);
                }
            }
        }
        return true;
    }

    /**
     * Queues the envelope on every live connection of {@code userId}.
     *
     * @return the number of connections the envelope was queued on; 0 means the user is offline here
     */
    public int send(String userId, Envelope envelope) {
        Set<String> ids = userConnections.get(userId);
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        String frame = codec.encode(envelope);
        int delivered = 0;
        for (String connectionId : ids) {
            LiveConnection connection = connections.get(connectionId);
            if (connection != null && deliver(connection, frame, envelope.type())) {
                delivered++;
            }
        }
        return delivered;
    }

    public int sendToConnection(String connectionId, Envelope envelope) {
        LiveConnection connection = connections.get(connectionId);
        if (connection == null) {
            return 0;
        }
        return deliver(connection, codec.encode(envelope), envelope.type()) ? 1 : 0;
    }

    /**
     * Queues the envelope on every connection matching {@code predicate}.
     */
    public int broadcast(Predicate<LiveConnection> predicate, Envelope envelope) {
        String frame = codec.encode(envelope);
        int delivered = 0;
        for (LiveConnection connection : new ArrayList<>(connections.values())) {
            if (predicate.test(connection) && deliver(connection, frame, envelope.type())) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Sends to each listed user that is connected; the others are skipped.
     */
    public int sendToUsers(Collection<String> userIds, Envelope envelope) {
        String frame = null;
        int delivered = 0;
        for (String userId : userIds) {
            Set<String> ids = userConnections.get(userId);
            if (ids == null) {
                continue;
            }
            if (frame == null) {
                frame = codec.encode(envelope);
            }
            for (String connectionId : ids) {
                LiveConnection connection = connections.get(connectionId);
                if (connection != null && deliver(connection, frame, envelope.type())) {
                    delivered++;
                }
            }
        }
        return delivered;
    }

    public void touch(String connectionId) {
        LiveConnection connection = connections.get(connectionId);
        if (connection != null) {
            connection.touch();
        }
    }

    public boolean isOnline(String userId) {
        Set<String> ids = userConnections.get(userId);
        return ids != null && !ids.isEmpty();
    }

    public int connectionCount(String userId) {
        Set<String> ids = userConnections.get(userId);
        return ids == null ? 0 : ids.size();
    }

    public Set<String> onlineUserIds() {
        return Set.copyOf(userConnections.keySet());
    }

    public int activeConnections() {
        return connections.size();
    }

    public int onlineUserCount() {
        return userConnections.size();
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    private boolean deliver(LiveConnection connection, String frame, String type) {
        try {
            connection.offer(frame);
            metrics.messageSent();
            return true;
        } catch (DeliveryException e) {
            metrics.messageDropped();
            int drops = connection.consecutiveDrops();
            if (drops >= maxConsecutiveDrops) {
                log.warn("Dropping connection {} of user {} after {} consecutive failed sends: {}",
                        connection.getConnectionId(), connection.getUserId(), drops, e.getMessage());
                metrics.connectionDropped();
                unregister(connection.getConnectionId());
                connection.forceClose();
            } else {
                log.warn("Dropped '{}' for connection {} of user {}: {}",
                        type, connection.getConnectionId(), connection.getUserId(), e.getMessage());
            }
            return false;
        }
    }

    /**
     * Tells every client the server is going away, lets queued frames flush for up to the
     * drain timeout, then force-closes whatever is still open.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        List<LiveConnection> snapshot = new ArrayList<>(connections.values());
        if (snapshot.isEmpty()) {
            return;
        }
        log.info("Draining {} connection(s), timeout {}s", snapshot.size(), drainTimeout.toSeconds());

        String notice = codec.encode(Envelope.of(MessageType.SYSTEM,
                new SystemNotice(SystemNotice.SERVER_SHUTDOWN, "Server is shutting down", null)));
        for (LiveConnection connection : snapshot) {
            try {
                connection.offer(notice);
            } catch (DeliveryException e) {
                log.debug("Could not queue shutdown notice for {}: {}", connection.getConnectionId(), e.getMessage());
            }
            connection.complete();
        }

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        while (snapshot.stream().anyMatch(LiveConnection::isOpen) && System.nanoTime() < deadline) {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }

        int forced = 0;
        for (LiveConnection connection : snapshot) {
            if (connection.isOpen()) {
                connection.forceClose();
                forced++;
            }
        }
        connections.clear();
        userConnections.clear();
        log.info("Connection registry stopped ({} connection(s) force-closed)", forced);
    }
}
