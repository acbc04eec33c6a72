package dev.sidechain.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
public class RealtimeMetrics {

    private final MeterRegistry meterRegistry;

    private final AtomicLong activeConnections = new AtomicLong(0);
    private final AtomicLong onlineUsers = new AtomicLong(0);

    private Counter connectionsTotal;
    private Counter connectionsDropped;
    private Counter messagesSent;
    private Counter messagesReceived;
    private Counter messagesDropped;
    private Counter errors;
    private Counter reconciliationSkipped;
    private final Map<String, Counter> fanoutOutcomes = new ConcurrentHashMap<>();
    private final Map<String, Counter> reconciledDocuments = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        Gauge.builder("sidechain.ws.connections.active", activeConnections, AtomicLong::get)
                .description("Live WebSocket connections on this node")
                .register(meterRegistry);

        Gauge.builder("sidechain.presence.online", onlineUsers, AtomicLong::get)
                .description("Distinct users with at least one live connection")
                .register(meterRegistry);

        connectionsTotal = meterRegistry.counter("sidechain.ws.connections.total");
        connectionsDropped = meterRegistry.counter("sidechain.ws.connections.dropped");
        messagesSent = meterRegistry.counter("sidechain.ws.messages.sent");
        messagesReceived = meterRegistry.counter("sidechain.ws.messages.received");
        messagesDropped = meterRegistry.counter("sidechain.ws.messages.dropped");
        errors = meterRegistry.counter("sidechain.ws.errors");
        reconciliationSkipped = meterRegistry.counter("sidechain.reconciliation.skipped");
    }

    public void connectionOpened(int distinctUsers) {
        connectionsTotal.increment();
        activeConnections.incrementAndGet();
        onlineUsers.set(distinctUsers);
    }

    public void connectionClosed(int distinctUsers) {
        activeConnections.updateAndGet(v -> Math.max(0, v - 1));
        onlineUsers.set(distinctUsers);
    }

    public void connectionDropped() {
        connectionsDropped.increment();
    }

    public void messageSent() {
        messagesSent.increment();
    }

    public void messageReceived() {
        messagesReceived.increment();
    }

    public void messageDropped() {
        messagesDropped.increment();
    }

    public void error() {
        errors.increment();
    }

    public void fanoutOutcome(String outcome) {
        fanoutOutcomes.computeIfAbsent(outcome,
                o -> meterRegistry.counter("sidechain.fanout.outcomes", "outcome", o)).increment();
    }

    public void documentsReconciled(String type, int count) {
        reconciledDocuments.computeIfAbsent(type,
                t -> meterRegistry.counter("sidechain.reconciliation.documents", "type", t)).increment(count);
    }

    public void reconciliationSkipped() {
        reconciliationSkipped.increment();
    }

    /**
     * Point-in-time view for the admin metrics endpoint.
     */
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("total_connections", (long) connectionsTotal.count());
        snapshot.put("active_connections", activeConnections.get());
        snapshot.put("online_users", onlineUsers.get());
        snapshot.put("messages_received", (long) messagesReceived.count());
        snapshot.put("messages_sent", (long) messagesSent.count());
        snapshot.put("messages_dropped", (long) messagesDropped.count());
        snapshot.put("connections_dropped", (long) connectionsDropped.count());
        snapshot.put("errors", (long) errors.count());
        return snapshot;
    }
}
