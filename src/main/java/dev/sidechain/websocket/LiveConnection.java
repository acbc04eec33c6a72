package dev.sidechain.websocket;

import dev.sidechain.exception.DeliveryException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One authenticated WebSocket session. Outbound frames go through a bounded queue
 * drained by the session's write pipeline, so a slow socket only ever fills its
 * own queue.
 */
@Getter
@Slf4j
public class LiveConnection {

    private final String connectionId;
    private final String userId;
    private final String username;
    private final ConnectionMetadata metadata;
    private final Instant connectedAt = Instant.now();
    private final TokenBucket rateLimiter;

    private volatile Instant lastPingAt = Instant.now();

    @Getter(lombok.AccessLevel.NONE)
    private final Sinks.Many<String> outbound;
    @Getter(lombok.AccessLevel.NONE)
    private final Sinks.Empty<Void> drained = Sinks.empty();
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean open = new AtomicBoolean(true);
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicInteger consecutiveDrops = new AtomicInteger();
    @Getter(lombok.AccessLevel.NONE)
    private volatile Runnable forceCloseHook = () -> { };

    public LiveConnection(String connectionId, String userId, String username, ConnectionMetadata metadata,
                          int queueCapacity, TokenBucket rateLimiter) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.username = username;
        this.metadata = metadata != null ? metadata : ConnectionMetadata.UNKNOWN;
        this.rateLimiter = rateLimiter;
        this.outbound = Sinks.many().unicast().onBackpressureBuffer(Queues.<String>get(queueCapacity).get());
    }

    /**
     * Frames for the session's write pipeline. Completes after {@link #complete()} once
     * queued frames have been flushed. Single subscriber.
     */
    public Flux<String> outbound() {
        return outbound.asFlux();
    }

    /** Completes when the outbound queue has been closed for new frames. */
    public Mono<Void> onDrainStarted() {
        return drained.asMono();
    }

    /**
     * Queues a frame without blocking.
     *
     * @throws DeliveryException if the queue is full or the connection is closing
     */
    public void offer(String frame) {
        Sinks.EmitResult result;
        synchronized (this) {
            result = outbound.tryEmitNext(frame);
        }
        if (result.isSuccess()) {
            consecutiveDrops.set(0);
            return;
        }
        consecutiveDrops.incrementAndGet();
        String reason = result == Sinks.EmitResult.FAIL_OVERFLOW ? "outbound queue full" : "connection closing (" + result + ")";
        throw new DeliveryException(connectionId, reason);
    }

    public int consecutiveDrops() {
        return consecutiveDrops.get();
    }

    public boolean allowInbound() {
        return rateLimiter.tryAcquire();
    }

    public void touch() {
        lastPingAt = Instant.now();
    }

    public boolean isOpen() {
        return open.get();
    }

    /**
     * Stops accepting frames; already queued frames are still written.
     */
    public void complete() {
        synchronized (this) {
            outbound.tryEmitComplete();
        }
        drained.tryEmitEmpty();
    }

    /** Called once the session has terminated. */
    void markClosed() {
        if (open.compareAndSet(true, false)) {
            complete();
        }
    }

    public void onForceClose(Runnable hook) {
        this.forceCloseHook = hook;
    }

    /**
     * Closes the underlying session without waiting for queued frames.
     */
    public void forceClose() {
        complete();
        try {
            forceCloseHook.run();
        } catch (RuntimeException e) {
            log.warn("Force close of connection {} failed: {}", connectionId, e.getMessage());
        }
        open.set(false);
    }
}
