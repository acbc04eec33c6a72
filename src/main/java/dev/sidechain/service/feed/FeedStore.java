package dev.sidechain.service.feed;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable per-user notification feed. Written by the fan-out router for recipients that
 * are not connected, read back by the notification endpoints.
 * <p>
 * Failures surface as {@link dev.sidechain.exception.ExternalServiceException}.
 * </p>
 */
public interface FeedStore {

    /**
     * Appends an activity. Adding an id that is already present is a no-op.
     */
    Mono<Void> add(NotificationEvent event);

    /**
     * Up to {@code limit} most recent activities, newest first.
     */
    Flux<NotificationEvent> recent(String userId, int limit);

    Mono<Void> markAllRead(String userId);

    Mono<Void> markAllSeen(String userId);

    Mono<NotificationCounts> counts(String userId);

    /** Short backend name for logs and health details. */
    String name();

    boolean isHealthy();
}
