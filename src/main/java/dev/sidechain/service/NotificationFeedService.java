package dev.sidechain.service;

import dev.sidechain.dto.NotificationGroup;
import dev.sidechain.dto.PageResponse;
import dev.sidechain.service.feed.FeedStore;
import dev.sidechain.service.feed.NotificationCounts;
import dev.sidechain.service.feed.NotificationEvent;
import dev.sidechain.websocket.ConnectionRegistry;
import dev.sidechain.websocket.message.Envelope;
import dev.sidechain.websocket.message.MessageType;
import dev.sidechain.websocket.message.NotificationCountUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read side of the durable notification feed: aggregated pages, badge counts and the
 * read/seen markers. Marking pushes the new counts to the user's other open clients.
 */
@Service
@Slf4j
public class NotificationFeedService {

    private final FeedStore feedStore;
    private final NotificationAggregationPresenter presenter;
    private final ConnectionRegistry registry;
    private final int maxPageSize;
    private final int fetchLimit;

    public NotificationFeedService(
            FeedStore feedStore,
            NotificationAggregationPresenter presenter,
            ConnectionRegistry registry,
            @Value("${notifications.feed-page-max-size:100}") int maxPageSize,
            @Value("${notifications.feed-fetch-limit:300}") int fetchLimit) {
        this.feedStore = feedStore;
        this.presenter = presenter;
        this.registry = registry;
        this.maxPageSize = maxPageSize;
        this.fetchLimit = fetchLimit;
    }

    public Mono<PageResponse<NotificationGroup>> getNotifications(String userId, int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must not be negative");
        }
        int pageSize = Math.max(1, Math.min(size, maxPageSize));
        return feedStore.recent(userId, fetchLimit)
                .collectList()
                .map(newestFirst -> {
                    List<NotificationEvent> oldestFirst = new ArrayList<>(newestFirst);
                    Collections.reverse(oldestFirst);
                    return PageResponse.slice(presenter.present(oldestFirst), page, pageSize);
                });
    }

    public Mono<NotificationCounts> getCounts(String userId) {
        return feedStore.counts(userId);
    }

    public Mono<NotificationCounts> markAllRead(String userId) {
        return feedStore.markAllRead(userId)
                .then(pushCounts(userId))
                .doOnNext(c -> log.debug("Marked notifications read for {}", userId));
    }

    public Mono<NotificationCounts> markAllSeen(String userId) {
        return feedStore.markAllSeen(userId)
                .then(pushCounts(userId))
                .doOnNext(c -> log.debug("Marked notifications seen for {}", userId));
    }

    private Mono<NotificationCounts> pushCounts(String userId) {
        return Mono.defer(() -> feedStore.counts(userId))
                .doOnNext(counts -> registry.send(userId, Envelope.of(MessageType.NOTIFICATION_COUNT_UPDATE,
                        new NotificationCountUpdate(counts.unread(), counts.unseen(), System.currentTimeMillis()))));
    }
}
