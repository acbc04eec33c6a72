package dev.sidechain.service.feed;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-process feed: the newest {@code maxPerUser} activities per user.
 * Used in development and tests, and as the fallback when no feed backend is configured.
 */
@Slf4j
public class InMemoryFeedStore implements FeedStore {

    private final Map<String, Deque<NotificationEvent>> feeds = new ConcurrentHashMap<>();
    private final int maxPerUser;

    public InMemoryFeedStore(int maxPerUser) {
        this.maxPerUser = maxPerUser;
        log.info("In-memory notification feed enabled (maxPerUser={})", maxPerUser);
    }

    @Override
    public Mono<Void> add(NotificationEvent event) {
        return Mono.fromRunnable(() -> {
            Deque<NotificationEvent> feed = feeds.computeIfAbsent(event.recipientId(), k -> new ArrayDeque<>());
            synchronized (feed) {
                for (NotificationEvent existing : feed) {
                    if (existing.id().equals(event.id())) {
                        return;
                    }
                }
                feed.addFirst(event);
                while (feed.size() > maxPerUser) {
                    feed.removeLast();
                }
            }
        });
    }

    @Override
    public Flux<NotificationEvent> recent(String userId, int limit) {
        return Flux.defer(() -> {
            Deque<NotificationEvent> feed = feeds.get(userId);
            if (feed == null) {
                return Flux.empty();
            }
            List<NotificationEvent> copy;
            synchronized (feed) {
                copy = new ArrayList<>(Math.min(limit, feed.size()));
                Iterator<NotificationEvent> it = feed.iterator();
                while (it.hasNext() && copy.size() < limit) {
                    copy.add(it.next());
                }
            }
            return Flux.fromIterable(copy);
        });
    }

    @Override
    public Mono<Void> markAllRead(String userId) {
        return Mono.fromRunnable(() -> replaceAll(userId, true));
    }

    @Override
    public Mono<Void> markAllSeen(String userId) {
        return Mono.fromRunnable(() -> replaceAll(userId, false));
    }

    @Override
    public Mono<NotificationCounts> counts(String userId) {
        return Mono.fromSupplier(() -> {
            Deque<NotificationEvent> feed = feeds.get(userId);
            if (feed == null) {
                return NotificationCounts.ZERO;
            }
            Set<String> unread = new HashSet<>();
            Set<String> unseen = new HashSet<>();
            synchronized (feed) {
                for (NotificationEvent event : feed) {
                    if (!event.read()) {
                        unread.add(event.aggregationKey());
                    }
                    if (!event.seen()) {
                        unseen.add(event.aggregationKey());
                    }
                }
            }
            return new NotificationCounts(unread.size(), unseen.size());
        });
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    private void replaceAll(String userId, boolean read) {
        Deque<NotificationEvent> feed = feeds.get(userId);
        if (feed == null) {
            return;
        }
        synchronized (feed) {
            List<NotificationEvent> updated = new ArrayList<>(feed.size());
            for (NotificationEvent event : feed) {
                updated.add(read ? event.markRead() : event.markSeen());
            }
            feed.clear();
            feed.addAll(updated);
        }
    }
}
