package dev.sidechain.service.feed;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryFeedStore")
class InMemoryFeedStoreTest {

    private InMemoryFeedStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFeedStore(3);
    }

    private static NotificationEvent event(String id, String verb, String at) {
        return new NotificationEvent(id, "me", "actor-" + id, "Actor", verb, "post-1", null,
                Instant.parse(at), false, false);
    }

    @Test
    @DisplayName("Should return newest first and keep only the newest entries")
    void shouldCapPerUser() {
        for (int i = 1; i <= 4; i++) {
            store.add(event(String.valueOf(i), "like", "2024-03-0" + i + "T00:00:00Z")).block();
        }

        StepVerifier.create(store.recent("me", 10).map(NotificationEvent::id))
                .expectNext("4", "3", "2")
                .verifyComplete();
    }

    @Test
    @DisplayName("Should ignore a second add with the same id")
    void shouldBeIdempotent() {
        NotificationEvent like = event("1", "like", "2024-03-01T00:00:00Z");

        store.add(like).block();
        store.add(like).block();

        StepVerifier.create(store.recent("me", 10)).expectNextCount(1).verifyComplete();
    }

    @Test
    @DisplayName("Should count unread and unseen in groups")
    void shouldCountGroups() {
        // Given
        store.add(event("1", "like", "2024-03-01T08:00:00Z")).block();
        store.add(event("2", "like", "2024-03-01T09:00:00Z")).block();
        store.add(event("3", "follow", "2024-03-01T10:00:00Z")).block();

        // When / Then
        StepVerifier.create(store.counts("me"))
                .expectNext(new NotificationCounts(2, 2))
                .verifyComplete();

        store.markAllSeen("me").block();
        StepVerifier.create(store.counts("me"))
                .expectNext(new NotificationCounts(2, 0))
                .verifyComplete();

        store.markAllRead("me").block();
        StepVerifier.create(store.counts("me"))
                .expectNext(NotificationCounts.ZERO)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should answer empty results for unknown users")
    void shouldHandleUnknownUser() {
        StepVerifier.create(store.recent("ghost", 5)).verifyComplete();
        StepVerifier.create(store.counts("ghost")).expectNext(NotificationCounts.ZERO).verifyComplete();
        StepVerifier.create(store.markAllRead("ghost")).verifyComplete();
        assertThat(store.isHealthy()).isTrue();
    }
}
