package dev.sidechain.service.feed;

import dev.sidechain.config.ResilienceConfig;
import dev.sidechain.exception.ExternalServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StreamFeedStore")
class StreamFeedStoreTest {

    private static final String SECRET = "stream-api-secret-for-tests-0123456789";

    private static final String FEED_JSON = """
            {
              "unread": 2,
              "unseen": 1,
              "results": [
                {
                  "id": "g1", "verb": "like", "group": "like_2026-03-01", "is_read": false, "is_seen": true,
                  "activities": [
                    {"id": "a1", "actor": "user-2", "verb": "like", "object": "post-1",
                     "time": "2026-03-01T10:00:00.000000", "foreign_id": "event:101", "actor_name": "bob"},
                    {"id": "a2", "actor": "user-3", "verb": "like", "object": "post-1",
                     "time": "2026-03-01T12:30:00.000000", "foreign_id": "event:102"}
                  ]
                },
                {
                  "id": "g2", "verb": "follow", "group": "follow_2026-02-28", "is_read": true, "is_seen": true,
                  "activities": [
                    {"id": "a3", "actor": "user-4", "verb": "follow", "object": "user-1",
                     "time": "2026-02-28T08:00:00.000000"}
                  ]
                }
              ]
            }
            """;

    private final List<ClientRequest> requests = new ArrayList<>();
    private HttpStatus status;
    private String body;
    private StreamFeedStore store;

    @BeforeEach
    void setUp() {
        status = HttpStatus.OK;
        body = FEED_JSON;
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        store = new StreamFeedStore(builder, "https://feeds.example.test/api/v1.0", "key-1", SECRET,
                "notification", new ResilienceConfig(1, 0, 10, 10, 1, 1, 50f, 30));
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("should flatten groups newest first and recover event ids from foreign ids")
        void shouldFlattenGroups() {
            StepVerifier.create(store.recent("user-1", 50).collectList())
                    .assertNext(events -> {
                        assertThat(events).extracting(NotificationEvent::id).containsExactly("102", "101", "a3");
                        NotificationEvent bob = events.get(1);
                        assertThat(bob.actorName()).isEqualTo("bob");
                        assertThat(bob.time()).isEqualTo(Instant.parse("2026-03-01T10:00:00Z"));
                        assertThat(bob.read()).isFalse();
                        assertThat(bob.seen()).isTrue();
                        assertThat(events.get(2).read()).isTrue();
                    })
                    .verifyComplete();

            ClientRequest request = requests.get(0);
            assertThat(request.method()).isEqualTo(HttpMethod.GET);
            assertThat(request.url().getPath()).endsWith("/feed/notification/user-1/");
            assertThat(request.url().getQuery()).contains("api_key=key-1").contains("limit=50");
            assertThat(request.headers().getFirst("Stream-Auth-Type")).isEqualTo("jwt");
            assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isNotBlank();
        }

        @Test
        @DisplayName("should cap the page size at 100")
        void shouldCapLimit() {
            store.recent("user-1", 500).collectList().block();

            assertThat(requests.get(0).url().getQuery()).contains("limit=100");
        }

        @Test
        @DisplayName("should read badge counts from the feed envelope")
        void shouldReadCounts() {
            StepVerifier.create(store.counts("user-1"))
                    .expectNext(new NotificationCounts(2, 1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return nothing for a feed without results")
        void shouldHandleEmptyFeed() {
            body = "{\"unread\":0,\"unseen\":0}";

            StepVerifier.create(store.recent("user-1", 20))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("should post the activity to the recipient's feed")
        void shouldAddActivity() {
            body = "{}";
            NotificationEvent event = new NotificationEvent("555", "user-9", "user-1", "alice", "comment",
                    "post-3", "nice", Instant.parse("2026-03-02T09:00:00Z"), false, false);

            StepVerifier.create(store.add(event)).verifyComplete();

            ClientRequest request = requests.get(0);
            assertThat(request.method()).isEqualTo(HttpMethod.POST);
            assertThat(request.url().getPath()).endsWith("/feed/notification/user-9/");
        }

        @Test
        @DisplayName("should mark read through the mark_read flag")
        void shouldMarkRead() {
            StepVerifier.create(store.markAllRead("user-1")).verifyComplete();

            assertThat(requests.get(0).url().getQuery()).contains("mark_read=true");
        }

        @Test
        @DisplayName("should mark seen through the mark_seen flag")
        void shouldMarkSeen() {
            StepVerifier.create(store.markAllSeen("user-1")).verifyComplete();

            assertThat(requests.get(0).url().getQuery()).contains("mark_seen=true");
        }
    }

    @Test
    @DisplayName("should surface backend errors as ExternalServiceException")
    void shouldWrapErrors() {
        status = HttpStatus.INTERNAL_SERVER_ERROR;
        body = "{\"detail\":\"boom\"}";

        StepVerifier.create(store.counts("user-1"))
                .expectError(ExternalServiceException.class)
                .verify();
    }

    @Test
    @DisplayName("should refuse to start without credentials")
    void shouldRequireCredentials() {
        ResilienceConfig resilience = new ResilienceConfig(1, 0, 10, 10, 1, 1, 50f, 30);

        assertThatThrownBy(() -> new StreamFeedStore(WebClient.builder(), "https://feeds.example.test", "key-1", "",
                "notification", resilience))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-secret");
    }

    @Nested
    @DisplayName("parseTime")
    class ParseTime {

        @Test
        @DisplayName("should read naive timestamps as UTC")
        void shouldParseNaive() {
            assertThat(StreamFeedStore.parseTime("2026-03-01T10:15:30.123456"))
                    .isEqualTo(Instant.parse("2026-03-01T10:15:30.123456Z"));
        }

        @Test
        @DisplayName("should accept ISO instants")
        void shouldParseInstant() {
            assertThat(StreamFeedStore.parseTime("2026-03-01T10:15:30Z"))
                    .isEqualTo(Instant.parse("2026-03-01T10:15:30Z"));
        }

        @Test
        @DisplayName("should fall back to epoch for missing or garbage input")
        void shouldFallBackToEpoch() {
            assertThat(StreamFeedStore.parseTime(null)).isEqualTo(Instant.EPOCH);
            assertThat(StreamFeedStore.parseTime("yesterday")).isEqualTo(Instant.EPOCH);
        }
    }
}
