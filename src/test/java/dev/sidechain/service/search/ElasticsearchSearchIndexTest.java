package dev.sidechain.service.search;

import dev.sidechain.config.ResilienceConfig;
import dev.sidechain.exception.ExternalServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
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

@DisplayName("ElasticsearchSearchIndex")
class ElasticsearchSearchIndexTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private HttpStatus status;
    private String body;
    private ElasticsearchSearchIndex index;

    @BeforeEach
    void setUp() {
        status = HttpStatus.OK;
        body = "{}";
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        });
        index = new ElasticsearchSearchIndex(builder, "http://search.example.test:9200", "elastic", "changeme",
                new ResilienceConfig(1, 0, 10, 10, 1, 1, 50f, 30));
    }

    @Test
    @DisplayName("should PUT the document under its id with basic auth")
    void shouldUpsertPost() {
        PostSearchDocument doc = new PostSearchDocument("p1", "u1", "alice", List.of("house"), 124, "Am",
                "Ableton Live", 3, 10, 1, Instant.parse("2026-03-01T12:00:00Z"));

        StepVerifier.create(index.upsertPost(doc)).verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.PUT);
        assertThat(request.url().getPath()).isEqualTo("/posts/_doc/p1");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).startsWith("Basic ");
    }

    @Test
    @DisplayName("should read the _source of a found document")
    void shouldFindUser() {
        body = """
                {"_index":"users","_id":"u1","found":true,
                 "_source":{"id":"u1","username":"alice","display_name":"Alice","genre":["techno"],"follower_count":7}}
                """;

        StepVerifier.create(index.findUser("u1"))
                .assertNext(doc -> {
                    assertThat(doc.username()).isEqualTo("alice");
                    assertThat(doc.displayName()).isEqualTo("Alice");
                    assertThat(doc.followerCount()).isEqualTo(7);
                })
                .verifyComplete();
        assertThat(requests.get(0).url().getPath()).isEqualTo("/users/_doc/u1");
    }

    @Test
    @DisplayName("should return empty for a missing document")
    void shouldReturnEmptyOnNotFound() {
        status = HttpStatus.NOT_FOUND;
        body = "{\"_index\":\"posts\",\"_id\":\"nope\",\"found\":false}";

        StepVerifier.create(index.findPost("nope")).verifyComplete();
    }

    @Test
    @DisplayName("should treat deleting a missing document as done")
    void shouldIgnoreMissingOnDelete() {
        status = HttpStatus.NOT_FOUND;

        StepVerifier.create(index.deleteUser("gone")).verifyComplete();
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.DELETE);
    }

    @Test
    @DisplayName("should surface server errors as ExternalServiceException")
    void shouldWrapServerErrors() {
        status = HttpStatus.SERVICE_UNAVAILABLE;

        StepVerifier.create(index.upsertUser(new UserSearchDocument("u1", "alice", null, null, List.of(), 0, null)))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ExternalServiceException.class);
                    assertThat(e.getMessage()).contains("Search request failed");
                })
                .verify();
        assertThat(index.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("should open the breaker after repeated failures and stop calling the backend")
    void shouldOpenBreaker() {
        status = HttpStatus.SERVICE_UNAVAILABLE;
        for (int i = 0; i < 5; i++) {
            StepVerifier.create(index.deletePost("p" + i)).expectError(ExternalServiceException.class).verify();
        }

        assertThat(index.isHealthy()).isFalse();
        StepVerifier.create(index.deletePost("p9")).expectError(ExternalServiceException.class).verify();
        assertThat(requests).hasSize(5);
    }
}
