package dev.sidechain.service.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.sidechain.config.ResilienceConfig;
import dev.sidechain.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Search index over the Elasticsearch document REST API ({@code PUT|GET|DELETE /{index}/_doc/{id}}).
 */
@Slf4j
public class ElasticsearchSearchIndex implements SearchIndex {

    private final WebClient webClient;
    private final ResilienceConfig resilience;
    private final CircuitBreaker circuitBreaker;

    public ElasticsearchSearchIndex(WebClient.Builder webClientBuilder, String url, String username, String password,
                                    ResilienceConfig resilience) {
        WebClient.Builder builder = webClientBuilder.baseUrl(url);
        if (username != null && !username.isBlank()) {
            builder = builder.defaultHeaders(h -> h.setBasicAuth(username, password != null ? password : ""));
        }
        this.webClient = builder.build();
        this.resilience = resilience;
        this.circuitBreaker = resilience.circuitBreaker("elasticsearch");
        log.info("Elasticsearch search index enabled (url={})", url);
    }

    @Override
    public Mono<Void> upsertPost(PostSearchDocument document) {
        return put(POSTS, document.id(), document);
    }

    @Override
    public Mono<Void> upsertUser(UserSearchDocument document) {
        return put(USERS, document.id(), document);
    }

    @Override
    public Mono<Void> deletePost(String id) {
        return delete(POSTS, id);
    }

    @Override
    public Mono<Void> deleteUser(String id) {
        return delete(USERS, id);
    }

    @Override
    public Mono<PostSearchDocument> findPost(String id) {
        return get(POSTS, id, new ParameterizedTypeReference<GetResponse<PostSearchDocument>>() { });
    }

    @Override
    public Mono<UserSearchDocument> findUser(String id) {
        return get(USERS, id, new ParameterizedTypeReference<GetResponse<UserSearchDocument>>() { });
    }

    @Override
    public String name() {
        return "elasticsearch";
    }

    @Override
    public boolean isHealthy() {
        return circuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    private Mono<Void> put(String index, String id, Object document) {
        return webClient.put()
                .uri("/{index}/_doc/{id}", index, id)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(document)
                .retrieve()
                .toBodilessEntity()
                .then()
                .transform(this::guard);
    }

    private Mono<Void> delete(String index, String id) {
        return webClient.delete()
                .uri("/{index}/_doc/{id}", index, id)
                .retrieve()
                .toBodilessEntity()
                .then()
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .transform(this::guard);
    }

    private <T> Mono<T> get(String index, String id, ParameterizedTypeReference<GetResponse<T>> type) {
        return webClient.get()
                .uri("/{index}/_doc/{id}", index, id)
                .exchangeToMono(response -> {
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return response.releaseBody().then(Mono.<GetResponse<T>>empty());
                    }
                    return response.statusCode().is2xxSuccessful()
                            ? response.bodyToMono(type)
                            : response.createException().flatMap(Mono::error);
                })
                .filter(GetResponse::isFound)
                .mapNotNull(GetResponse::getSource)
                .transform(this::guard);
    }

    private <T> Mono<T> guard(Mono<T> call) {
        return call
                .timeout(resilience.getExternalTimeout())
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorMap(e -> !(e instanceof ExternalServiceException),
                        e -> new ExternalServiceException("elasticsearch", "Search request failed: " + e.getMessage(), e));
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GetResponse<T> {
        private boolean found;
        @JsonProperty("_source")
        private T source;
    }
}
