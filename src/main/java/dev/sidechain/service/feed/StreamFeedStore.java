package dev.sidechain.service.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.sidechain.config.ResilienceConfig;
import dev.sidechain.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Notification feed backed by a getstream.io-compatible REST API.
 * <p>
 * Requests carry a server token (HS256 over the API secret, wildcard resource/action/feed),
 * go through a Resilience4j circuit breaker and fail with {@link ExternalServiceException}.
 * Counts are in groups, as the notification feed reports them.
 * </p>
 */
@Slf4j
public class StreamFeedStore implements FeedStore {

    static final String FOREIGN_ID_PREFIX = "event:";

    private final WebClient webClient;
    private final String apiKey;
    private final String feedGroup;
    private final String serverToken;
    private final ResilienceConfig resilience;
    private final CircuitBreaker circuitBreaker;

    public StreamFeedStore(WebClient.Builder webClientBuilder, String baseUrl, String apiKey, String apiSecret,
                           String feedGroup, ResilienceConfig resilience) {
        if (apiKey == null || apiKey.isBlank() || apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalStateException(
                    "Stream feed selected but sidechain.feed.stream.api-key / api-secret are not set");
        }
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.apiKey = apiKey;
        this.feedGroup = feedGroup;
        this.resilience = resilience;
        this.serverToken = Jwts.builder()
                .claim("resource", "*")
                .claim("action", "*")
                .claim("feed_id", "*")
                .signWith(Keys.hmacShaKeyFor(apiSecret.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();
        this.circuitBreaker = resilience.circuitBreaker("stream-feed");
        log.info("Stream notification feed enabled (baseUrl={}, group={})", baseUrl, feedGroup);
    }

    @Override
    public Mono<Void> add(NotificationEvent event) {
        Map<String, Object> activity = new LinkedHashMap<>();
        activity.put("actor", event.actorId());
        activity.put("verb", event.verb());
        activity.put("object", event.objectId());
        activity.put("foreign_id", FOREIGN_ID_PREFIX + event.id());
        activity.put("time", LocalDateTime.ofInstant(event.time(), ZoneOffset.UTC).toString());
        if (event.actorName() != null) {
            activity.put("actor_name", event.actorName());
        }
        if (event.preview() != null) {
            activity.put("preview", event.preview());
        }

        return webClient.post()
                .uri(feedUri(event.recipientId(), b -> b))
                .header("Authorization", serverToken)
                .header("Stream-Auth-Type", "jwt")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(activity)
                .retrieve()
                .toBodilessEntity()
                .then()
                .transform(this::guard)
                .doOnSuccess(v -> log.debug("Added '{}' activity {} to feed of {}",
                        event.verb(), event.id(), event.recipientId()));
    }

    @Override
    public Flux<NotificationEvent> recent(String userId, int limit) {
        return fetch(userId, b -> b.queryParam("limit", Math.min(limit, 100)))
                .flatMapMany(response -> Flux.fromIterable(toEvents(userId, response)));
    }

    @Override
    public Mono<Void> markAllRead(String userId) {
        return fetch(userId, b -> b.queryParam("limit", 1).queryParam("mark_read", true)).then();
    }

    @Override
    public Mono<Void> markAllSeen(String userId) {
        return fetch(userId, b -> b.queryParam("limit", 1).queryParam("mark_seen", true)).then();
    }

    @Override
    public Mono<NotificationCounts> counts(String userId) {
        return fetch(userId, b -> b.queryParam("limit", 1))
                .map(r -> new NotificationCounts(r.getUnread(), r.getUnseen()));
    }

    @Override
    public String name() {
        return "stream";
    }

    @Override
    public boolean isHealthy() {
        return circuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    private Mono<NotificationFeedResponse> fetch(String userId, Function<UriBuilder, UriBuilder> query) {
        return webClient.get()
                .uri(feedUri(userId, query))
                .header("Authorization", serverToken)
                .header("Stream-Auth-Type", "jwt")
                .retrieve()
                .bodyToMono(NotificationFeedResponse.class)
                .transform(this::guard);
    }

    private Function<UriBuilder, URI> feedUri(String userId, Function<UriBuilder, UriBuilder> query) {
        return b -> query.apply(b.path("/feed/{group}/{userId}/").queryParam("api_key", apiKey))
                .build(feedGroup, userId);
    }

    private <T> Mono<T> guard(Mono<T> call) {
        return call
                .timeout(resilience.getExternalTimeout())
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorMap(e -> !(e instanceof ExternalServiceException),
                        e -> new ExternalServiceException("stream", "Feed request failed: " + e.getMessage(), e));
    }

    List<NotificationEvent> toEvents(String userId, NotificationFeedResponse response) {
        List<NotificationEvent> events = new ArrayList<>();
        if (response.getResults() == null) {
            return events;
        }
        for (GroupDto group : response.getResults()) {
            if (group.getActivities() == null) {
                continue;
            }
            for (ActivityDto a : group.getActivities()) {
                events.add(new NotificationEvent(eventId(a), userId, a.getActor(), a.getActorName(), a.getVerb(),
                        a.getObject(), a.getPreview(), parseTime(a.getTime()), group.isRead(), group.isSeen()));
            }
        }
        events.sort(Comparator.comparing(NotificationEvent::time).reversed());
        return events;
    }

    private static String eventId(ActivityDto activity) {
        String foreignId = activity.getForeignId();
        if (foreignId != null && foreignId.startsWith(FOREIGN_ID_PREFIX)) {
            return foreignId.substring(FOREIGN_ID_PREFIX.length());
        }
        return activity.getId();
    }

    static Instant parseTime(String value) {
        if (value == null || value.isBlank()) {
            return Instant.EPOCH;
        }
        try {
            // the API returns naive UTC timestamps
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e2) {
                log.debug("Unparseable activity time '{}', using epoch", value);
                return Instant.EPOCH;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class NotificationFeedResponse {
        private List<GroupDto> results;
        private int unseen;
        private int unread;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GroupDto {
        private String id;
        private String verb;
        private String group;
        private List<ActivityDto> activities;
        @JsonProperty("is_read")
        private boolean read;
        @JsonProperty("is_seen")
        private boolean seen;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ActivityDto {
        private String id;
        private String actor;
        private String verb;
        private String object;
        private String time;
        @JsonProperty("foreign_id")
        private String foreignId;
        @JsonProperty("actor_name")
        private String actorName;
        private String preview;
    }
}
