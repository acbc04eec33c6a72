package dev.sidechain.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.sidechain.config.ResilienceConfig;
import dev.sidechain.entity.User;
import dev.sidechain.exception.ResourceNotFoundException;
import dev.sidechain.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Reads and writes the {@code show_activity_status} / {@code show_last_active} flags.
 * Presence reads and every follower broadcast consult these, so they sit behind a short Caffeine cache.
 */
@Service
@Slf4j
public class PresenceVisibilityService {

    private final UserRepository userRepository;
    private final ResilienceConfig resilience;

    private final Cache<String, ActivityVisibility> cache;

    public PresenceVisibilityService(
            UserRepository userRepository,
            ResilienceConfig resilience,
            @Value("${presence.visibility-cache.max-size:50000}") long cacheMaxSize,
            @Value("${presence.visibility-cache.ttl-seconds:60}") long cacheTtlSeconds) {
        this.userRepository = userRepository;
        this.resilience = resilience;
        this.cache = Caffeine.newBuilder()
                .maximumSize(cacheMaxSize)
                .expireAfterWrite(Duration.ofSeconds(cacheTtlSeconds))
                .build();
    }

    /**
     * Flags for {@code userId}. Unknown users and lookup failures read as visible.
     */
    public Mono<ActivityVisibility> visibilityOf(String userId) {
        ActivityVisibility cached = cache.getIfPresent(userId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return userRepository.findById(userId)
                .timeout(resilience.getDatabaseTimeout())
                .map(this::toVisibility)
                .doOnNext(v -> cache.put(userId, v))
                .defaultIfEmpty(ActivityVisibility.defaults(userId))
                .onErrorResume(e -> {
                    log.warn("Visibility lookup failed for {}, treating as visible: {}", userId, e.getMessage());
                    return Mono.just(ActivityVisibility.defaults(userId));
                });
    }

    public Mono<ActivityVisibility> update(String userId, boolean showActivityStatus, boolean showLastActive) {
        return userRepository.updateActivityVisibility(userId, showActivityStatus, showLastActive,
                        LocalDateTime.now(ZoneOffset.UTC))
                .timeout(resilience.getDatabaseTimeout())
                .flatMap(rows -> {
                    if (rows == 0) {
                        return Mono.error(new ResourceNotFoundException("User", userId));
                    }
                    cache.invalidate(userId);
                    log.info("Activity visibility updated for {}: showActivityStatus={}, showLastActive={}",
                            userId, showActivityStatus, showLastActive);
                    return visibilityOf(userId);
                });
    }

    private ActivityVisibility toVisibility(User user) {
        return new ActivityVisibility(
                user.getId(),
                user.getUsername(),
                !Boolean.FALSE.equals(user.getShowActivityStatus()),
                !Boolean.FALSE.equals(user.getShowLastActive()),
                user.getLastActiveAt() != null ? user.getLastActiveAt().toInstant(ZoneOffset.UTC) : null);
    }
}
